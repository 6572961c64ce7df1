package dtm.dao.repository.fixtures;

import dtm.dao.repository.HibernateRepository;
import dtm.dao.repository.sessions.SessionSource;

public class CustomerRepository extends HibernateRepository<Customer, Long> {

    public CustomerRepository(SessionSource sessionSource) {
        super(sessionSource, Customer.class);
    }
}
