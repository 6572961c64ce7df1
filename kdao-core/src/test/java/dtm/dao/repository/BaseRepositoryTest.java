package dtm.dao.repository;

import dtm.dao.repository.fixtures.CustomerRepository;
import dtm.dao.repository.fixtures.PersonRepository;
import dtm.dao.repository.fixtures.TestDatabase;
import dtm.dao.repository.sessions.imple.HibernateSessionProvider;
import org.hibernate.Session;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;

public abstract class BaseRepositoryTest {

    protected HibernateSessionProvider sessionProvider;
    protected PersonRepository personRepository;
    protected CustomerRepository customerRepository;

    @BeforeEach
    public void setUpProvider() {
        sessionProvider = new HibernateSessionProvider(TestDatabase.configuration());
        personRepository = new PersonRepository(sessionProvider);
        customerRepository = new CustomerRepository(sessionProvider);
    }

    @AfterEach
    public void closeProvider() {
        if (sessionProvider.hasBind()) {
            Session leftover = sessionProvider.unbind();
            if (leftover.isOpen()) {
                leftover.close();
            }
        }
        sessionProvider.close();
    }
}
