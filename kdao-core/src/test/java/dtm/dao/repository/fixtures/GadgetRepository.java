package dtm.dao.repository.fixtures;

import dtm.dao.repository.IntegerIdRepository;
import dtm.dao.repository.sessions.SessionSource;

public class GadgetRepository extends IntegerIdRepository<Gadget> {

    public GadgetRepository(SessionSource sessionSource) {
        super(sessionSource);
    }
}
