package dtm.dao.repository;

import dtm.dao.repository.sessions.SessionSource;

/**
 * Repositório cujas entidades usam {@link Integer} como identificador.
 */
public abstract class IntegerIdRepository<T> extends HibernateRepository<T, Integer> {

    protected IntegerIdRepository(SessionSource sessionSource) {
        super(sessionSource);
    }

    protected IntegerIdRepository(SessionSource sessionSource, Class<T> entityType) {
        super(sessionSource, entityType);
    }
}
