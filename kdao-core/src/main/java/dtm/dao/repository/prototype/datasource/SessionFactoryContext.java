package dtm.dao.repository.prototype.datasource;

import org.hibernate.Session;
import org.hibernate.SessionFactory;

public interface SessionFactoryContext extends AutoCloseable {

    DatabaseConfiguration getDatabaseConfiguration();
    SessionFactory getSessionFactory();

    default Session openSession() {
        return getSessionFactory().openSession();
    }

    default boolean isOpen() {
        SessionFactory sessionFactory = getSessionFactory();
        return sessionFactory != null && sessionFactory.isOpen();
    }

    @Override
    void close();
}
