package dtm.dao.repository.sessions.imple;

import dtm.dao.repository.config.HibernateConfiguration;
import dtm.dao.repository.exceptions.DatabaseInitializationException;
import dtm.dao.repository.exceptions.DatabaseSessionOutOfContextException;
import dtm.dao.repository.prototype.datasource.DatabaseConfiguration;
import dtm.dao.repository.prototype.datasource.SessionFactoryContext;
import dtm.dao.repository.sessions.SessionBindingContext;
import dtm.dao.repository.sessions.SessionProvider;
import lombok.extern.slf4j.Slf4j;
import org.hibernate.Session;
import org.hibernate.SessionFactory;
import org.hibernate.Transaction;

import java.util.function.Function;

/**
 * Provedor de sessões do Hibernate. A {@link SessionFactory} é construída uma
 * única vez, no primeiro acesso, a partir da configuração recebida.
 */
@Slf4j
public class HibernateSessionProvider implements SessionProvider {

    private final Object factoryLock = new Object();
    private final DatabaseConfiguration databaseConfiguration;
    private final HibernateConfiguration hibernateConfiguration;
    private final SessionBindingContext sessionBindingContext;

    private volatile SessionFactoryContext sessionFactoryContext;
    private volatile boolean closed;

    public HibernateSessionProvider(DatabaseConfiguration databaseConfiguration) {
        this(databaseConfiguration, new HibernateConfiguration(), new ThreadLocalSessionBindingContext());
    }

    public HibernateSessionProvider(
            DatabaseConfiguration databaseConfiguration,
            HibernateConfiguration hibernateConfiguration,
            SessionBindingContext sessionBindingContext
    ) {
        if (databaseConfiguration == null) {
            throw new DatabaseInitializationException("A implementação de DatabaseConfiguration não foi fornecida (é nula).");
        }
        this.databaseConfiguration = databaseConfiguration;
        this.hibernateConfiguration = hibernateConfiguration;
        this.sessionBindingContext = sessionBindingContext;
    }

    public HibernateSessionProvider(SessionFactoryContext sessionFactoryContext) {
        this(sessionFactoryContext, new ThreadLocalSessionBindingContext());
    }

    public HibernateSessionProvider(SessionFactoryContext sessionFactoryContext, SessionBindingContext sessionBindingContext) {
        if (sessionFactoryContext == null || sessionFactoryContext.getSessionFactory() == null) {
            throw new DatabaseInitializationException("Erro ao criar o provedor de sessões: SessionFactory ausente.");
        }
        this.databaseConfiguration = sessionFactoryContext.getDatabaseConfiguration();
        this.hibernateConfiguration = null;
        this.sessionBindingContext = sessionBindingContext;
        this.sessionFactoryContext = sessionFactoryContext;
    }

    @Override
    public Session currentSession() {
        Session session = sessionBindingContext.getBoundSession();
        if (session != null && session.isOpen()) {
            return session;
        }

        return openSession();
    }

    @Override
    public Session openSession() {
        Session session = getSessionFactoryContext().openSession();
        log.debug("Nova sessão aberta na thread: {}.", Thread.currentThread().getName());
        return session;
    }

    @Override
    public boolean hasBind() {
        return sessionBindingContext.hasBind();
    }

    @Override
    public Session getBoundSession() {
        return sessionBindingContext.getBoundSession();
    }

    @Override
    public void bind(Session session) {
        sessionBindingContext.bind(session);
        log.debug("Sessão vinculada à thread: {}.", Thread.currentThread().getName());
    }

    @Override
    public Session unbind() {
        Session session = sessionBindingContext.unbind();
        log.debug("Sessão desvinculada da thread: {}.", Thread.currentThread().getName());
        return session;
    }

    @Override
    public SessionFactory getSessionFactory() {
        return getSessionFactoryContext().getSessionFactory();
    }

    public DatabaseConfiguration getDatabaseConfiguration() {
        return databaseConfiguration;
    }

    public boolean isInitialized() {
        return sessionFactoryContext != null;
    }

    @Override
    public <R> R withSession(Function<Session, R> work) {
        Session bound = sessionBindingContext.getBoundSession();
        if (bound != null && bound.isOpen()) {
            return work.apply(bound);
        }

        try (Session session = openSession()) {
            return runInTransaction(session, work);
        }
    }

    @Override
    public void close() {
        synchronized (factoryLock) {
            if (closed) return;
            closed = true;

            if (sessionFactoryContext != null) {
                log.info("Encerrando SessionFactory do provedor de sessões.");
                sessionFactoryContext.close();
            }
        }
    }

    private <R> R runInTransaction(Session session, Function<Session, R> work) {
        Transaction transaction = session.beginTransaction();
        try {
            R result = work.apply(session);
            transaction.commit();
            return result;
        } catch (RuntimeException e) {
            try {
                if (transaction.getStatus().canRollback()) {
                    transaction.rollback();
                }
            } catch (RuntimeException rollbackError) {
                e.addSuppressed(rollbackError);
            }
            throw e;
        }
    }

    private SessionFactoryContext getSessionFactoryContext() {
        SessionFactoryContext context = sessionFactoryContext;
        if (context == null) {
            synchronized (factoryLock) {
                ensureNotClosed();
                context = sessionFactoryContext;
                if (context == null) {
                    log.debug("Construindo SessionFactory no primeiro acesso.");
                    context = hibernateConfiguration.createSessionFactoryContext(databaseConfiguration);
                    sessionFactoryContext = context;
                }
            }
        }

        ensureNotClosed();
        return context;
    }

    private void ensureNotClosed() {
        if (closed) {
            throw new DatabaseSessionOutOfContextException("O provedor de sessões já foi encerrado; nenhuma sessão pode ser aberta.");
        }
    }
}
