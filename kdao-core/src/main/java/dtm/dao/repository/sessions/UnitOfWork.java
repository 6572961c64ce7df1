package dtm.dao.repository.sessions;

import dtm.dao.repository.exceptions.DatabaseSessionOutOfContextException;
import dtm.dao.repository.exceptions.SessionBindingException;
import lombok.extern.slf4j.Slf4j;
import org.hibernate.Session;
import org.hibernate.Transaction;
import org.hibernate.resource.transaction.spi.TransactionStatus;

import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Unidade de trabalho: abre uma transação sobre a sessão corrente, vincula a
 * sessão à thread e garante commit ou rollback ao ser fechada.
 *
 * <pre>{@code
 * try (UnitOfWork unitOfWork = new UnitOfWork(sessionProvider)) {
 *     personRepository.saveOrUpdate(person);
 * }
 * }</pre>
 *
 * Com {@code autoCommit = false} nada é persistido a menos que
 * {@link #commit()} seja chamado explicitamente antes do fechamento.
 */
@Slf4j
public class UnitOfWork implements SessionSource, AutoCloseable {

    private final SessionProvider sessionProvider;
    private final Session session;
    private final boolean autoCommit;

    private boolean transactionDisposed;
    private boolean closed;

    public UnitOfWork(SessionProvider sessionProvider) {
        this(sessionProvider, true);
    }

    public UnitOfWork(SessionProvider sessionProvider, boolean autoCommit) {
        this.sessionProvider = sessionProvider;
        this.autoCommit = autoCommit;

        Session bound = sessionProvider.getBoundSession();
        if (bound != null && bound.isOpen()) {
            throw new SessionBindingException(String.format(
                    "A Thread [%s] já possui uma sessão aberta vinculada a outra unidade de trabalho. Unidades de trabalho aninhadas não são suportadas.",
                    Thread.currentThread().getName()
            ));
        }

        this.session = sessionProvider.currentSession();
        Transaction transaction = session.beginTransaction();
        try {
            sessionProvider.bind(session);
        } catch (RuntimeException e) {
            log.error("Falha ao vincular a sessão da unidade de trabalho à thread: {}.", Thread.currentThread().getName(), e);
            try {
                if (transaction.getStatus().canRollback()) {
                    transaction.rollback();
                }
            } finally {
                session.close();
            }
            throw e;
        }

        log.debug("Unidade de trabalho iniciada (autoCommit={}) na thread: {}.", autoCommit, Thread.currentThread().getName());
    }

    /**
     * Executa {@code work} em uma unidade de trabalho com commit automático.
     * Se {@code work} falhar, a transação é revertida antes do fechamento.
     */
    public static void execute(SessionProvider sessionProvider, Consumer<UnitOfWork> work) {
        call(sessionProvider, unitOfWork -> {
            work.accept(unitOfWork);
            return null;
        });
    }

    public static <R> R call(SessionProvider sessionProvider, Function<UnitOfWork, R> work) {
        try (UnitOfWork unitOfWork = new UnitOfWork(sessionProvider)) {
            try {
                return work.apply(unitOfWork);
            } catch (RuntimeException e) {
                log.debug("Revertendo unidade de trabalho após falha: {}", e.getMessage());
                try {
                    unitOfWork.rollback();
                } catch (RuntimeException rollbackError) {
                    e.addSuppressed(rollbackError);
                }
                throw e;
            }
        }
    }

    /**
     * Confirma a transação se estiver ativa. Em caso de falha a transação é
     * revertida e a exceção original é relançada.
     */
    public UnitOfWork commit() {
        ensureOpen("commit");
        Transaction transaction = session.getTransaction();

        try {
            if (transaction.isActive()) {
                transaction.commit();
                log.debug("Commit realizado na thread: {}.", Thread.currentThread().getName());
            }
        } catch (RuntimeException e) {
            log.error("""

            [ FALHA NO COMMIT ]
            A transação não pôde ser confirmada e será revertida.
            > Thread : {}
            > Detalhe: {}
            """, Thread.currentThread().getName(), e.getMessage());

            try {
                if (transaction.getStatus().canRollback()) {
                    transaction.rollback();
                }
            } catch (RuntimeException rollbackError) {
                e.addSuppressed(rollbackError);
            }
            throw e;
        } finally {
            transactionDisposed = true;
        }

        return this;
    }

    public UnitOfWork rollback() {
        ensureOpen("rollback");
        Transaction transaction = session.getTransaction();

        try {
            if (transaction.isActive()) {
                transaction.rollback();
                log.debug("Rollback realizado na thread: {}.", Thread.currentThread().getName());
            }
        } finally {
            transactionDisposed = true;
        }

        return this;
    }

    @Override
    public <R> R withSession(Function<Session, R> work) {
        ensureOpen("withSession");
        return work.apply(session);
    }

    public Session getSession() {
        return session;
    }

    public boolean isAutoCommit() {
        return autoCommit;
    }

    public boolean isClosed() {
        return closed;
    }

    public boolean isTransactionDisposed() {
        return transactionDisposed;
    }

    public TransactionStatus getTransactionStatus() {
        if (!session.isOpen()) {
            return TransactionStatus.NOT_ACTIVE;
        }
        return session.getTransaction().getStatus();
    }

    /**
     * Executa o commit quando {@code autoCommit} estiver habilitado e, em
     * qualquer caso, desvincula e fecha a sessão.
     */
    @Override
    public void close() {
        if (closed) return;

        RuntimeException failure = null;
        try {
            if (autoCommit) {
                commit();
            }
        } catch (RuntimeException e) {
            failure = e;
        }

        closed = true;
        try {
            release();
        } catch (RuntimeException e) {
            if (failure == null) {
                failure = e;
            } else {
                failure.addSuppressed(e);
            }
        }

        if (failure != null) {
            throw failure;
        }
    }

    private void release() {
        Session unbound = null;
        try {
            unbound = sessionProvider.unbind();
            if (unbound != session) {
                log.warn("A sessão desvinculada da thread {} não pertence a esta unidade de trabalho.", Thread.currentThread().getName());
            }

            if (session.isOpen() && session.getTransaction().isActive()) {
                session.getTransaction().rollback();
                log.debug("Transação pendente revertida ao fechar a unidade de trabalho.");
            }
        } finally {
            transactionDisposed = true;
            closeIfOpen(unbound);
            closeIfOpen(session);
        }

        log.debug("Unidade de trabalho encerrada na thread: {}.", Thread.currentThread().getName());
    }

    private void closeIfOpen(Session target) {
        if (target != null && target.isOpen()) {
            target.close();
        }
    }

    private void ensureOpen(String operation) {
        if (closed) {
            throw new DatabaseSessionOutOfContextException(String.format(
                    "Operação '%s' chamada em uma unidade de trabalho já encerrada (Thread [%s]).",
                    operation, Thread.currentThread().getName()
            ));
        }
    }
}
