package dtm.dao.repository.sessions;

import org.hibernate.Session;
import org.hibernate.SessionFactory;

public interface SessionProvider extends SessionSource, AutoCloseable {

    /**
     * Retorna a sessão vinculada à thread quando existir e estiver aberta;
     * caso contrário abre uma nova sessão, que NÃO é vinculada.
     */
    Session currentSession();

    Session openSession();

    boolean hasBind();

    /**
     * Sessão vinculada à thread, ou {@code null}. Pode estar fechada.
     */
    Session getBoundSession();

    void bind(Session session);

    /**
     * Remove a sessão vinculada e a devolve para que o chamador a feche.
     */
    Session unbind();

    SessionFactory getSessionFactory();

    @Override
    void close();
}
