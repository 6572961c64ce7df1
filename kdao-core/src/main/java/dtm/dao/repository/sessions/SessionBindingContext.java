package dtm.dao.repository.sessions;

import org.hibernate.Session;

/**
 * Armazena a sessão corrente do contexto de execução.
 */
public interface SessionBindingContext {
    boolean hasBind();
    Session getBoundSession();
    void bind(Session session);
    Session unbind();
}
