package dtm.dao.repository.sessions.imple;

import dtm.dao.repository.exceptions.SessionBindingException;
import dtm.dao.repository.sessions.SessionBindingContext;
import lombok.extern.slf4j.Slf4j;
import org.hibernate.Session;

@Slf4j
public class ThreadLocalSessionBindingContext implements SessionBindingContext {

    private final ThreadLocal<Session> sessionStorage = new ThreadLocal<>();

    @Override
    public boolean hasBind() {
        return sessionStorage.get() != null;
    }

    @Override
    public Session getBoundSession() {
        return sessionStorage.get();
    }

    @Override
    public void bind(Session session) {
        if (session == null) {
            throw new SessionBindingException("Não é possível vincular uma sessão nula.");
        }

        Session current = sessionStorage.get();
        if (current != null && current != session) {
            if (current.isOpen()) {
                throw new SessionBindingException(String.format(
                        "Já existe uma sessão aberta vinculada à Thread [%s]. Desvincule-a antes de vincular outra.",
                        Thread.currentThread().getName()
                ));
            }
            log.warn("Substituindo sessão já fechada que permanecia vinculada à thread: {}.", Thread.currentThread().getName());
        }

        sessionStorage.set(session);
    }

    @Override
    public Session unbind() {
        Session session = sessionStorage.get();
        if (session == null) {
            throw new SessionBindingException(String.format(
                    "Nenhuma sessão vinculada à Thread [%s] para ser desvinculada.",
                    Thread.currentThread().getName()
            ));
        }

        sessionStorage.remove();
        return session;
    }
}
