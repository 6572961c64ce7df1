package dtm.dao.repository.sessions;

import org.hibernate.Session;

import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Origem da sessão usada pelos repositórios: o {@link SessionProvider}
 * (sessão vinculada à thread) ou uma {@link UnitOfWork} passada explicitamente.
 */
public interface SessionSource {

    <R> R withSession(Function<Session, R> work);

    default void useSession(Consumer<Session> work) {
        withSession(session -> {
            work.accept(session);
            return null;
        });
    }
}
