package dtm.dao.repository.exceptions;

/**
 * Falha ao vincular ou desvincular a sessão corrente da thread.
 */
public class SessionBindingException extends RuntimeException {
    public SessionBindingException(String message) {
        super(message);
    }
}
