package dtm.dao.repository.exceptions;

/**
 * Exceção lançada quando o sistema não consegue resolver o tipo de entidade
 * de um repositório a partir da sua declaração genérica.
 */
public class RepositoryMetaInfoResolutionException extends RuntimeException {
    public RepositoryMetaInfoResolutionException(String message) {
        super(message);
    }
}
