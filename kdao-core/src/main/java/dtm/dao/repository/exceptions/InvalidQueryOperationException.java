package dtm.dao.repository.exceptions;

public class InvalidQueryOperationException extends RuntimeException {
    public InvalidQueryOperationException(String message) {
        super(message);
    }

    public InvalidQueryOperationException(String operation, String repositoryName, String details) {
        super(String.format(
                "Operacao invalida '%s' no repositorio '%s'. Detalhes: %s",
                operation, repositoryName, details
        ));
    }
}
