package complaint.router.app.exception;

/**
 * A remote collaborator (mail provider or sentiment backend) could not be reached or
 * answered with a retryable status.
 */
public class TransientProviderException extends RuntimeException {
    public TransientProviderException(String message) {
        super(message);
    }

    public TransientProviderException(String message, Throwable cause) {
        super(message, cause);
    }
}
