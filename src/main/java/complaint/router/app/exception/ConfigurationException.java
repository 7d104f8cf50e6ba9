package complaint.router.app.exception;

/**
 * Missing or invalid configuration or keyword source. Fatal at startup, never retried.
 */
public class ConfigurationException extends RuntimeException {
    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
