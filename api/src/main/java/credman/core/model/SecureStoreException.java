package credman.core.model;

/**
 * Raised when credentials cannot be encrypted or decrypted.
 */
public class SecureStoreException extends RuntimeException {

    public SecureStoreException(String message) {
        super(message);
    }

    public SecureStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
