package ac.tiercache.backend;

public class KeyValueClientException extends RuntimeException {

    public KeyValueClientException(String message) {
        super(message);
    }

    public KeyValueClientException(String message, Throwable cause) {
        super(message, cause);
    }
}
