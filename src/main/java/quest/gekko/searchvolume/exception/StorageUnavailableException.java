package quest.gekko.searchvolume.exception;

public class StorageUnavailableException extends RuntimeException {

    public StorageUnavailableException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
