package dev.evalset.log;

import javax.annotation.Nullable;

/** Thrown when a log store cannot list, read, write or delete a log. */
public class LogStoreException extends RuntimeException {
    public LogStoreException(String message) {
        super(message);
    }

    public LogStoreException(String message, @Nullable Throwable cause) {
        super(message, cause);
    }

    public LogStoreException(Throwable cause) {
        super(cause);
    }
}
