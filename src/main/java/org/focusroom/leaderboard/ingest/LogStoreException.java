package org.focusroom.leaderboard.ingest;

/**
 * Unchecked wrapper for I/O failures while reading or writing the raw logs and documents.
 */
public class LogStoreException extends RuntimeException {
    public LogStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
