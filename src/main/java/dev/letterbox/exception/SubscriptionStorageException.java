package dev.letterbox.exception;

/**
 * Thrown when an accepted subscriber could not be persisted.
 * The cause is kept for server-side logging and is never sent to the client.
 */
public class SubscriptionStorageException extends RuntimeException {

    public SubscriptionStorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
