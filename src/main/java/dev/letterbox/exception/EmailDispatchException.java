package dev.letterbox.exception;

import org.springframework.lang.Nullable;

/**
 * Thrown when the email provider is unreachable or answers with a non-2xx status.
 */
public class EmailDispatchException extends RuntimeException {

    @Nullable
    private final Integer statusCode;

    public EmailDispatchException(String message, @Nullable Integer statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    /**
     * HTTP status returned by the provider, or {@code null} for transport failures.
     */
    @Nullable
    public Integer getStatusCode() {
        return statusCode;
    }
}
