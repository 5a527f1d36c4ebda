package dev.letterbox.exception;

/**
 * Thrown when raw subscriber input fails domain validation.
 * Client-caused: answered with 400 and never logged as a server fault.
 */
public class SubscriberValidationException extends RuntimeException {

    private final String input;

    public SubscriberValidationException(String input, String message) {
        super(message);
        this.input = input;
    }

    /**
     * The raw value that was rejected, for diagnostics only.
     */
    public String getInput() {
        return input;
    }
}
