package dev.letterbox.domain;

import dev.letterbox.exception.SubscriberValidationException;
import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.util.regex.Pattern;

/**
 * A syntactically valid email address.
 * <p>
 * Instances only come out of {@link #parse(String)}, so holding one is proof that
 * the address has exactly one {@code @}, a non-empty local part and domain part,
 * and no whitespace. A dot in the domain is not required.
 */
@ToString
@EqualsAndHashCode
public final class SubscriberEmail {

    private static final Pattern EMAIL_PATTERN = Pattern.compile("^[^@\\s]+@[^@\\s]+$", Pattern.UNICODE_CHARACTER_CLASS);

    private final String value;

    private SubscriberEmail(String value) {
        this.value = value;
    }

    public static SubscriberEmail parse(String raw) {
        if (raw == null || !EMAIL_PATTERN.matcher(raw).matches()) {
            throw new SubscriberValidationException(raw,
                    String.format("\"%s\" is not a valid subscriber email.", raw));
        }
        return new SubscriberEmail(raw);
    }

    public String asString() {
        return value;
    }
}
