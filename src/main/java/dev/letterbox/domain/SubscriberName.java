package dev.letterbox.domain;

import dev.letterbox.exception.SubscriberValidationException;
import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A subscriber display name.
 * <p>
 * Only created through {@link #parse(String)}. The stored value is the input exactly
 * as received: trimming is used for the emptiness check and never applied to the value.
 */
@ToString
@EqualsAndHashCode
public final class SubscriberName {

    /** Upper bound on the name length, counted in grapheme clusters. */
    public static final int MAX_LENGTH = 256;

    public static final Set<Character> FORBIDDEN_CHARACTERS =
            Set.of('/', '(', ')', '"', '<', '>', '\\', '{', '}');

    private static final Pattern GRAPHEME_CLUSTER = Pattern.compile("\\X");

    private final String value;

    private SubscriberName(String value) {
        this.value = value;
    }

    public static SubscriberName parse(String raw) {
        if (!isValid(raw)) {
            throw new SubscriberValidationException(raw,
                    String.format("\"%s\" is not a valid subscriber name.", raw));
        }
        return new SubscriberName(raw);
    }

    public String asString() {
        return value;
    }

    private static boolean isValid(String raw) {
        if (raw == null) {
            return false;
        }
        boolean isEmptyOrWhitespace = raw.codePoints().allMatch(SubscriberName::isWhitespace);
        boolean isTooLong = graphemeCount(raw) > MAX_LENGTH;
        boolean containsForbiddenCharacter = raw.chars()
                .anyMatch(c -> FORBIDDEN_CHARACTERS.contains((char) c));

        return !(isEmptyOrWhitespace || isTooLong || containsForbiddenCharacter);
    }

    /**
     * Unicode whitespace, including no-break spaces that {@link Character#isWhitespace(int)} leaves out.
     */
    private static boolean isWhitespace(int codePoint) {
        return Character.isWhitespace(codePoint) || Character.isSpaceChar(codePoint);
    }

    /**
     * Number of extended grapheme clusters, so an emoji ZWJ sequence or a flag counts as one.
     */
    static int graphemeCount(String text) {
        Matcher matcher = GRAPHEME_CLUSTER.matcher(text);
        int count = 0;
        while (matcher.find()) {
            count++;
        }
        return count;
    }
}
