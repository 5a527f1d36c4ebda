package dev.letterbox.domain;

import java.util.Objects;

/**
 * A subscriber whose email and name have both passed validation.
 */
public record NewSubscriber(SubscriberEmail email, SubscriberName name) {

    public NewSubscriber {
        Objects.requireNonNull(email, "email must not be null");
        Objects.requireNonNull(name, "name must not be null");
    }

    /**
     * Builds a subscriber from raw form values.
     * The email is parsed first, so an invalid email is reported even when the name is invalid too.
     *
     * @throws dev.letterbox.exception.SubscriberValidationException on the first invalid field
     */
    public static NewSubscriber fromForm(String rawEmail, String rawName) {
        SubscriberEmail email = SubscriberEmail.parse(rawEmail);
        SubscriberName name = SubscriberName.parse(rawName);
        return new NewSubscriber(email, name);
    }
}
