package dev.letterbox.service;

import dev.letterbox.domain.NewSubscriber;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.MessageSource;
import org.springframework.stereotype.Service;
import org.springframework.web.util.HtmlUtils;
import reactor.core.publisher.Mono;

import java.util.Locale;

/**
 * Composes subscriber emails from {@code messages*.properties} and hands them to {@link EmailClient}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EmailService {

    private final EmailClient emailClient;
    private final MessageSource messageSource;

    public boolean isDispatchEnabled() {
        return emailClient.isEnabled();
    }

    /**
     * Send the welcome email to a freshly accepted subscriber.
     */
    public Mono<Void> sendWelcome(NewSubscriber subscriber) {
        return Mono.defer(() -> {
            String name = subscriber.name().asString().strip();
            String subject = msg("email.welcome.subject");
            String html = msg("email.welcome.html", HtmlUtils.htmlEscape(name));
            String text = msg("email.welcome.text", name);
            return emailClient.send(subscriber.email(), subject, html, text);
        });
    }

    private String msg(String key, Object... args) {
        return messageSource.getMessage(key, args, Locale.ENGLISH);
    }
}
