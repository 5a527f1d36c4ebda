package dev.letterbox.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * JSON body of the email provider's send endpoint. Field names follow the provider's snake_case convention.
 */
public record SendEmailRequest(
        String from,
        String to,
        String subject,
        @JsonProperty("html_body") String htmlBody,
        @JsonProperty("text_body") String textBody
) {}
