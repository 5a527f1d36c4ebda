package dev.letterbox.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.util.MultiValueMap;

/**
 * Raw, unvalidated fields of a subscription form. Missing fields stay {@code null}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SubscriptionForm {

    private String email;
    private String name;

    public static SubscriptionForm fromFormData(MultiValueMap<String, String> formData) {
        return SubscriptionForm.builder()
                .email(formData.getFirst("email"))
                .name(formData.getFirst("name"))
                .build();
    }
}
