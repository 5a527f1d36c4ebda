package dev.letterbox.entity;

import dev.letterbox.domain.NewSubscriber;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.annotation.Transient;
import org.springframework.data.domain.Persistable;
import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;

import java.time.OffsetDateTime;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Table("subscriptions")
public class Subscription implements Persistable<UUID> {

    @Id
    private UUID id;

    // Ids are assigned before insert; rows are never updated.
    @Transient
    @Builder.Default
    private boolean newRecord = true;

    @Override
    public boolean isNew() {
        return newRecord;
    }

    @Column("email")
    private String email;

    @Column("name")
    private String name;

    @Column("subscribed_at")
    private OffsetDateTime subscribedAt;

    /**
     * New row for an accepted subscriber. Only validated values reach the table.
     */
    public static Subscription of(NewSubscriber subscriber, UUID id, OffsetDateTime subscribedAt) {
        return Subscription.builder()
                .id(id)
                .email(subscriber.email().asString())
                .name(subscriber.name().asString())
                .subscribedAt(subscribedAt)
                .build();
    }
}
