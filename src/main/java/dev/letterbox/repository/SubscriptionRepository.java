package dev.letterbox.repository;

import dev.letterbox.entity.Subscription;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Mono;

import java.util.UUID;

@Repository
public interface SubscriptionRepository extends ReactiveCrudRepository<Subscription, UUID> {

    Mono<Subscription> findByEmail(String email);
}
