package aforo.ledger.event;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

/**
 * Event published when a subscriber is registered and its deposit pulled.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SubscriberRegisteredEvent {

    private Long subscriberId;

    private String owner;

    private long deposit;

    private String plan;

    /**
     * Active providers the subscriber actually joined; inactive ones from the request are absent.
     */
    private List<Long> providerIds;

    private Instant registeredAt;
}
