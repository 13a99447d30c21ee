package aforo.ledger.event;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Event published when a provider is registered.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProviderRegisteredEvent {

    private Long providerId;

    private String owner;

    /**
     * Raw registration key bytes as supplied by the caller.
     */
    private byte[] registrationKey;

    /**
     * Hourly fee the provider opened with.
     */
    private long fee;

    private Instant registeredAt;
}
