package aforo.ledger.event;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Event published when a provider is deleted after its residual payout.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProviderRemovedEvent {

    private Long providerId;

    private String owner;

    private long residualPayout;

    private Instant removedAt;
}
