package aforo.ledger.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

/**
 * Outcome of a subscriber settling its dues and leaving every roster.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CancellationResult {

    private Long subscriberId;
    private long owed;
    private long shortfallPulled;             // charged to the owner when the balance fell short
    private Map<Long, Long> providerPayouts;  // providerId -> amount paid
    private long remainingBalance;            // kept by the ledger, not refunded
    private Instant cancelledAt;
}
