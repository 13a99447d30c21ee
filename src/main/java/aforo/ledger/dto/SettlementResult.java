package aforo.ledger.dto;

import aforo.ledger.entity.SettlementKind;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

/**
 * Outcome of paying a provider its accrued earnings.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SettlementResult {

    private Long providerId;
    private SettlementKind kind;
    private long accrued;                     // earnings owed before any overdraft policy
    private long amount;                      // actually debited and paid out
    private Map<Long, Long> subscriberDebits; // subscriberId -> debit
    private Instant settledAt;
}
