package aforo.ledger.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProviderEarningsResponse {

    private Long providerId;
    private long currentRate;
    private Map<Long, Long> perSubscriber;
    private long total;
    private Instant lastWithdrawalAt;
    private Instant asOf;
}
