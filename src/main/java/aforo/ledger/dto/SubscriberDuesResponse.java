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
public class SubscriberDuesResponse {

    private Long subscriberId;
    private Map<Long, Long> perProvider;
    private long total;
    private long balance;
    private Instant asOf;
}
