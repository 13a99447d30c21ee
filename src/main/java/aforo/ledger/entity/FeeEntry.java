package aforo.ledger.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.time.Instant;

/**
 * Hourly rate charged over the half-open interval {@code [start, end)}.
 * Instances are replaced rather than mutated when the schedule is rewritten.
 */
@Embeddable
@Getter
@EqualsAndHashCode
@ToString
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
public class FeeEntry {

    @Column(name = "starts_at", nullable = false)
    private Instant start;

    @Column(name = "ends_at", nullable = false)
    private Instant end;

    @Column(name = "amount", nullable = false)
    private long amount;

    public FeeEntry closedAt(Instant newEnd) {
        return new FeeEntry(start, newEnd, amount);
    }

    public FeeEntry startingAt(Instant newStart) {
        return new FeeEntry(newStart, end, amount);
    }

    public FeeEntry withAmount(long newAmount) {
        return new FeeEntry(start, end, newAmount);
    }
}
