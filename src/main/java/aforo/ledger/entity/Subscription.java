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
 * A subscriber's membership in one provider's roster.
 */
@Embeddable
@Getter
@EqualsAndHashCode
@ToString
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
public class Subscription {

    @Column(name = "roster_index", nullable = false)
    private int rosterIndex;

    @Column(name = "joined_at", nullable = false)
    private Instant joinedAt;

    public Subscription atIndex(int index) {
        return new Subscription(index, joinedAt);
    }
}
