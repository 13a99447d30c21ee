package aforo.ledger.entity;

import aforo.ledger.accrual.LedgerMath;
import jakarta.persistence.CollectionTable;
import jakarta.persistence.Column;
import jakarta.persistence.ElementCollection;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * A prepaid account consuming several providers at once.
 * Cancellation pauses the account and clears its subscriptions; the record itself is kept.
 */
@Entity
@Table(name = "subscriber",
       indexes = {
           @Index(name = "idx_subscriber_owner", columnList = "owner_principal")
       })
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Subscriber {

    @Id
    private Long id;

    @Version
    private Long version;

    @Column(name = "owner_principal", nullable = false, length = 128)
    private String owner;

    @Column(name = "balance", nullable = false)
    private long balance;

    @Column(name = "plan", length = 64)
    private String plan;  // label only, never priced

    @Column(name = "paused", nullable = false)
    private boolean paused;

    @Column(name = "registered_at", nullable = false, updatable = false)
    private Instant registeredAt;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "subscriber_provider", joinColumns = @JoinColumn(name = "subscriber_id"))
    @Column(name = "provider_id", nullable = false)
    @Builder.Default
    private Set<Long> providerIds = new LinkedHashSet<>();

    public static Subscriber register(Long id, String owner, long deposit, String plan,
                                      Collection<Long> providerIds, Instant now) {
        return Subscriber.builder()
                .id(id)
                .owner(owner)
                .balance(deposit)
                .plan(plan)
                .registeredAt(now)
                .providerIds(new LinkedHashSet<>(providerIds))
                .build();
    }

    public void debit(long amount) {
        this.balance = LedgerMath.subtract(balance, amount);
    }

    public void credit(long amount) {
        this.balance = LedgerMath.add(balance, amount);
    }
}
