package aforo.ledger.entity;

import aforo.ledger.accrual.FeeSchedule;
import aforo.ledger.accrual.SubscriberRoster;
import jakarta.persistence.CollectionTable;
import jakarta.persistence.Column;
import jakarta.persistence.ElementCollection;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.MapKeyColumn;
import jakarta.persistence.OrderColumn;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * A service provider charging an hourly fee to every subscriber on its roster.
 * The fee history and the roster are stored as element collections and are
 * manipulated through {@link #feeSchedule()} and {@link #roster()}.
 */
@Entity
@Table(name = "provider",
       indexes = {
           @Index(name = "idx_provider_owner", columnList = "owner_principal"),
           @Index(name = "idx_provider_active", columnList = "active")
       })
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Provider {

    @Id
    private Long id;

    @Version
    private Long version;

    @Column(name = "owner_principal", nullable = false, length = 128)
    private String owner;

    @Column(name = "operator_principal", nullable = false, length = 128)
    private String operator;

    @Column(name = "active", nullable = false)
    private boolean active;

    @Column(name = "registered_at", nullable = false, updatable = false)
    private Instant registeredAt;

    @Column(name = "last_withdrawal_at")
    private Instant lastWithdrawalAt;

    @Column(name = "last_withdrawal_amount", nullable = false)
    private long lastWithdrawalAmount;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "provider_fee_entry", joinColumns = @JoinColumn(name = "provider_id"))
    @OrderColumn(name = "entry_order")
    @Builder.Default
    private List<FeeEntry> feeEntries = new ArrayList<>();

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "provider_roster_member", joinColumns = @JoinColumn(name = "provider_id"))
    @OrderColumn(name = "member_order")
    @Column(name = "subscriber_id", nullable = false)
    @Builder.Default
    private List<Long> rosterMembers = new ArrayList<>();

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "provider_subscription", joinColumns = @JoinColumn(name = "provider_id"))
    @MapKeyColumn(name = "subscriber_id")
    @Builder.Default
    private Map<Long, Subscription> subscriptions = new HashMap<>();

    /**
     * Creates an active provider whose schedule holds a single open-ended entry at {@code fee}.
     */
    public static Provider register(Long id, String owner, String operator, long fee, Instant now) {
        Provider provider = Provider.builder()
                .id(id)
                .owner(owner)
                .operator(operator)
                .active(true)
                .registeredAt(now)
                .build();
        provider.feeSchedule().open(fee, now);
        return provider;
    }

    public FeeSchedule feeSchedule() {
        return new FeeSchedule(feeEntries);
    }

    public SubscriberRoster roster() {
        return new SubscriberRoster(rosterMembers, subscriptions);
    }

    public void recordWithdrawal(Instant at, long amount) {
        this.lastWithdrawalAt = at;
        this.lastWithdrawalAmount = amount;
    }
}
