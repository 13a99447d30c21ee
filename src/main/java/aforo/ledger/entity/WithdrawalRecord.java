package aforo.ledger.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;

/**
 * One payout to a provider's owner. Year and month are derived in UTC from the
 * settlement instant and are kept for monthly reporting only.
 */
@Entity
@Table(name = "withdrawal_record",
       indexes = {
           @Index(name = "idx_withdrawal_provider_id", columnList = "provider_id"),
           @Index(name = "idx_withdrawal_period", columnList = "provider_id, settlement_year, settlement_month")
       })
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WithdrawalRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "provider_id", nullable = false)
    private Long providerId;

    @Column(name = "subscriber_id")
    private Long subscriberId;  // set for cancellation payouts only

    @Enumerated(EnumType.STRING)
    @Column(name = "kind", nullable = false, length = 20)
    private SettlementKind kind;

    @Column(name = "amount", nullable = false)
    private long amount;

    @Column(name = "settled_at", nullable = false)
    private Instant settledAt;

    @Column(name = "settlement_year", nullable = false)
    private int year;

    @Column(name = "settlement_month", nullable = false)
    private int month;

    public static WithdrawalRecord of(Long providerId, Long subscriberId, SettlementKind kind,
                                      long amount, Instant settledAt) {
        ZonedDateTime utc = settledAt.atZone(ZoneOffset.UTC);
        return WithdrawalRecord.builder()
                .providerId(providerId)
                .subscriberId(subscriberId)
                .kind(kind)
                .amount(amount)
                .settledAt(settledAt)
                .year(utc.getYear())
                .month(utc.getMonthValue())
                .build();
    }
}
