package aforo.ledger.accrual;

import aforo.ledger.entity.Provider;
import aforo.ledger.exception.NotSubscribedException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Read-only accrual over a provider's fee schedule and roster. Results depend only on the
 * provider state and the {@code now} passed in.
 */
@Component
@Slf4j
public class EarningsCalculator {

    /**
     * Accrued amount per roster member, in roster order.
     */
    public Map<Long, Long> perSubscriberEarnings(Provider provider, Instant now) {
        FeeSchedule schedule = provider.feeSchedule();
        SubscriberRoster roster = provider.roster();

        Map<Long, Long> earnings = new LinkedHashMap<>();
        for (Long subscriberId : roster.members()) {
            long amount = schedule.earningsFor(roster.joinedAt(subscriberId), now);
            earnings.put(subscriberId, amount);
        }
        log.debug("Provider {} accrued {} across {} subscriber(s) as of {}",
                provider.getId(), earnings, earnings.size(), now);
        return earnings;
    }

    public long totalEarnings(Provider provider, Instant now) {
        return total(perSubscriberEarnings(provider, now));
    }

    /**
     * Sum of a per-subscriber earnings map, overflow-checked.
     */
    public long total(Map<Long, Long> perSubscriber) {
        long total = 0L;
        for (long amount : perSubscriber.values()) {
            total = LedgerMath.add(total, amount);
        }
        return total;
    }

    /**
     * @throws NotSubscribedException if the subscriber is not on the provider's roster
     */
    public long earningsForOne(Provider provider, long subscriberId, Instant now) {
        SubscriberRoster roster = provider.roster();
        if (!roster.contains(subscriberId)) {
            throw new NotSubscribedException(subscriberId, provider.getId());
        }
        return provider.feeSchedule().earningsFor(roster.joinedAt(subscriberId), now);
    }
}
