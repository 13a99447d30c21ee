package aforo.ledger.accrual;

import aforo.ledger.entity.Subscription;
import aforo.ledger.exception.LedgerStateException;
import aforo.ledger.exception.NotSubscribedException;

import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Dense member list plus an id-to-subscription map, operating on a provider's live collections.
 * Removal swaps the last member into the freed slot, so member order carries no meaning.
 */
public class SubscriberRoster {

    private final List<Long> members;
    private final Map<Long, Subscription> subscriptions;

    public SubscriberRoster(List<Long> members, Map<Long, Subscription> subscriptions) {
        this.members = Objects.requireNonNull(members, "members");
        this.subscriptions = Objects.requireNonNull(subscriptions, "subscriptions");
    }

    public void add(long subscriberId, Instant now) {
        if (subscriptions.containsKey(subscriberId)) {
            throw new LedgerStateException("Subscriber " + subscriberId + " is already on the roster");
        }
        members.add(subscriberId);
        subscriptions.put(subscriberId, new Subscription(members.size() - 1, now));
    }

    public void remove(long subscriberId) {
        Subscription removed = subscriptions.get(subscriberId);
        if (removed == null) {
            throw new NotSubscribedException(subscriberId);
        }
        int index = removed.getRosterIndex();
        int lastIndex = members.size() - 1;
        if (index != lastIndex) {
            Long moved = members.get(lastIndex);
            members.set(index, moved);
            subscriptions.put(moved, subscriptions.get(moved).atIndex(index));
        }
        members.remove(lastIndex);
        subscriptions.remove(subscriberId);
    }

    public boolean contains(long subscriberId) {
        return subscriptions.containsKey(subscriberId);
    }

    public Instant joinedAt(long subscriberId) {
        Subscription subscription = subscriptions.get(subscriberId);
        if (subscription == null) {
            throw new NotSubscribedException(subscriberId);
        }
        return subscription.getJoinedAt();
    }

    public int indexOf(long subscriberId) {
        Subscription subscription = subscriptions.get(subscriberId);
        if (subscription == null) {
            throw new NotSubscribedException(subscriberId);
        }
        return subscription.getRosterIndex();
    }

    public List<Long> members() {
        return Collections.unmodifiableList(members);
    }

    public int size() {
        return members.size();
    }

    public boolean isEmpty() {
        return members.isEmpty();
    }
}
