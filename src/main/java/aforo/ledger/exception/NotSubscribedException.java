package aforo.ledger.exception;

import lombok.Getter;

@Getter
public class NotSubscribedException extends LedgerStateException {

    private final long subscriberId;

    public NotSubscribedException(long subscriberId) {
        super("Subscriber " + subscriberId + " is not on the roster");
        this.subscriberId = subscriberId;
    }

    public NotSubscribedException(long subscriberId, long providerId) {
        super("Subscriber " + subscriberId + " is not subscribed to provider " + providerId);
        this.subscriberId = subscriberId;
    }
}
