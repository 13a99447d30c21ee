package aforo.ledger.event;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * Logs registry events once the publishing transaction has committed.
 */
@Component
@Slf4j
public class LedgerEventListener {

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void onProviderRegistered(ProviderRegisteredEvent event) {
        log.info("Provider {} registered by {} with fee {}",
                event.getProviderId(), event.getOwner(), event.getFee());
    }

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void onProviderRemoved(ProviderRemovedEvent event) {
        log.info("Provider {} of {} removed, residual payout {}",
                event.getProviderId(), event.getOwner(), event.getResidualPayout());
    }

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void onSubscriberRegistered(SubscriberRegisteredEvent event) {
        log.info("Subscriber {} registered by {} with deposit {} on providers {}",
                event.getSubscriberId(), event.getOwner(), event.getDeposit(), event.getProviderIds());
    }
}
