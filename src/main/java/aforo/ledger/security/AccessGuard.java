package aforo.ledger.security;

import aforo.ledger.config.LedgerProperties;
import aforo.ledger.entity.Provider;
import aforo.ledger.entity.Subscriber;
import aforo.ledger.exception.AuthorizationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Ownership checks run at the top of every mutating operation, before any state changes.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AccessGuard {

    private final LedgerProperties properties;

    public Caller requireCaller(Caller caller) {
        if (caller == null || caller.principal() == null || caller.principal().isBlank()) {
            throw new AuthorizationException("Missing caller identity");
        }
        return caller;
    }

    public boolean isAdmin(Caller caller) {
        return caller != null && caller.is(properties.getAdminPrincipal());
    }

    public void requireAdmin(Caller caller) {
        requireCaller(caller);
        if (!isAdmin(caller)) {
            throw denied(caller, "administrator");
        }
    }

    /**
     * Owner or administrator: fee changes.
     */
    public void requireProviderOwner(Caller caller, Provider provider) {
        requireCaller(caller);
        if (!caller.is(provider.getOwner()) && !isAdmin(caller)) {
            throw denied(caller, "owner of provider " + provider.getId());
        }
    }

    /**
     * Owner, operator or administrator: withdrawals.
     */
    public void requireProviderSettlement(Caller caller, Provider provider) {
        requireCaller(caller);
        if (!caller.is(provider.getOwner()) && !caller.is(provider.getOperator()) && !isAdmin(caller)) {
            throw denied(caller, "owner or operator of provider " + provider.getId());
        }
    }

    public void requireSubscriberOwner(Caller caller, Subscriber subscriber) {
        requireCaller(caller);
        if (!caller.is(subscriber.getOwner())) {
            throw denied(caller, "owner of subscriber " + subscriber.getId());
        }
    }

    private AuthorizationException denied(Caller caller, String required) {
        log.warn("Denied {}: caller must be {}", caller.principal(), required);
        return new AuthorizationException("Caller " + caller.principal() + " is not the " + required);
    }
}
