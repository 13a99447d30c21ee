package aforo.ledger.service;

/**
 * Hands out ids for new providers and subscribers. Ids start at 1 and are never reused.
 */
public interface IdAllocator {

    long nextProviderId();

    long nextSubscriberId();
}
