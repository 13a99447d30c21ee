package aforo.ledger.service;

/**
 * One-time-use set of registration key digests.
 */
public interface RegistrationKeyStore {

    boolean contains(String digest);

    void insert(String digest);
}
