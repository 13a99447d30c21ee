package aforo.ledger.exception;

/**
 * The operation does not fit the current state of a provider or subscriber.
 */
public class LedgerStateException extends LedgerException {

    public LedgerStateException(String message) {
        super(message);
    }
}
