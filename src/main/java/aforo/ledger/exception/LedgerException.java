package aforo.ledger.exception;

/**
 * Base type for every rejection raised by the ledger. Thrown from inside a transaction,
 * it rolls back all state touched by the operation.
 */
public abstract class LedgerException extends RuntimeException {

    protected LedgerException(String message) {
        super(message);
    }

    protected LedgerException(String message, Throwable cause) {
        super(message, cause);
    }
}
