package aforo.ledger.exception;

/**
 * The value-transfer service declined or could not be reached.
 */
public class TransferFailedException extends LedgerException {

    public TransferFailedException(String message) {
        super(message);
    }

    public TransferFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
