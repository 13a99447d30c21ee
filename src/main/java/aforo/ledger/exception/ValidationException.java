package aforo.ledger.exception;

/**
 * Input rejected before any state is changed: fee below minimum, reused registration key,
 * provider list out of range, uncovered deposit, arithmetic overflow and similar.
 */
public class ValidationException extends LedgerException {

    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
