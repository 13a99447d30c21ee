package aforo.ledger.exception;

/**
 * The caller is not the owner, operator or administrator the operation requires.
 */
public class AuthorizationException extends LedgerException {

    public AuthorizationException(String message) {
        super(message);
    }
}
