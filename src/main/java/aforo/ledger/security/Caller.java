package aforo.ledger.security;

/**
 * An already-authenticated principal invoking a ledger operation.
 */
public record Caller(String principal) {

    public static Caller of(String principal) {
        return new Caller(principal);
    }

    public boolean is(String other) {
        return principal != null && principal.equals(other);
    }
}
