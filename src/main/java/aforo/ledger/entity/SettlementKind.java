package aforo.ledger.entity;

public enum SettlementKind {
    WITHDRAWAL,     // provider pulled its accrued earnings
    CANCELLATION,   // a cancelling subscriber paid the provider directly
    REMOVAL         // residual payout before the provider was deleted
}
