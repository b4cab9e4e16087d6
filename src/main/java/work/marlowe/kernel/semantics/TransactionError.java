package work.marlowe.kernel.semantics;

/**
 * Reasons a transaction is rejected as a whole.
 */
public enum TransactionError {
    AMBIGUOUS_TIME_INTERVAL("TEAmbiguousTimeIntervalError"),
    APPLY_NO_MATCH("TEApplyNoMatchError"),
    HASH_MISMATCH("TEHashMismatch"),
    MALFORMED_CALL("TEMalformedCall"),
    INVALID_INTERVAL("TEIntervalError"),
    INTERVAL_IN_PAST("TEIntervalError"),
    USELESS_TRANSACTION("TEUselessTransaction"),
    STEP_LIMIT_EXCEEDED("TEStepLimitExceeded");

    private final String code;

    TransactionError(String code) {
        this.code = code;
    }

    /**
     * Wire name of the error, as reported by the ledger-side tooling.
     */
    public String code() {
        return code;
    }
}
