package work.marlowe.kernel.semantics;

/**
 * Fatal rejection of a transaction. Nothing computed during the rejected call is kept.
 */
public final class TransactionException extends RuntimeException {
    private final TransactionError error;
    private final Object data;

    public TransactionException(TransactionError error, String message) {
        this(error, message, null);
    }

    public TransactionException(TransactionError error, String message, Object data) {
        super(message);
        this.error = error;
        this.data = data;
    }

    public TransactionError error() {
        return error;
    }

    public String code() {
        return error.code();
    }

    public Object data() {
        return data;
    }
}
