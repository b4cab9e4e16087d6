package work.marlowe.kernel.codec;

/**
 * Raised when a document does not have the shape of the contract language's JSON form.
 */
public final class CodecException extends IllegalArgumentException {
    public CodecException(String message) {
        super(message);
    }

    public CodecException(String message, Throwable cause) {
        super(message, cause);
    }
}
