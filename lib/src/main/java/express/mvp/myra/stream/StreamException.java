package express.mvp.myra.stream;

/**
 * Unchecked exception thrown when stream operations fail.
 *
 * <p>This is the root of the library's exception hierarchy. It extends {@link RuntimeException} so
 * that callbacks and factories can be plain functional interfaces without checked exception
 * clauses.
 *
 * @see express.mvp.myra.stream.retry.RetryError
 */
public class StreamException extends RuntimeException {

    /**
     * Constructs a new stream exception with the specified message.
     *
     * @param message the detail message describing the failure
     */
    public StreamException(String message) {
        super(message);
    }

    /**
     * Constructs a new stream exception with the specified message and cause.
     *
     * @param message the detail message describing the failure
     * @param cause the underlying cause of the failure
     */
    public StreamException(String message, Throwable cause) {
        super(message, cause);
    }
}
