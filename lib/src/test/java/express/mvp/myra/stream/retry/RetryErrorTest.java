package express.mvp.myra.stream.retry;

import static org.junit.jupiter.api.Assertions.*;

import express.mvp.myra.stream.StreamException;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/** Unit tests for {@link RetryError} and {@link FailedAttempt}. */
@DisplayName("RetryError")
class RetryErrorTest {

    @Test
    @DisplayName("Message names the retry count")
    void messageNamesCount() {
        RetryError error =
                new RetryError(2, List.of(new FailedAttempt(0, new RuntimeException("a"))));

        assertEquals("Received an error after attempting 2 retries", error.getMessage());
        assertEquals(2, error.count());
    }

    @Test
    @DisplayName("Is a StreamException")
    void isStreamException() {
        RetryError error = new RetryError(0, List.of(new FailedAttempt(0, new RuntimeException())));
        assertInstanceOf(StreamException.class, error);
    }

    @Test
    @DisplayName("Last error is the cause, earlier ones are suppressed")
    void causeAndSuppressed() {
        RuntimeException first = new RuntimeException("first");
        RuntimeException second = new RuntimeException("second");
        RuntimeException third = new RuntimeException("third");

        RetryError error =
                new RetryError(
                        2,
                        List.of(
                                new FailedAttempt(0, first),
                                new FailedAttempt(1, second),
                                new FailedAttempt(2, third)));

        assertSame(third, error.getCause());
        assertArrayEquals(new Throwable[] {first, second}, error.getSuppressed());
    }

    @Test
    @DisplayName("Error list is an unmodifiable copy")
    void errorsAreCopied() {
        List<FailedAttempt> log = new ArrayList<>();
        log.add(new FailedAttempt(0, new RuntimeException()));

        RetryError error = new RetryError(0, log);
        log.add(new FailedAttempt(1, new RuntimeException()));

        assertEquals(1, error.errors().size());
        assertThrows(
                UnsupportedOperationException.class,
                () -> error.errors().add(new FailedAttempt(2, new RuntimeException())));
    }

    @Test
    @DisplayName("FailedAttempt captures the stack trace when recorded")
    void failedAttemptCapturesStackTrace() {
        RuntimeException cause = new RuntimeException("x");
        FailedAttempt attempt = new FailedAttempt(3, cause);

        cause.setStackTrace(new StackTraceElement[0]);

        assertEquals(3, attempt.retryStep());
        assertSame(cause, attempt.error());
        assertFalse(attempt.stackTrace().isEmpty());
        assertTrue(attempt.toString().contains("step=3"));
    }

    @Test
    @DisplayName("FailedAttempt rejects a null error")
    void failedAttemptRejectsNull() {
        assertThrows(NullPointerException.class, () -> new FailedAttempt(0, null));
    }
}
