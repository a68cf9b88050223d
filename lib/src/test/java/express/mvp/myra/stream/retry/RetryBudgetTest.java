package express.mvp.myra.stream.retry;

import static org.junit.jupiter.api.Assertions.*;

import java.util.OptionalInt;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/** Unit tests for {@link RetryBudget}. */
@DisplayName("RetryBudget")
class RetryBudgetTest {

    @Nested
    @DisplayName("Unbounded budget")
    class UnboundedTests {

        @Test
        @DisplayName("unbounded has no count")
        void unbounded_hasNoCount() {
            RetryBudget budget = RetryBudget.unbounded();
            assertTrue(budget.isUnbounded());
            assertEquals(OptionalInt.empty(), budget.count());
            assertEquals(OptionalInt.empty(), budget.maxAttempts());
        }

        @Test
        @DisplayName("unbounded is never exhausted")
        void unbounded_neverExhausted() {
            RetryBudget budget = RetryBudget.unbounded();
            for (int step = 0; step < 1000; step++) {
                assertFalse(budget.isExhaustedAt(step));
            }
            assertFalse(budget.isExhaustedAt(Integer.MAX_VALUE));
        }

        @Test
        @DisplayName("ofNullable(null) is unbounded")
        void ofNullableNull_isUnbounded() {
            assertSame(RetryBudget.unbounded(), RetryBudget.ofNullable(null));
        }
    }

    @Nested
    @DisplayName("Bounded budget")
    class BoundedTests {

        @Test
        @DisplayName("of(3) allows four attempts")
        void ofThree_allowsFourAttempts() {
            RetryBudget budget = RetryBudget.of(3);
            assertFalse(budget.isUnbounded());
            assertEquals(OptionalInt.of(3), budget.count());
            assertEquals(OptionalInt.of(4), budget.maxAttempts());
        }

        @Test
        @DisplayName("Exhausted exactly at step == count")
        void exhaustedAtCount() {
            RetryBudget budget = RetryBudget.of(2);
            assertFalse(budget.isExhaustedAt(0));
            assertFalse(budget.isExhaustedAt(1));
            assertTrue(budget.isExhaustedAt(2));
        }

        @Test
        @DisplayName("noRetry is exhausted on the first failure")
        void noRetry_exhaustedImmediately() {
            RetryBudget budget = RetryBudget.noRetry();
            assertEquals(OptionalInt.of(1), budget.maxAttempts());
            assertTrue(budget.isExhaustedAt(0));
            assertSame(budget, RetryBudget.of(0));
        }

        @Test
        @DisplayName("Negative count is rejected")
        void negativeCount_rejected() {
            assertThrows(IllegalArgumentException.class, () -> RetryBudget.of(-1));
            assertThrows(IllegalArgumentException.class, () -> RetryBudget.ofNullable(-5));
        }

        @Test
        @DisplayName("Budgets with the same count are equal")
        void equality() {
            assertEquals(RetryBudget.of(5), RetryBudget.ofNullable(5));
            assertEquals(RetryBudget.of(5).hashCode(), RetryBudget.of(5).hashCode());
            assertNotEquals(RetryBudget.of(5), RetryBudget.of(6));
            assertNotEquals(RetryBudget.of(5), RetryBudget.unbounded());
        }

        @Test
        @DisplayName("toString describes the count")
        void toStringDescribesCount() {
            assertTrue(RetryBudget.of(7).toString().contains("7"));
            assertTrue(RetryBudget.unbounded().toString().contains("unbounded"));
        }
    }
}
