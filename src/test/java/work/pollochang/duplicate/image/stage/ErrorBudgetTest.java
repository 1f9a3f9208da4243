package work.pollochang.duplicate.image.stage;

import org.junit.jupiter.api.Test;
import work.pollochang.duplicate.image.core.ProviderUnstableException;

import static org.junit.jupiter.api.Assertions.*;

class ErrorBudgetTest {

    @Test
    void limit_isTenOrTenPercent() {
        assertEquals(10, new ErrorBudget("s", 5).limit());
        assertEquals(10, new ErrorBudget("s", 100).limit());
        assertEquals(50, new ErrorBudget("s", 500).limit());
    }

    @Test
    void recordFailure_throwsOnceLimitExceeded() {
        ErrorBudget budget = new ErrorBudget("exact-match", 20);
        budget.recordSuccess();
        for (int i = 0; i < 10; i++) {
            budget.recordFailure();
        }

        ProviderUnstableException e = assertThrows(ProviderUnstableException.class, budget::recordFailure);
        assertEquals("exact-match", e.getStage());
        assertEquals(1, e.getProcessed());
        assertEquals(11, e.getFailures());
        assertEquals(1, budget.processed());
    }
}
