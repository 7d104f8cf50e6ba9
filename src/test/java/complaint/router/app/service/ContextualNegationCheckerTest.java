package complaint.router.app.service;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ContextualNegationCheckerTest {
    private static final Set<String> NEGATIONS = Set.of("not", "never");

    @Test
    void adjacentNegationFullySuppresses() {
        List<String> tokens = List.of("i", "am", "not", "unhappy");

        assertEquals(0.0, ContextualNegationChecker.check(tokens, 3, 3, NEGATIONS));
    }

    @Test
    void dampeningDecaysLinearlyWithDistance() {
        List<String> oneApart = List.of("not", "really", "unhappy");
        List<String> twoApart = List.of("not", "really", "very", "unhappy");

        double near = ContextualNegationChecker.check(oneApart, 2, 3, NEGATIONS);
        double far = ContextualNegationChecker.check(twoApart, 3, 3, NEGATIONS);

        assertEquals(1.0 / 3, near, 1e-9);
        assertEquals(2.0 / 3, far, 1e-9);
        assertTrue(near < far);
    }

    @Test
    void negationOutsideWindowIsIgnored() {
        List<String> tokens = List.of("not", "a", "b", "c", "unhappy");

        assertEquals(1.0, ContextualNegationChecker.check(tokens, 4, 3, NEGATIONS));
    }

    @Test
    void negationAfterMatchCounts() {
        List<String> tokens = List.of("unhappy", "never");

        assertEquals(0.0, ContextualNegationChecker.check(tokens, 0, 3, NEGATIONS));
    }

    @Test
    void noNegationLeavesMatchUnaffected() {
        List<String> tokens = List.of("i", "am", "extremely", "unhappy");

        assertEquals(1.0, ContextualNegationChecker.check(tokens, 3, 3, NEGATIONS));
    }

    @Test
    void zeroWindowDisablesCheck() {
        List<String> tokens = List.of("not", "unhappy");

        assertEquals(1.0, ContextualNegationChecker.check(tokens, 1, 0, NEGATIONS));
    }

    @Test
    void tokensInsideMultiWordKeywordAreNotNegations() {
        List<String> tokens = List.of("printer", "not", "working", "again");

        // "not working" is the keyword itself
        assertEquals(1.0, ContextualNegationChecker.check(tokens, 1, 2, 3, NEGATIONS));
    }

    @Test
    void sameInputGivesSameOutput() {
        List<String> tokens = List.of("never", "been", "so", "disappointed");

        double first = ContextualNegationChecker.check(tokens, 3, 4, NEGATIONS);
        double second = ContextualNegationChecker.check(tokens, 3, 4, NEGATIONS);

        assertEquals(first, second);
        assertEquals(0.5, first, 1e-9);
    }
}
