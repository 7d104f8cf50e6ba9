package complaint.router.app.service;

import java.util.List;
import java.util.Set;

/**
 * Computes how much a keyword match is dampened by negation words around it.
 * Stateless; tokens are expected to be case-folded already.
 */
public final class ContextualNegationChecker {

    private ContextualNegationChecker() {
    }

    /**
     * @return 0 when a suppressing word is adjacent to the match, rising linearly with distance,
     *         1 when none is within {@code window} tokens
     */
    public static double check(List<String> tokens, int matchIndex, int window, Set<String> suppressingWords) {
        return check(tokens, matchIndex, 1, window, suppressingWords);
    }

    /**
     * Variant for multi-token keywords; tokens inside the matched span are never treated as negations.
     */
    public static double check(List<String> tokens, int matchIndex, int matchLength, int window,
                               Set<String> suppressingWords) {
        if (window <= 0 || suppressingWords.isEmpty() || tokens.isEmpty()) {
            return 1.0;
        }
        int matchEnd = matchIndex + Math.max(matchLength, 1) - 1;
        int nearest = Integer.MAX_VALUE;

        int from = Math.max(0, matchIndex - window);
        for (int i = from; i < matchIndex; i++) {
            if (suppressingWords.contains(tokens.get(i))) {
                nearest = Math.min(nearest, matchIndex - i);
            }
        }
        int to = Math.min(tokens.size() - 1, matchEnd + window);
        for (int i = matchEnd + 1; i <= to; i++) {
            if (suppressingWords.contains(tokens.get(i))) {
                nearest = Math.min(nearest, i - matchEnd);
            }
        }

        if (nearest == Integer.MAX_VALUE) {
            return 1.0;
        }
        return (double) (nearest - 1) / window;
    }
}
