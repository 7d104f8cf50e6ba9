package complaint.router.app.model;

import lombok.Getter;

import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Read-only snapshot of the keyword lists. A reload builds a new instance; existing
 * snapshots are never mutated.
 */
public final class KeywordSet {
    private final Map<KeywordCategory, Set<String>> terms;
    private final Map<KeywordCategory, List<List<String>>> phrases;

    @Getter
    private final long generation;

    public KeywordSet(Map<KeywordCategory, ? extends Set<String>> terms, long generation) {
        EnumMap<KeywordCategory, Set<String>> copy = new EnumMap<>(KeywordCategory.class);
        EnumMap<KeywordCategory, List<List<String>>> split = new EnumMap<>(KeywordCategory.class);
        for (KeywordCategory category : KeywordCategory.values()) {
            Set<String> source = terms.containsKey(category) ? terms.get(category) : Set.of();
            Set<String> ordered = Collections.unmodifiableSet(new LinkedHashSet<>(source));
            copy.put(category, ordered);
            split.put(category, ordered.stream()
                    .map(term -> List.of(term.split(" ")))
                    .collect(Collectors.toUnmodifiableList()));
        }
        this.terms = Collections.unmodifiableMap(copy);
        this.phrases = Collections.unmodifiableMap(split);
        this.generation = generation;
    }

    public Set<String> terms(KeywordCategory category) {
        return terms.get(category);
    }

    /**
     * Terms of a category split into their tokens, in load order.
     */
    public List<List<String>> phrases(KeywordCategory category) {
        return phrases.get(category);
    }

    public boolean contains(KeywordCategory category, String term) {
        return terms.get(category).contains(term);
    }

    public boolean containsAnywhere(String term) {
        return Arrays.stream(KeywordCategory.values()).anyMatch(c -> contains(c, term));
    }

    public int size() {
        return terms.values().stream().mapToInt(Set::size).sum();
    }
}
