package complaint.router.app.service;

import complaint.router.app.config.ComplaintRouterProperties;
import complaint.router.app.exception.ConfigurationException;
import complaint.router.app.model.KeywordCategory;
import complaint.router.app.model.KeywordSet;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Service;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Holds the current keyword snapshot. Readers call {@link #current()} once per message and keep
 * using that instance; a reload swaps in a complete new snapshot.
 */
@Slf4j
@Service
public class KeywordStore {
    private final Map<KeywordCategory, Resource> sources;
    private final AtomicReference<KeywordSet> snapshot = new AtomicReference<>();
    private final AtomicLong generation = new AtomicLong();
    private final Map<KeywordCategory, Long> lastModified = new ConcurrentHashMap<>();

    @Autowired
    public KeywordStore(ComplaintRouterProperties properties, ResourceLoader resourceLoader) {
        this(resolveSources(properties.getKeywordFiles(), resourceLoader));
    }

    KeywordStore(Map<KeywordCategory, Resource> sources) {
        this.sources = sources;
        KeywordSet initial = load(sources);
        snapshot.set(initial);
        rememberModificationTimes();
        log.info("Loaded {} keywords (complaint={}, subject={}, urgency={}, negation={})",
                initial.size(),
                initial.terms(KeywordCategory.COMPLAINT).size(),
                initial.terms(KeywordCategory.SUBJECT).size(),
                initial.terms(KeywordCategory.URGENCY).size(),
                initial.terms(KeywordCategory.NEGATION).size());
    }

    public KeywordSet current() {
        return snapshot.get();
    }

    /**
     * Reads every source into a new snapshot. Terms are case-folded and trimmed, blank lines and
     * duplicates dropped.
     *
     * @throws ConfigurationException if a source is missing or unreadable, no complaint keywords remain,
     *         or a term is listed in two categories that match the same text
     */
    public KeywordSet load(Map<KeywordCategory, Resource> sources) {
        Map<KeywordCategory, Set<String>> terms = new EnumMap<>(KeywordCategory.class);
        for (KeywordCategory category : KeywordCategory.values()) {
            Resource resource = sources.get(category);
            if (resource == null) {
                throw new ConfigurationException("No keyword source configured for " + category);
            }
            terms.put(category, readTerms(category, resource));
        }
        if (terms.get(KeywordCategory.COMPLAINT).isEmpty()) {
            throw new ConfigurationException("No complaint keywords configured in " + sources.get(KeywordCategory.COMPLAINT));
        }
        requireDisjoint(terms);
        return new KeywordSet(terms, generation.incrementAndGet());
    }

    private static void requireDisjoint(Map<KeywordCategory, Set<String>> terms) {
        KeywordCategory[] categories = KeywordCategory.values();
        for (int i = 0; i < categories.length; i++) {
            for (int j = i + 1; j < categories.length; j++) {
                KeywordCategory first = categories[i];
                KeywordCategory second = categories[j];
                // subject terms only ever match the subject, complaint terms only the body
                if (EnumSet.of(first, second).equals(EnumSet.of(KeywordCategory.COMPLAINT, KeywordCategory.SUBJECT))) {
                    continue;
                }
                Set<String> shared = new TreeSet<>(terms.get(first));
                shared.retainAll(terms.get(second));
                if (!shared.isEmpty()) {
                    throw new ConfigurationException("Keywords " + shared + " are listed as both " + first + " and " + second);
                }
            }
        }
    }

    /**
     * Reloads all sources and swaps the snapshot. On failure the previous snapshot stays active.
     */
    public boolean refresh() {
        try {
            KeywordSet reloaded = load(sources);
            snapshot.set(reloaded);
            rememberModificationTimes();
            log.info("Keyword lists reloaded (generation {}, {} terms)", reloaded.getGeneration(), reloaded.size());
            return true;
        } catch (ConfigurationException e) {
            log.error("Keyword reload failed, keeping generation {}: {}", snapshot.get().getGeneration(), e.getMessage());
            return false;
        }
    }

    /**
     * Reloads only when a file-backed source changed since the last load.
     */
    public boolean refreshIfModified() {
        for (Map.Entry<KeywordCategory, Resource> entry : sources.entrySet()) {
            Long known = lastModified.get(entry.getKey());
            long current = modificationTime(entry.getValue());
            if (known != null && current > known) {
                log.info("Keyword file for {} changed, reloading", entry.getKey());
                return refresh();
            }
        }
        return false;
    }

    private Set<String> readTerms(KeywordCategory category, Resource resource) {
        if (!resource.exists()) {
            throw new ConfigurationException("Keyword file for " + category + " not found: " + resource.getDescription());
        }
        Set<String> terms = new LinkedHashSet<>();
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(resource.getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                String term = TextTokenizer.normalizeTerm(line);
                if (!term.isEmpty()) {
                    terms.add(term);
                }
            }
        } catch (IOException e) {
            throw new ConfigurationException("Could not read keyword file for " + category + ": " + resource.getDescription(), e);
        }
        return terms;
    }

    private void rememberModificationTimes() {
        sources.forEach((category, resource) -> lastModified.put(category, modificationTime(resource)));
    }

    private long modificationTime(Resource resource) {
        try {
            return resource.lastModified();
        } catch (IOException e) {
            // classpath entries inside a jar have no usable timestamp
            return 0L;
        }
    }

    private static Map<KeywordCategory, Resource> resolveSources(ComplaintRouterProperties.KeywordFiles files,
                                                                 ResourceLoader resourceLoader) {
        Map<KeywordCategory, Resource> resolved = new EnumMap<>(KeywordCategory.class);
        resolved.put(KeywordCategory.COMPLAINT, resourceLoader.getResource(files.getComplaint()));
        resolved.put(KeywordCategory.SUBJECT, resourceLoader.getResource(files.getSubject()));
        resolved.put(KeywordCategory.URGENCY, resourceLoader.getResource(files.getUrgency()));
        resolved.put(KeywordCategory.NEGATION, resourceLoader.getResource(files.getNegation()));
        return resolved;
    }
}
