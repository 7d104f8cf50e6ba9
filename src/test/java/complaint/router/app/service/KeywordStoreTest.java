package complaint.router.app.service;

import complaint.router.app.exception.ConfigurationException;
import complaint.router.app.model.KeywordCategory;
import complaint.router.app.model.KeywordSet;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class KeywordStoreTest {

    @TempDir
    Path dir;

    private Map<KeywordCategory, Resource> writeSources(String complaint) throws IOException {
        Map<KeywordCategory, Resource> sources = new EnumMap<>(KeywordCategory.class);
        sources.put(KeywordCategory.COMPLAINT, write("complaint.txt", complaint));
        sources.put(KeywordCategory.SUBJECT, write("subject.txt", "Refund\n"));
        sources.put(KeywordCategory.URGENCY, write("urgency.txt", "urgent\nASAP\n"));
        sources.put(KeywordCategory.NEGATION, write("negation.txt", "not\nnever\n"));
        return sources;
    }

    private Resource write(String name, String content) throws IOException {
        Path file = dir.resolve(name);
        Files.writeString(file, content, StandardCharsets.UTF_8);
        return new FileSystemResource(file);
    }

    @Test
    void loadCaseFoldsTrimsAndDeduplicates() throws IOException {
        KeywordStore store = new KeywordStore(writeSources("Unhappy\n  unhappy  \n\nOUTAGE\nNot   Working\n"));

        KeywordSet keywords = store.current();

        assertEquals(Set.of("unhappy", "outage", "not working"), keywords.terms(KeywordCategory.COMPLAINT));
        assertTrue(keywords.contains(KeywordCategory.URGENCY, "asap"));
        assertTrue(keywords.containsAnywhere("refund"));
        assertEquals(8, keywords.size());
    }

    @Test
    void missingSourceFailsWithConfigurationError() throws IOException {
        Map<KeywordCategory, Resource> sources = writeSources("unhappy\n");
        sources.put(KeywordCategory.NEGATION, new FileSystemResource(dir.resolve("missing.txt")));

        assertThrows(ConfigurationException.class, () -> new KeywordStore(sources));
    }

    @Test
    void emptyComplaintListFailsWithConfigurationError() throws IOException {
        Map<KeywordCategory, Resource> sources = writeSources("\n   \n");

        assertThrows(ConfigurationException.class, () -> new KeywordStore(sources));
    }

    @Test
    void complaintTermAlsoListedAsNegationIsRejected() throws IOException {
        Map<KeywordCategory, Resource> sources = writeSources("unhappy\nnever\n");

        ConfigurationException error = assertThrows(ConfigurationException.class, () -> new KeywordStore(sources));
        assertTrue(error.getMessage().contains("never"));
    }

    @Test
    void urgencyTermAlsoListedAsSubjectIsRejected() throws IOException {
        Map<KeywordCategory, Resource> sources = writeSources("unhappy\n");
        sources.put(KeywordCategory.SUBJECT, write("subject.txt", "refund\nurgent\n"));

        assertThrows(ConfigurationException.class, () -> new KeywordStore(sources));
    }

    @Test
    void complaintTermMayAlsoBeSubjectTerm() throws IOException {
        KeywordStore store = new KeywordStore(writeSources("unhappy\nrefund\n"));

        assertTrue(store.current().terms(KeywordCategory.COMPLAINT).contains("refund"));
        assertTrue(store.current().terms(KeywordCategory.SUBJECT).contains("refund"));
    }

    @Test
    void overlappingReloadKeepsPreviousSnapshot() throws IOException {
        Map<KeywordCategory, Resource> sources = writeSources("unhappy\n");
        KeywordStore store = new KeywordStore(sources);
        KeywordSet before = store.current();
        write("negation.txt", "not\nunhappy\n");

        assertFalse(store.refresh());
        assertSame(before, store.current());
    }

    @Test
    void failedRefreshKeepsPreviousSnapshot() throws IOException {
        KeywordStore store = new KeywordStore(writeSources("unhappy\n"));
        KeywordSet before = store.current();

        Files.writeString(dir.resolve("complaint.txt"), "\n");
        boolean refreshed = store.refresh();

        assertFalse(refreshed);
        assertSame(before, store.current());
    }

    @Test
    void refreshSwapsInNewSnapshotWithoutTouchingOldOne() throws IOException {
        KeywordStore store = new KeywordStore(writeSources("unhappy\n"));
        KeywordSet before = store.current();

        Files.writeString(dir.resolve("complaint.txt"), "unhappy\nfurious\n");
        assertTrue(store.refresh());

        KeywordSet after = store.current();
        assertNotSame(before, after);
        assertTrue(after.getGeneration() > before.getGeneration());
        assertFalse(before.contains(KeywordCategory.COMPLAINT, "furious"));
        assertTrue(after.contains(KeywordCategory.COMPLAINT, "furious"));
    }

    @Test
    void refreshIfModifiedReloadsOnlyChangedFiles() throws IOException {
        KeywordStore store = new KeywordStore(writeSources("unhappy\n"));

        assertFalse(store.refreshIfModified());

        Path complaint = dir.resolve("complaint.txt");
        Files.writeString(complaint, "unhappy\nfurious\n");
        Files.setLastModifiedTime(complaint, FileTime.from(Instant.now().plusSeconds(60)));

        assertTrue(store.refreshIfModified());
        assertTrue(store.current().contains(KeywordCategory.COMPLAINT, "furious"));
    }
}
