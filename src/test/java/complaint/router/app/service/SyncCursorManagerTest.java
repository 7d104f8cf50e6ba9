package complaint.router.app.service;

import complaint.router.app.config.ComplaintRouterProperties;
import complaint.router.app.model.MessagePage;
import complaint.router.app.model.SyncCursor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class SyncCursorManagerTest {
    private static final String MAILBOX = "support@example.com";
    private static final Instant NOW = Instant.parse("2024-06-01T12:00:00Z");

    @Mock
    private MailboxProvider provider;

    @Mock
    private SyncCursorStore store;

    private ComplaintRouterProperties.EmailFilter filter;
    private SyncCursorManager manager;

    @BeforeEach
    void setUp() {
        filter = new ComplaintRouterProperties.EmailFilter();
        manager = new SyncCursorManager(provider, store, new MailboxLockService(), filter, 50,
            Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void storedCursorIsUsedForDeltaListing() {
        SyncCursor stored = new SyncCursor(MAILBOX, "100", NOW.minusSeconds(60));
        when(store.load(MAILBOX)).thenReturn(stored);
        when(provider.listMessagesSince(MAILBOX, "100")).thenReturn(new MessagePage(List.of("m1", "m2"), "120"));

        SyncBatch batch = manager.nextBatch(MAILBOX);

        assertFalse(batch.isBaseline());
        assertEquals(List.of("m1", "m2"), batch.getMessageIds());
        assertEquals("120", batch.getNextToken());
        verify(provider, never()).listMessages(any(), any(), anyInt());
    }

    @Test
    void missingCursorStartsWithFilteredFullListing() {
        when(store.load(MAILBOX)).thenReturn(SyncCursor.empty(MAILBOX));
        when(provider.listMessages(MAILBOX, filter, 50)).thenReturn(new MessagePage(List.of("m1"), "500"));

        SyncBatch batch = manager.nextBatch(MAILBOX);

        assertTrue(batch.isBaseline());
        assertEquals("500", batch.getNextToken());
        verify(provider, never()).listMessagesSince(any(), any());
    }

    @Test
    void expiredCursorFallsBackToFullListing() {
        when(store.load(MAILBOX)).thenReturn(new SyncCursor(MAILBOX, "1", NOW.minusSeconds(86400 * 30L)));
        when(provider.listMessagesSince(MAILBOX, "1"))
            .thenThrow(new MailboxProvider.CursorExpiredException("history expired", null));
        when(provider.listMessages(MAILBOX, filter, 50)).thenReturn(new MessagePage(List.of("m9"), "900"));

        SyncBatch batch = manager.nextBatch(MAILBOX);

        assertTrue(batch.isBaseline());
        assertEquals(List.of("m9"), batch.getMessageIds());
    }

    @Test
    void batchIteratesMessagesLazily() {
        when(store.load(MAILBOX)).thenReturn(new SyncCursor(MAILBOX, "100", NOW));
        when(provider.listMessagesSince(MAILBOX, "100")).thenReturn(new MessagePage(List.of("m1", "m2"), "120"));

        SyncBatch batch = manager.nextBatch(MAILBOX);
        verify(provider, never()).getMessage(any(), any());

        batch.iterator().next();
        verify(provider, times(1)).getMessage(MAILBOX, "m1");
    }

    @Test
    void commitPersistsNextCursor() {
        SyncCursor start = new SyncCursor(MAILBOX, "100", NOW.minusSeconds(60));
        when(store.load(MAILBOX)).thenReturn(start);
        when(provider.listMessagesSince(MAILBOX, "100")).thenReturn(new MessagePage(List.of("m1"), "120"));
        SyncBatch batch = manager.nextBatch(MAILBOX);

        assertTrue(manager.commit(batch));

        ArgumentCaptor<SyncCursor> saved = ArgumentCaptor.forClass(SyncCursor.class);
        verify(store).save(saved.capture());
        assertEquals("120", saved.getValue().getToken());
        assertEquals(NOW, saved.getValue().getSyncedAt());
    }

    @Test
    void commitRefusesWhenCursorMovedDuringPass() {
        SyncCursor start = new SyncCursor(MAILBOX, "100", NOW.minusSeconds(60));
        when(store.load(MAILBOX))
            .thenReturn(start)
            .thenReturn(new SyncCursor(MAILBOX, "130", NOW.minusSeconds(5)));
        when(provider.listMessagesSince(MAILBOX, "100")).thenReturn(new MessagePage(List.of("m1"), "120"));
        SyncBatch batch = manager.nextBatch(MAILBOX);

        assertFalse(manager.commit(batch));
        verify(store, never()).save(any());
    }

    @Test
    void baselineCommitReplacesStaleCursor() {
        when(store.load(MAILBOX))
            .thenReturn(new SyncCursor(MAILBOX, "1", NOW.minusSeconds(600)));
        when(provider.listMessagesSince(MAILBOX, "1"))
            .thenThrow(new MailboxProvider.CursorExpiredException("expired", null));
        when(provider.listMessages(MAILBOX, filter, 50)).thenReturn(new MessagePage(List.of(), "900"));
        SyncBatch batch = manager.nextBatch(MAILBOX);

        assertTrue(manager.commit(batch));
        verify(store).save(new SyncCursor(MAILBOX, "900", NOW));
    }

    @Test
    void missingNextCursorKeepsStoredOne() {
        when(store.load(MAILBOX)).thenReturn(SyncCursor.empty(MAILBOX));
        when(provider.listMessages(MAILBOX, filter, 50)).thenReturn(new MessagePage(List.of(), null));

        assertFalse(manager.commit(manager.nextBatch(MAILBOX)));
        verify(store, never()).save(any());
    }
}
