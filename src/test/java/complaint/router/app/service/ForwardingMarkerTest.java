package complaint.router.app.service;

import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class ForwardingMarkerTest {

    @Test
    void extractsIdFromQuotedForward() {
        String body = "Not ours, please reroute.\n\n> " + ForwardingMarker.line("18c2f0a9b7e") + "\n> original text";

        assertEquals(Optional.of("18c2f0a9b7e"), ForwardingMarker.extractMessageId(body));
    }

    @Test
    void lineHasStableFormat() {
        assertEquals("X-Complaint-Processor: Processed-v1.0; ID=abc;", ForwardingMarker.line("abc"));
    }

    @Test
    void textWithoutMarkerYieldsNothing() {
        assertTrue(ForwardingMarker.extractMessageId("X-Complaint-Processor: something else").isEmpty());
        assertTrue(ForwardingMarker.extractMessageId(null).isEmpty());
    }
}
