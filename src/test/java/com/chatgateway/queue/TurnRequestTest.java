package com.chatgateway.queue;

import com.chatgateway.ErrorKind;
import com.chatgateway.GatewayException;
import com.chatgateway.models.ContentPart;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TurnRequestTest {

    @Test
    void textComesFirstThenImagesThenAttachments() {
        List<ContentPart> parts = TurnRequest.ofText("look at this")
            .withImage("https://example.com/cat.png", 640, 480)
            .withAttachment("notes.txt", "line one")
            .toParts();

        assertEquals(3, parts.size());
        assertEquals("look at this", parts.get(0).getText());
        assertTrue(parts.get(1).isImage());
        assertEquals(640, parts.get(1).getWidth());
        assertEquals("Filename: notes.txt\n---\nline one", parts.get(2).getText());
    }

    @Test
    void longAttachmentsAreTruncated() {
        String content = "a".repeat(TurnRequest.MAX_ATTACHMENT_CHARS + 500);
        ContentPart folded = new TurnRequest().withAttachment("big.log", content).toParts().get(0);
        assertEquals("Filename: big.log\n---\n".length() + TurnRequest.MAX_ATTACHMENT_CHARS,
            folded.getText().length());
    }

    @Test
    void emptyRequestIsRejected() {
        GatewayException error = assertThrows(GatewayException.class, () -> TurnRequest.ofText("   ").toParts());
        assertEquals(ErrorKind.INVALID_REQUEST, error.getKind());
    }

    @Test
    void imageWithoutUriIsRejected() {
        TurnRequest request = TurnRequest.ofText("hi");
        request.getImages().add(new ContentPart());
        assertThrows(GatewayException.class, request::toParts);
    }

    @Test
    void parsesFromJsonBody() throws Exception {
        String json = "{\"text\":\"hi\",\"images\":[{\"uri\":\"data:image/png;base64,AAAA\"}],"
            + "\"attachments\":[{\"filename\":\"a.md\",\"content\":\"# A\"}],\"stream\":true}";
        TurnRequest request = new ObjectMapper().readValue(json, TurnRequest.class);
        List<ContentPart> parts = request.toParts();

        assertEquals(3, parts.size());
        assertTrue(parts.get(1).isImage());
        assertNull(parts.get(1).getWidth());
        assertTrue(parts.get(2).getText().startsWith("Filename: a.md"));
    }
}
