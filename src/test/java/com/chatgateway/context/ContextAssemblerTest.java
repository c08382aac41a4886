package com.chatgateway.context;

import com.chatgateway.ErrorKind;
import com.chatgateway.GatewayException;
import com.chatgateway.models.ChatMessage;
import com.chatgateway.models.ContentPart;
import com.chatgateway.models.ConversationTurn;
import com.chatgateway.models.Role;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ContextAssemblerTest {

    private final TokenEstimator estimator = new TokenEstimator();

    private static ConversationTurn turn(int seq, Role role, String text, int tokens) {
        ConversationTurn turn = new ConversationTurn(role, List.of(ContentPart.text(text)));
        turn.setSeq(seq);
        turn.setTokenEstimate(tokens);
        return turn;
    }

    private static List<ConversationTurn> history(int... tokens) {
        List<ConversationTurn> turns = new ArrayList<>();
        for (int i = 0; i < tokens.length; i++) {
            turns.add(turn(i + 1, i % 2 == 0 ? Role.USER : Role.ASSISTANT, "turn " + (i + 1), tokens[i]));
        }
        return turns;
    }

    private static ChatMessage userMessage(String text) {
        return new ChatMessage(Role.USER, List.of(ContentPart.text(text)));
    }

    @Test
    void keepsNewestTurnsThatFitAndDropsOlderOnes() {
        ContextAssembler assembler = new ContextAssembler(estimator, 100, 50);
        // new turn "hi" = 4 overhead + 1
        AssembledContext context = assembler.assemble(null, history(30, 30, 30, 30, 30), userMessage("hi"));

        assertEquals(3, context.getKeptTurns());
        assertEquals(2, context.getDroppedTurns());
        assertEquals(95, context.getEstimatedTokens());
        List<ChatMessage> messages = context.getMessages();
        assertEquals(4, messages.size());
        assertEquals("turn 3", messages.get(0).joinedText());
        assertEquals("turn 5", messages.get(2).joinedText());
        assertEquals("hi", messages.get(3).joinedText());
    }

    @Test
    void keptHistoryIsAContiguousSuffix() {
        ContextAssembler assembler = new ContextAssembler(estimator, 100, 50);
        AssembledContext context = assembler.assemble(null, history(10, 10, 90, 10), userMessage("hi"));

        assertEquals(1, context.getKeptTurns());
        assertEquals("turn 4", context.getMessages().get(0).joinedText());
    }

    @Test
    void considersAtMostMaxTurns() {
        ContextAssembler assembler = new ContextAssembler(estimator, 10_000, 5);
        int[] tokens = new int[20];
        java.util.Arrays.fill(tokens, 1);
        AssembledContext context = assembler.assemble(null, history(tokens), userMessage("hi"));

        assertEquals(5, context.getKeptTurns());
        assertEquals(15, context.getDroppedTurns());
        assertEquals("turn 16", context.getMessages().get(0).joinedText());
    }

    @Test
    void systemPromptComesFirstAndCountsAgainstBudget() {
        ContextAssembler assembler = new ContextAssembler(estimator, 50, 50);
        String prompt = "x".repeat(80); // 20 + 4
        AssembledContext context = assembler.assemble(prompt, history(20, 20), userMessage("hi"));

        assertEquals(Role.SYSTEM, context.getMessages().get(0).getRole());
        assertEquals(1, context.getKeptTurns());
        assertTrue(context.getEstimatedTokens() <= 50);
    }

    @Test
    void oversizedNewTurnIsRejected() {
        ContextAssembler assembler = new ContextAssembler(estimator, 100, 50);
        GatewayException error = assertThrows(GatewayException.class,
            () -> assembler.assemble("be brief", history(), userMessage("y".repeat(1000))));
        assertEquals(ErrorKind.PAYLOAD_TOO_LARGE, error.getKind());
    }

    @Test
    void emptyHistoryYieldsSystemAndNewTurnOnly() {
        ContextAssembler assembler = new ContextAssembler(estimator, 100, 50);
        AssembledContext context = assembler.assemble("be brief", List.of(), userMessage("hi"));
        assertEquals(2, context.getMessages().size());
        assertEquals(0, context.getDroppedTurns());
    }

    @Test
    void sameInputGivesSameOutput() {
        ContextAssembler assembler = new ContextAssembler(estimator, 120, 50);
        List<ConversationTurn> turns = history(25, 40, 15, 30, 20);
        AssembledContext first = assembler.assemble("sys", turns, userMessage("hello"));
        AssembledContext second = assembler.assemble("sys", turns, userMessage("hello"));

        assertEquals(first.getMessages(), second.getMessages());
        assertEquals(first.getEstimatedTokens(), second.getEstimatedTokens());
        assertEquals(first.getDroppedTurns(), second.getDroppedTurns());
    }

    @Test
    void imagePartsKeepTheirPosition() {
        ContextAssembler assembler = new ContextAssembler(estimator, 10_000, 50);
        ChatMessage message = new ChatMessage(Role.USER, List.of(
            ContentPart.text("before"),
            ContentPart.image("https://example.com/cat.png", 256, 256),
            ContentPart.text("after")
        ));
        AssembledContext context = assembler.assemble(null, List.of(), message);
        List<ContentPart> parts = context.getMessages().get(0).getParts();
        assertEquals("before", parts.get(0).getText());
        assertTrue(parts.get(1).isImage());
        assertEquals("after", parts.get(2).getText());
    }
}
