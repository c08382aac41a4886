package com.chatgateway.context;

import com.chatgateway.models.ChatMessage;
import com.chatgateway.models.ContentPart;
import com.chatgateway.models.ConversationTurn;
import com.chatgateway.models.Role;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TokenEstimatorTest {

    private final TokenEstimator estimator = new TokenEstimator();

    @Test
    void textUsesFourCharsPerToken() {
        assertEquals(0, TokenEstimator.estimateText(""));
        assertEquals(0, TokenEstimator.estimateText(null));
        assertEquals(1, TokenEstimator.estimateText("a"));
        assertEquals(1, TokenEstimator.estimateText("abcd"));
        assertEquals(2, TokenEstimator.estimateText("abcdef"));
        assertEquals(25, TokenEstimator.estimateText("x".repeat(100)));
    }

    @Test
    void imageWithoutDimensionsUsesFixedEstimate() {
        assertEquals(765, TokenEstimator.estimateImage(null, null));
        assertEquals(765, TokenEstimator.estimateImage(0, 600));
    }

    @Test
    void imageCostCountsTilesAndCapsLargeImages() {
        assertEquals(255, TokenEstimator.estimateImage(512, 512));
        assertEquals(425, TokenEstimator.estimateImage(513, 100));
        assertEquals(765, TokenEstimator.estimateImage(1024, 1024));
        assertEquals(85 + 170 * 16, TokenEstimator.estimateImage(2048, 2048));
        assertEquals(85 + 170 * 16, TokenEstimator.estimateImage(8000, 6000));
    }

    @Test
    void imageCostNeverDecreasesAsDimensionsGrow() {
        for (int h = 1; h <= 3000; h += 137) {
            int previous = 0;
            for (int w = 1; w <= 3000; w += 61) {
                int cost = TokenEstimator.estimateImage(w, h);
                assertTrue(cost >= previous, "cost dropped at " + w + "x" + h);
                assertTrue(cost >= TokenEstimator.estimateImage(w, Math.max(1, h - 137)));
                previous = cost;
            }
        }
    }

    @Test
    void messageAddsOverheadToEveryPart() {
        ChatMessage message = new ChatMessage(Role.USER, List.of(
            ContentPart.text("abcd"),
            ContentPart.image("https://example.com/a.png", 512, 512)
        ));
        assertEquals(TokenEstimator.MESSAGE_OVERHEAD + 1 + 255, estimator.estimate(message));
    }

    @Test
    void turnPrefersStoredEstimate() {
        ConversationTurn turn = new ConversationTurn(Role.USER, List.of(ContentPart.text("abcd")));
        assertEquals(5, estimator.estimate(turn));
        turn.setTokenEstimate(42);
        assertEquals(42, estimator.estimate(turn));
    }
}
