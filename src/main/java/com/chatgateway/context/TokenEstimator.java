package com.chatgateway.context;

import com.chatgateway.models.ChatMessage;
import com.chatgateway.models.ContentPart;
import com.chatgateway.models.ConversationTurn;

import java.util.List;

/**
 * Deterministic token estimates. Not a tokenizer: it only has to be stable and a little pessimistic
 * so assembled context stays inside provider limits.
 */
public class TokenEstimator {

    public static final int MESSAGE_OVERHEAD = 4;
    public static final int IMAGE_BASE_TOKENS = 85;
    public static final int IMAGE_TILE_TOKENS = 170;
    public static final int IMAGE_TILE_SIZE = 512;
    public static final int IMAGE_MAX_SIDE = 2048;
    /** Estimate for an image whose dimensions are not known (a 2x2 tile image). */
    public static final int UNKNOWN_IMAGE_TOKENS = IMAGE_BASE_TOKENS + IMAGE_TILE_TOKENS * 4;

    public static int estimateText(String text) {
        if (text == null || text.isEmpty()) {
            return 0;
        }
        return (int) Math.max(1, Math.round(text.length() / 4.0));
    }

    /**
     * Each side is capped at 2048 px and covered by 512 px tiles. Non-decreasing in both
     * width and height.
     */
    public static int estimateImage(Integer width, Integer height) {
        if (width == null || height == null || width <= 0 || height <= 0) {
            return UNKNOWN_IMAGE_TOKENS;
        }
        int w = Math.min(width, IMAGE_MAX_SIDE);
        int h = Math.min(height, IMAGE_MAX_SIDE);
        int tiles = ceilDiv(w, IMAGE_TILE_SIZE) * ceilDiv(h, IMAGE_TILE_SIZE);
        return IMAGE_BASE_TOKENS + IMAGE_TILE_TOKENS * tiles;
    }

    public int estimate(ContentPart part) {
        if (part == null) {
            return 0;
        }
        return part.isImage() ? estimateImage(part.getWidth(), part.getHeight()) : estimateText(part.getText());
    }

    public int estimate(List<ContentPart> parts) {
        int total = MESSAGE_OVERHEAD;
        for (ContentPart part : parts) {
            total += estimate(part);
        }
        return total;
    }

    public int estimate(ChatMessage message) {
        return estimate(message.getParts());
    }

    /**
     * Uses the estimate fixed at write time when the turn carries one.
     */
    public int estimate(ConversationTurn turn) {
        if (turn.getTokenEstimate() > 0) {
            return turn.getTokenEstimate();
        }
        return estimate(turn.getParts());
    }

    private static int ceilDiv(int value, int divisor) {
        return (value + divisor - 1) / divisor;
    }
}
