package com.chatgateway.models;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Provider-agnostic message handed to an adapter: a role and its ordered parts.
 */
public final class ChatMessage {

    private final Role role;
    private final List<ContentPart> parts;

    public ChatMessage(Role role, List<ContentPart> parts) {
        this.role = Objects.requireNonNull(role, "role");
        this.parts = Collections.unmodifiableList(List.copyOf(parts));
    }

    public static ChatMessage system(String text) {
        return new ChatMessage(Role.SYSTEM, List.of(ContentPart.text(text)));
    }

    public static ChatMessage of(ConversationTurn turn) {
        return new ChatMessage(turn.getRole(), turn.getParts());
    }

    public Role getRole() {
        return role;
    }

    public List<ContentPart> getParts() {
        return parts;
    }

    public boolean hasImages() {
        return parts.stream().anyMatch(ContentPart::isImage);
    }

    /**
     * Text parts joined with blank lines; image parts are skipped.
     */
    public String joinedText() {
        StringBuilder sb = new StringBuilder();
        for (ContentPart part : parts) {
            if (!part.isText() || part.getText() == null || part.getText().isEmpty()) {
                continue;
            }
            if (sb.length() > 0) {
                sb.append("\n\n");
            }
            sb.append(part.getText());
        }
        return sb.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ChatMessage)) return false;
        ChatMessage that = (ChatMessage) o;
        return role == that.role && parts.equals(that.parts);
    }

    @Override
    public int hashCode() {
        return Objects.hash(role, parts);
    }

    @Override
    public String toString() {
        return role.wireName() + ": " + parts;
    }
}
