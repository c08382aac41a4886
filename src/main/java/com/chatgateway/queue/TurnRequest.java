package com.chatgateway.queue;

import com.chatgateway.ErrorKind;
import com.chatgateway.GatewayException;
import com.chatgateway.models.ContentPart;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * A user's submitted turn: text, images, and text attachments that get folded into the prompt.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class TurnRequest {

    public static final int MAX_ATTACHMENT_CHARS = 10_000;

    private String text;
    private List<ContentPart> parts = new ArrayList<>();
    private List<ContentPart> images = new ArrayList<>();
    private List<Attachment> attachments = new ArrayList<>();

    public TurnRequest() {
    }

    public static TurnRequest ofText(String text) {
        TurnRequest request = new TurnRequest();
        request.setText(text);
        return request;
    }

    public TurnRequest withImage(String uri, Integer width, Integer height) {
        images.add(ContentPart.image(uri, width, height));
        return this;
    }

    public TurnRequest withAttachment(String filename, String content) {
        attachments.add(new Attachment(filename, content));
        return this;
    }

    /**
     * Message parts in submission order: explicit parts (or the text field), then images, then one
     * text part per attachment.
     *
     * @throws GatewayException INVALID_REQUEST when nothing usable was submitted
     */
    public List<ContentPart> toParts() {
        List<ContentPart> result = new ArrayList<>();
        for (ContentPart part : parts) {
            if (part == null) {
                continue;
            }
            if (part.getKind() == null) {
                part.setKind(part.getUri() != null ? ContentPart.Kind.IMAGE : ContentPart.Kind.TEXT);
            }
            if (part.isText() && (part.getText() == null || part.getText().isEmpty())) {
                continue;
            }
            result.add(part);
        }
        if (text != null && !text.isBlank()) {
            result.add(0, ContentPart.text(text));
        }
        for (ContentPart image : images) {
            if (image == null || image.getUri() == null || image.getUri().isBlank()) {
                throw new GatewayException(ErrorKind.INVALID_REQUEST, "Image uri is required");
            }
            result.add(ContentPart.image(image.getUri(), image.getWidth(), image.getHeight()));
        }
        for (Attachment attachment : attachments) {
            if (attachment != null) {
                result.add(ContentPart.text(attachment.fold()));
            }
        }
        boolean hasContent = result.stream().anyMatch(p -> p.isImage() || !p.getText().isBlank());
        if (!hasContent) {
            throw new GatewayException(ErrorKind.INVALID_REQUEST, "Message is empty");
        }
        return result;
    }

    public String getText() {
        return text;
    }

    public void setText(String text) {
        this.text = text;
    }

    public List<ContentPart> getParts() {
        return parts;
    }

    public void setParts(List<ContentPart> parts) {
        this.parts = parts != null ? parts : new ArrayList<>();
    }

    public List<ContentPart> getImages() {
        return images;
    }

    public void setImages(List<ContentPart> images) {
        this.images = images != null ? images : new ArrayList<>();
    }

    public List<Attachment> getAttachments() {
        return attachments;
    }

    public void setAttachments(List<Attachment> attachments) {
        this.attachments = attachments != null ? attachments : new ArrayList<>();
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Attachment {
        private String filename;
        private String content;

        public Attachment() {
        }

        public Attachment(String filename, String content) {
            this.filename = filename;
            this.content = content;
        }

        /**
         * {@code Filename: <name>\n---\n<content>}, content cut at {@link #MAX_ATTACHMENT_CHARS}.
         */
        public String fold() {
            String body = content != null ? content : "";
            if (body.length() > MAX_ATTACHMENT_CHARS) {
                body = body.substring(0, MAX_ATTACHMENT_CHARS);
            }
            String name = filename != null && !filename.isBlank() ? filename : "attachment.txt";
            return "Filename: " + name + "\n---\n" + body;
        }

        public String getFilename() {
            return filename;
        }

        public void setFilename(String filename) {
            this.filename = filename;
        }

        public String getContent() {
            return content;
        }

        public void setContent(String content) {
            this.content = content;
        }
    }
}
