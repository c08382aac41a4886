package com.chatgateway.models;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Objects;

/**
 * One typed piece of a message. A message's parts keep their original interleaving of text and images.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ContentPart {

    public enum Kind {
        TEXT,
        IMAGE
    }

    private Kind kind;
    private String text;
    private String uri;
    private Integer width;
    private Integer height;

    public ContentPart() {
    }

    public static ContentPart text(String text) {
        ContentPart part = new ContentPart();
        part.setKind(Kind.TEXT);
        part.setText(text != null ? text : "");
        return part;
    }

    public static ContentPart image(String uri) {
        return image(uri, null, null);
    }

    public static ContentPart image(String uri, Integer width, Integer height) {
        ContentPart part = new ContentPart();
        part.setKind(Kind.IMAGE);
        part.setUri(uri);
        part.setWidth(width);
        part.setHeight(height);
        return part;
    }

    @JsonIgnore
    public boolean isText() {
        return kind == Kind.TEXT;
    }

    @JsonIgnore
    public boolean isImage() {
        return kind == Kind.IMAGE;
    }

    public Kind getKind() {
        return kind;
    }

    public void setKind(Kind kind) {
        this.kind = kind;
    }

    public String getText() {
        return text;
    }

    public void setText(String text) {
        this.text = text;
    }

    public String getUri() {
        return uri;
    }

    public void setUri(String uri) {
        this.uri = uri;
    }

    public Integer getWidth() {
        return width;
    }

    public void setWidth(Integer width) {
        this.width = width;
    }

    public Integer getHeight() {
        return height;
    }

    public void setHeight(Integer height) {
        this.height = height;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ContentPart)) return false;
        ContentPart that = (ContentPart) o;
        return kind == that.kind
            && Objects.equals(text, that.text)
            && Objects.equals(uri, that.uri)
            && Objects.equals(width, that.width)
            && Objects.equals(height, that.height);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, text, uri, width, height);
    }

    @Override
    public String toString() {
        return isImage() ? "[image " + uri + "]" : text;
    }
}
