package com.agentdeck.core.model;

/**
 * Content sent alongside a user message.
 *
 * @param kind     text content or an image
 * @param name     display name or source path
 * @param content  the text, or base64 image data
 * @param mimeType media type for images, null for text
 */
public record Attachment(Kind kind, String name, String content, String mimeType) {

    public enum Kind { TEXT, IMAGE }

    public static Attachment text(String name, String content) {
        return new Attachment(Kind.TEXT, name, content, null);
    }

    public static Attachment image(String name, String base64Data, String mimeType) {
        return new Attachment(Kind.IMAGE, name, base64Data, mimeType);
    }
}
