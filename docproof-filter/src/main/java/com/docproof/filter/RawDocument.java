package com.docproof.filter;

import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * The unparsed input document. Content is sensitive: never log it.
 */
public final class RawDocument {

    private final String content;
    private final String contentType;
    private final String filename;

    public RawDocument(String content, String contentType, String filename) {
        this.content = Objects.requireNonNull(content, "content");
        this.contentType = contentType;
        this.filename = filename;
    }

    public static RawDocument of(String content) {
        return new RawDocument(content, null, null);
    }

    public String getContent() {
        return content;
    }

    /** MIME type if known (e.g. {@code application/xml}); may be null. */
    public String getContentType() {
        return contentType;
    }

    public String getFilename() {
        return filename;
    }

    public int getSizeBytes() {
        return content.getBytes(StandardCharsets.UTF_8).length;
    }

    @Override
    public String toString() {
        return "RawDocument{contentType=" + contentType + ", chars=" + content.length() + "}";
    }
}
