package io.echoprompt.core.model;

import java.util.Objects;

/**
 * Content fetched for a {@code #context(...)} reference: a mime type plus
 * either an inline data URL (binary assets such as images) or plain text.
 */
public record ResolvedContent(String mimeType, String dataUrl, String text) {

    public ResolvedContent {
        Objects.requireNonNull(mimeType, "mimeType must not be null");
    }

    public static ResolvedContent ofText(String mimeType, String text) {
        return new ResolvedContent(mimeType, null, text);
    }

    public static ResolvedContent ofDataUrl(String mimeType, String dataUrl) {
        return new ResolvedContent(mimeType, dataUrl, null);
    }

    /** {@code true} for an {@code image/*} mime type carrying a data URL. */
    public boolean isImage() {
        return mimeType.startsWith("image/") && dataUrl != null;
    }
}
