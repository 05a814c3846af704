package io.echoprompt.core.model;

import java.util.Objects;

/** One block of multimodal render output. */
public sealed interface ContentBlock permits ContentBlock.TextBlock, ContentBlock.ImageBlock {

    /** {@code "text"} or {@code "image"}, matching the block type names used by chat APIs. */
    String type();

    record TextBlock(String text) implements ContentBlock {
        public TextBlock {
            Objects.requireNonNull(text, "text must not be null");
        }

        @Override
        public String type() {
            return "text";
        }
    }

    /** An inlined image; {@code url} is a base64 data URL. */
    record ImageBlock(String url) implements ContentBlock {
        public ImageBlock {
            Objects.requireNonNull(url, "url must not be null");
        }

        @Override
        public String type() {
            return "image";
        }
    }
}
