package com.phillippitts.talkback.domain;

import java.util.Objects;

/**
 * Incremental piece of a streamed language-model response.
 *
 * @param content token text (must not be null, may be empty)
 * @param isDone  whether this is the last token of the response
 */
public record LlmToken(String content, boolean isDone) {

    public LlmToken {
        Objects.requireNonNull(content, "content must not be null");
    }

    public static LlmToken of(String content) {
        return new LlmToken(content, false);
    }

    public static LlmToken last(String content) {
        return new LlmToken(content, true);
    }
}
