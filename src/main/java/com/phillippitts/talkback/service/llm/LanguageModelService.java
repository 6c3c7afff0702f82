package com.phillippitts.talkback.service.llm;

import com.phillippitts.talkback.domain.ChatMessage;
import com.phillippitts.talkback.domain.LlmToken;
import com.phillippitts.talkback.service.stream.ProviderStream;

import java.util.List;

/**
 * Contract for streaming language-model providers.
 *
 * <p>The returned stream yields response tokens in order; the last token has
 * {@link LlmToken#isDone()} set, or the stream simply ends. Provider failures surface as a
 * {@link RuntimeException} either from this method or from {@link ProviderStream#next()}.
 */
public interface LanguageModelService {

    /**
     * Requests a streamed completion for the full conversation.
     *
     * @param messages conversation history, system entry first
     * @param config   request settings
     * @return token stream
     */
    ProviderStream<LlmToken> streamCompletion(List<ChatMessage> messages, LlmRequestConfig config);
}
