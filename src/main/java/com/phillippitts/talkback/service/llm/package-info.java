/**
 * Streaming chat-completion contract and per-request settings.
 */
package com.phillippitts.talkback.service.llm;
