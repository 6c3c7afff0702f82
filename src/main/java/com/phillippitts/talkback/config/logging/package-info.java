/**
 * Log correlation support.
 *
 * <p>Conversation logs carry a {@code sessionId} entry in the Log4j2 ThreadContext. The session
 * loop sets it for its own thread; {@link com.phillippitts.talkback.config.logging.ThreadContextTaskDecorator}
 * carries it onto pooled worker threads.
 */
package com.phillippitts.talkback.config.logging;
