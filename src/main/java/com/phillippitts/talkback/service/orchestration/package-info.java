/**
 * Conversation orchestration: turn-taking, utterance detection, sentence segmentation, synthesis
 * prefetching and barge-in handling.
 *
 * <p>Entry point is {@link com.phillippitts.talkback.service.orchestration.ConversationOrchestrator},
 * created per conversation through
 * {@link com.phillippitts.talkback.service.orchestration.ConversationSessionFactory}.
 *
 * <p>All mutable session state is confined to one {@code SessionLoop} thread per orchestrator;
 * provider streams are read on worker threads that post back to the loop.
 *
 * @since 1.0
 */
package com.phillippitts.talkback.service.orchestration;
