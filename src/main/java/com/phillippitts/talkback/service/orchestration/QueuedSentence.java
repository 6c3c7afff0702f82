package com.phillippitts.talkback.service.orchestration;

/**
 * A sentence waiting for playback, identified by its enqueue position.
 *
 * <p>The sequence keeps two occurrences of the same text apart in the prefetch maps.
 *
 * @param sequence monotonically increasing enqueue number
 * @param text     sentence text
 */
record QueuedSentence(long sequence, String text) {
}
