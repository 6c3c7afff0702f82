package com.phillippitts.talkback.service.stream;

/**
 * Pull-based stream of elements produced by an external provider (audio frames, transcripts,
 * tokens, synthesized audio).
 *
 * <p><b>Contract:</b>
 * <ul>
 *   <li>{@link #next()} blocks until an element is available and returns {@code null} once the
 *       stream has ended</li>
 *   <li>{@link #close()} releases the provider resources and must unblock a thread waiting in
 *       {@link #next()}, which then returns {@code null} or throws {@link InterruptedException}</li>
 *   <li>A failing provider throws a {@link RuntimeException} from {@link #next()}</li>
 * </ul>
 *
 * <p>Consumers read from a single thread; implementations need not support concurrent readers.
 *
 * @param <T> element type
 * @since 1.0
 */
public interface ProviderStream<T> extends AutoCloseable {

    /**
     * Returns the next element, blocking until one is available.
     *
     * @return next element, or {@code null} if the stream has ended
     * @throws InterruptedException if the reading thread is interrupted while waiting
     */
    T next() throws InterruptedException;

    /**
     * Closes the stream. Idempotent.
     */
    @Override
    void close();
}
