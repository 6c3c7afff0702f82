package com.phillippitts.talkback.testutil;

import com.phillippitts.talkback.service.stream.ProviderStream;

import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;

/**
 * {@link ProviderStream} backed by a blocking queue that tests feed by hand.
 *
 * <p>{@link #next()} blocks until the test emits an element, completes, or fails the stream.
 * {@link #close()} unblocks a waiting reader.
 */
public class QueueProviderStream<T> implements ProviderStream<T> {

    private final BlockingQueue<Signal<T>> queue = new LinkedBlockingQueue<>();
    private volatile boolean closed;

    public QueueProviderStream<T> emit(T element) {
        queue.add(new Signal<>(element, null, false));
        return this;
    }

    public QueueProviderStream<T> complete() {
        queue.add(Signal.endSignal());
        return this;
    }

    public QueueProviderStream<T> fail(RuntimeException error) {
        queue.add(new Signal<>(null, error, false));
        return this;
    }

    @Override
    public T next() throws InterruptedException {
        if (closed) {
            return null;
        }
        Signal<T> signal = queue.take();
        if (signal.end()) {
            queue.add(signal);
            return null;
        }
        if (signal.error() != null) {
            throw signal.error();
        }
        return signal.element();
    }

    @Override
    public void close() {
        closed = true;
        queue.add(Signal.endSignal());
    }

    public boolean isClosed() {
        return closed;
    }

    private record Signal<T>(T element, RuntimeException error, boolean end) {

        static <T> Signal<T> endSignal() {
            return new Signal<>(null, null, true);
        }
    }
}
