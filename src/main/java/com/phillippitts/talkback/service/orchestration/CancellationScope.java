package com.phillippitts.talkback.service.orchestration;

import com.phillippitts.talkback.service.stream.ProviderStream;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cancellation token for a group of concurrent operations (a session or a single turn).
 *
 * <p>Cancelling sets the flag that workers check at every loop step, cancels tracked futures with
 * interruption, and closes tracked provider streams so blocked reads return. Anything tracked
 * after cancellation is cancelled immediately.
 */
final class CancellationScope {

    private static final Logger LOG = LogManager.getLogger(CancellationScope.class);

    private final AtomicBoolean cancelled = new AtomicBoolean();
    private final Set<Future<?>> tasks = ConcurrentHashMap.newKeySet();
    private final Set<ProviderStream<?>> streams = ConcurrentHashMap.newKeySet();

    boolean isCancelled() {
        return cancelled.get();
    }

    void track(Future<?> task) {
        tasks.add(task);
        if (cancelled.get() && tasks.remove(task)) {
            task.cancel(true);
        }
    }

    void untrack(Future<?> task) {
        tasks.remove(task);
    }

    <S extends ProviderStream<?>> S track(S stream) {
        streams.add(stream);
        if (cancelled.get() && streams.remove(stream)) {
            closeQuietly(stream);
        }
        return stream;
    }

    void release(ProviderStream<?> stream) {
        streams.remove(stream);
        closeQuietly(stream);
    }

    /**
     * Cancels all tracked work. Idempotent.
     */
    void cancel() {
        if (!cancelled.compareAndSet(false, true)) {
            return;
        }
        for (Future<?> task : tasks) {
            task.cancel(true);
        }
        tasks.clear();
        for (ProviderStream<?> stream : streams) {
            closeQuietly(stream);
        }
        streams.clear();
    }

    static void closeQuietly(ProviderStream<?> stream) {
        try {
            stream.close();
        } catch (RuntimeException e) {
            LOG.debug("Provider stream close failed: {}", e.getMessage());
        }
    }
}
