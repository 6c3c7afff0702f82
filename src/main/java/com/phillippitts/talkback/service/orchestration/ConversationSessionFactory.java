package com.phillippitts.talkback.service.orchestration;

import com.phillippitts.talkback.domain.ChatMessage;
import com.phillippitts.talkback.domain.SessionState;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Creates one orchestrator per conversation and keeps track of the open ones.
 *
 * <p>Callers own the returned orchestrator and must {@link ConversationOrchestrator#close()} it;
 * closing unregisters it. Orchestrators still open at shutdown are closed by {@link #closeAll()}.
 */
public class ConversationSessionFactory {

    private static final Logger LOG = LogManager.getLogger(ConversationSessionFactory.class);

    private final Supplier<DefaultConversationOrchestrator> orchestratorSupplier;
    private final Set<ConversationOrchestrator> open = ConcurrentHashMap.newKeySet();

    public ConversationSessionFactory(Supplier<DefaultConversationOrchestrator> orchestratorSupplier) {
        this.orchestratorSupplier = Objects.requireNonNull(orchestratorSupplier, "orchestratorSupplier must not be null");
    }

    /**
     * Creates a new idle orchestrator.
     */
    public ConversationOrchestrator create() {
        TrackedOrchestrator orchestrator = new TrackedOrchestrator(orchestratorSupplier.get());
        open.add(orchestrator);
        LOG.debug("Created orchestrator ({} open)", open.size());
        return orchestrator;
    }

    /** Orchestrators created and not yet closed. */
    public List<ConversationOrchestrator> openOrchestrators() {
        return List.copyOf(open);
    }

    public void closeAll() {
        for (ConversationOrchestrator orchestrator : List.copyOf(open)) {
            try {
                orchestrator.close();
            } catch (RuntimeException e) {
                LOG.warn("Closing orchestrator failed: {}", e.getMessage());
            }
        }
    }

    private final class TrackedOrchestrator implements ConversationOrchestrator {

        private final DefaultConversationOrchestrator delegate;

        private TrackedOrchestrator(DefaultConversationOrchestrator delegate) {
            this.delegate = delegate;
        }

        @Override
        public void startSession(SessionServices services, SessionMode mode) {
            delegate.startSession(services, mode);
        }

        @Override
        public void stopSession() {
            delegate.stopSession();
        }

        @Override
        public boolean injectUtterance(String text) {
            return delegate.injectUtterance(text);
        }

        @Override
        public SessionState state() {
            return delegate.state();
        }

        @Override
        public String sessionId() {
            return delegate.sessionId();
        }

        @Override
        public String currentTranscript() {
            return delegate.currentTranscript();
        }

        @Override
        public String currentResponse() {
            return delegate.currentResponse();
        }

        @Override
        public List<ChatMessage> history() {
            return delegate.history();
        }

        @Override
        public float audioLevelDb() {
            return delegate.audioLevelDb();
        }

        @Override
        public void close() {
            try {
                delegate.close();
            } finally {
                open.remove(this);
            }
        }
    }
}
