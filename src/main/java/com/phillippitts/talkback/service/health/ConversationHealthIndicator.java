package com.phillippitts.talkback.service.health;

import com.phillippitts.talkback.domain.SessionState;
import com.phillippitts.talkback.service.orchestration.ConversationOrchestrator;
import com.phillippitts.talkback.service.orchestration.ConversationSessionFactory;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Health indicator for conversation sessions.
 *
 * <p>Reports:
 * <ul>
 *   <li>UP: no session is in the error state</li>
 *   <li>DEGRADED: at least one session is recovering from an error</li>
 * </ul>
 *
 * <p>Details list the number of open orchestrators and their states. Exposed via /actuator/health.
 */
@Component
public class ConversationHealthIndicator implements HealthIndicator {

    private final ConversationSessionFactory sessionFactory;

    public ConversationHealthIndicator(ConversationSessionFactory sessionFactory) {
        this.sessionFactory = sessionFactory;
    }

    @Override
    public Health health() {
        List<ConversationOrchestrator> open = sessionFactory.openOrchestrators();
        Map<SessionState, Integer> byState = new EnumMap<>(SessionState.class);
        for (ConversationOrchestrator orchestrator : open) {
            byState.merge(orchestrator.state(), 1, Integer::sum);
        }
        long active = open.stream().filter(o -> o.state().isActive()).count();

        Health.Builder builder = byState.containsKey(SessionState.ERROR)
                ? new Health.Builder().status("DEGRADED")
                : new Health.Builder().up();
        return builder
                .withDetail("openOrchestrators", open.size())
                .withDetail("activeSessions", active)
                .withDetail("states", byState)
                .build();
    }
}
