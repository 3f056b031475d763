package com.phillippitts.voicegate.service.events;

import com.phillippitts.voicegate.domain.BreakerState;
import com.phillippitts.voicegate.service.orchestration.event.BreakerStateChangedEvent;
import com.phillippitts.voicegate.service.orchestration.event.ProviderFailureEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Central log sink for provider failures and breaker transitions. Failure logs are throttled per
 * (provider, kind) to avoid log spam during an outage; breaker transitions are always logged.
 */
@Component
class ProviderEventsListener {

    private static final Logger LOG = LogManager.getLogger(ProviderEventsListener.class);
    private static final Duration THROTTLE = Duration.ofMinutes(1);

    private final Map<String, Instant> lastLog = new ConcurrentHashMap<>();
    private final Clock clock;

    ProviderEventsListener(Clock clock) {
        this.clock = clock;
    }

    @EventListener
    void onProviderFailure(ProviderFailureEvent e) {
        String key = "failure-" + e.provider() + '-' + e.kind();
        if (shouldLog(key)) {
            LOG.warn("Provider failure: provider={}, operation={}, kind={}, msg={}",
                    e.provider(), e.operation().label(), e.kind(), e.message());
        }
    }

    @EventListener
    void onBreakerStateChanged(BreakerStateChangedEvent e) {
        if (e.to() == BreakerState.OPEN) {
            LOG.error("Circuit OPEN for provider {} after {} consecutive failures", e.provider(),
                    e.consecutiveFailures());
        } else {
            LOG.info("Circuit {} -> {} for provider {}", e.from(), e.to(), e.provider());
        }
    }

    // Package-private for tests
    boolean shouldLog(String key) {
        Instant now = clock.instant();
        Instant prev = lastLog.get(key);
        if (prev == null || Duration.between(prev, now).compareTo(THROTTLE) > 0) {
            lastLog.put(key, now);
            return true;
        }
        return false;
    }
}
