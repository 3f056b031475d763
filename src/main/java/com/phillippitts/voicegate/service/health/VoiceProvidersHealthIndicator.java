package com.phillippitts.voicegate.service.health;

import com.phillippitts.voicegate.domain.BreakerState;
import com.phillippitts.voicegate.domain.ProviderCategory;
import com.phillippitts.voicegate.domain.ProviderHealthSnapshot;
import com.phillippitts.voicegate.service.provider.ProviderCandidate;
import com.phillippitts.voicegate.service.provider.ProviderRegistry;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Actuator view of provider availability per category.
 *
 * <ul>
 *   <li>UP: every enabled provider has a closed breaker</li>
 *   <li>DEGRADED: each category with providers still has at least one selectable provider</li>
 *   <li>DOWN: some configured category has no selectable provider</li>
 * </ul>
 *
 * <p>Exposed via /actuator/health.
 */
@Component
public class VoiceProvidersHealthIndicator implements HealthIndicator {

    static final String DEGRADED = "DEGRADED";

    private final ProviderRegistry registry;
    private final ProviderHealthMonitor monitor;

    public VoiceProvidersHealthIndicator(ProviderRegistry registry, ProviderHealthMonitor monitor) {
        this.registry = registry;
        this.monitor = monitor;
    }

    @Override
    public Health health() {
        Map<String, ProviderHealthSnapshot> all = monitor.healthCheck(Optional.empty());

        boolean allClosed = true;
        boolean categoryDown = false;
        Map<String, Object> categories = new LinkedHashMap<>();
        for (ProviderCategory category : ProviderCategory.values()) {
            int total = 0;
            int selectable = 0;
            int closed = 0;
            for (ProviderCandidate candidate : registry.candidates(category)) {
                ProviderHealthSnapshot s = all.get(candidate.name());
                if (s == null) {
                    continue;
                }
                total++;
                if (s.breakerState() != BreakerState.OPEN) {
                    selectable++;
                }
                if (s.breakerState() == BreakerState.CLOSED) {
                    closed++;
                }
            }
            if (total == 0) {
                continue;
            }
            allClosed &= closed == total;
            categoryDown |= selectable == 0;
            categories.put(category.label(), selectable + "/" + total + " available");
        }

        Health.Builder builder;
        if (categoryDown) {
            builder = Health.down();
        } else if (allClosed) {
            builder = Health.up();
        } else {
            builder = Health.status(DEGRADED);
        }
        builder.withDetails(categories);
        all.forEach((name, s) -> builder.withDetail(name, s.status().name().toLowerCase(Locale.ROOT)));
        return builder.build();
    }
}
