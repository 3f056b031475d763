package com.phillippitts.voicegate.domain;

/**
 * Outcome of an adapter's lightweight health probe.
 *
 * @param ok        whether the provider looks usable
 * @param latencyMs probe round-trip time
 * @param detail    optional diagnostic, never containing credentials
 */
public record HealthProbe(boolean ok, double latencyMs, String detail) {

    public static HealthProbe up(double latencyMs) {
        return new HealthProbe(true, latencyMs, null);
    }

    public static HealthProbe down(double latencyMs, String detail) {
        return new HealthProbe(false, latencyMs, detail);
    }
}
