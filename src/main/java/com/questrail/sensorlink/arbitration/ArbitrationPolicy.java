package com.questrail.sensorlink.arbitration;

import java.time.Duration;
import java.util.Objects;

/**
 * ArbitrationPolicy
 * -----------------------------------------------------------------------------
 * Tunables for protocol arbitration.
 *
 * @param observationWindow how long hits are counted after attach
 * @param dominanceFactor   one path must exceed the other by this factor to
 *                          be chosen exclusively; otherwise the device is hybrid
 */
public record ArbitrationPolicy(Duration observationWindow, double dominanceFactor)
{
    public static final Duration DEFAULT_OBSERVATION_WINDOW = Duration.ofMinutes(15);
    public static final double DEFAULT_DOMINANCE_FACTOR = 2.0;

    public ArbitrationPolicy {
        Objects.requireNonNull(observationWindow, "observationWindow");
        if (observationWindow.isNegative() || observationWindow.isZero()) {
            throw new IllegalArgumentException("observationWindow must be > 0");
        }
        if (!Double.isFinite(dominanceFactor) || dominanceFactor < 1.0) {
            throw new IllegalArgumentException("dominanceFactor must be >= 1: " + dominanceFactor);
        }
    }

    public static ArbitrationPolicy defaults() {
        return new ArbitrationPolicy(DEFAULT_OBSERVATION_WINDOW, DEFAULT_DOMINANCE_FACTOR);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Applies the decision rule to final hit counts.
     */
    public ProtocolAffinity decide(long clusterHits, long dataPointHits)
    {
        if (dataPointHits > dominanceFactor * clusterHits) {
            return ProtocolAffinity.DATA_POINT_ONLY;
        }
        if (clusterHits > dominanceFactor * dataPointHits) {
            return ProtocolAffinity.CLUSTER_ONLY;
        }
        return ProtocolAffinity.HYBRID;
    }

    public static final class Builder {
        private Duration observationWindow = DEFAULT_OBSERVATION_WINDOW;
        private double dominanceFactor = DEFAULT_DOMINANCE_FACTOR;

        private Builder() {}

        public Builder withObservationWindow(Duration observationWindow) {
            this.observationWindow = observationWindow;
            return this;
        }

        public Builder withDominanceFactor(double dominanceFactor) {
            this.dominanceFactor = dominanceFactor;
            return this;
        }

        public ArbitrationPolicy build() {
            return new ArbitrationPolicy(observationWindow, dominanceFactor);
        }
    }
}
