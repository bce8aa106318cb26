package com.questrail.sensorlink.config;

import com.questrail.sensorlink.arbitration.ArbitrationPolicy;
import com.questrail.sensorlink.learn.LearningPolicy;
import com.questrail.sensorlink.profile.ProfileCatalogLoader;

import java.util.Objects;

/**
 * Aggregated configuration for a SensorLink engine.
 *
 * @param catalogResource      classpath location of the profile catalog, used
 *                             when no registry is supplied explicitly
 * @param surfaceUnmappedValues whether values with no capability mapping are
 *                             still returned to the host as pass-through updates
 */
public record SensorLinkConfig(
    ArbitrationPolicy arbitrationPolicy,
    LearningPolicy learningPolicy,
    String catalogResource,
    boolean surfaceUnmappedValues
) {
    public SensorLinkConfig {
        Objects.requireNonNull(arbitrationPolicy, "arbitrationPolicy");
        Objects.requireNonNull(learningPolicy, "learningPolicy");
        Objects.requireNonNull(catalogResource, "catalogResource");
    }

    public static SensorLinkConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private ArbitrationPolicy arbitrationPolicy = ArbitrationPolicy.defaults();
        private LearningPolicy learningPolicy = LearningPolicy.defaults();
        private String catalogResource = ProfileCatalogLoader.DEFAULT_RESOURCE;
        private boolean surfaceUnmappedValues = true;

        public Builder withArbitrationPolicy(ArbitrationPolicy policy) {
            this.arbitrationPolicy = policy;
            return this;
        }

        public Builder withLearningPolicy(LearningPolicy policy) {
            this.learningPolicy = policy;
            return this;
        }

        public Builder withCatalogResource(String resource) {
            this.catalogResource = resource;
            return this;
        }

        public Builder withSurfaceUnmappedValues(boolean surface) {
            this.surfaceUnmappedValues = surface;
            return this;
        }

        public SensorLinkConfig build() {
            return new SensorLinkConfig(arbitrationPolicy, learningPolicy, catalogResource, surfaceUnmappedValues);
        }
    }
}
