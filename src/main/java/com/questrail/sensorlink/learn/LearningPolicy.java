package com.questrail.sensorlink.learn;

/**
 * LearningPolicy
 * -----------------------------------------------------------------------------
 * Thresholds for divisor learning.
 *
 * @param historySize        number of most recent raw observations kept per capability
 * @param promotionCount     successful corrections with the same divisor before it is learned
 * @param minimumVoteSamples history size at which the majority vote starts running
 * @param majorityFraction   share of the history a divisor must explain to win the vote
 */
public record LearningPolicy(
        int historySize,
        int promotionCount,
        int minimumVoteSamples,
        double majorityFraction
) {
    public LearningPolicy {
        if (historySize < 1) {
            throw new IllegalArgumentException("historySize must be >= 1");
        }
        if (promotionCount < 1) {
            throw new IllegalArgumentException("promotionCount must be >= 1");
        }
        if (minimumVoteSamples < 1 || minimumVoteSamples > historySize) {
            throw new IllegalArgumentException("minimumVoteSamples must be in 1.." + historySize);
        }
        if (!(majorityFraction > 0 && majorityFraction <= 1)) {
            throw new IllegalArgumentException("majorityFraction must be in (0, 1]");
        }
    }

    public static LearningPolicy defaults() {
        return new LearningPolicy(20, 3, 5, 0.5);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private int historySize = 20;
        private int promotionCount = 3;
        private int minimumVoteSamples = 5;
        private double majorityFraction = 0.5;

        private Builder() {}

        public Builder withHistorySize(int historySize) {
            this.historySize = historySize;
            return this;
        }

        public Builder withPromotionCount(int promotionCount) {
            this.promotionCount = promotionCount;
            return this;
        }

        public Builder withMinimumVoteSamples(int minimumVoteSamples) {
            this.minimumVoteSamples = minimumVoteSamples;
            return this;
        }

        public Builder withMajorityFraction(double majorityFraction) {
            this.majorityFraction = majorityFraction;
            return this;
        }

        public LearningPolicy build() {
            return new LearningPolicy(historySize, promotionCount, minimumVoteSamples, majorityFraction);
        }
    }
}
