package com.questrail.sensorlink.learn;

import java.util.HashMap;
import java.util.Map;
import java.util.OptionalDouble;

/**
 * Bounded history of raw observations for one (device, capability) pair,
 * together with the correction tally and the learned divisor.
 *
 * <p>Not thread-safe; owned by {@link AdaptiveLearner}.</p>
 */
final class ValueHistory
{
    private final double[] samples;
    private int next;
    private int size;

    private final Map<Double, Integer> correctionTally = new HashMap<>();
    private Double learnedDivisor;

    ValueHistory(int capacity) {
        this.samples = new double[capacity];
    }

    void record(double raw) {
        samples[next] = raw;
        next = (next + 1) % samples.length;
        if (size < samples.length) {
            size++;
        }
    }

    int size() {
        return size;
    }

    /**
     * Samples oldest first.
     */
    double[] samples() {
        double[] out = new double[size];
        int start = (next - size + samples.length) % samples.length;
        for (int i = 0; i < size; i++) {
            out[i] = samples[(start + i) % samples.length];
        }
        return out;
    }

    /**
     * @return the tally for {@code divisor} after counting this correction
     */
    int countCorrection(double divisor) {
        return correctionTally.merge(divisor, 1, Integer::sum);
    }

    OptionalDouble learnedDivisor() {
        return learnedDivisor != null ? OptionalDouble.of(learnedDivisor) : OptionalDouble.empty();
    }

    void learn(double divisor) {
        this.learnedDivisor = divisor;
    }
}
