package com.questrail.sensorlink.learn;

import com.questrail.sensorlink.api.CapabilityId;
import com.questrail.sensorlink.api.DeviceId;
import com.questrail.sensorlink.normalize.ConversionRule;
import com.questrail.sensorlink.normalize.CorrectionKind;
import com.questrail.sensorlink.normalize.NormalizationResult;
import com.questrail.sensorlink.normalize.ValueRange;
import com.questrail.sensorlink.observability.DivisorLearnedEvent;
import com.questrail.sensorlink.observability.SensorLinkObservabilitySink;
import com.questrail.sensorlink.protocol.datapoint.value.DecodedValue;
import com.questrail.sensorlink.time.WallClock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalDouble;

/**
 * AdaptiveLearner
 * =============================================================================
 * Infers, per (device, capability), the divisor a device really uses when its
 * reports do not match the configured scaling.
 *
 * <h2>Learning rules</h2>
 * <ul>
 *   <li><b>Correction tally:</b> every divisor correction made by the
 *       normalizer is counted. Once the same divisor has succeeded
 *       {@link LearningPolicy#promotionCount()} times it becomes learned.</li>
 *   <li><b>Majority vote:</b> once the history holds
 *       {@link LearningPolicy#minimumVoteSamples()} samples and nothing is
 *       learned yet, each candidate divisor is scored by how many samples it
 *       maps into the typical range. The best score wins, the smaller divisor
 *       on a tie. The winner is learned only if it explains at least
 *       {@link LearningPolicy#majorityFraction()} of the history, is
 *       neither 1 nor the rule's own base divisor, and explains strictly
 *       more samples than the rule's base transform does.</li>
 * </ul>
 *
 * <p>A learned divisor is stable until {@link #reset(DeviceId, CapabilityId)}.
 * Histories are created lazily on first observation and dropped with
 * {@link #forget(DeviceId)} when the device detaches.</p>
 *
 * <p>Not thread-safe. Like the rest of the core it is driven from the single
 * event-delivery thread.</p>
 */
public final class AdaptiveLearner
{
    private static final Logger log = LoggerFactory.getLogger(AdaptiveLearner.class);

    private final LearningPolicy policy;
    private final SensorLinkObservabilitySink sink;
    private final WallClock wallClock;

    private final Map<LearnerKey, ValueHistory> histories = new HashMap<>();

    public AdaptiveLearner(LearningPolicy policy, SensorLinkObservabilitySink sink, WallClock wallClock) {
        this.policy = Objects.requireNonNull(policy, "policy");
        this.sink = Objects.requireNonNull(sink, "sink");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
    }

    public OptionalDouble learnedDivisor(DeviceId deviceId, CapabilityId capability)
    {
        ValueHistory history = histories.get(new LearnerKey(deviceId, capability));
        return history != null ? history.learnedDivisor() : OptionalDouble.empty();
    }

    /**
     * Feeds one normalization outcome into the history.
     *
     * @param raw    the value before normalization
     * @param result what the normalizer made of it
     * @param rule   the rule that was applied; only scaled rules take part in the vote
     * @return the divisor learned as a consequence of this observation, if any
     */
    public OptionalDouble observe(DeviceId deviceId,
                                  CapabilityId capability,
                                  DecodedValue raw,
                                  NormalizationResult result,
                                  ConversionRule rule)
    {
        Objects.requireNonNull(raw, "raw");
        Objects.requireNonNull(result, "result");
        Objects.requireNonNull(rule, "rule");

        final OptionalDouble numeric = raw.numeric();
        if (numeric.isEmpty()) {
            return OptionalDouble.empty();
        }

        final LearnerKey key = new LearnerKey(deviceId, capability);
        final ValueHistory history = histories.computeIfAbsent(key, k -> new ValueHistory(policy.historySize()));
        history.record(numeric.getAsDouble());

        if (history.learnedDivisor().isPresent()) {
            return OptionalDouble.empty();
        }

        if (result.correctionKind() == CorrectionKind.DIVISOR && !result.learned()) {
            final double divisor = result.appliedDivisor().orElseThrow();
            final int count = history.countCorrection(divisor);
            log.debug("[{}] divisor {} correction #{}", key, divisor, count);
            if (count >= policy.promotionCount()) {
                return learn(key, history, divisor, DivisorLearnedEvent.Rule.CORRECTION_TALLY);
            }
        }

        if (rule instanceof ConversionRule.ScaledRule scaled && history.size() >= policy.minimumVoteSamples()) {
            final OptionalDouble winner = vote(history, scaled);
            if (winner.isPresent()) {
                return learn(key, history, winner.getAsDouble(), DivisorLearnedEvent.Rule.MAJORITY_VOTE);
            }
        }
        return OptionalDouble.empty();
    }

    private OptionalDouble vote(ValueHistory history, ConversionRule.ScaledRule rule)
    {
        final List<Double> candidates = new ArrayList<>(rule.candidateDivisors());
        if (candidates.isEmpty()) {
            return OptionalDouble.empty();
        }
        Collections.sort(candidates);

        final double[] samples = history.samples();
        final ValueRange typical = rule.typicalRange();

        double best = 0;
        int bestScore = -1;
        for (double d : candidates) {
            int score = 0;
            for (double s : samples) {
                if (typical.contains(s / d)) {
                    score++;
                }
            }
            if (score > bestScore) {
                bestScore = score;
                best = d;
            }
        }

        if (bestScore < policy.majorityFraction() * samples.length) {
            return OptionalDouble.empty();
        }

        // the configured scaling keeps any tie it is part of
        int baseScore = 0;
        for (double s : samples) {
            if (typical.contains(rule.apply(s))) {
                baseScore++;
            }
        }
        if (bestScore <= baseScore) {
            return OptionalDouble.empty();
        }
        if (best == 1.0 || best == rule.divisor()) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(best);
    }

    private OptionalDouble learn(LearnerKey key, ValueHistory history, double divisor, DivisorLearnedEvent.Rule rule)
    {
        history.learn(divisor);
        log.info("[{}] learned divisor {} ({})", key, divisor, rule);
        sink.onDivisorLearned(new DivisorLearnedEvent(wallClock.now(), key.deviceId(), key.capability(), divisor, rule));
        return OptionalDouble.of(divisor);
    }

    /**
     * Seeds a learned divisor from persisted state.
     */
    public void restore(DeviceId deviceId, CapabilityId capability, double divisor)
    {
        if (!Double.isFinite(divisor) || divisor <= 0) {
            log.warn("[{}/{}] ignoring persisted divisor {}", deviceId, capability, divisor);
            return;
        }
        final LearnerKey key = new LearnerKey(deviceId, capability);
        histories.computeIfAbsent(key, k -> new ValueHistory(policy.historySize())).learn(divisor);
        sink.onDivisorLearned(new DivisorLearnedEvent(wallClock.now(), deviceId, capability, divisor,
                DivisorLearnedEvent.Rule.RESTORED));
    }

    /**
     * Clears history, tally and learned divisor for one capability.
     */
    public void reset(DeviceId deviceId, CapabilityId capability)
    {
        if (histories.remove(new LearnerKey(deviceId, capability)) != null) {
            log.info("[{}/{}] learning reset", deviceId, capability);
        }
    }

    /**
     * Drops all state for a device.
     */
    public void forget(DeviceId deviceId)
    {
        histories.keySet().removeIf(k -> k.deviceId().equals(deviceId));
    }

    /**
     * Learned divisors of one device, in no particular order.
     */
    public Map<CapabilityId, Double> learnedDivisors(DeviceId deviceId)
    {
        final Map<CapabilityId, Double> out = new LinkedHashMap<>();
        histories.forEach((key, history) -> {
            if (key.deviceId().equals(deviceId)) {
                history.learnedDivisor().ifPresent(d -> out.put(key.capability(), d));
            }
        });
        return Collections.unmodifiableMap(out);
    }

    /**
     * Number of samples currently held for a capability.
     */
    public int historySize(DeviceId deviceId, CapabilityId capability)
    {
        ValueHistory history = histories.get(new LearnerKey(deviceId, capability));
        return history != null ? history.size() : 0;
    }
}
