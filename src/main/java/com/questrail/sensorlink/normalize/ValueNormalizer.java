package com.questrail.sensorlink.normalize;

import com.questrail.sensorlink.protocol.datapoint.value.DecodedValue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.OptionalDouble;

/**
 * ValueNormalizer
 * -----------------------------------------------------------------------------
 * Applies a {@link ConversionRule} to a decoded value, validating the result
 * against the rule's ranges and correcting mis-scaled values.
 *
 * <h2>Scaled rules</h2>
 * <ol>
 *   <li>Base transform {@code raw / divisor * multiplier + offset}; in the
 *       valid range it is returned as {@link CorrectionKind#NONE}.</li>
 *   <li>Candidate divisors, largest first and skipping 1: the first
 *       {@code raw / d} inside the typical range wins; failing that, the
 *       first inside the valid range.</li>
 *   <li>Candidate multipliers in configured order: the first
 *       {@code raw * m} inside the valid range.</li>
 *   <li>Otherwise a base value below the minimum is clamped to it and one
 *       above the maximum is rejected.</li>
 * </ol>
 *
 * <p>Boolean, text and raw inputs are surfaced unchanged under a scaled
 * rule. Bit, enum and custom rules apply their transform with no range
 * check.</p>
 *
 * <p>This class holds no state. Per-device learning is layered on top by
 * passing a learned divisor to
 * {@link #normalize(DecodedValue, ConversionRule, OptionalDouble)}.</p>
 */
public final class ValueNormalizer
{
    private static final Logger log = LoggerFactory.getLogger(ValueNormalizer.class);

    public NormalizationResult normalize(DecodedValue raw, ConversionRule rule)
    {
        return normalize(raw, rule, OptionalDouble.empty());
    }

    /**
     * Learner-aware variant. A learned divisor is tried before anything else;
     * if it lands in the valid range the result is {@link CorrectionKind#DIVISOR}
     * with {@code learned = true}, otherwise the normal search runs.
     */
    public NormalizationResult normalize(DecodedValue raw, ConversionRule rule, OptionalDouble learnedDivisor)
    {
        Objects.requireNonNull(raw, "raw");
        Objects.requireNonNull(rule, "rule");
        Objects.requireNonNull(learnedDivisor, "learnedDivisor");

        return switch (rule.kind()) {
            case DIVISOR, MULTIPLIER -> scaled(raw, (ConversionRule.ScaledRule) rule, learnedDivisor);
            case BIT_EXTRACT -> bitExtract(raw, (ConversionRule.BitExtractRule) rule);
            case ENUM_MAP -> enumMap(raw, (ConversionRule.EnumMapRule) rule);
            case CUSTOM -> custom(raw, (ConversionRule.CustomRule) rule);
        };
    }

    private static NormalizationResult scaled(DecodedValue raw,
                                              ConversionRule.ScaledRule rule,
                                              OptionalDouble learnedDivisor)
    {
        final OptionalDouble numeric = raw.numeric();
        if (numeric.isEmpty()) {
            return NormalizationResult.unchanged(NormalizedValue.passThrough(raw));
        }
        final double v = numeric.getAsDouble();
        final ValueRange valid = rule.validRange();

        if (learnedDivisor.isPresent()) {
            final double d = learnedDivisor.getAsDouble();
            final double candidate = v / d;
            if (Double.isFinite(candidate) && valid.contains(candidate)) {
                return NormalizationResult.divisor(candidate, d, true);
            }
            log.debug("Learned divisor {} no longer fits raw {} (got {})", d, v, candidate);
        }

        final double base = rule.apply(v);
        if (!Double.isFinite(base)) {
            return NormalizationResult.rejected("non-finite result for raw " + v);
        }
        if (valid.contains(base)) {
            return NormalizationResult.unchanged(new NormalizedValue.Numeric(base));
        }

        final List<Double> divisors = new ArrayList<>(rule.candidateDivisors());
        divisors.removeIf(d -> d == 1.0);
        divisors.sort(Comparator.reverseOrder());

        for (ValueRange target : List.of(rule.typicalRange(), valid)) {
            for (double d : divisors) {
                final double candidate = v / d;
                if (target.contains(candidate)) {
                    return NormalizationResult.divisor(candidate, d, false);
                }
            }
        }

        for (double m : rule.candidateMultipliers()) {
            if (m == 1.0) {
                continue;
            }
            final double candidate = v * m;
            if (Double.isFinite(candidate) && valid.contains(candidate)) {
                return NormalizationResult.multiplier(candidate, m);
            }
        }

        if (base < valid.min()) {
            return NormalizationResult.clampedMin(valid.min(),
                    "raw " + v + " gives " + base + ", below " + valid.min());
        }
        return NormalizationResult.rejected("raw " + v + " gives " + base + ", above " + valid.max()
                + " and no candidate correction fits " + valid);
    }

    private static NormalizationResult bitExtract(DecodedValue raw, ConversionRule.BitExtractRule rule)
    {
        final long mask;
        if (raw instanceof DecodedValue.Bool b) {
            mask = b.value() ? 1 : 0;
        }
        else if (raw instanceof DecodedValue.Int i) {
            mask = i.unsigned();
        }
        else {
            final OptionalDouble numeric = raw.numeric();
            if (numeric.isEmpty()) {
                return NormalizationResult.rejected("bit extraction needs an integer value, got " + raw.type());
            }
            mask = (long) numeric.getAsDouble();
        }

        if (rule.bit().isEmpty()) {
            return NormalizationResult.unchanged(new NormalizedValue.Numeric(mask));
        }
        return NormalizationResult.unchanged(new NormalizedValue.Flag(((mask >>> rule.bit().getAsInt()) & 1L) != 0));
    }

    private static NormalizationResult enumMap(DecodedValue raw, ConversionRule.EnumMapRule rule)
    {
        final int ordinal;
        if (raw instanceof DecodedValue.Bool b) {
            ordinal = b.value() ? 1 : 0;
        }
        else if (raw instanceof DecodedValue.Enumerated e) {
            ordinal = e.ordinal();
        }
        else if (raw instanceof DecodedValue.Int i) {
            ordinal = (int) i.value();
        }
        else {
            return NormalizationResult.rejected("enum mapping needs an ordinal, got " + raw.type());
        }

        final NormalizedValue mapped = rule.table().get(ordinal);
        if (mapped == null) {
            return NormalizationResult.rejected("unknown enum ordinal " + ordinal);
        }
        return NormalizationResult.unchanged(mapped);
    }

    private static NormalizationResult custom(DecodedValue raw, ConversionRule.CustomRule rule)
    {
        final NormalizedValue converted;
        try {
            converted = rule.function().apply(raw);
        }
        catch (RuntimeException e) {
            log.warn("Custom converter '{}' failed for {}", rule.name(), raw, e);
            return NormalizationResult.rejected("custom converter '" + rule.name() + "' failed: " + e.getMessage());
        }
        if (converted == null) {
            log.warn("Custom converter '{}' returned no value for {}", rule.name(), raw);
            return NormalizationResult.rejected("custom converter '" + rule.name() + "' returned no value");
        }
        return NormalizationResult.unchanged(converted);
    }
}
