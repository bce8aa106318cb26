package com.questrail.sensorlink.normalize;

import com.questrail.sensorlink.protocol.datapoint.value.DecodedValue;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalInt;
import java.util.function.Function;

/**
 * ConversionRule
 * -----------------------------------------------------------------------------
 * How a decoded wire value becomes a {@link NormalizedValue}.
 *
 * <p>The family is closed. {@link ValueNormalizer} dispatches on
 * {@link #kind()} with an exhaustive {@code switch}, one handler per
 * variant:</p>
 * <ul>
 *   <li>{@link ScaledRule}: divide/multiply with range validation and
 *       automatic correction</li>
 *   <li>{@link BitExtractRule}: one bit as a flag, or the whole mask</li>
 *   <li>{@link EnumMapRule}: ordinal lookup</li>
 *   <li>{@link CustomRule}: host-supplied function</li>
 * </ul>
 */
public sealed interface ConversionRule
        permits ConversionRule.ScaledRule, ConversionRule.BitExtractRule,
                ConversionRule.EnumMapRule, ConversionRule.CustomRule
{
    enum Kind {
        DIVISOR,
        MULTIPLIER,
        BIT_EXTRACT,
        ENUM_MAP,
        CUSTOM
    }

    Kind kind();

    /**
     * Scaled numeric conversion: {@code raw / divisor * multiplier + offset}.
     *
     * <p>{@code kind} records how the catalog declared the rule
     * ({@link Kind#DIVISOR} or {@link Kind#MULTIPLIER}); both share the same
     * formula and correction search.</p>
     *
     * <p>{@code typicalRange} must lie within {@code validRange}. Candidate
     * lists are the alternatives tried when the base transform lands out of
     * range.</p>
     */
    record ScaledRule(
            Kind kind,
            double divisor,
            double multiplier,
            double offset,
            ValueRange validRange,
            ValueRange typicalRange,
            List<Double> candidateDivisors,
            List<Double> candidateMultipliers
    ) implements ConversionRule {

        public ScaledRule {
            Objects.requireNonNull(kind, "kind");
            if (kind != Kind.DIVISOR && kind != Kind.MULTIPLIER) {
                throw new IllegalArgumentException("scaled rule kind must be DIVISOR or MULTIPLIER: " + kind);
            }
            requirePositive("divisor", divisor);
            if (!Double.isFinite(multiplier) || multiplier == 0) {
                throw new IllegalArgumentException("multiplier must be finite and non-zero: " + multiplier);
            }
            if (!Double.isFinite(offset)) {
                throw new IllegalArgumentException("offset must be finite: " + offset);
            }
            Objects.requireNonNull(validRange, "validRange");
            Objects.requireNonNull(typicalRange, "typicalRange");
            if (!validRange.encloses(typicalRange)) {
                throw new IllegalArgumentException("typical range " + typicalRange
                        + " is not within valid range " + validRange);
            }
            candidateDivisors = List.copyOf(candidateDivisors);
            candidateMultipliers = List.copyOf(candidateMultipliers);
            candidateDivisors.forEach(d -> requirePositive("candidate divisor", d));
            candidateMultipliers.forEach(m -> requirePositive("candidate multiplier", m));
        }

        private static void requirePositive(String name, double v) {
            if (!Double.isFinite(v) || v <= 0) {
                throw new IllegalArgumentException(name + " must be finite and > 0: " + v);
            }
        }

        /** Base transform before any correction. */
        public double apply(double raw) {
            return raw / divisor * multiplier + offset;
        }

        public static Builder builder() {
            return new Builder();
        }

        public Builder toBuilder() {
            return new Builder()
                    .kind(kind)
                    .divisor(divisor)
                    .multiplier(multiplier)
                    .offset(offset)
                    .validRange(validRange)
                    .typicalRange(typicalRange)
                    .candidateDivisors(candidateDivisors)
                    .candidateMultipliers(candidateMultipliers);
        }

        /**
         * Builder for {@link ScaledRule}. An unset typical range defaults to
         * the valid range; an unset valid range is unbounded.
         */
        public static final class Builder {
            private Kind kind = Kind.DIVISOR;
            private double divisor = 1;
            private double multiplier = 1;
            private double offset = 0;
            private ValueRange validRange = ValueRange.UNBOUNDED;
            private ValueRange typicalRange;
            private List<Double> candidateDivisors = List.of();
            private List<Double> candidateMultipliers = List.of();

            private Builder() {}

            public Builder kind(Kind kind) {
                this.kind = kind;
                return this;
            }

            public Builder divisor(double divisor) {
                this.divisor = divisor;
                return this;
            }

            public Builder multiplier(double multiplier) {
                this.multiplier = multiplier;
                return this;
            }

            public Builder offset(double offset) {
                this.offset = offset;
                return this;
            }

            public Builder validRange(ValueRange validRange) {
                this.validRange = validRange;
                return this;
            }

            public Builder validRange(double min, double max) {
                return validRange(ValueRange.of(min, max));
            }

            public Builder typicalRange(ValueRange typicalRange) {
                this.typicalRange = typicalRange;
                return this;
            }

            public Builder typicalRange(double min, double max) {
                return typicalRange(ValueRange.of(min, max));
            }

            public Builder candidateDivisors(List<Double> candidateDivisors) {
                this.candidateDivisors = candidateDivisors;
                return this;
            }

            public Builder candidateDivisors(double... divisors) {
                List<Double> list = new ArrayList<>(divisors.length);
                for (double d : divisors) {
                    list.add(d);
                }
                return candidateDivisors(list);
            }

            public Builder candidateMultipliers(List<Double> candidateMultipliers) {
                this.candidateMultipliers = candidateMultipliers;
                return this;
            }

            public Builder candidateMultipliers(double... multipliers) {
                List<Double> list = new ArrayList<>(multipliers.length);
                for (double m : multipliers) {
                    list.add(m);
                }
                return candidateMultipliers(list);
            }

            public ScaledRule build() {
                return new ScaledRule(kind, divisor, multiplier, offset, validRange,
                        typicalRange != null ? typicalRange : validRange,
                        candidateDivisors, candidateMultipliers);
            }
        }
    }

    /**
     * Single-bit or whole-mask extraction.
     *
     * @param bit 0-based bit to test; empty to surface the full mask as an integer
     */
    record BitExtractRule(OptionalInt bit) implements ConversionRule {
        public BitExtractRule {
            Objects.requireNonNull(bit, "bit");
            if (bit.isPresent() && (bit.getAsInt() < 0 || bit.getAsInt() > 31)) {
                throw new IllegalArgumentException("bit index must be 0-31: " + bit.getAsInt());
            }
        }

        public static BitExtractRule bit(int bit) {
            return new BitExtractRule(OptionalInt.of(bit));
        }

        public static BitExtractRule fullMask() {
            return new BitExtractRule(OptionalInt.empty());
        }

        @Override
        public Kind kind() {
            return Kind.BIT_EXTRACT;
        }
    }

    /**
     * Ordinal to normalized value table. Ordinals missing from the table are
     * rejected.
     */
    record EnumMapRule(Map<Integer, NormalizedValue> table) implements ConversionRule {
        public EnumMapRule {
            table = Collections.unmodifiableMap(new LinkedHashMap<>(Objects.requireNonNull(table, "table")));
        }

        @Override
        public Kind kind() {
            return Kind.ENUM_MAP;
        }
    }

    /**
     * Host-supplied conversion. A function that throws or returns
     * {@code null} rejects the value.
     *
     * @param name label used in logs
     */
    record CustomRule(String name, Function<DecodedValue, NormalizedValue> function) implements ConversionRule {
        public CustomRule {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(function, "function");
        }

        @Override
        public Kind kind() {
            return Kind.CUSTOM;
        }
    }
}
