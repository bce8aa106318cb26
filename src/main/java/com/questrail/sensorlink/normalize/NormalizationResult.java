package com.questrail.sensorlink.normalize;

import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * NormalizationResult
 * -----------------------------------------------------------------------------
 * Outcome of normalizing one raw value.
 *
 * <p>A result is either valid, carrying a value (possibly corrected or
 * clamped), or {@link CorrectionKind#REJECTED} with no value. The applied
 * divisor or multiplier is present only for the matching correction kind.
 * {@link #learned()} is true when a previously learned divisor produced the
 * value without running the correction search.</p>
 */
public final class NormalizationResult
{
    private final NormalizedValue value;
    private final CorrectionKind correctionKind;
    private final Double appliedDivisor;
    private final Double appliedMultiplier;
    private final boolean learned;
    private final String detail;

    private NormalizationResult(NormalizedValue value,
                                CorrectionKind correctionKind,
                                Double appliedDivisor,
                                Double appliedMultiplier,
                                boolean learned,
                                String detail) {
        this.value = value;
        this.correctionKind = Objects.requireNonNull(correctionKind, "correctionKind");
        this.appliedDivisor = appliedDivisor;
        this.appliedMultiplier = appliedMultiplier;
        this.learned = learned;
        this.detail = detail;
    }

    public static NormalizationResult unchanged(NormalizedValue value) {
        return new NormalizationResult(Objects.requireNonNull(value, "value"),
                CorrectionKind.NONE, null, null, false, null);
    }

    public static NormalizationResult divisor(double value, double divisor, boolean learned) {
        return new NormalizationResult(new NormalizedValue.Numeric(value),
                CorrectionKind.DIVISOR, divisor, null, learned, null);
    }

    public static NormalizationResult multiplier(double value, double multiplier) {
        return new NormalizationResult(new NormalizedValue.Numeric(value),
                CorrectionKind.MULTIPLIER, null, multiplier, false, null);
    }

    public static NormalizationResult clampedMin(double min, String detail) {
        return new NormalizationResult(new NormalizedValue.Numeric(min),
                CorrectionKind.CLAMPED_MIN, null, null, false, detail);
    }

    public static NormalizationResult rejected(String detail) {
        return new NormalizationResult(null, CorrectionKind.REJECTED, null, null, false,
                Objects.requireNonNull(detail, "detail"));
    }

    public boolean valid() {
        return correctionKind != CorrectionKind.REJECTED;
    }

    public Optional<NormalizedValue> correctedValue() {
        return Optional.ofNullable(value);
    }

    /**
     * Numeric view of the value, empty for flags, labels and rejections.
     */
    public OptionalDouble numericValue() {
        return value instanceof NormalizedValue.Numeric n ? OptionalDouble.of(n.value()) : OptionalDouble.empty();
    }

    public CorrectionKind correctionKind() {
        return correctionKind;
    }

    public OptionalDouble appliedDivisor() {
        return appliedDivisor != null ? OptionalDouble.of(appliedDivisor) : OptionalDouble.empty();
    }

    public OptionalDouble appliedMultiplier() {
        return appliedMultiplier != null ? OptionalDouble.of(appliedMultiplier) : OptionalDouble.empty();
    }

    public boolean learned() {
        return learned;
    }

    /**
     * Human-readable reason for a clamp or rejection.
     */
    public Optional<String> detail() {
        return Optional.ofNullable(detail);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof NormalizationResult other)) return false;
        return learned == other.learned
                && correctionKind == other.correctionKind
                && Objects.equals(value, other.value)
                && Objects.equals(appliedDivisor, other.appliedDivisor)
                && Objects.equals(appliedMultiplier, other.appliedMultiplier);
    }

    @Override
    public int hashCode() {
        return Objects.hash(value, correctionKind, appliedDivisor, appliedMultiplier, learned);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("NormalizationResult{").append(correctionKind);
        if (value != null) sb.append(", value=").append(value);
        if (appliedDivisor != null) sb.append(", divisor=").append(appliedDivisor);
        if (appliedMultiplier != null) sb.append(", multiplier=").append(appliedMultiplier);
        if (learned) sb.append(", learned");
        if (detail != null) sb.append(", ").append(detail);
        return sb.append('}').toString();
    }
}
