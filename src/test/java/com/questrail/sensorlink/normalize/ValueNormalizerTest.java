package com.questrail.sensorlink.normalize;

import com.questrail.sensorlink.protocol.datapoint.value.DecodedValue;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.OptionalDouble;

import static org.junit.jupiter.api.Assertions.*;

/**
 * ValueNormalizerTest
 * -----------------------------------------------------------------------------
 * Correction search order, clamping and the non-scaled rule kinds.
 */
final class ValueNormalizerTest
{
    private final ValueNormalizer normalizer = new ValueNormalizer();

    private static final ConversionRule.ScaledRule PERCENT = ConversionRule.ScaledRule.builder()
            .validRange(0, 100)
            .candidateDivisors(100, 10, 1)
            .build();

    private NormalizationResult scaled(long raw, ConversionRule rule) {
        return normalizer.normalize(DecodedValue.Int.of(raw), rule);
    }

    @Test
    void inRangeValueIsUnchanged()
    {
        NormalizationResult r = scaled(35, PERCENT);

        assertTrue(r.valid());
        assertEquals(CorrectionKind.NONE, r.correctionKind());
        assertEquals(35.0, r.numericValue().getAsDouble());
        assertTrue(r.appliedDivisor().isEmpty());
    }

    @Test
    void misScaledValueIsCorrectedByLargestFittingDivisor()
    {
        NormalizationResult r = scaled(3500, PERCENT);

        assertEquals(CorrectionKind.DIVISOR, r.correctionKind());
        assertEquals(35.0, r.numericValue().getAsDouble());
        assertEquals(100.0, r.appliedDivisor().getAsDouble());
        assertFalse(r.learned());
    }

    @Test
    void correctedValueNormalizesToItself()
    {
        double corrected = scaled(3500, PERCENT).numericValue().getAsDouble();

        NormalizationResult again = scaled((long) corrected, PERCENT);
        assertEquals(CorrectionKind.NONE, again.correctionKind());
        assertEquals(corrected, again.numericValue().getAsDouble());
    }

    @Test
    void typicalRangeIsPreferredOverValidRange()
    {
        ConversionRule.ScaledRule rule = ConversionRule.ScaledRule.builder()
                .validRange(0, 100)
                .typicalRange(10, 50)
                .candidateDivisors(1000, 100)
                .build();

        NormalizationResult r = scaled(2150, rule);

        assertEquals(100.0, r.appliedDivisor().getAsDouble());
        assertEquals(21.5, r.numericValue().getAsDouble());
    }

    @Test
    void validRangeIsTheFallbackWhenNothingIsTypical()
    {
        ConversionRule.ScaledRule rule = ConversionRule.ScaledRule.builder()
                .validRange(0, 100)
                .typicalRange(10, 50)
                .candidateDivisors(1000, 100)
                .build();

        NormalizationResult r = scaled(9000, rule);

        assertEquals(1000.0, r.appliedDivisor().getAsDouble());
        assertEquals(9.0, r.numericValue().getAsDouble());
    }

    @Test
    void multiplierIsTriedAfterDivisors()
    {
        ConversionRule.ScaledRule rule = ConversionRule.ScaledRule.builder()
                .validRange(10, 100)
                .candidateMultipliers(10)
                .build();

        NormalizationResult r = scaled(3, rule);

        assertEquals(CorrectionKind.MULTIPLIER, r.correctionKind());
        assertEquals(30.0, r.numericValue().getAsDouble());
        assertEquals(10.0, r.appliedMultiplier().getAsDouble());
    }

    @Test
    void belowMinimumIsClampedAndAboveMaximumIsRejected()
    {
        NormalizationResult low = scaled(-5, PERCENT);
        assertEquals(CorrectionKind.CLAMPED_MIN, low.correctionKind());
        assertEquals(0.0, low.numericValue().getAsDouble());
        assertTrue(low.valid());
        assertTrue(low.detail().isPresent());

        NormalizationResult high = scaled(1_000_000, PERCENT);
        assertEquals(CorrectionKind.REJECTED, high.correctionKind());
        assertFalse(high.valid());
        assertTrue(high.correctedValue().isEmpty());
        assertTrue(high.detail().isPresent());
    }

    @Test
    void baseTransformAppliesDivisorMultiplierAndOffset()
    {
        ConversionRule.ScaledRule rule = ConversionRule.ScaledRule.builder()
                .divisor(10)
                .multiplier(2)
                .offset(-40)
                .validRange(-40, 125)
                .build();

        assertEquals(3.0, scaled(215, rule).numericValue().getAsDouble());
    }

    @Test
    void learnedDivisorIsAppliedFirst()
    {
        ConversionRule.ScaledRule rule = ConversionRule.ScaledRule.builder()
                .validRange(0, 1000)
                .build();

        NormalizationResult r = normalizer.normalize(DecodedValue.Int.of(215), rule, OptionalDouble.of(10));

        assertEquals(CorrectionKind.DIVISOR, r.correctionKind());
        assertEquals(21.5, r.numericValue().getAsDouble());
        assertTrue(r.learned());
    }

    @Test
    void learnedDivisorThatNoLongerFitsFallsBackToSearch()
    {
        NormalizationResult r = normalizer.normalize(DecodedValue.Int.of(3500), PERCENT, OptionalDouble.of(1000));

        assertEquals(100.0, r.appliedDivisor().getAsDouble());
        assertFalse(r.learned());
    }

    @Test
    void nonNumericValuesPassThroughScaledRules()
    {
        assertEquals(new NormalizedValue.Flag(true),
                normalizer.normalize(new DecodedValue.Bool(true), PERCENT).correctedValue().orElseThrow());
        assertEquals(new NormalizedValue.Label("v1.2"),
                normalizer.normalize(new DecodedValue.Text("v1.2"), PERCENT).correctedValue().orElseThrow());
    }

    @Test
    void enumMapLooksUpOrdinal()
    {
        ConversionRule rule = new ConversionRule.EnumMapRule(Map.of(
                0, NormalizedValue.label("none"),
                1, NormalizedValue.flag(true)));

        assertEquals(NormalizedValue.flag(true),
                normalizer.normalize(new DecodedValue.Enumerated(1), rule).correctedValue().orElseThrow());

        NormalizationResult unknown = normalizer.normalize(new DecodedValue.Enumerated(5), rule);
        assertEquals(CorrectionKind.REJECTED, unknown.correctionKind());
    }

    @Test
    void bitExtractTestsOneBitOrSurfacesMask()
    {
        DecodedValue bitmap = new DecodedValue.Bitmap(0b10);

        assertEquals(NormalizedValue.flag(true),
                normalizer.normalize(bitmap, ConversionRule.BitExtractRule.bit(1)).correctedValue().orElseThrow());
        assertEquals(NormalizedValue.flag(false),
                normalizer.normalize(bitmap, ConversionRule.BitExtractRule.bit(0)).correctedValue().orElseThrow());
        assertEquals(NormalizedValue.numeric(2),
                normalizer.normalize(bitmap, ConversionRule.BitExtractRule.fullMask()).correctedValue().orElseThrow());

        NormalizationResult text = normalizer.normalize(new DecodedValue.Text("x"), ConversionRule.BitExtractRule.bit(0));
        assertFalse(text.valid());
    }

    @Test
    void customRuleFailureRejectsValue()
    {
        ConversionRule ok = new ConversionRule.CustomRule("half",
                v -> NormalizedValue.numeric(v.numeric().orElseThrow() / 2));
        ConversionRule throwing = new ConversionRule.CustomRule("broken", v -> {
            throw new IllegalStateException("boom");
        });
        ConversionRule empty = new ConversionRule.CustomRule("empty", v -> null);

        assertEquals(NormalizedValue.numeric(5),
                normalizer.normalize(DecodedValue.Int.of(10), ok).correctedValue().orElseThrow());
        assertEquals(CorrectionKind.REJECTED, normalizer.normalize(DecodedValue.Int.of(10), throwing).correctionKind());
        assertEquals(CorrectionKind.REJECTED, normalizer.normalize(DecodedValue.Int.of(10), empty).correctionKind());
    }

    @Test
    void typicalRangeOutsideValidRangeIsRejectedAtConstruction()
    {
        assertThrows(IllegalArgumentException.class, () -> ConversionRule.ScaledRule.builder()
                .validRange(0, 100)
                .typicalRange(-10, 50)
                .build());
    }
}
