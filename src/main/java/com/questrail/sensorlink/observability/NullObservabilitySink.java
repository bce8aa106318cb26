package com.questrail.sensorlink.observability;

/**
 * No-op implementation of SensorLinkObservabilitySink.
 */
public final class NullObservabilitySink implements SensorLinkObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onFrameDefect(FrameDefectEvent event) {}

    @Override
    public void onDataQuality(DataQualityEvent event) {}

    @Override
    public void onDivisorLearned(DivisorLearnedEvent event) {}

    @Override
    public void onAffinityDecided(AffinityDecidedEvent event) {}

    @Override
    public void onUnmappedDataPoint(UnmappedDataPointEvent event) {}
}
