package com.questrail.sensorlink.observability;

/**
 * Main interface for receiving SensorLink observability events.
 * Implementations can provide logging, metrics, or tracing.
 *
 * <p>Callbacks are invoked synchronously on the event-delivery thread and
 * must not block.</p>
 */
public interface SensorLinkObservabilitySink {
    /**
     * Called when a frame or payload is malformed and dropped.
     * @param event the defect details
     */
    void onFrameDefect(FrameDefectEvent event);

    /**
     * Called when a value had to be clamped or was rejected.
     * @param event the data-quality details
     */
    void onDataQuality(DataQualityEvent event);

    /**
     * Called when a divisor becomes learned or is restored.
     * @param event the learning details
     */
    void onDivisorLearned(DivisorLearnedEvent event);

    /**
     * Called when a device's protocol affinity is decided.
     * @param event the decision
     */
    void onAffinityDecided(AffinityDecidedEvent event);

    /**
     * Called when a reported key maps to no capability.
     * @param event the unmapped report
     */
    void onUnmappedDataPoint(UnmappedDataPointEvent event);
}
