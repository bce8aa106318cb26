package com.questrail.sensorlink.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of SensorLinkObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jSensorLinkObservabilitySink implements SensorLinkObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jSensorLinkObservabilitySink.class);

    @Override
    public void onFrameDefect(FrameDefectEvent event) {
        if (event.dataPointId() >= 0) {
            log.warn("DataPoint frame defect {} (dp {}): {}", event.kind(), event.dataPointId(), event.detail());
        } else {
            log.warn("DataPoint frame defect {}: {}", event.kind(), event.detail());
        }
    }

    @Override
    public void onDataQuality(DataQualityEvent event) {
        switch (event.correctionKind()) {
            case REJECTED -> log.warn("[{}] {} rejected raw {}: {}",
                event.deviceId(), event.capability(), event.rawValue(), event.detail());
            case CLAMPED_MIN -> log.debug("[{}] {} clamped raw {}: {}",
                event.deviceId(), event.capability(), event.rawValue(), event.detail());
            default -> log.debug("[{}] {} data quality: {}",
                event.deviceId(), event.capability(), event.detail());
        }
    }

    @Override
    public void onDivisorLearned(DivisorLearnedEvent event) {
        log.info("[{}] {} learned divisor {} ({})",
            event.deviceId(), event.capability(), event.divisor(), event.rule());
    }

    @Override
    public void onAffinityDecided(AffinityDecidedEvent event) {
        log.info("[{}] Protocol affinity: {} (cluster={}, dataPoint={}{})",
            event.deviceId(), event.affinity(), event.clusterHits(), event.dataPointHits(),
            event.restored() ? ", restored" : event.forced() ? ", forced" : "");
    }

    @Override
    public void onUnmappedDataPoint(UnmappedDataPointEvent event) {
        log.info("[{}] Unmapped {} key {} = {}",
            event.deviceId(), event.path(), event.key(), event.value());
    }
}
