package com.questrail.sensorlink.observability;

import com.questrail.sensorlink.api.CapabilityId;
import com.questrail.sensorlink.api.DeviceId;
import com.questrail.sensorlink.api.ProtocolPath;
import com.questrail.sensorlink.arbitration.ProtocolAffinity;
import com.questrail.sensorlink.normalize.CorrectionKind;
import com.questrail.sensorlink.protocol.datapoint.value.DecodedValue;
import com.questrail.sensorlink.time.FixedWallClock;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Smoke test: every event kind can be logged, including the optional fields.
 */
final class Slf4jSensorLinkObservabilitySinkTest
{
    private static final Instant NOW = FixedWallClock.EPOCH;
    private static final DeviceId DEVICE = DeviceId.of("dev-1");
    private static final CapabilityId HUMIDITY = CapabilityId.of("measure_humidity");

    private final SensorLinkObservabilitySink sink = new Slf4jSensorLinkObservabilitySink();

    @Test
    void logsEveryEventKind()
    {
        assertDoesNotThrow(() -> {
            sink.onFrameDefect(new FrameDefectEvent(NOW, FrameDefectEvent.Kind.TRUNCATED, -1, "header cut"));
            sink.onFrameDefect(new FrameDefectEvent(NOW, FrameDefectEvent.Kind.TYPE_MISMATCH, 4, "empty boolean"));
            for (CorrectionKind kind : CorrectionKind.values()) {
                sink.onDataQuality(new DataQualityEvent(NOW, DEVICE, HUMIDITY, DecodedValue.Int.of(650), kind, "detail"));
            }
            sink.onDivisorLearned(new DivisorLearnedEvent(NOW, DEVICE, HUMIDITY, 10, DivisorLearnedEvent.Rule.MAJORITY_VOTE));
            sink.onAffinityDecided(new AffinityDecidedEvent(NOW, DEVICE, ProtocolAffinity.HYBRID, 4, 5, false, false));
            sink.onAffinityDecided(new AffinityDecidedEvent(NOW, DEVICE, ProtocolAffinity.HYBRID, 0, 0, true, false));
            sink.onAffinityDecided(new AffinityDecidedEvent(NOW, DEVICE, ProtocolAffinity.CLUSTER_ONLY, 1, 0, false, true));
            sink.onUnmappedDataPoint(new UnmappedDataPointEvent(NOW, DEVICE, ProtocolPath.DATA_POINT, 99,
                    new DecodedValue.Text("fw-1.0.3")));
        });
    }
}
