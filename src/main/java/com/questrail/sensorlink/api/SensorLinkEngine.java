package com.questrail.sensorlink.api;

import com.questrail.sensorlink.arbitration.AffinitySnapshot;
import com.questrail.sensorlink.arbitration.ProtocolAffinity;
import com.questrail.sensorlink.normalize.ConversionRule;
import com.questrail.sensorlink.normalize.NormalizationResult;
import com.questrail.sensorlink.profile.CapabilityProfile;
import com.questrail.sensorlink.protocol.datapoint.model.DataPointRecord;
import com.questrail.sensorlink.protocol.datapoint.model.DataPointType;
import com.questrail.sensorlink.protocol.datapoint.value.DecodedValue;
import com.questrail.sensorlink.runtime.CapabilityUpdate;
import com.questrail.sensorlink.runtime.PersistedDeviceState;

import java.util.List;
import java.util.Optional;

/**
 * SensorLinkEngine
 * =============================================================================
 * Public entry point of the core for a host integration layer.
 *
 * <p>The host feeds raw protocol traffic in and receives normalized
 * {@link CapabilityUpdate}s back. The engine hides:</p>
 * <ul>
 *   <li>which of the two protocol paths a value arrived on</li>
 *   <li>wrapper encodings and integer widths of DataPoint payloads</li>
 *   <li>vendor scaling quirks, corrected and learned per device</li>
 * </ul>
 *
 * <h2>Threading</h2>
 * <p>All device-scoped methods must be called from a single event-delivery
 * thread, the same one on which the supplied scheduler runs callbacks. The
 * stateless operations ({@link #decodeFrame(Object)},
 * {@link #encodeDataPoint(int, DataPointType, Object)},
 * {@link #normalize(DecodedValue, ConversionRule)}) may be called from any
 * thread.</p>
 *
 * <h2>Failure model</h2>
 * <p>No inbound-data condition throws. Malformed frames, unknown devices and
 * implausible values yield fewer or no updates and are logged and reported
 * to the observability sink. Caller misuse (null arguments, unencodable
 * outbound values) throws {@link NullPointerException} or
 * {@link IllegalArgumentException}.</p>
 */
public interface SensorLinkEngine extends AutoCloseable
{
    /**
     * Decodes a private-channel payload in any supported wrapper encoding.
     */
    List<DataPointRecord> decodeFrame(Object input);

    /**
     * Encodes one outbound DataPoint frame.
     *
     * @throws IllegalArgumentException on a bad id, an over-long payload, or
     *         a value of the wrong Java type for {@code type}
     */
    byte[] encodeDataPoint(int id, DataPointType type, Object value);

    Optional<CapabilityProfile> resolveProfile(DeviceFingerprint fingerprint);

    /**
     * Registers or replaces a profile. Devices already attached keep the
     * profile they resolved at attach time.
     */
    void registerProfile(DeviceFingerprint fingerprint, CapabilityProfile profile);

    /**
     * Stateless normalization with no learning.
     */
    NormalizationResult normalize(DecodedValue rawValue, ConversionRule rule);

    /**
     * Creates a device session, restoring persisted state and opening the
     * observation window. Re-attaching an attached device replaces its session.
     */
    void attachDevice(DeviceId deviceId, DeviceFingerprint fingerprint);

    /**
     * Tears the session down and cancels its observation window. Unknown
     * devices are ignored.
     */
    void detachDevice(DeviceId deviceId);

    /**
     * Feeds one protocol event through arbitration, normalization and
     * learning.
     *
     * @param key      cluster id or DataPoint id
     * @param rawValue a {@link DecodedValue}, or a host value ({@code Number},
     *                 {@code Boolean}, {@code String}, {@code byte[]})
     * @return the update to apply; empty if the device is unknown or the
     *         value was rejected
     */
    Optional<CapabilityUpdate> observeProtocolEvent(DeviceId deviceId, ProtocolPath path, int key, Object rawValue);

    /**
     * Decodes a private-channel payload and observes every record in it.
     */
    List<CapabilityUpdate> onDataPointFrame(DeviceId deviceId, Object payload);

    Optional<AffinitySnapshot> getProtocolAffinity(DeviceId deviceId);

    /**
     * Overrides the observed protocol affinity of an attached device. The
     * override is persisted and restored on the next attach. Unknown devices
     * are ignored.
     *
     * @throws IllegalArgumentException if {@code affinity} is {@link ProtocolAffinity#UNDECIDED}
     */
    void forceProtocolAffinity(DeviceId deviceId, ProtocolAffinity affinity);

    /**
     * Discards the protocol decision of an attached device, including a forced
     * one, and opens a new observation window. Unknown devices are ignored.
     */
    void resetProtocolAffinity(DeviceId deviceId);

    /**
     * Forgets history and any learned divisor for one capability.
     */
    void resetLearning(DeviceId deviceId, CapabilityId capability);

    /**
     * Current persistable state of an attached device.
     */
    Optional<PersistedDeviceState> persistedState(DeviceId deviceId);

    /**
     * Detaches every device.
     */
    @Override
    void close();
}
