package com.questrail.sensorlink.runtime;

import com.questrail.sensorlink.api.CapabilityId;
import com.questrail.sensorlink.api.DeviceFingerprint;
import com.questrail.sensorlink.api.DeviceId;
import com.questrail.sensorlink.api.MappingConfidence;
import com.questrail.sensorlink.api.ProtocolPath;
import com.questrail.sensorlink.api.SensorLinkEngine;
import com.questrail.sensorlink.arbitration.AffinitySnapshot;
import com.questrail.sensorlink.arbitration.ProtocolAffinity;
import com.questrail.sensorlink.arbitration.ProtocolArbitrator;
import com.questrail.sensorlink.config.SensorLinkConfig;
import com.questrail.sensorlink.learn.AdaptiveLearner;
import com.questrail.sensorlink.normalize.ConversionRule;
import com.questrail.sensorlink.normalize.CorrectionKind;
import com.questrail.sensorlink.normalize.NormalizationResult;
import com.questrail.sensorlink.normalize.NormalizedValue;
import com.questrail.sensorlink.normalize.ValueNormalizer;
import com.questrail.sensorlink.observability.DataQualityEvent;
import com.questrail.sensorlink.observability.FrameDefectEvent;
import com.questrail.sensorlink.observability.NullObservabilitySink;
import com.questrail.sensorlink.observability.SensorLinkObservabilitySink;
import com.questrail.sensorlink.observability.UnmappedDataPointEvent;
import com.questrail.sensorlink.profile.CapabilityMapping;
import com.questrail.sensorlink.profile.CapabilityProfile;
import com.questrail.sensorlink.profile.DefaultProfileRegistry;
import com.questrail.sensorlink.profile.ProfileCatalogLoader;
import com.questrail.sensorlink.profile.ProfileRegistry;
import com.questrail.sensorlink.profile.ResolvedMapping;
import com.questrail.sensorlink.protocol.datapoint.codec.DataPointFrameDecoder;
import com.questrail.sensorlink.protocol.datapoint.codec.DataPointFrameEncoder;
import com.questrail.sensorlink.protocol.datapoint.codec.impl.DefaultDataPointFrameDecoder;
import com.questrail.sensorlink.protocol.datapoint.codec.impl.DefaultDataPointFrameEncoder;
import com.questrail.sensorlink.protocol.datapoint.codec.impl.PayloadUnwrapper;
import com.questrail.sensorlink.protocol.datapoint.model.DataPointRecord;
import com.questrail.sensorlink.protocol.datapoint.model.DataPointType;
import com.questrail.sensorlink.protocol.datapoint.value.DataPointDecodeException;
import com.questrail.sensorlink.protocol.datapoint.value.DataPointValueDecoder;
import com.questrail.sensorlink.protocol.datapoint.value.DecodedValue;
import com.questrail.sensorlink.time.MonotonicClock;
import com.questrail.sensorlink.time.MonotonicScheduler;
import com.questrail.sensorlink.time.SystemMonotonicClock;
import com.questrail.sensorlink.time.SystemWallClock;
import com.questrail.sensorlink.time.WallClock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.stream.Stream;

/**
 * DefaultSensorLinkEngine
 * =============================================================================
 * Composition root and implementation of {@link SensorLinkEngine}.
 *
 * <h2>Inbound pipeline</h2>
 * <pre>
 *   payload ─► DataPointFrameDecoder ─► DataPointValueDecoder ─┐
 *                                                              ├─► observe
 *   cluster attribute ─► DecodedValue.fromHost ────────────────┘
 *
 *   observe:
 *     ResolvedMapping (profile, then conventions)
 *       ─► ProtocolArbitrator.recordHit
 *       ─► ValueNormalizer (with learned divisor)
 *       ─► AdaptiveLearner.observe
 *       ─► CapabilityUpdate
 * </pre>
 *
 * <p>Persisted state is written through the {@link DeviceStateStore} when an
 * affinity is decided, a divisor is learned and when learning is reset.</p>
 */
public final class DefaultSensorLinkEngine implements SensorLinkEngine
{
    private static final Logger log = LoggerFactory.getLogger(DefaultSensorLinkEngine.class);

    private final SensorLinkConfig config;
    private final ProfileRegistry registry;
    private final MonotonicScheduler scheduler;
    private final MonotonicClock clock;
    private final WallClock wallClock;
    private final SensorLinkObservabilitySink sink;
    private final DeviceStateStore stateStore;

    private final DataPointFrameDecoder frameDecoder;
    private final DataPointFrameEncoder frameEncoder;
    private final DataPointValueDecoder valueDecoder = new DataPointValueDecoder();
    private final ValueNormalizer normalizer = new ValueNormalizer();
    private final AdaptiveLearner learner;

    private final Map<DeviceId, DeviceSession> sessions = new HashMap<>();

    private DefaultSensorLinkEngine(Builder b)
    {
        this.config = b.config;
        this.registry = b.registry;
        this.scheduler = b.scheduler;
        this.clock = b.clock;
        this.wallClock = b.wallClock;
        this.sink = b.observabilitySink;
        this.stateStore = b.stateStore;
        this.frameDecoder = new DefaultDataPointFrameDecoder(new PayloadUnwrapper(), sink, wallClock);
        this.frameEncoder = new DefaultDataPointFrameEncoder();
        this.learner = new AdaptiveLearner(config.learningPolicy(), sink, wallClock);
    }

    // -------------------------------------------------------------------------
    // Stateless operations
    // -------------------------------------------------------------------------

    @Override
    public List<DataPointRecord> decodeFrame(Object input)
    {
        return frameDecoder.decodeAll(input);
    }

    @Override
    public byte[] encodeDataPoint(int id, DataPointType type, Object value)
    {
        return frameEncoder.encode(id, type, value);
    }

    @Override
    public Optional<CapabilityProfile> resolveProfile(DeviceFingerprint fingerprint)
    {
        return registry.resolve(fingerprint);
    }

    @Override
    public void registerProfile(DeviceFingerprint fingerprint, CapabilityProfile profile)
    {
        registry.register(fingerprint, profile);
    }

    @Override
    public NormalizationResult normalize(DecodedValue rawValue, ConversionRule rule)
    {
        return normalizer.normalize(rawValue, rule);
    }

    // -------------------------------------------------------------------------
    // Device lifecycle
    // -------------------------------------------------------------------------

    @Override
    public void attachDevice(DeviceId deviceId, DeviceFingerprint fingerprint)
    {
        Objects.requireNonNull(deviceId, "deviceId");
        Objects.requireNonNull(fingerprint, "fingerprint");

        if (sessions.containsKey(deviceId)) {
            log.info("[{}] re-attached; replacing existing session", deviceId);
            detachDevice(deviceId);
        }

        final Optional<CapabilityProfile> profile = registry.resolve(fingerprint);
        if (profile.isEmpty()) {
            log.info("[{}] no profile for {}; falling back to protocol conventions", deviceId, fingerprint);
        }

        final ProtocolArbitrator arbitrator = new ProtocolArbitrator(deviceId, config.arbitrationPolicy(),
                scheduler, clock, wallClock, sink, snapshot -> saveState(deviceId));
        final DeviceSession session = new DeviceSession(deviceId, fingerprint, profile, arbitrator);
        sessions.put(deviceId, session);

        final Optional<PersistedDeviceState> persisted = stateStore.load(deviceId);
        persisted.ifPresent(state ->
                state.learnedDivisors().forEach((capability, divisor) -> learner.restore(deviceId, capability, divisor)));

        if (persisted.isPresent() && persisted.get().affinity() != ProtocolAffinity.UNDECIDED) {
            arbitrator.restore(persisted.get().affinity());
        }
        else {
            arbitrator.start();
        }
        log.debug("[{}] attached ({}, profile={})", deviceId, fingerprint, profile.isPresent());
    }

    @Override
    public void detachDevice(DeviceId deviceId)
    {
        Objects.requireNonNull(deviceId, "deviceId");
        final DeviceSession session = sessions.remove(deviceId);
        if (session == null) {
            return;
        }
        session.close();
        learner.forget(deviceId);
        log.debug("[{}] detached", deviceId);
    }

    @Override
    public void close()
    {
        for (DeviceId deviceId : new ArrayList<>(sessions.keySet())) {
            detachDevice(deviceId);
        }
    }

    // -------------------------------------------------------------------------
    // Inbound traffic
    // -------------------------------------------------------------------------

    @Override
    public Optional<CapabilityUpdate> observeProtocolEvent(DeviceId deviceId, ProtocolPath path, int key, Object rawValue)
    {
        Objects.requireNonNull(deviceId, "deviceId");
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(rawValue, "rawValue");

        final DeviceSession session = sessions.get(deviceId);
        if (session == null) {
            log.warn("[{}] ignoring {} event for key {}: device not attached", deviceId, path, key);
            return Optional.empty();
        }

        final DecodedValue value;
        try {
            value = DecodedValue.fromHost(rawValue);
        }
        catch (IllegalArgumentException e) {
            log.warn("[{}] ignoring {} key {}: {}", deviceId, path, key, e.getMessage());
            return Optional.empty();
        }
        return observe(session, path, key, value);
    }

    @Override
    public List<CapabilityUpdate> onDataPointFrame(DeviceId deviceId, Object payload)
    {
        Objects.requireNonNull(deviceId, "deviceId");

        final DeviceSession session = sessions.get(deviceId);
        if (session == null) {
            log.warn("[{}] ignoring DataPoint frame: device not attached", deviceId);
            return List.of();
        }

        final List<CapabilityUpdate> updates = new ArrayList<>();
        try (Stream<DataPointRecord> records = frameDecoder.decode(payload)) {
            records.forEach(record -> {
                final DecodedValue value;
                try {
                    value = valueDecoder.decode(record);
                }
                catch (DataPointDecodeException e) {
                    log.warn("[{}] dropping DataPoint {}: {}", deviceId, e.dataPointId(), e.getMessage());
                    sink.onFrameDefect(new FrameDefectEvent(wallClock.now(), FrameDefectEvent.Kind.TYPE_MISMATCH,
                            e.dataPointId(), e.getMessage()));
                    return;
                }
                observe(session, ProtocolPath.DATA_POINT, record.id(), value).ifPresent(updates::add);
            });
        }
        return updates;
    }

    private Optional<CapabilityUpdate> observe(DeviceSession session, ProtocolPath path, int key, DecodedValue value)
    {
        final DeviceId deviceId = session.deviceId();
        final ResolvedMapping resolved = ResolvedMapping.resolve(session.profile(), registry.conventions(), path, key);
        session.arbitrator().recordHit(path, key, resolved);

        if (resolved.confidence() == MappingConfidence.NONE) {
            log.info("[{}] unmapped {} key {} = {}", deviceId, path, key, value);
            sink.onUnmappedDataPoint(new UnmappedDataPointEvent(wallClock.now(), deviceId, path, key, value));
            if (!config.surfaceUnmappedValues()) {
                return Optional.empty();
            }
            return Optional.of(new CapabilityUpdate(deviceId, Optional.empty(), path, key,
                    NormalizedValue.passThrough(value), MappingConfidence.NONE, CorrectionKind.NONE, wallClock.now()));
        }

        if (resolved.confidence() == MappingConfidence.CONVENTION
                && session.profile().isEmpty()
                && session.markConventionFallbackLogged()) {
            log.info("[{}] using convention mappings for unregistered fingerprint {}", deviceId, session.fingerprint());
        }

        final CapabilityMapping mapping = resolved.primary().orElseThrow();
        final CapabilityId capability = mapping.capability();

        final OptionalDouble learnedDivisor = learner.learnedDivisor(deviceId, capability);
        final NormalizationResult result = normalizer.normalize(value, mapping.rule(), learnedDivisor);

        if (learner.observe(deviceId, capability, value, result, mapping.rule()).isPresent()) {
            saveState(deviceId);
        }

        switch (result.correctionKind()) {
            case REJECTED -> {
                final String detail = result.detail().orElse("rejected");
                log.debug("[{}] {} value {} quarantined: {}", deviceId, capability, value, detail);
                sink.onDataQuality(new DataQualityEvent(wallClock.now(), deviceId, capability, value,
                        CorrectionKind.REJECTED, detail));
                return Optional.empty();
            }
            case CLAMPED_MIN -> {
                final String detail = result.detail().orElse("clamped");
                log.debug("[{}] {} value {} clamped: {}", deviceId, capability, value, detail);
                sink.onDataQuality(new DataQualityEvent(wallClock.now(), deviceId, capability, value,
                        CorrectionKind.CLAMPED_MIN, detail));
            }
            case DIVISOR, MULTIPLIER -> log.debug("[{}] {} corrected: {}", deviceId, capability, result);
            case NONE -> { }
        }

        return Optional.of(new CapabilityUpdate(deviceId, Optional.of(capability), path, key,
                result.correctedValue().orElseThrow(), resolved.confidence(), result.correctionKind(), wallClock.now()));
    }

    // -------------------------------------------------------------------------
    // State
    // -------------------------------------------------------------------------

    @Override
    public Optional<AffinitySnapshot> getProtocolAffinity(DeviceId deviceId)
    {
        Objects.requireNonNull(deviceId, "deviceId");
        return Optional.ofNullable(sessions.get(deviceId)).map(s -> s.arbitrator().snapshot());
    }

    @Override
    public void forceProtocolAffinity(DeviceId deviceId, ProtocolAffinity affinity)
    {
        Objects.requireNonNull(deviceId, "deviceId");
        Objects.requireNonNull(affinity, "affinity");
        final DeviceSession session = sessions.get(deviceId);
        if (session == null) {
            log.warn("[{}] cannot force protocol affinity {}: device not attached", deviceId, affinity);
            return;
        }
        // the arbitrator's decision callback persists the override
        session.arbitrator().force(affinity);
    }

    @Override
    public void resetProtocolAffinity(DeviceId deviceId)
    {
        Objects.requireNonNull(deviceId, "deviceId");
        final DeviceSession session = sessions.get(deviceId);
        if (session == null) {
            log.warn("[{}] cannot reset protocol affinity: device not attached", deviceId);
            return;
        }
        session.arbitrator().reset();
        saveState(deviceId);
    }

    @Override
    public void resetLearning(DeviceId deviceId, CapabilityId capability)
    {
        Objects.requireNonNull(deviceId, "deviceId");
        Objects.requireNonNull(capability, "capability");
        learner.reset(deviceId, capability);
        if (sessions.containsKey(deviceId)) {
            saveState(deviceId);
        }
    }

    @Override
    public Optional<PersistedDeviceState> persistedState(DeviceId deviceId)
    {
        Objects.requireNonNull(deviceId, "deviceId");
        final DeviceSession session = sessions.get(deviceId);
        if (session == null) {
            return Optional.empty();
        }
        return Optional.of(new PersistedDeviceState(deviceId, learner.learnedDivisors(deviceId),
                session.arbitrator().affinity()));
    }

    private void saveState(DeviceId deviceId)
    {
        persistedState(deviceId).ifPresent(state -> {
            try {
                stateStore.save(state);
            }
            catch (RuntimeException e) {
                log.warn("[{}] failed to persist device state", deviceId, e);
            }
        });
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private SensorLinkConfig config = SensorLinkConfig.defaults();
        private ProfileRegistry registry;
        private MonotonicScheduler scheduler;
        private MonotonicClock clock = SystemMonotonicClock.INSTANCE;
        private WallClock wallClock = SystemWallClock.INSTANCE;
        private SensorLinkObservabilitySink observabilitySink = NullObservabilitySink.INSTANCE;
        private DeviceStateStore stateStore = DeviceStateStore.none();

        public Builder withConfig(SensorLinkConfig config) {
            this.config = config;
            return this;
        }

        /**
         * Supplies the registry directly. Without one, the catalog named by
         * {@link SensorLinkConfig#catalogResource()} is loaded at build time.
         */
        public Builder withRegistry(ProfileRegistry registry) {
            this.registry = registry;
            return this;
        }

        /**
         * Required. Window callbacks must run on the event-delivery thread.
         */
        public Builder withScheduler(MonotonicScheduler scheduler) {
            this.scheduler = scheduler;
            return this;
        }

        public Builder withMonotonicClock(MonotonicClock clock) {
            this.clock = clock;
            return this;
        }

        public Builder withWallClock(WallClock wallClock) {
            this.wallClock = wallClock;
            return this;
        }

        public Builder withObservabilitySink(SensorLinkObservabilitySink sink) {
            this.observabilitySink = sink;
            return this;
        }

        public Builder withStateStore(DeviceStateStore stateStore) {
            this.stateStore = stateStore;
            return this;
        }

        /**
         * @throws com.questrail.sensorlink.profile.ProfileCatalogException if the
         *         configured catalog is missing or invalid
         */
        public DefaultSensorLinkEngine build() {
            Objects.requireNonNull(config, "config");
            Objects.requireNonNull(scheduler, "scheduler");
            Objects.requireNonNull(clock, "clock");
            Objects.requireNonNull(wallClock, "wallClock");
            Objects.requireNonNull(observabilitySink, "observabilitySink");
            Objects.requireNonNull(stateStore, "stateStore");

            if (registry == null) {
                registry = DefaultProfileRegistry.fromCatalog(
                        new ProfileCatalogLoader().loadResource(config.catalogResource()));
            }
            return new DefaultSensorLinkEngine(this);
        }
    }
}
