package com.questrail.sensorlink.arbitration;

import com.questrail.sensorlink.api.CapabilityId;
import com.questrail.sensorlink.api.DeviceId;
import com.questrail.sensorlink.api.MappingConfidence;
import com.questrail.sensorlink.api.ProtocolPath;
import com.questrail.sensorlink.observability.AffinityDecidedEvent;
import com.questrail.sensorlink.observability.SensorLinkObservabilitySink;
import com.questrail.sensorlink.profile.CapabilityMapping;
import com.questrail.sensorlink.profile.ResolvedMapping;
import com.questrail.sensorlink.time.Cancellable;
import com.questrail.sensorlink.time.MonotonicClock;
import com.questrail.sensorlink.time.MonotonicScheduler;
import com.questrail.sensorlink.time.WallClock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * ProtocolArbitrator
 * =============================================================================
 * Decides, once per device session, whether a device is best served over
 * the cluster path, the DataPoint path, or both.
 *
 * <h2>Lifecycle</h2>
 * <ul>
 *   <li>{@link #start()} opens the observation window and schedules its end
 *       on the {@link MonotonicScheduler}.</li>
 *   <li>While {@link ArbitrationPhase#OBSERVING}, every
 *       {@link #recordHit(ProtocolPath, int, ResolvedMapping)} counts toward
 *       its path and grows the discovered-capability set.</li>
 *   <li>When the window elapses the affinity is decided exactly once using
 *       {@link ArbitrationPolicy#decide(long, long)} and the phase becomes
 *       {@link ArbitrationPhase#DECIDED} for good.</li>
 *   <li>{@link #force(ProtocolAffinity)} replaces observation with a manual
 *       decision; {@link #reset()} discards any decision and opens a fresh
 *       window.</li>
 *   <li>{@link #close()} cancels a pending window.</li>
 * </ul>
 *
 * <h2>Time</h2>
 * The window is measured on the {@link MonotonicClock}. Last-hit timestamps
 * use the {@link WallClock} and are observational only.
 *
 * <h2>Threading</h2>
 * Not thread-safe. The window callback must be delivered on the same thread
 * as hits, which is the contract of the scheduler the host supplies.
 */
public final class ProtocolArbitrator implements AutoCloseable
{
    private static final Logger log = LoggerFactory.getLogger(ProtocolArbitrator.class);

    private final DeviceId deviceId;
    private final ArbitrationPolicy policy;
    private final MonotonicScheduler scheduler;
    private final MonotonicClock clock;
    private final WallClock wallClock;
    private final SensorLinkObservabilitySink sink;
    private final Consumer<AffinitySnapshot> onDecided;

    private ArbitrationPhase phase = ArbitrationPhase.OBSERVING;
    private ProtocolAffinity affinity = ProtocolAffinity.UNDECIDED;
    private boolean restored;
    private boolean forced;

    private long clusterHits;
    private long dataPointHits;
    private Instant lastClusterHit;
    private Instant lastDataPointHit;
    private final Map<CapabilityId, DiscoveredCapability> discovered = new LinkedHashMap<>();

    private Cancellable window;
    private boolean started;
    private boolean closed;

    /**
     * @param onDecided invoked once, on the event thread, when the affinity is decided
     */
    public ProtocolArbitrator(DeviceId deviceId,
                              ArbitrationPolicy policy,
                              MonotonicScheduler scheduler,
                              MonotonicClock clock,
                              WallClock wallClock,
                              SensorLinkObservabilitySink sink,
                              Consumer<AffinitySnapshot> onDecided)
    {
        this.deviceId = Objects.requireNonNull(deviceId, "deviceId");
        this.policy = Objects.requireNonNull(policy, "policy");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.sink = Objects.requireNonNull(sink, "sink");
        this.onDecided = Objects.requireNonNull(onDecided, "onDecided");
    }

    /**
     * Opens the observation window.
     *
     * @throws IllegalStateException if already started, restored or closed
     */
    public void start()
    {
        if (started || closed || phase != ArbitrationPhase.OBSERVING) {
            throw new IllegalStateException("arbitrator for " + deviceId + " cannot start in phase " + phase);
        }
        started = true;
        window = scheduler.scheduleAfter(policy.observationWindow(), clock, this::endObservation);
        log.debug("[{}] observing protocol traffic for {}", deviceId, policy.observationWindow());
    }

    /**
     * Skips observation and adopts a previously decided affinity.
     *
     * @throws IllegalArgumentException if {@code persisted} is {@link ProtocolAffinity#UNDECIDED}
     * @throws IllegalStateException    if the window was already started
     */
    public void restore(ProtocolAffinity persisted)
    {
        Objects.requireNonNull(persisted, "persisted");
        if (persisted == ProtocolAffinity.UNDECIDED) {
            throw new IllegalArgumentException("cannot restore an undecided affinity");
        }
        if (started || closed || phase != ArbitrationPhase.OBSERVING) {
            throw new IllegalStateException("arbitrator for " + deviceId + " already started");
        }
        started = true;
        restored = true;
        phase = ArbitrationPhase.DECIDED;
        affinity = persisted;
        log.info("[{}] restored protocol affinity {}", deviceId, persisted);
        sink.onAffinityDecided(new AffinityDecidedEvent(wallClock.now(), deviceId, affinity, 0, 0, true, false));
    }

    /**
     * Manual override. Any pending window is cancelled, the affinity is
     * decided immediately and the decision callback runs so it can be
     * persisted. Calling it again replaces the previous override.
     *
     * @throws IllegalArgumentException if {@code affinity} is {@link ProtocolAffinity#UNDECIDED}
     * @throws IllegalStateException    if closed
     */
    public void force(ProtocolAffinity affinity)
    {
        Objects.requireNonNull(affinity, "affinity");
        if (affinity == ProtocolAffinity.UNDECIDED) {
            throw new IllegalArgumentException("cannot force an undecided affinity; use reset()");
        }
        requireOpen();
        cancelWindow();
        started = true;
        restored = false;
        forced = true;
        phase = ArbitrationPhase.DECIDED;
        this.affinity = affinity;

        log.info("[{}] protocol affinity forced to {}", deviceId, affinity);
        sink.onAffinityDecided(new AffinityDecidedEvent(wallClock.now(), deviceId, affinity,
                clusterHits, dataPointHits, false, true));
        onDecided.accept(snapshot());
    }

    /**
     * Discards hit counts, discovered capabilities and any decision (observed,
     * restored or forced) and opens a new observation window.
     *
     * @throws IllegalStateException if closed
     */
    public void reset()
    {
        requireOpen();
        cancelWindow();
        clusterHits = 0;
        dataPointHits = 0;
        lastClusterHit = null;
        lastDataPointHit = null;
        discovered.clear();
        restored = false;
        forced = false;
        phase = ArbitrationPhase.OBSERVING;
        affinity = ProtocolAffinity.UNDECIDED;

        started = true;
        window = scheduler.scheduleAfter(policy.observationWindow(), clock, this::endObservation);
        log.info("[{}] arbitration reset; observing again for {}", deviceId, policy.observationWindow());
    }

    private void requireOpen()
    {
        if (closed) {
            throw new IllegalStateException("arbitrator for " + deviceId + " is closed");
        }
    }

    private void cancelWindow()
    {
        if (window != null) {
            window.cancel();
            window = null;
        }
    }

    /**
     * Counts one protocol event. Ignored once decided.
     */
    public void recordHit(ProtocolPath path, int key, ResolvedMapping mapping)
    {
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(mapping, "mapping");
        if (phase != ArbitrationPhase.OBSERVING || closed) {
            return;
        }

        final Instant now = wallClock.now();
        switch (path) {
            case CLUSTER -> {
                clusterHits++;
                lastClusterHit = now;
            }
            case DATA_POINT -> {
                dataPointHits++;
                lastDataPointHit = now;
            }
        }

        if (mapping.confidence() == MappingConfidence.NONE) {
            return;
        }
        for (CapabilityMapping m : mapping.mappings()) {
            discovered.merge(m.capability(),
                    new DiscoveredCapability(m.capability(), path, key, mapping.confidence(), 1),
                    (existing, fresh) -> existing.hit());
        }
    }

    private void endObservation()
    {
        if (phase != ArbitrationPhase.OBSERVING || closed) {
            return;
        }
        window = null;
        affinity = policy.decide(clusterHits, dataPointHits);
        phase = ArbitrationPhase.DECIDED;

        log.info("[{}] protocol affinity {} after window (cluster={}, dataPoint={}, capabilities={})",
                deviceId, affinity, clusterHits, dataPointHits, discovered.keySet());
        sink.onAffinityDecided(new AffinityDecidedEvent(wallClock.now(), deviceId, affinity,
                clusterHits, dataPointHits, false, false));
        onDecided.accept(snapshot());
    }

    public ArbitrationPhase phase() {
        return phase;
    }

    public ProtocolAffinity affinity() {
        return affinity;
    }

    public AffinitySnapshot snapshot()
    {
        return new AffinitySnapshot(deviceId, phase, affinity, clusterHits, dataPointHits,
                Optional.ofNullable(lastClusterHit), Optional.ofNullable(lastDataPointHit),
                new ArrayList<>(discovered.values()), restored, forced);
    }

    /**
     * Cancels a pending window. The affinity stays undecided if it was not
     * decided yet.
     */
    @Override
    public void close()
    {
        if (closed) {
            return;
        }
        closed = true;
        if (window != null) {
            cancelWindow();
            log.debug("[{}] observation window cancelled", deviceId);
        }
    }
}
