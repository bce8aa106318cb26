package com.questrail.sensorlink.profile;

import com.questrail.sensorlink.api.DeviceFingerprint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory {@link ProfileRegistry}, normally seeded from a
 * {@link ProfileCatalog} at startup.
 *
 * <p>Registration may happen from a host thread other than the one
 * delivering events, so the table is concurrent.</p>
 */
public final class DefaultProfileRegistry implements ProfileRegistry
{
    private static final Logger log = LoggerFactory.getLogger(DefaultProfileRegistry.class);

    private final Map<DeviceFingerprint, CapabilityProfile> profiles = new ConcurrentHashMap<>();
    private final ProtocolConventions conventions;

    public DefaultProfileRegistry(ProtocolConventions conventions) {
        this.conventions = Objects.requireNonNull(conventions, "conventions");
    }

    public static DefaultProfileRegistry fromCatalog(ProfileCatalog catalog) {
        Objects.requireNonNull(catalog, "catalog");
        DefaultProfileRegistry registry = new DefaultProfileRegistry(catalog.conventions());
        registry.profiles.putAll(catalog.profiles());
        log.info("Profile registry loaded: {} profile(s), {} cluster and {} DataPoint convention(s)",
                catalog.profiles().size(),
                catalog.conventions().clusters().size(),
                catalog.conventions().dataPoints().size());
        return registry;
    }

    @Override
    public Optional<CapabilityProfile> resolve(DeviceFingerprint fingerprint) {
        Objects.requireNonNull(fingerprint, "fingerprint");
        return Optional.ofNullable(profiles.get(fingerprint));
    }

    @Override
    public void register(DeviceFingerprint fingerprint, CapabilityProfile profile) {
        Objects.requireNonNull(fingerprint, "fingerprint");
        Objects.requireNonNull(profile, "profile");
        CapabilityProfile previous = profiles.put(fingerprint, profile);
        if (previous != null && !previous.equals(profile)) {
            log.info("Replaced profile for {}", fingerprint);
        } else if (previous == null) {
            log.debug("Registered profile for {}", fingerprint);
        }
    }

    @Override
    public ProtocolConventions conventions() {
        return conventions;
    }

    public int size() {
        return profiles.size();
    }
}
