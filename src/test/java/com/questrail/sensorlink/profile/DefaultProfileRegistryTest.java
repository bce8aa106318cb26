package com.questrail.sensorlink.profile;

import com.questrail.sensorlink.api.DeviceFingerprint;
import com.questrail.sensorlink.api.MappingConfidence;
import com.questrail.sensorlink.api.ProtocolPath;
import com.questrail.sensorlink.normalize.ConversionRule;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

final class DefaultProfileRegistryTest
{
    private static final ConversionRule TENTHS = ConversionRule.ScaledRule.builder().divisor(10).build();
    private static final ConversionRule PLAIN = ConversionRule.ScaledRule.builder().build();

    private static final ProtocolConventions CONVENTIONS = new ProtocolConventions(
            Map.of(0x0402, List.of(CapabilityMapping.of("measure_temperature", PLAIN))),
            Map.of(24, CapabilityMapping.of("measure_temperature", PLAIN),
                   2, CapabilityMapping.of("dim", PLAIN)));

    private static CapabilityProfile profile(String capability) {
        return CapabilityProfile.builder()
                .capability(capability)
                .dataPoint(2, CapabilityMapping.of(capability, TENTHS))
                .build();
    }

    @Test
    void lookupIgnoresCase()
    {
        DefaultProfileRegistry registry = new DefaultProfileRegistry(CONVENTIONS);
        CapabilityProfile p = profile("measure_humidity");
        registry.register(DeviceFingerprint.of("_TZE200_BJAWZODF", "TS0601"), p);

        assertEquals(Optional.of(p), registry.resolve(DeviceFingerprint.of("_tze200_bjawzodf", "ts0601")));
        assertTrue(registry.resolve(DeviceFingerprint.of("_TZE200_bjawzod", "TS0601")).isEmpty());
    }

    @Test
    void registerReplacesExistingProfile()
    {
        DefaultProfileRegistry registry = new DefaultProfileRegistry(CONVENTIONS);
        DeviceFingerprint fp = DeviceFingerprint.of("v", "m");
        registry.register(fp, profile("measure_humidity"));
        registry.register(fp, profile("measure_power"));

        assertEquals(1, registry.size());
        assertEquals(profile("measure_power"), registry.resolve(fp).orElseThrow());
    }

    @Test
    void profileMappingTakesPrecedenceOverConvention()
    {
        Optional<CapabilityProfile> p = Optional.of(profile("measure_humidity"));

        ResolvedMapping registered = ResolvedMapping.resolve(p, CONVENTIONS, ProtocolPath.DATA_POINT, 2);
        assertEquals(MappingConfidence.REGISTRY, registered.confidence());
        assertEquals("measure_humidity", registered.primary().orElseThrow().capability().value());

        ResolvedMapping conventional = ResolvedMapping.resolve(p, CONVENTIONS, ProtocolPath.DATA_POINT, 24);
        assertEquals(MappingConfidence.CONVENTION, conventional.confidence());

        ResolvedMapping noProfile = ResolvedMapping.resolve(Optional.empty(), CONVENTIONS, ProtocolPath.DATA_POINT, 2);
        assertEquals("dim", noProfile.primary().orElseThrow().capability().value());

        ResolvedMapping cluster = ResolvedMapping.resolve(p, CONVENTIONS, ProtocolPath.CLUSTER, 0x0402);
        assertEquals(MappingConfidence.CONVENTION, cluster.confidence());

        ResolvedMapping unmapped = ResolvedMapping.resolve(p, CONVENTIONS, ProtocolPath.DATA_POINT, 99);
        assertEquals(MappingConfidence.NONE, unmapped.confidence());
        assertTrue(unmapped.primary().isEmpty());
    }

    @Test
    void registryFromCatalogExposesConventions()
    {
        DefaultProfileRegistry registry = DefaultProfileRegistry.fromCatalog(new ProfileCatalogLoader().loadDefault());

        assertEquals(4, registry.size());
        assertFalse(registry.conventions().forCluster(0x0405).isEmpty());
    }
}
