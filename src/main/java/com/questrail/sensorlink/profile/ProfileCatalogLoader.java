package com.questrail.sensorlink.profile;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.questrail.sensorlink.api.CapabilityId;
import com.questrail.sensorlink.api.DeviceFingerprint;
import com.questrail.sensorlink.normalize.ConversionRule;
import com.questrail.sensorlink.normalize.NormalizedValue;
import com.questrail.sensorlink.normalize.ValueRange;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalInt;
import java.util.Set;

/**
 * ProfileCatalogLoader
 * =============================================================================
 * Reads a JSON profile catalog into a {@link ProfileCatalog}.
 *
 * <h2>Catalog layout</h2>
 * <pre>
 * {
 *   "capabilityDefaults": {
 *     "measure_temperature": { "validRange": [-40, 80], "typicalRange": [-10, 50],
 *                              "candidateDivisors": [1, 10, 100] }
 *   },
 *   "clusterConventions": [
 *     { "cluster": "0x0402", "capabilities": ["measure_temperature"],
 *       "rule": { "type": "divisor", "divisor": 100 } }
 *   ],
 *   "dataPointConventions": [
 *     { "dp": 24, "capability": "measure_temperature", "rule": { "type": "divisor", "divisor": 10 } }
 *   ],
 *   "profiles": [
 *     { "vendor": "_TZE200_abc", "model": "TS0601",
 *       "inherits": { "vendor": "_TZE200_base", "model": "TS0601" },
 *       "capabilities": ["measure_temperature"],
 *       "dataPoints": [ { "dp": 1, "capability": "measure_temperature", "rule": { ... } } ],
 *       "clusters":   [ { "cluster": 1026, "capabilities": [...], "rule": { ... } } ],
 *       "options": { ... } }
 *   ]
 * }
 * </pre>
 *
 * <h2>Rules</h2>
 * <p>{@code type} is one of {@code divisor}, {@code multiplier},
 * {@code bitExtract} or {@code enumMap}; an absent rule means a plain
 * divisor-1 scaled rule. Scaled rules take any range or candidate list they
 * omit from the capability's defaults. Custom rules are Java-only and are
 * registered through the API.</p>
 *
 * <h2>Inheritance</h2>
 * <p>A profile with {@code inherits} starts from its parent's mappings,
 * capabilities and options; its own entries override by key. Parents may
 * appear anywhere in the file. A missing parent or a cycle is a catalog
 * error.</p>
 *
 * <p>Every structural problem raises {@link ProfileCatalogException} naming
 * the catalog source.</p>
 */
public final class ProfileCatalogLoader
{
    private static final Logger log = LoggerFactory.getLogger(ProfileCatalogLoader.class);

    /** Classpath location of the bundled catalog. */
    public static final String DEFAULT_RESOURCE = "sensorlink/profile-catalog.json";

    private final ObjectMapper mapper;

    public ProfileCatalogLoader() {
        this(new ObjectMapper());
    }

    public ProfileCatalogLoader(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    public ProfileCatalog loadDefault() {
        return loadResource(DEFAULT_RESOURCE);
    }

    public ProfileCatalog loadResource(String resource) {
        Objects.requireNonNull(resource, "resource");
        ClassLoader loader = Thread.currentThread().getContextClassLoader();
        if (loader == null) {
            loader = ProfileCatalogLoader.class.getClassLoader();
        }
        try (InputStream in = loader.getResourceAsStream(resource)) {
            if (in == null) {
                throw new ProfileCatalogException("Profile catalog not found on classpath: " + resource);
            }
            return load(in, "classpath:" + resource);
        }
        catch (IOException e) {
            throw new ProfileCatalogException("Failed to read profile catalog " + resource, e);
        }
    }

    public ProfileCatalog load(Path file) {
        Objects.requireNonNull(file, "file");
        try (InputStream in = Files.newInputStream(file)) {
            return load(in, file.toString());
        }
        catch (IOException e) {
            throw new ProfileCatalogException("Failed to read profile catalog " + file, e);
        }
    }

    public ProfileCatalog load(InputStream in, String source) {
        Objects.requireNonNull(in, "in");
        final JsonNode root;
        try {
            root = mapper.readTree(in);
        }
        catch (IOException e) {
            throw new ProfileCatalogException("Malformed JSON in profile catalog " + source, e);
        }
        if (root == null || !root.isObject()) {
            throw new ProfileCatalogException("Profile catalog " + source + " must be a JSON object");
        }

        ProfileCatalog catalog = new Parser(source).parse(root);
        log.info("Loaded profile catalog {}: {} profile(s)", source, catalog.profiles().size());
        return catalog;
    }

    /**
     * One-shot parse state for a single catalog document.
     */
    private static final class Parser
    {
        private final String source;
        private final Map<CapabilityId, CapabilityDefaults> defaults = new LinkedHashMap<>();

        Parser(String source) {
            this.source = source;
        }

        ProfileCatalog parse(JsonNode root)
        {
            parseDefaults(root.path("capabilityDefaults"));

            Map<Integer, List<CapabilityMapping>> clusters = new LinkedHashMap<>();
            for (JsonNode entry : array(root, "clusterConventions")) {
                clusters.put(key(entry, "cluster", 0xFFFF), clusterMappings(entry));
            }

            Map<Integer, CapabilityMapping> dataPoints = new LinkedHashMap<>();
            for (JsonNode entry : array(root, "dataPointConventions")) {
                dataPoints.put(key(entry, "dp", 0xFF), mapping(entry));
            }

            Map<DeviceFingerprint, JsonNode> rawProfiles = new LinkedHashMap<>();
            for (JsonNode entry : array(root, "profiles")) {
                DeviceFingerprint fp = fingerprint(entry, "profile");
                if (rawProfiles.put(fp, entry) != null) {
                    throw fail("duplicate profile " + fp);
                }
            }

            Map<DeviceFingerprint, CapabilityProfile> profiles = new LinkedHashMap<>();
            for (DeviceFingerprint fp : rawProfiles.keySet()) {
                resolveProfile(fp, rawProfiles, profiles, new HashSet<>());
            }

            return new ProfileCatalog(defaults, new ProtocolConventions(clusters, dataPoints), profiles);
        }

        private void parseDefaults(JsonNode node)
        {
            if (node.isMissingNode() || node.isNull()) {
                return;
            }
            if (!node.isObject()) {
                throw fail("capabilityDefaults must be an object");
            }
            Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                JsonNode d = field.getValue();
                ValueRange valid = d.has("validRange") ? range(d.get("validRange")) : ValueRange.UNBOUNDED;
                ValueRange typical = d.has("typicalRange") ? range(d.get("typicalRange")) : valid;
                if (!valid.encloses(typical)) {
                    throw fail("typicalRange of " + field.getKey() + " is not within its validRange");
                }
                defaults.put(CapabilityId.of(field.getKey()), new CapabilityDefaults(valid, typical,
                        numbers(d.get("candidateDivisors")), numbers(d.get("candidateMultipliers"))));
            }
        }

        private CapabilityProfile resolveProfile(DeviceFingerprint fp,
                                                 Map<DeviceFingerprint, JsonNode> raw,
                                                 Map<DeviceFingerprint, CapabilityProfile> resolved,
                                                 Set<DeviceFingerprint> visiting)
        {
            CapabilityProfile done = resolved.get(fp);
            if (done != null) {
                return done;
            }
            if (!visiting.add(fp)) {
                throw fail("inheritance cycle through " + fp);
            }

            JsonNode entry = raw.get(fp);
            final CapabilityProfile.Builder builder;
            if (entry.has("inherits")) {
                DeviceFingerprint parent = fingerprint(entry.get("inherits"), "inherits of " + fp);
                if (!raw.containsKey(parent)) {
                    throw fail("profile " + fp + " inherits unknown profile " + parent);
                }
                builder = resolveProfile(parent, raw, resolved, visiting).toBuilder();
            }
            else {
                builder = CapabilityProfile.builder();
            }

            for (JsonNode c : array(entry, "capabilities")) {
                builder.capability(text(c, "capability"));
            }
            for (JsonNode dp : array(entry, "dataPoints")) {
                CapabilityMapping m = mapping(dp);
                builder.dataPoint(key(dp, "dp", 0xFF), m);
                builder.capability(m.capability());
            }
            for (JsonNode cl : array(entry, "clusters")) {
                List<CapabilityMapping> mappings = clusterMappings(cl);
                builder.cluster(key(cl, "cluster", 0xFFFF), mappings);
                mappings.forEach(m -> builder.capability(m.capability()));
            }

            JsonNode options = entry.path("options");
            if (options.isObject()) {
                Iterator<Map.Entry<String, JsonNode>> it = options.fields();
                while (it.hasNext()) {
                    Map.Entry<String, JsonNode> o = it.next();
                    builder.option(o.getKey(), optionValue(o.getValue()));
                }
            }

            CapabilityProfile profile = builder.build();
            resolved.put(fp, profile);
            visiting.remove(fp);
            return profile;
        }

        private CapabilityMapping mapping(JsonNode entry)
        {
            CapabilityId capability = CapabilityId.of(text(entry.get("capability"), "capability"));
            return new CapabilityMapping(capability, rule(entry.path("rule"), capability));
        }

        private List<CapabilityMapping> clusterMappings(JsonNode entry)
        {
            List<CapabilityMapping> out = new ArrayList<>();
            for (JsonNode c : array(entry, "capabilities")) {
                CapabilityId capability = CapabilityId.of(text(c, "capability"));
                out.add(new CapabilityMapping(capability, rule(entry.path("rule"), capability)));
            }
            if (out.isEmpty()) {
                throw fail("cluster entry " + entry + " lists no capabilities");
            }
            return out;
        }

        private ConversionRule rule(JsonNode node, CapabilityId capability)
        {
            if (node.isMissingNode() || node.isNull()) {
                return scaled(ConversionRule.Kind.DIVISOR, node, capability);
            }
            String type = text(node.get("type"), "rule type");
            return switch (type) {
                case "divisor" -> scaled(ConversionRule.Kind.DIVISOR, node, capability);
                case "multiplier" -> scaled(ConversionRule.Kind.MULTIPLIER, node, capability);
                case "bitExtract" -> bitExtract(node, capability);
                case "enumMap" -> enumMap(node);
                default -> throw fail("unknown rule type '" + type + "' for " + capability);
            };
        }

        private ConversionRule bitExtract(JsonNode node, CapabilityId capability)
        {
            if (!node.has("bit")) {
                return ConversionRule.BitExtractRule.fullMask();
            }
            JsonNode bit = node.get("bit");
            if (!bit.isIntegralNumber() || bit.intValue() < 0 || bit.intValue() > 31) {
                throw fail("bit of " + capability + " must be an integer 0-31: " + bit);
            }
            return new ConversionRule.BitExtractRule(OptionalInt.of(bit.intValue()));
        }

        private ConversionRule scaled(ConversionRule.Kind kind, JsonNode node, CapabilityId capability)
        {
            CapabilityDefaults d = defaults.get(capability);
            ValueRange valid = node.has("validRange") ? range(node.get("validRange"))
                    : d != null ? d.validRange() : ValueRange.UNBOUNDED;
            ValueRange typical;
            if (node.has("typicalRange")) {
                typical = range(node.get("typicalRange"));
            }
            else if (d != null && valid.encloses(d.typicalRange())) {
                typical = d.typicalRange();
            }
            else {
                typical = valid;
            }

            try {
                return ConversionRule.ScaledRule.builder()
                        .kind(kind)
                        .divisor(node.path("divisor").asDouble(1))
                        .multiplier(node.path("multiplier").asDouble(1))
                        .offset(node.path("offset").asDouble(0))
                        .validRange(valid)
                        .typicalRange(typical)
                        .candidateDivisors(node.has("candidateDivisors") ? numbers(node.get("candidateDivisors"))
                                : d != null ? d.candidateDivisors() : List.of())
                        .candidateMultipliers(node.has("candidateMultipliers") ? numbers(node.get("candidateMultipliers"))
                                : d != null ? d.candidateMultipliers() : List.of())
                        .build();
            }
            catch (IllegalArgumentException e) {
                throw new ProfileCatalogException("Invalid rule for " + capability + " in " + source + ": " + e.getMessage(), e);
            }
        }

        private ConversionRule enumMap(JsonNode node)
        {
            JsonNode values = node.get("values");
            if (values == null || !values.isObject()) {
                throw fail("enumMap rule needs a 'values' object");
            }
            Map<Integer, NormalizedValue> table = new LinkedHashMap<>();
            Iterator<Map.Entry<String, JsonNode>> it = values.fields();
            while (it.hasNext()) {
                Map.Entry<String, JsonNode> e = it.next();
                final int ordinal;
                try {
                    ordinal = Integer.parseInt(e.getKey().trim());
                }
                catch (NumberFormatException nfe) {
                    throw fail("enumMap ordinal '" + e.getKey() + "' is not an integer");
                }
                table.put(ordinal, normalizedValue(e.getValue()));
            }
            return new ConversionRule.EnumMapRule(table);
        }

        private NormalizedValue normalizedValue(JsonNode v)
        {
            if (v.isBoolean()) {
                return NormalizedValue.flag(v.booleanValue());
            }
            if (v.isNumber()) {
                return NormalizedValue.numeric(v.doubleValue());
            }
            if (v.isTextual()) {
                return NormalizedValue.label(v.textValue());
            }
            throw fail("enumMap value must be boolean, number or string: " + v);
        }

        private Object optionValue(JsonNode v)
        {
            if (v.isBoolean()) return v.booleanValue();
            if (v.isIntegralNumber()) return v.longValue();
            if (v.isNumber()) return v.doubleValue();
            if (v.isTextual()) return v.textValue();
            return v.toString();
        }

        private DeviceFingerprint fingerprint(JsonNode node, String what)
        {
            if (node == null || !node.isObject()) {
                throw fail(what + " must be an object with vendor and model");
            }
            return DeviceFingerprint.of(text(node.get("vendor"), what + " vendor"),
                    text(node.get("model"), what + " model"));
        }

        private int key(JsonNode entry, String field, int max)
        {
            JsonNode node = entry.get(field);
            final int value;
            if (node != null && node.isIntegralNumber()) {
                value = node.intValue();
            }
            else if (node != null && node.isTextual()) {
                String s = node.textValue().trim();
                try {
                    value = s.startsWith("0x") || s.startsWith("0X")
                            ? Integer.parseInt(s.substring(2), 16)
                            : Integer.parseInt(s);
                }
                catch (NumberFormatException e) {
                    throw fail("'" + field + "' is not a number: " + s);
                }
            }
            else {
                throw fail("entry " + entry + " is missing '" + field + "'");
            }
            if (value < 0 || value > max) {
                throw fail("'" + field + "' out of range 0.." + max + ": " + value);
            }
            return value;
        }

        private ValueRange range(JsonNode node)
        {
            if (node == null || !node.isArray() || node.size() != 2
                    || !node.get(0).isNumber() || !node.get(1).isNumber()) {
                throw fail("range must be [min, max]: " + node);
            }
            try {
                return ValueRange.of(node.get(0).doubleValue(), node.get(1).doubleValue());
            }
            catch (IllegalArgumentException e) {
                throw new ProfileCatalogException("Invalid range " + node + " in " + source, e);
            }
        }

        private List<Double> numbers(JsonNode node)
        {
            if (node == null || node.isNull()) {
                return List.of();
            }
            if (!node.isArray()) {
                throw fail("expected an array of numbers: " + node);
            }
            List<Double> out = new ArrayList<>();
            for (JsonNode n : node) {
                if (!n.isNumber()) {
                    throw fail("expected a number: " + n);
                }
                out.add(n.doubleValue());
            }
            return out;
        }

        private Iterable<JsonNode> array(JsonNode parent, String field)
        {
            JsonNode node = parent.path(field);
            if (node.isMissingNode() || node.isNull()) {
                return List.of();
            }
            if (!node.isArray()) {
                throw fail("'" + field + "' must be an array");
            }
            return node;
        }

        private String text(JsonNode node, String what)
        {
            if (node == null || !node.isTextual() || node.textValue().isBlank()) {
                throw fail(what + " must be a non-empty string");
            }
            return node.textValue();
        }

        private ProfileCatalogException fail(String message) {
            return new ProfileCatalogException("Profile catalog " + source + ": " + message);
        }
    }
}
