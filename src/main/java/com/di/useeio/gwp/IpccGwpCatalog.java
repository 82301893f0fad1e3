package com.di.useeio.gwp;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.IOException;
import java.io.InputStream;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * The IPCC GWP reference catalog as published (raw gas names), read from YAML.
 *
 * <pre>
 * gases:
 *   - name: "Methane – non-fossil"
 *     category: "Major GHG"
 *     gwp: { AR4: 25.0, AR5: 28.0, AR6: 27.0 }
 *   - name: "HFO-1132a"
 *     gwp: { AR5: null }
 *     display: { AR5: "&lt;1" }
 * </pre>
 */
public class IpccGwpCatalog {

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory())
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
            .configure(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS, true);

    private final List<GasEntry> gases;

    public IpccGwpCatalog(List<GasEntry> gases) {
        this.gases = gases != null ? List.copyOf(gases) : List.of();
    }

    public static IpccGwpCatalog read(InputStream in) throws IOException {
        CatalogYaml root = YAML_MAPPER.readValue(in, CatalogYaml.class);
        return new IpccGwpCatalog(root != null ? root.getGases() : null);
    }

    public List<GasEntry> getGases() {
        return gases;
    }

    /**
     * One row per (normalized gas name, AR version) with a value or a display text.
     * When normalization maps two entries to the same key the later entry wins.
     */
    public List<GwpReference> toReferences() {
        Map<String, GwpReference> byKey = new LinkedHashMap<>();
        for (GasEntry gas : gases) {
            if (gas.getName() == null || gas.getName().isBlank()) {
                continue;
            }
            String name = GasNames.normalize(gas.getName());
            Map<String, BigDecimal> values = gas.getGwp() != null ? gas.getGwp() : Collections.emptyMap();
            Map<String, String> displays = gas.getDisplay() != null ? gas.getDisplay() : Collections.emptyMap();
            Set<String> arVersions = new TreeSet<>(values.keySet());
            arVersions.addAll(displays.keySet());
            for (String ar : arVersions) {
                BigDecimal value = values.get(ar);
                String display = displays.get(ar);
                if (value == null && display == null) {
                    continue;
                }
                byKey.put(name + '\u0000' + ar, GwpReference.builder()
                        .gasName(name)
                        .arVersion(ar)
                        .gwpValue(value)
                        .gwpDisplay(display)
                        .category(gas.getCategory())
                        .build());
            }
        }
        return new ArrayList<>(byKey.values());
    }

    /** Published names that {@link GasNames#normalize} changes; rows stored under them are stale. */
    public Set<String> renamedRawNames() {
        Set<String> renamed = new LinkedHashSet<>();
        for (GasEntry gas : gases) {
            String raw = gas.getName();
            if (raw != null && !raw.isBlank() && !raw.equals(GasNames.normalize(raw))) {
                renamed.add(raw);
            }
        }
        return renamed;
    }

    @Data
    @NoArgsConstructor
    public static class CatalogYaml {
        private List<GasEntry> gases;
    }

    @Data
    @NoArgsConstructor
    public static class GasEntry {
        private String name;
        private String category;
        /** AR version -> GWP; a null value means the report gives only a bound. */
        private Map<String, BigDecimal> gwp;
        /** AR version -> text shown instead of (or alongside) the value. */
        private Map<String, String> display;
    }
}
