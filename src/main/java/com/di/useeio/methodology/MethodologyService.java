package com.di.useeio.methodology;

import com.di.useeio.aspect.LogStoreOperation;
import com.di.useeio.gwp.ArVersion;
import com.di.useeio.metadata.ModelMetadata;
import com.di.useeio.metadata.ModelMetadataRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * What a reading application needs: the active model version, a one-paragraph description of its
 * methodology, and characterization factors resolved against the IPCC GWP reference.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class MethodologyService {

    private final ModelMetadataRepository metadataRepository;
    private final MethodologyRepository methodologyRepository;

    /**
     * The active model version. When several rows are active the most recently updated one
     * is returned and the others are reported in a warning.
     */
    public Optional<ModelMetadata> findActive() {
        List<ModelMetadata> active = metadataRepository.findActive();
        if (active.isEmpty()) {
            return Optional.empty();
        }
        if (active.size() > 1) {
            log.warn("[MODEL] {} active model versions; using {} (also active: {})",
                    active.size(), active.get(0).getModelVersion(),
                    active.subList(1, active.size()).stream()
                            .map(ModelMetadata::getModelVersion)
                            .collect(Collectors.joining(", ")));
        }
        return Optional.of(active.get(0));
    }

    public Optional<String> describeActive() {
        return findActive().map(MethodologyService::describe);
    }

    /**
     * E.g. "USEEIO model v2.1 (economic year 2018, satellite data 2015-2020)."
     * Missing years are left out of the parenthesis; with none it is dropped.
     */
    public static String describe(ModelMetadata m) {
        List<String> parts = new ArrayList<>();
        if (m.getEconomicYear() != null) {
            parts.add("economic year " + m.getEconomicYear());
        }
        String satellite = yearRange(m.getSatelliteYearMin(), m.getSatelliteYearMax());
        if (satellite != null) {
            parts.add("satellite data " + satellite);
        }
        StringBuilder sb = new StringBuilder("USEEIO model ").append(m.getModelVersion());
        if (!parts.isEmpty()) {
            sb.append(" (").append(String.join(", ", parts)).append(')');
        }
        return sb.append('.').toString();
    }

    /**
     * Factors of {@code indicatorCode} under the active version. {@code arVersion} is an
     * {@link ArVersion} code in any case ("AR5", "ar5").
     *
     * @throws IllegalStateException if no model version is active
     * @throws IllegalArgumentException if {@code arVersion} is not a known AR version
     */
    @LogStoreOperation(eventType = "RESOLVE_FACTORS", parameterNames = {"indicatorCode", "arVersion"}, includeResult = true)
    public List<ResolvedFactor> resolveFactors(String indicatorCode, String arVersion) {
        String ar = ArVersion.fromCode(arVersion).name();
        ModelMetadata active = requireActive();
        List<ResolvedFactor> factors = methodologyRepository.resolveFactors(active.getModelVersion(), indicatorCode, ar);
        long unmatched = factors.stream().filter(f -> !f.hasGwp()).count();
        if (unmatched > 0) {
            log.debug("[GWP] {} of {} flow(s) of {} have no {} reference row",
                    unmatched, factors.size(), indicatorCode, ar);
        }
        return factors;
    }

    /**
     * One flow of {@code indicatorCode} under the active version; empty when the matrix has no such cell.
     *
     * @throws IllegalStateException if no model version is active
     * @throws IllegalArgumentException if {@code arVersion} is not a known AR version
     */
    @LogStoreOperation(eventType = "RESOLVE_FACTOR", parameterNames = {"flow", "indicatorCode", "arVersion"})
    public Optional<ResolvedFactor> resolveFactor(String flow, String indicatorCode, String arVersion) {
        String ar = ArVersion.fromCode(arVersion).name();
        ModelMetadata active = requireActive();
        return methodologyRepository.resolveFactor(active.getModelVersion(), indicatorCode, flow, ar);
    }

    private ModelMetadata requireActive() {
        return findActive().orElseThrow(() -> new IllegalStateException("No active model version in model_metadata"));
    }

    private static String yearRange(Integer min, Integer max) {
        if (min == null && max == null) {
            return null;
        }
        if (min == null || max == null || min.equals(max)) {
            return String.valueOf(min != null ? min : max);
        }
        return min + "-" + max;
    }
}
