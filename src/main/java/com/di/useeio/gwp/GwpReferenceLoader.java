package com.di.useeio.gwp;

import com.di.useeio.aspect.ErrorCategory;
import com.di.useeio.aspect.LogStoreOperation;
import com.di.useeio.config.StoreProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import java.util.Set;

/**
 * Writes the IPCC GWP catalog ({@code useeio.store.reference.catalog}) to {@code ipcc_ar_gwp}.
 *
 * <p>A refresh first deletes rows left under legacy names (suffixed, or published names that
 * normalization rewrites) and then upserts every catalog row, in one transaction. Running it
 * again leaves the table unchanged.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class GwpReferenceLoader {

    private final GwpReferenceRepository repository;
    private final TransactionTemplate transactionTemplate;
    private final ResourceLoader resourceLoader;
    private final StoreProperties properties;

    /** Outcome of {@link #refresh()}; {@code skipped} when the table does not exist. */
    public record RefreshResult(int legacyRowsDeleted, int rowsUpserted, boolean skipped) {
        static RefreshResult skippedResult() {
            return new RefreshResult(0, 0, true);
        }
    }

    @LogStoreOperation(eventType = "GWP_REFERENCE_REFRESH")
    public RefreshResult refresh() {
        return refresh(loadCatalog());
    }

    public RefreshResult refresh(IpccGwpCatalog catalog) {
        List<GwpReference> rows = catalog.toReferences();
        Set<String> renamed = catalog.renamedRawNames();
        try {
            RefreshResult result = transactionTemplate.execute(status -> {
                int deleted = 0;
                for (String suffix : GasNames.LEGACY_SUFFIXES) {
                    deleted += repository.deleteByGasNameSuffix(suffix);
                }
                for (String raw : renamed) {
                    deleted += repository.deleteByGasName(raw);
                }
                int upserted = repository.upsertAll(rows);
                return new RefreshResult(deleted, upserted, false);
            });
            log.info("[GWP] Reference refreshed: {} row(s) upserted, {} legacy row(s) removed",
                    result.rowsUpserted(), result.legacyRowsDeleted());
            return result;
        } catch (DataAccessException e) {
            if (ErrorCategory.isUndefinedTable(e)) {
                log.warn("[GWP] Skipped ipcc_ar_gwp refresh: table does not exist yet (run the schema migrations first)");
                return RefreshResult.skippedResult();
            }
            throw e;
        }
    }

    /**
     * Reads the configured catalog.
     *
     * @throws IllegalStateException if the resource is missing or not valid YAML
     */
    public IpccGwpCatalog loadCatalog() {
        String location = properties.getReference().getCatalog();
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            throw new IllegalStateException("GWP reference catalog not found: " + location);
        }
        try (InputStream in = resource.getInputStream()) {
            IpccGwpCatalog catalog = IpccGwpCatalog.read(in);
            log.debug("[GWP] Catalog loaded from {}: {} gas(es)", location, catalog.getGases().size());
            return catalog;
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read GWP reference catalog from " + location, e);
        }
    }
}
