package com.di.useeio.metadata;

import com.di.useeio.aspect.ErrorCategory;
import com.di.useeio.aspect.LogStoreOperation;
import com.di.useeio.characterization.CharacterizationMatrixRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Lifecycle of model versions in {@code model_metadata}: register a new version as the only
 * active one, switch the active version, purge a version together with its matrix rows.
 *
 * <p>The schema does not enforce a single active row; these operations keep it that way
 * by deactivating the other versions in the same transaction.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ModelVersionService {

    private final ModelMetadataRepository metadataRepository;
    private final CharacterizationMatrixRepository matrixRepository;
    private final TransactionTemplate transactionTemplate;

    /** Rows removed by {@link #purge(String)}. */
    public record PurgeResult(int characterizationRows, int metadataRows) {
        public boolean found() {
            return metadataRows > 0;
        }
    }

    /**
     * Upserts {@code modelVersion} as active and deactivates every other version.
     *
     * @return false when {@code model_metadata} does not exist and nothing was written
     */
    @LogStoreOperation(eventType = "MODEL_VERSION_REGISTER",
            parameterNames = {"modelVersion", "economicYear", "satelliteYearMin", "satelliteYearMax"})
    public boolean register(String modelVersion, Integer economicYear, Integer satelliteYearMin, Integer satelliteYearMax) {
        ModelMetadata row = ModelMetadata.builder()
                .modelVersion(modelVersion)
                .economicYear(economicYear)
                .satelliteYearMin(satelliteYearMin)
                .satelliteYearMax(satelliteYearMax)
                .isActive(true)
                .build();
        try {
            Integer deactivated = transactionTemplate.execute(status -> {
                metadataRepository.upsert(row);
                return metadataRepository.deactivateAllExcept(modelVersion);
            });
            log.info("[MODEL] Registered {} as active ({} other version(s) deactivated)", modelVersion, deactivated);
            return true;
        } catch (DataAccessException e) {
            if (ErrorCategory.isUndefinedTable(e)) {
                log.warn("[MODEL] model_metadata does not exist; skipping registration of {}", modelVersion);
                return false;
            }
            throw e;
        }
    }

    /**
     * Makes an existing version the only active one.
     *
     * @throws IllegalArgumentException if the version is unknown
     */
    @LogStoreOperation(eventType = "MODEL_VERSION_ACTIVATE", parameterNames = {"modelVersion"})
    public void activate(String modelVersion) {
        transactionTemplate.executeWithoutResult(status -> {
            if (metadataRepository.setActive(modelVersion, true) == 0) {
                throw new IllegalArgumentException("Unknown model version: " + modelVersion);
            }
            int deactivated = metadataRepository.deactivateAllExcept(modelVersion);
            log.info("[MODEL] Activated {} ({} other version(s) deactivated)", modelVersion, deactivated);
        });
    }

    /** Deletes the version's characterization rows and its metadata row. */
    @LogStoreOperation(eventType = "MODEL_VERSION_PURGE", parameterNames = {"modelVersion"})
    public PurgeResult purge(String modelVersion) {
        PurgeResult result = transactionTemplate.execute(status -> new PurgeResult(
                matrixRepository.deleteByModelVersion(modelVersion),
                metadataRepository.deleteByVersion(modelVersion)));
        if (result != null && !result.found()) {
            log.warn("[MODEL] Purge of {}: no metadata row ({} matrix row(s) removed)",
                    modelVersion, result.characterizationRows());
        }
        return result;
    }
}
