package com.di.useeio.metadata;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Domain model for the {@code model_metadata} table: one row per USEEIO model version.
 *
 * <p>{@code isActive} left null on insert takes the column default (false).
 * {@code createdAt} and {@code updatedAt} are always assigned by the database;
 * {@code updatedAt} is rewritten by the {@code model_metadata_updated_at} trigger on every update.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ModelMetadata {

    private String modelVersion;

    // ---- year coverage -----------------------------------------------------
    private Integer economicYear;
    private Integer satelliteYearMin;
    private Integer satelliteYearMax;

    // ---- lifecycle ---------------------------------------------------------
    private Boolean isActive;
    private Instant createdAt;
    private Instant updatedAt;

    public boolean active() {
        return Boolean.TRUE.equals(isActive);
    }
}
