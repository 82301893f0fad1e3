package com.di.useeio.schema;

import java.util.List;

/**
 * Physical names of the objects the migrations install.
 */
public final class StoreTables {

    public static final String MODEL_METADATA = "model_metadata";
    public static final String IPCC_AR_GWP = "ipcc_ar_gwp";
    public static final String CHARACTERIZATION_MATRIX = "c";

    public static final String UPDATED_AT_TRIGGER = "model_metadata_updated_at";
    public static final String UPDATED_AT_FUNCTION = "set_updated_at";

    public static final List<String> ALL = List.of(MODEL_METADATA, IPCC_AR_GWP, CHARACTERIZATION_MATRIX);

    private StoreTables() {}
}
