package com.di.useeio.sql;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * SQL statements loaded from sql-queries.yml (useeio.sql.*).
 * Repositories and the schema inspector hold no SQL of their own; they run these named statements.
 */
@Component
@ConfigurationProperties(prefix = "useeio.sql")
public class SqlQueriesProperties {

    private ModelMetadata modelMetadata = new ModelMetadata();
    private GwpReference gwpReference = new GwpReference();
    private Characterization characterization = new Characterization();
    private Methodology methodology = new Methodology();
    private Schema schema = new Schema();

    public ModelMetadata getModelMetadata() { return modelMetadata; }
    public void setModelMetadata(ModelMetadata modelMetadata) { this.modelMetadata = modelMetadata; }
    public GwpReference getGwpReference() { return gwpReference; }
    public void setGwpReference(GwpReference gwpReference) { this.gwpReference = gwpReference; }
    public Characterization getCharacterization() { return characterization; }
    public void setCharacterization(Characterization characterization) { this.characterization = characterization; }
    public Methodology getMethodology() { return methodology; }
    public void setMethodology(Methodology methodology) { this.methodology = methodology; }
    public Schema getSchema() { return schema; }
    public void setSchema(Schema schema) { this.schema = schema; }

    public static class ModelMetadata {
        private String insert;
        private String insertWithDefaultFlag;
        private String upsert;
        private String update;
        private String setActive;
        private String deactivateAllExcept;
        private String findByVersion;
        private String findActive;
        private String findAll;
        private String deleteByVersion;
        public String getInsert() { return insert; }
        public void setInsert(String insert) { this.insert = insert; }
        public String getInsertWithDefaultFlag() { return insertWithDefaultFlag; }
        public void setInsertWithDefaultFlag(String insertWithDefaultFlag) { this.insertWithDefaultFlag = insertWithDefaultFlag; }
        public String getUpsert() { return upsert; }
        public void setUpsert(String upsert) { this.upsert = upsert; }
        public String getUpdate() { return update; }
        public void setUpdate(String update) { this.update = update; }
        public String getSetActive() { return setActive; }
        public void setSetActive(String setActive) { this.setActive = setActive; }
        public String getDeactivateAllExcept() { return deactivateAllExcept; }
        public void setDeactivateAllExcept(String deactivateAllExcept) { this.deactivateAllExcept = deactivateAllExcept; }
        public String getFindByVersion() { return findByVersion; }
        public void setFindByVersion(String findByVersion) { this.findByVersion = findByVersion; }
        public String getFindActive() { return findActive; }
        public void setFindActive(String findActive) { this.findActive = findActive; }
        public String getFindAll() { return findAll; }
        public void setFindAll(String findAll) { this.findAll = findAll; }
        public String getDeleteByVersion() { return deleteByVersion; }
        public void setDeleteByVersion(String deleteByVersion) { this.deleteByVersion = deleteByVersion; }
    }

    public static class GwpReference {
        private String insert;
        private String upsert;
        private String findByKey;
        private String findByGasName;
        private String findByArVersion;
        private String findAll;
        private String deleteByKey;
        private String deleteByGasName;
        private String deleteByGasNameSuffix;
        public String getInsert() { return insert; }
        public void setInsert(String insert) { this.insert = insert; }
        public String getUpsert() { return upsert; }
        public void setUpsert(String upsert) { this.upsert = upsert; }
        public String getFindByKey() { return findByKey; }
        public void setFindByKey(String findByKey) { this.findByKey = findByKey; }
        public String getFindByGasName() { return findByGasName; }
        public void setFindByGasName(String findByGasName) { this.findByGasName = findByGasName; }
        public String getFindByArVersion() { return findByArVersion; }
        public void setFindByArVersion(String findByArVersion) { this.findByArVersion = findByArVersion; }
        public String getFindAll() { return findAll; }
        public void setFindAll(String findAll) { this.findAll = findAll; }
        public String getDeleteByKey() { return deleteByKey; }
        public void setDeleteByKey(String deleteByKey) { this.deleteByKey = deleteByKey; }
        public String getDeleteByGasName() { return deleteByGasName; }
        public void setDeleteByGasName(String deleteByGasName) { this.deleteByGasName = deleteByGasName; }
        public String getDeleteByGasNameSuffix() { return deleteByGasNameSuffix; }
        public void setDeleteByGasNameSuffix(String deleteByGasNameSuffix) { this.deleteByGasNameSuffix = deleteByGasNameSuffix; }
    }

    public static class Characterization {
        private String insert;
        private String upsert;
        private String findByKey;
        private String findByModelVersion;
        private String findByIndicator;
        private String countByModelVersion;
        private String deleteByModelVersion;
        public String getInsert() { return insert; }
        public void setInsert(String insert) { this.insert = insert; }
        public String getUpsert() { return upsert; }
        public void setUpsert(String upsert) { this.upsert = upsert; }
        public String getFindByKey() { return findByKey; }
        public void setFindByKey(String findByKey) { this.findByKey = findByKey; }
        public String getFindByModelVersion() { return findByModelVersion; }
        public void setFindByModelVersion(String findByModelVersion) { this.findByModelVersion = findByModelVersion; }
        public String getFindByIndicator() { return findByIndicator; }
        public void setFindByIndicator(String findByIndicator) { this.findByIndicator = findByIndicator; }
        public String getCountByModelVersion() { return countByModelVersion; }
        public void setCountByModelVersion(String countByModelVersion) { this.countByModelVersion = countByModelVersion; }
        public String getDeleteByModelVersion() { return deleteByModelVersion; }
        public void setDeleteByModelVersion(String deleteByModelVersion) { this.deleteByModelVersion = deleteByModelVersion; }
    }

    public static class Methodology {
        private String resolveFactors;
        private String resolveFactor;
        public String getResolveFactors() { return resolveFactors; }
        public void setResolveFactors(String resolveFactors) { this.resolveFactors = resolveFactors; }
        public String getResolveFactor() { return resolveFactor; }
        public void setResolveFactor(String resolveFactor) { this.resolveFactor = resolveFactor; }
    }

    public static class Schema {
        private String tableExists;
        private String functionExists;
        private String primaryKeyColumns;
        private String triggerCount;
        private String tableComment;
        private String columnComment;
        public String getTableExists() { return tableExists; }
        public void setTableExists(String tableExists) { this.tableExists = tableExists; }
        public String getFunctionExists() { return functionExists; }
        public void setFunctionExists(String functionExists) { this.functionExists = functionExists; }
        public String getPrimaryKeyColumns() { return primaryKeyColumns; }
        public void setPrimaryKeyColumns(String primaryKeyColumns) { this.primaryKeyColumns = primaryKeyColumns; }
        public String getTriggerCount() { return triggerCount; }
        public void setTriggerCount(String triggerCount) { this.triggerCount = triggerCount; }
        public String getTableComment() { return tableComment; }
        public void setTableComment(String tableComment) { this.tableComment = tableComment; }
        public String getColumnComment() { return columnComment; }
        public void setColumnComment(String columnComment) { this.columnComment = columnComment; }
    }
}
