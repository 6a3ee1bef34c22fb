package com.di.bqsampler.query;

import com.di.bqsampler.entity.TableReference;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Port for the warehouse metadata and statement execution used by the sampler.
 */
public interface BigQueryGateway {

    /**
     * @return the dataset location, empty when the dataset does not exist
     */
    Optional<String> datasetLocation(String projectId, String datasetId);

    /**
     * @return row count and view flag, empty when the table does not exist
     */
    Optional<TableMetadata> tableMetadata(TableReference table);

    /**
     * Creates the dataset in {@code location} unless it already exists.
     */
    void ensureDataset(String projectId, String datasetId, String location, Map<String, String> labels);

    /**
     * Creates {@code target} with the schema of {@code schemaSource}.
     *
     * @param dropExisting drop a pre-existing {@code target} first
     */
    void createTable(TableReference target, TableReference schemaSource,
                     Map<String, String> labels, boolean dropExisting);

    /**
     * @return false when the table did not exist
     */
    boolean dropTable(TableReference table);

    /**
     * Runs a DML/DDL statement as a job in {@code projectId} and {@code location} and waits for it.
     */
    void executeStatement(String sql, String projectId, String location);

    /**
     * Exact row count through {@code SELECT COUNT(*)}.
     */
    long countRows(TableReference table);

    /**
     * Dataset ids in {@code projectId} carrying every one of {@code labels}.
     */
    List<String> listDatasets(String projectId, Map<String, String> labels);

    /**
     * Tables of the dataset carrying every one of {@code labels}; all tables for an empty map.
     */
    List<TableReference> listTables(String projectId, String datasetId, Map<String, String> labels);

    /**
     * @return false when the dataset did not exist
     */
    boolean removeDataset(String projectId, String datasetId, boolean deleteContents);
}
