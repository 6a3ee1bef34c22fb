package com.di.bqsampler.query;

import com.di.bqsampler.entity.SortDirection;
import com.di.bqsampler.entity.TableReference;
import com.di.bqsampler.util.InputValidator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;

/**
 * Materialises samples into target tables and cleans up what previous runs left behind.
 *
 * <h3>Same location</h3>
 * <ol>
 *   <li>Ensure the target dataset, (re)create the target table with the source schema.</li>
 *   <li>Run {@code INSERT INTO target SELECT ... LIMIT amount}.</li>
 *   <li>Return {@code COUNT(*)} of the target.</li>
 * </ol>
 *
 * <h3>Different locations</h3>
 * The sample is written to a staging table in {@code <dataset>_<source location>_temp},
 * co-located with the source, and a cross-location transfer copies the staging dataset
 * into the target dataset. The staging dataset is removed when the transfer run reports
 * success (TRANSFER_RUN_DONE, then REMOVE_DATASET) or by the next START cleanup. When
 * staging or starting the transfer fails the staging table is dropped right away.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SampleQueryService {

    public static final String SAMPLE_TABLE_LABEL = "sample_table";
    public static final String SOURCE_PROJECT_LABEL = "source_project";
    public static final String SOURCE_LOCATION_LABEL = "source_location";
    static final String STAGING_DATASET_SUFFIX = "_temp";

    static final Map<String, String> SAMPLE_LABELS = Collections.singletonMap(SAMPLE_TABLE_LABEL, "true");

    private final BigQueryGateway bigQueryGateway;
    private final TransferGateway transferGateway;

    // ------------------------------------------------------------------ //
    // Row counts                                                          //
    // ------------------------------------------------------------------ //

    /**
     * Rows of {@code table}: metadata for tables, {@code COUNT(*)} for views, whose
     * metadata carries no row count.
     *
     * @throws IllegalStateException if the table does not exist
     */
    public long rowCount(TableReference table) {
        TableMetadata metadata = requireMetadata(table);
        if (metadata.isView()) {
            long count = bigQueryGateway.countRows(table);
            log.debug("[SAMPLE] View {} counted {} rows", table, count);
            return count;
        }
        return metadata.getNumRows();
    }

    // ------------------------------------------------------------------ //
    // Sampling                                                            //
    // ------------------------------------------------------------------ //

    /**
     * Random sample through {@code TABLESAMPLE SYSTEM}; views fall back to a full scan
     * ordered by {@code RAND()}.
     *
     * @return rows in the written table
     */
    public long createTableWithRandomSample(TableReference source, TableReference target, long amount,
                                            boolean recreateTable, String notificationTopic) {
        log.info("[SAMPLE] Random sample of {} rows from {} into {}", amount, source, target);
        return createTableWithSample(source, target, amount, recreateTable, notificationTopic,
                (metadata, writeTarget) -> randomSampleStatement(metadata, writeTarget, amount));
    }

    /**
     * Sample of the first {@code amount} rows ordered by {@code column}.
     *
     * @return rows in the written table
     */
    public long createTableWithSortedSample(TableReference source, TableReference target, long amount,
                                            String column, SortDirection direction,
                                            boolean recreateTable, String notificationTopic) {
        String validColumn = InputValidator.validateColumnName(column);
        if (direction == null) {
            throw new IllegalArgumentException("Sort direction cannot be null");
        }
        log.info("[SAMPLE] Sorted sample of {} rows by {} {} from {} into {}",
                amount, validColumn, direction, source, target);
        return createTableWithSample(source, target, amount, recreateTable, notificationTopic,
                (metadata, writeTarget) -> SampleQueryTemplates.insertSortedSample(
                        source, writeTarget, validColumn, direction, amount));
    }

    // ------------------------------------------------------------------ //
    // Cleanup                                                             //
    // ------------------------------------------------------------------ //

    /**
     * Drops every table labelled {@code sample_table=true} in the project. All datasets are
     * searched: a target dataset that existed before the first run carries no sample label.
     *
     * @return number of tables dropped
     * @throws IllegalStateException listing every table that could not be dropped
     */
    public int dropAllSampleTables(String projectId) {
        List<String> errors = new ArrayList<>();
        int dropped = 0;
        for (String datasetId : bigQueryGateway.listDatasets(projectId, Collections.emptyMap())) {
            for (TableReference table : bigQueryGateway.listTables(projectId, datasetId, SAMPLE_LABELS)) {
                try {
                    if (bigQueryGateway.dropTable(table)) {
                        dropped++;
                    }
                } catch (RuntimeException e) {
                    log.warn("[CLEANUP] Could not drop sample table {}: {}", table, e.getMessage());
                    errors.add(table + ": " + e.getMessage());
                }
            }
        }
        failOnErrors("drop sample tables in project " + projectId, errors);
        log.info("[CLEANUP] Dropped {} sample tables in project {}", dropped, projectId);
        return dropped;
    }

    /**
     * Removes sample datasets of the project that no longer hold any table.
     *
     * @return number of datasets removed
     * @throws IllegalStateException listing every dataset that could not be removed
     */
    public int removeEmptySampleDatasets(String projectId) {
        List<String> errors = new ArrayList<>();
        int removed = 0;
        for (String datasetId : bigQueryGateway.listDatasets(projectId, SAMPLE_LABELS)) {
            try {
                if (bigQueryGateway.listTables(projectId, datasetId, Collections.emptyMap()).isEmpty()
                        && bigQueryGateway.removeDataset(projectId, datasetId, false)) {
                    removed++;
                }
            } catch (RuntimeException e) {
                log.warn("[CLEANUP] Could not remove dataset {}.{}: {}", projectId, datasetId, e.getMessage());
                errors.add(projectId + "." + datasetId + ": " + e.getMessage());
            }
        }
        failOnErrors("remove empty sample datasets in project " + projectId, errors);
        log.info("[CLEANUP] Removed {} empty sample datasets in project {}", removed, projectId);
        return removed;
    }

    public int removeAllTransferConfigs(String projectId, String location) {
        int removed = transferGateway.removeAllTransferConfigs(projectId, location);
        log.info("[CLEANUP] Removed {} transfer configs in projects/{}/locations/{}", removed, projectId, location);
        return removed;
    }

    public void removeTransferConfig(String name) {
        transferGateway.removeTransferConfig(name);
    }

    /**
     * Deletes the dataset and its tables; a missing dataset is not an error.
     */
    public void removeDataset(String projectId, String datasetId) {
        boolean removed = bigQueryGateway.removeDataset(projectId, datasetId, true);
        log.info("[CLEANUP] Dataset {}.{} {}", projectId, datasetId, removed ? "removed" : "did not exist");
    }

    // ------------------------------------------------------------------ //
    // Internal helpers                                                    //
    // ------------------------------------------------------------------ //

    @FunctionalInterface
    private interface StatementFactory {
        String statement(TableMetadata sourceMetadata, TableReference writeTarget);
    }

    private long createTableWithSample(TableReference source, TableReference target, long amount,
                                       boolean recreateTable, String notificationTopic,
                                       StatementFactory statementFactory) {
        InputValidator.validateTableReference(source);
        InputValidator.validateTableReference(target);
        InputValidator.validateAmount(amount);
        TableMetadata metadata = requireMetadata(source);

        if (sameLocation(source, target)) {
            return sampleInto(source, target, metadata, amount, recreateTable,
                    writeTarget -> statementFactory.statement(metadata, writeTarget));
        }
        return sampleAcrossLocations(source, target, metadata, amount, recreateTable, notificationTopic,
                writeTarget -> statementFactory.statement(metadata, writeTarget));
    }

    private long sampleInto(TableReference source, TableReference writeTarget, TableMetadata metadata,
                            long amount, boolean recreateTable,
                            Function<TableReference, String> statement) {
        bigQueryGateway.ensureDataset(writeTarget.getProjectId(), writeTarget.getDatasetId(),
                writeTarget.getLocation(), SAMPLE_LABELS);
        bigQueryGateway.createTable(writeTarget, source, tableLabels(source), recreateTable);

        if (amount == 0 || (metadata.getNumRows() == 0 && !metadata.isView())) {
            log.info("[SAMPLE] Nothing to insert into {} (amount={}, source rows={})",
                    writeTarget, amount, metadata.getNumRows());
            return 0L;
        }
        bigQueryGateway.executeStatement(statement.apply(writeTarget), writeTarget.getProjectId(),
                source.getLocation());
        long inserted = bigQueryGateway.countRows(writeTarget);
        if (inserted < amount) {
            log.warn("[SAMPLE] {} received {} of {} requested rows", writeTarget, inserted, amount);
        }
        return inserted;
    }

    private long sampleAcrossLocations(TableReference source, TableReference target, TableMetadata metadata,
                                       long amount, boolean recreateTable, String notificationTopic,
                                       Function<TableReference, String> statement) {
        TableReference staging = stagingTable(source, target);
        log.info("[SAMPLE] {} and {} are in different locations; staging through {}", source, target, staging);
        long inserted;
        try {
            inserted = sampleInto(source, staging, metadata, amount, recreateTable, statement);
            bigQueryGateway.ensureDataset(target.getProjectId(), target.getDatasetId(), target.getLocation(),
                    SAMPLE_LABELS);
            String transferConfig = transferGateway.startCrossLocationCopy(
                    staging.getProjectId(), staging.getDatasetId(), target, notificationTopic);
            log.info("[TRANSFER] Started {} copying {} into {}", transferConfig, staging.datasetFqnId(),
                    target.datasetFqnId());
        } catch (RuntimeException e) {
            log.warn("[TRANSFER] Could not stage and copy {}; dropping staging table", staging);
            try {
                bigQueryGateway.dropTable(staging);
            } catch (RuntimeException dropError) {
                e.addSuppressed(dropError);
            }
            throw e;
        }
        return inserted;
    }

    static TableReference stagingTable(TableReference source, TableReference target) {
        String stagingDataset = InputValidator.bigQueryValidName(
                target.getDatasetId() + "_" + source.getLocation() + STAGING_DATASET_SUFFIX);
        return target.withDatasetId(stagingDataset).withLocation(source.getLocation());
    }

    private String randomSampleStatement(TableMetadata metadata, TableReference writeTarget, long amount) {
        TableReference source = metadata.getTable();
        if (metadata.isView() && metadata.getNumRows() == 0) {
            log.info("[SAMPLE] {} is a view; using ORDER BY RAND() instead of TABLESAMPLE", source);
            return SampleQueryTemplates.insertViewRandomSample(source, writeTarget, amount);
        }
        int percent = SampleQueryTemplates.tableSamplePercent(amount, metadata.getNumRows());
        return SampleQueryTemplates.insertRandomSample(source, writeTarget, percent, amount);
    }

    private TableMetadata requireMetadata(TableReference table) {
        return bigQueryGateway.tableMetadata(table)
                .orElseThrow(() -> new IllegalStateException("Table " + table + " does not exist"));
    }

    static Map<String, String> tableLabels(TableReference source) {
        Map<String, String> labels = new LinkedHashMap<>(SAMPLE_LABELS);
        labels.put(SOURCE_PROJECT_LABEL, InputValidator.labelValue(source.getProjectId()));
        labels.put(SOURCE_LOCATION_LABEL, InputValidator.labelValue(source.getLocation()));
        return labels;
    }

    private static boolean sameLocation(TableReference source, TableReference target) {
        if (source.getLocation() == null || target.getLocation() == null) {
            return true;
        }
        return source.getLocation().toLowerCase(Locale.ROOT).equals(target.getLocation().toLowerCase(Locale.ROOT));
    }

    private static void failOnErrors(String operation, List<String> errors) {
        if (!errors.isEmpty()) {
            throw new IllegalStateException("Could not " + operation + ". Error(s): " + errors);
        }
    }
}
