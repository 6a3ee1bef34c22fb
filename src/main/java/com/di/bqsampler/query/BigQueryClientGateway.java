package com.di.bqsampler.query;

import com.di.bqsampler.entity.TableReference;
import com.google.cloud.RetryOption;
import com.google.cloud.bigquery.BigQuery;
import com.google.cloud.bigquery.BigQueryError;
import com.google.cloud.bigquery.BigQueryException;
import com.google.cloud.bigquery.Dataset;
import com.google.cloud.bigquery.DatasetId;
import com.google.cloud.bigquery.DatasetInfo;
import com.google.cloud.bigquery.Job;
import com.google.cloud.bigquery.JobId;
import com.google.cloud.bigquery.JobInfo;
import com.google.cloud.bigquery.QueryJobConfiguration;
import com.google.cloud.bigquery.Schema;
import com.google.cloud.bigquery.StandardTableDefinition;
import com.google.cloud.bigquery.Table;
import com.google.cloud.bigquery.TableDefinition;
import com.google.cloud.bigquery.TableId;
import com.google.cloud.bigquery.TableInfo;
import com.google.cloud.bigquery.TableResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.threeten.bp.Duration;

import java.math.BigInteger;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;
import java.util.stream.StreamSupport;

/**
 * {@link BigQueryGateway} backed by the BigQuery client library.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BigQueryClientGateway implements BigQueryGateway {

    private static final int HTTP_CONFLICT = 409;
    private static final Duration JOB_TIMEOUT = Duration.ofHours(1);

    private final BigQuery bigQuery;

    @Override
    public Optional<String> datasetLocation(String projectId, String datasetId) {
        Dataset dataset = bigQuery.getDataset(DatasetId.of(projectId, datasetId));
        return Optional.ofNullable(dataset).map(Dataset::getLocation);
    }

    @Override
    public Optional<TableMetadata> tableMetadata(TableReference table) {
        Table bqTable = bigQuery.getTable(tableId(table));
        if (bqTable == null) {
            return Optional.empty();
        }
        BigInteger numRows = bqTable.getNumRows();
        return Optional.of(TableMetadata.builder()
                .table(table)
                .numRows(numRows != null ? numRows.longValue() : 0L)
                .view(isView(bqTable.getDefinition()))
                .build());
    }

    @Override
    public void ensureDataset(String projectId, String datasetId, String location, Map<String, String> labels) {
        DatasetInfo.Builder info = DatasetInfo.newBuilder(DatasetId.of(projectId, datasetId)).setLabels(labels);
        if (location != null) {
            info.setLocation(location);
        }
        try {
            bigQuery.create(info.build());
            log.info("[BQ] Created dataset {}.{} in {}", projectId, datasetId, location);
        } catch (BigQueryException e) {
            if (e.getCode() != HTTP_CONFLICT) {
                throw e;
            }
            log.debug("[BQ] Dataset {}.{} already exists", projectId, datasetId);
        }
    }

    @Override
    public void createTable(TableReference target, TableReference schemaSource,
                            Map<String, String> labels, boolean dropExisting) {
        TableId targetId = tableId(target);
        if (dropExisting && bigQuery.delete(targetId)) {
            log.info("[BQ] Dropped existing table {}", target);
        } else if (!dropExisting && bigQuery.getTable(targetId) != null) {
            log.debug("[BQ] Keeping existing table {}", target);
            return;
        }
        Table source = bigQuery.getTable(tableId(schemaSource));
        if (source == null) {
            throw new IllegalStateException("Table " + schemaSource + " does not exist");
        }
        Schema schema = source.getDefinition().getSchema();
        bigQuery.create(TableInfo.newBuilder(targetId, StandardTableDefinition.of(schema))
                .setLabels(labels)
                .build());
        log.info("[BQ] Created table {} with schema of {}", target, schemaSource);
    }

    @Override
    public boolean dropTable(TableReference table) {
        boolean deleted = bigQuery.delete(tableId(table));
        log.info("[BQ] Drop table {}: {}", table, deleted ? "dropped" : "not found");
        return deleted;
    }

    @Override
    public void executeStatement(String sql, String projectId, String location) {
        QueryJobConfiguration cfg = QueryJobConfiguration.newBuilder(sql)
                .setUseLegacySql(false)
                .build();
        JobId jobId = jobId(projectId, location);
        Job job = bigQuery.create(JobInfo.newBuilder(cfg).setJobId(jobId).build());
        log.info("[BQ] Statement job submitted: {}", jobId.getJob());
        log.debug("[BQ] {}", sql);

        try {
            job = job.waitFor(RetryOption.totalTimeout(JOB_TIMEOUT));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted waiting for BigQuery job " + jobId.getJob(), e);
        }

        if (job == null) {
            throw new IllegalStateException("BigQuery job timed out or no longer exists: " + jobId.getJob());
        }
        if (job.getStatus().getError() != null) {
            BigQueryError err = job.getStatus().getError();
            throw new IllegalStateException("BigQuery job failed [" + jobId.getJob() + "]: " + err.getMessage());
        }
    }

    @Override
    public long countRows(TableReference table) {
        String sql = String.format("SELECT COUNT(*) AS cnt FROM `%s`", table.fqnId(false));
        try {
            QueryJobConfiguration cfg = QueryJobConfiguration.newBuilder(sql)
                    .setUseLegacySql(false)
                    .build();
            TableResult result = bigQuery.query(cfg, jobId(table.getProjectId(), table.getLocation()));
            long cnt = result.iterateAll().iterator().next().get("cnt").getLongValue();
            log.debug("[BQ] Count {} = {}", table, cnt);
            return cnt;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("BigQuery count interrupted for " + table, e);
        }
    }

    @Override
    public List<String> listDatasets(String projectId, Map<String, String> labels) {
        Iterable<Dataset> datasets = labels.isEmpty()
                ? bigQuery.listDatasets(projectId).iterateAll()
                : bigQuery.listDatasets(projectId, BigQuery.DatasetListOption.labelFilter(labelFilter(labels)))
                        .iterateAll();
        return StreamSupport.stream(datasets.spliterator(), false)
                .map(dataset -> dataset.getDatasetId().getDataset())
                .collect(Collectors.toList());
    }

    @Override
    public List<TableReference> listTables(String projectId, String datasetId, Map<String, String> labels) {
        Iterable<Table> tables = bigQuery.listTables(DatasetId.of(projectId, datasetId)).iterateAll();
        return StreamSupport.stream(tables.spliterator(), false)
                .filter(table -> hasLabels(table.getLabels(), labels))
                .map(table -> TableReference.of(projectId, datasetId, table.getTableId().getTable()))
                .collect(Collectors.toList());
    }

    @Override
    public boolean removeDataset(String projectId, String datasetId, boolean deleteContents) {
        DatasetId id = DatasetId.of(projectId, datasetId);
        boolean deleted = deleteContents
                ? bigQuery.delete(id, BigQuery.DatasetDeleteOption.deleteContents())
                : bigQuery.delete(id);
        log.info("[BQ] Remove dataset {}.{}: {}", projectId, datasetId, deleted ? "removed" : "not found");
        return deleted;
    }

    // ------------------------------------------------------------------ //

    private static TableId tableId(TableReference table) {
        return TableId.of(table.getProjectId(), table.getDatasetId(), table.getTableId());
    }

    private static JobId jobId(String projectId, String location) {
        JobId.Builder builder = JobId.newBuilder()
                .setJob("bqsampler-" + UUID.randomUUID())
                .setProject(projectId);
        if (location != null) {
            builder.setLocation(location);
        }
        return builder.build();
    }

    private static boolean isView(TableDefinition definition) {
        return definition != null
                && (definition.getType() == TableDefinition.Type.VIEW
                || definition.getType() == TableDefinition.Type.MATERIALIZED_VIEW);
    }

    /**
     * {@code labels.k1:v1 labels.k2:v2}; space-separated terms are AND-ed.
     */
    static String labelFilter(Map<String, String> labels) {
        return labels.entrySet().stream()
                .map(e -> "labels." + e.getKey() + ":" + e.getValue())
                .collect(Collectors.joining(" "));
    }

    static boolean hasLabels(Map<String, String> actual, Map<String, String> required) {
        if (required.isEmpty()) {
            return true;
        }
        if (actual == null) {
            return false;
        }
        return required.entrySet().stream()
                .allMatch(e -> e.getValue().equals(actual.get(e.getKey())));
    }
}
