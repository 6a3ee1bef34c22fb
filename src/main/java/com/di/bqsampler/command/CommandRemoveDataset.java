package com.di.bqsampler.command;

import com.di.bqsampler.entity.JsonFields;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Deletes a dataset and everything in it, e.g. the staging dataset of a finished transfer.
 */
@Getter
@ToString(callSuper = true)
@EqualsAndHashCode(callSuper = true)
public class CommandRemoveDataset extends Command {

    private final String projectId;
    private final String datasetId;

    public CommandRemoveDataset(long timestamp, String projectId, String datasetId) {
        super(CommandType.REMOVE_DATASET, timestamp);
        if (projectId == null || projectId.isBlank() || datasetId == null || datasetId.isBlank()) {
            throw new IllegalArgumentException(String.format(
                    "Project and dataset ids must be non-empty, got: <%s> and <%s>", projectId, datasetId));
        }
        this.projectId = projectId;
        this.datasetId = datasetId;
    }

    static CommandRemoveDataset fromJson(JsonNode node, long timestamp) {
        return new CommandRemoveDataset(
                timestamp,
                JsonFields.text(node, "project_id"),
                JsonFields.text(node, "dataset_id"));
    }

    @Override
    protected void writeFields(ObjectNode node) {
        node.put("project_id", projectId);
        node.put("dataset_id", datasetId);
    }
}
