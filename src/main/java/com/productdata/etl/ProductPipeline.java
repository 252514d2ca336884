package com.productdata.etl;

import java.time.Clock;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * The task graph: an ordered list of named stages, each depending on the completion of the one before.
 *
 * @param dagId pipeline identifier used in logs
 * @param stages stages in execution order
 */
public record ProductPipeline(String dagId, List<Stage> stages) {
    public static final String DAG_ID = "etl_products_dag";

    public ProductPipeline {
        if (stages == null || stages.isEmpty()) {
            throw new IllegalArgumentException("A pipeline needs at least one stage");
        }
        Set<String> names = new HashSet<>();
        for (Stage stage : stages) {
            if (!names.add(stage.name())) {
                throw new IllegalArgumentException("Duplicate stage name: " + stage.name());
            }
        }
        stages = List.copyOf(stages);
    }

    /**
     * Builds the archive, extract, transform, load chain for the given configuration.
     */
    public static ProductPipeline create(PipelineConfig config, CsvServiceInterface csvService,
                                         RecordSinkInterface sink, Clock clock) {
        return new ProductPipeline(DAG_ID, List.of(
            new ArchiveStage(config, clock),
            new ExtractStage(config, csvService),
            new TransformStage(config, csvService),
            new LoadStage(config, csvService, sink)
        ));
    }

    public List<String> stageNames() {
        return stages.stream().map(Stage::name).toList();
    }
}
