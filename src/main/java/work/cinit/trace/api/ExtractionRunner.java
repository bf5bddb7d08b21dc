package work.cinit.trace.api;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import work.cinit.trace.catalog.CatalogLoader;
import work.cinit.trace.config.ExtractionSettings;
import work.cinit.trace.config.SettingsLoader;
import work.cinit.trace.pipeline.ExtractionPipeline;
import work.cinit.trace.pipeline.RoutineExtractionException;
import work.cinit.trace.pipeline.TraceDocument;
import work.cinit.trace.shared.ExtractionException;
import work.cinit.trace.syntax.SyntaxTreeLoader;

/**
 * Public entry point for embedding the extractor.
 */
public final class ExtractionRunner {
    private static final Logger LOG = LogManager.getLogger(ExtractionRunner.class);

    public RunResult run(ExtractionConfiguration configuration) {
        var started = Instant.now();
        try {
            var result = pipeline(configuration).run();

            var metadata = new LinkedHashMap<String, Object>();
            metadata.put("catalog", configuration.catalogFile().toString());
            metadata.put("trees", configuration.treeFile().toString());
            metadata.put("routines", result.routines().size());
            metadata.put("statements", result.statementCount());
            metadata.put("logLevel", configuration.logLevel().name());
            metadata.put("status", "ok");
            if (configuration.outputFile().isPresent()) {
                var output = configuration.outputFile().get();
                TraceDocument.write(result, output);
                metadata.put("output", output.toString());
                return RunResult.success(metadata, started);
            }
            return RunResult.success(metadata, started).withSerializedPayload(TraceDocument.toJson(result));
        } catch (Exception ex) {
            var errorMeta = new LinkedHashMap<String, Object>();
            errorMeta.put("catalog", configuration.catalogFile().toString());
            errorMeta.put("trees", configuration.treeFile().toString());
            if (ex.getMessage() != null && !ex.getMessage().isBlank()) {
                errorMeta.put("error", ex.getMessage());
            }
            if (ex instanceof ExtractionException extraction) {
                errorMeta.put("code", extraction.code());
            }
            if (ex instanceof RoutineExtractionException routine) {
                errorMeta.put("routine", routine.routine());
                errorMeta.put("listing", routine.listing());
            }
            if (Boolean.getBoolean("cinit.debug")) {
                LOG.error("Extraction failed", ex);
            }
            return RunResult.failure(ex.getMessage(), errorMeta, started);
        }
    }

    public List<String> listing(ExtractionConfiguration configuration, String routine) {
        return pipeline(configuration).listing(routine);
    }

    private ExtractionPipeline pipeline(ExtractionConfiguration configuration) {
        var catalog = CatalogLoader.load(configuration.catalogFile());
        var sources = SyntaxTreeLoader.load(configuration.treeFile());
        var settings = configuration.settingsFile()
            .map(SettingsLoader::load)
            .orElseGet(ExtractionSettings::empty);
        return new ExtractionPipeline(catalog, sources, settings);
    }
}
