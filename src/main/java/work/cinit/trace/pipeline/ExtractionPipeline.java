package work.cinit.trace.pipeline;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import work.cinit.trace.catalog.FactCatalog;
import work.cinit.trace.config.ExtractionSettings;
import work.cinit.trace.normalize.NormalizedRoutine;
import work.cinit.trace.normalize.OverrideRule;
import work.cinit.trace.normalize.StatementNormalizer;
import work.cinit.trace.normalize.UnrecognizedConstructException;
import work.cinit.trace.runtime.SymbolicEvaluator;
import work.cinit.trace.shared.Listings;
import work.cinit.trace.syntax.RoutineSource;

/**
 * Normalizes and evaluates the configured initialization routines in startup order.
 *
 * <p>A pipeline owns one normalizer and one evaluator; declared-variable defaults folded by an early
 * routine are seen by the later ones, so a pipeline is meant to be run once.</p>
 */
public final class ExtractionPipeline {
    private static final Logger LOG = LogManager.getLogger(ExtractionPipeline.class);

    private final FactCatalog catalog;
    private final ExtractionSettings settings;
    private final List<String> declared = new ArrayList<>();
    private final Map<String, String> units = new LinkedHashMap<>();
    private final StatementNormalizer normalizer;
    private final SymbolicEvaluator evaluator;

    public ExtractionPipeline(FactCatalog catalog, Collection<RoutineSource> sources, ExtractionSettings settings) {
        this.catalog = Objects.requireNonNull(catalog, "catalog");
        this.settings = Objects.requireNonNull(settings, "settings");
        for (var source : sources) {
            declared.add(source.name());
            units.put(source.name(), source.unit());
        }
        var overrides = new LinkedHashMap<String, List<OverrideRule>>();
        settings.routines().forEach((name, routine) -> overrides.put(name, routine.overrides()));
        this.normalizer = new StatementNormalizer(sources, overrides, settings.handImplemented());
        this.evaluator = new SymbolicEvaluator(catalog, settings.primitives());
    }

    /**
     * Extracts every init call in order. Without configured init calls, every routine of the tree
     * file is extracted in file order.
     */
    public ExtractionResult run() {
        var calls = settings.initCalls().isEmpty() ? declared : settings.initCalls();
        var traces = new ArrayList<RoutineTrace>();
        for (var call : calls) {
            if (settings.isExcluded(call)) {
                LOG.debug("Skipping excluded routine {}", call);
                continue;
            }
            if (!normalizer.knows(call)) {
                LOG.warn("Skipping init call {}: no such routine", call);
                continue;
            }
            traces.add(extract(call));
        }
        return new ExtractionResult(catalog, traces);
    }

    public RoutineTrace extract(String routine) {
        var normalized = normalize(routine);
        var routineSettings = settings.routine(routine);
        try {
            var evaluation = evaluator.evaluate(normalized, routineSettings.injections());
            var statements = routineSettings.rewriter()
                .map(rewriter -> rewriter.rewrite(evaluation.statements(), evaluation.finalState()))
                .orElse(evaluation.statements());
            LOG.info("Extracted {} ({}): {} statements", routine, normalized.unit(), statements.size());
            return new RoutineTrace(routine, normalized.unit(), statements, normalized.handImplemented());
        } catch (RuntimeException ex) {
            throw failure(routine, normalized.unit(), normalized.listing(), ex);
        }
    }

    /** Normalized listing of one routine, for diagnostics. */
    public List<String> listing(String routine) {
        return normalize(routine).listing();
    }

    private NormalizedRoutine normalize(String routine) {
        try {
            return normalizer.normalize(routine);
        } catch (UnrecognizedConstructException ex) {
            throw failure(routine, units.get(routine), ex.partialListing(), ex);
        } catch (RuntimeException ex) {
            throw failure(routine, units.get(routine), List.of(), ex);
        }
    }

    private static RoutineExtractionException failure(String routine, String unit, List<String> listing, RuntimeException cause) {
        if (cause instanceof RoutineExtractionException nested) {
            return nested;
        }
        var failure = new RoutineExtractionException(routine, unit, listing, cause);
        LOG.error("{}\n{}", failure.getMessage(), Listings.numbered(listing));
        return failure;
    }
}
