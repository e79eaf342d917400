package io.github.cyfko.truthtable.core.impl;

import io.github.cyfko.truthtable.core.api.Formula;
import io.github.cyfko.truthtable.core.api.TruthTableEngine;
import io.github.cyfko.truthtable.core.api.TruthTableResult;
import io.github.cyfko.truthtable.core.cache.FormulaCache;
import io.github.cyfko.truthtable.core.config.CachePolicy;
import io.github.cyfko.truthtable.core.config.EnginePolicy;
import io.github.cyfko.truthtable.core.exception.FormulaSyntaxException;
import io.github.cyfko.truthtable.core.exception.TruthTableException;
import io.github.cyfko.truthtable.core.parsing.FormulaEvaluator;
import io.github.cyfko.truthtable.core.parsing.FormulaParser;
import io.github.cyfko.truthtable.core.parsing.FormulaTokenizer;
import io.github.cyfko.truthtable.core.table.TruthTable;
import io.github.cyfko.truthtable.core.table.TruthTableGenerator;

import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Default {@link TruthTableEngine} running the tokenize, parse, evaluate pipeline.
 *
 * <h2>Pipeline</h2>
 * <ol>
 *   <li><strong>Phase 1</strong>: {@link FormulaTokenizer} - typed tokens, length limit</li>
 *   <li><strong>Phase 2</strong>: {@link FormulaParser} - syntax tree, structural validation, nesting limit</li>
 *   <li><strong>Phase 3</strong>: {@link TruthTableGenerator} - variable limit, one {@link FormulaEvaluator} call per row</li>
 * </ol>
 *
 * <h2>Caching</h2>
 * <p>
 * Phases 1 and 2 are skipped for expressions found in the optional {@link FormulaCache}
 * (see {@link CachePolicy}). Tables are never cached.
 * </p>
 *
 * <h2>Usage examples</h2>
 * <pre>{@code
 * // Default configuration
 * TruthTableEngine engine = new BasicTruthTableEngine();
 *
 * // Strict configuration (for public endpoints)
 * TruthTableEngine strict = new BasicTruthTableEngine(EnginePolicy.strict(), CachePolicy.strict());
 * }</pre>
 *
 * <p>Instances are thread-safe: the only shared state is the cache.</p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class BasicTruthTableEngine implements TruthTableEngine {

    private static final Logger log = Logger.getLogger(BasicTruthTableEngine.class.getName());

    private final EnginePolicy enginePolicy;
    private final CachePolicy cachePolicy;
    private final TruthTableGenerator generator;
    protected final FormulaCache cache;

    /**
     * Default constructor using {@link EnginePolicy#defaults()} and {@link CachePolicy#defaults()}.
     */
    public BasicTruthTableEngine() {
        this(EnginePolicy.defaults(), CachePolicy.defaults());
    }

    /**
     * @param enginePolicy limits and options to apply; default cache policy is used
     * @throws IllegalArgumentException if enginePolicy is null
     */
    public BasicTruthTableEngine(EnginePolicy enginePolicy) {
        this(enginePolicy, CachePolicy.defaults());
    }

    /**
     * @param enginePolicy limits and options to apply
     * @param cachePolicy  the cache policy settings
     * @throws IllegalArgumentException if either policy is null
     */
    public BasicTruthTableEngine(EnginePolicy enginePolicy, CachePolicy cachePolicy) {
        this(enginePolicy, cachePolicy, new FormulaEvaluator());
    }

    /**
     * Constructor with a custom evaluator.
     *
     * @param enginePolicy limits and options to apply
     * @param cachePolicy  the cache policy settings
     * @param evaluator    evaluator invoked for every row
     * @throws IllegalArgumentException if any argument is null
     */
    public BasicTruthTableEngine(EnginePolicy enginePolicy, CachePolicy cachePolicy, FormulaEvaluator evaluator) {
        if (enginePolicy == null) {
            throw new IllegalArgumentException("Engine policy is required");
        }
        if (cachePolicy == null) {
            throw new IllegalArgumentException("Cache policy is required");
        }

        this.enginePolicy = enginePolicy;
        this.cachePolicy = cachePolicy;
        this.generator = new TruthTableGenerator(evaluator, enginePolicy);
        this.cache = cachePolicy.cacheEnabled()
                ? new FormulaCache(cachePolicy.cacheSize())
                : null;
    }

    @Override
    public Formula parse(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new FormulaSyntaxException("Expression cannot be null or empty");
        }

        if (cache == null) {
            return doParse(expression);
        }

        Formula cached = cache.get(expression);
        if (cached != null) {
            log.fine(() -> String.format("Formula cache hit for '%s'", expression));
            return cached;
        }
        return cache.computeIfAbsent(expression, this::doParse);
    }

    private Formula doParse(String expression) {
        Formula formula = FormulaParser.parse(expression, enginePolicy);
        log.fine(() -> String.format(
                "Parsed '%s' as %s with variables %s", expression, formula.canonical(), formula.variables()));
        return formula;
    }

    @Override
    public TruthTable computeTruthTable(Formula formula) {
        Objects.requireNonNull(formula, "formula cannot be null");
        return generator.build(formula);
    }

    @Override
    public TruthTableResult evaluate(String expression) {
        try {
            return TruthTableResult.success(generateTruthTable(expression));
        } catch (TruthTableException e) {
            log.warning(() -> String.format(
                    "Rejected expression '%s' [%s]: %s", expression, e.getErrorKind(), e.getMessage()));
            return TruthTableResult.failure(e.getErrorKind(), e.getMessage());
        }
    }

    public EnginePolicy getEnginePolicy() {
        return enginePolicy;
    }

    /**
     * Clears the formula cache (if enabled).
     */
    public void clearCache() {
        if (cache != null) {
            cache.clear();
        }
    }

    /**
     * Returns cache statistics (if caching is enabled).
     *
     * @return map containing cache statistics, or {@code enabled=false} if the cache is disabled
     */
    public Map<String, Object> getCacheStats() {
        if (cache == null) {
            return Map.of("enabled", false);
        }

        return Map.of(
                "enabled", true,
                "size", cache.size(),
                "maxSize", cachePolicy.cacheSize()
        );
    }
}
