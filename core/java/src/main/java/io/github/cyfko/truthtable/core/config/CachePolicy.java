package io.github.cyfko.truthtable.core.config;

/**
 * Configuration of the parsed formula cache.
 * <p>
 * Parsing is cheap compared to table generation, but UI callers tend to resubmit the same
 * expression many times; the cache lets them skip tokenizing and parsing on repeats.
 * </p>
 *
 * <h2>Preset Configurations</h2>
 * <pre>{@code
 * CachePolicy.defaults();   // enabled, 256 entries
 * CachePolicy.strict();     // enabled, 64 entries
 * CachePolicy.relaxed();    // enabled, 1024 entries
 * CachePolicy.none();       // disabled
 * CachePolicy.custom(500);  // enabled, 500 entries
 * }</pre>
 *
 * @param cacheEnabled whether parsed formulas are cached
 * @param cacheSize    maximum number of cached formulas
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record CachePolicy(
        boolean cacheEnabled,
        int cacheSize
) {

    /**
     * Canonical constructor with validation.
     */
    public CachePolicy {
        if (cacheSize <= 0) {
            throw new IllegalArgumentException("cacheSize must be positive, got: " + cacheSize);
        }
    }

    public static CachePolicy defaults() {
        return new CachePolicy(true, 256);
    }

    public static CachePolicy strict() {
        return new CachePolicy(true, 64);
    }

    public static CachePolicy relaxed() {
        return new CachePolicy(true, 1024);
    }

    /**
     * No cache configuration: every call re-parses its expression.
     *
     * @return a CachePolicy with caching disabled
     */
    public static CachePolicy none() {
        return new CachePolicy(false, 1);
    }

    public static CachePolicy custom(int cacheSize) {
        return new CachePolicy(true, cacheSize);
    }
}
