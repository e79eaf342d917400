package io.github.cyfko.truthtable.core.cache;

import io.github.cyfko.truthtable.core.api.Formula;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

/**
 * Bounded LRU cache of parsed formulas, keyed by the raw expression text.
 * <p>
 * Backed by an access-ordered {@link LinkedHashMap}; the least recently used entry is evicted
 * once {@code maxSize} is exceeded. Since a lookup reorders entries, every operation runs under
 * a single exclusive lock.
 * </p>
 *
 * <p>
 * Keys are raw expressions: {@code "P∧Q"} and {@code "P ∧ Q"} are cached separately.
 * Cached {@link Formula} instances are immutable and safe to share.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class FormulaCache {

    private final int maxSize;
    private final Map<String, Formula> entries;
    private final Lock lock = new ReentrantLock();

    /**
     * @param maxSize the maximum number of entries to store
     * @throws IllegalArgumentException if maxSize is not positive
     */
    public FormulaCache(int maxSize) {
        if (maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be positive, got: " + maxSize);
        }
        this.maxSize = maxSize;
        this.entries = new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, Formula> eldest) {
                return size() > FormulaCache.this.maxSize;
            }
        };
    }

    /**
     * @param expression the raw expression
     * @return the cached formula, or null if absent
     */
    public Formula get(String expression) {
        lock.lock();
        try {
            return entries.get(expression);
        } finally {
            lock.unlock();
        }
    }

    public void put(String expression, Formula formula) {
        lock.lock();
        try {
            entries.put(expression, formula);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns the cached formula for {@code expression}, parsing and caching it on a miss.
     * <p>
     * The parser runs outside the lock; exceptions it throws propagate and nothing is cached.
     * Two threads missing on the same key may both parse it, and the last one wins.
     * </p>
     *
     * @param expression the raw expression
     * @param parser     function parsing the expression
     * @return the cached or newly parsed formula
     */
    public Formula computeIfAbsent(String expression, Function<String, Formula> parser) {
        Formula cached = get(expression);
        if (cached != null) {
            return cached;
        }
        Formula parsed = parser.apply(expression);
        put(expression, parsed);
        return parsed;
    }

    public int size() {
        lock.lock();
        try {
            return entries.size();
        } finally {
            lock.unlock();
        }
    }

    public boolean containsKey(String expression) {
        lock.lock();
        try {
            return entries.containsKey(expression);
        } finally {
            lock.unlock();
        }
    }

    public void clear() {
        lock.lock();
        try {
            entries.clear();
        } finally {
            lock.unlock();
        }
    }

    public int getMaxSize() {
        return maxSize;
    }

    /**
     * @return statistics string
     */
    public String getStats() {
        int size = size();
        return String.format("FormulaCache[size=%d, maxSize=%d, utilization=%.1f%%]",
                size, maxSize, (size * 100.0) / maxSize);
    }
}
