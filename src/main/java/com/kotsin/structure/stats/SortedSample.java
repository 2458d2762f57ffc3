package com.kotsin.structure.stats;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

/**
 * Sorted multiset of doubles with rank queries.
 *
 * Binary search for lookups; inserts and removals shift the backing array.
 * Sample sizes here are bounded by the live leg population, so this stays
 * cheaper than a balanced tree in practice.
 */
public class SortedSample {

    private final List<Double> values = new ArrayList<>();

    public void add(double value) {
        values.add(lowerBound(value), value);
    }

    public void addAll(Collection<Double> all) {
        for (Double v : all) {
            add(v);
        }
    }

    /**
     * Removes one occurrence of value.
     *
     * @return false if the value was not present
     */
    public boolean remove(double value) {
        int idx = lowerBound(value);
        if (idx < values.size() && Double.compare(values.get(idx), value) == 0) {
            values.remove(idx);
            return true;
        }
        return false;
    }

    public void replace(double oldValue, double newValue) {
        remove(oldValue);
        add(newValue);
    }

    /** Number of values strictly below {@code value}. */
    public int countBelow(double value) {
        return lowerBound(value);
    }

    /** Number of values strictly above {@code value}. */
    public int countAbove(double value) {
        return values.size() - upperBound(value);
    }

    /**
     * Percentile rank in [0, 100): share of the sample strictly below value.
     *
     * @return null for an empty sample
     */
    public Double percentileRank(double value) {
        if (values.isEmpty()) {
            return null;
        }
        return (double) countBelow(value) / values.size() * 100.0;
    }

    public int size() {
        return values.size();
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    public void clear() {
        values.clear();
    }

    public List<Double> toList() {
        return Collections.unmodifiableList(new ArrayList<>(values));
    }

    private int lowerBound(double value) {
        int lo = 0;
        int hi = values.size();
        while (lo < hi) {
            int mid = (lo + hi) >>> 1;
            if (Double.compare(values.get(mid), value) < 0) {
                lo = mid + 1;
            } else {
                hi = mid;
            }
        }
        return lo;
    }

    private int upperBound(double value) {
        int lo = 0;
        int hi = values.size();
        while (lo < hi) {
            int mid = (lo + hi) >>> 1;
            if (Double.compare(values.get(mid), value) <= 0) {
                lo = mid + 1;
            } else {
                hi = mid;
            }
        }
        return lo;
    }
}
