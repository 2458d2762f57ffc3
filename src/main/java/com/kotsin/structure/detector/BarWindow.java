package com.kotsin.structure.detector;

import com.kotsin.structure.model.Bar;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Most recent bars, contiguous by index. Older bars fall off once capacity
 * is reached.
 */
public class BarWindow {

    private final int capacity;
    private final List<Bar> bars;

    public BarWindow(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
        this.bars = new ArrayList<>(capacity + 1);
    }

    public void add(Bar bar) {
        if (!bars.isEmpty() && bar.getIndex() != latest().getIndex() + 1) {
            throw new IllegalArgumentException("Bar index " + bar.getIndex() + " does not follow " + latest().getIndex());
        }
        bars.add(bar);
        if (bars.size() > capacity) {
            bars.remove(0);
        }
    }

    /**
     * @throws IndexOutOfBoundsException if the bar is no longer (or not yet) held
     */
    public Bar get(int barIndex) {
        if (!contains(barIndex)) {
            throw new IndexOutOfBoundsException("Bar " + barIndex + " outside window ["
                    + firstIndex() + ", " + lastIndex() + "]");
        }
        return bars.get(barIndex - firstIndex());
    }

    public boolean contains(int barIndex) {
        return !bars.isEmpty() && barIndex >= firstIndex() && barIndex <= lastIndex();
    }

    public Bar latest() {
        return bars.isEmpty() ? null : bars.get(bars.size() - 1);
    }

    public int firstIndex() {
        return bars.isEmpty() ? -1 : bars.get(0).getIndex();
    }

    public int lastIndex() {
        return bars.isEmpty() ? -1 : latest().getIndex();
    }

    public int size() {
        return bars.size();
    }

    public int getCapacity() {
        return capacity;
    }

    public List<Bar> toList() {
        return Collections.unmodifiableList(new ArrayList<>(bars));
    }
}
