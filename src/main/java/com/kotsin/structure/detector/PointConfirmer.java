package com.kotsin.structure.detector;

import com.kotsin.structure.model.Bar;
import com.kotsin.structure.model.SwingPoint;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;

/**
 * Confirms swing highs and lows with a fixed lag and keeps the recent ones
 * for pairing.
 *
 * At bar N the bar at N - lookback is a swing high (low) when its high (low)
 * is strictly above (below) every other bar within lookback on both sides.
 * Nothing past bar N is ever read.
 */
public class PointConfirmer {

    private final int lookback;
    private final int maxPairDistance;
    private final Deque<SwingPoint> highs = new ArrayDeque<>();
    private final Deque<SwingPoint> lows = new ArrayDeque<>();

    public PointConfirmer(int lookback, int maxPairDistance) {
        this.lookback = lookback;
        this.maxPairDistance = maxPairDistance;
    }

    /**
     * @return points confirmed at this bar, a high before a low
     */
    public List<SwingPoint> confirm(BarWindow window, int currentIndex) {
        List<SwingPoint> confirmed = new ArrayList<>(2);
        int center = currentIndex - lookback;
        if (center - lookback < 0 || !window.contains(center - lookback)) {
            return confirmed;
        }

        Bar pivot = window.get(center);
        boolean isHigh = true;
        boolean isLow = true;
        for (int i = center - lookback; i <= center + lookback; i++) {
            if (i == center) {
                continue;
            }
            Bar other = window.get(i);
            if (other.getHigh() >= pivot.getHigh()) {
                isHigh = false;
            }
            if (other.getLow() <= pivot.getLow()) {
                isLow = false;
            }
        }

        if (isHigh) {
            SwingPoint high = new SwingPoint(center, pivot.getHigh(), true, currentIndex);
            highs.addLast(high);
            confirmed.add(high);
        }
        if (isLow) {
            SwingPoint low = new SwingPoint(center, pivot.getLow(), false, currentIndex);
            lows.addLast(low);
            confirmed.add(low);
        }
        evict(currentIndex);
        return confirmed;
    }

    /**
     * Most recent confirmed point of the opposite type at an earlier bar,
     * within maxPairDistance bars.
     */
    public SwingPoint mostRecentOpposite(SwingPoint point) {
        Deque<SwingPoint> opposite = point.isHigh() ? lows : highs;
        Iterator<SwingPoint> it = opposite.descendingIterator();
        while (it.hasNext()) {
            SwingPoint candidate = it.next();
            if (candidate.getBarIndex() < point.getBarIndex()) {
                return point.getBarIndex() - candidate.getBarIndex() <= maxPairDistance ? candidate : null;
            }
        }
        return null;
    }

    private void evict(int currentIndex) {
        int oldest = currentIndex - lookback - maxPairDistance;
        while (!highs.isEmpty() && highs.peekFirst().getBarIndex() < oldest) {
            highs.removeFirst();
        }
        while (!lows.isEmpty() && lows.peekFirst().getBarIndex() < oldest) {
            lows.removeFirst();
        }
    }

    public List<SwingPoint> getHighs() {
        return new ArrayList<>(highs);
    }

    public List<SwingPoint> getLows() {
        return new ArrayList<>(lows);
    }

    public void restore(Collection<SwingPoint> restoredHighs, Collection<SwingPoint> restoredLows) {
        highs.clear();
        lows.clear();
        highs.addAll(restoredHighs);
        lows.addAll(restoredLows);
    }
}
