package com.kotsin.structure.model;

import com.kotsin.structure.exception.InvariantViolationException;
import com.kotsin.structure.frame.ReferenceFrame;
import com.kotsin.structure.stats.RunningMoments;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.util.Collections;
import java.util.NavigableSet;
import java.util.TreeSet;

/**
 * Leg - a tracked directional move from an origin to a pivot.
 *
 * Lifecycle:
 *   created ACTIVE at pairing
 *   -> extends while favorable and unbreached
 *   -> may form (gains a Swing)
 *   -> INVALIDATED on origin breach (pivot frozen), later STALE
 *   -> or PRUNED by a pruning rule
 *
 * Origin is immutable. Pivot moves only through {@link #extendPivot}, which
 * refuses to run once the origin has been breached.
 *
 * Hierarchy pointers are ids into the owning arena, never object references.
 */
@Getter
@Builder
@AllArgsConstructor
@ToString(of = {"id", "direction", "originPrice", "originIndex", "pivotPrice", "pivotIndex", "status", "formed"})
public class Leg {

    private final long id;
    private final Direction direction;
    private final double originPrice;
    private final int originIndex;

    private double pivotPrice;
    private int pivotIndex;

    @Builder.Default
    private LegStatus status = LegStatus.ACTIVE;
    private boolean formed;
    private Integer formedAtBar;

    // Running maxima, absent until the breach is first recorded
    private Double maxOriginBreach;
    private Double maxPivotBreach;

    /** First bar whose adverse extreme traded past the origin, tolerance aside. */
    private Integer originBreachedAtBar;

    private Long parentId;
    @Getter(lombok.AccessLevel.NONE)
    @Builder.Default
    private TreeSet<Long> childIds = new TreeSet<>();

    private final int createdAtBar;
    private int barCount;

    /**
     * Largest opposite-direction range whose pivot sat at this leg's origin
     * when the leg was created. Turn-limit ranking score.
     */
    private double originCounterTrendRange;

    /**
     * Largest turn scale (new counter leg range) this leg has survived.
     */
    private double turnSurvivalScale;

    @Builder.Default
    private RunningMoments moments = new RunningMoments();
    private Double impulsiveness;

    // ========== Derived ==========

    public double getRange() {
        return Math.abs(pivotPrice - originPrice);
    }

    public ReferenceFrame frame() {
        return ReferenceFrame.of(this);
    }

    /**
     * Points per bar from origin to pivot.
     */
    public double getImpulse() {
        int bars = pivotIndex - originIndex;
        return bars > 0 ? getRange() / bars : 0.0;
    }

    public Double getSpikiness() {
        return moments.spikiness();
    }

    public boolean isLive() {
        return status.isLive();
    }

    public boolean isActive() {
        return status == LegStatus.ACTIVE;
    }

    public boolean isOriginBreached() {
        return maxOriginBreach != null;
    }

    public boolean isRoot() {
        return parentId == null;
    }

    public NavigableSet<Long> getChildIds() {
        return Collections.unmodifiableNavigableSet(childIds);
    }

    // ========== Mutation ==========

    /**
     * Moves the pivot to a new favorable extreme.
     *
     * @throws InvariantViolationException if the leg is not ACTIVE, its origin
     *         was breached, or the price does not lie beyond the current pivot
     */
    public void extendPivot(double price, int barIndex) {
        if (status != LegStatus.ACTIVE || maxOriginBreach != null) {
            throw new InvariantViolationException(
                    "Pivot extension on leg " + id + " with status " + status + " and origin breach " + maxOriginBreach);
        }
        if (frame().ratio(price) <= 1.0) {
            throw new InvariantViolationException(
                    "Pivot of leg " + id + " would retreat from " + pivotPrice + " to " + price);
        }
        this.pivotPrice = price;
        this.pivotIndex = barIndex;
    }

    /**
     * Records an origin breach distance. The first call turns the leg INVALIDATED
     * and freezes the pivot; later calls only raise the running maximum.
     *
     * @return true if this call invalidated the leg
     */
    public boolean recordOriginBreach(double distance) {
        if (maxOriginBreach == null) {
            maxOriginBreach = distance;
            status = LegStatus.INVALIDATED;
            return true;
        }
        if (distance > maxOriginBreach) {
            maxOriginBreach = distance;
        }
        return false;
    }

    /**
     * @return true if this is the first bar trading past the origin
     */
    public boolean markOriginBreachedAt(int barIndex) {
        if (originBreachedAtBar != null) {
            return false;
        }
        originBreachedAtBar = barIndex;
        return true;
    }

    /**
     * Records a pivot breach distance. Only formed legs with a breached origin
     * track it: before that the pivot either extends or is not yet a
     * structural reference.
     *
     * @return true if this is the first pivot breach of the leg
     */
    public boolean recordPivotBreach(double distance) {
        if (!formed || maxOriginBreach == null) {
            throw new InvariantViolationException("Pivot breach recorded on leg " + id
                    + " with formed=" + formed + " and origin breach " + maxOriginBreach);
        }
        if (maxPivotBreach == null) {
            maxPivotBreach = distance;
            return true;
        }
        if (distance > maxPivotBreach) {
            maxPivotBreach = distance;
        }
        return false;
    }

    public void markFormed(int barIndex) {
        if (formed) {
            throw new InvariantViolationException("Leg " + id + " already formed at bar " + formedAtBar);
        }
        formed = true;
        formedAtBar = barIndex;
    }

    public void markRemoved(LegStatus terminalStatus) {
        if (terminalStatus.isLive()) {
            throw new IllegalArgumentException("Not a terminal status: " + terminalStatus);
        }
        status = terminalStatus;
    }

    public void assignParent(Long newParentId) {
        if (newParentId != null && newParentId == id) {
            throw new InvariantViolationException("Leg " + id + " cannot be its own parent");
        }
        parentId = newParentId;
    }

    public void addChild(long childId) {
        childIds.add(childId);
    }

    public void removeChild(long childId) {
        childIds.remove(childId);
    }

    public void recordTurnSurvival(double scale) {
        turnSurvivalScale = Math.max(turnSurvivalScale, scale);
    }

    public void setOriginCounterTrendRange(double range) {
        originCounterTrendRange = range;
    }

    public void setImpulsiveness(Double impulsiveness) {
        this.impulsiveness = impulsiveness;
    }

    /**
     * Feeds one bar contribution into the impulse moments and counts the bar.
     */
    public void recordContribution(double contribution) {
        moments.add(contribution);
        barCount++;
    }
}
