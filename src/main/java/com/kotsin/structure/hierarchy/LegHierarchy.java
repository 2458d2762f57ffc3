package com.kotsin.structure.hierarchy;

import com.kotsin.structure.exception.InvariantViolationException;
import com.kotsin.structure.model.Direction;
import com.kotsin.structure.model.Leg;
import com.kotsin.structure.model.LegStatus;
import com.kotsin.structure.model.Swing;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * LegHierarchy - arena of live legs keyed by stable id, plus their swings.
 *
 * Parent/child links are ids. The only way out of the arena is
 * {@link #removeLeg}, which reattaches children to the removed leg's parent
 * in the same call.
 *
 * Iteration is always in ascending id order.
 */
@Slf4j
public class LegHierarchy {

    private final TreeMap<Long, Leg> legs = new TreeMap<>();
    private final TreeMap<Long, Swing> swings = new TreeMap<>();
    private long nextLegId;

    public LegHierarchy() {
        this(1L);
    }

    public LegHierarchy(long nextLegId) {
        this.nextLegId = nextLegId;
    }

    public long allocateId() {
        return nextLegId++;
    }

    public long getNextLegId() {
        return nextLegId;
    }

    // ========== Membership ==========

    /**
     * Adds a leg and links it under {@code parentId} (null for a root).
     */
    public void add(Leg leg, Long parentId) {
        if (legs.containsKey(leg.getId())) {
            throw new InvariantViolationException("Leg " + leg.getId() + " already in arena");
        }
        legs.put(leg.getId(), leg);
        attach(leg, parentId);
    }

    /**
     * Restores a leg with its pointers as-is. Call {@link #verifyIntegrity()}
     * once every leg is back.
     */
    public void restore(Leg leg) {
        legs.put(leg.getId(), leg);
        nextLegId = Math.max(nextLegId, leg.getId() + 1);
    }

    public void attach(Leg child, Long parentId) {
        Long previous = child.getParentId();
        if (previous != null && legs.containsKey(previous)) {
            legs.get(previous).removeChild(child.getId());
        }
        if (parentId == null) {
            child.assignParent(null);
            return;
        }
        Leg parent = legs.get(parentId);
        if (parent == null) {
            throw new InvariantViolationException("Parent " + parentId + " of leg " + child.getId() + " not in arena");
        }
        child.assignParent(parentId);
        parent.addChild(child.getId());
    }

    /**
     * Removes a leg in one step: children move to the leg's parent (or become
     * roots), the parent's child set is updated, the leg and its swing leave
     * the arena, and the leg takes its terminal status.
     *
     * @return the ids of the reparented children
     */
    public List<Long> removeLeg(Leg leg, LegStatus terminalStatus) {
        if (!legs.containsKey(leg.getId())) {
            throw new InvariantViolationException("Leg " + leg.getId() + " not in arena");
        }
        Long grandparentId = leg.getParentId();
        Leg grandparent = grandparentId == null ? null : legs.get(grandparentId);
        if (grandparentId != null && grandparent == null) {
            throw new InvariantViolationException("Leg " + leg.getId() + " has dangling parent " + grandparentId);
        }

        List<Long> children = new ArrayList<>(leg.getChildIds());
        for (Long childId : children) {
            Leg child = legs.get(childId);
            if (child == null) {
                throw new InvariantViolationException("Leg " + leg.getId() + " lists missing child " + childId);
            }
            child.assignParent(grandparentId);
            leg.removeChild(childId);
            if (grandparent != null) {
                grandparent.addChild(childId);
            }
        }
        if (grandparent != null) {
            grandparent.removeChild(leg.getId());
        }

        legs.remove(leg.getId());
        swings.remove(leg.getId());
        leg.markRemoved(terminalStatus);

        log.debug("Removed leg {} as {} | children {} -> parent {}",
                leg.getId(), terminalStatus, children, grandparentId);
        return children;
    }

    // ========== Lookup ==========

    public Leg get(long id) {
        return legs.get(id);
    }

    public boolean contains(long id) {
        return legs.containsKey(id);
    }

    public Collection<Leg> legs() {
        return Collections.unmodifiableCollection(legs.values());
    }

    /**
     * Stable copy for loops that may remove legs.
     */
    public List<Leg> legsSnapshot() {
        return new ArrayList<>(legs.values());
    }

    public List<Leg> liveLegs(Direction direction) {
        List<Leg> out = new ArrayList<>();
        for (Leg leg : legs.values()) {
            if (leg.getDirection() == direction && leg.isLive()) {
                out.add(leg);
            }
        }
        return out;
    }

    public List<Leg> activeLegs() {
        List<Leg> out = new ArrayList<>();
        for (Leg leg : legs.values()) {
            if (leg.isActive()) {
                out.add(leg);
            }
        }
        return out;
    }

    /**
     * Hierarchy depth from the roots, 0 for a root.
     */
    public int depth(Leg leg) {
        int depth = 0;
        Long cursor = leg.getParentId();
        while (cursor != null) {
            depth++;
            if (depth > legs.size()) {
                throw new InvariantViolationException("Cycle above leg " + leg.getId());
            }
            Leg parent = legs.get(cursor);
            cursor = parent == null ? null : parent.getParentId();
        }
        return depth;
    }

    public int size() {
        return legs.size();
    }

    // ========== Swings ==========

    public void putSwing(Swing swing) {
        if (!legs.containsKey(swing.getLegId())) {
            throw new InvariantViolationException("Swing for leg " + swing.getLegId() + " which is not in arena");
        }
        swings.put(swing.getLegId(), swing);
    }

    public Swing swing(long legId) {
        return swings.get(legId);
    }

    public Collection<Swing> swings() {
        return Collections.unmodifiableCollection(swings.values());
    }

    // ========== Integrity ==========

    /**
     * Acyclic, every parent present, parent and child sets agree, every swing
     * anchored to a leg in the arena.
     *
     * @throws InvariantViolationException on the first problem found
     */
    public void verifyIntegrity() {
        for (Map.Entry<Long, Leg> e : legs.entrySet()) {
            Leg leg = e.getValue();
            if (!leg.isLive()) {
                throw new InvariantViolationException("Leg " + leg.getId() + " in arena with status " + leg.getStatus());
            }
            Long parentId = leg.getParentId();
            if (parentId != null) {
                Leg parent = legs.get(parentId);
                if (parent == null) {
                    throw new InvariantViolationException("Leg " + leg.getId() + " has dangling parent " + parentId);
                }
                if (!parent.getChildIds().contains(leg.getId())) {
                    throw new InvariantViolationException("Parent " + parentId + " does not list child " + leg.getId());
                }
            }
            for (Long childId : leg.getChildIds()) {
                Leg child = legs.get(childId);
                if (child == null || !Long.valueOf(leg.getId()).equals(child.getParentId())) {
                    throw new InvariantViolationException("Leg " + leg.getId() + " lists child " + childId
                            + " which does not point back");
                }
            }
            assertNoCycle(leg);
        }
        for (Swing swing : swings.values()) {
            if (!legs.containsKey(swing.getLegId())) {
                throw new InvariantViolationException("Orphaned swing for removed leg " + swing.getLegId());
            }
        }
    }

    private void assertNoCycle(Leg start) {
        Set<Long> seen = new HashSet<>();
        Long cursor = start.getId();
        while (cursor != null) {
            if (!seen.add(cursor)) {
                throw new InvariantViolationException("Cycle through leg " + cursor);
            }
            Leg leg = legs.get(cursor);
            cursor = leg == null ? null : leg.getParentId();
        }
    }
}
