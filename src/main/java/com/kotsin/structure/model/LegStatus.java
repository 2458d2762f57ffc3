package com.kotsin.structure.model;

/**
 * Leg lifecycle.
 *
 * ACTIVE -> INVALIDATED -> STALE
 * ACTIVE/INVALIDATED -> PRUNED
 *
 * STALE and PRUNED are terminal: the leg has left the arena.
 */
public enum LegStatus {
    ACTIVE,
    INVALIDATED,
    STALE,
    PRUNED;

    public boolean isLive() {
        return this == ACTIVE || this == INVALIDATED;
    }
}
