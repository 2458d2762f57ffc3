package com.kotsin.structure.event;

import com.kotsin.structure.model.LegStatus;

/**
 * Why a leg left the arena. STALE maps to {@link StructureEventType#LEG_STALE},
 * everything else to {@link StructureEventType#LEG_PRUNED}.
 */
public enum PruneReason {
    ENGULFED,
    STALE,
    TURN_LIMIT,
    PROXIMITY,
    INNER_STRUCTURE;

    public LegStatus terminalStatus() {
        return this == STALE ? LegStatus.STALE : LegStatus.PRUNED;
    }

    public StructureEventType eventType() {
        return this == STALE ? StructureEventType.LEG_STALE : StructureEventType.LEG_PRUNED;
    }
}
