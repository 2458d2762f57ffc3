package com.kotsin.structure.event;

public enum StructureEventType {
    LEG_CREATED,
    LEG_EXTENDED,
    SWING_FORMED,
    ORIGIN_BREACHED,
    LEG_INVALIDATED,
    PIVOT_BREACHED,
    LEVEL_CROSS,
    LEG_PRUNED,
    LEG_STALE
}
