package com.kotsin.structure.model;

/**
 * Mirror of the anchoring leg's status. Tracks the leg, never drives it.
 */
public enum SwingStatus {
    ACTIVE,
    INVALIDATED
}
