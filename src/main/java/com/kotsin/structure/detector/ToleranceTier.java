package com.kotsin.structure.detector;

/**
 * Invalidation tolerance tier of an ACTIVE leg at a given bar.
 */
public enum ToleranceTier {
    /** Not formed yet: any close past the origin invalidates. */
    UNFORMED,
    /** Formed and among the largest live legs of its direction. */
    BIG,
    /** Formed, one or two levels below a big leg. */
    CHILD_OF_BIG,
    /** Any other formed leg: any close past the origin invalidates. */
    STANDARD
}
