package com.kotsin.structure.stats;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class RunningMomentsTest {

    @Test
    @DisplayName("Spikiness undefined below three samples")
    void testSpikiness_TooFewSamples() {
        RunningMoments moments = new RunningMoments();
        moments.add(1.0);
        moments.add(2.0);
        assertNull(moments.spikiness());
    }

    @Test
    @DisplayName("Identical contributions are neutral (50)")
    void testSpikiness_ZeroVariance() {
        RunningMoments moments = new RunningMoments();
        for (int i = 0; i < 5; i++) {
            moments.add(2.0);
        }
        assertEquals(50.0, moments.spikiness(), 1e-12);
    }

    @Test
    @DisplayName("Symmetric contributions are neutral, one outlier bar is spiky")
    void testSpikiness_Skew() {
        RunningMoments symmetric = new RunningMoments();
        symmetric.add(-1.0);
        symmetric.add(0.0);
        symmetric.add(1.0);
        assertEquals(50.0, symmetric.spikiness(), 1e-9);

        RunningMoments spiky = new RunningMoments();
        for (int i = 0; i < 9; i++) {
            spiky.add(0.1);
        }
        spiky.add(10.0);
        assertTrue(spiky.spikiness() > 90.0, "one large bar drives the move: " + spiky.spikiness());

        RunningMoments negative = new RunningMoments();
        for (int i = 0; i < 9; i++) {
            negative.add(1.0);
        }
        negative.add(-10.0);
        assertTrue(negative.spikiness() < 10.0, "left-skewed: " + negative.spikiness());
    }

    @Test
    @DisplayName("Copy is independent")
    void testCopy() {
        RunningMoments moments = new RunningMoments();
        moments.add(1.0);
        RunningMoments copy = moments.copy();
        copy.add(2.0);

        assertEquals(1, moments.getCount());
        assertEquals(2, copy.getCount());
        assertEquals(3.0, copy.getSumX(), 1e-12);
    }
}
