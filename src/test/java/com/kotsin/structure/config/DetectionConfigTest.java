package com.kotsin.structure.config;

import com.kotsin.structure.exception.InvalidConfigurationException;
import com.kotsin.structure.model.Direction;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class DetectionConfigTest {

    @Test
    @DisplayName("Defaults are valid")
    void testDefaults_Valid() {
        DetectionConfig config = DetectionConfig.defaults();

        assertTrue(config.collectErrors().isEmpty());
        assertEquals(2, config.getLookback());
        assertEquals(0.382, config.forDirection(Direction.BULL).getFormationThreshold(), 1e-9);
        assertEquals(0.236, config.forDirection(Direction.BEAR).getEngulfmentThreshold(), 1e-9);
        assertEquals(10, config.getBear().getMaxLegsPerTurn());
        assertFalse(config.getBull().isInnerStructureEnabled());
        assertEquals(config.getMaxPairDistance() + config.getLookback() + 1, config.barWindowSize());
    }

    @Test
    @DisplayName("Every problem is reported with its property path")
    void testValidate_CollectsAll() {
        DetectionConfig config = DetectionConfig.defaults();
        config.setLookback(0);
        config.setStaleExtension(-1);
        config.getBull().setFormationThreshold(1.5);
        config.getBear().setMaxLegsPerTurn(0);

        InvalidConfigurationException ex = assertThrows(InvalidConfigurationException.class, config::validate);

        assertTrue(ex.getErrors().size() >= 4);
        assertTrue(ex.getErrors().stream().anyMatch(e -> e.startsWith("structure.detection.lookback")));
        assertTrue(ex.getErrors().stream().anyMatch(e -> e.startsWith("structure.detection.stale-extension")));
        assertTrue(ex.getErrors().stream().anyMatch(e -> e.startsWith("structure.detection.bull")));
        assertTrue(ex.getErrors().stream().anyMatch(e -> e.startsWith("structure.detection.bear")));
    }

    @Test
    @DisplayName("Pair distance shorter than the lookback is refused")
    void testValidate_PairDistanceBelowLookback() {
        DetectionConfig config = DetectionConfig.defaults();
        config.setLookback(5);
        config.setMaxPairDistance(3);

        assertEquals(1, config.collectErrors().size());
    }

    @Test
    @DisplayName("Copies are deep")
    void testCopy_Deep() {
        DetectionConfig config = DetectionConfig.defaults();
        DetectionConfig copy = config.copy();
        copy.getBull().setProximityTolerance(0.5);
        copy.setLookback(4);

        assertEquals(0.02, config.getBull().getProximityTolerance(), 1e-9);
        assertEquals(2, config.getLookback());
        assertEquals(config.getBear(), copy.getBear());
    }
}
