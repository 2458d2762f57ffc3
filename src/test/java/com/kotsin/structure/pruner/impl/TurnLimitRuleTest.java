package com.kotsin.structure.pruner.impl;

import com.kotsin.structure.config.DetectionConfig;
import com.kotsin.structure.hierarchy.LegHierarchy;
import com.kotsin.structure.model.Direction;
import com.kotsin.structure.model.Leg;
import com.kotsin.structure.pruner.PruneDecision;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static com.kotsin.structure.pruner.PruneFixtures.context;
import static com.kotsin.structure.pruner.PruneFixtures.leg;
import static org.junit.jupiter.api.Assertions.*;

class TurnLimitRuleTest {

    private final TurnLimitRule rule = new TurnLimitRule();

    private LegHierarchy hierarchy;
    private DetectionConfig config;
    private List<Leg> bearLegs;
    private Leg turn;

    /**
     * Five bear legs ending at 100 @ bar 10 with counter-trend scores
     * 5, 1, 4, 2, 3; a bull leg 100 -> 110 starting at that pivot forms
     * at bar 17.
     */
    @BeforeEach
    void setUp() {
        hierarchy = new LegHierarchy();
        config = DetectionConfig.defaults();
        config.getBear().setMaxLegsPerTurn(3);

        double[] scores = {5, 1, 4, 2, 3};
        bearLegs = new ArrayList<>();
        for (int i = 0; i < scores.length; i++) {
            Leg bear = Leg.builder()
                    .id(hierarchy.allocateId())
                    .direction(Direction.BEAR)
                    .originPrice(105 + i)
                    .originIndex(i)
                    .pivotPrice(100)
                    .pivotIndex(10)
                    .originCounterTrendRange(scores[i])
                    .build();
            hierarchy.add(bear, null);
            bearLegs.add(bear);
        }
        turn = leg(hierarchy.allocateId(), Direction.BULL, 100, 10, 110, 15);
        hierarchy.add(turn, null);
        turn.markFormed(17);
    }

    @Test
    @DisplayName("Lowest-ranked counter legs beyond the limit are pruned")
    void testEvaluate_PrunesBeyondLimit() {
        List<PruneDecision> decisions = rule.evaluate(context(hierarchy, config, 17, List.of(turn)));

        assertEquals(List.of(2L, 4L), decisions.stream().map(d -> d.getLeg().getId()).toList());
        for (long survivor : List.of(1L, 3L, 5L)) {
            assertEquals(10.0, hierarchy.get(survivor).getTurnSurvivalScale(), 1e-9);
        }
        assertEquals(0.0, hierarchy.get(2L).getTurnSurvivalScale(), 1e-9);
    }

    @Test
    @DisplayName("Formed legs beyond the limit are kept")
    void testEvaluate_FormedExempt() {
        bearLegs.get(1).markFormed(12);

        List<PruneDecision> decisions = rule.evaluate(context(hierarchy, config, 17, List.of(turn)));

        assertEquals(List.of(4L), decisions.stream().map(d -> d.getLeg().getId()).toList());
    }

    @Test
    @DisplayName("A leg that survived a larger turn is exempt")
    void testEvaluate_LargerSurvivalExempt() {
        bearLegs.get(3).recordTurnSurvival(20.0);

        List<PruneDecision> decisions = rule.evaluate(context(hierarchy, config, 17, List.of(turn)));

        assertEquals(List.of(2L), decisions.stream().map(d -> d.getLeg().getId()).toList());
    }

    @Test
    @DisplayName("Nothing happens without a leg formed this bar")
    void testEvaluate_NoFormedLeg() {
        assertTrue(rule.evaluate(context(hierarchy, config, 17)).isEmpty());
        assertEquals(0.0, hierarchy.get(1L).getTurnSurvivalScale(), 1e-9);
    }

    @Test
    @DisplayName("Turn scale is the forming leg's range at formation")
    void testEvaluate_ScaleFromFormingLeg() {
        Leg extended = leg(hierarchy.allocateId(), Direction.BULL, 100, 10, 125, 19);
        hierarchy.add(extended, null);
        extended.markFormed(21);

        List<PruneDecision> decisions = rule.evaluate(context(hierarchy, config, 21, List.of(extended)));

        assertEquals(List.of(2L, 4L), decisions.stream().map(d -> d.getLeg().getId()).toList());
        assertEquals(25.0, hierarchy.get(1L).getTurnSurvivalScale(), 1e-9);
    }
}
