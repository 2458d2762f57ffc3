package com.kotsin.structure.pruner.impl;

import com.kotsin.structure.event.PruneReason;
import com.kotsin.structure.model.Leg;
import com.kotsin.structure.pruner.PruneContext;
import com.kotsin.structure.pruner.PruneDecision;
import com.kotsin.structure.pruner.PruneRule;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * TurnLimitRule - bounds the counter legs that end where a forming leg starts.
 *
 * For every leg that formed this bar, live counter-direction legs whose pivot
 * is the forming leg's origin are ranked by originCounterTrendRange (ties:
 * older first). The top maxLegsPerTurn survive and record the turn scale (the
 * forming leg's range). The rest are pruned unless formed, or unless they
 * already survived a larger turn. Legs that are created but never form do
 * not trigger a turn.
 *
 * Survivor bookkeeping happens during evaluation.
 */
@Slf4j
public class TurnLimitRule implements PruneRule {

    private static final Comparator<Leg> RANKING = Comparator
            .comparingDouble(Leg::getOriginCounterTrendRange).reversed()
            .thenComparingLong(Leg::getId);

    @Override
    public String getName() {
        return "TURN_LIMIT";
    }

    @Override
    public PruneReason getReason() {
        return PruneReason.TURN_LIMIT;
    }

    @Override
    public List<PruneDecision> evaluate(PruneContext context) {
        List<PruneDecision> decisions = new ArrayList<>();
        Set<Long> pruned = new HashSet<>();

        for (Leg forming : context.getFormedThisBar()) {
            if (!context.getHierarchy().contains(forming.getId())) {
                continue;
            }
            List<Leg> counters = new ArrayList<>();
            for (Leg leg : context.getHierarchy().liveLegs(forming.getDirection().opposite())) {
                if (!pruned.contains(leg.getId())
                        && leg.getPivotIndex() == forming.getOriginIndex()
                        && leg.getPivotPrice() == forming.getOriginPrice()) {
                    counters.add(leg);
                }
            }
            if (counters.isEmpty()) {
                continue;
            }

            double scale = forming.getRange();
            int limit = context.getConfig().forDirection(forming.getDirection().opposite()).getMaxLegsPerTurn();
            counters.sort(RANKING);

            for (int i = 0; i < counters.size(); i++) {
                Leg counter = counters.get(i);
                if (i < limit) {
                    counter.recordTurnSurvival(scale);
                } else if (counter.isFormed()) {
                    log.debug("Turn at leg {}: formed leg {} kept beyond limit {}", forming.getId(), counter.getId(), limit);
                } else if (counter.getTurnSurvivalScale() > scale) {
                    log.debug("Turn at leg {}: leg {} exempt, survived scale {} > {}",
                            forming.getId(), counter.getId(), counter.getTurnSurvivalScale(), scale);
                } else {
                    pruned.add(counter.getId());
                    decisions.add(PruneDecision.prune(counter, getReason(), String.format(
                            "turn at leg %d, rank %d of %d, score=%.4f",
                            forming.getId(), i + 1, counters.size(), counter.getOriginCounterTrendRange())));
                }
            }
        }
        decisions.sort(Comparator.comparingLong(d -> d.getLeg().getId()));
        return decisions;
    }
}
