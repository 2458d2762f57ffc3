package com.kotsin.structure.pruner;

import com.kotsin.structure.event.StructureEvent;
import com.kotsin.structure.hierarchy.LegHierarchy;
import com.kotsin.structure.model.Leg;
import com.kotsin.structure.pruner.impl.DominationRule;
import com.kotsin.structure.pruner.impl.EngulfmentRule;
import com.kotsin.structure.pruner.impl.InnerStructureRule;
import com.kotsin.structure.pruner.impl.ProximityRule;
import com.kotsin.structure.pruner.impl.StalenessRule;
import com.kotsin.structure.pruner.impl.TurnLimitRule;
import com.kotsin.structure.stats.ScaleStatistics;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * LegPruner - runs the prune rules after the detector, in a fixed order:
 *
 * 1. Engulfment
 * 2. Staleness
 * 3. Turn-limit
 * 4. Proximity
 * 5. Domination (creation-time veto, see {@link #getDominationRule()})
 * 6. Inner-structure
 *
 * Each rule's decisions are applied before the next rule runs, so later rules
 * never see a leg removed earlier in the bar. Removal always goes through
 * {@link LegHierarchy#removeLeg}.
 */
@Slf4j
public class LegPruner {

    private final List<PruneRule> rules;
    private final DominationRule dominationRule;

    public LegPruner() {
        this(List.of(
                new EngulfmentRule(),
                new StalenessRule(),
                new TurnLimitRule(),
                new ProximityRule(),
                new InnerStructureRule()), new DominationRule());
    }

    public LegPruner(List<PruneRule> rules, DominationRule dominationRule) {
        this.rules = new ArrayList<>(rules);
        this.dominationRule = dominationRule;
    }

    /**
     * Applies every rule and returns the removal events, rule order first,
     * ascending leg id within a rule.
     */
    public List<StructureEvent> prune(PruneContext context, ScaleStatistics statistics) {
        List<StructureEvent> events = new ArrayList<>();
        LegHierarchy hierarchy = context.getHierarchy();

        for (PruneRule rule : rules) {
            List<PruneDecision> decisions = rule.evaluate(context);
            for (PruneDecision decision : decisions) {
                Leg leg = decision.getLeg();
                if (!hierarchy.contains(leg.getId())) {
                    continue;
                }

                StructureEvent event = StructureEvent.of(decision.getReason().eventType(), leg,
                        context.getBarIndex(), context.getBar().getTimestamp());
                event.setReason(decision.getReason());
                event.setDetail(decision.getDetail());

                statistics.onLegRemoved(leg);
                hierarchy.removeLeg(leg, decision.getReason().terminalStatus());
                events.add(event);

                log.debug("[{}] bar={} leg={} {} formed={} | {}", rule.getName(), context.getBarIndex(),
                        leg.getId(), leg.getDirection(), leg.isFormed(), decision.getDetail());
            }
        }
        return events;
    }

    public DominationRule getDominationRule() {
        return dominationRule;
    }

    public List<PruneRule> getRules() {
        return Collections.unmodifiableList(rules);
    }
}
