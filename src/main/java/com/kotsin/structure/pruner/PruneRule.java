package com.kotsin.structure.pruner;

import com.kotsin.structure.event.PruneReason;

import java.util.List;

/**
 * PruneRule - one elimination rule run by {@link LegPruner}.
 *
 * Rules only report decisions. The pruner performs removals, so a rule sees
 * the arena as left by the rules before it.
 */
public interface PruneRule {

    String getName();

    PruneReason getReason();

    /**
     * @return legs to remove this bar, each at most once
     */
    List<PruneDecision> evaluate(PruneContext context);
}
