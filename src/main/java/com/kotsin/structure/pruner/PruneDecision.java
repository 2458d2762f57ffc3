package com.kotsin.structure.pruner;

import com.kotsin.structure.event.PruneReason;
import com.kotsin.structure.model.Leg;
import lombok.AllArgsConstructor;
import lombok.Data;

@Data
@AllArgsConstructor
public class PruneDecision {

    private Leg leg;
    private PruneReason reason;
    private String detail;

    public static PruneDecision prune(Leg leg, PruneReason reason, String detail) {
        return new PruneDecision(leg, reason, detail);
    }
}
