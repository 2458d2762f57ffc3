package com.kotsin.structure.pruner;

import com.kotsin.structure.config.DetectionConfig;
import com.kotsin.structure.hierarchy.LegHierarchy;
import com.kotsin.structure.model.Bar;
import com.kotsin.structure.model.Leg;
import lombok.Builder;
import lombok.Getter;

import java.util.List;

/**
 * State handed to prune rules for one bar.
 */
@Getter
@Builder
public class PruneContext {

    private final Bar bar;
    private final LegHierarchy hierarchy;
    private final DetectionConfig config;

    /** Legs that formed at this bar, ascending id. */
    private final List<Leg> formedThisBar;

    public int getBarIndex() {
        return bar.getIndex();
    }
}
