package com.kotsin.structure.event;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.kotsin.structure.model.Direction;
import com.kotsin.structure.model.Leg;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Structural event emitted by the detector.
 *
 * childIds are captured when the event is built; for removals that is
 * before the children get reparented.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class StructureEvent {

    private StructureEventType type;
    private int barIndex;
    private long timestamp;
    private long legId;
    private Direction direction;
    private Long parentId;
    private List<Long> childIds;

    // Only for LEG_PRUNED / LEG_STALE
    private PruneReason reason;

    /** Price relevant to the event (new pivot, breach extreme, formation close). */
    private Double price;

    // Only for ORIGIN_BREACHED / PIVOT_BREACHED: distance past the anchor
    private Double breachAmount;

    // Only for LEVEL_CROSS: Fibonacci bands in the swing frame
    private Double level;
    private Double previousLevel;

    private String detail;

    public static StructureEvent of(StructureEventType type, Leg leg, int barIndex, long timestamp) {
        return StructureEvent.builder()
                .type(type)
                .barIndex(barIndex)
                .timestamp(timestamp)
                .legId(leg.getId())
                .direction(leg.getDirection())
                .parentId(leg.getParentId())
                .childIds(new ArrayList<>(leg.getChildIds()))
                .build();
    }
}
