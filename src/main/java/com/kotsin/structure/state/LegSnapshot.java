package com.kotsin.structure.state;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.kotsin.structure.model.Direction;
import com.kotsin.structure.model.Leg;
import com.kotsin.structure.model.LegStatus;
import com.kotsin.structure.stats.RunningMoments;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.TreeSet;

/**
 * Serializable form of a {@link Leg}, every field included.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class LegSnapshot {

    private long id;
    private Direction direction;
    private double originPrice;
    private int originIndex;
    private double pivotPrice;
    private int pivotIndex;
    private LegStatus status;
    private boolean formed;
    private Integer formedAtBar;
    private Double maxOriginBreach;
    private Double maxPivotBreach;
    private Integer originBreachedAtBar;
    private Long parentId;
    private List<Long> childIds;
    private int createdAtBar;
    private int barCount;
    private double originCounterTrendRange;
    private double turnSurvivalScale;
    private RunningMoments moments;
    private Double impulsiveness;

    public static LegSnapshot from(Leg leg) {
        return LegSnapshot.builder()
                .id(leg.getId())
                .direction(leg.getDirection())
                .originPrice(leg.getOriginPrice())
                .originIndex(leg.getOriginIndex())
                .pivotPrice(leg.getPivotPrice())
                .pivotIndex(leg.getPivotIndex())
                .status(leg.getStatus())
                .formed(leg.isFormed())
                .formedAtBar(leg.getFormedAtBar())
                .maxOriginBreach(leg.getMaxOriginBreach())
                .maxPivotBreach(leg.getMaxPivotBreach())
                .originBreachedAtBar(leg.getOriginBreachedAtBar())
                .parentId(leg.getParentId())
                .childIds(new ArrayList<>(leg.getChildIds()))
                .createdAtBar(leg.getCreatedAtBar())
                .barCount(leg.getBarCount())
                .originCounterTrendRange(leg.getOriginCounterTrendRange())
                .turnSurvivalScale(leg.getTurnSurvivalScale())
                .moments(leg.getMoments().copy())
                .impulsiveness(leg.getImpulsiveness())
                .build();
    }

    public Leg toLeg() {
        return Leg.builder()
                .id(id)
                .direction(direction)
                .originPrice(originPrice)
                .originIndex(originIndex)
                .pivotPrice(pivotPrice)
                .pivotIndex(pivotIndex)
                .status(status)
                .formed(formed)
                .formedAtBar(formedAtBar)
                .maxOriginBreach(maxOriginBreach)
                .maxPivotBreach(maxPivotBreach)
                .originBreachedAtBar(originBreachedAtBar)
                .parentId(parentId)
                .childIds(childIds == null ? new TreeSet<>() : new TreeSet<>(childIds))
                .createdAtBar(createdAtBar)
                .barCount(barCount)
                .originCounterTrendRange(originCounterTrendRange)
                .turnSurvivalScale(turnSurvivalScale)
                .moments(moments == null ? new RunningMoments() : moments.copy())
                .impulsiveness(impulsiveness)
                .build();
    }
}
