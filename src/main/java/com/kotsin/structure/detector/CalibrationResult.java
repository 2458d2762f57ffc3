package com.kotsin.structure.detector;

import com.kotsin.structure.event.StructureEvent;
import com.kotsin.structure.event.StructureEventType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CalibrationResult {

    private int barCount;
    private List<StructureEvent> events;
    private int activeLegCount;
    private int legCount;
    private int swingCount;
    private long elapsedMillis;

    public Map<StructureEventType, Integer> countByType() {
        Map<StructureEventType, Integer> counts = new EnumMap<>(StructureEventType.class);
        for (StructureEvent event : events) {
            counts.merge(event.getType(), 1, Integer::sum);
        }
        return counts;
    }
}
