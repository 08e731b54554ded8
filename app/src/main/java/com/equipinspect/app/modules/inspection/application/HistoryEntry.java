package com.equipinspect.app.modules.inspection.application;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import com.equipinspect.app.modules.inspection.domain.HistoryAction;
import com.equipinspect.app.modules.inspection.domain.InspectionHistory;

public record HistoryEntry(
        Long id,
        Long recordId,
        HistoryAction action,
        Map<String, String> previousValues,
        Map<String, String> newValues,
        OffsetDateTime changedAt
) {

    public HistoryEntry {
        previousValues = previousValues == null ? Map.of() : Collections.unmodifiableMap(previousValues);
        newValues = newValues == null ? Map.of() : Collections.unmodifiableMap(newValues);
    }

    static HistoryEntry from(InspectionHistory history) {
        return new HistoryEntry(
                history.getId(),
                history.getRecordId(),
                history.getAction(),
                history.getPreviousValues(),
                history.getNewValues(),
                history.getChangedAt()
        );
    }

    /**
     * Names of the fields whose value differs between the two snapshots, in field order.
     */
    public List<String> changedFields() {
        Set<String> names = new LinkedHashSet<>(previousValues.keySet());
        names.addAll(newValues.keySet());
        List<String> changed = new ArrayList<>();
        for (String name : names) {
            if (!Objects.equals(previousValues.get(name), newValues.get(name))) {
                changed.add(name);
            }
        }
        return changed;
    }
}
