package com.equipinspect.app.modules.inspection.domain;

import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import com.equipinspect.app.global.jpa.JsonMapConverter;

import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

/**
 * Append-only audit entry: the record's field values before and after one write.
 */
@Entity
@Table(name = "inspection_history")
public class InspectionHistory {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", nullable = false, updatable = false)
    private Long id;

    @Column(name = "record_id", nullable = false, updatable = false)
    private Long recordId;

    @Enumerated(EnumType.STRING)
    @Column(name = "action_type", nullable = false, length = 16, updatable = false)
    private HistoryAction action;

    @Convert(converter = JsonMapConverter.class)
    @Column(name = "previous_values", updatable = false)
    private Map<String, String> previousValues;

    @Convert(converter = JsonMapConverter.class)
    @Column(name = "new_values", updatable = false)
    private Map<String, String> newValues;

    @Column(name = "changed_at", nullable = false, updatable = false)
    private OffsetDateTime changedAt;

    protected InspectionHistory() {
    }

    public InspectionHistory(
            Long recordId,
            HistoryAction action,
            Map<String, String> previousValues,
            Map<String, String> newValues,
            OffsetDateTime changedAt
    ) {
        this.recordId = Objects.requireNonNull(recordId, "recordId is required");
        this.action = Objects.requireNonNull(action, "action is required");
        this.previousValues = previousValues == null ? new LinkedHashMap<>() : new LinkedHashMap<>(previousValues);
        this.newValues = newValues == null ? new LinkedHashMap<>() : new LinkedHashMap<>(newValues);
        this.changedAt = Objects.requireNonNull(changedAt, "changedAt is required");
    }

    public Long getId() {
        return id;
    }

    public Long getRecordId() {
        return recordId;
    }

    public HistoryAction getAction() {
        return action;
    }

    public Map<String, String> getPreviousValues() {
        return previousValues;
    }

    public Map<String, String> getNewValues() {
        return newValues;
    }

    public OffsetDateTime getChangedAt() {
        return changedAt;
    }
}
