package com.equipinspect.app.modules.inspection.domain;

import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import com.equipinspect.app.global.jpa.AbstractAuditedEntity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

/**
 * One equipment inspection. The TAG and the next inspection date are derived values: they only
 * change through {@link #revise}, which receives them already computed from the form.
 */
@Entity
@Table(name = "inspection_record")
public class InspectionRecord extends AbstractAuditedEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", nullable = false, updatable = false)
    private Long id;

    @Column(name = "platform", nullable = false, length = 32)
    private String platform;

    @Column(name = "module_code", nullable = false, length = 32)
    private String module;

    @Column(name = "sector", nullable = false, length = 32)
    private String sector;

    @Column(name = "equipment_type", nullable = false, length = 64)
    private String equipmentType;

    @Column(name = "sequence_no", nullable = false)
    private int sequence;

    @Column(name = "tag", nullable = false, length = 128)
    private String tag;

    @Column(name = "inspection_date", nullable = false)
    private LocalDate inspectionDate;

    @Column(name = "next_inspection_date", nullable = false)
    private LocalDate nextInspectionDate;

    @Column(name = "defect", length = 64)
    private String defect;

    @Column(name = "cause", length = 64)
    private String cause;

    @Column(name = "rti_category", length = 16)
    private String rtiCategory;

    @Column(name = "recommendation", length = 64)
    private String recommendation;

    @Column(name = "damage_type", length = 32)
    private String damageType;

    @Column(name = "notes", length = 4000)
    private String notes;

    @Column(name = "photo_original_path", length = 512)
    private String photoOriginalPath;

    @Column(name = "photo_optimized_path", length = 512)
    private String photoOptimizedPath;

    @Column(name = "photo_thumbnail_path", length = 512)
    private String photoThumbnailPath;

    /**
     * Replaces every user-entered field together with the values derived from them.
     */
    public void revise(InspectionForm form, String tag, LocalDate nextInspectionDate) {
        Objects.requireNonNull(form, "form is required");
        this.platform = form.platform();
        this.module = form.module();
        this.sector = form.sector();
        this.equipmentType = form.equipmentType();
        this.sequence = form.sequence();
        this.inspectionDate = form.inspectionDate();
        this.tag = Objects.requireNonNull(tag, "tag is required");
        this.nextInspectionDate = Objects.requireNonNull(nextInspectionDate, "nextInspectionDate is required");
        InspectionFindings findings = form.findings();
        this.defect = findings.defect();
        this.cause = findings.cause();
        this.rtiCategory = findings.rtiCategory();
        this.recommendation = findings.recommendation();
        this.damageType = findings.damageType();
        this.notes = form.notes();
    }

    public void attachPhoto(PhotoReference photo) {
        Objects.requireNonNull(photo, "photo is required");
        this.photoOriginalPath = photo.originalPath();
        this.photoOptimizedPath = photo.optimizedPath();
        this.photoThumbnailPath = photo.thumbnailPath();
    }

    /**
     * Field values recorded in the history log, in a stable order.
     */
    public Map<String, String> auditValues() {
        Map<String, String> values = new LinkedHashMap<>();
        values.put("platform", platform);
        values.put("module", module);
        values.put("sector", sector);
        values.put("equipmentType", equipmentType);
        values.put("sequence", String.valueOf(sequence));
        values.put("tag", tag);
        values.put("inspectionDate", toText(inspectionDate));
        values.put("nextInspectionDate", toText(nextInspectionDate));
        values.put("defect", defect);
        values.put("cause", cause);
        values.put("rtiCategory", rtiCategory);
        values.put("recommendation", recommendation);
        values.put("damageType", damageType);
        values.put("notes", notes);
        values.put("photoOriginalPath", photoOriginalPath);
        values.put("photoOptimizedPath", photoOptimizedPath);
        values.put("photoThumbnailPath", photoThumbnailPath);
        values.put("deletedAt", toText(getDeletedAt()));
        return values;
    }

    private static String toText(Object value) {
        return value == null ? null : value.toString();
    }

    public Long getId() {
        return id;
    }

    public String getPlatform() {
        return platform;
    }

    public String getModule() {
        return module;
    }

    public String getSector() {
        return sector;
    }

    public String getEquipmentType() {
        return equipmentType;
    }

    public int getSequence() {
        return sequence;
    }

    public String getTag() {
        return tag;
    }

    public LocalDate getInspectionDate() {
        return inspectionDate;
    }

    public LocalDate getNextInspectionDate() {
        return nextInspectionDate;
    }

    public InspectionFindings getFindings() {
        return new InspectionFindings(defect, cause, rtiCategory, recommendation, damageType);
    }

    public String getNotes() {
        return notes;
    }

    public PhotoReference getPhoto() {
        if (photoOriginalPath == null && photoOptimizedPath == null) {
            return null;
        }
        return new PhotoReference(photoOriginalPath, photoOptimizedPath, photoThumbnailPath);
    }
}
