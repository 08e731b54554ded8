package com.equipinspect.app.modules.inspection.application;

import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.temporal.ChronoUnit;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import com.equipinspect.app.global.error.NotFoundException;
import com.equipinspect.app.global.error.StorageException;
import com.equipinspect.app.global.error.ValidationException;
import com.equipinspect.app.modules.catalog.domain.CatalogField;
import com.equipinspect.app.modules.catalog.domain.EquipmentType;
import com.equipinspect.app.modules.catalog.domain.OptionCatalog;
import com.equipinspect.app.modules.inspection.domain.HistoryAction;
import com.equipinspect.app.modules.inspection.domain.InspectionDateValidator;
import com.equipinspect.app.modules.inspection.domain.InspectionFindings;
import com.equipinspect.app.modules.inspection.domain.InspectionForm;
import com.equipinspect.app.modules.inspection.domain.InspectionHistory;
import com.equipinspect.app.modules.inspection.domain.InspectionRecord;
import com.equipinspect.app.modules.inspection.domain.PhotoReference;
import com.equipinspect.app.modules.inspection.infrastructure.persistence.InspectionHistoryRepository;
import com.equipinspect.app.modules.inspection.infrastructure.persistence.InspectionRecordRepository;
import com.equipinspect.app.modules.inspection.infrastructure.persistence.InspectionSearchCondition;
import com.equipinspect.app.modules.photo.application.PhotoHandler;
import com.equipinspect.app.modules.photo.domain.ProcessedPhoto;

import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

@Service
@Transactional
public class InspectionRecordService {

    private static final Logger log = LoggerFactory.getLogger(InspectionRecordService.class);

    private final InspectionRecordRepository inspectionRecordRepository;
    private final InspectionHistoryRepository inspectionHistoryRepository;
    private final OptionCatalog optionCatalog;
    private final InspectionDateValidator dateValidator;
    private final PhotoHandler photoHandler;
    private final Validator validator;
    private final Clock clock;

    public InspectionRecordService(
            InspectionRecordRepository inspectionRecordRepository,
            InspectionHistoryRepository inspectionHistoryRepository,
            OptionCatalog optionCatalog,
            InspectionDateValidator dateValidator,
            PhotoHandler photoHandler,
            Validator validator,
            Clock clock
    ) {
        this.inspectionRecordRepository = inspectionRecordRepository;
        this.inspectionHistoryRepository = inspectionHistoryRepository;
        this.optionCatalog = optionCatalog;
        this.dateValidator = dateValidator;
        this.photoHandler = photoHandler;
        this.validator = validator;
        this.clock = clock;
    }

    public InspectionSnapshot create(InspectionForm form) {
        LocalDate today = LocalDate.now(clock);
        InspectionForm normalized = normalize(form);
        DerivedValues derived = derive(normalized, today);

        InspectionRecord record = new InspectionRecord();
        record.revise(normalized, derived.tag(), derived.nextInspectionDate());
        InspectionRecord saved = saveRecord(record);
        appendHistory(saved.getId(), HistoryAction.CREATED, Map.of(), saved.auditValues());

        log.info("Created inspection record {} ({}), next inspection {}",
                saved.getId(), saved.getTag(), saved.getNextInspectionDate());
        return toSnapshot(saved, today);
    }

    public InspectionSnapshot update(Long recordId, InspectionForm form) {
        LocalDate today = LocalDate.now(clock);
        InspectionRecord record = loadActiveRecord(recordId);
        InspectionForm normalized = normalize(form);
        DerivedValues derived = derive(normalized, today);

        Map<String, String> previous = record.auditValues();
        record.revise(normalized, derived.tag(), derived.nextInspectionDate());
        InspectionRecord saved = saveRecord(record);
        appendHistory(saved.getId(), HistoryAction.UPDATED, previous, saved.auditValues());

        log.info("Updated inspection record {} ({})", saved.getId(), saved.getTag());
        return toSnapshot(saved, today);
    }

    @Transactional(readOnly = true)
    public InspectionSnapshot get(Long recordId) {
        return toSnapshot(loadActiveRecord(recordId), LocalDate.now(clock));
    }

    @Transactional(readOnly = true)
    public List<InspectionSnapshot> list(InspectionFilter filter) {
        InspectionFilter effective = filter == null ? InspectionFilter.all() : filter;
        dateValidator.validateRange(effective.inspectedFrom(), effective.inspectedTo());
        LocalDate today = LocalDate.now(clock);
        try {
            return inspectionRecordRepository.search(toCondition(effective, today)).stream()
                    .map(record -> toSnapshot(record, today))
                    .toList();
        } catch (DataAccessException ex) {
            throw new StorageException(StorageException.DATABASE_FAILURE, "Could not list inspection records", ex);
        }
    }

    public void softDelete(Long recordId) {
        InspectionRecord record = loadActiveRecord(recordId);
        Map<String, String> previous = record.auditValues();
        record.markDeleted(OffsetDateTime.now(clock));
        InspectionRecord saved = saveRecord(record);
        appendHistory(saved.getId(), HistoryAction.DELETED, previous, saved.auditValues());
        log.info("Soft-deleted inspection record {} ({})", saved.getId(), saved.getTag());
    }

    /**
     * Audit trail of a record in write order. Soft-deleted records keep theirs.
     */
    @Transactional(readOnly = true)
    public List<HistoryEntry> history(Long recordId) {
        Objects.requireNonNull(recordId, "recordId is required");
        try {
            if (!inspectionRecordRepository.existsById(recordId)) {
                throw new NotFoundException(recordId);
            }
            return inspectionHistoryRepository.findByRecordIdOrderByChangedAtAscIdAsc(recordId).stream()
                    .map(HistoryEntry::from)
                    .toList();
        } catch (DataAccessException ex) {
            throw new StorageException(StorageException.DATABASE_FAILURE,
                    "Could not read history of record " + recordId, ex);
        }
    }

    /**
     * Writes a fresh photo set first and only then points the record at it. If the database write
     * fails the new set is removed and the record keeps its previous photo files untouched; the
     * previous set is removed only after the write succeeded.
     */
    public InspectionSnapshot attachPhoto(Long recordId, Path photoFile) {
        InspectionRecord record = loadActiveRecord(recordId);
        PhotoReference previousPhoto = record.getPhoto();
        Map<String, String> previous = record.auditValues();

        ProcessedPhoto processed = photoHandler.process(photoFile, recordId);
        PhotoReference attached = processed.toReference();
        InspectionRecord saved;
        try {
            record.attachPhoto(attached);
            saved = saveRecord(record);
            appendHistory(saved.getId(), HistoryAction.PHOTO_ATTACHED, previous, saved.auditValues());
        } catch (RuntimeException ex) {
            discardNewPhoto(recordId, processed, ex);
            throw ex;
        }
        if (previousPhoto != null) {
            discardReplacedPhoto(recordId, previousPhoto);
        }

        log.info("Attached photo {} to inspection record {}", attached.originalPath(), recordId);
        return toSnapshot(saved, LocalDate.now(clock));
    }

    /**
     * Deletes photo files no stored record points at, such as sets left behind when a rollback
     * could not remove them.
     *
     * @return number of directories removed
     */
    @Transactional(readOnly = true)
    public int cleanupOrphanedPhotos() {
        List<InspectionRecord> records;
        try {
            records = inspectionRecordRepository.findAll();
        } catch (DataAccessException ex) {
            throw new StorageException(StorageException.DATABASE_FAILURE, "Could not load inspection records", ex);
        }
        Set<Long> recordIds = new HashSet<>();
        Set<Path> referencedSets = new HashSet<>();
        for (InspectionRecord record : records) {
            recordIds.add(record.getId());
            PhotoReference photo = record.getPhoto();
            if (photo != null && photo.originalPath() != null) {
                referencedSets.add(Path.of(photo.originalPath()).getParent());
            }
        }
        return photoHandler.cleanupOrphans(recordIds, referencedSets);
    }

    private InspectionRecord loadActiveRecord(Long recordId) {
        Objects.requireNonNull(recordId, "recordId is required");
        try {
            return inspectionRecordRepository.findByIdAndDeletedAtIsNull(recordId)
                    .orElseThrow(() -> new NotFoundException(recordId));
        } catch (DataAccessException ex) {
            throw new StorageException(StorageException.DATABASE_FAILURE, "Could not load record " + recordId, ex);
        }
    }

    private InspectionRecord saveRecord(InspectionRecord record) {
        try {
            return inspectionRecordRepository.saveAndFlush(record);
        } catch (DataAccessException ex) {
            throw new StorageException(StorageException.DATABASE_FAILURE, "Could not save inspection record", ex);
        }
    }

    private void appendHistory(
            Long recordId,
            HistoryAction action,
            Map<String, String> previousValues,
            Map<String, String> newValues
    ) {
        try {
            OffsetDateTime changedAt = nextHistoryTimestamp(recordId);
            inspectionHistoryRepository.saveAndFlush(
                    new InspectionHistory(recordId, action, previousValues, newValues, changedAt));
        } catch (DataAccessException ex) {
            throw new StorageException(StorageException.DATABASE_FAILURE,
                    "Could not append history for record " + recordId, ex);
        }
    }

    /**
     * Clock time at microsecond precision, nudged past the latest entry so a record's history
     * timestamps stay strictly increasing even when the clock does not move.
     */
    private OffsetDateTime nextHistoryTimestamp(Long recordId) {
        OffsetDateTime now = OffsetDateTime.now(clock).truncatedTo(ChronoUnit.MICROS);
        return inspectionHistoryRepository.findTopByRecordIdOrderByChangedAtDescIdDesc(recordId)
                .map(InspectionHistory::getChangedAt)
                .filter(last -> !now.isAfter(last))
                .map(last -> last.plus(1, ChronoUnit.MICROS))
                .orElse(now);
    }

    private DerivedValues derive(InspectionForm form, LocalDate today) {
        validateConstraints(form);

        requireCatalogValue(CatalogField.PLATFORM, form.platform());
        requireCatalogValue(CatalogField.MODULE, form.module());
        requireCatalogValue(CatalogField.SECTOR, form.sector());
        requireCatalogValue(CatalogField.EQUIPMENT_TYPE, form.equipmentType());

        EquipmentType type = optionCatalog.equipmentType(form.equipmentType());
        if (!type.acceptsSequence(form.sequence())) {
            throw new ValidationException(ValidationException.SEQUENCE_OUT_OF_RANGE, "sequence", form.sequence(),
                    "Sequence must be between 1 and " + type.maxSequence() + " for " + type.name());
        }

        InspectionFindings findings = form.findings();
        requireOptionalCatalogValue(CatalogField.DEFECT, findings.defect());
        requireOptionalCatalogValue(CatalogField.CAUSE, findings.cause());
        requireOptionalCatalogValue(CatalogField.RTI_CATEGORY, findings.rtiCategory());
        requireOptionalCatalogValue(CatalogField.RECOMMENDATION, findings.recommendation());
        requireOptionalCatalogValue(CatalogField.DAMAGE_TYPE, findings.damageType());

        dateValidator.validateInspectionDate(form.inspectionDate(), today);

        String tag = optionCatalog.tag(form.platform(), form.module(), form.sector(), form.equipmentType(),
                form.sequence());
        LocalDate next = dateValidator.computeNextInspection(form.inspectionDate(), form.equipmentType());
        return new DerivedValues(tag, next);
    }

    private void validateConstraints(InspectionForm form) {
        Set<ConstraintViolation<InspectionForm>> violations = validator.validate(form);
        violations.stream()
                .min(Comparator.comparing(violation -> violation.getPropertyPath().toString()))
                .ifPresent(violation -> {
                    String field = violation.getPropertyPath().toString();
                    throw new ValidationException(ValidationException.INVALID_FIELD, field,
                            violation.getInvalidValue(), field + " " + violation.getMessage());
                });
    }

    private void requireCatalogValue(CatalogField field, String value) {
        if (!optionCatalog.allows(field, value)) {
            throw new ValidationException(ValidationException.UNKNOWN_OPTION, field.fieldName(), value,
                    "Unknown " + field.fieldName() + " '" + value + "'");
        }
    }

    private void requireOptionalCatalogValue(CatalogField field, String value) {
        if (value != null) {
            requireCatalogValue(field, value);
        }
    }

    private static InspectionForm normalize(InspectionForm form) {
        Objects.requireNonNull(form, "form is required");
        InspectionFindings findings = form.findings();
        return new InspectionForm(
                trimToNull(form.platform()),
                trimToNull(form.module()),
                trimToNull(form.sector()),
                trimToNull(form.equipmentType()),
                form.sequence(),
                form.inspectionDate(),
                new InspectionFindings(
                        trimToNull(findings.defect()),
                        trimToNull(findings.cause()),
                        trimToNull(findings.rtiCategory()),
                        trimToNull(findings.recommendation()),
                        trimToNull(findings.damageType())
                ),
                trimToNull(form.notes())
        );
    }

    private InspectionSearchCondition toCondition(InspectionFilter filter, LocalDate today) {
        LocalDate nextDueFrom = null;
        LocalDate nextDueTo = null;
        if (filter.status() != null) {
            int window = dateValidator.getWarningWindowDays();
            switch (filter.status()) {
                case OVERDUE -> nextDueTo = today.minusDays(1);
                case DUE_SOON -> {
                    nextDueFrom = today;
                    nextDueTo = today.plusDays(window);
                }
                case OK -> nextDueFrom = today.plusDays(window + 1L);
            }
        }
        return new InspectionSearchCondition(
                trimToNull(filter.equipmentType()),
                trimToNull(filter.tag()),
                filter.inspectedFrom(),
                filter.inspectedTo(),
                nextDueFrom,
                nextDueTo,
                filter.descending()
        );
    }

    private InspectionSnapshot toSnapshot(InspectionRecord record, LocalDate today) {
        return new InspectionSnapshot(
                record.getId(),
                record.getPlatform(),
                record.getModule(),
                record.getSector(),
                record.getEquipmentType(),
                record.getSequence(),
                record.getTag(),
                record.getInspectionDate(),
                record.getNextInspectionDate(),
                dateValidator.status(today, record.getNextInspectionDate()),
                dateValidator.daysUntilDue(today, record.getNextInspectionDate()),
                record.getFindings(),
                record.getNotes(),
                record.getPhoto(),
                record.getCreatedAt(),
                record.getUpdatedAt()
        );
    }

    private void discardNewPhoto(Long recordId, ProcessedPhoto processed, RuntimeException failure) {
        try {
            photoHandler.discard(recordId, processed.directory());
        } catch (StorageException ex) {
            failure.addSuppressed(ex);
            log.warn("Could not remove photo set {} of record {}", processed.directory(), recordId, ex);
        }
    }

    private void discardReplacedPhoto(Long recordId, PhotoReference previousPhoto) {
        if (previousPhoto.originalPath() == null) {
            return;
        }
        Path previousSet = Path.of(previousPhoto.originalPath()).getParent();
        try {
            photoHandler.discard(recordId, previousSet);
        } catch (StorageException ex) {
            log.warn("Could not remove replaced photo set {} of record {}", previousSet, recordId, ex);
        }
    }

    private static String trimToNull(String value) {
        if (!StringUtils.hasText(value)) {
            return null;
        }
        return value.trim();
    }

    private record DerivedValues(String tag, LocalDate nextInspectionDate) {
    }
}
