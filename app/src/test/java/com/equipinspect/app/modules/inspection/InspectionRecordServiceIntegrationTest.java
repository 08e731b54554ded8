package com.equipinspect.app.modules.inspection;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

import javax.imageio.ImageIO;

import com.equipinspect.app.global.error.NotFoundException;
import com.equipinspect.app.global.error.UnsupportedFormatException;
import com.equipinspect.app.global.error.ValidationException;
import com.equipinspect.app.modules.catalog.domain.CatalogField;
import com.equipinspect.app.modules.catalog.domain.OptionCatalog;
import com.equipinspect.app.modules.inspection.application.HistoryEntry;
import com.equipinspect.app.modules.inspection.application.InspectionFilter;
import com.equipinspect.app.modules.inspection.application.InspectionRecordService;
import com.equipinspect.app.modules.inspection.application.InspectionSnapshot;
import com.equipinspect.app.modules.inspection.domain.HistoryAction;
import com.equipinspect.app.modules.inspection.domain.InspectionFindings;
import com.equipinspect.app.modules.inspection.domain.InspectionForm;
import com.equipinspect.app.modules.inspection.domain.InspectionStatus;
import com.equipinspect.app.support.AbstractH2IntegrationTest;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

class InspectionRecordServiceIntegrationTest extends AbstractH2IntegrationTest {

    private static final String PRESSURE_VESSEL = "Vaso de Pressão";
    private static final String HEAT_EXCHANGER = "Permutador";
    private static final String FILTER = "Filtro";

    @Autowired
    private InspectionRecordService inspectionRecordService;

    @Autowired
    private OptionCatalog optionCatalog;

    @Test
    @DisplayName("catalog is loaded from application configuration")
    void catalogFromConfiguration() {
        assertThat(optionCatalog.values(CatalogField.PLATFORM)).containsExactly("P-1", "P-2", "P-3", "P-4");
        assertThat(optionCatalog.values(CatalogField.MODULE)).hasSize(10);
        assertThat(optionCatalog.equipmentType(PRESSURE_VESSEL).tagPrefix()).isEqualTo("VP");
        assertThat(optionCatalog.tagsFor(FILTER)).hasSize(100);
        assertThat(optionCatalog.values(CatalogField.RTI_CATEGORY)).containsExactly("I", "II", "III", "IV");
    }

    @Test
    @DisplayName("created record is read back with derived TAG, due date and status")
    void createAndGet() {
        InspectionForm form = new InspectionForm("P-1", "M01", "S01", HEAT_EXCHANGER, 7,
                LocalDate.of(2024, 1, 10),
                new InspectionFindings("Vazamento", "Corrosão externa", "II", "Pintura", "Localizado"),
                "  Flange leaking  ");

        InspectionSnapshot created = inspectionRecordService.create(form);
        InspectionSnapshot loaded = inspectionRecordService.get(created.id());

        assertThat(loaded.tag()).isEqualTo("P-1/M01/S01/PM-007");
        assertThat(loaded.nextInspectionDate()).isEqualTo(LocalDate.of(2024, 7, 8));
        assertThat(loaded.status()).isEqualTo(InspectionStatus.DUE_SOON);
        assertThat(loaded.daysUntilDue()).isEqualTo(7);
        assertThat(loaded.findings().defect()).isEqualTo("Vazamento");
        assertThat(loaded.findings().rtiCategory()).isEqualTo("II");
        assertThat(loaded.notes()).isEqualTo("Flange leaking");
        assertThat(loaded.photo()).isNull();
        assertThat(loaded.createdAt()).isNotNull();
        assertThat(loaded.updatedAt()).isNotNull();

        List<HistoryEntry> history = inspectionRecordService.history(created.id());
        assertThat(history).hasSize(1);
        assertThat(history.get(0).action()).isEqualTo(HistoryAction.CREATED);
        assertThat(history.get(0).previousValues()).isEmpty();
        assertThat(history.get(0).newValues()).containsEntry("tag", "P-1/M01/S01/PM-007");
    }

    @Test
    @DisplayName("future inspection date is rejected without writing anything")
    void create_futureDate() {
        InspectionForm form = form(HEAT_EXCHANGER, 1, LocalDate.of(2024, 7, 2));

        assertThatThrownBy(() -> inspectionRecordService.create(form))
                .isInstanceOf(ValidationException.class)
                .extracting(ex -> ((ValidationException) ex).getCode())
                .isEqualTo(ValidationException.INVALID_DATE);

        assertThat(countRows("inspection_record")).isZero();
        assertThat(countRows("inspection_history")).isZero();
    }

    @Test
    @DisplayName("values outside the catalog are rejected with the offending field")
    void create_invalidValues() {
        LocalDate date = LocalDate.of(2024, 6, 1);

        assertValidationError(
                new InspectionForm("P-9", "M01", "S01", FILTER, 1, date, null, null),
                ValidationException.UNKNOWN_OPTION, "platform");
        assertValidationError(form(HEAT_EXCHANGER, 31, date),
                ValidationException.SEQUENCE_OUT_OF_RANGE, "sequence");
        assertValidationError(
                new InspectionForm("P-1", "M01", "S01", FILTER, 1, date,
                        new InspectionFindings("Ferrugem", null, null, null, null), null),
                ValidationException.UNKNOWN_OPTION, "defect");
        assertValidationError(
                new InspectionForm("   ", "M01", "S01", FILTER, 1, date, null, null),
                ValidationException.INVALID_FIELD, "platform");

        assertThat(countRows("inspection_record")).isZero();
    }

    @Test
    @DisplayName("every update appends one history entry with a strictly later timestamp")
    void update_appendsHistory() {
        InspectionSnapshot created = inspectionRecordService.create(form(FILTER, 1, LocalDate.of(2024, 6, 1)));

        inspectionRecordService.update(created.id(), form(FILTER, 2, LocalDate.of(2024, 6, 1)));
        inspectionRecordService.update(created.id(), form(FILTER, 2, LocalDate.of(2024, 6, 15)));
        InspectionSnapshot updated = inspectionRecordService.update(created.id(),
                form(PRESSURE_VESSEL, 2, LocalDate.of(2024, 6, 15)));

        assertThat(updated.tag()).isEqualTo("P-1/M01/S01/VP-002");
        assertThat(updated.nextInspectionDate()).isEqualTo(LocalDate.of(2025, 6, 10));

        List<HistoryEntry> history = inspectionRecordService.history(created.id());
        assertThat(history).extracting(HistoryEntry::action).containsExactly(
                HistoryAction.CREATED, HistoryAction.UPDATED, HistoryAction.UPDATED, HistoryAction.UPDATED);
        for (int i = 1; i < history.size(); i++) {
            assertThat(history.get(i).changedAt()).isAfter(history.get(i - 1).changedAt());
        }
        assertThat(history.get(1).changedFields()).contains("sequence", "tag");
        assertThat(history.get(2).changedFields()).contains("inspectionDate", "nextInspectionDate");
    }

    @Test
    @DisplayName("soft-deleted record disappears from reads but keeps its history")
    void softDelete() {
        InspectionSnapshot created = inspectionRecordService.create(form(FILTER, 3, LocalDate.of(2024, 6, 1)));

        inspectionRecordService.softDelete(created.id());

        assertThatThrownBy(() -> inspectionRecordService.get(created.id()))
                .isInstanceOf(NotFoundException.class);
        assertThatThrownBy(() -> inspectionRecordService.update(created.id(), form(FILTER, 3, LocalDate.of(2024, 6, 1))))
                .isInstanceOf(NotFoundException.class);
        assertThatThrownBy(() -> inspectionRecordService.softDelete(created.id()))
                .isInstanceOf(NotFoundException.class);
        assertThat(inspectionRecordService.list(InspectionFilter.all())).isEmpty();
        assertThat(countRows("inspection_record")).isEqualTo(1);

        List<HistoryEntry> history = inspectionRecordService.history(created.id());
        assertThat(history).extracting(HistoryEntry::action)
                .containsExactly(HistoryAction.CREATED, HistoryAction.DELETED);
        assertThat(history.get(1).newValues().get("deletedAt")).isNotNull();
    }

    @Test
    @DisplayName("history of an id that never existed is not found")
    void history_unknownRecord() {
        assertThatThrownBy(() -> inspectionRecordService.history(999_999L))
                .isInstanceOf(NotFoundException.class);
    }

    @Test
    @DisplayName("list filters by status, type, TAG and inspection date, ordered by due date")
    void list_filters() {
        InspectionSnapshot dueSoon = inspectionRecordService.create(form(HEAT_EXCHANGER, 1, LocalDate.of(2024, 1, 10)));
        InspectionSnapshot overdue = inspectionRecordService.create(form(FILTER, 1, LocalDate.of(2023, 12, 1)));
        InspectionSnapshot ok = inspectionRecordService.create(form(PRESSURE_VESSEL, 1, LocalDate.of(2024, 6, 1)));

        assertThat(ids(inspectionRecordService.list(InspectionFilter.all())))
                .containsExactly(overdue.id(), dueSoon.id(), ok.id());
        assertThat(ids(inspectionRecordService.list(InspectionFilter.all().newestDueFirst())))
                .containsExactly(ok.id(), dueSoon.id(), overdue.id());

        for (InspectionStatus status : InspectionStatus.values()) {
            List<InspectionSnapshot> matches = inspectionRecordService.list(InspectionFilter.byStatus(status));
            assertThat(matches).hasSize(1);
            assertThat(matches).allSatisfy(snapshot -> assertThat(snapshot.status()).isEqualTo(status));
        }
        assertThat(inspectionRecordService.list(InspectionFilter.byStatus(InspectionStatus.OVERDUE)).get(0).id())
                .isEqualTo(overdue.id());

        assertThat(ids(inspectionRecordService.list(InspectionFilter.all().withEquipmentType(FILTER))))
                .containsExactly(overdue.id());
        assertThat(ids(inspectionRecordService.list(InspectionFilter.all().withTag(dueSoon.tag()))))
                .containsExactly(dueSoon.id());
        assertThat(ids(inspectionRecordService.list(InspectionFilter.all()
                .inspectedBetween(LocalDate.of(2024, 1, 1), LocalDate.of(2024, 6, 30)))))
                .containsExactly(dueSoon.id(), ok.id());

        assertThatThrownBy(() -> inspectionRecordService.list(InspectionFilter.all()
                .inspectedBetween(LocalDate.of(2024, 6, 30), LocalDate.of(2024, 1, 1))))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    @DisplayName("status is evaluated against the current day on every read")
    void status_followsClock() {
        InspectionSnapshot created = inspectionRecordService.create(form(HEAT_EXCHANGER, 1, LocalDate.of(2024, 1, 10)));

        clock.setInstant(Instant.parse("2024-07-09T09:00:00Z"));

        InspectionSnapshot loaded = inspectionRecordService.get(created.id());
        assertThat(loaded.status()).isEqualTo(InspectionStatus.OVERDUE);
        assertThat(loaded.daysUntilDue()).isEqualTo(-1);
    }

    @Test
    @DisplayName("attached photo is stored under the record directory and logged in history")
    void attachPhoto() throws IOException {
        InspectionSnapshot created = inspectionRecordService.create(form(FILTER, 5, LocalDate.of(2024, 6, 1)));
        Path source = writePng(STORAGE_ROOT.resolve("incoming").resolve("flange.png"), 2400, 1600);
        byte[] sourceBytes = Files.readAllBytes(source);

        InspectionSnapshot updated = inspectionRecordService.attachPhoto(created.id(), source);

        assertThat(updated.hasPhoto()).isTrue();
        Path recordDirectory = STORAGE_ROOT.resolve("uploads").resolve("record-" + created.id());
        assertThat(Path.of(updated.photo().originalPath())).isEqualTo(recordDirectory.resolve("photo-1").resolve("original.png"));
        assertThat(Path.of(updated.photo().optimizedPath())).exists();
        assertThat(Path.of(updated.photo().thumbnailPath())).exists();
        assertThat(Files.readAllBytes(source)).isEqualTo(sourceBytes);

        List<HistoryEntry> history = inspectionRecordService.history(created.id());
        assertThat(history).last().extracting(HistoryEntry::action).isEqualTo(HistoryAction.PHOTO_ATTACHED);
        assertThat(history.get(history.size() - 1).changedFields()).contains("photoOptimizedPath");
    }

    @Test
    @DisplayName("replacing a photo points the record at the new set and removes the previous one")
    void attachPhoto_replace() throws IOException {
        InspectionSnapshot created = inspectionRecordService.create(form(FILTER, 7, LocalDate.of(2024, 6, 1)));
        InspectionSnapshot first = inspectionRecordService.attachPhoto(created.id(),
                writePng(STORAGE_ROOT.resolve("incoming").resolve("before.png"), 200, 100));

        InspectionSnapshot second = inspectionRecordService.attachPhoto(created.id(),
                writePng(STORAGE_ROOT.resolve("incoming").resolve("after.png"), 300, 200));

        Path recordDirectory = STORAGE_ROOT.resolve("uploads").resolve("record-" + created.id());
        assertThat(Path.of(second.photo().originalPath())).isEqualTo(recordDirectory.resolve("photo-2").resolve("original.png"));
        assertThat(Path.of(first.photo().originalPath()).getParent()).doesNotExist();
        assertThat(inspectionRecordService.history(created.id())).hasSize(3);
    }

    @Test
    @DisplayName("orphan cleanup keeps photos of stored records, soft-deleted ones included")
    void cleanupOrphanedPhotos() throws IOException {
        InspectionSnapshot kept = inspectionRecordService.create(form(FILTER, 8, LocalDate.of(2024, 6, 1)));
        InspectionSnapshot deleted = inspectionRecordService.create(form(FILTER, 9, LocalDate.of(2024, 6, 1)));
        Path source = writePng(STORAGE_ROOT.resolve("incoming").resolve("gasket.png"), 120, 90);
        InspectionSnapshot keptWithPhoto = inspectionRecordService.attachPhoto(kept.id(), source);
        InspectionSnapshot deletedWithPhoto = inspectionRecordService.attachPhoto(deleted.id(), source);
        inspectionRecordService.softDelete(deleted.id());
        Path strayRecord = Files.createDirectories(STORAGE_ROOT.resolve("uploads").resolve("record-999999").resolve("photo-1"));
        Path straySet = Files.createDirectories(
                STORAGE_ROOT.resolve("uploads").resolve("record-" + kept.id()).resolve("photo-7"));

        int removed = inspectionRecordService.cleanupOrphanedPhotos();

        assertThat(removed).isEqualTo(2);
        assertThat(strayRecord.getParent()).doesNotExist();
        assertThat(straySet).doesNotExist();
        assertThat(Path.of(keptWithPhoto.photo().optimizedPath())).exists();
        assertThat(Path.of(deletedWithPhoto.photo().optimizedPath())).exists();
    }

    @Test
    @DisplayName("rejected photo leaves the record and its directory untouched")
    void attachPhoto_rejected() throws IOException {
        InspectionSnapshot created = inspectionRecordService.create(form(FILTER, 6, LocalDate.of(2024, 6, 1)));
        Path fake = STORAGE_ROOT.resolve("incoming").resolve("fake.jpg");
        Files.createDirectories(fake.getParent());
        Files.writeString(fake, "definitely not a jpeg");

        assertThatThrownBy(() -> inspectionRecordService.attachPhoto(created.id(), fake))
                .isInstanceOf(UnsupportedFormatException.class);

        assertThat(inspectionRecordService.get(created.id()).photo()).isNull();
        assertThat(inspectionRecordService.history(created.id())).hasSize(1);
        assertThat(STORAGE_ROOT.resolve("uploads").resolve("record-" + created.id())).doesNotExist();
    }

    private void assertValidationError(InspectionForm form, String code, String field) {
        assertThatThrownBy(() -> inspectionRecordService.create(form))
                .isInstanceOf(ValidationException.class)
                .satisfies(ex -> {
                    ValidationException error = (ValidationException) ex;
                    assertThat(error.getCode()).isEqualTo(code);
                    assertThat(error.getField()).isEqualTo(field);
                });
    }

    private static InspectionForm form(String equipmentType, int sequence, LocalDate inspectionDate) {
        return new InspectionForm("P-1", "M01", "S01", equipmentType, sequence, inspectionDate, null, null);
    }

    private static List<Long> ids(List<InspectionSnapshot> snapshots) {
        return snapshots.stream().map(InspectionSnapshot::id).toList();
    }

    private static Path writePng(Path target, int width, int height) throws IOException {
        Files.createDirectories(target.getParent());
        BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_INT_ARGB);
        for (int x = 0; x < width; x += 8) {
            for (int y = 0; y < height; y += 8) {
                image.setRGB(x, y, 0x80FF0000);
            }
        }
        ImageIO.write(image, "png", target.toFile());
        return target;
    }
}
