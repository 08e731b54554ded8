package com.equipinspect.app.modules.report.application;

import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

import javax.imageio.ImageIO;

import com.equipinspect.app.global.error.RenderException;
import com.equipinspect.app.modules.inspection.application.InspectionSnapshot;
import com.equipinspect.app.modules.inspection.domain.InspectionFindings;
import com.equipinspect.app.modules.inspection.domain.InspectionStatus;
import com.equipinspect.app.modules.report.domain.RenderedReport;
import com.equipinspect.app.modules.report.domain.ReportKind;
import com.equipinspect.app.modules.report.infrastructure.pdf.PdfPageWriter;

import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.graphics.image.JPEGFactory;
import org.apache.pdfbox.pdmodel.graphics.image.PDImageXObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Renders inspection records into PDF documents held in memory. A photo that cannot be loaded
 * does not fail the report: the slot shows a placeholder and the failure is listed in
 * {@link RenderedReport#problems()}.
 */
@Component
public class ReportGenerator {

    private static final Logger log = LoggerFactory.getLogger(ReportGenerator.class);

    static final String PHOTO_UNAVAILABLE = "Photo unavailable";

    private static final DateTimeFormatter GENERATED_AT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");
    private static final float PHOTO_MAX_WIDTH = 360f;
    private static final float PHOTO_MAX_HEIGHT = 240f;
    private static final float[] SUMMARY_COLUMNS = {50f, 200f, 90f, 155f};

    private final Clock clock;

    public ReportGenerator(Clock clock) {
        this.clock = clock;
    }

    public RenderedReport renderSingle(InspectionSnapshot record) {
        Objects.requireNonNull(record, "record is required");
        List<RenderException> problems = new ArrayList<>();
        RenderedReport report = render(ReportKind.SINGLE, record.tag(), record.id(), problems, (document, writer) ->
                writeRecordPage(document, writer, record, problems));
        log.info("Rendered inspection report for record {} ({})", record.id(), record.tag());
        return report;
    }

    /**
     * One page per record in the given order, optionally preceded by a cover page. An empty batch
     * still gets its cover page.
     */
    public RenderedReport renderBatch(List<InspectionSnapshot> records, boolean coverPage) {
        Objects.requireNonNull(records, "records is required");
        List<RenderException> problems = new ArrayList<>();
        RenderedReport report = render(ReportKind.BATCH, null, null, problems, (document, writer) -> {
            if (coverPage || records.isEmpty()) {
                writer.startPage();
                writer.title("INSPECTION BATCH REPORT");
                writer.field("Records", String.valueOf(records.size()));
                writer.field("Generated at", generatedAt());
            }
            for (InspectionSnapshot record : records) {
                writeRecordPage(document, writer, record, problems);
            }
        });
        log.info("Rendered batch report with {} records ({} pages)", records.size(), report.pageCount());
        return report;
    }

    public RenderedReport renderSummary(List<InspectionSnapshot> records) {
        Objects.requireNonNull(records, "records is required");
        RenderedReport report = render(ReportKind.SUMMARY, null, null, new ArrayList<>(), (document, writer) -> {
            writer.startPage();
            writer.title("INSPECTION SUMMARY REPORT");
            writer.field("Generated at", generatedAt());
            writer.field("Total records", String.valueOf(records.size()));

            writer.heading("STATUS");
            for (Map.Entry<InspectionStatus, Long> entry : countByStatus(records).entrySet()) {
                writer.text(entry.getKey().name() + ": " + entry.getValue());
            }

            writer.heading("BY EQUIPMENT TYPE");
            Map<String, Long> byType = new TreeMap<>();
            records.forEach(record -> byType.merge(record.equipmentType(), 1L, Long::sum));
            for (Map.Entry<String, Long> entry : byType.entrySet()) {
                writer.text(entry.getKey() + ": " + entry.getValue());
            }

            writer.heading("RECORDS");
            writer.row(List.of("ID", "TAG", "STATUS", "NEXT INSPECTION"), SUMMARY_COLUMNS, true);
            for (InspectionSnapshot record : records) {
                writer.row(List.of(
                        String.valueOf(record.id()),
                        record.tag(),
                        record.status().name(),
                        String.valueOf(record.nextInspectionDate())
                ), SUMMARY_COLUMNS, false);
            }
        });
        log.info("Rendered summary report over {} records", records.size());
        return report;
    }

    /**
     * Number of records per status; every status is present, with zero when nothing matches.
     */
    public static Map<InspectionStatus, Long> countByStatus(List<InspectionSnapshot> records) {
        Map<InspectionStatus, Long> counts = new EnumMap<>(InspectionStatus.class);
        for (InspectionStatus status : InspectionStatus.values()) {
            counts.put(status, 0L);
        }
        records.forEach(record -> counts.merge(record.status(), 1L, Long::sum));
        return counts;
    }

    private RenderedReport render(
            ReportKind kind,
            String subject,
            Long recordId,
            List<RenderException> problems,
            PageContent pageContent
    ) {
        try (PDDocument document = new PDDocument()) {
            try (PdfPageWriter writer = new PdfPageWriter(document)) {
                pageContent.write(document, writer);
            }
            document.getDocumentInformation().setTitle(kind.name() + " inspection report");
            ByteArrayOutputStream buffer = new ByteArrayOutputStream();
            document.save(buffer);
            return new RenderedReport(kind, buffer.toByteArray(), document.getNumberOfPages(), problems, subject);
        } catch (IOException ex) {
            throw new RenderException(RenderException.PDF_FAILED, recordId,
                    "Could not render " + kind.name().toLowerCase(Locale.ROOT) + " report", ex);
        }
    }

    private void writeRecordPage(
            PDDocument document,
            PdfPageWriter writer,
            InspectionSnapshot record,
            List<RenderException> problems
    ) throws IOException {
        writer.startPage();
        writer.title("EQUIPMENT INSPECTION REPORT");
        writer.small("Record #" + record.id());

        writer.heading("BASIC INFORMATION");
        writer.field("TAG", record.tag());
        writer.field("Platform", record.platform());
        writer.field("Module", record.module());
        writer.field("Sector", record.sector());
        writer.field("Equipment type", record.equipmentType());
        writer.field("Sequence", String.valueOf(record.sequence()));

        writer.heading("INSPECTION DETAILS");
        writer.field("Inspection date", String.valueOf(record.inspectionDate()));
        writer.field("Next inspection", String.valueOf(record.nextInspectionDate()));
        writer.field("Status", record.status().name());
        writer.field("Days until due", String.valueOf(record.daysUntilDue()));

        InspectionFindings findings = record.findings() == null ? InspectionFindings.NONE : record.findings();
        writer.heading("FINDINGS");
        writer.field("Defect", findings.defect());
        writer.field("Cause", findings.cause());
        writer.field("RTI category", findings.rtiCategory());
        writer.field("Recommendation", findings.recommendation());
        writer.field("Damage type", findings.damageType());

        if (record.notes() != null) {
            writer.heading("NOTES");
            writer.paragraph(record.notes());
        }

        writer.heading("PHOTO");
        if (!record.hasPhoto()) {
            writer.text("No photo attached");
        } else {
            PDImageXObject image = loadPhoto(document, record, problems);
            if (image == null) {
                writer.text(PHOTO_UNAVAILABLE);
            } else {
                writer.image(image, PHOTO_MAX_WIDTH, PHOTO_MAX_HEIGHT);
            }
        }

        writer.gap(10f);
        writer.small("Generated at " + generatedAt());
    }

    private PDImageXObject loadPhoto(PDDocument document, InspectionSnapshot record, List<RenderException> problems) {
        Path path = Path.of(record.photo().optimizedPath());
        try {
            BufferedImage image = Files.isReadable(path) ? ImageIO.read(path.toFile()) : null;
            if (image == null) {
                return recordPhotoProblem(record, problems,
                        new RenderException(RenderException.PHOTO_UNAVAILABLE, record.id(), "Photo not readable: " + path));
            }
            return JPEGFactory.createFromImage(document, image);
        } catch (IOException ex) {
            return recordPhotoProblem(record, problems,
                    new RenderException(RenderException.PHOTO_UNAVAILABLE, record.id(), "Photo not readable: " + path, ex));
        }
    }

    private PDImageXObject recordPhotoProblem(
            InspectionSnapshot record,
            List<RenderException> problems,
            RenderException problem
    ) {
        log.warn("Rendering record {} without its photo: {}", record.id(), problem.getDetailMessage());
        problems.add(problem);
        return null;
    }

    private String generatedAt() {
        return LocalDateTime.now(clock).format(GENERATED_AT);
    }

    @FunctionalInterface
    private interface PageContent {
        void write(PDDocument document, PdfPageWriter writer) throws IOException;
    }
}
