package com.equipinspect.app.modules.report.domain;

import java.util.List;
import java.util.Objects;

import com.equipinspect.app.global.error.RenderException;

/**
 * A finished PDF held in memory. {@code problems} lists the degradations met while rendering,
 * such as a photo that could not be embedded; the document is complete regardless.
 * {@code subject} names what the report is about (the TAG of a single-record report).
 */
public record RenderedReport(
        ReportKind kind,
        byte[] content,
        int pageCount,
        List<RenderException> problems,
        String subject
) {

    public RenderedReport {
        Objects.requireNonNull(kind, "kind is required");
        Objects.requireNonNull(content, "content is required");
        problems = problems == null ? List.of() : List.copyOf(problems);
    }
}
