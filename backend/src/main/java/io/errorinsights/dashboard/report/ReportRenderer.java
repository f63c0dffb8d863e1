package io.errorinsights.dashboard.report;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.errorinsights.dashboard.engine.ExportProjector;
import io.errorinsights.dashboard.model.LogField;
import io.errorinsights.dashboard.service.dto.ExportRows;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.springframework.stereotype.Component;

/**
 * Renders projected export rows as a downloadable CSV, JSON or PDF document.
 */
@Component
@RequiredArgsConstructor
public class ReportRenderer {

    private static final DateTimeFormatter ISO = DateTimeFormatter.ISO_OFFSET_DATE_TIME;
    private static final DateTimeFormatter FILE_TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");
    private static final float PDF_MARGIN = 40f;
    private static final float PDF_LINE_HEIGHT = 14f;
    private static final int PDF_FONT_SIZE = 9;

    private final ExportProjector projector;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public byte[] render(ExportRows rows, ReportFormat format) throws IOException {
        return switch (format) {
            case CSV -> renderCsv(rows);
            case JSON -> renderJson(rows);
            case PDF -> renderPdf(rows);
        };
    }

    public String fileName(ReportFormat format) {
        String timestamp = FILE_TIMESTAMP.format(OffsetDateTime.now(clock).withOffsetSameInstant(ZoneOffset.UTC));
        return "report_" + timestamp + '.' + format.extension();
    }

    byte[] renderCsv(ExportRows rows) {
        StringBuilder csv = new StringBuilder(projector.csvHeader(rows.columns())).append('\n');
        for (List<String> row : rows.rows()) {
            csv.append(projector.csvRow(row)).append('\n');
        }
        return csv.toString().getBytes(StandardCharsets.UTF_8);
    }

    byte[] renderJson(ExportRows rows) throws IOException {
        List<Map<String, String>> items = new ArrayList<>(rows.rows().size());
        for (List<String> row : rows.rows()) {
            Map<String, String> item = new LinkedHashMap<>();
            for (int i = 0; i < rows.columns().size(); i++) {
                item.put(rows.columns().get(i).id(), row.get(i));
            }
            items.add(item);
        }
        return objectMapper.writeValueAsBytes(items);
    }

    byte[] renderPdf(ExportRows rows) throws IOException {
        List<String> lines = new ArrayList<>();
        lines.add("Error Log Report");
        lines.add("Generated: " + ISO.format(OffsetDateTime.now(clock).withOffsetSameInstant(ZoneOffset.UTC)));
        lines.add("Rows: " + rows.rows().size());
        lines.add("");
        lines.add(rows.columns().stream().map(LogField::displayName).collect(Collectors.joining(" | ")));
        for (List<String> row : rows.rows()) {
            lines.add(String.join(" | ", row));
        }
        return renderLines(lines);
    }

    private byte[] renderLines(List<String> lines) throws IOException {
        try (PDDocument document = new PDDocument()) {
            PDPage page = new PDPage(PDRectangle.A4);
            document.addPage(page);

            PDPageContentStream content = startPage(document, page);
            float y = page.getMediaBox().getHeight() - PDF_MARGIN;

            for (String raw : lines) {
                if (y <= PDF_MARGIN) {
                    content.endText();
                    content.close();
                    page = new PDPage(PDRectangle.A4);
                    document.addPage(page);
                    content = startPage(document, page);
                    y = page.getMediaBox().getHeight() - PDF_MARGIN;
                }
                String line = sanitizeForPdf(raw);
                if (!line.isEmpty()) {
                    content.showText(line);
                }
                content.newLine();
                y -= PDF_LINE_HEIGHT;
            }

            content.endText();
            content.close();

            ByteArrayOutputStream output = new ByteArrayOutputStream();
            document.save(output);
            return output.toByteArray();
        }
    }

    private PDPageContentStream startPage(PDDocument document, PDPage page) throws IOException {
        PDPageContentStream content = new PDPageContentStream(document, page);
        content.setFont(PDType1Font.HELVETICA, PDF_FONT_SIZE);
        content.beginText();
        content.newLineAtOffset(PDF_MARGIN, page.getMediaBox().getHeight() - PDF_MARGIN);
        content.setLeading(PDF_LINE_HEIGHT);
        return content;
    }

    // Standard 14 fonts only encode printable ASCII here
    private String sanitizeForPdf(String value) {
        if (value == null) {
            return "";
        }
        String withoutBreaks = value.replaceAll("[\r\n]+", " ");
        StringBuilder builder = new StringBuilder(withoutBreaks.length());
        for (char ch : withoutBreaks.toCharArray()) {
            builder.append(ch < 32 || ch > 126 ? '?' : ch);
        }
        return builder.toString();
    }
}
