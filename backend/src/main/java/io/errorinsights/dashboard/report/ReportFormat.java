package io.errorinsights.dashboard.report;

import java.util.Locale;
import java.util.Optional;

public enum ReportFormat {
    CSV("csv", "text/csv"),
    JSON("json", "application/json"),
    PDF("pdf", "application/pdf");

    private final String extension;
    private final String mediaType;

    ReportFormat(String extension, String mediaType) {
        this.extension = extension;
        this.mediaType = mediaType;
    }

    public String extension() {
        return extension;
    }

    public String mediaType() {
        return mediaType;
    }

    /** CSV when {@code name} is blank. */
    public static Optional<ReportFormat> fromName(String name) {
        if (name == null || name.isBlank()) {
            return Optional.of(CSV);
        }
        try {
            return Optional.of(valueOf(name.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
