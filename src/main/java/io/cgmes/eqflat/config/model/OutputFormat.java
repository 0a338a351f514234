package io.cgmes.eqflat.config.model;

import java.util.Locale;

public enum OutputFormat {
    CSV("csv"),
    XLSX("xlsx");

    private final String extension;

    OutputFormat(String extension) {
        this.extension = extension;
    }

    public String extension() {
        return extension;
    }

    /** Parses {@code csv} or {@code xlsx} (case-insensitive, {@code excel} accepted for xlsx). */
    public static OutputFormat parse(String raw) {
        String value = raw == null ? "" : raw.trim().toLowerCase(Locale.ROOT);
        return switch (value) {
            case "csv" -> CSV;
            case "xlsx", "excel" -> XLSX;
            default -> throw new IllegalArgumentException(
                    "Unknown output format '" + raw + "', expected csv or xlsx");
        };
    }
}
