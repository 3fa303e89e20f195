package com.vidnyan.dtc.adapter.out.corpus;

import com.vidnyan.dtc.domain.error.CorpusLoadException;

import java.util.Locale;

/**
 * Supported corpus file formats.
 */
public enum CorpusFormat {
    /** Pick by file name: CSV for *.csv, BLOCK otherwise. */
    AUTO,
    /** Key-value record blocks separated by blank lines. */
    BLOCK,
    /** Header row plus one record per row, list columns separated by '|'. */
    CSV;

    /**
     * @throws CorpusLoadException for a value other than AUTO, BLOCK or CSV
     */
    public static CorpusFormat parse(String value) {
        if (value == null || value.isBlank()) {
            return AUTO;
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        for (CorpusFormat format : values()) {
            if (format.name().equals(normalized)) {
                return format;
            }
        }
        throw new CorpusLoadException(0, "unknown corpus format '" + value.trim() + "' (expected AUTO, BLOCK or CSV)");
    }

    public CorpusFormat resolve(String fileName) {
        if (this != AUTO) {
            return this;
        }
        return fileName != null && fileName.toLowerCase(Locale.ROOT).endsWith(".csv") ? CSV : BLOCK;
    }
}
