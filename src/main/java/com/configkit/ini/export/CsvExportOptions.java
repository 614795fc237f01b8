package com.configkit.ini.export;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Settings for the one-row-per-property CSV export.
 */
@Value
@Builder(toBuilder = true)
public class CsvExportOptions {

    @Builder.Default
    char delimiter = ',';

    @Builder.Default
    boolean includeHeader = true;

    /**
     * Adds a fourth column with the inline comment of each property.
     */
    boolean includeComments;

    boolean alwaysQuote;

    /**
     * Encoding used when writing to a file.
     */
    @NonNull
    @Builder.Default
    Charset charset = StandardCharsets.UTF_8;

    public static CsvExportOptions defaults() {
        return builder().build();
    }
}
