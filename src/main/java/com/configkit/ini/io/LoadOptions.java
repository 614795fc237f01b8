package com.configkit.ini.io;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.function.Predicate;

import com.configkit.ini.parser.IniParserOptions;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * File loading settings: text encoding, parser configuration and an optional filter deciding
 * which named sections are kept. The default section is always kept.
 */
@Value
@Builder(toBuilder = true)
public class LoadOptions {

    @NonNull
    @Builder.Default
    Charset charset = StandardCharsets.UTF_8;

    @NonNull
    @Builder.Default
    IniParserOptions parserOptions = IniParserOptions.defaults();

    /**
     * Receives section names; {@code null} keeps every section.
     */
    Predicate<String> sectionFilter;

    public static LoadOptions defaults() {
        return builder().build();
    }
}
