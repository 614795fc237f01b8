package com.configkit.ini.export;

import lombok.Builder;
import lombok.Value;

/**
 * Settings for {@link DocumentExporter#toJson(com.configkit.ini.model.Document, JsonExportOptions)}.
 */
@Value
@Builder(toBuilder = true)
public class JsonExportOptions {

    @Builder.Default
    boolean indented = true;

    /**
     * Writes section comments as {@code _preComments}/{@code _comment} members, and a commented
     * property as an object holding its value and comments.
     */
    boolean includeComments;

    /**
     * Puts default-section properties at the top level instead of under {@code _default}.
     */
    boolean flattenDefaultSection;

    /**
     * Writes values that read as booleans or numbers as JSON booleans and numbers.
     */
    boolean autoConvertTypes;

    public static JsonExportOptions defaults() {
        return builder().build();
    }
}
