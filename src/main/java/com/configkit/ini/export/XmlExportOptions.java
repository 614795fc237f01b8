package com.configkit.ini.export;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

@Value
@Builder(toBuilder = true)
public class XmlExportOptions {

    @Builder.Default
    boolean indented = true;

    @Builder.Default
    boolean includeXmlDeclaration = true;

    boolean includeComments;

    @NonNull
    @Builder.Default
    String rootElementName = "configuration";

    @NonNull
    @Builder.Default
    String sectionElementName = "section";

    @NonNull
    @Builder.Default
    String propertyElementName = "property";

    /**
     * Writes the value as a {@code value} attribute instead of element text.
     */
    boolean useAttributeForValue;

    public static XmlExportOptions defaults() {
        return builder().build();
    }
}
