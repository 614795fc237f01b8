package com.configkit.ini.export;

import java.io.IOException;
import java.io.StringWriter;
import java.io.Writer;
import java.math.BigDecimal;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import javax.xml.namespace.QName;
import javax.xml.stream.XMLStreamException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.configkit.ini.model.Comment;
import com.configkit.ini.model.Document;
import com.configkit.ini.model.Property;
import com.configkit.ini.model.Section;
import com.configkit.ini.model.ValueConverter;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.dataformat.csv.CsvGenerator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.fasterxml.jackson.dataformat.xml.XmlMapper;
import com.fasterxml.jackson.dataformat.xml.ser.ToXmlGenerator;
import com.fasterxml.jackson.dataformat.xml.util.DefaultXmlPrettyPrinter;

/**
 * Writes a document as JSON, XML or CSV. The export is one-way; nothing reads these formats back.
 *
 * JSON: one object per section keyed by name, the default section under {@code _default}.
 * XML: {@code <configuration><section name="..."><property key="...">value</property>}, names configurable.
 * CSV: one row per property with the columns Section, Key, Value and optionally Comment.
 */
public class DocumentExporter {
    private static final Logger log = LoggerFactory.getLogger(DocumentExporter.class);

    /** Name the default section is exported under in JSON and XML; CSV leaves its section column empty. */
    public static final String DEFAULT_SECTION_KEY = "_default";

    static final String SECTION_COLUMN = "Section";
    static final String KEY_COLUMN = "Key";
    static final String VALUE_COLUMN = "Value";
    static final String COMMENT_COLUMN = "Comment";

    private static final ObjectMapper JSON_MAPPER = new ObjectMapper();
    private static final XmlMapper XML_MAPPER = new XmlMapper();
    private static final CsvMapper CSV_MAPPER = new CsvMapper();

    public String export(Document document, ExportFormat format) {
        if (format == null) {
            throw new IllegalArgumentException("Export format cannot be null");
        }
        return switch (format) {
            case JSON -> toJson(document);
            case XML -> toXml(document);
            case CSV -> toCsv(document);
        };
    }

    public void export(Document document, ExportFormat format, Path file) throws IOException {
        requireFile(file);
        write(file, export(document, format), StandardCharsets.UTF_8);
    }

    public String toJson(Document document) {
        return toJson(document, JsonExportOptions.defaults());
    }

    public String toJson(Document document, JsonExportOptions options) {
        requireDocument(document);
        requireOptions(options);

        ObjectNode root = JSON_MAPPER.createObjectNode();
        Section defaults = document.getDefaultSection();
        if (!defaults.isEmpty()) {
            if (options.isFlattenDefaultSection()) {
                for (Property property : defaults) {
                    putJsonProperty(root, property, options);
                }
            } else {
                root.set(DEFAULT_SECTION_KEY, jsonSection(defaults, options));
            }
        }
        for (Section section : document) {
            root.set(section.getName(), jsonSection(section, options));
        }

        ObjectWriter writer = options.isIndented() ? JSON_MAPPER.writerWithDefaultPrettyPrinter() : JSON_MAPPER.writer();
        try {
            String json = writer.writeValueAsString(root);
            log.debug("Exported {} sections as JSON", document.size());
            return json;
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to write JSON", e);
        }
    }

    public void toJsonFile(Document document, Path file, JsonExportOptions options) throws IOException {
        requireFile(file);
        write(file, toJson(document, options), StandardCharsets.UTF_8);
    }

    private ObjectNode jsonSection(Section section, JsonExportOptions options) {
        ObjectNode node = JSON_MAPPER.createObjectNode();
        if (options.isIncludeComments() && !section.getPreComments().isEmpty()) {
            node.set("_preComments", jsonComments(section.getPreComments()));
        }
        if (options.isIncludeComments() && section.hasComment()) {
            node.put("_comment", section.getComment().getValue());
        }
        for (Property property : section) {
            putJsonProperty(node, property, options);
        }
        return node;
    }

    private void putJsonProperty(ObjectNode node, Property property, JsonExportOptions options) {
        boolean commented = !property.getPreComments().isEmpty() || property.hasComment();
        if (options.isIncludeComments() && commented) {
            ObjectNode detail = node.putObject(property.getName());
            detail.put("value", property.getValue());
            if (!property.getPreComments().isEmpty()) {
                detail.set("preComments", jsonComments(property.getPreComments()));
            }
            if (property.hasComment()) {
                detail.put("comment", property.getComment().getValue());
            }
        } else if (options.isAutoConvertTypes()) {
            putTypedValue(node, property.getName(), property.getValue());
        } else {
            node.put(property.getName(), property.getValue());
        }
    }

    private ArrayNode jsonComments(Iterable<Comment> comments) {
        ArrayNode array = JSON_MAPPER.createArrayNode();
        for (Comment comment : comments) {
            array.add(comment.getValue());
        }
        return array;
    }

    /**
     * Booleans first, so {@code 1} and {@code 0} export as {@code true} and {@code false}.
     */
    private static void putTypedValue(ObjectNode node, String name, String value) {
        Optional<Boolean> bool = ValueConverter.tryConvert(value, Boolean.class);
        if (bool.isPresent()) {
            node.put(name, bool.get().booleanValue());
            return;
        }
        Optional<Long> integer = ValueConverter.tryConvert(value, Long.class);
        if (integer.isPresent()) {
            node.put(name, integer.get().longValue());
            return;
        }
        Optional<BigDecimal> decimal = ValueConverter.tryConvert(value, BigDecimal.class);
        if (decimal.isPresent()) {
            node.put(name, decimal.get());
            return;
        }
        node.put(name, value);
    }

    public String toXml(Document document) {
        return toXml(document, XmlExportOptions.defaults());
    }

    public String toXml(Document document, XmlExportOptions options) {
        requireDocument(document);
        requireOptions(options);

        StringWriter out = new StringWriter();
        try {
            writeXml(document, options, out);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to write XML", e);
        }
        log.debug("Exported {} sections as XML", document.size());
        return out.toString();
    }

    public void toXmlFile(Document document, Path file, XmlExportOptions options) throws IOException {
        requireFile(file);
        write(file, toXml(document, options), StandardCharsets.UTF_8);
    }

    private void writeXml(Document document, XmlExportOptions options, Writer out) throws IOException {
        try (ToXmlGenerator gen = XML_MAPPER.getFactory().createGenerator(out)) {
            gen.configure(ToXmlGenerator.Feature.WRITE_XML_DECLARATION, options.isIncludeXmlDeclaration());
            if (options.isIndented()) {
                gen.setPrettyPrinter(new DefaultXmlPrettyPrinter());
            }
            gen.setNextName(new QName(options.getRootElementName()));
            gen.initGenerator();
            gen.writeStartObject();

            if (!document.getDefaultSection().isEmpty()) {
                writeXmlSection(gen, document.getDefaultSection(), DEFAULT_SECTION_KEY, options);
            }
            for (Section section : document) {
                writeXmlSection(gen, section, section.getName(), options);
            }

            gen.writeEndObject();
        }
    }

    private void writeXmlSection(ToXmlGenerator gen, Section section, String name, XmlExportOptions options)
            throws IOException {
        gen.writeFieldName(options.getSectionElementName());
        gen.writeStartObject();
        writeXmlAttribute(gen, "name", name);

        if (options.isIncludeComments()) {
            for (Comment comment : section.getPreComments()) {
                writeXmlComment(gen, comment.getValue());
            }
            if (section.hasComment()) {
                writeXmlComment(gen, "Inline: " + section.getComment().getValue());
            }
        }
        for (Property property : section) {
            writeXmlProperty(gen, property, options);
        }

        gen.writeEndObject();
    }

    private void writeXmlProperty(ToXmlGenerator gen, Property property, XmlExportOptions options)
            throws IOException {
        if (options.isIncludeComments()) {
            for (Comment comment : property.getPreComments()) {
                writeXmlComment(gen, comment.getValue());
            }
        }

        gen.writeFieldName(options.getPropertyElementName());
        gen.writeStartObject();
        // attributes must precede the element text
        writeXmlAttribute(gen, "key", property.getName());
        if (options.isUseAttributeForValue()) {
            writeXmlAttribute(gen, "value", property.getValue());
        }
        if (options.isIncludeComments() && property.hasComment()) {
            writeXmlAttribute(gen, "comment", property.getComment().getValue());
        }
        if (!options.isUseAttributeForValue()) {
            gen.setNextIsUnwrapped(true);
            gen.writeStringField("value", property.getValue());
        }
        gen.writeEndObject();
    }

    private static void writeXmlAttribute(ToXmlGenerator gen, String name, String value) throws IOException {
        gen.setNextIsAttribute(true);
        gen.writeStringField(name, value);
        gen.setNextIsAttribute(false);
    }

    private static void writeXmlComment(ToXmlGenerator gen, String text) throws IOException {
        try {
            gen.getStaxWriter().writeComment(xmlCommentText(text));
        } catch (XMLStreamException e) {
            throw new IOException("Failed to write XML comment", e);
        }
    }

    /**
     * XML comments may not contain "--" or end with '-'.
     */
    static String xmlCommentText(String text) {
        String safe = text;
        while (safe.contains("--")) {
            safe = safe.replace("--", "- -");
        }
        return safe.endsWith("-") ? safe + " " : safe;
    }

    public String toCsv(Document document) {
        return toCsv(document, CsvExportOptions.defaults());
    }

    public String toCsv(Document document, CsvExportOptions options) {
        requireDocument(document);
        requireOptions(options);

        CsvSchema.Builder columns = CsvSchema.builder()
                .addColumn(SECTION_COLUMN)
                .addColumn(KEY_COLUMN)
                .addColumn(VALUE_COLUMN);
        if (options.isIncludeComments()) {
            columns.addColumn(COMMENT_COLUMN);
        }
        CsvSchema schema = columns.build()
                .withColumnSeparator(options.getDelimiter())
                .withoutHeader();

        ObjectWriter writer = CSV_MAPPER.writer(schema).with(CsvGenerator.Feature.STRICT_CHECK_FOR_QUOTING);
        if (options.isAlwaysQuote()) {
            writer = writer.with(CsvGenerator.Feature.ALWAYS_QUOTE_STRINGS)
                    .with(CsvGenerator.Feature.ALWAYS_QUOTE_EMPTY_STRINGS);
        }

        StringWriter out = new StringWriter();
        try (SequenceWriter rows = writer.writeValues(out)) {
            if (options.isIncludeHeader()) {
                rows.write(csvRow(SECTION_COLUMN, KEY_COLUMN, VALUE_COLUMN, COMMENT_COLUMN, options));
            }
            writeCsvRows(rows, "", document.getDefaultSection(), options);
            for (Section section : document) {
                writeCsvRows(rows, section.getName(), section, options);
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed to write CSV", e);
        }
        log.debug("Exported {} sections as CSV", document.size());
        return out.toString();
    }

    public void toCsvFile(Document document, Path file, CsvExportOptions options) throws IOException {
        requireFile(file);
        requireOptions(options);
        write(file, toCsv(document, options), options.getCharset());
    }

    private static void writeCsvRows(SequenceWriter rows, String sectionName, Section section,
            CsvExportOptions options) throws IOException {
        for (Property property : section) {
            String comment = property.hasComment() ? property.getComment().getValue() : "";
            rows.write(csvRow(sectionName, property.getName(), property.getValue(), comment, options));
        }
    }

    private static Map<String, String> csvRow(String section, String key, String value, String comment,
            CsvExportOptions options) {
        Map<String, String> row = new LinkedHashMap<>();
        row.put(SECTION_COLUMN, section);
        row.put(KEY_COLUMN, key);
        row.put(VALUE_COLUMN, value);
        if (options.isIncludeComments()) {
            row.put(COMMENT_COLUMN, comment);
        }
        return row;
    }

    private static void write(Path file, String content, Charset charset) throws IOException {
        log.debug("Writing export to {} ({})", file, charset);
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(file, content, charset);
    }

    private static void requireDocument(Document document) {
        if (document == null) {
            throw new IllegalArgumentException("Document cannot be null");
        }
    }

    private static void requireOptions(Object options) {
        if (options == null) {
            throw new IllegalArgumentException("Export options cannot be null");
        }
    }

    private static void requireFile(Path file) {
        if (file == null) {
            throw new IllegalArgumentException("File path cannot be null");
        }
    }
}
