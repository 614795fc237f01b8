package com.configkit.ini.util;

import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.configkit.ini.model.Document;
import com.configkit.ini.model.Property;
import com.configkit.ini.model.Section;

/**
 * Replaces {@code ${NAME}} and {@code %NAME%} references in property values.
 * References to unknown variables are left as written.
 */
public class EnvironmentVariableSubstitutor {
    private static final Logger log = LoggerFactory.getLogger(EnvironmentVariableSubstitutor.class);

    private static final Pattern VARIABLE_PATTERN = Pattern.compile("\\$\\{([^}]+)\\}|%([^%]+)%");

    private final Function<String, String> lookup;

    public EnvironmentVariableSubstitutor() {
        this(System::getenv);
    }

    /**
     * @param lookup returns the value of a variable, or {@code null} when it is not defined
     */
    public EnvironmentVariableSubstitutor(Function<String, String> lookup) {
        this.lookup = lookup;
    }

    /**
     * Substitutes every property of the document, default section included.
     *
     * @return number of properties whose value changed
     */
    public int substitute(Document document) {
        int changed = substitute(document.getDefaultSection());
        for (Section section : document) {
            changed += substitute(section);
        }
        return changed;
    }

    public int substitute(Section section) {
        int changed = 0;
        for (Property property : section) {
            if (substitute(property)) {
                changed++;
            }
        }
        return changed;
    }

    public boolean substitute(Property property) {
        String replaced = substituteValue(property.getValue());
        if (replaced.equals(property.getValue())) {
            return false;
        }
        log.debug("Substituted variables in '{}'", property.getName());
        property.setValue(replaced);
        return true;
    }

    public String substituteValue(String value) {
        if (value == null || value.isEmpty()) {
            return value;
        }
        Matcher matcher = VARIABLE_PATTERN.matcher(value);
        StringBuilder sb = new StringBuilder();
        while (matcher.find()) {
            String name = matcher.group(1) != null ? matcher.group(1) : matcher.group(2);
            String resolved = lookup.apply(name);
            matcher.appendReplacement(sb, Matcher.quoteReplacement(resolved != null ? resolved : matcher.group()));
        }
        matcher.appendTail(sb);
        return sb.toString();
    }
}
