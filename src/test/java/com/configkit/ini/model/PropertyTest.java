package com.configkit.ini.model;

import com.configkit.ini.model.exception.ValueConversionException;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for Property and the shared ElementBase rules.
 */
class PropertyTest {

    @Test
    void testNameValidation() {
        assertThatThrownBy(() -> new Property(""))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Element name cannot be empty or whitespace");
        assertThatThrownBy(() -> new Property(" key"))
                .hasMessage("Element name cannot have leading or trailing whitespace");
        assertThatThrownBy(() -> new Property("a\nb"))
                .hasMessage("Element name cannot contain newline characters");
        assertThat(ElementBase.isValidName("inner space")).isTrue();
    }

    @Test
    void testNullValueBecomesEmpty() {
        Property property = new Property("key", null);

        assertThat(property.getValue()).isEmpty();
        assertThat(property.isEmpty()).isTrue();
        assertThat(property.isQuoted()).isFalse();
    }

    @Test
    void testTypedAccess() {
        Property property = new Property("port", "8080");

        assertThat(property.getValueAs(Integer.class)).contains(8080);
        assertThat(property.getRequiredValue(int.class)).isEqualTo(8080);
        assertThat(property.getValueAs(Boolean.class)).isEmpty();
        assertThat(property.getValueOrDefault(Boolean.class, false)).isFalse();
        assertThatThrownBy(() -> property.getRequiredValue(Boolean.class))
                .isInstanceOf(ValueConversionException.class);
    }

    @Test
    void testSetTypedValue() {
        Property property = new Property("ratio");

        property.setValue((Object) 0.75);

        assertThat(property.getValue()).isEqualTo("0.75");
        assertThat(property.getValueAs(Double.class)).contains(0.75);
    }

    @Test
    void testArrayValues() {
        Property property = new Property("hosts");

        property.setValueArray(List.of("alpha", "beta gamma"));

        assertThat(property.getValue()).isEqualTo("{alpha, \"beta gamma\"}");
        assertThat(property.getValueArray(String.class)).containsExactly("alpha", "beta gamma");
    }

    @Test
    void testCopyIsDeep() {
        Property original = new Property("key", "value")
                .withQuoted(true)
                .withComment("inline")
                .withPreComment("above");

        Property copy = original.copy();
        copy.getComment().setValue("changed");
        copy.getPreComments().get(0).setValue("changed");
        copy.setValue("other");

        assertThat(copy.isQuoted()).isTrue();
        assertThat(original.getValue()).isEqualTo("value");
        assertThat(original.getComment().getValue()).isEqualTo("inline");
        assertThat(original.getPreComments().get(0).getValue()).isEqualTo("above");
        assertThat(copy.getComment()).isNotSameAs(original.getComment());
    }

    @Test
    void testCopyAsKeepsEverythingButName() {
        Property original = new Property("old", "v").withComment("c");

        Property renamed = original.copyAs("new");

        assertThat(renamed.getName()).isEqualTo("new");
        assertThat(renamed.getValue()).isEqualTo("v");
        assertThat(renamed.getComment().getValue()).isEqualTo("c");
    }

    @Test
    void testAppendCommentConcatenates() {
        Property property = new Property("key");

        property.appendComment(new Comment("first"));
        property.appendComment(new Comment(" second"));

        assertThat(property.getComment().getValue()).isEqualTo("first second");
    }

    @Test
    void testAddPreCommentClonesInput() {
        Comment shared = new Comment("shared");
        Property a = new Property("a");
        Property b = new Property("b");

        a.addPreComment(shared);
        b.addPreComment(shared);
        a.getPreComments().get(0).setValue("changed");

        assertThat(b.getPreComments().get(0).getValue()).isEqualTo("shared");
        assertThat(shared.getValue()).isEqualTo("shared");
    }
}
