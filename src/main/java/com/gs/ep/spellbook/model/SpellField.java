package com.gs.ep.spellbook.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * A spell field holding either one of the known values of {@code T} or free text for anything
 * those values cannot express.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class SpellField<T extends FieldValue> {

    private final T controlled;
    private final String custom;

    @JsonCreator
    private SpellField(@JsonProperty("controlled") T controlled, @JsonProperty("custom") String custom) {
        if ((controlled == null) == (custom == null)) {
            throw new IllegalArgumentException("A spell field needs exactly one of 'controlled' and 'custom'");
        }
        this.controlled = controlled;
        this.custom = custom;
    }

    public static <T extends FieldValue> SpellField<T> controlled(T value) {
        return new SpellField<>(Objects.requireNonNull(value, "value"), null);
    }

    public static <T extends FieldValue> SpellField<T> custom(String text) {
        return new SpellField<>(null, Objects.requireNonNull(text, "text"));
    }

    @JsonProperty("controlled")
    public T getControlled() {
        return controlled;
    }

    @JsonProperty("custom")
    public String getCustom() {
        return custom;
    }

    public boolean hasControlledValue() {
        return controlled != null;
    }

    public String asText() {
        return controlled != null ? controlled.asText() : custom;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof SpellField)) {
            return false;
        }
        SpellField<?> other = (SpellField<?>) o;
        return Objects.equals(controlled, other.controlled) && Objects.equals(custom, other.custom);
    }

    @Override
    public int hashCode() {
        return Objects.hash(controlled, custom);
    }

    @Override
    public String toString() {
        return asText();
    }
}
