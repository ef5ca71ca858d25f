package com.gs.ep.spellbook.model;

/**
 * A controlled value of a spell field, as it is printed on the spell's page.
 */
public interface FieldValue {

    String asText();
}
