package com.gs.ep.spellbook.model;

public enum MagicSchool implements FieldValue {
    ABJURATION("Abjuration"),
    CONJURATION("Conjuration"),
    DIVINATION("Divination"),
    ENCHANTMENT("Enchantment"),
    EVOCATION("Evocation"),
    ILLUSION("Illusion"),
    NECROMANCY("Necromancy"),
    TRANSMUTATION("Transmutation");

    private final String text;

    MagicSchool(String text) {
        this.text = text;
    }

    @Override
    public String asText() {
        return text;
    }
}
