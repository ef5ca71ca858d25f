package com.gs.ep.spellbook.model;

public enum Level implements FieldValue {
    CANTRIP(0),
    LEVEL_1(1),
    LEVEL_2(2),
    LEVEL_3(3),
    LEVEL_4(4),
    LEVEL_5(5),
    LEVEL_6(6),
    LEVEL_7(7),
    LEVEL_8(8),
    LEVEL_9(9);

    private final int number;

    Level(int number) {
        this.number = number;
    }

    public int getNumber() {
        return number;
    }

    public static Level of(int number) {
        for (Level level : values()) {
            if (level.number == number) {
                return level;
            }
        }
        throw new IllegalArgumentException("Spell levels go from 0 to 9, got " + number);
    }

    @Override
    public String asText() {
        switch (this) {
            case CANTRIP:
                return "Cantrip";
            case LEVEL_1:
                return "1st-level";
            case LEVEL_2:
                return "2nd-level";
            case LEVEL_3:
                return "3rd-level";
            default:
                return number + "th-level";
        }
    }
}
