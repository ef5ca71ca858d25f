package com.gs.ep.spellbook.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

public final class Duration implements FieldValue {

    public enum Kind {
        INSTANTANEOUS(null),
        SECONDS("second"),
        ROUNDS("round"),
        MINUTES("minute"),
        HOURS("hour"),
        DAYS("day"),
        WEEKS("week"),
        MONTHS("month"),
        YEARS("year"),
        DISPELLED_OR_TRIGGERED(null),
        UNTIL_DISPELLED(null),
        PERMANENT(null),
        SPECIAL(null);

        private final String singular;

        Kind(String singular) {
            this.singular = singular;
        }
    }

    private final Kind kind;
    private final int amount;
    private final boolean concentration;

    @JsonCreator
    public Duration(@JsonProperty("kind") Kind kind, @JsonProperty("amount") int amount,
            @JsonProperty("concentration") boolean concentration) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.amount = amount;
        this.concentration = concentration;
    }

    public static Duration instantaneous() {
        return new Duration(Kind.INSTANTANEOUS, 0, false);
    }

    public static Duration of(int amount, Kind kind) {
        return new Duration(kind, amount, false);
    }

    public static Duration concentration(int amount, Kind kind) {
        return new Duration(kind, amount, true);
    }

    public Kind getKind() {
        return kind;
    }

    public int getAmount() {
        return amount;
    }

    public boolean isConcentration() {
        return concentration;
    }

    @Override
    public String asText() {
        switch (kind) {
            case INSTANTANEOUS:
                return "Instantaneous";
            case PERMANENT:
                return "Permanent";
            case DISPELLED_OR_TRIGGERED:
                return concentrated("Until dispelled or triggered");
            case UNTIL_DISPELLED:
                return concentrated("Until dispelled");
            case SPECIAL:
                return concentration ? "Concentration, Special" : "Special";
            default:
                String text = Amounts.of(amount, kind.singular);
                return concentration ? "Concentration, up to " + text : text;
        }
    }

    private String concentrated(String text) {
        return concentration ? "Concentration, " + text.substring(0, 1).toLowerCase() + text.substring(1) : text;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Duration)) {
            return false;
        }
        Duration other = (Duration) o;
        return kind == other.kind && amount == other.amount && concentration == other.concentration;
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, amount, concentration);
    }
}
