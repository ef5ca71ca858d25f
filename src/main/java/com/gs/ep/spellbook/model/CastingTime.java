package com.gs.ep.spellbook.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

@JsonInclude(JsonInclude.Include.NON_NULL)
public final class CastingTime implements FieldValue {

    public enum Unit {
        SECONDS("second"),
        ACTIONS("action"),
        BONUS_ACTION("bonus action"),
        REACTION("reaction"),
        MINUTES("minute"),
        HOURS("hour"),
        DAYS("day"),
        WEEKS("week"),
        MONTHS("month"),
        YEARS("year");

        private final String singular;

        Unit(String singular) {
            this.singular = singular;
        }
    }

    private final Unit unit;
    private final int amount;
    private final String trigger;

    /**
     * @param trigger for reactions, what the reaction is taken in response to
     */
    @JsonCreator
    public CastingTime(@JsonProperty("unit") Unit unit, @JsonProperty("amount") int amount,
            @JsonProperty("trigger") String trigger) {
        this.unit = Objects.requireNonNull(unit, "unit");
        this.amount = amount;
        this.trigger = trigger;
    }

    public static CastingTime of(int amount, Unit unit) {
        return new CastingTime(unit, amount, null);
    }

    public static CastingTime action() {
        return of(1, Unit.ACTIONS);
    }

    public static CastingTime bonusAction() {
        return of(1, Unit.BONUS_ACTION);
    }

    public static CastingTime reaction(String trigger) {
        return new CastingTime(Unit.REACTION, 1, trigger);
    }

    public Unit getUnit() {
        return unit;
    }

    public int getAmount() {
        return amount;
    }

    public String getTrigger() {
        return trigger;
    }

    @Override
    public String asText() {
        switch (unit) {
            case BONUS_ACTION:
                return "1 bonus action";
            case REACTION:
                return trigger == null || trigger.isEmpty()
                        ? "1 reaction"
                        : "1 reaction, which you take when " + trigger;
            default:
                return Amounts.of(amount, unit.singular);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CastingTime)) {
            return false;
        }
        CastingTime other = (CastingTime) o;
        return unit == other.unit && amount == other.amount && Objects.equals(trigger, other.trigger);
    }

    @Override
    public int hashCode() {
        return Objects.hash(unit, amount, trigger);
    }
}
