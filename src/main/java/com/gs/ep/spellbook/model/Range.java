package com.gs.ep.spellbook.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

@JsonInclude(JsonInclude.Include.NON_NULL)
public final class Range implements FieldValue {

    public enum Kind {
        SELF,
        TOUCH,
        FEET,
        MILES,
        SIGHT,
        UNLIMITED,
        SPECIAL
    }

    private final Kind kind;
    private final int distance;
    private final AreaOfEffect area;

    /**
     * @param area for {@link Kind#SELF}, the area affected around the caster, or null
     */
    @JsonCreator
    public Range(@JsonProperty("kind") Kind kind, @JsonProperty("distance") int distance,
            @JsonProperty("area") AreaOfEffect area) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.distance = distance;
        this.area = area;
    }

    public static Range self() {
        return new Range(Kind.SELF, 0, null);
    }

    public static Range self(AreaOfEffect area) {
        return new Range(Kind.SELF, 0, area);
    }

    public static Range touch() {
        return new Range(Kind.TOUCH, 0, null);
    }

    public static Range feet(int distance) {
        return new Range(Kind.FEET, distance, null);
    }

    public static Range miles(int distance) {
        return new Range(Kind.MILES, distance, null);
    }

    public Kind getKind() {
        return kind;
    }

    public int getDistance() {
        return distance;
    }

    public AreaOfEffect getArea() {
        return area;
    }

    @Override
    public String asText() {
        switch (kind) {
            case SELF:
                return area == null ? "Self" : "Self (" + area.asText() + ")";
            case TOUCH:
                return "Touch";
            case FEET:
                return distance == 1 ? "1 foot" : distance + " feet";
            case MILES:
                return Amounts.of(distance, "mile");
            case SIGHT:
                return "Sight";
            case UNLIMITED:
                return "Unlimited";
            default:
                return "Special";
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Range)) {
            return false;
        }
        Range other = (Range) o;
        return kind == other.kind && distance == other.distance && Objects.equals(area, other.area);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, distance, area);
    }
}
