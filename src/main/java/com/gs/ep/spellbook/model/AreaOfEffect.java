package com.gs.ep.spellbook.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Shape of the area a spell cast on oneself affects. Sizes are in feet, except {@link Shape#RADIUS}
 * which is in miles.
 */
public final class AreaOfEffect {

    public enum Shape {
        LINE,
        CONE,
        CUBE,
        SPHERE,
        CYLINDER,
        EMANATION,
        RADIUS
    }

    private final Shape shape;
    private final int size;
    private final int height;

    @JsonCreator
    public AreaOfEffect(@JsonProperty("shape") Shape shape, @JsonProperty("size") int size,
            @JsonProperty("height") int height) {
        this.shape = Objects.requireNonNull(shape, "shape");
        this.size = size;
        this.height = height;
    }

    public static AreaOfEffect of(Shape shape, int size) {
        return new AreaOfEffect(shape, size, 0);
    }

    public static AreaOfEffect cylinder(int radius, int height) {
        return new AreaOfEffect(Shape.CYLINDER, radius, height);
    }

    public Shape getShape() {
        return shape;
    }

    public int getSize() {
        return size;
    }

    public int getHeight() {
        return height;
    }

    public String asText() {
        switch (shape) {
            case LINE:
                return size + "-foot line";
            case CONE:
                return size + "-foot cone";
            case CUBE:
                return size + "-foot cube";
            case SPHERE:
                return size + "-foot sphere";
            case CYLINDER:
                return size + "-foot radius, " + height + "-foot tall cylinder";
            case EMANATION:
                return size + "-foot emanation";
            default:
                return size + "-mile radius";
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof AreaOfEffect)) {
            return false;
        }
        AreaOfEffect other = (AreaOfEffect) o;
        return shape == other.shape && size == other.size && height == other.height;
    }

    @Override
    public int hashCode() {
        return Objects.hash(shape, size, height);
    }
}
