package com.gs.ep.spellbook.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.eclipse.collections.impl.factory.Lists;

import java.util.List;
import java.util.Objects;

/**
 * Everything printed on a spell's pages. The description and the upcast description use the
 * spellbook markup: {@code <r> <b> <i> <bi>} switch the font, {@code <table> ... <table>} holds an
 * inline table, and a line containing only {@code [table][N]} prints {@code tables.get(N)}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class Spell {

    private final String name;
    private final SpellField<Level> level;
    private final SpellField<MagicSchool> school;
    private final boolean ritual;
    private final SpellField<CastingTime> castingTime;
    private final SpellField<Range> range;
    private final Components components;
    private final SpellField<Duration> duration;
    private final String description;
    private final String upcastDescription;
    private final List<Table> tables;

    @JsonCreator
    public Spell(@JsonProperty("name") String name,
            @JsonProperty("level") SpellField<Level> level,
            @JsonProperty("school") SpellField<MagicSchool> school,
            @JsonProperty("ritual") boolean ritual,
            @JsonProperty("castingTime") SpellField<CastingTime> castingTime,
            @JsonProperty("range") SpellField<Range> range,
            @JsonProperty("components") Components components,
            @JsonProperty("duration") SpellField<Duration> duration,
            @JsonProperty("description") String description,
            @JsonProperty("upcastDescription") String upcastDescription,
            @JsonProperty("tables") List<Table> tables) {
        this.name = Objects.requireNonNull(name, "name");
        this.level = Objects.requireNonNull(level, "level");
        this.school = Objects.requireNonNull(school, "school");
        this.ritual = ritual;
        this.castingTime = Objects.requireNonNull(castingTime, "castingTime");
        this.range = Objects.requireNonNull(range, "range");
        this.components = Objects.requireNonNull(components, "components");
        this.duration = Objects.requireNonNull(duration, "duration");
        this.description = description == null ? "" : description;
        this.upcastDescription = upcastDescription;
        this.tables = tables == null
                ? Lists.immutable.<Table>empty().castToList()
                : Lists.immutable.withAll(tables).castToList();
    }

    public String getName() {
        return name;
    }

    public SpellField<Level> getLevel() {
        return level;
    }

    public SpellField<MagicSchool> getSchool() {
        return school;
    }

    public boolean isRitual() {
        return ritual;
    }

    public SpellField<CastingTime> getCastingTime() {
        return castingTime;
    }

    public SpellField<Range> getRange() {
        return range;
    }

    public Components getComponents() {
        return components;
    }

    public SpellField<Duration> getDuration() {
        return duration;
    }

    public String getDescription() {
        return description;
    }

    /**
     * @return what casting the spell at a higher level adds, or null
     */
    public String getUpcastDescription() {
        return upcastDescription;
    }

    public List<Table> getTables() {
        return tables;
    }

    @JsonIgnore
    public boolean isCantrip() {
        return level.getControlled() == Level.CANTRIP;
    }

    /**
     * "1st-level Evocation", "Evocation cantrip", with " (ritual)" appended for rituals.
     */
    public String levelSchoolText() {
        String text = isCantrip()
                ? school.asText() + " cantrip"
                : level.asText() + " " + school.asText();
        return ritual ? text + " (ritual)" : text;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Spell)) {
            return false;
        }
        Spell other = (Spell) o;
        return ritual == other.ritual && name.equals(other.name) && level.equals(other.level)
                && school.equals(other.school) && castingTime.equals(other.castingTime)
                && range.equals(other.range) && components.equals(other.components)
                && duration.equals(other.duration) && description.equals(other.description)
                && Objects.equals(upcastDescription, other.upcastDescription) && tables.equals(other.tables);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, level, school, ritual, castingTime, range, components, duration, description,
                upcastDescription, tables);
    }

    @Override
    public String toString() {
        return "Spell[" + name + "]";
    }
}
