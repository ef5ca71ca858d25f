package com.gs.ep.spellbook.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.impl.factory.Lists;

import java.util.List;
import java.util.Objects;

/**
 * A table a spell description refers to with {@code [table][N]}.
 */
public final class Table {

    private final String title;
    private final List<String> columnLabels;
    private final List<List<String>> cells;

    /**
     * @param columnLabels header row, empty for a table without one
     * @param cells body rows; rows may have different lengths
     */
    @JsonCreator
    public Table(@JsonProperty("title") String title, @JsonProperty("columnLabels") List<String> columnLabels,
            @JsonProperty("cells") List<List<String>> cells) {
        this.title = title == null ? "" : title;
        this.columnLabels = columnLabels == null
                ? Lists.immutable.<String>empty().castToList()
                : Lists.immutable.withAll(columnLabels).castToList();
        ImmutableList<List<String>> rows = cells == null
                ? Lists.immutable.empty()
                : Lists.immutable.withAll(cells).collect(row -> Lists.immutable.withAll(row).castToList());
        this.cells = rows.castToList();
    }

    public String getTitle() {
        return title;
    }

    public List<String> getColumnLabels() {
        return columnLabels;
    }

    public List<List<String>> getCells() {
        return cells;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Table)) {
            return false;
        }
        Table other = (Table) o;
        return title.equals(other.title) && columnLabels.equals(other.columnLabels) && cells.equals(other.cells);
    }

    @Override
    public int hashCode() {
        return Objects.hash(title, columnLabels, cells);
    }
}
