package com.gs.ep.spellbook.model.renderer;

/**
 * Opaque reference to a page created by a {@link Renderer}, identified by its position in the document.
 */
public final class PageHandle {

    private final int index;

    public PageHandle(int index) {
        if (index < 0) {
            throw new IllegalArgumentException("Page index must not be negative: " + index);
        }
        this.index = index;
    }

    public int getIndex() {
        return index;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof PageHandle)) {
            return false;
        }
        return index == ((PageHandle) o).index;
    }

    @Override
    public int hashCode() {
        return Integer.hashCode(index);
    }

    @Override
    public String toString() {
        return "PageHandle[" + index + "]";
    }
}
