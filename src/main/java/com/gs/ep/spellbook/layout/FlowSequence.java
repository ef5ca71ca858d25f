package com.gs.ep.spellbook.layout;

import com.gs.ep.spellbook.model.renderer.PageHandle;
import com.gs.ep.spellbook.model.renderer.Renderer;
import org.eclipse.collections.api.list.ListIterable;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The pages touched while writing one block of content, in order. Pages are only ever appended,
 * and only when a cursor moves past the last one.
 */
public class FlowSequence {

    private static final Logger LOGGER = LoggerFactory.getLogger(FlowSequence.class);

    private final Renderer renderer;
    private final PageGeometry geometry;
    private final MutableList<PageHandle> pages = Lists.mutable.empty();

    public FlowSequence(Renderer renderer, PageGeometry geometry, PageHandle firstPage) {
        this.renderer = renderer;
        this.geometry = geometry;
        this.pages.add(firstPage);
    }

    /**
     * Starts a sequence on a freshly created page.
     */
    public static FlowSequence onNewPage(Renderer renderer, PageGeometry geometry) {
        return new FlowSequence(renderer, geometry, renderer.createPage(geometry.getWidth(), geometry.getHeight()));
    }

    /**
     * Returns the page at the index, creating it when the index is one past the last page.
     */
    public PageHandle page(int index) {
        if (index == pages.size()) {
            PageHandle page = renderer.createPage(geometry.getWidth(), geometry.getHeight());
            pages.add(page);
            LOGGER.debug("Flow sequence grew to {} pages, new page {}", pages.size(), page);
        } else if (index > pages.size() || index < 0) {
            throw new IndexOutOfBoundsException("Page " + index + " of a flow sequence with " + pages.size() + " pages");
        }
        return pages.get(index);
    }

    public int size() {
        return pages.size();
    }

    public PageHandle lastPage() {
        return pages.getLast();
    }

    public ListIterable<PageHandle> getPages() {
        return pages.asUnmodifiable();
    }

    public Renderer getRenderer() {
        return renderer;
    }

    public PageGeometry getGeometry() {
        return geometry;
    }
}
