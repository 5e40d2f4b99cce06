package com.docbinder.core.renderer;

import com.docbinder.core.tree.Node;

import java.nio.file.Path;

/**
 * Boundary to the component that turns a finished composite tree into output bytes.
 *
 * <p>Implementations are discovered with {@link java.util.ServiceLoader} and selected by
 * {@link #getId()}.
 */
public interface PageRenderer {

    /**
     * Unique identifier used to select this renderer.
     *
     * @return renderer id
     */
    String getId();

    /**
     * Extension of the files written by this renderer, without dot.
     *
     * @return file extension
     */
    String fileExtension();

    /**
     * Scheme of the URIs through which output documents link to each other.
     *
     * @return URI scheme
     */
    default String linkScheme() {
        return "pdf";
    }

    /**
     * Extension used in inter-document URIs ({@code <scheme>:<target>.<extension>}).
     *
     * @return link extension
     */
    default String linkExtension() {
        return "pdf";
    }

    /**
     * Renders one output document.
     *
     * @param tree final composite tree
     * @param target file to write
     * @param options effective renderer options of the document
     * @throws IllegalStateException if the output cannot be written
     */
    void render(Node tree, Path target, RenderOptions options);
}
