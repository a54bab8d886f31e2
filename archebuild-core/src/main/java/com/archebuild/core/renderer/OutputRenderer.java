package com.archebuild.core.renderer;

/**
 * Writes generated report files to a destination.
 *
 * <p>Implementations are discovered through {@link java.util.ServiceLoader}; the bundled
 * ones are registered in
 * {@code META-INF/services/com.archebuild.core.renderer.OutputRenderer}.
 *
 * @see GeneratedOutput
 * @see RenderContext
 */
public interface OutputRenderer {

    /**
     * Returns the identifier used to select this renderer, e.g. {@code console}.
     *
     * @return lowercase renderer id
     */
    String getId();

    /**
     * Renders all files of the output.
     *
     * @param output files to render
     * @param context destination settings
     * @throws IllegalStateException if the context is incomplete or writing fails
     */
    void render(GeneratedOutput output, RenderContext context);
}
