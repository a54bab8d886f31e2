package com.archebuild.core.renderer.impl;

import com.archebuild.core.renderer.GeneratedFile;
import com.archebuild.core.renderer.GeneratedOutput;
import com.archebuild.core.renderer.OutputRenderer;
import com.archebuild.core.renderer.RenderContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.util.Objects;

/**
 * Prints generated reports to a stream, {@code System.out} by default.
 *
 * <p><b>Settings:</b>
 * <ul>
 *   <li>{@code console.headers} - print a header line before each file ("true"/"false", default "true")</li>
 *   <li>{@code console.separator} - separator repeated between files (default "-")</li>
 * </ul>
 */
public class ConsoleRenderer implements OutputRenderer {

    private static final Logger log = LoggerFactory.getLogger(ConsoleRenderer.class);

    private static final String DEFAULT_SEPARATOR = "-";
    private static final int LINE_WIDTH = 72;

    private final PrintStream out;

    public ConsoleRenderer() {
        this(System.out);
    }

    public ConsoleRenderer(PrintStream out) {
        this.out = Objects.requireNonNull(out, "out must not be null");
    }

    @Override
    public String getId() {
        return "console";
    }

    @Override
    public void render(GeneratedOutput output, RenderContext context) {
        boolean headers = Boolean.parseBoolean(context.getSettingOrDefault("console.headers", "true"));
        String separator = context.getSettingOrDefault("console.separator", DEFAULT_SEPARATOR);
        String line = separator.repeat(Math.max(1, LINE_WIDTH / Math.max(1, separator.length())));

        log.debug("Rendering {} report(s) to console", output.files().size());

        for (int i = 0; i < output.files().size(); i++) {
            GeneratedFile file = output.files().get(i);
            if (i > 0) {
                out.println(line);
            }
            if (headers) {
                out.println("== " + file.relativePath() + " ==");
                out.println();
            }
            out.println(file.content());
        }
        out.flush();
    }
}
