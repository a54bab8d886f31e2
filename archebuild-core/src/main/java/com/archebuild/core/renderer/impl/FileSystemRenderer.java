package com.archebuild.core.renderer.impl;

import com.archebuild.core.renderer.GeneratedFile;
import com.archebuild.core.renderer.GeneratedOutput;
import com.archebuild.core.renderer.OutputRenderer;
import com.archebuild.core.renderer.RenderContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Writes generated reports below the context's output directory.
 *
 * <p>Directories are created as needed and existing files are overwritten. Files whose
 * relative path points outside the output directory are rejected.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * new FileSystemRenderer().render(output, RenderContext.directory("build/archebuild"));
 * // build/archebuild/house-1.md
 * }</pre>
 */
public class FileSystemRenderer implements OutputRenderer {

    private static final Logger log = LoggerFactory.getLogger(FileSystemRenderer.class);

    @Override
    public String getId() {
        return "filesystem";
    }

    @Override
    public void render(GeneratedOutput output, RenderContext context) {
        if (context.outputDirectory() == null) {
            throw new IllegalStateException("File system rendering requires an output directory");
        }
        Path outputDir = Paths.get(context.outputDirectory()).toAbsolutePath().normalize();
        log.info("Writing {} report(s) to {}", output.files().size(), outputDir);

        try {
            Files.createDirectories(outputDir);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to create output directory: " + outputDir, e);
        }

        for (GeneratedFile file : output.files()) {
            writeFile(outputDir, file);
        }
    }

    private void writeFile(Path outputDir, GeneratedFile file) {
        Path target = outputDir.resolve(file.relativePath()).normalize();
        if (!target.startsWith(outputDir)) {
            throw new IllegalStateException("Report path escapes the output directory: " + file.relativePath());
        }

        try {
            Path parent = target.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(target, file.content(), StandardCharsets.UTF_8);
            log.debug("Wrote {} ({} chars)", target, file.content().length());
        } catch (IOException e) {
            throw new IllegalStateException("Failed to write report: " + file.relativePath(), e);
        }
    }
}
