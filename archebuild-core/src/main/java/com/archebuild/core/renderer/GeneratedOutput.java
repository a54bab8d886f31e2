package com.archebuild.core.renderer;

import java.nio.file.Path;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Report files of one run.
 *
 * <p>Relative paths must be unique after normalization, so that no renderer overwrites
 * a file of the same run.
 *
 * @param files generated files in rendering order
 */
public record GeneratedOutput(
    List<GeneratedFile> files
) {
    public GeneratedOutput {
        Objects.requireNonNull(files, "files must not be null");
        files = List.copyOf(files);

        Set<Path> paths = new HashSet<>();
        for (GeneratedFile file : files) {
            if (!paths.add(Path.of(file.relativePath()).normalize())) {
                throw new IllegalArgumentException("Duplicate output file: " + file.relativePath());
            }
        }
    }

    public boolean isEmpty() {
        return files.isEmpty();
    }
}
