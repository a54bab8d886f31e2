package com.archebuild.cli;

import com.archebuild.core.database.JsonTypeElementDatabaseLoader;
import com.archebuild.core.database.TypeElementDatabase;
import picocli.CommandLine.Option;

import java.nio.file.Path;

/**
 * Options selecting the type-element database, shared by all commands.
 *
 * <p>Without options the sample database bundled with the core library is used. Both
 * files must be given together.
 */
public class DatabaseOptions {

    @Option(names = "--type-elements", description = "Type-element JSON file (default: bundled sample data)")
    Path typeElements;

    @Option(names = "--materials", description = "Material template JSON file (default: bundled sample data)")
    Path materials;

    /**
     * @return true if database files were given on the command line
     */
    public boolean isSet() {
        return typeElements != null || materials != null;
    }

    /**
     * Loads the database selected by these options.
     *
     * @return loaded database
     * @throws IllegalArgumentException if only one of the two files is given
     * @throws com.archebuild.core.exception.DatabaseLoadException if loading fails
     */
    public TypeElementDatabase load() {
        return load(typeElements, materials);
    }

    /**
     * Loads a database from explicit files, or the bundled one if both are null.
     *
     * @param typeElementsFile type-element JSON file
     * @param materialsFile material template JSON file
     * @return loaded database
     */
    static TypeElementDatabase load(Path typeElementsFile, Path materialsFile) {
        JsonTypeElementDatabaseLoader loader = new JsonTypeElementDatabaseLoader();
        if (typeElementsFile == null && materialsFile == null) {
            return loader.loadBundled();
        }
        if (typeElementsFile == null || materialsFile == null) {
            throw new IllegalArgumentException("--type-elements and --materials must be given together");
        }
        return loader.load(typeElementsFile, materialsFile);
    }
}
