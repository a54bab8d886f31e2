package com.archebuild.cli;

import com.archebuild.core.database.DatabaseValidator;
import com.archebuild.core.database.TypeElementDatabase;
import com.archebuild.core.exception.ArcheBuildException;
import com.archebuild.core.model.DatabaseIssue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

import java.util.List;
import java.util.concurrent.Callable;

/**
 * Command to validate type-element and material data.
 *
 * <p>Exits with 1 if the data cannot be loaded or has errors. Warnings are printed but
 * do not fail the command.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * archebuild validate --type-elements data/TypeElements.json --materials data/MaterialTemplates.json
 * }</pre>
 */
@Command(
    name = "validate",
    description = "Validate type-element and material data",
    mixinStandardHelpOptions = true
)
public class ValidateCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ValidateCommand.class);

    @Mixin
    private DatabaseOptions databaseOptions;

    @Override
    public Integer call() {
        try {
            TypeElementDatabase database = databaseOptions.load();
            List<DatabaseIssue> issues = DatabaseValidator.validate(database);

            for (DatabaseIssue issue : issues) {
                System.out.println("  [" + issue.severity() + "] " + issue.key() + ": " + issue.message());
            }

            if (DatabaseValidator.hasErrors(issues)) {
                System.out.println("✗ Validation failed with " + issues.size() + " issue(s)");
                return 1;
            }
            System.out.println("✓ " + database.records().size() + " type elements and "
                + database.materials().size() + " materials valid (" + issues.size() + " warning(s))");
            return 0;

        } catch (ArcheBuildException | IllegalArgumentException e) {
            log.error("Validation failed: {}", e.getMessage());
            System.err.println("✗ Could not load database: " + e.getMessage());
            return 1;
        }
    }
}
