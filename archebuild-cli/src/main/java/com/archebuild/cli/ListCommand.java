package com.archebuild.cli;

import com.archebuild.core.database.TypeElementDatabase;
import com.archebuild.core.exception.ArcheBuildException;
import com.archebuild.core.model.ElementCategory;
import com.archebuild.core.model.TypeElementRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * Command to list type-element records, optionally filtered.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * archebuild list
 * archebuild list --category OuterWall --construction iwu_heavy --year 1965
 * }</pre>
 */
@Command(
    name = "list",
    description = "List type-element records of the database",
    mixinStandardHelpOptions = true
)
public class ListCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ListCommand.class);

    @Option(names = "--category", description = "Element category, e.g. OuterWall, Window")
    private String category;

    @Option(names = "--construction", description = "Construction type, e.g. iwu_heavy")
    private String construction;

    @Option(names = "--year", description = "Construction year the record must cover")
    private Integer year;

    @Mixin
    private DatabaseOptions databaseOptions;

    @Override
    public Integer call() {
        ElementCategory selectedCategory = null;
        if (category != null) {
            Optional<ElementCategory> parsed = ElementCategory.fromPrefix(category);
            if (parsed.isEmpty()) {
                System.err.println("✗ Unknown element category: " + category);
                return 1;
            }
            selectedCategory = parsed.get();
        }

        try {
            TypeElementDatabase database = databaseOptions.load();
            ElementCategory filter = selectedCategory;
            List<TypeElementRecord> records = database.records().stream()
                .filter(record -> filter == null || filter.matchesKey(record.key()))
                .filter(record -> construction == null || construction.equals(record.constructionType()))
                .filter(record -> year == null || record.ageRange().contains(year))
                .toList();

            System.out.println("Type elements (database version " + database.version() + "):");
            for (TypeElementRecord record : records) {
                System.out.printf("  %-50s %-12s %-14s %d layer(s), %.3f m%n",
                    record.key(), record.ageRange(), record.constructionType(),
                    record.layers().size(), record.totalThickness());
            }
            System.out.println(records.size() + " of " + database.records().size() + " record(s)");
            return 0;

        } catch (ArcheBuildException | IllegalArgumentException e) {
            log.error("Listing failed: {}", e.getMessage());
            System.err.println("✗ Listing failed: " + e.getMessage());
            return 1;
        }
    }
}
