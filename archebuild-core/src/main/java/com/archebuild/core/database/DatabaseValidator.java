package com.archebuild.core.database;

import com.archebuild.core.model.DatabaseIssue;
import com.archebuild.core.model.ElementCategory;
import com.archebuild.core.model.IssueSeverity;
import com.archebuild.core.model.LayerDefinition;
import com.archebuild.core.model.TypeElementRecord;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Consistency checks over a {@link TypeElementDatabase}.
 *
 * <p>Reports:</p>
 * <ul>
 *   <li>ERROR - layer referencing a material id that does not exist</li>
 *   <li>ERROR - layer with a thickness that is not positive</li>
 *   <li>ERROR - age range whose lower bound exceeds its upper bound</li>
 *   <li>WARNING - record key without a known category prefix</li>
 *   <li>WARNING - two records of the same category and construction type with
 *       overlapping age ranges (resolution picks one of them by tie-break)</li>
 * </ul>
 */
public final class DatabaseValidator {

    private DatabaseValidator() {
        // Utility class
    }

    /**
     * Validates all records of a database.
     *
     * @param database database to check
     * @return issues in record order; empty if the data is consistent
     */
    public static List<DatabaseIssue> validate(TypeElementDatabase database) {
        List<DatabaseIssue> issues = new ArrayList<>();
        List<TypeElementRecord> records = database.records();

        for (TypeElementRecord record : records) {
            if (record.ageRange().isInverted()) {
                issues.add(DatabaseIssue.error(record.key(), "Inverted age range " + record.ageRange()));
            }
            for (LayerDefinition layer : record.layers()) {
                if (!(layer.thickness() > 0.0)) {
                    issues.add(DatabaseIssue.error(record.key(),
                        "Layer " + layer.id() + " has non-positive thickness " + layer.thickness()));
                }
                if (database.findMaterial(layer.materialId()).isEmpty()) {
                    issues.add(DatabaseIssue.error(record.key(),
                        "Layer " + layer.id() + " references unknown material '" + layer.materialId() + "'"));
                }
            }
            if (ElementCategory.fromKey(record.key()).isEmpty()) {
                issues.add(DatabaseIssue.warning(record.key(), "Key has no known element category prefix"));
            }
        }

        for (int i = 0; i < records.size(); i++) {
            TypeElementRecord first = records.get(i);
            Optional<ElementCategory> category = ElementCategory.fromKey(first.key());
            if (category.isEmpty()) {
                continue;
            }
            for (int j = i + 1; j < records.size(); j++) {
                TypeElementRecord second = records.get(j);
                if (category.equals(ElementCategory.fromKey(second.key()))
                    && first.constructionType().equals(second.constructionType())
                    && first.ageRange().overlaps(second.ageRange())) {
                    issues.add(DatabaseIssue.warning(second.key(),
                        "Age range " + second.ageRange() + " overlaps " + first.key() + " " + first.ageRange()));
                }
            }
        }
        return issues;
    }

    /**
     * @param issues validation result
     * @return true if at least one issue is an error
     */
    public static boolean hasErrors(List<DatabaseIssue> issues) {
        return issues.stream().anyMatch(issue -> issue.severity() == IssueSeverity.ERROR);
    }
}
