package com.archebuild.core.report;

import com.archebuild.core.renderer.GeneratedFile;

import java.util.Locale;

/**
 * Turns an {@link EnvelopeReport} into a report file.
 *
 * <p>Implementations are discovered through {@link java.util.ServiceLoader} and selected
 * by {@link #getId()}; the bundled ones are registered in
 * {@code META-INF/services/com.archebuild.core.report.ReportGenerator}.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * ReportGenerator generator = new MarkdownReportGenerator();
 * GeneratedFile file = generator.generate(EnvelopeReport.from(building));
 * }</pre>
 */
public interface ReportGenerator {

    /**
     * @return lowercase format id, e.g. {@code markdown}
     */
    String getId();

    String getDisplayName();

    /**
     * @return file extension without dot
     */
    String getFileExtension();

    /**
     * Generates the report for one building.
     *
     * @param report building snapshot
     * @return report file named after the building
     */
    GeneratedFile generate(EnvelopeReport report);

    /**
     * Derives a file name from the building name: lower case, runs of characters other
     * than letters and digits replaced by a single dash.
     *
     * @param report building snapshot
     * @return relative file name with this generator's extension
     */
    default String fileNameFor(EnvelopeReport report) {
        String slug = report.buildingName()
            .toLowerCase(Locale.ROOT)
            .replaceAll("[^a-z0-9]+", "-")
            .replaceAll("^-|-$", "");
        if (slug.isEmpty()) {
            slug = "building";
        }
        return slug + "." + getFileExtension();
    }
}
