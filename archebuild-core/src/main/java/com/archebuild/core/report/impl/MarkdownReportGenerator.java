package com.archebuild.core.report.impl;

import com.archebuild.core.archetype.EnvelopeEstimate;
import com.archebuild.core.report.EnvelopeReport;
import com.archebuild.core.report.EnvelopeReport.ElementReport;
import com.archebuild.core.report.EnvelopeReport.LayerReport;
import com.archebuild.core.report.EnvelopeReport.ZoneReport;
import com.archebuild.core.report.ReportGenerator;
import com.archebuild.core.renderer.GeneratedFile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;

/**
 * Writes a Markdown report with building data, the envelope estimate and one element
 * table per zone.
 *
 * <p>Unresolved elements are listed with a dash instead of a type-element key. Layer
 * tables are written for resolved elements only.
 *
 * <p><b>Sample output:</b>
 * <pre>
 * # House 1
 *
 * | Property | Value |
 * |--------|--------|
 * | Year of construction | 1962 |
 * ...
 * </pre>
 */
public class MarkdownReportGenerator implements ReportGenerator {

    private static final Logger log = LoggerFactory.getLogger(MarkdownReportGenerator.class);

    private static final String H1 = "# ";
    private static final String H2 = "## ";
    private static final String H3 = "### ";
    private static final String PIPE = "|";
    private static final String NEWLINE = "\n";
    private static final String DOUBLE_NEWLINE = "\n\n";
    private static final String DASH_VALUE = "-";

    @Override
    public String getId() {
        return "markdown";
    }

    @Override
    public String getDisplayName() {
        return "Markdown Envelope Report";
    }

    @Override
    public String getFileExtension() {
        return "md";
    }

    @Override
    public GeneratedFile generate(EnvelopeReport report) {
        StringBuilder sb = new StringBuilder();
        sb.append(H1).append(escapeMarkdown(report.buildingName())).append(DOUBLE_NEWLINE);

        appendTableRow(sb, "Property", "Value");
        appendTableDivider(sb, 2);
        appendTableRow(sb, "Year of construction", String.valueOf(report.yearOfConstruction()));
        appendTableRow(sb, "Construction data", report.constructionData());
        appendTableRow(sb, "Number of floors", String.valueOf(report.numberOfFloors()));
        appendTableRow(sb, "Height of floors [m]", format(report.heightOfFloors()));
        appendTableRow(sb, "Net leased area [m2]", format(report.netLeasedArea()));
        appendTableRow(sb, "Elements", String.valueOf(report.elementCount()));
        appendTableRow(sb, "Unresolved elements", String.valueOf(report.unresolvedCount()));
        sb.append(NEWLINE);

        if (report.estimate() != null) {
            appendEstimate(sb, report.estimate());
        }

        for (ZoneReport zone : report.zones()) {
            appendZone(sb, zone);
        }

        log.debug("Generated Markdown report for '{}' ({} chars)", report.buildingName(), sb.length());
        return new GeneratedFile(fileNameFor(report), sb.toString(), "text/markdown");
    }

    private void appendEstimate(StringBuilder sb, EnvelopeEstimate estimate) {
        sb.append(H2).append("Envelope estimate").append(DOUBLE_NEWLINE);
        appendTableRow(sb, "Quantity", "Value");
        appendTableDivider(sb, 2);
        appendTableRow(sb, "Heated floors", format(estimate.heatedFloors()));
        appendTableRow(sb, "Living area per floor [m2]", format(estimate.livingAreaPerFloor()));
        appendTableRow(sb, "Ground floor area [m2]", format(estimate.groundFloorArea()));
        appendTableRow(sb, "Roof area [m2]", format(estimate.roofArea())
            + (estimate.roofFromTopFloor() ? " (top floor)" : ""));
        appendTableRow(sb, "Facade area [m2]", format(estimate.facadeArea()));
        appendTableRow(sb, "Window area [m2]", format(estimate.windowArea()));
        appendTableRow(sb, "Cellar wall area [m2]", format(estimate.cellarWallArea()));
        appendTableRow(sb, "Outer wall area [m2]", format(estimate.outerWallArea()));
        sb.append(NEWLINE);
    }

    private void appendZone(StringBuilder sb, ZoneReport zone) {
        sb.append(H2).append("Zone ").append(escapeMarkdown(zone.name())).append(DOUBLE_NEWLINE);
        sb.append("- **Usage:** ").append(zone.usage() != null ? escapeMarkdown(zone.usage()) : DASH_VALUE).append(NEWLINE);
        sb.append("- **Area:** ").append(format(zone.area())).append(" m2").append(NEWLINE);
        sb.append("- **Volume:** ").append(format(zone.volume())).append(" m3").append(NEWLINE);
        sb.append("- **Floors:** ").append(zone.numberOfFloors())
            .append(" x ").append(format(zone.heightOfFloors())).append(" m").append(DOUBLE_NEWLINE);

        appendTableRow(sb, "Element", "Category", "Area [m2]", "Tilt", "Orientation", "Type element", "Thickness [m]");
        appendTableDivider(sb, 7);
        for (ElementReport element : zone.elements()) {
            appendTableRow(sb,
                escapeMarkdown(element.name()),
                element.category().keyPrefix(),
                format(element.area()),
                format(element.tilt()),
                format(element.orientation()),
                element.typeElementKey() != null ? escapeMarkdown(element.typeElementKey()) : DASH_VALUE,
                format(element.totalThickness()));
        }
        sb.append(NEWLINE);

        for (ElementReport element : zone.elements()) {
            if (!element.layers().isEmpty()) {
                appendLayers(sb, element);
            }
        }
    }

    private void appendLayers(StringBuilder sb, ElementReport element) {
        sb.append(H3).append(escapeMarkdown(element.name())).append(DOUBLE_NEWLINE);
        appendTableRow(sb, "Layer", "Material", "Thickness [m]", "Density [kg/m3]", "Conductivity [W/mK]", "Heat capacity [kJ/kgK]");
        appendTableDivider(sb, 6);
        for (LayerReport layer : element.layers()) {
            appendTableRow(sb,
                layer.id(),
                escapeMarkdown(layer.materialName()),
                format(layer.thickness()),
                format(layer.density()),
                format(layer.thermalConductivity()),
                format(layer.heatCapacity()));
        }
        sb.append(NEWLINE);
    }

    private String format(Double value) {
        return value != null ? String.format(Locale.ROOT, "%.2f", value) : DASH_VALUE;
    }

    private String escapeMarkdown(String text) {
        if (text == null) {
            return "";
        }
        return text.replace("|", "\\|").replace("\n", " ");
    }

    private void appendTableRow(StringBuilder sb, String... columns) {
        sb.append(PIPE);
        for (String col : columns) {
            sb.append(' ').append(col).append(' ').append(PIPE);
        }
        sb.append(NEWLINE);
    }

    private void appendTableDivider(StringBuilder sb, int columnCount) {
        sb.append(PIPE);
        for (int i = 0; i < columnCount; i++) {
            sb.append("--------|");
        }
        sb.append(NEWLINE);
    }
}
