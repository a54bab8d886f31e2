package com.archebuild.cli;

import com.archebuild.core.archetype.GenerationSettings;
import com.archebuild.core.archetype.SingleFamilyDwelling;
import com.archebuild.core.building.StaticUseConditionsProvider;
import com.archebuild.core.config.ConfigLoader;
import com.archebuild.core.config.ProjectConfig;
import com.archebuild.core.database.TypeElementDatabase;
import com.archebuild.core.exception.ArcheBuildException;
import com.archebuild.core.project.ArchetypeProject;
import com.archebuild.core.renderer.GeneratedFile;
import com.archebuild.core.renderer.GeneratedOutput;
import com.archebuild.core.renderer.OutputRenderer;
import com.archebuild.core.renderer.RenderContext;
import com.archebuild.core.report.EnvelopeReport;
import com.archebuild.core.report.ReportGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.ServiceLoader;
import java.util.concurrent.Callable;

/**
 * Command to generate archetype buildings and render their envelope reports.
 *
 * <p>Buildings come either from a configuration file ({@code -c}) or from the building
 * flags, which describe a single building. Command line options override the
 * configuration's settings and output section. Relative database and output paths in
 * the configuration are resolved against the directory of the configuration file.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * archebuild generate --year 1975 --floors 2 --height 2.8 --area 150 --attic 2 --cellar 1
 * archebuild generate -c archebuild.yaml --format markdown,json --output build/reports
 * archebuild generate --year 2018 --construction kfw_55 --floors 1 --height 2.6 --area 120 --strict
 * }</pre>
 */
@Command(
    name = "generate",
    description = "Generate archetype buildings and render their envelope reports",
    mixinStandardHelpOptions = true
)
public class GenerateCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(GenerateCommand.class);

    @Option(names = {"-c", "--config"}, description = "Configuration file listing the buildings")
    private Path configPath;

    @Option(names = "--name", description = "Building name (default: ${DEFAULT-VALUE})", defaultValue = "Building")
    private String name;

    @Option(names = "--year", description = "Year of construction")
    private Integer year;

    @Option(names = "--construction", description = "Construction data: iwu_heavy, iwu_light, kfw_40 ... kfw_100")
    private String construction;

    @Option(names = "--floors", description = "Number of floors above ground")
    private Integer floors;

    @Option(names = "--height", description = "Average floor height [m]")
    private Double height;

    @Option(names = "--area", description = "Net leased area [m2]")
    private Double area;

    @Option(names = "--layout", description = "Residential layout: 0 compact, 1 elongated")
    private Integer layout;

    @Option(names = "--neighbours", description = "Number of neighbour buildings: 0, 1 or 2")
    private Integer neighbours;

    @Option(names = "--attic", description = "Attic: 0 flat roof, 1 non heated, 2 partly heated, 3 heated")
    private Integer attic;

    @Option(names = "--cellar", description = "Cellar: 0 none, 1 non heated, 2 partly heated, 3 heated")
    private Integer cellar;

    @Option(names = "--dormer", description = "Dormer: 0 none, 1 dormer")
    private Integer dormer;

    @Option(names = {"-f", "--format"}, split = ",", description = "Report formats: markdown, json (default: markdown)")
    private List<String> formats;

    @Option(names = {"-o", "--output"}, description = "Output directory (default: console)")
    private Path outputDir;

    @Option(names = "--strict", description = "Fail if an element has no matching type element")
    private boolean strict;

    @Mixin
    private DatabaseOptions databaseOptions;

    @Override
    public Integer call() {
        try {
            ProjectConfig config = configPath != null ? loadConfiguration() : null;
            List<ProjectConfig.BuildingConfig> buildings = config != null
                ? config.buildings()
                : List.of(buildingFromFlags());
            if (buildings == null || buildings.isEmpty()) {
                System.err.println("✗ No buildings configured in " + configPath);
                return 1;
            }

            List<ReportGenerator> generators = selectGenerators(resolveFormats(config));
            TypeElementDatabase database = loadDatabase(config);
            ArchetypeProject project = new ArchetypeProject(projectName(config), database,
                new StaticUseConditionsProvider(), resolveSettings(config));

            List<GeneratedFile> files = new ArrayList<>();
            for (ProjectConfig.BuildingConfig building : buildings) {
                String buildingName = building.name() != null ? building.name() : "Building " + (project.getBuildings().size() + 1);
                SingleFamilyDwelling dwelling = project.addResidential(buildingName, building.toParameters());
                EnvelopeReport report = EnvelopeReport.from(dwelling);
                if (report.unresolvedCount() > 0) {
                    System.err.printf("! %s: %d element(s) without type-element data%n", buildingName, report.unresolvedCount());
                }
                for (ReportGenerator generator : generators) {
                    files.add(generator.generate(report));
                }
            }

            render(new GeneratedOutput(files), resolveOutputDirectory(config));
            return 0;

        } catch (ArcheBuildException | IllegalArgumentException | IllegalStateException e) {
            log.error("Generation failed: {}", e.getMessage());
            log.debug("Generation failure details", e);
            System.err.println("✗ Generation failed: " + e.getMessage());
            return 1;
        }
    }

    private ProjectConfig loadConfiguration() {
        log.debug("Loading configuration from: {}", configPath);
        return ConfigLoader.load(configPath);
    }

    private ProjectConfig.BuildingConfig buildingFromFlags() {
        return new ProjectConfig.BuildingConfig(name, year, construction, floors, height, area,
            layout, neighbours, attic, cellar, dormer);
    }

    private String projectName(ProjectConfig config) {
        if (config != null && config.project() != null && config.project().name() != null) {
            return config.project().name();
        }
        return "archebuild";
    }

    private GenerationSettings resolveSettings(ProjectConfig config) {
        if (strict) {
            return GenerationSettings.strict();
        }
        return config != null ? config.generationSettings() : GenerationSettings.defaults();
    }

    private TypeElementDatabase loadDatabase(ProjectConfig config) {
        if (databaseOptions.isSet() || config == null || config.database() == null) {
            return databaseOptions.load();
        }
        Path base = configPath.toAbsolutePath().getParent();
        return DatabaseOptions.load(
            resolveAgainst(base, config.database().typeElements()),
            resolveAgainst(base, config.database().materials()));
    }

    private Path resolveAgainst(Path base, String file) {
        if (file == null) {
            return null;
        }
        return base != null ? base.resolve(file) : Path.of(file);
    }

    private List<String> resolveFormats(ProjectConfig config) {
        if (formats != null && !formats.isEmpty()) {
            return formats;
        }
        if (config != null && config.output() != null && config.output().formats() != null
            && !config.output().formats().isEmpty()) {
            return config.output().formats();
        }
        return List.of("markdown");
    }

    private String resolveOutputDirectory(ProjectConfig config) {
        if (outputDir != null) {
            return outputDir.toAbsolutePath().toString();
        }
        if (config != null && config.output() != null && config.output().directory() != null) {
            Path base = configPath.toAbsolutePath().getParent();
            return resolveAgainst(base, config.output().directory()).toAbsolutePath().toString();
        }
        return null;
    }

    /**
     * Picks the report generators for the requested formats via SPI.
     */
    private List<ReportGenerator> selectGenerators(List<String> requested) {
        List<ReportGenerator> available = new ArrayList<>();
        ServiceLoader.load(ReportGenerator.class).forEach(available::add);
        log.debug("Discovered {} report generators", available.size());

        List<ReportGenerator> selected = new ArrayList<>();
        for (String format : requested) {
            String id = format.trim().toLowerCase(Locale.ROOT);
            ReportGenerator generator = available.stream()
                .filter(candidate -> candidate.getId().equals(id))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown report format: " + format));
            selected.add(generator);
        }
        return selected;
    }

    /**
     * Renders to the console without output directory, to the file system otherwise.
     */
    private void render(GeneratedOutput output, String directory) {
        String rendererId = directory == null ? "console" : "filesystem";
        List<OutputRenderer> renderers = new ArrayList<>();
        ServiceLoader.load(OutputRenderer.class).forEach(renderers::add);

        OutputRenderer renderer = renderers.stream()
            .filter(candidate -> rendererId.equals(candidate.getId()))
            .findFirst()
            .orElseThrow(() -> new IllegalStateException("Output renderer not found: " + rendererId));

        log.info("Rendering {} report(s) with: {}", output.files().size(), renderer.getId());
        renderer.render(output, new RenderContext(directory, null));

        if (directory != null) {
            System.out.println("✓ Wrote " + output.files().size() + " report(s) to " + directory);
        }
    }
}
