package com.archebuild.core;

import com.archebuild.core.database.InMemoryTypeElementDatabase;
import com.archebuild.core.model.AgeRange;
import com.archebuild.core.model.ExchangeCoefficients;
import com.archebuild.core.model.LayerDefinition;
import com.archebuild.core.model.Material;
import com.archebuild.core.model.TypeElementRecord;

import java.util.List;

/**
 * Small type-element databases shared by the core tests.
 *
 * <p>{@link #residential()} covers every category the single family dwelling generates
 * for {@code iwu_heavy}, with two outer wall age groups, plus both window constructions.
 * Nothing is defined for the other construction data.
 */
public final class TestDatabases {

    public static final Material PLASTER = Material.of("plaster", "Kalkzementputz", 1800, 0.87, 1.0);
    public static final Material BRICK = Material.of("brick", "Vollziegel", 1800, 0.81, 1.0);
    public static final Material EPS = Material.of("eps", "EPS", 25, 0.035, 1.5);
    public static final Material CONCRETE = Material.of("concrete", "Stahlbeton", 2400, 2.1, 1.0);
    public static final Material GLASS = new Material("glass", "Fensterglas", 2500, 0.96, 0.75, 0.0, 0.84, 0.9);

    public static final String OLD_OUTER_WALL = "OuterWall_iwu_heavy_0_1918";
    public static final String NEW_OUTER_WALL = "OuterWall_iwu_heavy_1919_2100";
    public static final String DEFAULT_WINDOW = "Window_isolierverglasung";
    public static final String KFW_WINDOW = "Window_dreifach";

    private TestDatabases() {
        // Utility class
    }

    public static InMemoryTypeElementDatabase residential() {
        return InMemoryTypeElementDatabase.builder()
            .version("test")
            .materials(List.of(PLASTER, BRICK, EPS, CONCRETE, GLASS))
            .record(new TypeElementRecord(OLD_OUTER_WALL, new AgeRange(0, 1918), "iwu_heavy",
                ExchangeCoefficients.opaque(5.0, 2.7, 5.0, 20.0),
                List.of(
                    layer("0", 0.015, PLASTER),
                    layer("1", 0.365, BRICK),
                    layer("2", 0.02, PLASTER))))
            .record(new TypeElementRecord(NEW_OUTER_WALL, new AgeRange(1919, 2100), "iwu_heavy",
                ExchangeCoefficients.opaque(5.0, 2.7, 5.0, 25.0),
                List.of(
                    layer("0", 0.015, PLASTER),
                    layer("1", 0.24, BRICK),
                    layer("2", 0.1, EPS))))
            .record(new TypeElementRecord("InnerWall_iwu_heavy", new AgeRange(0, 2100), "iwu_heavy",
                ExchangeCoefficients.inner(5.0, 2.7),
                List.of(layer("0", 0.115, BRICK))))
            .record(new TypeElementRecord("Rooftop_iwu_heavy", new AgeRange(0, 2100), "iwu_heavy",
                ExchangeCoefficients.opaque(5.0, 1.7, 5.0, 20.0),
                List.of(layer("0", 0.2, CONCRETE), layer("1", 0.12, EPS))))
            .record(new TypeElementRecord("GroundFloor_iwu_heavy", new AgeRange(0, 2100), "iwu_heavy",
                ExchangeCoefficients.inner(5.0, 1.7),
                List.of(layer("0", 0.16, CONCRETE))))
            .record(new TypeElementRecord("Ceiling_iwu_heavy", new AgeRange(0, 2100), "iwu_heavy",
                ExchangeCoefficients.inner(5.0, 1.7),
                List.of(layer("0", 0.18, CONCRETE))))
            .record(new TypeElementRecord("Floor_iwu_heavy", new AgeRange(0, 2100), "iwu_heavy",
                ExchangeCoefficients.inner(5.0, 1.7),
                List.of(layer("0", 0.18, CONCRETE))))
            .record(new TypeElementRecord(DEFAULT_WINDOW, new AgeRange(0, 2100), "Kunststofffenster, Isolierverglasung",
                new ExchangeCoefficients(5.0, 2.7, 5.0, 20.0, 0.78, 0.03, 1.0, 100.0),
                List.of(layer("0", 0.024, GLASS))))
            .record(new TypeElementRecord(KFW_WINDOW, new AgeRange(0, 2100), "Waermeschutzverglasung, dreifach",
                new ExchangeCoefficients(5.0, 2.7, 5.0, 20.0, 0.5, 0.03, 1.0, 100.0),
                List.of(layer("0", 0.036, GLASS))))
            .build();
    }

    public static LayerDefinition layer(String id, double thickness, Material material) {
        return new LayerDefinition(id, thickness, material.materialId(), material.name());
    }
}
