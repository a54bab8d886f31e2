package com.archebuild.cli;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Small database with outer walls and windows only.
 */
final class TestData {

    private TestData() {
        // Utility class
    }

    static void writeFixtureDatabase(Path directory) throws IOException {
        Files.writeString(directory.resolve("TypeElements.json"), """
            {
              "version": "cli-fixture",
              "OuterWall_iwu_heavy_0_1976": {
                "building_age_group": [0, 1976],
                "construction_type": "iwu_heavy",
                "inner_radiation": 5.0,
                "inner_convection": 2.7,
                "outer_radiation": 5.0,
                "outer_convection": 20.0,
                "layer": {
                  "0": {"thickness": 0.015, "material": {"name": "Kalkzementputz", "material_id": "plaster"}},
                  "1": {"thickness": 0.365, "material": {"name": "Vollziegel", "material_id": "brick"}}
                }
              },
              "Window_isolierverglasung": {
                "building_age_group": [0, 2100],
                "construction_type": "Kunststofffenster, Isolierverglasung",
                "inner_radiation": 5.0,
                "inner_convection": 2.7,
                "outer_radiation": 5.0,
                "outer_convection": 20.0,
                "g_value": 0.78,
                "layer": {
                  "0": {"thickness": 0.024, "material": {"name": "Fensterglas", "material_id": "glass"}}
                }
              }
            }
            """);
        Files.writeString(directory.resolve("MaterialTemplates.json"), """
            {
              "version": "cli-fixture",
              "plaster": {"name": "Kalkzementputz", "density": 1800, "thermal_conduc": 0.87, "heat_capac": 1.0},
              "brick": {"name": "Vollziegel", "density": 1800, "thermal_conduc": 0.81, "heat_capac": 1.0},
              "glass": {"name": "Fensterglas", "density": 2500, "thermal_conduc": 0.96, "heat_capac": 0.75}
            }
            """);
    }

    static void writeBrokenDatabase(Path directory) throws IOException {
        writeFixtureDatabase(directory);
        Files.writeString(directory.resolve("MaterialTemplates.json"), """
            {
              "version": "cli-fixture",
              "plaster": {"name": "Kalkzementputz", "density": 1800, "thermal_conduc": 0.87, "heat_capac": 1.0}
            }
            """);
    }
}
