package com.archebuild.core.report.impl;

import com.archebuild.core.building.Building;
import com.archebuild.core.building.OuterWall;
import com.archebuild.core.building.ThermalZone;
import com.archebuild.core.model.ConstructionData;
import com.archebuild.core.report.EnvelopeReport;
import com.archebuild.core.renderer.GeneratedFile;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link JsonReportGenerator}.
 */
class JsonReportGeneratorTest {

    private final JsonReportGenerator generator = new JsonReportGenerator();

    @Test
    void generate_building_writesReadableJson() throws Exception {
        Building building = new Building("Row House 3", 1955, 2, 2.7, ConstructionData.IWU_HEAVY);
        ThermalZone zone = building.addThermalZone("Living");
        zone.setArea(85.0);
        OuterWall wall = zone.addElement(new OuterWall());
        wall.setName("Facade");
        wall.setOrientation(180.0);
        wall.setArea(42.5);

        GeneratedFile file = generator.generate(EnvelopeReport.from(building));

        assertThat(file.relativePath()).isEqualTo("row-house-3.json");
        assertThat(file.contentType()).isEqualTo("application/json");
        assertThat(file.content()).contains(System.lineSeparator());

        JsonNode root = new ObjectMapper().readTree(file.content());
        assertThat(root.get("buildingName").asText()).isEqualTo("Row House 3");
        assertThat(root.get("constructionData").asText()).isEqualTo("iwu_heavy");
        assertThat(root.get("estimate").isNull()).isTrue();
        JsonNode element = root.get("zones").get(0).get("elements").get(0);
        assertThat(element.get("category").asText()).isEqualTo("OUTER_WALL");
        assertThat(element.get("area").asDouble()).isEqualTo(42.5);
        assertThat(element.get("typeElementKey").isNull()).isTrue();
    }
}
