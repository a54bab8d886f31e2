package com.archebuild.core.database;

import com.archebuild.core.exception.DatabaseLoadException;
import com.archebuild.core.model.AgeRange;
import com.archebuild.core.model.ExchangeCoefficients;
import com.archebuild.core.model.LayerDefinition;
import com.archebuild.core.model.Material;
import com.archebuild.core.model.TypeElementRecord;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Loads a {@link TypeElementDatabase} from the JSON type-element and material template files.
 *
 * <p>Both files are JSON objects keyed by record key (resp. material id) with one
 * additional {@code "version"} entry. Field order of the {@code layer} object is the
 * stacking order of the construction and is preserved.
 *
 * <p><b>Type element entry:</b>
 * <pre>{@code
 * "OuterWall_1919_1948_iwu_heavy": {
 *   "building_age_group": [1919, 1948],
 *   "construction_type": "iwu_heavy",
 *   "inner_radiation": 5.0, "inner_convection": 2.7,
 *   "outer_radiation": 5.0, "outer_convection": 20.0,
 *   "layer": {
 *     "0": {"thickness": 0.015, "material": {"name": "Lime plaster", "material_id": "2"}}
 *   }
 * }
 * }</pre>
 *
 * <p><b>Material entry:</b>
 * <pre>{@code
 * "2": {"name": "Lime plaster", "density": 1600.0, "thermal_conduc": 0.7, "heat_capac": 1.0}
 * }</pre>
 */
public class JsonTypeElementDatabaseLoader {

    private static final Logger log = LoggerFactory.getLogger(JsonTypeElementDatabaseLoader.class);

    /** Classpath location of the bundled type-element sample data. */
    public static final String BUNDLED_TYPE_ELEMENTS = "/archebuild/data/TypeElements.json";

    /** Classpath location of the bundled material templates. */
    public static final String BUNDLED_MATERIALS = "/archebuild/data/MaterialTemplates.json";

    private static final String VERSION_KEY = "version";

    private final ObjectMapper objectMapper;

    public JsonTypeElementDatabaseLoader() {
        this.objectMapper = new ObjectMapper();
    }

    /**
     * Loads the sample database bundled with this library.
     *
     * @return loaded database
     * @throws DatabaseLoadException if the bundled resources are missing or invalid
     */
    public TypeElementDatabase loadBundled() {
        return loadFromClasspath(BUNDLED_TYPE_ELEMENTS, BUNDLED_MATERIALS);
    }

    /**
     * Loads a database from two files on disk.
     *
     * @param typeElementsFile path to the type-element JSON
     * @param materialsFile path to the material template JSON
     * @return loaded database
     * @throws DatabaseLoadException if a file cannot be read or parsed
     */
    public TypeElementDatabase load(Path typeElementsFile, Path materialsFile) {
        log.debug("Loading type elements from {} and materials from {}", typeElementsFile, materialsFile);
        JsonNode elements = readFile(typeElementsFile);
        JsonNode materials = readFile(materialsFile);
        return assemble(elements, materials, typeElementsFile.toString());
    }

    /**
     * Loads a database from two classpath resources.
     *
     * @param typeElementsResource absolute resource name of the type-element JSON
     * @param materialsResource absolute resource name of the material template JSON
     * @return loaded database
     * @throws DatabaseLoadException if a resource is missing or cannot be parsed
     */
    public TypeElementDatabase loadFromClasspath(String typeElementsResource, String materialsResource) {
        log.debug("Loading type elements from classpath:{} and materials from classpath:{}",
            typeElementsResource, materialsResource);
        JsonNode elements = readResource(typeElementsResource);
        JsonNode materials = readResource(materialsResource);
        return assemble(elements, materials, "classpath:" + typeElementsResource);
    }

    /**
     * Parses already-read JSON content. Mainly useful for tests and embedded data.
     *
     * @param typeElementsJson type-element JSON content
     * @param materialsJson material template JSON content
     * @return loaded database
     */
    public TypeElementDatabase parse(String typeElementsJson, String materialsJson) {
        try {
            return assemble(objectMapper.readTree(typeElementsJson), objectMapper.readTree(materialsJson), "<string>");
        } catch (IOException e) {
            throw new DatabaseLoadException("Failed to parse database JSON: " + e.getMessage(), e);
        }
    }

    private TypeElementDatabase assemble(JsonNode elements, JsonNode materials, String source) {
        if (elements == null || !elements.isObject()) {
            throw new DatabaseLoadException("Type element data must be a JSON object: " + source);
        }
        if (materials == null || !materials.isObject()) {
            throw new DatabaseLoadException("Material data must be a JSON object: " + source);
        }

        InMemoryTypeElementDatabase.Builder builder = InMemoryTypeElementDatabase.builder()
            .version(getTextOrDefault(elements.get(VERSION_KEY), "unknown"));

        int materialCount = 0;
        Iterator<Map.Entry<String, JsonNode>> materialFields = materials.fields();
        while (materialFields.hasNext()) {
            Map.Entry<String, JsonNode> entry = materialFields.next();
            if (VERSION_KEY.equals(entry.getKey())) {
                continue;
            }
            builder.material(parseMaterial(entry.getKey(), entry.getValue()));
            materialCount++;
        }

        int recordCount = 0;
        Iterator<Map.Entry<String, JsonNode>> elementFields = elements.fields();
        while (elementFields.hasNext()) {
            Map.Entry<String, JsonNode> entry = elementFields.next();
            if (VERSION_KEY.equals(entry.getKey())) {
                continue;
            }
            builder.record(parseRecord(entry.getKey(), entry.getValue()));
            recordCount++;
        }

        log.info("Loaded {} type elements and {} materials from {}", recordCount, materialCount, source);
        return builder.build();
    }

    private TypeElementRecord parseRecord(String key, JsonNode node) {
        if (!node.isObject()) {
            throw new DatabaseLoadException("Type element '" + key + "' is not a JSON object");
        }

        JsonNode ageNode = node.has("building_age_group") ? node.get("building_age_group") : node.get("age_range");
        if (ageNode == null || !ageNode.isArray() || ageNode.size() != 2) {
            throw new DatabaseLoadException("Type element '" + key + "' needs a two-element building_age_group");
        }
        AgeRange ageRange = new AgeRange(ageNode.get(0).asInt(), ageNode.get(1).asInt());

        String constructionType = extractText(node, "construction_type");
        if (constructionType == null) {
            throw new DatabaseLoadException("Type element '" + key + "' has no construction_type");
        }

        ExchangeCoefficients coefficients = new ExchangeCoefficients(
            getDouble(node, "inner_radiation"),
            getDouble(node, "inner_convection"),
            getDouble(node, "outer_radiation"),
            getDouble(node, "outer_convection"),
            getDouble(node, "g_value"),
            getDouble(node, "a_conv"),
            getDouble(node, "shading_g_total"),
            getDouble(node, "shading_max_irr")
        );

        return new TypeElementRecord(key, ageRange, constructionType, coefficients, parseLayers(key, node.get("layer")));
    }

    private List<LayerDefinition> parseLayers(String key, JsonNode layerNode) {
        List<LayerDefinition> layers = new ArrayList<>();
        if (layerNode == null || layerNode.isNull()) {
            return layers;
        }
        if (!layerNode.isObject()) {
            throw new DatabaseLoadException("Layers of type element '" + key + "' must be a JSON object");
        }

        Iterator<Map.Entry<String, JsonNode>> fields = layerNode.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> entry = fields.next();
            JsonNode layer = entry.getValue();
            JsonNode material = layer.get("material");
            String materialId = extractText(material, "material_id");
            Double thickness = getDouble(layer, "thickness");
            if (materialId == null || thickness == null) {
                throw new DatabaseLoadException(
                    "Layer '" + entry.getKey() + "' of type element '" + key + "' needs thickness and material_id");
            }
            if (!(thickness > 0.0)) {
                throw new DatabaseLoadException(
                    "Layer '" + entry.getKey() + "' of type element '" + key + "' has non-positive thickness " + thickness);
            }
            layers.add(new LayerDefinition(entry.getKey(), thickness, materialId, extractText(material, "name")));
        }
        return layers;
    }

    private Material parseMaterial(String materialId, JsonNode node) {
        Double density = getDouble(node, "density");
        Double conductivity = getDouble(node, "thermal_conduc");
        Double heatCapacity = getDouble(node, "heat_capac");
        if (density == null || conductivity == null || heatCapacity == null) {
            throw new DatabaseLoadException(
                "Material '" + materialId + "' needs density, thermal_conduc and heat_capac");
        }
        return new Material(
            materialId,
            extractText(node, "name"),
            density,
            conductivity,
            heatCapacity,
            getDouble(node, "solar_absorp"),
            getDouble(node, "ir_emissivity"),
            getDouble(node, "transmittance")
        );
    }

    // ==================== JsonNode Navigation Utilities ====================

    private JsonNode readFile(Path file) {
        if (!Files.isRegularFile(file) || !Files.isReadable(file)) {
            throw new DatabaseLoadException("Database file is not readable: " + file);
        }
        try {
            return objectMapper.readTree(file.toFile());
        } catch (IOException e) {
            throw new DatabaseLoadException("Failed to parse database file " + file + ": " + e.getMessage(), e);
        }
    }

    private JsonNode readResource(String resource) {
        try (InputStream in = JsonTypeElementDatabaseLoader.class.getResourceAsStream(resource)) {
            if (in == null) {
                throw new DatabaseLoadException("Database resource not found on classpath: " + resource);
            }
            return objectMapper.readTree(in);
        } catch (IOException e) {
            throw new DatabaseLoadException("Failed to parse database resource " + resource + ": " + e.getMessage(), e);
        }
    }

    private String extractText(JsonNode node, String fieldName) {
        if (node == null) {
            return null;
        }
        JsonNode child = node.get(fieldName);
        if (child == null || child.isNull()) {
            return null;
        }
        return child.asText();
    }

    private String getTextOrDefault(JsonNode node, String defaultValue) {
        if (node == null || !node.isValueNode() || node.isNull()) {
            return defaultValue;
        }
        return node.asText();
    }

    private Double getDouble(JsonNode node, String fieldName) {
        if (node == null) {
            return null;
        }
        JsonNode child = node.get(fieldName);
        if (child == null || !child.isNumber()) {
            return null;
        }
        return child.asDouble();
    }
}
