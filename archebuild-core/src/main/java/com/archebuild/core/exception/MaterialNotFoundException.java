package com.archebuild.core.exception;

/**
 * Thrown when a layer definition references a material id the database does not hold.
 */
public class MaterialNotFoundException extends ArcheBuildException {

    private final String materialId;

    public MaterialNotFoundException(String materialId) {
        super("Material not found in database: " + materialId);
        this.materialId = materialId;
    }

    public String getMaterialId() {
        return materialId;
    }
}
