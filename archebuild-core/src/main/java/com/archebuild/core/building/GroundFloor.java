package com.archebuild.core.building;

import com.archebuild.core.model.ElementCategory;

/**
 * Floor slab in contact with the ground.
 */
public class GroundFloor extends BuildingElement {

    @Override
    public ElementCategory category() {
        return ElementCategory.GROUND_FLOOR;
    }
}
