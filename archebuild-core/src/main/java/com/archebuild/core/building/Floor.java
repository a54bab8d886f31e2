package com.archebuild.core.building;

import com.archebuild.core.model.ElementCategory;

/**
 * Interior floor between two storeys of the same zone.
 */
public class Floor extends BuildingElement {

    @Override
    public ElementCategory category() {
        return ElementCategory.FLOOR;
    }
}
