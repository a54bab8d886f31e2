package com.archebuild.core.building;

import com.archebuild.core.model.ElementCategory;

/**
 * Interior ceiling between two storeys of the same zone.
 */
public class Ceiling extends BuildingElement {

    @Override
    public ElementCategory category() {
        return ElementCategory.CEILING;
    }
}
