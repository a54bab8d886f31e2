package com.archebuild.core.building;

import com.archebuild.core.model.ElementCategory;

/**
 * Interior partition wall within a zone.
 */
public class InnerWall extends BuildingElement {

    @Override
    public ElementCategory category() {
        return ElementCategory.INNER_WALL;
    }
}
