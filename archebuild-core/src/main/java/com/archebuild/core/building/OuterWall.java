package com.archebuild.core.building;

import com.archebuild.core.model.ElementCategory;

/**
 * Exterior wall facing ambient air.
 */
public class OuterWall extends OpaqueEnvelopeElement {

    @Override
    public ElementCategory category() {
        return ElementCategory.OUTER_WALL;
    }
}
