package com.archebuild.core.building;

import com.archebuild.core.model.ElementCategory;

/**
 * Exterior door.
 */
public class Door extends OpaqueEnvelopeElement {

    @Override
    public ElementCategory category() {
        return ElementCategory.DOOR;
    }
}
