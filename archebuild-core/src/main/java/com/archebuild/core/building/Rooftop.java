package com.archebuild.core.building;

import com.archebuild.core.model.ElementCategory;

/**
 * Roof of the topmost zone.
 */
public class Rooftop extends OpaqueEnvelopeElement {

    @Override
    public ElementCategory category() {
        return ElementCategory.ROOFTOP;
    }
}
