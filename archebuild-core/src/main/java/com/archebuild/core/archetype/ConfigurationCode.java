package com.archebuild.core.archetype;

/**
 * Integer code identifying one entry of an estimation coefficient table.
 */
public interface ConfigurationCode {

    /**
     * @return code as used in archetype inputs (e.g. {@code attic = 2})
     */
    int code();
}
