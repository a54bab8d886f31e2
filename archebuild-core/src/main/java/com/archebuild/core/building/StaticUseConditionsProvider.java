package com.archebuild.core.building;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * {@link UseConditionsProvider} backed by a fixed table, falling back to a 6 m x 6 m
 * typical room for unknown usages.
 */
public class StaticUseConditionsProvider implements UseConditionsProvider {

    static final double DEFAULT_TYPICAL_LENGTH = 6.0;
    static final double DEFAULT_TYPICAL_WIDTH = 6.0;

    private final Map<String, UseConditions> table = new HashMap<>();

    /**
     * Registers use conditions for their usage type, replacing any earlier entry.
     *
     * @param conditions use conditions
     * @return this provider
     */
    public StaticUseConditionsProvider with(UseConditions conditions) {
        Objects.requireNonNull(conditions, "conditions must not be null");
        table.put(conditions.usage(), conditions);
        return this;
    }

    @Override
    public UseConditions forUsage(String usage) {
        UseConditions conditions = table.get(usage);
        if (conditions != null) {
            return conditions;
        }
        return new UseConditions(usage, DEFAULT_TYPICAL_LENGTH, DEFAULT_TYPICAL_WIDTH);
    }
}
