package com.vidnyan.statute.domain.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Geographic region granularity. Each kind reads one entity attribute.
 */
public enum RegionType {
    COUNTRY("country"),
    STATE("state"),
    CITY("city"),
    DISTRICT("district"),
    POSTAL_CODE("postal_code");

    private final String attributeKey;

    RegionType(String attributeKey) {
        this.attributeKey = attributeKey;
    }

    /**
     * Entity attribute holding the region value for this kind.
     */
    public String attributeKey() {
        return attributeKey;
    }

    public static Optional<RegionType> fromName(String name) {
        String normalized = name.toUpperCase(Locale.ROOT);
        for (RegionType type : values()) {
            if (type.name().equals(normalized)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
