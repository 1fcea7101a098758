package com.e2eq.persistence.backend;

import com.e2eq.persistence.exceptions.ConfigurationException;

import java.util.Arrays;
import java.util.stream.Collectors;

public enum BackendType {
    JSON("json"),
    SQLITE("sqlite"),
    POSTGRESQL("postgresql");

    private final String externalName;

    BackendType(String externalName) {
        this.externalName = externalName;
    }

    /** The name used in configuration and in backup documents. */
    public String externalName() {
        return externalName;
    }

    public static BackendType fromName(String name) {
        if (name != null) {
            for (BackendType type : values()) {
                if (type.externalName.equalsIgnoreCase(name.trim())) {
                    return type;
                }
            }
        }
        throw new ConfigurationException(String.format("Unsupported backend type: %s, expected one of %s", name,
                Arrays.stream(values()).map(BackendType::externalName).collect(Collectors.joining(", "))));
    }

    @Override
    public String toString() {
        return externalName;
    }
}
