package org.streamhttp.https;

import org.streamhttp.ConfigException;

/**
 * How a string of certificate or key material is read.
 */
public enum StorageMode {
    /**
     * Shorter than {@link MaterialSource#PATH_MAX} characters is a path, anything longer is inline data.
     */
    GUESS,
    FILE,
    DATA;

    public static StorageMode parse(String value) {
        if (value == null || value.isBlank()) {
            return GUESS;
        }
        switch (value.trim().toLowerCase()) {
            case "guess": return GUESS;
            case "file": return FILE;
            case "data": return DATA;
            default: throw new ConfigException("invalid storage mode: " + value);
        }
    }
}
