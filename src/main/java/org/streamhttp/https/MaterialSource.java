package org.streamhttp.https;

import org.streamhttp.ConfigException;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * PEM material (certificate chain or private key) given inline or as a file.
 */
public final class MaterialSource {

    public static final int PATH_MAX = 256;

    private final byte[] data;
    private final Path path;

    private MaterialSource(byte[] data, Path path) {
        this.data = data;
        this.path = path;
    }

    public static MaterialSource of(byte[] data) {
        return new MaterialSource(data.clone(), null);
    }

    public static MaterialSource of(Path path) {
        return new MaterialSource(null, path);
    }

    /**
     * Resolves a string the way the storage mode says: a file path, inline
     * data, or a guess based on its length.
     */
    public static MaterialSource of(String input, StorageMode mode) {
        if (input == null) {
            throw new ConfigException("missing certificate or key material");
        }
        switch (mode) {
            case FILE:
                return of(Paths.get(input));
            case DATA:
                return of(input.getBytes(StandardCharsets.US_ASCII));
            default:
                return input.length() < PATH_MAX ? of(Paths.get(input)) : of(input.getBytes(StandardCharsets.US_ASCII));
        }
    }

    public boolean isFile() {
        return path != null;
    }

    public byte[] read() {
        if (data != null) {
            return data.clone();
        }
        try {
            return Files.readAllBytes(path);
        } catch (IOException e) {
            throw new ConfigException("cannot read " + path, e);
        }
    }

    public InputStream open() {
        return new ByteArrayInputStream(read());
    }

    @Override
    public String toString() {
        return path != null ? path.toString() : "<inline " + data.length + " bytes>";
    }
}
