package com.questrail.telemetry.schema;

import java.io.ByteArrayInputStream;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Where a schema document is read from.
 *
 * <p>Each call to {@link #open()} must return a fresh stream positioned at the
 * start of the document so that the same source can be reloaded.</p>
 */
public interface SchemaSource
{
    InputStream open() throws IOException;

    /** Human-readable origin, used in operator-facing events. */
    String description();

    static SchemaSource ofPath(Path path) {
        Objects.requireNonNull(path, "path");
        return new SchemaSource() {
            @Override
            public InputStream open() throws IOException {
                return Files.newInputStream(path);
            }

            @Override
            public String description() {
                return path.toString();
            }
        };
    }

    static SchemaSource ofClasspath(String resource) {
        Objects.requireNonNull(resource, "resource");
        return new SchemaSource() {
            @Override
            public InputStream open() throws IOException {
                InputStream in = SchemaSource.class.getClassLoader().getResourceAsStream(resource);
                if (in == null) {
                    throw new FileNotFoundException("classpath:" + resource);
                }
                return in;
            }

            @Override
            public String description() {
                return "classpath:" + resource;
            }
        };
    }

    static SchemaSource ofString(String json) {
        Objects.requireNonNull(json, "json");
        byte[] bytes = json.getBytes(StandardCharsets.UTF_8);
        return new SchemaSource() {
            @Override
            public InputStream open() {
                return new ByteArrayInputStream(bytes);
            }

            @Override
            public String description() {
                return "inline";
            }
        };
    }
}
