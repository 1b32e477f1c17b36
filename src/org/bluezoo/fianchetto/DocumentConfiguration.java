/*
 * DocumentConfiguration.java
 * Copyright (C) 2025 Chris Burdess
 *
 * This file is part of Fianchetto, a PDF document object model.
 *
 * Fianchetto is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Lesser General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * Fianchetto is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Lesser General Public License for more details.
 *
 * You should have received a copy of the GNU Lesser General Public License
 * along with Fianchetto.  If not, see <http://www.gnu.org/licenses/>.
 */

package org.bluezoo.fianchetto;

import java.io.IOException;
import java.io.InputStream;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Properties;
import java.util.Set;

/**
 * Configuration of a {@link PDFDocument}.
 * <p>
 * A typed view over {@link Properties}. The defaults are read from the
 * resource {@code fianchetto.properties} next to this class; properties
 * given to the constructor override them.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class DocumentConfiguration {

    public static final String DEFAULT_VERSION = "document.defaultVersion";
    public static final String OBJECT_STREAM_GROUP_SIZE = "optimize.objectStreams.groupSize";
    public static final String OBJECT_STREAM_EXCLUDED_TYPES = "optimize.objectStreams.excludedTypes";
    public static final String STREAM_FILTER = "optimize.streamFilter";
    public static final String SCHEMA_RESOURCE = "schema.resource";

    private static final String DEFAULTS_RESOURCE = "fianchetto.properties";

    private final Properties properties;

    /**
     * Creates a configuration with the default values.
     */
    public DocumentConfiguration() {
        this(null);
    }

    /**
     * Creates a configuration.
     *
     * @param overrides properties that replace the defaults, or null
     */
    public DocumentConfiguration(Properties overrides) {
        this.properties = new Properties();
        try (InputStream in = DocumentConfiguration.class.getResourceAsStream(DEFAULTS_RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Default configuration not found: " + DEFAULTS_RESOURCE);
            }
            properties.load(in);
        } catch (IOException e) {
            throw new IllegalStateException("Cannot read default configuration", e);
        }
        if (overrides != null) {
            for (String key : overrides.stringPropertyNames()) {
                properties.setProperty(key, overrides.getProperty(key));
            }
        }
    }

    public String getProperty(String key) {
        return properties.getProperty(key);
    }

    public void setProperty(String key, String value) {
        properties.setProperty(key, value);
    }

    /**
     * Returns the PDF version of new documents.
     *
     * @return the version, e.g. "1.2"
     * @throws IllegalArgumentException if the configured value is not a
     *         valid version
     */
    public String getDefaultVersion() {
        String version = properties.getProperty(DEFAULT_VERSION, "1.2").trim();
        if (!PDFDocument.isValidVersion(version)) {
            throw new IllegalArgumentException("Invalid " + DEFAULT_VERSION + ": " + version);
        }
        return version;
    }

    /**
     * Returns the maximum number of objects in a generated object stream.
     *
     * @return the group size
     * @throws IllegalArgumentException if the configured value is not a
     *         positive integer
     */
    public int getObjectStreamGroupSize() {
        String value = properties.getProperty(OBJECT_STREAM_GROUP_SIZE, "200").trim();
        int size;
        try {
            size = Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid " + OBJECT_STREAM_GROUP_SIZE + ": " + value, e);
        }
        if (size <= 0) {
            throw new IllegalArgumentException("Invalid " + OBJECT_STREAM_GROUP_SIZE + ": " + value);
        }
        return size;
    }

    /**
     * Returns the dictionary types that are never stored in object
     * streams.
     *
     * @return the excluded types
     */
    public Set<Name> getObjectStreamExcludedTypes() {
        String value = properties.getProperty(OBJECT_STREAM_EXCLUDED_TYPES, "");
        Set<Name> types = new LinkedHashSet<>();
        for (String token : value.split("[,\\s]+")) {
            if (token.startsWith("/")) {
                token = token.substring(1);
            }
            if (!token.isEmpty()) {
                types.add(Name.of(token));
            }
        }
        return Collections.unmodifiableSet(types);
    }

    /**
     * Returns the filter for generated object streams and cross-reference
     * streams.
     *
     * @return the filter name, or null to leave the data unencoded
     */
    public Name getStreamFilter() {
        String value = properties.getProperty(STREAM_FILTER, "FlateDecode").trim();
        if (value.isEmpty() || "none".equalsIgnoreCase(value)) {
            return null;
        }
        return Name.of(value.startsWith("/") ? value.substring(1) : value);
    }

    public String getSchemaResource() {
        return properties.getProperty(SCHEMA_RESOURCE, "field-schema.txt").trim();
    }

}
