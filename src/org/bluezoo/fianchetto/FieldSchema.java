/*
 * FieldSchema.java
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

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Field definitions of the PDF dictionary types, keyed by type name.
 * <p>
 * The schema is data: it is read from a text resource with one field per
 * line,
 * <pre>
 *   /Type /Field required|optional version nestedType [default]
 * </pre>
 * where version and nestedType may be "-" for none, and the default, if
 * present, is the rest of the line in PDF syntax. Lines starting with '#'
 * are comments.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class FieldSchema {

    private static final Pattern LINE = Pattern.compile(
        "/(\\S+)\\s+/(\\S+)\\s+(required|optional)\\s+(\\S+)\\s+(\\S+)(?:\\s+(.*))?");

    private final Map<Name, Map<Name, FieldDefinition>> types;

    /**
     * Creates an empty schema.
     */
    public FieldSchema() {
        this.types = new HashMap<>();
    }

    /**
     * Loads the schema resource named by a configuration.
     *
     * @param configuration the configuration
     * @return the schema
     * @throws IllegalStateException if the resource is missing or invalid
     */
    public static FieldSchema load(DocumentConfiguration configuration) {
        String resource = configuration.getSchemaResource();
        try (InputStream in = FieldSchema.class.getResourceAsStream(resource)) {
            if (in == null) {
                throw new IllegalStateException("Field schema resource not found: " + resource);
            }
            FieldSchema schema = new FieldSchema();
            schema.load(in);
            return schema;
        } catch (IOException e) {
            throw new IllegalStateException("Cannot read field schema " + resource, e);
        }
    }

    /**
     * Adds the field definitions read from a stream.
     *
     * @param in the schema text, UTF-8
     * @throws IOException if an I/O error occurs
     * @throws IllegalArgumentException if a line is malformed
     */
    public void load(InputStream in) throws IOException {
        BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
        String line;
        int lineNumber = 0;
        while ((line = reader.readLine()) != null) {
            lineNumber++;
            line = line.trim();
            if (line.isEmpty() || line.startsWith("#")) {
                continue;
            }
            Matcher m = LINE.matcher(line);
            if (!m.matches()) {
                throw new IllegalArgumentException("Malformed field definition at line " + lineNumber + ": " + line);
            }
            Name type = Name.of(m.group(1));
            Name field = Name.of(m.group(2));
            boolean required = "required".equals(m.group(3));
            String version = "-".equals(m.group(4)) ? null : m.group(4);
            Name nestedType = "-".equals(m.group(5)) ? null : Name.of(m.group(5));
            Object defaultValue = null;
            if (m.group(6) != null && !m.group(6).isEmpty()) {
                try {
                    defaultValue = PDFTokenizer.parseValue(m.group(6));
                } catch (PDFParseException e) {
                    throw new IllegalArgumentException("Invalid default at line " + lineNumber + ": " + m.group(6), e);
                }
            }
            register(type, new FieldDefinition(field, required, defaultValue, version, nestedType));
        }
    }

    /**
     * Adds or replaces a field definition.
     *
     * @param type the dictionary type
     * @param field the field definition
     */
    public void register(Name type, FieldDefinition field) {
        types.computeIfAbsent(type, k -> new LinkedHashMap<>()).put(field.getName(), field);
    }

    public boolean hasType(Name type) {
        return type != null && types.containsKey(type);
    }

    /**
     * Returns the definition of a field.
     *
     * @param type the dictionary type
     * @param field the field name
     * @return the definition, or null if the type or field is unknown
     */
    public FieldDefinition getField(Name type, Name field) {
        Map<Name, FieldDefinition> fields = types.get(type);
        return fields != null ? fields.get(field) : null;
    }

    /**
     * Returns the definitions of all fields of a type.
     *
     * @param type the dictionary type
     * @return the field definitions in schema order, empty for an unknown
     *         type
     */
    public Collection<FieldDefinition> getFields(Name type) {
        Map<Name, FieldDefinition> fields = types.get(type);
        return fields != null ? Collections.unmodifiableCollection(fields.values())
                              : Collections.<FieldDefinition>emptyList();
    }

}
