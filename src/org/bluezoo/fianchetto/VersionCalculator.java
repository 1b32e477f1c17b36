/*
 * VersionCalculator.java
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
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Computes the lowest PDF version that can express a document.
 * <p>
 * Every field of a known dictionary type that was introduced in a later
 * version raises the requirement. Direct dictionaries nested in a field
 * are examined too, with the field definitions of their own /Type, or of
 * the type the field declares for its value. The version of the document
 * is raised to the result but never lowered.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class VersionCalculator {

    private static final Logger logger = Logger.getLogger(VersionCalculator.class.getName());

    static final Name TRAILER = Name.of("Trailer");

    private final PDFDocument document;
    private final FieldSchema schema;

    public VersionCalculator(PDFDocument document) {
        this.document = document;
        this.schema = document.getFieldSchema();
    }

    /**
     * Returns the version the objects of the document require.
     *
     * @return the required version, or null if no field requires one
     * @throws IOException if an I/O error occurs while loading objects
     */
    public String calculate() throws IOException {
        String required = minimum(document.getTrailer(), TRAILER, null);
        for (IndirectObject obj : document.objects(true)) {
            Map<Name, Object> dict = obj.getDictionary();
            if (dict != null) {
                required = minimum(dict, null, required);
            }
        }
        return required;
    }

    /**
     * Raises the document version to the required version if it is lower.
     *
     * @return the document version afterwards
     * @throws IOException if an I/O error occurs while loading objects
     */
    public String run() throws IOException {
        String required = calculate();
        String current = document.getVersion();
        if (required != null && PDFDocument.compareVersions(required, current) > 0) {
            logger.log(Level.FINE, () -> String.format("raising PDF version from %s to %s", current, required));
            document.setVersion(required);
            return required;
        }
        return current;
    }

    private String minimum(Map<Name, Object> dict, Name impliedType, String required) {
        Name type = impliedType;
        Object declared = dict.get(Name.TYPE);
        if (declared instanceof Name && schema.hasType((Name) declared)) {
            type = (Name) declared;
        }
        if (type == null || !schema.hasType(type)) {
            return required;
        }
        for (Map.Entry<Name, Object> entry : dict.entrySet()) {
            FieldDefinition field = schema.getField(type, entry.getKey());
            if (field == null) {
                continue;
            }
            required = max(required, field.getVersion());
            Object value = entry.getValue();
            if (value instanceof Map) {
                @SuppressWarnings("unchecked")
                Map<Name, Object> nested = (Map<Name, Object>) value;
                required = minimum(nested, field.getNestedType(), required);
            }
        }
        return required;
    }

    private static String max(String a, String b) {
        if (a == null) {
            return b;
        }
        if (b == null) {
            return a;
        }
        return PDFDocument.compareVersions(a, b) >= 0 ? a : b;
    }

}
