/*
 * FieldDefinition.java
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

import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Definition of one field of a dictionary type.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class FieldDefinition {

    private final Name name;
    private final boolean required;
    private final Object defaultValue;
    private final String version;
    private final Name nestedType;

    /**
     * Creates a field definition.
     *
     * @param name the dictionary key
     * @param required whether the field must be present
     * @param defaultValue the value a reader assumes when the field is
     *        absent, or null if there is none
     * @param version the PDF version that introduced the field, e.g. "1.5",
     *        or null if it has always existed
     * @param nestedType the dictionary type of the field value, or null
     */
    public FieldDefinition(Name name, boolean required, Object defaultValue, String version, Name nestedType) {
        if (name == null) {
            throw new NullPointerException("Field name cannot be null");
        }
        if (version != null && !PDFDocument.isValidVersion(version)) {
            throw new IllegalArgumentException("Invalid PDF version: " + version);
        }
        this.name = name;
        this.required = required;
        this.defaultValue = defaultValue;
        this.version = version;
        this.nestedType = nestedType;
    }

    public Name getName() {
        return name;
    }

    public boolean isRequired() {
        return required;
    }

    public boolean hasDefault() {
        return defaultValue != null;
    }

    public Object getDefault() {
        return defaultValue;
    }

    public String getVersion() {
        return version;
    }

    public Name getNestedType() {
        return nestedType;
    }

    /**
     * Returns whether a value equals the default of this field. Numbers
     * are compared by value, so 0 and 0.0 are equal.
     *
     * @param value the field value
     * @return true if the field has a default and the value equals it
     */
    public boolean isDefault(Object value) {
        return defaultValue != null && sameValue(value, defaultValue);
    }

    private static boolean sameValue(Object a, Object b) {
        if (a instanceof Number && b instanceof Number) {
            return ((Number) a).doubleValue() == ((Number) b).doubleValue();
        }
        if (a instanceof List && b instanceof List) {
            List<?> la = (List<?>) a;
            List<?> lb = (List<?>) b;
            if (la.size() != lb.size()) {
                return false;
            }
            for (int i = 0; i < la.size(); i++) {
                if (!sameValue(la.get(i), lb.get(i))) {
                    return false;
                }
            }
            return true;
        }
        if (a instanceof Map && b instanceof Map) {
            Map<?, ?> ma = (Map<?, ?>) a;
            Map<?, ?> mb = (Map<?, ?>) b;
            if (ma.size() != mb.size()) {
                return false;
            }
            Iterator<? extends Map.Entry<?, ?>> i = ma.entrySet().iterator();
            while (i.hasNext()) {
                Map.Entry<?, ?> entry = i.next();
                if (!mb.containsKey(entry.getKey()) || !sameValue(entry.getValue(), mb.get(entry.getKey()))) {
                    return false;
                }
            }
            return true;
        }
        return a != null && a.equals(b);
    }

    @Override
    public String toString() {
        return "FieldDefinition[" + name + (required ? ", required" : "") +
               (version != null ? ", " + version : "") + "]";
    }

}
