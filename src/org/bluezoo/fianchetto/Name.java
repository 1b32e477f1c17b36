/*
 * Name.java
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

import java.util.HashMap;
import java.util.Map;

/**
 * A PDF name object.
 * <p>
 * Names are case-sensitive atomic symbols. They are used as dictionary
 * keys throughout the object model, so the names this library consults
 * itself are available as constants, and {@link #of(String)} returns a
 * shared instance for every other name.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class Name implements Comparable<Name> {

    private static final Map<String, Name> INTERNED = new HashMap<>();

    public static final Name TYPE = of("Type");
    public static final Name SIZE = of("Size");
    public static final Name PREV = of("Prev");
    public static final Name ROOT = of("Root");
    public static final Name INFO = of("Info");
    public static final Name ENCRYPT = of("Encrypt");
    public static final Name ID = of("ID");
    public static final Name XREF_STM = of("XRefStm");
    public static final Name LENGTH = of("Length");
    public static final Name FILTER = of("Filter");
    public static final Name DECODE_PARMS = of("DecodeParms");
    public static final Name N = of("N");
    public static final Name FIRST = of("First");
    public static final Name W = of("W");
    public static final Name INDEX = of("Index");
    public static final Name VERSION = of("Version");
    public static final Name CATALOG = of("Catalog");
    public static final Name OBJ_STM = of("ObjStm");
    public static final Name XREF = of("XRef");
    public static final Name FLATE_DECODE = of("FlateDecode");

    private final String value;
    private final int hashCode;

    /**
     * Creates a new name with the specified value.
     *
     * @param value the name value (without the leading solidus)
     * @throws NullPointerException if value is null
     * @throws IllegalArgumentException if value contains null characters
     */
    public Name(String value) {
        if (value == null) {
            throw new NullPointerException("Name value cannot be null");
        }
        if (value.indexOf('\0') >= 0) {
            throw new IllegalArgumentException("Name cannot contain null character");
        }
        this.value = value;
        this.hashCode = value.hashCode();
    }

    /**
     * Returns the shared name instance for the given value.
     *
     * @param value the name value (without the leading solidus)
     * @return the name
     */
    public static Name of(String value) {
        synchronized (INTERNED) {
            Name name = INTERNED.get(value);
            if (name == null) {
                name = new Name(value);
                INTERNED.put(value, name);
            }
            return name;
        }
    }

    /**
     * Returns the string value of this name.
     *
     * @return the name value
     */
    public String getValue() {
        return value;
    }

    @Override
    public int compareTo(Name other) {
        return value.compareTo(other.value);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj instanceof Name) {
            Name other = (Name) obj;
            return value.equals(other.value);
        }
        return false;
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    /**
     * Returns the string representation of this name in PDF syntax.
     *
     * @return the name prefixed with a solidus
     */
    @Override
    public String toString() {
        return "/" + value;
    }

}
