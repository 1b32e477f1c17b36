/*
 * IndirectObject.java
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

import java.util.Map;

/**
 * A materialized PDF indirect object.
 * <p>
 * The value uses the following Java types:
 * <ul>
 *   <li>null - the PDF null object</li>
 *   <li>{@link Boolean}, {@link Integer}, {@link Long}, {@link Double}</li>
 *   <li>{@link String} - a PDF string, one char per byte</li>
 *   <li>{@link Name}</li>
 *   <li>{@code List<Object>} - an array</li>
 *   <li>{@code Map<Name, Object>} - a dictionary</li>
 *   <li>{@link ObjectId} - a reference to another indirect object</li>
 *   <li>{@code IndirectObject} - a shared handle to another indirect
 *       object, left in place of a reference by the {@link Dereferencer}</li>
 * </ul>
 * A stream object has a dictionary value and the raw stream bytes, still
 * encoded with the filters named by the dictionary.
 * <p>
 * Instances are owned by the {@link Revision} that loaded or received
 * them; a resolver always hands out the same instance for an identity, so
 * graph algorithms may compare objects with {@code ==}.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class IndirectObject {

    private ObjectId id;
    private Object value;
    private byte[] stream;

    /**
     * Creates an indirect object without stream data.
     *
     * @param id the object identity
     * @param value the object value
     */
    public IndirectObject(ObjectId id, Object value) {
        this(id, value, null);
    }

    /**
     * Creates an indirect object.
     *
     * @param id the object identity
     * @param value the object value; must be a dictionary if stream is given
     * @param stream the raw stream bytes, or null for a non-stream object
     */
    public IndirectObject(ObjectId id, Object value, byte[] stream) {
        if (id == null) {
            throw new NullPointerException("Object identity cannot be null");
        }
        if (stream != null && !(value instanceof Map)) {
            throw new IllegalArgumentException("A stream needs a dictionary value: " + id);
        }
        this.id = id;
        this.value = value;
        this.stream = stream;
    }

    /**
     * Returns the identity of this object.
     *
     * @return the object identity
     */
    public ObjectId getId() {
        return id;
    }

    /**
     * Changes the identity of this object.
     * <p>
     * Only compaction renumbers objects: every handle to this object that
     * the dereferencer left in the graph follows the new identity.
     */
    void setId(ObjectId id) {
        this.id = id;
    }

    public Object getValue() {
        return value;
    }

    public void setValue(Object value) {
        if (stream != null && !(value instanceof Map)) {
            throw new IllegalArgumentException("A stream needs a dictionary value: " + id);
        }
        this.value = value;
    }

    /**
     * Returns the raw stream bytes.
     *
     * @return the stream bytes, or null if this is not a stream
     */
    public byte[] getStream() {
        return stream;
    }

    /**
     * Replaces the raw stream bytes.
     *
     * @param stream the new encoded bytes, or null to drop the stream
     */
    public void setStream(byte[] stream) {
        if (stream != null && !(value instanceof Map)) {
            throw new IllegalArgumentException("A stream needs a dictionary value: " + id);
        }
        this.stream = stream;
    }

    public boolean isStream() {
        return stream != null;
    }

    /**
     * Returns the value as a dictionary.
     *
     * @return the dictionary, or null if the value is not a dictionary
     */
    @SuppressWarnings("unchecked")
    public Map<Name, Object> getDictionary() {
        return value instanceof Map ? (Map<Name, Object>) value : null;
    }

    /**
     * Returns the /Type of a dictionary value.
     *
     * @return the type name, or null if there is none
     */
    public Name getType() {
        Map<Name, Object> dict = getDictionary();
        if (dict == null) {
            return null;
        }
        Object type = dict.get(Name.TYPE);
        return type instanceof Name ? (Name) type : null;
    }

    /**
     * Returns whether this object has the given /Type.
     *
     * @param type the type name
     * @return true if the dictionary value has that type
     */
    public boolean isType(Name type) {
        return type.equals(getType());
    }

    @Override
    public String toString() {
        return "IndirectObject[" + id.getObjectNumber() + " " + id.getGenerationNumber() +
               (stream != null ? ", stream=" + stream.length : "") + "]";
    }

}
