/*
 * ObjectLocation.java
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

/**
 * Where a revision stores an indirect object.
 * <p>
 * A location is one of three kinds:
 * <ul>
 *   <li><b>Free</b> - the object number is not in use in this revision,
 *       and shadows any binding of the number in older revisions</li>
 *   <li><b>Offset</b> - the object begins at a byte offset of the file</li>
 *   <li><b>In container</b> - the object is packed, at an index, inside an
 *       object stream (PDF 1.5+)</li>
 * </ul>
 * The free-list links of the file format are not part of a location; they
 * are kept by the {@link CrossReferenceSection} that owns the entry.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class ObjectLocation {

    /**
     * Location kind for free object numbers.
     */
    public static final int TYPE_FREE = 0;

    /**
     * Location kind for objects at a byte offset.
     */
    public static final int TYPE_OFFSET = 1;

    /**
     * Location kind for objects packed in an object stream.
     */
    public static final int TYPE_IN_CONTAINER = 2;

    private final int type;
    private final long offsetOrContainer;
    private final int generationOrIndex;

    /**
     * Returns a free location.
     *
     * @param generation the generation number the object number would be
     *        reused with
     * @return the free location
     */
    public static ObjectLocation free(int generation) {
        return new ObjectLocation(TYPE_FREE, 0L, generation);
    }

    /**
     * Returns a byte offset location.
     *
     * @param offset the byte offset of the "n g obj" header in the file
     * @param generation the generation number
     * @return the offset location
     */
    public static ObjectLocation offset(long offset, int generation) {
        if (offset < 0L) {
            throw new IllegalArgumentException("Negative offset: " + offset);
        }
        return new ObjectLocation(TYPE_OFFSET, offset, generation);
    }

    /**
     * Returns a location inside an object stream.
     *
     * @param containerNumber the object number of the object stream
     * @param index the index of the object within the stream
     * @return the container location
     */
    public static ObjectLocation inContainer(int containerNumber, int index) {
        if (containerNumber <= 0) {
            throw new IllegalArgumentException("Invalid container number: " + containerNumber);
        }
        if (index < 0) {
            throw new IllegalArgumentException("Negative container index: " + index);
        }
        return new ObjectLocation(TYPE_IN_CONTAINER, containerNumber, index);
    }

    private ObjectLocation(int type, long offsetOrContainer, int generationOrIndex) {
        this.type = type;
        this.offsetOrContainer = offsetOrContainer;
        this.generationOrIndex = generationOrIndex;
    }

    /**
     * Returns the location kind.
     *
     * @return TYPE_FREE, TYPE_OFFSET, or TYPE_IN_CONTAINER
     */
    public int getType() {
        return type;
    }

    public boolean isFree() {
        return type == TYPE_FREE;
    }

    public boolean isOffset() {
        return type == TYPE_OFFSET;
    }

    public boolean isInContainer() {
        return type == TYPE_IN_CONTAINER;
    }

    /**
     * Returns the byte offset of the object.
     *
     * @return the byte offset
     * @throws IllegalStateException if not an offset location
     */
    public long getOffset() {
        if (type != TYPE_OFFSET) {
            throw new IllegalStateException("Not an offset location: " + this);
        }
        return offsetOrContainer;
    }

    /**
     * Returns the generation number.
     * <p>
     * Objects in containers always have generation 0.
     *
     * @return the generation number
     */
    public int getGeneration() {
        return type == TYPE_IN_CONTAINER ? 0 : generationOrIndex;
    }

    /**
     * Returns the object number of the containing object stream.
     *
     * @return the container object number
     * @throws IllegalStateException if not a container location
     */
    public int getContainerNumber() {
        if (type != TYPE_IN_CONTAINER) {
            throw new IllegalStateException("Not a container location: " + this);
        }
        return (int) offsetOrContainer;
    }

    /**
     * Returns the index of the object within its object stream.
     *
     * @return the index in the container
     * @throws IllegalStateException if not a container location
     */
    public int getIndex() {
        if (type != TYPE_IN_CONTAINER) {
            throw new IllegalStateException("Not a container location: " + this);
        }
        return generationOrIndex;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj instanceof ObjectLocation) {
            ObjectLocation other = (ObjectLocation) obj;
            return type == other.type
                && offsetOrContainer == other.offsetOrContainer
                && generationOrIndex == other.generationOrIndex;
        }
        return false;
    }

    @Override
    public int hashCode() {
        return (31 * type + Long.hashCode(offsetOrContainer)) * 31 + generationOrIndex;
    }

    @Override
    public String toString() {
        switch (type) {
            case TYPE_FREE:
                return "free(gen=" + generationOrIndex + ")";
            case TYPE_OFFSET:
                return "offset(" + offsetOrContainer + ", gen=" + generationOrIndex + ")";
            case TYPE_IN_CONTAINER:
                return "inContainer(" + offsetOrContainer + ", index=" + generationOrIndex + ")";
            default:
                return "unknown";
        }
    }

}
