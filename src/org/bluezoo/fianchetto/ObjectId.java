/*
 * ObjectId.java
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
 * Identity of a PDF indirect object.
 * <p>
 * Every indirect object in a PDF document is identified by a pair of
 * integers: the object number and the generation number. The generation
 * number is incremented when an object number is freed and later reused.
 * <p>
 * Object number 0 is reserved: it never names an indirect object in a
 * cross-reference section. An {@link IndirectObject} with object number 0
 * is a wrapped direct value.
 * <p>
 * When an {@code ObjectId} appears inside an object value (a dictionary
 * entry or an array element) it is a reference to the indirect object with
 * that identity.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class ObjectId implements Comparable<ObjectId> {

    /**
     * The sentinel identity of wrapped direct values.
     */
    public static final ObjectId DIRECT = new ObjectId(0, 0);

    private final int objectNumber;
    private final int generationNumber;

    /**
     * Creates a new object identifier with generation number 0.
     *
     * @param objectNumber the object number (must be non-negative)
     * @throws IllegalArgumentException if objectNumber is negative
     */
    public ObjectId(int objectNumber) {
        this(objectNumber, 0);
    }

    /**
     * Creates a new object identifier.
     *
     * @param objectNumber the object number (must be non-negative)
     * @param generationNumber the generation number (must be non-negative)
     * @throws IllegalArgumentException if objectNumber is negative
     *         or generationNumber is negative
     */
    public ObjectId(int objectNumber, int generationNumber) {
        if (objectNumber < 0) {
            throw new IllegalArgumentException(
                "Object number must be non-negative: " + objectNumber);
        }
        if (generationNumber < 0) {
            throw new IllegalArgumentException(
                "Generation number must be non-negative: " + generationNumber);
        }
        this.objectNumber = objectNumber;
        this.generationNumber = generationNumber;
    }

    /**
     * Returns the object number.
     *
     * @return the object number
     */
    public int getObjectNumber() {
        return objectNumber;
    }

    /**
     * Returns the generation number.
     *
     * @return the generation number
     */
    public int getGenerationNumber() {
        return generationNumber;
    }

    /**
     * Returns whether this is the sentinel identity of a wrapped direct value.
     *
     * @return true if the object number is 0
     */
    public boolean isDirect() {
        return objectNumber == 0;
    }

    @Override
    public int compareTo(ObjectId other) {
        if (objectNumber != other.objectNumber) {
            return Integer.compare(objectNumber, other.objectNumber);
        }
        return Integer.compare(generationNumber, other.generationNumber);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj instanceof ObjectId) {
            ObjectId other = (ObjectId) obj;
            return objectNumber == other.objectNumber
                && generationNumber == other.generationNumber;
        }
        return false;
    }

    @Override
    public int hashCode() {
        return 31 * objectNumber + generationNumber;
    }

    /**
     * Returns the reference syntax of this identity, "n g R".
     *
     * @return the object reference in PDF syntax
     */
    @Override
    public String toString() {
        return objectNumber + " " + generationNumber + " R";
    }

}
