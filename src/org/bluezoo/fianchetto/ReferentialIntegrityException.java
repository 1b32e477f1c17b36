/*
 * ReferentialIntegrityException.java
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
 * Exception thrown when a rewrite of the object graph would leave a
 * reference that does not lead to an object registered in the document.
 * <p>
 * Rewrites check their result before returning; an operation that throws
 * this exception has not produced a usable chain.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class ReferentialIntegrityException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final ObjectId target;

    /**
     * Creates a new exception.
     *
     * @param message the error message
     * @param target the identity that no longer leads to its object
     */
    public ReferentialIntegrityException(String message, ObjectId target) {
        super(message + ": " + target);
        this.target = target;
    }

    /**
     * Returns the identity the dangling reference points at.
     *
     * @return the target identity
     */
    public ObjectId getTarget() {
        return target;
    }

}
