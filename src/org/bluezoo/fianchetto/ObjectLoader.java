/*
 * ObjectLoader.java
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

/**
 * Materializes the indirect object stored at a location.
 * <p>
 * A {@link Revision} calls its loader the first time one of its objects is
 * requested. The {@link ObjectResolver} is the loader of every revision of
 * a document read from a file.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
@FunctionalInterface
public interface ObjectLoader {

    /**
     * Loads an indirect object.
     *
     * @param id the identity of the object
     * @param location the offset or container location of the object
     * @return the loaded object, or null if it cannot be found
     * @throws IOException if an I/O error occurs
     * @throws PDFParseException if the stored object is malformed
     */
    IndirectObject load(ObjectId id, ObjectLocation location) throws IOException;

}
