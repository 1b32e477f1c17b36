/*
 * PDFParseException.java
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
 * Exception thrown when the bytes of a PDF document are malformed.
 * <p>
 * This covers syntax errors, broken cross-reference data, object streams
 * that cannot be unpacked, and stream filters the codec does not support.
 * Where it is known, the exception records the byte offset of the problem;
 * for offsets inside a decoded object stream this is the offset within the
 * decoded data.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class PDFParseException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final long offset;

    public PDFParseException(String message) {
        super(message);
        this.offset = -1;
    }

    /**
     * Creates a new exception with the specified message and byte offset.
     *
     * @param message the error message
     * @param offset the byte offset where the error occurred
     */
    public PDFParseException(String message, long offset) {
        super(message + " at offset " + offset);
        this.offset = offset;
    }

    public PDFParseException(String message, Throwable cause) {
        super(message, cause);
        this.offset = -1;
    }

    /**
     * Returns the byte offset where the error occurred.
     *
     * @return the offset, or -1 if not available
     */
    public long getOffset() {
        return offset;
    }

}
