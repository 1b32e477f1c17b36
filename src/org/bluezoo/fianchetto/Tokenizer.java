/*
 * Tokenizer.java
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
import java.nio.ByteBuffer;
import java.util.Map;

/**
 * Byte-level reader of PDF syntax.
 * <p>
 * The document model asks the tokenizer for the few structural pieces it
 * needs and never looks at file bytes itself. {@link PDFTokenizer} is the
 * implementation over a seekable channel.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public interface Tokenizer {

    /**
     * Returns the offset named by the last startxref keyword of the file,
     * the entry point of the revision chain.
     *
     * @return the byte offset of the newest cross-reference section
     * @throws IOException if an I/O error occurs
     * @throws PDFParseException if there is no startxref keyword
     */
    long getStartXRefOffset() throws IOException;

    /**
     * Returns the version declared in the file header, e.g. "1.4".
     *
     * @return the header version, or null if the header has none
     * @throws IOException if an I/O error occurs
     */
    String getHeaderVersion() throws IOException;

    /**
     * Parses the cross-reference section at an offset. The section may be
     * a classic xref table or a cross-reference stream; for a stream the
     * section also contains an entry for the stream object itself.
     *
     * @param offset the byte offset of the section
     * @return the parsed section
     * @throws IOException if an I/O error occurs
     * @throws PDFParseException if the section is malformed
     */
    CrossReferenceSection parseCrossReferenceSection(long offset) throws IOException;

    /**
     * Parses the trailer of the cross-reference section at an offset. For a
     * cross-reference stream this is the stream dictionary.
     *
     * @param offset the byte offset of the section
     * @return the trailer dictionary
     * @throws IOException if an I/O error occurs
     * @throws PDFParseException if the trailer is malformed
     */
    Map<Name, Object> parseTrailer(long offset) throws IOException;

    /**
     * Parses the indirect object whose "n g obj" header starts at an offset.
     *
     * @param offset the byte offset of the object
     * @return the object, with its raw stream bytes if it is a stream
     * @throws IOException if an I/O error occurs
     * @throws PDFParseException if the object is malformed
     */
    IndirectObject parseObjectAt(long offset) throws IOException;

    /**
     * Parses one direct value from a buffer, such as a member of a decoded
     * object stream.
     *
     * @param data the buffer
     * @param offset the position of the value in the buffer
     * @return the value
     * @throws PDFParseException if the value is malformed
     */
    Object parseValue(ByteBuffer data, int offset);

    /**
     * Parses the index table at the start of a decoded object stream.
     *
     * @param data the decoded object stream
     * @param count the /N value of the stream dictionary
     * @param first the /First value of the stream dictionary
     * @return for each member, its object number and its offset relative
     *         to first, as pairs
     * @throws PDFParseException if the table is malformed
     */
    int[][] parseObjectStreamIndex(ByteBuffer data, int count, int first);

}
