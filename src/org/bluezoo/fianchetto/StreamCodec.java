/*
 * StreamCodec.java
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
 * Encodes and decodes the data of PDF streams.
 * <p>
 * The document model keeps stream data encoded and only decodes it when
 * it has to look inside, which is the case for object streams and
 * cross-reference streams. {@link DefaultStreamCodec} is the standard
 * implementation.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public interface StreamCodec {

    /**
     * Decodes stream data through the filters named by a stream dictionary.
     *
     * @param data the encoded stream data
     * @param dictionary the stream dictionary, with /Filter and
     *        /DecodeParms entries if the data is encoded
     * @return the decoded data
     * @throws PDFParseException if a filter is not supported or the data
     *         is corrupt
     */
    byte[] decode(byte[] data, Map<Name, Object> dictionary);

    /**
     * Encodes data with a single filter.
     *
     * @param data the data to encode
     * @param filter the filter name, or null to leave the data as is
     * @return the encoded data
     * @throws IllegalArgumentException if the filter cannot encode
     */
    byte[] encode(byte[] data, Name filter);

}
