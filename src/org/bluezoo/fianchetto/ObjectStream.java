/*
 * ObjectStream.java
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

import java.io.ByteArrayOutputStream;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

/**
 * In-memory representation of a decoded PDF object stream (PDF 1.5+).
 * <p>
 * An object stream contains multiple indirect objects stored sequentially.
 * The stream has an index table (N pairs of object number and byte offset)
 * followed by the object data. Offsets in the table are relative to the
 * first object (the /First value in the stream dictionary).
 * <p>
 * The decoded form is only ever read. When object streams are written,
 * {@link #pack} produces fresh stream data from the current values of the
 * members.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class ObjectStream {

    private final IndirectObject container;
    private final byte[] source;
    private final ByteBuffer decoded;
    private final int first;
    private final int[] objectNumbers;
    private final int[] relativeOffsets;

    private ObjectStream(IndirectObject container, ByteBuffer decoded, int first, int[][] index) {
        this.container = container;
        this.source = container.getStream();
        this.decoded = decoded;
        this.first = first;
        this.objectNumbers = new int[index.length];
        this.relativeOffsets = new int[index.length];
        for (int i = 0; i < index.length; i++) {
            objectNumbers[i] = index[i][0];
            relativeOffsets[i] = index[i][1];
        }
    }

    /**
     * Decodes an object stream.
     *
     * @param container the /ObjStm stream object
     * @param tokenizer the tokenizer used to read the index table
     * @param codec the codec used to decode the stream data
     * @return the decoded object stream
     * @throws PDFParseException if the object is not a valid object stream
     */
    public static ObjectStream decode(IndirectObject container, Tokenizer tokenizer, StreamCodec codec) {
        Map<Name, Object> dict = container.getDictionary();
        if (!container.isStream() || !container.isType(Name.OBJ_STM)) {
            throw new PDFParseException("Not an object stream: " + container.getId());
        }
        Object n = dict.get(Name.N);
        Object first = dict.get(Name.FIRST);
        if (!(n instanceof Integer) || !(first instanceof Integer)) {
            throw new PDFParseException("Object stream " + container.getId() + " has no valid /N and /First");
        }
        ByteBuffer decoded = ByteBuffer.wrap(codec.decode(container.getStream(), dict));
        int[][] index = tokenizer.parseObjectStreamIndex(decoded.duplicate(), (Integer) n, (Integer) first);
        return new ObjectStream(container, decoded, (Integer) first, index);
    }

    /**
     * Returns the container object this object stream was decoded from.
     *
     * @return the /ObjStm object
     */
    public IndirectObject getContainer() {
        return container;
    }

    /**
     * Returns whether this decoded form still matches the stream data of
     * its container.
     *
     * @return false if the container's stream data has been replaced
     */
    public boolean isCurrent() {
        return container.getStream() == source;
    }

    /**
     * Returns a read-only duplicate of the decoded stream buffer.
     *
     * @return a duplicate of the decoded data
     */
    public ByteBuffer getDecoded() {
        return decoded.duplicate().asReadOnlyBuffer();
    }

    /**
     * Returns the byte offset in the decoded stream where the object at the
     * given index starts. This is {@code first + relativeOffsets[index]}.
     *
     * @param index the 0-based index of the object in the stream
     * @return the start offset in decoded
     * @throws IndexOutOfBoundsException if index is out of range
     */
    public int getObjectStartOffset(int index) {
        if (index < 0 || index >= relativeOffsets.length) {
            throw new IndexOutOfBoundsException("Object index " + index + " not in [0, " + relativeOffsets.length + ")");
        }
        return first + relativeOffsets[index];
    }

    public int getObjectNumber(int index) {
        return objectNumbers[index];
    }

    public int getObjectCount() {
        return relativeOffsets.length;
    }

    /**
     * Finds the index of a member.
     * <p>
     * The index recorded in the cross-reference entry is tried first; if
     * it holds a different object, the index table is searched.
     *
     * @param objectNumber the object number of the member
     * @param hint the index recorded in the cross-reference entry
     * @return the index, or -1 if the object is not in this stream
     */
    public int indexOf(int objectNumber, int hint) {
        if (hint >= 0 && hint < objectNumbers.length && objectNumbers[hint] == objectNumber) {
            return hint;
        }
        for (int i = 0; i < objectNumbers.length; i++) {
            if (objectNumbers[i] == objectNumber) {
                return i;
            }
        }
        return -1;
    }

    /**
     * Parses the value of the member at an index.
     *
     * @param index the index of the member
     * @param tokenizer the tokenizer
     * @return the member value
     */
    public Object parseMember(int index, Tokenizer tokenizer) {
        return tokenizer.parseValue(getDecoded(), getObjectStartOffset(index));
    }

    /**
     * Writes members into an object stream container.
     * <p>
     * The container's dictionary receives the /N, /First, /Filter and
     * /Length entries for the new data, and its stream data is replaced.
     *
     * @param container the /ObjStm object
     * @param members the objects to store, in index order
     * @param serializer the serializer for the member values
     * @param codec the codec to encode the data with
     * @param filter the filter to encode with, or null
     */
    public static void pack(IndirectObject container, List<IndirectObject> members,
                            PDFSerializer serializer, StreamCodec codec, Name filter) {
        StringBuilder index = new StringBuilder();
        ByteArrayOutputStream data = new ByteArrayOutputStream();
        for (IndirectObject member : members) {
            if (member.isStream() || member.getId().getGenerationNumber() != 0) {
                throw new IllegalArgumentException("Cannot store " + member.getId() + " in an object stream");
            }
            index.append(member.getId().getObjectNumber()).append(' ').append(data.size()).append(' ');
            byte[] value = serializer.serialize(member.getValue());
            data.write(value, 0, value.length);
            data.write('\n');
        }
        byte[] head = index.toString().getBytes(StandardCharsets.US_ASCII);
        ByteArrayOutputStream out = new ByteArrayOutputStream(head.length + data.size());
        out.write(head, 0, head.length);
        byte[] body = data.toByteArray();
        out.write(body, 0, body.length);
        byte[] encoded = codec.encode(out.toByteArray(), filter);

        Map<Name, Object> dict = container.getDictionary();
        dict.put(Name.TYPE, Name.OBJ_STM);
        dict.put(Name.N, members.size());
        dict.put(Name.FIRST, head.length);
        dict.remove(Name.DECODE_PARMS);
        if (filter != null) {
            dict.put(Name.FILTER, filter);
        } else {
            dict.remove(Name.FILTER);
        }
        dict.put(Name.LENGTH, encoded.length);
        container.setStream(encoded);
    }

}
