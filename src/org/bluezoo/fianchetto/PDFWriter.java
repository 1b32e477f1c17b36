/*
 * PDFWriter.java
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
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.WritableByteChannel;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Writes a document as a PDF file.
 * <p>
 * Every revision of the chain is written in order, each followed by its
 * own cross-reference section and trailer, so the file keeps the update
 * history of the document. A revision with a /XRef object, or with
 * objects assigned to object streams, gets a cross-reference stream;
 * other revisions get a classic xref table. Object streams are repacked
 * from their members as they are written.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class PDFWriter {

    private static final Logger logger = Logger.getLogger(PDFWriter.class.getName());

    private static final byte[] BINARY_COMMENT = {
        '%', (byte) 0xe2, (byte) 0xe3, (byte) 0xcf, (byte) 0xd3, '\n'
    };

    private final PDFDocument document;
    private final WritableByteChannel channel;
    private final PDFSerializer serializer;
    private long position;
    private int maxObjectNumber;

    /**
     * Creates a writer.
     *
     * @param document the document to write
     * @param channel the channel to write to, positioned at the start of
     *        the output
     */
    public PDFWriter(PDFDocument document, WritableByteChannel channel) {
        this.document = document;
        this.channel = channel;
        this.serializer = new PDFSerializer();
    }

    /**
     * Writes the document.
     *
     * @throws IOException if an I/O error occurs
     * @throws IllegalStateException if a revision has objects in object
     *         streams but no /XRef object
     */
    public void write() throws IOException {
        position = 0L;
        maxObjectNumber = 0;
        writeAscii("%PDF-" + document.getVersion() + "\n");
        write(BINARY_COMMENT);
        long prev = -1L;
        for (Revision revision : document.getRevisions()) {
            prev = writeRevision(revision, prev);
        }
        final long size = position;
        logger.log(Level.FINE, () -> String.format("wrote %d revisions, %d bytes",
                                                   document.getRevisions().size(), size));
    }

    /**
     * Writes the objects and the cross-reference section of a revision.
     *
     * @return the offset of the cross-reference section
     */
    private long writeRevision(Revision revision, long prev) throws IOException {
        List<IndirectObject> objects = revision.objects();
        IndirectObject xref = null;
        Map<Integer, IndirectObject> containers = new TreeMap<>();
        for (IndirectObject obj : objects) {
            if (obj.isType(Name.XREF)) {
                if (xref == null) {
                    xref = obj;
                }
            } else if (obj.isType(Name.OBJ_STM)) {
                containers.put(obj.getId().getObjectNumber(), obj);
            }
        }

        Map<Integer, List<IndirectObject>> members = new TreeMap<>();
        for (Integer number : containers.keySet()) {
            members.put(number, new ArrayList<>());
        }
        List<IndirectObject> independent = new ArrayList<>();
        for (IndirectObject obj : objects) {
            if (obj == xref) {
                continue;
            }
            Integer container = revision.containerOf(obj.getId().getObjectNumber());
            if (container != null && containers.containsKey(container)
                    && !obj.isStream() && obj.getId().getGenerationNumber() == 0) {
                members.get(container).add(obj);
            } else {
                independent.add(obj);
            }
        }
        boolean packed = false;
        for (List<IndirectObject> list : members.values()) {
            packed |= !list.isEmpty();
        }
        if (packed && xref == null) {
            throw new IllegalStateException("Object streams need a cross-reference stream in " + revision);
        }

        DocumentConfiguration configuration = document.getConfiguration();
        Name filter = configuration.getStreamFilter();
        for (Map.Entry<Integer, IndirectObject> entry : containers.entrySet()) {
            ObjectStream.pack(entry.getValue(), members.get(entry.getKey()), serializer,
                              document.getCodec(), filter);
        }

        CrossReferenceSection section = new CrossReferenceSection();
        section.addFreeEntry(0, Revision.MAX_GENERATION, 0);
        for (Integer number : revision.getFreeNumbers()) {
            section.addFreeEntry(number, revision.getFreeGeneration(number), 0);
        }
        for (IndirectObject obj : independent) {
            ObjectId id = obj.getId();
            section.addOffsetEntry(id.getObjectNumber(), id.getGenerationNumber(), position);
            write(serializer.serializeIndirect(obj));
        }
        for (Map.Entry<Integer, List<IndirectObject>> entry : members.entrySet()) {
            List<IndirectObject> list = entry.getValue();
            for (int i = 0; i < list.size(); i++) {
                section.addContainerEntry(list.get(i).getId().getObjectNumber(), entry.getKey(), i);
            }
        }
        section.relinkFreeList();

        maxObjectNumber = Math.max(maxObjectNumber, revision.getMaxObjectNumber());
        Map<Name, Object> trailer = new LinkedHashMap<>(revision.getTrailer());
        trailer.remove(Name.PREV);
        trailer.remove(Name.XREF_STM);
        trailer.put(Name.SIZE, maxObjectNumber + 1);
        if (prev >= 0L) {
            trailer.put(Name.PREV, prev);
        }

        long offset = position;
        if (xref != null) {
            writeXRefStream(xref, section, trailer);
        } else {
            writeXRefTable(section, trailer);
        }
        writeAscii("startxref\n" + offset + "\n%%EOF\n");
        return offset;
    }

    private void writeXRefTable(CrossReferenceSection section, Map<Name, Object> trailer) throws IOException {
        StringBuilder buf = new StringBuilder("xref\n");
        for (int[] subsection : section.subsections()) {
            buf.append(subsection[0]).append(' ').append(subsection[1]).append('\n');
            for (int number = subsection[0]; number < subsection[0] + subsection[1]; number++) {
                ObjectLocation location = section.getEntry(number);
                if (location.isFree()) {
                    buf.append(String.format(Locale.ROOT, "%010d %05d f \n", section.getNextFree(number), location.getGeneration()));
                } else {
                    buf.append(String.format(Locale.ROOT, "%010d %05d n \n", location.getOffset(), location.getGeneration()));
                }
            }
        }
        buf.append("trailer\n");
        writeAscii(buf.toString());
        write(serializer.serialize(trailer));
        writeAscii("\n");
    }

    private void writeXRefStream(IndirectObject xref, CrossReferenceSection section, Map<Name, Object> trailer)
            throws IOException {
        ObjectId id = xref.getId();
        section.addOffsetEntry(id.getObjectNumber(), id.getGenerationNumber(), position);

        long maxField2 = 0L;
        long maxField3 = 0L;
        List<Object> index = new ArrayList<>();
        for (int[] subsection : section.subsections()) {
            index.add(subsection[0]);
            index.add(subsection[1]);
            for (int number = subsection[0]; number < subsection[0] + subsection[1]; number++) {
                ObjectLocation location = section.getEntry(number);
                maxField2 = Math.max(maxField2, field2(section, number, location));
                maxField3 = Math.max(maxField3, field3(location));
            }
        }
        int[] w = { 1, width(maxField2), width(maxField3) };

        ByteArrayOutputStream rows = new ByteArrayOutputStream();
        for (int[] subsection : section.subsections()) {
            for (int number = subsection[0]; number < subsection[0] + subsection[1]; number++) {
                ObjectLocation location = section.getEntry(number);
                writeField(rows, location.getType(), w[0]);
                writeField(rows, field2(section, number, location), w[1]);
                writeField(rows, field3(location), w[2]);
            }
        }

        Name filter = document.getConfiguration().getStreamFilter();
        byte[] data = document.getCodec().encode(rows.toByteArray(), filter);
        Map<Name, Object> dict = new LinkedHashMap<>();
        dict.put(Name.TYPE, Name.XREF);
        dict.putAll(trailer);
        dict.put(Name.INDEX, index);
        List<Object> wArray = new ArrayList<>();
        for (int width : w) {
            wArray.add(width);
        }
        dict.put(Name.W, wArray);
        if (filter != null) {
            dict.put(Name.FILTER, filter);
        }
        xref.setValue(dict);
        xref.setStream(data);
        write(serializer.serializeIndirect(xref));
    }

    private static long field2(CrossReferenceSection section, int number, ObjectLocation location) {
        switch (location.getType()) {
            case ObjectLocation.TYPE_FREE:
                return section.getNextFree(number);
            case ObjectLocation.TYPE_OFFSET:
                return location.getOffset();
            default:
                return location.getContainerNumber();
        }
    }

    private static long field3(ObjectLocation location) {
        return location.isInContainer() ? location.getIndex() : location.getGeneration();
    }

    private static int width(long value) {
        int n = 0;
        do {
            n++;
            value >>>= 8;
        } while (value != 0L);
        return n;
    }

    private static void writeField(ByteArrayOutputStream out, long value, int width) {
        for (int i = width - 1; i >= 0; i--) {
            out.write((int) (value >>> (i * 8)) & 0xff);
        }
    }

    private void writeAscii(String s) throws IOException {
        write(s.getBytes(StandardCharsets.ISO_8859_1));
    }

    private void write(byte[] bytes) throws IOException {
        ByteBuffer buf = ByteBuffer.wrap(bytes);
        while (buf.hasRemaining()) {
            position += channel.write(buf);
        }
    }

}
