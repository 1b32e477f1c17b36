/*
 * PDFWriterTest.java
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

import static org.junit.jupiter.api.Assertions.*;

import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

import org.junit.jupiter.api.Test;

public class PDFWriterTest {

    private static byte[] write(PDFDocument document) throws Exception {
        ByteBufferChannel out = new ByteBufferChannel();
        new PDFWriter(document, out).write();
        return out.toByteArray();
    }

    private static String text(byte[] bytes) {
        return new String(bytes, StandardCharsets.ISO_8859_1);
    }

    @Test
    public void testWriteNewDocument() throws Exception {
        PDFDocument document = new PDFDocument();
        document.getCatalog();
        String text = text(write(document));

        assertTrue(text.startsWith("%PDF-1.2\n%\u00e2\u00e3\u00cf\u00d3\n"));
        assertTrue(text.contains("1 0 obj\n<</Type /Catalog>>\nendobj\n"));
        assertTrue(text.contains("xref\n0 2\n0000000000 65535 f \n0000000015 00000 n \ntrailer\n"));
        assertTrue(text.contains("<</Size 2 /Root 1 0 R>>"));
        assertTrue(text.endsWith("%%EOF\n"));
    }

    @Test
    public void testReopenNewDocument() throws Exception {
        PDFDocument document = new PDFDocument();
        IndirectObject catalog = document.getCatalog();
        Map<Name, Object> info = new LinkedHashMap<>();
        info.put(Name.of("Producer"), "Fianchetto");
        IndirectObject infoObject = document.add(info);
        document.getTrailer().put(Name.INFO, infoObject.getId());
        byte[] data = "BT ET".getBytes(StandardCharsets.US_ASCII);
        IndirectObject contents = document.add(new LinkedHashMap<>(), data);
        catalog.getDictionary().put(Name.of("Contents"), contents.getId());

        PDFDocument reopened = PDFDocument.open(new ByteBufferChannel(write(document)));
        assertEquals(Name.CATALOG, reopened.getCatalog().getType());
        IndirectObject info2 = (IndirectObject) reopened.deref(reopened.getTrailer().get(Name.INFO));
        assertEquals("Fianchetto", info2.getDictionary().get(Name.of("Producer")));
        IndirectObject contents2 = reopened.object(contents.getId());
        assertArrayEquals(data, contents2.getStream());
        assertEquals(5, contents2.getDictionary().get(Name.LENGTH));
    }

    @Test
    public void testRevisionsAreKept() throws Exception {
        PDFDocument document = RevisionChainTest.twoRevisions().open();
        document.getRevisions().add();
        IndirectObject added = document.add("added");
        document.delete(new ObjectId(3, 0));

        PDFDocument reopened = PDFDocument.open(new ByteBufferChannel(write(document)));
        RevisionChain revisions = reopened.getRevisions();
        assertEquals(3, revisions.size());
        assertEquals("added", reopened.object(added.getId()).getValue());
        assertNull(reopened.object(new ObjectId(3, 0)));
        assertNotNull(revisions.get(0).object(new ObjectId(3, 0)));
        assertEquals(200, reopened.object(new ObjectId(2, 0)).getValue());
        assertEquals(20, revisions.get(0).object(new ObjectId(2, 0)).getValue());

        Revision current = revisions.current();
        assertTrue(current.isFree(3));
        assertEquals(1, current.getFreeGeneration(3));
        assertEquals(5, current.getTrailer().get(Name.SIZE));
        assertTrue(current.getTrailer().containsKey(Name.PREV));
    }

    @Test
    public void testFreeListIsLinked() throws Exception {
        PDFDocument document = new PDFDocument();
        document.getCatalog();
        IndirectObject a = document.add("a");
        IndirectObject b = document.add("b");
        document.delete(a.getId());
        document.delete(b.getId());
        String text = text(write(document));
        assertTrue(text.contains("0000000002 65535 f \n"));
        assertTrue(text.contains("0000000003 00001 f \n"));
        assertTrue(text.contains("0000000000 00001 f \n"));
    }

    @Test
    public void testObjectStreamsNeedXRefStream() throws Exception {
        PDFDocument document = new PDFDocument();
        IndirectObject catalog = document.getCatalog();
        Map<Name, Object> dict = new LinkedHashMap<>();
        dict.put(Name.TYPE, Name.OBJ_STM);
        IndirectObject container = document.add(dict, new byte[0]);
        document.getRevisions().current().pack(catalog.getId().getObjectNumber(),
                                               container.getId().getObjectNumber());
        assertThrows(IllegalStateException.class, () -> write(document));
    }

    @Test
    public void testXRefStreamOutput() throws Exception {
        PDFDocument document = new PDFDocument();
        document.getCatalog();
        Map<Name, Object> dict = new LinkedHashMap<>();
        dict.put(Name.TYPE, Name.XREF);
        IndirectObject xref = document.add(dict, new byte[0]);
        byte[] bytes = write(document);
        assertFalse(text(bytes).contains("\ntrailer\n"));
        assertEquals(Name.FLATE_DECODE, xref.getDictionary().get(Name.FILTER));

        PDFDocument reopened = PDFDocument.open(new ByteBufferChannel(bytes));
        CrossReferenceSection section = reopened.getRevisions().current().getSection();
        assertTrue(section.getEntry(1).isOffset());
        assertTrue(section.getEntry(2).isOffset());
        assertEquals(new ObjectId(1, 0), reopened.getTrailer().get(Name.ROOT));
        assertEquals(3, reopened.getTrailer().get(Name.SIZE));
    }

    @Test
    public void testXRefTableIgnoresDefaultLocale() throws Exception {
        Locale saved = Locale.getDefault();
        byte[] bytes;
        try {
            Locale.setDefault(Locale.forLanguageTag("ar-EG"));
            PDFDocument document = new PDFDocument();
            document.getCatalog();
            bytes = write(document);
        } finally {
            Locale.setDefault(saved);
        }
        String text = text(bytes);
        assertTrue(text.contains("0000000000 65535 f \n"));
        assertTrue(text.contains("0000000015 00000 n \n"));
        PDFDocument reopened = PDFDocument.open(new ByteBufferChannel(bytes));
        assertTrue(reopened.getCatalog().isType(Name.CATALOG));
    }
}
