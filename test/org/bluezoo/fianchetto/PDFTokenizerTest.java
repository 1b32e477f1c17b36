/*
 * PDFTokenizerTest.java
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

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

public class PDFTokenizerTest {

    private static PDFTokenizer tokenizer(PDFFixture fixture) {
        return new PDFTokenizer(fixture.channel(), new DefaultStreamCodec());
    }

    @Test
    public void testParseValues() {
        assertEquals(42, PDFTokenizer.parseValue("42"));
        assertEquals(-7, PDFTokenizer.parseValue("-7"));
        assertEquals(3000000000L, PDFTokenizer.parseValue("3000000000"));
        assertEquals(0.5, PDFTokenizer.parseValue(".5"));
        assertEquals(-1.25, PDFTokenizer.parseValue("-1.25"));
        assertEquals(Boolean.TRUE, PDFTokenizer.parseValue("true"));
        assertEquals(Boolean.FALSE, PDFTokenizer.parseValue("false"));
        assertNull(PDFTokenizer.parseValue("null"));
        assertEquals(Name.of("Type"), PDFTokenizer.parseValue("/Type"));
        assertEquals(Name.of("A B"), PDFTokenizer.parseValue("/A#20B"));
        assertEquals(new ObjectId(12, 3), PDFTokenizer.parseValue("12 3 R"));
    }

    @Test
    public void testParseStrings() {
        assertEquals("a (nested) string", PDFTokenizer.parseValue("(a (nested) string)"));
        assertEquals("line\nbreak\t\\", PDFTokenizer.parseValue("(line\\nbreak\\t\\\\)"));
        assertEquals("A\u00e9", PDFTokenizer.parseValue("(\\101\\351)"));
        assertEquals("Hello", PDFTokenizer.parseValue("<48656C6C6F>"));
        assertEquals("\u00a0", PDFTokenizer.parseValue("<A>"));
    }

    @Test
    public void testParseComposites() {
        Object value = PDFTokenizer.parseValue("[1 2 0 R /Name (text) [true] <</K 3>>]");
        assertEquals(Arrays.asList(1, new ObjectId(2, 0), Name.of("Name"), "text",
                                   Collections.singletonList(Boolean.TRUE),
                                   Collections.singletonMap(Name.of("K"), 3)),
                     value);
        @SuppressWarnings("unchecked")
        Map<Name, Object> dict = (Map<Name, Object>) PDFTokenizer.parseValue("<</A 1 /B null /C /D>>");
        assertEquals(2, dict.size());
        assertFalse(dict.containsKey(Name.of("B")));
        assertEquals(Name.of("D"), dict.get(Name.of("C")));
        // a negative number never starts a reference
        assertEquals(Arrays.asList(-1, 0, Name.of("R")), PDFTokenizer.parseValue("[-1 0 /R]"));
    }

    @Test
    public void testMalformedValues() {
        assertThrows(PDFParseException.class, () -> PDFTokenizer.parseValue("(unterminated"));
        assertThrows(PDFParseException.class, () -> PDFTokenizer.parseValue("[1 2"));
        assertThrows(PDFParseException.class, () -> PDFTokenizer.parseValue("<</A>>"));
        assertThrows(PDFParseException.class, () -> PDFTokenizer.parseValue(")"));
        assertThrows(PDFParseException.class, () -> PDFTokenizer.parseValue("<4G>"));
    }

    @Test
    public void testStartXRefAndHeader() throws Exception {
        PDFFixture fixture = new PDFFixture("1.7");
        fixture.object(1, "<</Type /Catalog>>");
        long offset = fixture.xrefTable("/Size 2 /Root 1 0 R");
        PDFTokenizer tokenizer = tokenizer(fixture);
        assertEquals(offset, tokenizer.getStartXRefOffset());
        assertEquals("1.7", tokenizer.getHeaderVersion());
    }

    @Test
    public void testMissingStartXRef() {
        PDFFixture fixture = new PDFFixture();
        fixture.object(1, "<</Type /Catalog>>");
        assertThrows(PDFParseException.class, () -> tokenizer(fixture).getStartXRefOffset());
    }

    @Test
    public void testXRefTable() throws Exception {
        PDFFixture fixture = new PDFFixture();
        fixture.object(1, "<</Type /Catalog>>");
        fixture.object(3, 2, "(three)");
        fixture.free(0, 65535, 2);
        fixture.free(2, 4, 0);
        long offset = fixture.xrefTable("/Size 4 /Root 1 0 R /ID [<01> <02>]");
        PDFTokenizer tokenizer = tokenizer(fixture);

        CrossReferenceSection section = tokenizer.parseCrossReferenceSection(offset);
        assertEquals(9L, section.lookup(new ObjectId(1, 0)).getOffset());
        assertTrue(section.lookup(new ObjectId(2, 0)).isFree());
        assertEquals(4, section.getEntry(2).getGeneration());
        assertEquals(Arrays.asList(2), section.getFreeList());
        assertNotNull(section.lookup(new ObjectId(3, 2)));

        Map<Name, Object> trailer = tokenizer.parseTrailer(offset);
        assertEquals(4, trailer.get(Name.SIZE));
        assertEquals(Arrays.asList("\u0001", "\u0002"), trailer.get(Name.ID));
    }

    @Test
    public void testInUseEntryAtOffsetZeroIsFree() throws Exception {
        PDFFixture fixture = new PDFFixture();
        fixture.object(1, "<</Type /Catalog>>");
        long offset = fixture.position();
        fixture.raw("xref\n0 3\n0000000000 65535 f \n0000000009 00000 n \n0000000000 00000 n \n" +
                    "trailer\n<</Size 3>>\nstartxref\n" + offset + "\n%%EOF\n");
        CrossReferenceSection section = tokenizer(fixture).parseCrossReferenceSection(offset);
        assertTrue(section.getEntry(2).isFree());
    }

    @Test
    public void testXRefStream() throws Exception {
        PDFFixture fixture = new PDFFixture("1.5");
        fixture.object(1, "<</Type /Catalog>>");
        fixture.objectStream(4, new int[] { 2, 3 }, new String[] { "(two)", "(three)" });
        long offset = fixture.xrefStream(5, "/Size 6 /Root 1 0 R");
        PDFTokenizer tokenizer = tokenizer(fixture);
        assertEquals(offset, tokenizer.getStartXRefOffset());

        CrossReferenceSection section = tokenizer.parseCrossReferenceSection(offset);
        assertTrue(section.getEntry(1).isOffset());
        assertEquals(4, section.getEntry(3).getContainerNumber());
        assertEquals(1, section.getEntry(3).getIndex());
        assertEquals(offset, section.getEntry(5).getOffset());
        Map<Name, Object> dict = tokenizer.parseTrailer(offset);
        assertEquals(Name.XREF, dict.get(Name.TYPE));
        assertEquals(new ObjectId(1, 0), dict.get(Name.ROOT));
    }

    @Test
    public void testInvalidXRefStreamWidths() throws Exception {
        PDFFixture fixture = new PDFFixture("1.5");
        long offset = fixture.position();
        fixture.raw("1 0 obj\n<</Type /XRef /Size 1 /W [1 9 2] /Length 0>>\nstream\n\nendstream\nendobj\n");
        fixture.raw("startxref\n" + offset + "\n%%EOF\n");
        assertThrows(PDFParseException.class, () -> tokenizer(fixture).parseCrossReferenceSection(offset));
    }

    @Test
    public void testStreamWithIndirectLength() throws Exception {
        PDFFixture fixture = new PDFFixture();
        long offset = fixture.position();
        fixture.object(1, "<</Length 2 0 R>>\nstream\r\nsome data\r\nendstream");
        IndirectObject obj = tokenizer(fixture).parseObjectAt(offset);
        assertTrue(obj.isStream());
        assertEquals("some data", new String(obj.getStream(), StandardCharsets.ISO_8859_1));
        assertEquals(new ObjectId(2, 0), obj.getDictionary().get(Name.LENGTH));
    }

    @Test
    public void testStreamWithWrongLength() throws Exception {
        PDFFixture fixture = new PDFFixture();
        long offset = fixture.position();
        fixture.object(1, "<</Length 4>>\nstream\nlonger data\nendstream");
        IndirectObject obj = tokenizer(fixture).parseObjectAt(offset);
        assertEquals("longer data", new String(obj.getStream(), StandardCharsets.ISO_8859_1));
    }

    @Test
    public void testObjectStreamIndex() {
        PDFTokenizer tokenizer = new PDFTokenizer(new ByteBufferChannel(new byte[0]), null);
        byte[] data = "10 0 11 4 % comment\n12 9 (a) (b) (c)".getBytes(StandardCharsets.US_ASCII);
        int[][] index = tokenizer.parseObjectStreamIndex(ByteBuffer.wrap(data), 3, 26);
        assertArrayEquals(new int[] { 10, 0 }, index[0]);
        assertArrayEquals(new int[] { 11, 4 }, index[1]);
        assertArrayEquals(new int[] { 12, 9 }, index[2]);
        assertThrows(PDFParseException.class,
                     () -> tokenizer.parseObjectStreamIndex(ByteBuffer.wrap(data), 4, 26));
    }

    @Test
    public void testParseValueAtOffset() {
        PDFTokenizer tokenizer = new PDFTokenizer(new ByteBufferChannel(new byte[0]), null);
        byte[] data = "(a) [1 2] /N".getBytes(StandardCharsets.US_ASCII);
        List<?> array = (List<?>) tokenizer.parseValue(ByteBuffer.wrap(data), 4);
        assertEquals(Arrays.asList(1, 2), array);
        assertEquals(Name.N, tokenizer.parseValue(ByteBuffer.wrap(data), 10));
    }

}
