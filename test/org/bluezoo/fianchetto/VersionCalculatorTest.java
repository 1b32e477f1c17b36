/*
 * VersionCalculatorTest.java
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

import java.util.LinkedHashMap;
import java.util.Map;

import org.junit.jupiter.api.Test;

public class VersionCalculatorTest {

    @Test
    public void testVersionIsRaised() throws Exception {
        PDFDocument document = new PDFDocument();
        assertEquals("1.2", document.getVersion());
        Map<Name, Object> page = new LinkedHashMap<>();
        page.put(Name.TYPE, Name.of("Page"));
        page.put(Name.of("UserUnit"), 2.0);
        document.add(page);

        VersionCalculator calculator = new VersionCalculator(document);
        assertEquals("1.6", calculator.calculate());
        assertEquals("1.6", calculator.run());
        assertEquals("1.6", document.getVersion());
        // a second run changes nothing
        assertEquals("1.6", calculator.run());
        assertEquals("1.6", document.getVersion());
    }

    @Test
    public void testVersionIsNeverLowered() throws Exception {
        PDFDocument document = new PDFDocument();
        document.setVersion("1.7");
        Map<Name, Object> info = new LinkedHashMap<>();
        info.put(Name.of("Title"), "A title");
        document.getTrailer().put(Name.INFO, info);

        VersionCalculator calculator = new VersionCalculator(document);
        assertEquals("1.1", calculator.calculate());
        assertEquals("1.7", calculator.run());
        assertEquals("1.7", document.getVersion());
    }

    @Test
    public void testNestedDictionaryUsesDeclaredType() throws Exception {
        PDFDocument document = new PDFDocument();
        IndirectObject catalog = document.getCatalog();
        Map<Name, Object> prefs = new LinkedHashMap<>();
        prefs.put(Name.of("PrintScaling"), Name.of("None"));
        catalog.getDictionary().put(Name.of("ViewerPreferences"), prefs);
        assertEquals("1.6", new VersionCalculator(document).calculate());
    }

    @Test
    public void testNestedDictionaryUsesOwnType() throws Exception {
        PDFDocument document = new PDFDocument();
        Map<Name, Object> nested = new LinkedHashMap<>();
        nested.put(Name.TYPE, Name.of("Page"));
        nested.put(Name.of("Tabs"), Name.of("R"));
        Map<Name, Object> outer = new LinkedHashMap<>();
        outer.put(Name.TYPE, Name.of("Info"));
        outer.put(Name.of("Author"), "someone");
        outer.put(Name.of("Custom"), nested);
        document.add(outer);
        // Custom is not an Info field, so its value is not examined
        assertNull(new VersionCalculator(document).calculate());

        outer.remove(Name.of("Custom"));
        Map<Name, Object> catalogFields = document.getCatalog().getDictionary();
        catalogFields.put(Name.of("Outlines"), nested);
        assertEquals("1.5", new VersionCalculator(document).calculate());
    }

    @Test
    public void testWriteRaisesHeaderVersion() throws Exception {
        PDFDocument document = new PDFDocument();
        IndirectObject catalog = document.getCatalog();
        catalog.getDictionary().put(Name.of("OCProperties"), new LinkedHashMap<Name, Object>());
        ByteBufferChannel out = new ByteBufferChannel();
        document.write(out);
        String text = new String(out.toByteArray(), "ISO-8859-1");
        assertTrue(text.startsWith("%PDF-1.5\n"));
    }

    @Test
    public void testCatalogVersionCounts() throws Exception {
        PDFDocument document = new PDFDocument();
        document.getCatalog().getDictionary().put(Name.VERSION, Name.of("1.4"));
        assertEquals("1.4", document.getVersion());
        assertThrows(IllegalArgumentException.class, () -> document.setVersion("1.x"));
    }

    @Test
    public void testIndirectDictionaryIsNotNested() throws Exception {
        PDFDocument document = new PDFDocument();
        IndirectObject catalog = document.getCatalog();
        Map<Name, Object> prefs = new LinkedHashMap<>();
        prefs.put(Name.of("PrintScaling"), Name.of("None"));
        IndirectObject prefsObject = document.add(prefs);
        catalog.getDictionary().put(Name.of("ViewerPreferences"), prefsObject.getId());
        assertEquals("1.2", new VersionCalculator(document).calculate());

        // the same holds once references are replaced by handles
        new Dereferencer(document.getResolver()).dereferenceInPlace(catalog);
        assertSame(prefsObject, catalog.getDictionary().get(Name.of("ViewerPreferences")));
        assertEquals("1.2", new VersionCalculator(document).calculate());
    }
}
