/*
 * FieldDefaultPrunerTest.java
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

import java.util.Arrays;
import java.util.Map;

import org.junit.jupiter.api.Test;

public class FieldDefaultPrunerTest {

    @SuppressWarnings("unchecked")
    private static Map<Name, Object> parse(String text) {
        return (Map<Name, Object>) PDFTokenizer.parseValue(text);
    }

    private final FieldDefaultPruner pruner = new FieldDefaultPruner(new PDFDocument().getFieldSchema());

    @Test
    public void testDefaultsAreRemoved() {
        Map<Name, Object> page = parse("<</Type /Page /Parent 2 0 R /Rotate 0 /UserUnit 1 /MediaBox [0 0 612 792]>>");
        assertEquals(2, pruner.prune(page));
        assertFalse(page.containsKey(Name.of("Rotate")));
        assertFalse(page.containsKey(Name.of("UserUnit")));
        assertTrue(page.containsKey(Name.of("MediaBox")));
        assertEquals(Name.of("Page"), page.get(Name.TYPE));
    }

    @Test
    public void testOtherValuesAreKept() {
        Map<Name, Object> page = parse("<</Type /Page /Parent 2 0 R /Rotate 90 /UserUnit 2.5>>");
        assertEquals(0, pruner.prune(page));
        assertEquals(90, page.get(Name.of("Rotate")));
    }

    @Test
    public void testRequiredFieldsAreKept() {
        Map<Name, Object> pages = parse("<</Type /Pages /Kids [] /Count 0>>");
        assertEquals(0, pruner.prune(pages));
        assertEquals(3, pages.size());
    }

    @Test
    public void testUnknownTypesAreIgnored() {
        Map<Name, Object> dict = parse("<</Type /Widget /Rotate 0>>");
        assertEquals(0, pruner.prune(dict));
        Map<Name, Object> untyped = parse("<</Rotate 0>>");
        assertEquals(0, pruner.prune(untyped));
    }

    @Test
    public void testNestedDictionariesAreLeftAlone() {
        Map<Name, Object> catalog = parse(
            "<</Type /Catalog /PageLayout /SinglePage /ViewerPreferences <</HideToolbar false>>>>");
        assertEquals(1, pruner.prune(catalog));
        @SuppressWarnings("unchecked")
        Map<Name, Object> prefs = (Map<Name, Object>) catalog.get(Name.of("ViewerPreferences"));
        assertEquals(Boolean.FALSE, prefs.get(Name.of("HideToolbar")));
    }

    @Test
    public void testPruneObjects() {
        IndirectObject page = new IndirectObject(new ObjectId(3, 0), parse("<</Type /Page /Rotate 0>>"));
        IndirectObject number = new IndirectObject(new ObjectId(4, 0), 0);
        assertEquals(1, pruner.prune(Arrays.asList(page, number)));
        assertEquals(0, number.getValue());
    }

}
