/*
 * FieldSchemaTest.java
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

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Collection;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link FieldSchema} and {@link FieldDefinition}.
 */
public class FieldSchemaTest {

    private static InputStream text(String s) {
        return new ByteArrayInputStream(s.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    public void testBundledSchema() {
        FieldSchema schema = FieldSchema.load(new DocumentConfiguration());
        assertTrue(schema.hasType(Name.CATALOG));
        assertTrue(schema.hasType(Name.of("Page")));
        FieldDefinition pages = schema.getField(Name.CATALOG, Name.of("Pages"));
        assertNotNull(pages);
        assertTrue(pages.isRequired());
        assertEquals(Name.of("Pages"), pages.getNestedType());
        FieldDefinition layout = schema.getField(Name.CATALOG, Name.of("PageLayout"));
        assertTrue(layout.hasDefault());
        assertEquals(Name.of("SinglePage"), layout.getDefault());
        assertEquals("1.4", schema.getField(Name.CATALOG, Name.VERSION).getVersion());
    }

    @Test
    public void testLoad() throws IOException {
        FieldSchema schema = new FieldSchema();
        schema.load(text("# comment\n\n/Thing /A optional 1.5 -\n/Thing /B required - Other [0 0 1]\n"));
        Collection<FieldDefinition> fields = schema.getFields(Name.of("Thing"));
        assertEquals(2, fields.size());
        FieldDefinition a = schema.getField(Name.of("Thing"), Name.of("A"));
        assertFalse(a.isRequired());
        assertFalse(a.hasDefault());
        assertNull(a.getNestedType());
        FieldDefinition b = schema.getField(Name.of("Thing"), Name.of("B"));
        assertNull(b.getVersion());
        assertEquals(Name.of("Other"), b.getNestedType());
        assertEquals(Arrays.asList(0, 0, 1), b.getDefault());
    }

    @Test
    public void testMalformedLine() {
        FieldSchema schema = new FieldSchema();
        assertThrows(IllegalArgumentException.class, () -> schema.load(text("/Thing /A sometimes - -\n")));
        assertThrows(IllegalArgumentException.class, () -> schema.load(text("/Thing /A optional - - (unterminated\n")));
    }

    @Test
    public void testUnknownType() {
        FieldSchema schema = new FieldSchema();
        assertFalse(schema.hasType(Name.of("Thing")));
        assertFalse(schema.hasType(null));
        assertNull(schema.getField(Name.of("Thing"), Name.of("A")));
        assertTrue(schema.getFields(Name.of("Thing")).isEmpty());
    }

    @Test
    public void testRegisterReplaces() {
        FieldSchema schema = new FieldSchema();
        schema.register(Name.of("Thing"), new FieldDefinition(Name.of("A"), false, 1, null, null));
        schema.register(Name.of("Thing"), new FieldDefinition(Name.of("A"), true, null, "1.3", null));
        FieldDefinition a = schema.getField(Name.of("Thing"), Name.of("A"));
        assertTrue(a.isRequired());
        assertEquals("1.3", a.getVersion());
    }

    @Test
    public void testIsDefault() {
        FieldDefinition rotate = new FieldDefinition(Name.of("Rotate"), false, 0, null, null);
        assertTrue(rotate.isDefault(0));
        assertTrue(rotate.isDefault(0.0));
        assertFalse(rotate.isDefault(90));
        assertFalse(rotate.isDefault(null));
        FieldDefinition matrix = new FieldDefinition(Name.of("Matrix"), false, Arrays.asList(1, 0, 0, 1), null, null);
        assertTrue(matrix.isDefault(Arrays.asList(1.0, 0, 0, 1)));
        assertFalse(matrix.isDefault(Arrays.asList(1, 0, 0)));
        FieldDefinition none = new FieldDefinition(Name.of("X"), false, null, null, null);
        assertFalse(none.isDefault(null));
    }

}
