/*
 * RevisionTest.java
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
import java.util.LinkedHashMap;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.Test;

public class RevisionTest {

    private static Revision revisionWithLoader(AtomicInteger loads) {
        CrossReferenceSection section = new CrossReferenceSection();
        section.addFreeEntry(0, 65535, 0);
        section.addOffsetEntry(1, 0, 10L);
        section.addOffsetEntry(2, 1, 20L);
        section.addFreeEntry(3, 2, 0);
        section.addContainerEntry(4, 5, 0);
        section.addOffsetEntry(5, 0, 50L);
        ObjectLoader loader = (id, location) -> {
            loads.incrementAndGet();
            return new IndirectObject(id, "value " + id.getObjectNumber());
        };
        return new Revision(section, new LinkedHashMap<>(), loader);
    }

    @Test
    public void testContains() {
        Revision revision = revisionWithLoader(new AtomicInteger());
        assertTrue(revision.contains(new ObjectId(1, 0)));
        assertFalse(revision.contains(new ObjectId(1, 1)));
        assertTrue(revision.contains(new ObjectId(2, 1)));
        // free numbers are known for every generation
        assertTrue(revision.contains(new ObjectId(3, 0)));
        assertTrue(revision.contains(new ObjectId(3, 7)));
        assertFalse(revision.contains(new ObjectId(9, 0)));
        assertFalse(revision.contains(ObjectId.DIRECT));
    }

    @Test
    public void testObjectIsLoadedOnce() throws Exception {
        AtomicInteger loads = new AtomicInteger();
        Revision revision = revisionWithLoader(loads);
        IndirectObject first = revision.object(new ObjectId(1, 0));
        IndirectObject second = revision.object(new ObjectId(1, 0));
        assertSame(first, second);
        assertSame(first, revision.object(1));
        assertEquals(1, loads.get());
        assertEquals("value 1", first.getValue());
        assertNull(revision.object(new ObjectId(3, 2)));
        assertNull(revision.object(new ObjectId(2, 0)));
    }

    @Test
    public void testAddRejectsBoundNumber() {
        Revision revision = revisionWithLoader(new AtomicInteger());
        assertThrows(IllegalStateException.class,
                     () -> revision.add(new IndirectObject(new ObjectId(1, 0), "other")));
        assertThrows(IllegalArgumentException.class,
                     () -> revision.add(new IndirectObject(ObjectId.DIRECT, "direct")));
        // a free number may be reused
        IndirectObject reused = new IndirectObject(new ObjectId(3, 2), "reused");
        revision.add(reused);
        assertFalse(revision.isFree(3));
        assertTrue(revision.contains(new ObjectId(3, 2)));
    }

    @Test
    public void testDeleteMarksFree() throws Exception {
        Revision revision = revisionWithLoader(new AtomicInteger());
        revision.object(new ObjectId(2, 1));
        revision.delete(2, true);
        assertTrue(revision.isFree(2));
        assertEquals(2, revision.getFreeGeneration(2));
        assertTrue(revision.contains(new ObjectId(2, 1)));
        assertNull(revision.object(new ObjectId(2, 1)));
        assertEquals(Arrays.asList(2, 3), revision.getFreeNumbers());
        assertEquals(Arrays.asList(1, 4, 5), revision.getObjectNumbers());
    }

    @Test
    public void testDeleteWithoutMarking() {
        Revision revision = revisionWithLoader(new AtomicInteger());
        revision.delete(1, false);
        assertFalse(revision.contains(new ObjectId(1, 0)));
        assertFalse(revision.isFree(1));
        assertFalse(revision.getFreeNumbers().contains(1));
    }

    @Test
    public void testFreeGenerationIsCapped() {
        Revision revision = new Revision(new LinkedHashMap<>());
        revision.add(new IndirectObject(new ObjectId(1, Revision.MAX_GENERATION), "old"));
        revision.delete(1, true);
        assertEquals(Revision.MAX_GENERATION, revision.getFreeGeneration(1));
    }

    @Test
    public void testContainerMembership() {
        Revision revision = revisionWithLoader(new AtomicInteger());
        assertEquals(Integer.valueOf(5), revision.containerOf(4));
        assertNull(revision.containerOf(1));

        revision.unpack(4);
        assertNull(revision.containerOf(4));
        revision.pack(1, 5);
        assertEquals(Integer.valueOf(5), revision.containerOf(1));

        Revision other = revisionWithLoader(new AtomicInteger());
        other.delete(5, true);
        // the container is gone, so its members are independent
        assertNull(other.containerOf(4));
    }

    @Test
    public void testMaxObjectNumber() {
        Revision revision = revisionWithLoader(new AtomicInteger());
        assertEquals(5, revision.getMaxObjectNumber());
        revision.add(new IndirectObject(new ObjectId(12, 0), "new"));
        assertEquals(12, revision.getMaxObjectNumber());
    }

    @Test
    public void testUpdateReplacesHandle() throws Exception {
        Revision revision = new Revision(new LinkedHashMap<>());
        Object value = new LinkedHashMap<Name, Object>();
        IndirectObject stored = new IndirectObject(new ObjectId(4, 0), value);
        revision.add(stored);

        IndirectObject replacement = new IndirectObject(new ObjectId(4, 0), value);
        assertSame(replacement, revision.update(replacement));
        assertSame(replacement, revision.object(4));

        // a different value or identity is not an update
        assertNull(revision.update(new IndirectObject(new ObjectId(4, 0), new LinkedHashMap<Name, Object>())));
        assertNull(revision.update(new IndirectObject(new ObjectId(4, 1), value)));
        assertNull(revision.update(new IndirectObject(new ObjectId(7, 0), value)));
        assertSame(replacement, revision.object(4));
    }
}
