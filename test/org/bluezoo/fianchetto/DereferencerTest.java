/*
 * DereferencerTest.java
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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.junit.jupiter.api.Test;

public class DereferencerTest {

    private static final Name KIDS = Name.of("Kids");
    private static final Name PARENT = Name.of("Parent");
    private static final Name PAGES = Name.of("Pages");

    private static Map<Name, Object> dict(Object... entries) {
        Map<Name, Object> dict = new LinkedHashMap<>();
        for (int i = 0; i < entries.length; i += 2) {
            dict.put((Name) entries[i], entries[i + 1]);
        }
        return dict;
    }

    /**
     * Returns whether an ObjectId can still be reached from a value.
     */
    private static boolean containsReference(Object root) {
        Set<Object> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        Deque<Object> queue = new ArrayDeque<>();
        queue.push(root);
        while (!queue.isEmpty()) {
            Object item = queue.pop();
            if (item instanceof ObjectId) {
                return true;
            }
            if (item == null || !seen.add(item)) {
                continue;
            }
            if (item instanceof IndirectObject) {
                queue.push(((IndirectObject) item).getValue());
            } else if (item instanceof Map) {
                queue.addAll(((Map<?, ?>) item).values());
            } else if (item instanceof List) {
                queue.addAll((List<?>) item);
            }
        }
        return false;
    }

    @Test
    public void testCyclicGraph() throws Exception {
        PDFDocument document = new PDFDocument();
        IndirectObject pages = document.add(dict(Name.TYPE, PAGES));
        IndirectObject page = document.add(dict(Name.TYPE, Name.of("Page"), PARENT, pages.getId()));
        pages.getDictionary().put(KIDS, new ArrayList<>(Arrays.asList(page.getId())));
        IndirectObject catalog = document.getCatalog();
        catalog.getDictionary().put(PAGES, pages.getId());

        Dereferencer dereferencer = new Dereferencer(document.getResolver());
        List<IndirectObject> unused = dereferencer.dereferenceAll();
        assertTrue(unused.isEmpty());
        assertSame(pages, page.getDictionary().get(PARENT));
        assertSame(page, ((List<?>) pages.getDictionary().get(KIDS)).get(0));
        assertSame(catalog, document.getTrailer().get(Name.ROOT));
        assertFalse(containsReference(document.getTrailer()));
    }

    @Test
    public void testDanglingReferences() throws Exception {
        PDFDocument document = new PDFDocument();
        List<Object> array = new ArrayList<>(Arrays.asList(1, new ObjectId(99, 0), 3));
        Map<Name, Object> root = dict(Name.of("Missing"), new ObjectId(98, 0), Name.of("Array"), array);

        Object result = new Dereferencer(document.getResolver()).dereferenceInPlace(root);
        assertSame(root, result);
        assertFalse(root.containsKey(Name.of("Missing")));
        assertEquals(Arrays.asList(1, null, 3), array);
    }

    @Test
    public void testDirectWrappersAreUnwrapped() throws Exception {
        PDFDocument document = new PDFDocument();
        IndirectObject target = document.add("target");
        IndirectObject wrapper = new IndirectObject(ObjectId.DIRECT,
                                                    new IndirectObject(ObjectId.DIRECT, target.getId()));
        Map<Name, Object> root = dict(Name.of("Value"), wrapper);
        new Dereferencer(document.getResolver()).dereferenceInPlace(root);
        assertSame(target, root.get(Name.of("Value")));

        Object unwrapped = new Dereferencer(document.getResolver())
            .dereferenceInPlace(new IndirectObject(ObjectId.DIRECT, 7));
        assertEquals(7, unwrapped);
    }

    @Test
    public void testUnusedObjects() throws Exception {
        PDFDocument document = new PDFDocument();
        IndirectObject catalog = document.getCatalog();
        IndirectObject used = document.add("used");
        catalog.getDictionary().put(Name.of("Used"), used.getId());
        IndirectObject orphan = document.add("orphan");
        IndirectObject length = document.add(5);
        document.add(dict(Name.LENGTH, length.getId()), new byte[] { 1, 2, 3, 4, 5 });
        IndirectObject objStm = document.add(dict(Name.TYPE, Name.OBJ_STM));

        Dereferencer dereferencer = new Dereferencer(document.getResolver());
        List<IndirectObject> unused = dereferencer.dereferenceAll();
        // the stream itself is unreachable, its length is referenced only as a length
        assertTrue(unused.contains(orphan));
        assertTrue(unused.contains(length));
        assertFalse(unused.contains(used));
        assertFalse(unused.contains(catalog));
        assertFalse(unused.contains(objStm));
        assertTrue(dereferencer.isVisited(used));
    }

    @Test
    public void testLengthTargetIsUnusedWhenStreamIsLive() throws Exception {
        PDFDocument document = new PDFDocument();
        IndirectObject catalog = document.getCatalog();
        IndirectObject length = document.add(3);
        IndirectObject stream = document.add(dict(Name.LENGTH, length.getId()), new byte[] { 1, 2, 3 });
        catalog.getDictionary().put(Name.of("Metadata"), stream.getId());

        List<IndirectObject> unused = new Dereferencer(document.getResolver()).dereferenceAll();
        assertEquals(Collections.singletonList(length), unused);
        assertSame(length, stream.getDictionary().get(Name.LENGTH));
    }

    @Test
    public void testIdempotent() throws Exception {
        PDFDocument document = RevisionChainTest.twoRevisions().open();
        Dereferencer dereferencer = new Dereferencer(document.getResolver());
        List<IndirectObject> first = dereferencer.dereferenceAll();
        List<IndirectObject> second = dereferencer.dereferenceAll();
        assertEquals(first.size(), second.size());
        for (int i = 0; i < first.size(); i++) {
            assertSame(first.get(i), second.get(i));
        }
        assertFalse(containsReference(document.getTrailer()));
    }

    @Test
    public void testShadowedObjectsAreUnused() throws Exception {
        PDFDocument document = RevisionChainTest.twoRevisions().open();
        List<IndirectObject> unused = new Dereferencer(document.getResolver()).dereferenceAll();
        // 2 0 R is not referenced at all: both revisions' objects are reported
        assertEquals(2, unused.size());
        assertEquals(20, unused.get(0).getValue());
        assertEquals(200, unused.get(1).getValue());
    }

}
