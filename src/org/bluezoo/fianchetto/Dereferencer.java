/*
 * Dereferencer.java
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

import java.io.IOException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.Iterator;
import java.util.List;
import java.util.ListIterator;
import java.util.Map;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Replaces references in the object graph with the objects they lead to.
 * <p>
 * Every {@link ObjectId} met in a value is resolved and replaced by the
 * shared {@link IndirectObject} handle; an {@link IndirectObject} with
 * object number 0 is replaced by its value; a reference that cannot be
 * resolved becomes null, which removes it from a dictionary. The walk uses
 * an explicit work queue and identity sets, so it terminates on cyclic
 * graphs and visits each composite value and each indirect object once.
 * <p>
 * In whole-graph mode the walk starts at the trailer of the current
 * revision, and the objects it never reached are reported as unused.
 * Object streams and cross-reference streams are never reported. The
 * /Length entry of a stream is dereferenced without counting as a use, so
 * an object only referenced as a stream length is reported as unused.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class Dereferencer {

    private static final Logger logger = Logger.getLogger(Dereferencer.class.getName());

    private final ObjectResolver resolver;

    private Deque<Object> queue;
    private Set<Object> composites;
    private Set<IndirectObject> visited;

    /**
     * Creates a dereferencer.
     *
     * @param resolver the resolver of the document
     */
    public Dereferencer(ObjectResolver resolver) {
        this.resolver = resolver;
    }

    /**
     * Dereferences everything reachable from a value.
     *
     * @param root the value to start from
     * @return the root itself, or its replacement if the root is a
     *         reference or a wrapped direct value
     * @throws IOException if an I/O error occurs while resolving
     */
    public Object dereferenceInPlace(Object root) throws IOException {
        reset();
        Object result = replace(root);
        queue.push(result);
        walk();
        return result;
    }

    /**
     * Dereferences the whole document and collects unused objects.
     *
     * @return the objects of all revisions, oldest revision first and by
     *         object number within a revision, that are not reachable from
     *         the current trailer
     * @throws IOException if an I/O error occurs while resolving
     */
    public List<IndirectObject> dereferenceAll() throws IOException {
        reset();
        RevisionChain revisions = resolver.getRevisions();
        queue.push(revisions.current().getTrailer());
        walk();
        List<IndirectObject> unused = new ArrayList<>();
        for (Revision revision : revisions) {
            for (IndirectObject obj : revision.objects()) {
                if (!visited.contains(obj) && !obj.isType(Name.OBJ_STM) && !obj.isType(Name.XREF)) {
                    unused.add(obj);
                }
            }
        }
        logger.log(Level.FINE, () -> String.format("dereferenced %d objects, %d unused",
                                                   visited.size(), unused.size()));
        return unused;
    }

    /**
     * Returns whether the last walk reached an object.
     *
     * @param obj the object
     * @return true if the object was visited
     */
    public boolean isVisited(IndirectObject obj) {
        return visited != null && visited.contains(obj);
    }

    private void reset() {
        queue = new ArrayDeque<>();
        composites = Collections.newSetFromMap(new IdentityHashMap<>());
        visited = Collections.newSetFromMap(new IdentityHashMap<>());
    }

    private void walk() throws IOException {
        while (!queue.isEmpty()) {
            Object item = queue.pop();
            if (item instanceof IndirectObject) {
                IndirectObject obj = (IndirectObject) item;
                if (!visited.add(obj)) {
                    continue;
                }
                Object value = obj.getValue();
                if (obj.isStream()) {
                    walkDictionary(obj.getDictionary(), true);
                } else {
                    Object replacement = replace(value);
                    if (replacement != value) {
                        obj.setValue(replacement);
                    }
                    queue.push(replacement);
                }
            } else if (item instanceof Map) {
                @SuppressWarnings("unchecked")
                Map<Name, Object> dict = (Map<Name, Object>) item;
                walkDictionary(dict, false);
            } else if (item instanceof List) {
                @SuppressWarnings("unchecked")
                List<Object> array = (List<Object>) item;
                walkArray(array);
            }
        }
    }

    private void walkDictionary(Map<Name, Object> dict, boolean streamDictionary) throws IOException {
        if (!composites.add(dict)) {
            return;
        }
        Iterator<Map.Entry<Name, Object>> i = dict.entrySet().iterator();
        while (i.hasNext()) {
            Map.Entry<Name, Object> entry = i.next();
            Object value = entry.getValue();
            Object replacement = replace(value);
            if (replacement == null) {
                i.remove();
                continue;
            }
            if (replacement != value) {
                entry.setValue(replacement);
            }
            if (streamDictionary && Name.LENGTH.equals(entry.getKey())) {
                continue;
            }
            queue.push(replacement);
        }
    }

    private void walkArray(List<Object> array) throws IOException {
        if (!composites.add(array)) {
            return;
        }
        ListIterator<Object> i = array.listIterator();
        while (i.hasNext()) {
            Object value = i.next();
            Object replacement = replace(value);
            if (replacement != value) {
                i.set(replacement);
            }
            if (replacement != null) {
                queue.push(replacement);
            }
        }
    }

    /**
     * Returns what a value is replaced with: the target of a reference, or
     * the value wrapped in a direct object.
     */
    private Object replace(Object value) throws IOException {
        while (value instanceof IndirectObject && ((IndirectObject) value).getId().isDirect()) {
            value = ((IndirectObject) value).getValue();
        }
        if (value instanceof ObjectId) {
            return resolver.resolve((ObjectId) value);
        }
        return value;
    }

}
