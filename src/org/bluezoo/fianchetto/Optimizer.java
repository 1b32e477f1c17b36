/*
 * Optimizer.java
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
import java.util.Comparator;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Rewrites the revision chain of a document.
 * <p>
 * Three independent tasks can be enabled, and run in this order:
 * <ol>
 *   <li><b>Compaction</b> merges the chain into a single revision that
 *       holds only the objects reachable from the trailer, renumbered
 *       from 1 with generation 0.</li>
 *   <li><b>Object streams</b> are generated, deleted, or left alone.</li>
 *   <li><b>Cross-reference streams</b> are generated, deleted, or left
 *       alone.</li>
 * </ol>
 * Optional fields set to their default value are removed from every
 * object unless {@link #setPruneDefaults} disables it.
 *
 * <pre>
 * new Optimizer(document)
 *     .setCompact(true)
 *     .setObjectStreams(Optimizer.Mode.GENERATE)
 *     .run();
 * </pre>
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class Optimizer {

    private static final Logger logger = Logger.getLogger(Optimizer.class.getName());

    /**
     * What to do with an optional file structure.
     */
    public enum Mode {
        /** Keep the structure as it is. */
        PRESERVE,
        /** Create the structure where it is missing. */
        GENERATE,
        /** Remove the structure. */
        DELETE
    }

    private static final Comparator<IndirectObject> BY_ID = new Comparator<IndirectObject>() {
        @Override
        public int compare(IndirectObject a, IndirectObject b) {
            return a.getId().compareTo(b.getId());
        }
    };

    private final PDFDocument document;
    private boolean compact;
    private Mode objectStreams = Mode.PRESERVE;
    private Mode xrefStreams = Mode.PRESERVE;
    private boolean pruneDefaults = true;

    public Optimizer(PDFDocument document) {
        this.document = document;
    }

    public Optimizer setCompact(boolean compact) {
        this.compact = compact;
        return this;
    }

    public Optimizer setObjectStreams(Mode mode) {
        this.objectStreams = mode;
        return this;
    }

    public Optimizer setXRefStreams(Mode mode) {
        this.xrefStreams = mode;
        return this;
    }

    public Optimizer setPruneDefaults(boolean pruneDefaults) {
        this.pruneDefaults = pruneDefaults;
        return this;
    }

    /**
     * Runs the enabled tasks.
     *
     * @throws IOException if an I/O error occurs while loading objects
     * @throws ReferentialIntegrityException if compaction left a reference
     *         to an object that is not part of the compacted revision
     */
    public void run() throws IOException {
        if (compact) {
            compact();
        } else if (pruneDefaults) {
            new FieldDefaultPruner(document.getFieldSchema()).prune(document.objects(false));
        }
        switch (objectStreams) {
            case GENERATE:
                generateObjectStreams();
                break;
            case DELETE:
                deleteObjectStreams();
                break;
            default:
                break;
        }
        switch (xrefStreams) {
            case GENERATE:
                generateXRefStreams();
                break;
            case DELETE:
                deleteXRefStreams();
                break;
            default:
                break;
        }
    }

    // ==================== Compaction ====================

    void compact() throws IOException {
        RevisionChain revisions = document.getRevisions();
        ObjectResolver resolver = document.getResolver();
        IndirectObject xref = null;
        if (xrefStreams == Mode.PRESERVE) {
            for (Revision revision : revisions.newestFirst()) {
                xref = findXRefObject(revision);
                if (xref != null) {
                    break;
                }
            }
        }
        revisions.merge();
        resolver.clear();
        if (xref != null && revisions.current().object(xref.getId()) != xref) {
            xref = null;
        }
        Dereferencer dereferencer = new Dereferencer(resolver);
        List<IndirectObject> unused = dereferencer.dereferenceAll();

        List<IndirectObject> live = new ArrayList<>();
        for (IndirectObject obj : revisions.current().objects()) {
            if (obj.isType(Name.OBJ_STM) || obj.isType(Name.XREF)) {
                continue;
            }
            if (dereferencer.isVisited(obj)) {
                live.add(obj);
            }
        }
        Collections.sort(live, BY_ID);
        if (xref != null) {
            // Drop the stale trailer entries; the writer rebuilds the dictionary
            Map<Name, Object> dict = new LinkedHashMap<>();
            dict.put(Name.TYPE, Name.XREF);
            xref.setValue(dict);
            xref.setStream(new byte[0]);
            live.add(xref);
        }

        Revision compacted = revisions.add();
        int number = 0;
        for (IndirectObject obj : live) {
            obj.setId(new ObjectId(++number, 0));
            if (obj.isStream()) {
                obj.getDictionary().put(Name.LENGTH, obj.getStream().length);
            }
            compacted.add(obj);
        }
        if (pruneDefaults) {
            new FieldDefaultPruner(document.getFieldSchema()).prune(live);
        }
        compacted.getTrailer().put(Name.SIZE, number + 1);
        revisions.delete(0);
        resolver.clear();
        checkIntegrity(compacted);

        final int count = number;
        logger.log(Level.FINE, () -> String.format("compacted to %d objects, %d unused objects removed",
                                                   count, unused.size()));
    }

    /**
     * Checks that every indirect object reachable from the revision is
     * registered in it under its identity.
     */
    private void checkIntegrity(Revision revision) throws IOException {
        Set<Object> composites = Collections.newSetFromMap(new IdentityHashMap<>());
        Deque<Object> queue = new ArrayDeque<>();
        queue.push(revision.getTrailer());
        for (IndirectObject obj : revision.objects()) {
            queue.push(obj.getValue());
        }
        while (!queue.isEmpty()) {
            Object item = queue.pop();
            if (item instanceof ObjectId) {
                throw new ReferentialIntegrityException("Unresolved reference after compaction", (ObjectId) item);
            } else if (item instanceof IndirectObject) {
                IndirectObject obj = (IndirectObject) item;
                if (obj.getId().isDirect()) {
                    queue.push(obj.getValue());
                } else if (revision.object(obj.getId()) != obj) {
                    throw new ReferentialIntegrityException("Object is not part of the compacted revision",
                                                            obj.getId());
                }
            } else if (item instanceof Map) {
                if (composites.add(item)) {
                    for (Object value : ((Map<?, ?>) item).values()) {
                        queue.push(value);
                    }
                }
            } else if (item instanceof List) {
                if (composites.add(item)) {
                    for (Object value : (List<?>) item) {
                        queue.push(value);
                    }
                }
            }
        }
    }

    // ==================== Object streams ====================

    void generateObjectStreams() throws IOException {
        DocumentConfiguration configuration = document.getConfiguration();
        int groupSize = configuration.getObjectStreamGroupSize();
        Set<Name> excluded = configuration.getObjectStreamExcludedTypes();
        Name filter = configuration.getStreamFilter();
        PDFSerializer serializer = new PDFSerializer();
        for (Revision revision : document.getRevisions()) {
            List<IndirectObject> objects = revision.objects();
            boolean hasXRef = false;
            for (IndirectObject obj : objects) {
                if (obj.isType(Name.OBJ_STM)) {
                    deleteObject(revision, obj);
                } else if (obj.isType(Name.XREF)) {
                    hasXRef = true;
                }
            }

            Map<Name, Object> trailer = revision.getTrailer();
            int encrypt = objectNumber(trailer.get(Name.ENCRYPT));
            int root = trailer.containsKey(Name.ENCRYPT) ? objectNumber(trailer.get(Name.ROOT)) : 0;
            List<IndirectObject> eligible = new ArrayList<>();
            for (IndirectObject obj : objects) {
                int number = obj.getId().getObjectNumber();
                if (obj.isStream() || obj.getId().getGenerationNumber() != 0
                        || obj.isType(Name.OBJ_STM) || obj.isType(Name.XREF)
                        || number == encrypt || number == root) {
                    continue;
                }
                Name type = obj.getType();
                if (type != null && excluded.contains(type)) {
                    continue;
                }
                eligible.add(obj);
            }
            if (eligible.isEmpty()) {
                continue;
            }
            if (!hasXRef) {
                addXRefObject(revision);
            }

            int containers = 0;
            for (int start = 0; start < eligible.size(); start += groupSize) {
                List<IndirectObject> members = eligible.subList(start, Math.min(start + groupSize, eligible.size()));
                Map<Name, Object> dict = new LinkedHashMap<>();
                dict.put(Name.TYPE, Name.OBJ_STM);
                IndirectObject container = document.add(dict, new byte[0], revision);
                for (IndirectObject member : members) {
                    revision.pack(member.getId().getObjectNumber(), container.getId().getObjectNumber());
                }
                ObjectStream.pack(container, members, serializer, document.getCodec(), filter);
                containers++;
            }
            final int count = containers;
            logger.log(Level.FINE, () -> String.format("packed %d objects into %d object streams in %s",
                                                       eligible.size(), count, revision));
        }
    }

    void deleteObjectStreams() throws IOException {
        for (Revision revision : document.getRevisions()) {
            List<IndirectObject> objects = revision.objects();
            for (IndirectObject obj : objects) {
                int number = obj.getId().getObjectNumber();
                if (revision.containerOf(number) != null) {
                    revision.unpack(number);
                }
            }
            for (IndirectObject obj : objects) {
                if (obj.isType(Name.OBJ_STM)) {
                    deleteObject(revision, obj);
                }
            }
        }
    }

    // ==================== Cross-reference streams ====================

    void generateXRefStreams() throws IOException {
        for (Revision revision : document.getRevisions()) {
            if (findXRefObject(revision) == null) {
                addXRefObject(revision);
            }
        }
    }

    void deleteXRefStreams() throws IOException {
        for (Revision revision : document.getRevisions()) {
            IndirectObject xref = findXRefObject(revision);
            if (xref == null) {
                continue;
            }
            if (hasPackedObjects(revision)) {
                logger.log(Level.FINE, () -> String.format(
                    "keeping cross-reference stream %s for object streams in %s", xref.getId(), revision));
                continue;
            }
            deleteObject(revision, xref);
        }
    }

    // ==================== Helpers ====================

    private void addXRefObject(Revision revision) {
        Map<Name, Object> dict = new LinkedHashMap<>();
        dict.put(Name.TYPE, Name.XREF);
        document.add(dict, new byte[0], revision);
    }

    private void deleteObject(Revision revision, IndirectObject obj) {
        revision.delete(obj.getId().getObjectNumber(), true);
        document.getResolver().invalidate(obj.getId());
    }

    private static IndirectObject findXRefObject(Revision revision) throws IOException {
        for (IndirectObject obj : revision.objects()) {
            if (obj.isType(Name.XREF)) {
                return obj;
            }
        }
        return null;
    }

    private static boolean hasPackedObjects(Revision revision) {
        for (Integer number : revision.getObjectNumbers()) {
            if (revision.containerOf(number) != null) {
                return true;
            }
        }
        return false;
    }

    private static int objectNumber(Object value) {
        if (value instanceof ObjectId) {
            return ((ObjectId) value).getObjectNumber();
        }
        if (value instanceof IndirectObject) {
            return ((IndirectObject) value).getId().getObjectNumber();
        }
        return 0;
    }

}
