/*
 * ObjectResolver.java
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
import java.util.HashMap;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.Map;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Resolves object identities to indirect objects across a revision chain.
 * <p>
 * Revisions are consulted from newest to oldest, and the first revision
 * that knows an identity answers for it: with the object it binds, or with
 * nothing if it marks the object number as free. Objects read from the
 * file are loaded on first access, through this resolver acting as the
 * {@link ObjectLoader} of every revision, and cached by identity so that
 * every resolution of an identity returns the same instance.
 * <p>
 * Objects stored in object streams are loaded by resolving the container
 * (object number, generation 0), decoding it once, and parsing the member.
 * <p>
 * Code that changes the bindings of the chain directly, rather than through
 * {@link PDFDocument}, must call {@link #invalidate(ObjectId)} or
 * {@link #clear()} afterwards.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class ObjectResolver implements ObjectLoader {

    private static final Logger logger = Logger.getLogger(ObjectResolver.class.getName());

    private final Tokenizer tokenizer;
    private final StreamCodec codec;
    private RevisionChain revisions;

    private final Map<ObjectId, IndirectObject> cache;
    private final Map<IndirectObject, ObjectStream> objectStreams;
    private final Set<ObjectId> resolving;

    /**
     * Creates a resolver.
     *
     * @param tokenizer the tokenizer for the file, or null for a document
     *        that only exists in memory
     * @param codec the codec used to decode object streams
     */
    public ObjectResolver(Tokenizer tokenizer, StreamCodec codec) {
        this.tokenizer = tokenizer;
        this.codec = codec;
        this.cache = new HashMap<>();
        this.objectStreams = new IdentityHashMap<>();
        this.resolving = new HashSet<>();
    }

    /**
     * Sets the revision chain this resolver works on.
     *
     * @param revisions the revision chain
     */
    public void setRevisions(RevisionChain revisions) {
        this.revisions = revisions;
        clear();
    }

    public RevisionChain getRevisions() {
        return revisions;
    }

    /**
     * Resolves an object identity.
     *
     * @param id the object identity
     * @return the object bound by the newest revision that knows the
     *         identity, or null if that revision frees it or no revision
     *         knows it
     * @throws IOException if an I/O error occurs while loading
     * @throws PDFParseException if the stored object is malformed, or if
     *         loading the object requires the object itself
     */
    public IndirectObject resolve(ObjectId id) throws IOException {
        if (id.isDirect()) {
            return null;
        }
        IndirectObject cached = cache.get(id);
        if (cached != null) {
            return cached;
        }
        if (revisions == null) {
            throw new IllegalStateException("Resolver has no revision chain");
        }
        if (!resolving.add(id)) {
            throw new PDFParseException("Object " + id + " is needed to load itself");
        }
        try {
            for (Revision revision : revisions.newestFirst()) {
                if (revision.contains(id)) {
                    IndirectObject obj = revision.object(id);
                    if (obj != null) {
                        cache.put(id, obj);
                    }
                    return obj;
                }
            }
            return null;
        } finally {
            resolving.remove(id);
        }
    }

    /**
     * Loads an object stored in the file.
     *
     * @param id the object identity
     * @param location the offset or container location
     * @return the loaded object, or null if it is not there
     * @throws IOException if an I/O error occurs
     * @throws PDFParseException if the stored object is malformed or is not
     *         the object the cross-reference entry names
     */
    @Override
    public IndirectObject load(ObjectId id, ObjectLocation location) throws IOException {
        if (tokenizer == null) {
            return null;
        }
        if (location.isOffset()) {
            IndirectObject obj = tokenizer.parseObjectAt(location.getOffset());
            if (!obj.getId().equals(id)) {
                throw new PDFParseException("Expected object " + id + " but found " + obj.getId(),
                                            location.getOffset());
            }
            logger.log(Level.FINEST, () -> String.format("loaded %s at %d", id, location.getOffset()));
            return obj;
        }
        if (location.isInContainer()) {
            ObjectId containerId = new ObjectId(location.getContainerNumber(), 0);
            IndirectObject container = resolve(containerId);
            if (container == null) {
                logger.log(Level.FINE, () -> String.format("object stream %s for %s not found", containerId, id));
                return null;
            }
            ObjectStream objectStream = getObjectStream(container);
            int index = objectStream.indexOf(id.getObjectNumber(), location.getIndex());
            if (index < 0) {
                logger.log(Level.FINE, () -> String.format("%s not in object stream %s", id, containerId));
                return null;
            }
            Object value = objectStream.parseMember(index, tokenizer);
            logger.log(Level.FINEST, () -> String.format("loaded %s from object stream %s", id, containerId));
            return new IndirectObject(id, value);
        }
        return null;
    }

    private ObjectStream getObjectStream(IndirectObject container) {
        ObjectStream objectStream = objectStreams.get(container);
        if (objectStream == null || !objectStream.isCurrent()) {
            objectStream = ObjectStream.decode(container, tokenizer, codec);
            objectStreams.put(container, objectStream);
        }
        return objectStream;
    }

    /**
     * Forgets the cached resolution of an identity.
     *
     * @param id the object identity
     */
    public void invalidate(ObjectId id) {
        cache.remove(id);
    }

    /**
     * Forgets all cached resolutions and decoded object streams.
     */
    public void clear() {
        cache.clear();
        objectStreams.clear();
    }

}
