/*
 * RevisionChain.java
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
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * The ordered revisions of a PDF document, oldest first.
 * <p>
 * A file is read from its newest cross-reference section backwards along
 * the /Prev entries of the trailers, so revisions are discovered newest
 * first and prepended. The newest revision is the current one; edits go
 * into it. The chain is never empty.
 * <p>
 * Discovery tolerates damaged files: a /Prev entry that leads back to an
 * offset already read, or to a section that cannot be parsed, ends the
 * chain at the revisions read so far.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class RevisionChain implements Iterable<Revision> {

    private static final Logger logger = Logger.getLogger(RevisionChain.class.getName());

    /**
     * Loading state of a chain read from a file.
     */
    public enum LoadState {
        UNPARSED,
        LOADING,
        LOADED
    }

    private final List<Revision> revisions;
    private final Tokenizer tokenizer;
    private final ObjectLoader loader;
    private LoadState state;

    /**
     * Creates a chain with a single empty revision.
     */
    public RevisionChain() {
        this.revisions = new ArrayList<>();
        this.tokenizer = null;
        this.loader = null;
        Map<Name, Object> trailer = new LinkedHashMap<>();
        trailer.put(Name.SIZE, 1);
        revisions.add(new Revision(trailer));
        this.state = LoadState.LOADED;
    }

    /**
     * Creates a chain that will be read from a file by {@link #load()}.
     *
     * @param tokenizer the tokenizer over the file
     * @param loader the loader for the objects of the revisions
     */
    public RevisionChain(Tokenizer tokenizer, ObjectLoader loader) {
        if (tokenizer == null) {
            throw new NullPointerException("Tokenizer cannot be null");
        }
        this.revisions = new ArrayList<>();
        this.tokenizer = tokenizer;
        this.loader = loader;
        this.state = LoadState.UNPARSED;
    }

    public LoadState getLoadState() {
        return state;
    }

    /**
     * Reads the revisions of the file, starting at the section named by
     * startxref and following /Prev entries.
     * <p>
     * A hybrid file's /XRefStm section is merged into the revision whose
     * trailer names it, without replacing the entries of the table.
     *
     * @throws IOException if an I/O error occurs
     * @throws PDFParseException if the newest section cannot be read
     * @throws IllegalStateException if the chain has already been loaded
     */
    public void load() throws IOException {
        if (state != LoadState.UNPARSED) {
            throw new IllegalStateException("Revision chain is " + state);
        }
        state = LoadState.LOADING;
        long offset = tokenizer.getStartXRefOffset();
        Set<Long> seen = new HashSet<>();
        boolean entry = true;
        while (state == LoadState.LOADING) {
            if (!seen.add(offset)) {
                final long loop = offset;
                logger.log(Level.WARNING, () -> String.format(
                    "Cross-reference section at %d already read, ending revision chain", loop));
                break;
            }
            Revision revision;
            try {
                revision = readRevision(offset);
            } catch (PDFParseException e) {
                if (entry) {
                    throw e;
                }
                logger.log(Level.WARNING, "Ignoring damaged older revisions: " + e.getMessage(), e);
                break;
            }
            revisions.add(0, revision);
            entry = false;
            final long read = offset;
            final Revision loaded = revision;
            logger.log(Level.FINE, () -> String.format("read revision at %d: %s", read, loaded));
            Object prev = revision.getTrailer().get(Name.PREV);
            if (prev instanceof Number) {
                offset = ((Number) prev).longValue();
            } else {
                break;
            }
        }
        state = LoadState.LOADED;
    }

    private Revision readRevision(long offset) throws IOException {
        CrossReferenceSection section = tokenizer.parseCrossReferenceSection(offset);
        Map<Name, Object> trailer = new LinkedHashMap<>(tokenizer.parseTrailer(offset));
        if (Name.XREF.equals(trailer.get(Name.TYPE))) {
            // The stream dictionary of a cross-reference stream doubles as trailer
            trailer.remove(Name.TYPE);
            trailer.remove(Name.W);
            trailer.remove(Name.INDEX);
            trailer.remove(Name.LENGTH);
            trailer.remove(Name.FILTER);
            trailer.remove(Name.DECODE_PARMS);
        }
        Object xrefStm = trailer.get(Name.XREF_STM);
        if (xrefStm instanceof Number) {
            long streamOffset = ((Number) xrefStm).longValue();
            section.mergeMissing(tokenizer.parseCrossReferenceSection(streamOffset));
        }
        return new Revision(section, trailer, loader);
    }

    private void checkLoaded() {
        if (state != LoadState.LOADED) {
            throw new IllegalStateException("Revision chain is " + state);
        }
    }

    /**
     * Returns the newest revision.
     *
     * @return the current revision
     */
    public Revision current() {
        checkLoaded();
        return revisions.get(revisions.size() - 1);
    }

    /**
     * Returns the revision at an index, 0 being the oldest.
     *
     * @param index the index
     * @return the revision
     */
    public Revision get(int index) {
        checkLoaded();
        return revisions.get(index);
    }

    public int size() {
        return revisions.size();
    }

    /**
     * Returns the index of a revision in this chain.
     *
     * @param revision the revision
     * @return the index, or -1 if the revision is not in the chain
     */
    public int indexOf(Revision revision) {
        for (int i = 0; i < revisions.size(); i++) {
            if (revisions.get(i) == revision) {
                return i;
            }
        }
        return -1;
    }

    /**
     * Appends a new empty revision, which becomes the current revision.
     * <p>
     * The trailer of the new revision starts as a copy of the current
     * trailer without the /Prev and /XRefStm entries, which only describe
     * the file layout of the revision they were read with.
     *
     * @return the new revision
     */
    public Revision add() {
        checkLoaded();
        Map<Name, Object> trailer = new LinkedHashMap<>(current().getTrailer());
        trailer.remove(Name.PREV);
        trailer.remove(Name.XREF_STM);
        Revision revision = new Revision(trailer);
        revisions.add(revision);
        return revision;
    }

    /**
     * Removes the revision at an index.
     *
     * @param index the index, 0 being the oldest
     * @return the removed revision
     * @throws IllegalStateException if it is the only revision
     */
    public Revision delete(int index) {
        checkLoaded();
        if (revisions.size() == 1) {
            throw new IllegalStateException("Cannot delete the only revision of a document");
        }
        return revisions.remove(index);
    }

    /**
     * Removes a revision.
     *
     * @param revision the revision
     * @throws IllegalArgumentException if the revision is not in the chain
     * @throws IllegalStateException if it is the only revision
     */
    public void delete(Revision revision) {
        int index = indexOf(revision);
        if (index < 0) {
            throw new IllegalArgumentException("Revision is not part of this chain");
        }
        delete(index);
    }

    /**
     * Merges all revisions into one.
     *
     * @throws IOException if an I/O error occurs while loading objects
     * @see #merge(int, int)
     */
    public void merge() throws IOException {
        merge(0, revisions.size() - 1);
    }

    /**
     * Merges a range of revisions into the oldest revision of the range.
     * <p>
     * Objects and free entries of newer revisions replace those of older
     * ones, and the newest trailer of the range becomes the trailer of the
     * merged revision. The /Prev and /XRefStm entries of the oldest
     * revision are kept, since they describe where it was read from.
     *
     * @param from the index of the oldest revision to merge
     * @param to the index of the newest revision to merge, inclusive
     * @throws IOException if an I/O error occurs while loading objects
     * @throws IndexOutOfBoundsException if the range is not in the chain
     */
    public void merge(int from, int to) throws IOException {
        checkLoaded();
        if (from < 0 || to >= revisions.size() || from > to) {
            throw new IndexOutOfBoundsException("Cannot merge revisions " + from + " to " + to
                                                + " of " + revisions.size());
        }
        Revision base = revisions.get(from);
        Object prev = base.getTrailer().get(Name.PREV);
        Object xrefStm = base.getTrailer().get(Name.XREF_STM);
        for (int i = to; i > from; i--) {
            Revision revision = revisions.get(i);
            Revision older = revisions.get(i - 1);
            Map<Name, Object> trailer = older.getTrailer();
            trailer.clear();
            trailer.putAll(revision.getTrailer());
            for (IndirectObject obj : revision.objects()) {
                int number = obj.getId().getObjectNumber();
                older.delete(number, false);
                older.add(obj);
                Integer container = revision.containerOf(number);
                if (container != null) {
                    older.pack(number, container);
                } else {
                    older.unpack(number);
                }
            }
            for (Integer number : revision.getFreeNumbers()) {
                older.free(number, revision.getFreeGeneration(number));
            }
        }
        Map<Name, Object> trailer = base.getTrailer();
        trailer.remove(Name.PREV);
        trailer.remove(Name.XREF_STM);
        if (prev != null) {
            trailer.put(Name.PREV, prev);
        }
        if (xrefStm != null) {
            trailer.put(Name.XREF_STM, xrefStm);
        }
        for (int i = to; i > from; i--) {
            revisions.remove(i);
        }
        final int count = to - from + 1;
        logger.log(Level.FINE, () -> String.format("merged %d revisions into %s", count, base));
    }

    /**
     * Returns the highest object number used by any revision.
     *
     * @return the maximum object number
     */
    public int getMaxObjectNumber() {
        int max = 0;
        for (Revision revision : revisions) {
            max = Math.max(max, revision.getMaxObjectNumber());
        }
        return max;
    }

    /**
     * Returns the revisions from oldest to newest.
     *
     * @return an iterator over a snapshot of the chain
     */
    @Override
    public Iterator<Revision> iterator() {
        checkLoaded();
        return Collections.unmodifiableList(new ArrayList<>(revisions)).iterator();
    }

    /**
     * Returns the revisions from newest to oldest.
     *
     * @return a snapshot of the chain in resolution order
     */
    public List<Revision> newestFirst() {
        checkLoaded();
        List<Revision> list = new ArrayList<>(revisions);
        Collections.reverse(list);
        return list;
    }

    @Override
    public String toString() {
        return "RevisionChain[revisions=" + revisions.size() + ", state=" + state + "]";
    }

}
