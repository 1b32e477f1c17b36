/*
 * Revision.java
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
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * One revision of a PDF document.
 * <p>
 * A revision owns a {@link CrossReferenceSection}, a trailer dictionary,
 * and the indirect objects materialized from it or added to it. Objects
 * read from a file are loaded on first access through the revision's
 * {@link ObjectLoader}; objects added in memory are registered directly.
 * <p>
 * The cross-reference section read from the file is never modified.
 * Changes made in memory are layered over it: added objects, object
 * numbers freed in this revision, and the assignment of objects to object
 * streams for the next write.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class Revision {

    /**
     * The highest generation number a free entry can carry.
     */
    public static final int MAX_GENERATION = 65535;

    private final CrossReferenceSection section;
    private final Map<Name, Object> trailer;
    private final ObjectLoader loader;

    // Materialized objects by object number
    private final Map<Integer, IndirectObject> objects;

    // Object numbers freed in this revision, with their next generation
    private final Map<Integer, Integer> freed;

    // Object numbers no longer part of this revision at all
    private final Set<Integer> removed;

    // Container assignments made in memory; a null value unpacks the member
    private final Map<Integer, Integer> packing;

    /**
     * Creates an empty revision, as for a new document or an incremental
     * update.
     *
     * @param trailer the trailer dictionary
     */
    public Revision(Map<Name, Object> trailer) {
        this(new CrossReferenceSection(), trailer, null);
    }

    /**
     * Creates a revision backed by a cross-reference section.
     *
     * @param section the cross-reference section read from the file
     * @param trailer the trailer dictionary
     * @param loader the loader for objects of the section, or null
     */
    public Revision(CrossReferenceSection section, Map<Name, Object> trailer, ObjectLoader loader) {
        if (section == null) {
            throw new NullPointerException("Cross-reference section cannot be null");
        }
        this.section = section;
        this.trailer = trailer != null ? trailer : new LinkedHashMap<>();
        this.loader = loader;
        this.objects = new HashMap<>();
        this.freed = new HashMap<>();
        this.removed = new HashSet<>();
        this.packing = new HashMap<>();
    }

    public CrossReferenceSection getSection() {
        return section;
    }

    /**
     * Returns the trailer dictionary of this revision. The map is live.
     *
     * @return the trailer
     */
    public Map<Name, Object> getTrailer() {
        return trailer;
    }

    /**
     * Returns whether this revision knows the object identity.
     * <p>
     * An object number that is free in this revision is known for every
     * generation: the resolver must stop at this revision and report the
     * object as not found.
     *
     * @param id the object identity
     * @return true if the revision binds or frees the identity
     */
    public boolean contains(ObjectId id) {
        int number = id.getObjectNumber();
        if (number == 0 || removed.contains(number)) {
            return false;
        }
        if (freed.containsKey(number)) {
            return true;
        }
        IndirectObject obj = objects.get(number);
        if (obj != null) {
            return obj.getId().equals(id);
        }
        return section.lookup(id) != null;
    }

    /**
     * Returns whether this revision marks the object number as free.
     *
     * @param number the object number
     * @return true if the number is free in this revision
     */
    public boolean isFree(int number) {
        if (removed.contains(number) || objects.containsKey(number)) {
            return false;
        }
        if (freed.containsKey(number)) {
            return true;
        }
        ObjectLocation location = section.getEntry(number);
        return number != 0 && location != null && location.isFree();
    }

    /**
     * Returns the object with the given identity.
     *
     * @param id the object identity
     * @return the object, or null if this revision does not bind the
     *         identity or marks it as free
     * @throws IOException if an I/O error occurs while loading
     * @throws PDFParseException if the stored object is malformed
     */
    public IndirectObject object(ObjectId id) throws IOException {
        int number = id.getObjectNumber();
        if (number == 0 || removed.contains(number) || freed.containsKey(number)) {
            return null;
        }
        IndirectObject obj = objects.get(number);
        if (obj != null) {
            return obj.getId().equals(id) ? obj : null;
        }
        ObjectLocation location = section.lookup(id);
        if (location == null || location.isFree() || loader == null) {
            return null;
        }
        obj = loader.load(id, location);
        if (obj != null) {
            objects.put(number, obj);
        }
        return obj;
    }

    /**
     * Returns the object bound to an object number, whatever its
     * generation.
     *
     * @param number the object number
     * @return the object, or null if the number is not bound here
     * @throws IOException if an I/O error occurs while loading
     */
    public IndirectObject object(int number) throws IOException {
        IndirectObject obj = objects.get(number);
        if (obj != null) {
            return removed.contains(number) || freed.containsKey(number) ? null : obj;
        }
        ObjectId id = section.getObjectId(number);
        return id != null ? object(id) : null;
    }

    /**
     * Registers an object in this revision.
     *
     * @param obj the object
     * @throws IllegalArgumentException if the object has object number 0
     * @throws IllegalStateException if the revision already binds the
     *         object number
     */
    public void add(IndirectObject obj) {
        int number = obj.getId().getObjectNumber();
        if (number == 0) {
            throw new IllegalArgumentException("Cannot add a direct value as an indirect object");
        }
        if (objects.containsKey(number) && !removed.contains(number) && !freed.containsKey(number)) {
            throw new IllegalStateException("Revision already has an object with number " + number);
        }
        if (!removed.contains(number) && !freed.containsKey(number)) {
            ObjectLocation location = section.getEntry(number);
            if (location != null && !location.isFree()) {
                throw new IllegalStateException("Revision already has an object with number " + number);
            }
        }
        removed.remove(number);
        freed.remove(number);
        packing.remove(number);
        objects.put(number, obj);
    }

    /**
     * Deletes an object number from this revision.
     *
     * @param number the object number
     * @param markAsFree if true the number becomes a free entry that
     *        shadows older revisions; otherwise the revision forgets the
     *        number and older bindings show through
     */
    public void delete(int number, boolean markAsFree) {
        if (number == 0) {
            return;
        }
        IndirectObject obj = objects.remove(number);
        packing.remove(number);
        if (markAsFree) {
            int generation;
            if (obj != null) {
                generation = obj.getId().getGenerationNumber() + 1;
            } else {
                ObjectLocation location = section.getEntry(number);
                if (location == null) {
                    generation = 0;
                } else {
                    generation = location.isFree() ? location.getGeneration() : location.getGeneration() + 1;
                }
            }
            removed.remove(number);
            freed.put(number, Math.min(generation, MAX_GENERATION));
        } else {
            freed.remove(number);
            removed.add(number);
        }
    }

    /**
     * Frees an object identity in this revision, so that the object number
     * is reused with a later generation.
     *
     * @param id the identity of the object to free
     */
    public void free(ObjectId id) {
        int number = id.getObjectNumber();
        if (number == 0) {
            return;
        }
        delete(number, true);
        int generation = Math.max(freed.get(number), id.getGenerationNumber() + 1);
        freed.put(number, Math.min(generation, MAX_GENERATION));
    }

    /**
     * Marks an object number as free with a given next generation.
     *
     * @param number the object number
     * @param generation the generation the number is reused with
     */
    void free(int number, int generation) {
        if (number == 0) {
            return;
        }
        delete(number, true);
        freed.put(number, Math.min(generation, MAX_GENERATION));
    }

    /**
     * Replaces the object stored for an identity by another handle.
     * <p>
     * Nothing is done unless this revision binds the identity to an object
     * sharing the value of the given object.
     *
     * @param obj the new handle
     * @return the object, or null if the stored object was not replaced
     * @throws IOException if an I/O error occurs while loading the stored
     *         object
     */
    public IndirectObject update(IndirectObject obj) throws IOException {
        IndirectObject stored = object(obj.getId());
        if (stored == null || stored.getValue() != obj.getValue()) {
            return null;
        }
        objects.put(obj.getId().getObjectNumber(), obj);
        return obj;
    }

    /**
     * Returns the object numbers bound to objects in this revision.
     *
     * @return the object numbers in ascending order
     */
    public List<Integer> getObjectNumbers() {
        Set<Integer> numbers = new TreeSet<>(objects.keySet());
        for (Integer number : section.getObjectNumbers()) {
            if (!section.getEntry(number).isFree()) {
                numbers.add(number);
            }
        }
        numbers.removeAll(freed.keySet());
        numbers.removeAll(removed);
        return new ArrayList<>(numbers);
    }

    /**
     * Returns the object numbers that are free in this revision.
     *
     * @return the free object numbers in ascending order, excluding 0
     */
    public List<Integer> getFreeNumbers() {
        Set<Integer> numbers = new TreeSet<>(freed.keySet());
        for (Integer number : section.getObjectNumbers()) {
            if (section.getEntry(number).isFree() && !objects.containsKey(number)
                    && !removed.contains(number)) {
                numbers.add(number);
            }
        }
        return new ArrayList<>(numbers);
    }

    /**
     * Returns the generation number a free object number would be reused
     * with.
     *
     * @param number a free object number
     * @return the next generation of the number
     */
    public int getFreeGeneration(int number) {
        Integer generation = freed.get(number);
        if (generation != null) {
            return generation;
        }
        ObjectLocation location = section.getEntry(number);
        return location != null ? location.getGeneration() : 0;
    }

    /**
     * Returns all objects of this revision, loading those not yet
     * materialized.
     *
     * @return the objects in ascending object number order
     * @throws IOException if an I/O error occurs while loading
     */
    public List<IndirectObject> objects() throws IOException {
        List<IndirectObject> result = new ArrayList<>();
        for (Integer number : getObjectNumbers()) {
            IndirectObject obj = object(number);
            if (obj != null) {
                result.add(obj);
            }
        }
        return result;
    }

    /**
     * Returns the highest object number this revision binds or frees.
     *
     * @return the maximum object number, 0 if there is none
     */
    public int getMaxObjectNumber() {
        int max = section.getMaxObjectNumber();
        for (Integer number : objects.keySet()) {
            max = Math.max(max, number);
        }
        for (Integer number : freed.keySet()) {
            max = Math.max(max, number);
        }
        return max;
    }

    // ==================== Object stream membership ====================

    /**
     * Assigns an object to an object stream of this revision.
     *
     * @param number the object number of the member
     * @param containerNumber the object number of the object stream
     */
    public void pack(int number, int containerNumber) {
        packing.put(number, containerNumber);
    }

    /**
     * Removes an object from the object stream holding it, so that it is
     * written as an independent object.
     *
     * @param number the object number of the member
     */
    public void unpack(int number) {
        packing.put(number, null);
    }

    /**
     * Returns the object stream of this revision that holds an object.
     * <p>
     * Assignments made with {@link #pack} and {@link #unpack} take
     * precedence over the cross-reference section. A section entry only
     * counts while its object stream is still bound in this revision.
     *
     * @param number the object number
     * @return the container object number, or null for an independent
     *         object
     */
    public Integer containerOf(int number) {
        if (packing.containsKey(number)) {
            return packing.get(number);
        }
        if (objects.containsKey(number)) {
            IndirectObject obj = objects.get(number);
            ObjectLocation location = section.lookup(obj.getId());
            if (location == null || !location.isInContainer()) {
                return null;
            }
        }
        ObjectLocation location = section.getEntry(number);
        if (location == null || !location.isInContainer()) {
            return null;
        }
        int container = location.getContainerNumber();
        return isBound(container) ? container : null;
    }

    private boolean isBound(int number) {
        if (removed.contains(number) || freed.containsKey(number)) {
            return false;
        }
        if (objects.containsKey(number)) {
            return true;
        }
        ObjectLocation location = section.getEntry(number);
        return location != null && !location.isFree();
    }

    @Override
    public String toString() {
        return "Revision[section=" + section + ", trailer=" + trailer.keySet() + "]";
    }

}
