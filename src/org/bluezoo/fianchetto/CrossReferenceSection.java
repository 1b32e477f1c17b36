/*
 * CrossReferenceSection.java
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

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * The cross-reference section of one revision.
 * <p>
 * The section maps object numbers to {@link ObjectLocation}s. It can be
 * populated from either a classic xref table or a cross-reference stream
 * (PDF 1.5+). There is at most one entry per object number, and an entry,
 * once added, is never replaced: a later change to an object belongs in
 * the section of a newer revision.
 * <p>
 * The file format chains free entries into a linked list (each free entry
 * names the next free object number, and the entry for object 0 is the
 * head). This class keeps those links to itself: {@link #lookup(ObjectId)}
 * only ever answers with a location, and {@link #getFreeList()} returns the
 * reconstructed list.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class CrossReferenceSection {

    private final TreeMap<Integer, ObjectLocation> entries;
    private final Map<Integer, Integer> freeLinks;

    /**
     * Creates an empty cross-reference section.
     */
    public CrossReferenceSection() {
        this.entries = new TreeMap<>();
        this.freeLinks = new HashMap<>();
    }

    /**
     * Adds a free entry.
     *
     * @param objectNumber the object number (0 for the head of the free list)
     * @param generation the generation number for the next use of the number
     * @param nextFree the next object number in the free list, 0 at the end
     * @throws IllegalStateException if the section already has an entry
     *         for the object number
     */
    public void addFreeEntry(int objectNumber, int generation, int nextFree) {
        put(objectNumber, ObjectLocation.free(generation));
        freeLinks.put(objectNumber, nextFree);
    }

    /**
     * Adds an entry for an object stored at a byte offset.
     *
     * @param objectNumber the object number
     * @param generation the generation number
     * @param offset the byte offset of the object in the file
     * @throws IllegalStateException if the section already has an entry
     *         for the object number
     */
    public void addOffsetEntry(int objectNumber, int generation, long offset) {
        put(objectNumber, ObjectLocation.offset(offset, generation));
    }

    /**
     * Adds an entry for an object packed in an object stream.
     *
     * @param objectNumber the object number
     * @param containerNumber the object number of the object stream
     * @param index the index of the object in the object stream
     * @throws IllegalStateException if the section already has an entry
     *         for the object number
     */
    public void addContainerEntry(int objectNumber, int containerNumber, int index) {
        put(objectNumber, ObjectLocation.inContainer(containerNumber, index));
    }

    private void put(int objectNumber, ObjectLocation location) {
        if (objectNumber < 0) {
            throw new IllegalArgumentException("Negative object number: " + objectNumber);
        }
        if (entries.containsKey(objectNumber)) {
            throw new IllegalStateException(
                "Cross-reference section already has an entry for object " + objectNumber);
        }
        entries.put(objectNumber, location);
    }

    /**
     * Returns whether the section has an entry for the object number.
     *
     * @param objectNumber the object number
     * @return true if an entry exists
     */
    public boolean contains(int objectNumber) {
        return entries.containsKey(objectNumber);
    }

    /**
     * Looks up the location of an indirect object.
     * <p>
     * A free entry answers for every generation of its object number. An
     * offset or container entry only answers for its own generation. Object
     * number 0 is never an indirect object and is never found.
     *
     * @param id the object identity
     * @return the location, or null if the section does not know the object
     */
    public ObjectLocation lookup(ObjectId id) {
        if (id.isDirect()) {
            return null;
        }
        ObjectLocation location = entries.get(id.getObjectNumber());
        if (location == null) {
            return null;
        }
        if (location.isFree() || location.getGeneration() == id.getGenerationNumber()) {
            return location;
        }
        return null;
    }

    /**
     * Returns the raw entry for an object number, including object 0.
     *
     * @param objectNumber the object number
     * @return the entry, or null if none
     */
    public ObjectLocation getEntry(int objectNumber) {
        return entries.get(objectNumber);
    }

    /**
     * Returns the identity recorded for an object number.
     *
     * @param objectNumber the object number
     * @return the identity, or null if the number has no entry
     */
    public ObjectId getObjectId(int objectNumber) {
        ObjectLocation location = entries.get(objectNumber);
        return location == null ? null : new ObjectId(objectNumber, location.getGeneration());
    }

    /**
     * Returns the object numbers of all entries except object 0, in
     * ascending order.
     *
     * @return the object numbers
     */
    public List<Integer> getObjectNumbers() {
        List<Integer> numbers = new ArrayList<>(entries.size());
        for (Integer number : entries.keySet()) {
            if (number != 0) {
                numbers.add(number);
            }
        }
        return numbers;
    }

    /**
     * Returns the number of entries in the section.
     *
     * @return the entry count
     */
    public int size() {
        return entries.size();
    }

    /**
     * Returns the highest object number in the section.
     *
     * @return the maximum object number, 0 if the section is empty
     */
    public int getMaxObjectNumber() {
        return entries.isEmpty() ? 0 : entries.lastKey();
    }

    /**
     * Adds every entry of another section whose object number this section
     * does not have yet.
     * <p>
     * Used for hybrid files, where the cross-reference stream named by a
     * trailer's /XRefStm entry supplements the classic table.
     *
     * @param other the section to take missing entries from
     */
    public void mergeMissing(CrossReferenceSection other) {
        for (Map.Entry<Integer, ObjectLocation> e : other.entries.entrySet()) {
            int number = e.getKey();
            if (!entries.containsKey(number)) {
                entries.put(number, e.getValue());
                Integer link = other.freeLinks.get(number);
                if (link != null) {
                    freeLinks.put(number, link);
                }
            }
        }
    }

    /**
     * Returns the free object numbers in free-list order.
     * <p>
     * The list is walked from the head (object 0) along the recorded links
     * until it ends, reaches a number that is not free, or loops. Free
     * numbers the walk did not reach follow in ascending order, so every
     * free object number is returned exactly once.
     *
     * @return the free object numbers, excluding 0
     */
    public List<Integer> getFreeList() {
        List<Integer> list = new ArrayList<>();
        Set<Integer> seen = new HashSet<>();
        Integer next = freeLinks.get(0);
        while (next != null && next != 0 && seen.add(next)) {
            ObjectLocation location = entries.get(next);
            if (location == null || !location.isFree()) {
                break;
            }
            list.add(next);
            next = freeLinks.get(next);
        }
        for (Map.Entry<Integer, ObjectLocation> e : entries.entrySet()) {
            int number = e.getKey();
            if (number != 0 && e.getValue().isFree() && !seen.contains(number)) {
                list.add(number);
            }
        }
        return list;
    }

    /**
     * Rewrites the free-list links so that the free numbers are chained in
     * ascending order starting at object 0 and ending with a link to 0.
     */
    public void relinkFreeList() {
        int previous = 0;
        for (Map.Entry<Integer, ObjectLocation> e : entries.entrySet()) {
            int number = e.getKey();
            if (number != 0 && e.getValue().isFree()) {
                freeLinks.put(previous, number);
                previous = number;
            }
        }
        freeLinks.put(previous, 0);
    }

    /**
     * Returns the free-list link recorded for a free entry.
     *
     * @param objectNumber the object number of a free entry
     * @return the next free object number, 0 at the end of the list
     */
    public int getNextFree(int objectNumber) {
        Integer link = freeLinks.get(objectNumber);
        return link != null ? link : 0;
    }

    /**
     * Returns the runs of consecutive object numbers in the section, as
     * pairs of first object number and entry count.
     *
     * @return the subsections in ascending order
     */
    public List<int[]> subsections() {
        List<int[]> result = new ArrayList<>();
        int start = -1;
        int count = 0;
        for (Integer number : entries.keySet()) {
            if (start >= 0 && start + count == number) {
                count++;
            } else {
                if (start >= 0) {
                    result.add(new int[] { start, count });
                }
                start = number;
                count = 1;
            }
        }
        if (start >= 0) {
            result.add(new int[] { start, count });
        }
        return result;
    }

    @Override
    public String toString() {
        return "CrossReferenceSection[entries=" + entries.size() +
               ", maxObject=" + getMaxObjectNumber() + "]";
    }

}
