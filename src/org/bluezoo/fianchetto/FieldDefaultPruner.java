/*
 * FieldDefaultPruner.java
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

import java.util.Collection;
import java.util.Iterator;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Removes dictionary fields whose value equals the default of the field.
 * <p>
 * Only dictionaries whose /Type has field definitions are pruned, and
 * only fields that are optional and declare a default. Nested values are
 * left alone.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class FieldDefaultPruner {

    private static final Logger logger = Logger.getLogger(FieldDefaultPruner.class.getName());

    private final FieldSchema schema;

    public FieldDefaultPruner(FieldSchema schema) {
        this.schema = schema;
    }

    /**
     * Prunes the dictionary values of a number of objects.
     *
     * @param objects the objects
     * @return the number of fields removed
     */
    public int prune(Collection<IndirectObject> objects) {
        int count = 0;
        for (IndirectObject obj : objects) {
            Map<Name, Object> dict = obj.getDictionary();
            if (dict != null) {
                count += prune(dict);
            }
        }
        if (count > 0) {
            final int removed = count;
            logger.log(Level.FINE, () -> String.format("pruned %d default fields", removed));
        }
        return count;
    }

    /**
     * Prunes a dictionary.
     *
     * @param dict the dictionary
     * @return the number of fields removed
     */
    public int prune(Map<Name, Object> dict) {
        Object type = dict.get(Name.TYPE);
        if (!(type instanceof Name) || !schema.hasType((Name) type)) {
            return 0;
        }
        int count = 0;
        Iterator<Map.Entry<Name, Object>> i = dict.entrySet().iterator();
        while (i.hasNext()) {
            Map.Entry<Name, Object> entry = i.next();
            FieldDefinition field = schema.getField((Name) type, entry.getKey());
            if (field != null && !field.isRequired() && field.isDefault(entry.getValue())) {
                i.remove();
                count++;
            }
        }
        return count;
    }

}
