/*
 * package-info.java
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

/**
 * Fianchetto PDF document object model.
 * <p>
 * A PDF file is an append-only sequence of revisions, each with a
 * cross-reference section that may override the entries of older ones.
 * This package reads the chain of revisions, resolves indirect objects
 * lazily from the newest revision that knows them, and rewrites the
 * object graph: garbage collection and renumbering, object stream and
 * cross-reference stream conversion, pruning of default field values and
 * calculation of the minimum PDF version.
 * <p>
 * The main entry points are:
 * <ul>
 *   <li>{@link org.bluezoo.fianchetto.PDFDocument} - The document</li>
 *   <li>{@link org.bluezoo.fianchetto.Optimizer} - Rewrites the revision chain</li>
 *   <li>{@link org.bluezoo.fianchetto.PDFWriter} - Writes a document</li>
 * </ul>
 * <p>
 * Core PDF object types represented in this package:
 * <ul>
 *   <li>{@link org.bluezoo.fianchetto.Name} - PDF name objects</li>
 *   <li>{@link org.bluezoo.fianchetto.ObjectId} - Indirect object identifiers</li>
 *   <li>{@link org.bluezoo.fianchetto.IndirectObject} - Indirect objects</li>
 * </ul>
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
package org.bluezoo.fianchetto;
