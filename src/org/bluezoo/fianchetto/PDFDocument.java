/*
 * PDFDocument.java
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
import java.nio.channels.SeekableByteChannel;
import java.nio.channels.WritableByteChannel;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.regex.Pattern;

/**
 * A PDF document.
 * <p>
 * The document owns its {@link RevisionChain} and the
 * {@link ObjectResolver} every lookup goes through. A document opened from
 * a channel reads the chain of cross-reference sections at once and loads
 * objects lazily; the channel must stay open while the document is used.
 * <p>
 * Objects are added to and deleted from the current revision, so that
 * older revisions keep describing the file as it was read.
 *
 * <pre>
 * PDFDocument doc = PDFDocument.open(channel);
 * IndirectObject catalog = doc.getCatalog();
 * new Optimizer(doc).setCompact(true).run();
 * doc.write(out);
 * </pre>
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class PDFDocument {

    private static final Logger logger = Logger.getLogger(PDFDocument.class.getName());

    private static final Pattern VERSION = Pattern.compile("\\d\\.\\d");

    private final DocumentConfiguration configuration;
    private final RevisionChain revisions;
    private final ObjectResolver resolver;
    private final StreamCodec codec;
    private final FieldSchema fieldSchema;
    private String version;

    /**
     * Creates an empty document with the default configuration.
     */
    public PDFDocument() {
        this(new DocumentConfiguration());
    }

    /**
     * Creates an empty document.
     *
     * @param configuration the configuration
     */
    public PDFDocument(DocumentConfiguration configuration) {
        this.configuration = configuration;
        this.codec = new DefaultStreamCodec();
        this.revisions = new RevisionChain();
        this.resolver = new ObjectResolver(null, codec);
        this.resolver.setRevisions(revisions);
        this.fieldSchema = FieldSchema.load(configuration);
        this.version = configuration.getDefaultVersion();
    }

    private PDFDocument(DocumentConfiguration configuration, StreamCodec codec,
                        RevisionChain revisions, ObjectResolver resolver, String version) {
        this.configuration = configuration;
        this.codec = codec;
        this.revisions = revisions;
        this.resolver = resolver;
        this.fieldSchema = FieldSchema.load(configuration);
        this.version = version;
    }

    /**
     * Opens a document with the default configuration.
     *
     * @param channel the channel to read the document from
     * @return the document
     * @throws IOException if an I/O error occurs
     * @throws PDFParseException if the newest cross-reference section
     *         cannot be read
     */
    public static PDFDocument open(SeekableByteChannel channel) throws IOException {
        return open(channel, new DocumentConfiguration());
    }

    /**
     * Opens a document.
     *
     * @param channel the channel to read the document from
     * @param configuration the configuration
     * @return the document
     * @throws IOException if an I/O error occurs
     * @throws PDFParseException if the newest cross-reference section
     *         cannot be read
     */
    public static PDFDocument open(SeekableByteChannel channel, DocumentConfiguration configuration)
            throws IOException {
        StreamCodec codec = new DefaultStreamCodec();
        PDFTokenizer tokenizer = new PDFTokenizer(channel, codec);
        ObjectResolver resolver = new ObjectResolver(tokenizer, codec);
        RevisionChain revisions = new RevisionChain(tokenizer, resolver);
        resolver.setRevisions(revisions);
        revisions.load();
        String version = tokenizer.getHeaderVersion();
        if (version == null) {
            version = configuration.getDefaultVersion();
        }
        PDFDocument document = new PDFDocument(configuration, codec, revisions, resolver, version);
        logger.log(Level.FINE, () -> String.format("opened PDF %s document with %d revisions",
                                                   document.version, revisions.size()));
        return document;
    }

    static boolean isValidVersion(String version) {
        return version != null && VERSION.matcher(version).matches();
    }

    /**
     * Compares two PDF versions.
     *
     * @param a a version
     * @param b another version
     * @return a negative number, zero, or a positive number as a is lower
     *         than, equal to, or higher than b
     */
    static int compareVersions(String a, String b) {
        return a.compareTo(b);
    }

    // ==================== Accessors ====================

    public DocumentConfiguration getConfiguration() {
        return configuration;
    }

    public RevisionChain getRevisions() {
        return revisions;
    }

    public ObjectResolver getResolver() {
        return resolver;
    }

    public StreamCodec getCodec() {
        return codec;
    }

    public FieldSchema getFieldSchema() {
        return fieldSchema;
    }

    /**
     * Returns the trailer of the current revision.
     *
     * @return the trailer dictionary
     */
    public Map<Name, Object> getTrailer() {
        return revisions.current().getTrailer();
    }

    /**
     * Returns the PDF version of the document: the higher of the version
     * in the file header and the /Version entry of the catalog.
     *
     * @return the version, e.g. "1.7"
     * @throws IOException if an I/O error occurs while loading the catalog
     */
    public String getVersion() throws IOException {
        String result = version;
        Object root = deref(getTrailer().get(Name.ROOT));
        if (root instanceof IndirectObject) {
            Map<Name, Object> catalog = ((IndirectObject) root).getDictionary();
            Object catalogVersion = catalog != null ? catalog.get(Name.VERSION) : null;
            if (catalogVersion instanceof Name) {
                String v = ((Name) catalogVersion).getValue();
                if (isValidVersion(v) && compareVersions(v, result) > 0) {
                    result = v;
                }
            }
        }
        return result;
    }

    /**
     * Sets the version written in the file header.
     *
     * @param version the version, e.g. "1.7"
     * @throws IllegalArgumentException if the version is not of the form
     *         major.minor
     */
    public void setVersion(String version) {
        if (!isValidVersion(version)) {
            throw new IllegalArgumentException("Invalid PDF version: " + version);
        }
        this.version = version;
    }

    // ==================== Objects ====================

    /**
     * Returns the object with the given identity.
     *
     * @param id the object identity
     * @return the object, or null if it does not exist
     * @throws IOException if an I/O error occurs while loading
     */
    public IndirectObject object(ObjectId id) throws IOException {
        return resolver.resolve(id);
    }

    /**
     * Follows a reference.
     *
     * @param value a value
     * @return the object a reference leads to (null if there is none), the
     *         value of a wrapped direct value, or the value itself
     * @throws IOException if an I/O error occurs while loading
     */
    public Object deref(Object value) throws IOException {
        if (value instanceof ObjectId) {
            return resolver.resolve((ObjectId) value);
        }
        if (value instanceof IndirectObject && ((IndirectObject) value).getId().isDirect()) {
            return ((IndirectObject) value).getValue();
        }
        return value;
    }

    /**
     * Returns the next unused object number.
     *
     * @return one more than the highest object number of any revision
     */
    public int nextObjectNumber() {
        return revisions.getMaxObjectNumber() + 1;
    }

    /**
     * Adds a new object to the current revision.
     *
     * @param value the object value
     * @return the new object
     */
    public IndirectObject add(Object value) {
        return add(value, null, revisions.current());
    }

    /**
     * Adds a new stream object to the current revision.
     *
     * @param dictionary the stream dictionary
     * @param stream the encoded stream data
     * @return the new object
     */
    public IndirectObject add(Map<Name, Object> dictionary, byte[] stream) {
        return add(dictionary, stream, revisions.current());
    }

    /**
     * Adds a new object to a revision, with a new object number.
     *
     * @param value the object value
     * @param stream the encoded stream data, or null
     * @param revision a revision of this document
     * @return the new object
     * @throws IllegalArgumentException if the revision is not part of this
     *         document
     */
    public IndirectObject add(Object value, byte[] stream, Revision revision) {
        if (revisions.indexOf(revision) < 0) {
            throw new IllegalArgumentException("Revision is not part of this document");
        }
        IndirectObject obj = new IndirectObject(new ObjectId(nextObjectNumber(), 0), value, stream);
        revision.add(obj);
        resolver.invalidate(obj.getId());
        return obj;
    }

    /**
     * Adds an existing object to the current revision.
     * <p>
     * An object read from an older revision is added with its identity, so
     * that the change is recorded in the current revision. An object with
     * object number 0 is given a new object number.
     *
     * @param obj the object
     * @return the object
     * @throws IllegalStateException if the current revision already binds
     *         another object to the object number
     */
    public IndirectObject add(IndirectObject obj) {
        Revision current = revisions.current();
        if (obj.getId().isDirect()) {
            obj.setId(new ObjectId(nextObjectNumber(), 0));
        }
        try {
            if (current.object(obj.getId()) == obj) {
                return obj;
            }
        } catch (IOException e) {
            throw new IllegalStateException("Cannot check current revision for " + obj.getId(), e);
        }
        current.add(obj);
        resolver.invalidate(obj.getId());
        return obj;
    }

    /**
     * Deletes an object by freeing its object number in the current
     * revision.
     *
     * @param id the object identity
     */
    public void delete(ObjectId id) {
        revisions.current().free(id);
        resolver.invalidate(id);
    }

    /**
     * Returns the objects of the document.
     *
     * @param onlyCurrent if true, only the object each object number is
     *        currently bound to; otherwise every object of every revision
     * @return the objects, by object number for the current view, or in
     *         revision order otherwise
     * @throws IOException if an I/O error occurs while loading
     */
    public List<IndirectObject> objects(boolean onlyCurrent) throws IOException {
        if (!onlyCurrent) {
            List<IndirectObject> all = new ArrayList<>();
            for (Revision revision : revisions) {
                all.addAll(revision.objects());
            }
            return all;
        }
        Map<Integer, IndirectObject> current = new TreeMap<>();
        Set<Integer> shadowed = new HashSet<>();
        for (Revision revision : revisions.newestFirst()) {
            List<Integer> numbers = revision.getObjectNumbers();
            for (Integer number : numbers) {
                if (!shadowed.contains(number)) {
                    IndirectObject obj = revision.object(number);
                    if (obj != null) {
                        current.put(number, obj);
                    }
                }
            }
            shadowed.addAll(numbers);
            shadowed.addAll(revision.getFreeNumbers());
        }
        return new ArrayList<>(current.values());
    }

    /**
     * Returns the document catalog, creating it if the trailer has none.
     *
     * @return the catalog object
     * @throws IOException if an I/O error occurs while loading
     */
    public IndirectObject getCatalog() throws IOException {
        Object root = deref(getTrailer().get(Name.ROOT));
        if (root instanceof IndirectObject) {
            return (IndirectObject) root;
        }
        Map<Name, Object> dict = new LinkedHashMap<>();
        dict.put(Name.TYPE, Name.CATALOG);
        IndirectObject catalog = add(dict);
        getTrailer().put(Name.ROOT, catalog.getId());
        return catalog;
    }

    // ==================== Writing ====================

    /**
     * Writes the document with all its revisions.
     * <p>
     * The document version is raised first if the objects use features of
     * a later version.
     *
     * @param channel the channel to write to, positioned at the start of
     *        the output
     * @throws IOException if an I/O error occurs
     */
    public void write(WritableByteChannel channel) throws IOException {
        new VersionCalculator(this).run();
        new PDFWriter(this, channel).write();
    }

    @Override
    public String toString() {
        return "PDFDocument[version=" + version + ", revisions=" + revisions.size() + "]";
    }

}
