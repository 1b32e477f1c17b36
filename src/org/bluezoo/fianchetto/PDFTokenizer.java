/*
 * PDFTokenizer.java
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

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.SeekableByteChannel;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads PDF syntax from a seekable channel.
 * <p>
 * The tokenizer is positioned explicitly by each operation: it seeks to
 * the requested offset, reads what it needs through an internal buffer,
 * and leaves nothing behind for the next call. Values are built as the
 * Java types described by {@link IndirectObject}; references are returned
 * as {@link ObjectId}s and are never followed.
 * <p>
 * Stream data is returned still encoded. The stream length is taken from
 * a direct /Length entry when the data is followed by the endstream
 * keyword at that length; otherwise, including for an indirect /Length,
 * the data extends to the next endstream keyword.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class PDFTokenizer implements Tokenizer {

    private static final int BUFFER_SIZE = 8192;
    private static final int SEARCH_SIZE = 1024;

    private static final byte[] HEADER = ascii("%PDF-");
    private static final byte[] STARTXREF = ascii("startxref");
    private static final byte[] XREF = ascii("xref");
    private static final byte[] TRAILER = ascii("trailer");
    private static final byte[] OBJ = ascii("obj");
    private static final byte[] STREAM = ascii("stream");
    private static final byte[] ENDSTREAM = ascii("endstream");
    private static final byte[] TRUE = ascii("true");
    private static final byte[] FALSE = ascii("false");
    private static final byte[] NULL = ascii("null");

    private final SeekableByteChannel channel;
    private final StreamCodec codec;
    private final ByteBuffer buffer;
    private long bufferOffset; // file offset of buffer start

    /**
     * Creates a tokenizer.
     *
     * @param channel the channel to read
     * @param codec the codec used to decode cross-reference streams
     */
    public PDFTokenizer(SeekableByteChannel channel, StreamCodec codec) {
        if (channel == null) {
            throw new NullPointerException("Channel cannot be null");
        }
        this.channel = channel;
        this.codec = codec;
        this.buffer = ByteBuffer.allocate(BUFFER_SIZE);
        this.buffer.limit(0);
    }

    private static byte[] ascii(String s) {
        return s.getBytes(StandardCharsets.US_ASCII);
    }

    /**
     * Parses a direct value written in PDF syntax, such as "[0 0 612 792]".
     *
     * @param text the PDF syntax
     * @return the value
     * @throws PDFParseException if the text is not a valid value
     */
    public static Object parseValue(String text) {
        byte[] bytes = text.getBytes(StandardCharsets.ISO_8859_1);
        return readDirectValue(ByteBuffer.wrap(bytes), 0, null);
    }

    private static Object readDirectValue(ByteBuffer data, int offset, StreamCodec codec) {
        PDFTokenizer tokenizer = new PDFTokenizer(new ByteBufferChannel(data), codec);
        try {
            tokenizer.seek(offset);
            return tokenizer.readValue();
        } catch (IOException e) {
            // An in-memory channel only fails once closed
            throw new PDFParseException("Cannot read in-memory data", e);
        }
    }

    // ========================================================================
    // Tokenizer
    // ========================================================================

    @Override
    public long getStartXRefOffset() throws IOException {
        long fileSize = channel.size();
        int searchSize = (int) Math.min(SEARCH_SIZE, fileSize);
        long searchStart = fileSize - searchSize;
        seek(searchStart);
        byte[] tail = readBytes(searchSize);
        for (int i = searchSize - STARTXREF.length; i >= 0; i--) {
            if (matches(tail, i, STARTXREF)) {
                seek(searchStart + i + STARTXREF.length);
                skipWhitespace();
                return readLong();
            }
        }
        throw new PDFParseException("startxref not found");
    }

    @Override
    public String getHeaderVersion() throws IOException {
        int searchSize = (int) Math.min(SEARCH_SIZE, channel.size());
        seek(0L);
        byte[] head = readBytes(searchSize);
        for (int i = 0; i + HEADER.length + 3 <= searchSize; i++) {
            if (matches(head, i, HEADER)) {
                int p = i + HEADER.length;
                if (isDigit(head[p]) && head[p + 1] == '.' && isDigit(head[p + 2])) {
                    return new String(head, p, 3, StandardCharsets.US_ASCII);
                }
                return null;
            }
        }
        return null;
    }

    @Override
    public CrossReferenceSection parseCrossReferenceSection(long offset) throws IOException {
        seek(offset);
        skipWhitespace();
        int b = peek();
        if (b == 'x') {
            CrossReferenceSection section = new CrossReferenceSection();
            readXRefTable(offset, section);
            return section;
        } else if (isDigit(b)) {
            return readXRefStream(offset);
        }
        throw new PDFParseException("Invalid cross-reference section", offset);
    }

    @Override
    public Map<Name, Object> parseTrailer(long offset) throws IOException {
        seek(offset);
        skipWhitespace();
        int b = peek();
        if (b == 'x') {
            readXRefTable(offset, new CrossReferenceSection());
            if (!skipKeyword(TRAILER)) {
                throw new PDFParseException("Expected 'trailer'", getPosition());
            }
            skipWhitespace();
            if (peek() != '<') {
                throw new PDFParseException("Expected trailer dictionary", getPosition());
            }
            return readDictionary();
        } else if (isDigit(b)) {
            readObjectHeader();
            Object value = readValue();
            if (!(value instanceof Map)) {
                throw new PDFParseException("Cross-reference stream has no dictionary", offset);
            }
            @SuppressWarnings("unchecked")
            Map<Name, Object> dict = (Map<Name, Object>) value;
            return dict;
        }
        throw new PDFParseException("Invalid cross-reference section", offset);
    }

    @Override
    public IndirectObject parseObjectAt(long offset) throws IOException {
        seek(offset);
        skipWhitespace();
        ObjectId id = readObjectHeader();
        Object value = readValue();
        skipWhitespace();
        byte[] stream = null;
        if (value instanceof Map && peek() == 's') {
            if (!skipKeyword(STREAM)) {
                throw new PDFParseException("Expected 'stream'", getPosition());
            }
            @SuppressWarnings("unchecked")
            Map<Name, Object> dict = (Map<Name, Object>) value;
            stream = readStreamData(dict);
        }
        return new IndirectObject(id, value, stream);
    }

    @Override
    public Object parseValue(ByteBuffer data, int offset) {
        return readDirectValue(data, offset, codec);
    }

    @Override
    public int[][] parseObjectStreamIndex(ByteBuffer data, int count, int first) {
        if (count < 0 || first < 0 || first > data.remaining()) {
            throw new PDFParseException("Invalid object stream index: N=" + count + ", First=" + first);
        }
        int[][] index = new int[count][2];
        ByteBuffer slice = data.duplicate();
        slice.limit(slice.position() + first);
        for (int i = 0; i < count; i++) {
            skipWhitespace(slice);
            index[i][0] = (int) readInteger(slice);
            skipWhitespace(slice);
            index[i][1] = (int) readInteger(slice);
        }
        return index;
    }

    // ========================================================================
    // Cross-reference sections
    // ========================================================================

    /**
     * Reads a classic xref table, leaving the position at the trailer
     * keyword.
     */
    private void readXRefTable(long offset, CrossReferenceSection section) throws IOException {
        seek(offset);
        skipWhitespace();
        if (!skipKeyword(XREF)) {
            throw new PDFParseException("Expected 'xref'", offset);
        }
        skipWhitespace();
        while (true) {
            int b = peek();
            if (b == 't' || b == -1) {
                break;
            }
            if (!isDigit(b)) {
                throw new PDFParseException("Expected subsection or trailer", getPosition());
            }
            int startObject = (int) readLong();
            skipWhitespace();
            int count = (int) readLong();
            skipWhitespace();
            for (int i = 0; i < count; i++) {
                int objectNumber = startObject + i;
                long field = readLong();
                skipWhitespace();
                int generation = (int) readLong();
                skipWhitespace();
                int type = readByte();
                skipWhitespace();
                if (type != 'n' && type != 'f') {
                    throw new PDFParseException("Invalid xref entry type: " + (char) type, getPosition());
                }
                if (section.contains(objectNumber)) {
                    continue;
                }
                if (type == 'f') {
                    section.addFreeEntry(objectNumber, generation, (int) field);
                } else if (objectNumber == 0 || field == 0L) {
                    // An in-use entry cannot point at the file header
                    section.addFreeEntry(objectNumber, generation, 0);
                } else {
                    section.addOffsetEntry(objectNumber, generation, field);
                }
            }
        }
    }

    private CrossReferenceSection readXRefStream(long offset) throws IOException {
        IndirectObject obj = parseObjectAt(offset);
        Map<Name, Object> dict = obj.getDictionary();
        if (!obj.isStream() || !obj.isType(Name.XREF)) {
            throw new PDFParseException("Not a cross-reference stream", offset);
        }
        if (codec == null) {
            throw new IllegalStateException("No stream codec to decode cross-reference stream");
        }
        ByteBuffer data = ByteBuffer.wrap(codec.decode(obj.getStream(), dict));

        Object wValue = dict.get(Name.W);
        if (!(wValue instanceof List) || ((List<?>) wValue).size() != 3) {
            throw new PDFParseException("Cross-reference stream missing or invalid W array", offset);
        }
        List<?> wArray = (List<?>) wValue;
        int[] w = new int[3];
        for (int i = 0; i < 3; i++) {
            Object width = wArray.get(i);
            if (!(width instanceof Integer) || (Integer) width < 0 || (Integer) width > 8) {
                throw new PDFParseException("Invalid field width in W array: " + width, offset);
            }
            w[i] = (Integer) width;
        }
        int entrySize = w[0] + w[1] + w[2];
        if (entrySize == 0) {
            throw new PDFParseException("Cross-reference stream has empty entries", offset);
        }

        List<Integer> index = new ArrayList<>();
        Object indexValue = dict.get(Name.INDEX);
        if (indexValue instanceof List) {
            for (Object value : (List<?>) indexValue) {
                if (!(value instanceof Integer)) {
                    throw new PDFParseException("Invalid Index array in cross-reference stream", offset);
                }
                index.add((Integer) value);
            }
            if (index.size() % 2 != 0) {
                throw new PDFParseException("Odd-length Index array in cross-reference stream", offset);
            }
        } else {
            Object size = dict.get(Name.SIZE);
            if (!(size instanceof Integer)) {
                throw new PDFParseException("Cross-reference stream missing Size", offset);
            }
            index.add(0);
            index.add((Integer) size);
        }

        CrossReferenceSection section = new CrossReferenceSection();
        for (int i = 0; i < index.size(); i += 2) {
            int startObject = index.get(i);
            int count = index.get(i + 1);
            for (int j = 0; j < count; j++) {
                if (data.remaining() < entrySize) {
                    throw new PDFParseException("Cross-reference stream truncated", offset);
                }
                int objectNumber = startObject + j;
                int type = (w[0] > 0) ? (int) readField(data, w[0]) : 1;
                long field2 = readField(data, w[1]);
                long field3 = readField(data, w[2]);
                if (section.contains(objectNumber)) {
                    continue;
                }
                switch (type) {
                    case 0:
                        section.addFreeEntry(objectNumber, (int) field3, (int) field2);
                        break;
                    case 1:
                        section.addOffsetEntry(objectNumber, (int) field3, field2);
                        break;
                    case 2:
                        section.addContainerEntry(objectNumber, (int) field2, (int) field3);
                        break;
                    default:
                        // Unknown entry types are references to the null object
                        break;
                }
            }
        }
        int number = obj.getId().getObjectNumber();
        if (!section.contains(number)) {
            section.addOffsetEntry(number, obj.getId().getGenerationNumber(), offset);
        }
        return section;
    }

    /**
     * Reads a big-endian unsigned field of the given byte width.
     */
    private static long readField(ByteBuffer buf, int width) {
        long value = 0L;
        for (int i = 0; i < width; i++) {
            value = (value << 8) | (buf.get() & 0xFF);
        }
        return value;
    }

    // ========================================================================
    // Objects and values
    // ========================================================================

    private ObjectId readObjectHeader() throws IOException {
        long start = getPosition();
        int number = (int) readLong();
        skipWhitespace();
        int generation = (int) readLong();
        skipWhitespace();
        if (!skipKeyword(OBJ)) {
            throw new PDFParseException("Expected 'obj'", getPosition());
        }
        if (number < 0 || generation < 0) {
            throw new PDFParseException("Invalid object header", start);
        }
        return new ObjectId(number, generation);
    }

    private byte[] readStreamData(Map<Name, Object> dict) throws IOException {
        int eol = readByte();
        if (eol == '\r') {
            if (peek() == '\n') {
                readByte();
            }
        } else if (eol != '\n') {
            seek(getPosition() - 1);
        }
        long start = getPosition();
        Object length = dict.get(Name.LENGTH);
        if (length instanceof Integer) {
            int len = (Integer) length;
            if (len >= 0 && start + len <= channel.size()) {
                byte[] data = readBytes(len);
                skipWhitespace();
                if (skipKeyword(ENDSTREAM)) {
                    return data;
                }
            }
            seek(start);
        }
        return scanStreamData(start);
    }

    /**
     * Reads stream data up to the next endstream keyword, without the end
     * of line marker that precedes it.
     */
    private byte[] scanStreamData(long start) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        int matched = 0;
        while (matched < ENDSTREAM.length) {
            int b = readByte();
            if (b == -1) {
                throw new PDFParseException("Unterminated stream", start);
            }
            out.write(b);
            if (b == ENDSTREAM[matched]) {
                matched++;
            } else {
                matched = (b == ENDSTREAM[0]) ? 1 : 0;
            }
        }
        byte[] bytes = out.toByteArray();
        int end = bytes.length - ENDSTREAM.length;
        if (end > 0 && bytes[end - 1] == '\n') {
            end--;
        }
        if (end > 0 && bytes[end - 1] == '\r') {
            end--;
        }
        byte[] data = new byte[end];
        System.arraycopy(bytes, 0, data, 0, end);
        return data;
    }

    /**
     * Reads the value at the current position.
     */
    private Object readValue() throws IOException {
        skipWhitespace();
        int b = peek();
        switch (b) {
            case '/':
                return readName();
            case '(':
                return readLiteralString();
            case '<':
                if (peekAt(1) == '<') {
                    return readDictionary();
                }
                return readHexString();
            case '[':
                return readArray();
            case 't':
                expectKeyword(TRUE);
                return Boolean.TRUE;
            case 'f':
                expectKeyword(FALSE);
                return Boolean.FALSE;
            case 'n':
                expectKeyword(NULL);
                return null;
            case -1:
                throw new PDFParseException("Unexpected end of data", getPosition());
            default:
                if (isDigit(b) || b == '+' || b == '-' || b == '.') {
                    return readNumberOrReference();
                }
                throw new PDFParseException("Unexpected character: " + (char) b, getPosition());
        }
    }

    private void expectKeyword(byte[] keyword) throws IOException {
        long start = getPosition();
        if (!skipKeyword(keyword)) {
            throw new PDFParseException("Expected '" + new String(keyword, StandardCharsets.US_ASCII) + "'", start);
        }
    }

    private Name readName() throws IOException {
        if (readByte() != '/') {
            throw new PDFParseException("Expected '/'", getPosition());
        }
        StringBuilder sb = new StringBuilder();
        while (true) {
            int b = peek();
            if (isWhitespace(b) || isDelimiter(b) || b == -1) {
                break;
            }
            readByte();
            if (b == '#') {
                int h1 = readByte();
                int h2 = readByte();
                sb.append((char) ((hexValue(h1) << 4) | hexValue(h2)));
            } else {
                sb.append((char) b);
            }
        }
        return Name.of(sb.toString());
    }

    private String readLiteralString() throws IOException {
        if (readByte() != '(') {
            throw new PDFParseException("Expected '('", getPosition());
        }
        StringBuilder sb = new StringBuilder();
        int parenDepth = 1;
        while (parenDepth > 0) {
            int b = readByte();
            if (b == -1) {
                throw new PDFParseException("Unterminated string", getPosition());
            }
            if (b == '(') {
                parenDepth++;
                sb.append((char) b);
            } else if (b == ')') {
                parenDepth--;
                if (parenDepth > 0) {
                    sb.append((char) b);
                }
            } else if (b == '\\') {
                int escaped = readByte();
                switch (escaped) {
                    case 'n': sb.append('\n'); break;
                    case 'r': sb.append('\r'); break;
                    case 't': sb.append('\t'); break;
                    case 'b': sb.append('\b'); break;
                    case 'f': sb.append('\f'); break;
                    case '(': sb.append('('); break;
                    case ')': sb.append(')'); break;
                    case '\\': sb.append('\\'); break;
                    case '\r':
                        if (peek() == '\n') {
                            readByte();
                        }
                        break;
                    case '\n':
                        break;
                    case -1:
                        throw new PDFParseException("Unterminated string", getPosition());
                    default:
                        if (escaped >= '0' && escaped <= '7') {
                            int octal = escaped - '0';
                            for (int i = 0; i < 2; i++) {
                                int next = peek();
                                if (next >= '0' && next <= '7') {
                                    readByte();
                                    octal = (octal << 3) | (next - '0');
                                } else {
                                    break;
                                }
                            }
                            sb.append((char) (octal & 0xFF));
                        } else {
                            sb.append((char) escaped);
                        }
                }
            } else {
                sb.append((char) b);
            }
        }
        return sb.toString();
    }

    private String readHexString() throws IOException {
        if (readByte() != '<') {
            throw new PDFParseException("Expected '<'", getPosition());
        }
        StringBuilder sb = new StringBuilder();
        int pendingNibble = -1;
        while (true) {
            int b = readByte();
            if (b == '>') {
                break;
            }
            if (b == -1) {
                throw new PDFParseException("Unterminated hex string", getPosition());
            }
            if (isWhitespace(b)) {
                continue;
            }
            int nibble = hexValue(b);
            if (pendingNibble < 0) {
                pendingNibble = nibble;
            } else {
                sb.append((char) ((pendingNibble << 4) | nibble));
                pendingNibble = -1;
            }
        }
        if (pendingNibble >= 0) {
            sb.append((char) (pendingNibble << 4));
        }
        return sb.toString();
    }

    private Map<Name, Object> readDictionary() throws IOException {
        if (readByte() != '<' || readByte() != '<') {
            throw new PDFParseException("Expected '<<'", getPosition());
        }
        Map<Name, Object> dict = new LinkedHashMap<>();
        skipWhitespace();
        while (true) {
            int b = peek();
            if (b == '>') {
                readByte();
                if (readByte() != '>') {
                    throw new PDFParseException("Expected '>>'", getPosition());
                }
                break;
            }
            if (b != '/') {
                throw new PDFParseException("Expected dictionary key", getPosition());
            }
            Name key = readName();
            Object value = readValue();
            if (value != null) {
                // A null entry is the same as an absent one
                dict.put(key, value);
            }
            skipWhitespace();
        }
        return dict;
    }

    private List<Object> readArray() throws IOException {
        if (readByte() != '[') {
            throw new PDFParseException("Expected '['", getPosition());
        }
        List<Object> array = new ArrayList<>();
        skipWhitespace();
        while (true) {
            int b = peek();
            if (b == ']') {
                readByte();
                break;
            }
            if (b == -1) {
                throw new PDFParseException("Unterminated array", getPosition());
            }
            array.add(readValue());
            skipWhitespace();
        }
        return array;
    }

    private Object readNumberOrReference() throws IOException {
        Number num1 = readNumber();
        if (!(num1 instanceof Integer) || num1.intValue() < 0) {
            return num1;
        }
        long savedPos = getPosition();
        skipWhitespace();
        // Check if this might be an indirect reference (objNum genNum R)
        if (isDigit(peek())) {
            Number num2 = readNumber();
            skipWhitespace();
            if (num2 instanceof Integer && peek() == 'R') {
                readByte();
                return new ObjectId(num1.intValue(), num2.intValue());
            }
        }
        seek(savedPos);
        return num1;
    }

    // ========================================================================
    // Low-level I/O helpers
    // ========================================================================

    private void seek(long position) throws IOException {
        channel.position(position);
        buffer.clear();
        int count = channel.read(buffer);
        if (count < 0) {
            buffer.limit(0);
        } else {
            buffer.flip();
        }
        bufferOffset = position;
    }

    private long getPosition() {
        return bufferOffset + buffer.position();
    }

    private int readByte() throws IOException {
        if (!buffer.hasRemaining()) {
            refillBuffer();
            if (!buffer.hasRemaining()) {
                return -1;
            }
        }
        return buffer.get() & 0xFF;
    }

    private int peek() throws IOException {
        if (!buffer.hasRemaining()) {
            refillBuffer();
            if (!buffer.hasRemaining()) {
                return -1;
            }
        }
        return buffer.get(buffer.position()) & 0xFF;
    }

    /**
     * Peeks at a byte at a relative offset.
     */
    private int peekAt(int offset) throws IOException {
        if (buffer.position() + offset >= buffer.limit()) {
            seek(getPosition());
            if (buffer.position() + offset >= buffer.limit()) {
                return -1;
            }
        }
        return buffer.get(buffer.position() + offset) & 0xFF;
    }

    private void refillBuffer() throws IOException {
        bufferOffset += buffer.position();
        buffer.clear();
        channel.position(bufferOffset);
        int count = channel.read(buffer);
        if (count < 0) {
            buffer.limit(0);
        } else {
            buffer.flip();
        }
    }

    private void skipWhitespace() throws IOException {
        while (true) {
            int b = peek();
            if (b == '%') {
                skipComment();
            } else if (b != -1 && isWhitespace(b)) {
                readByte();
            } else {
                break;
            }
        }
    }

    private void skipComment() throws IOException {
        while (true) {
            int b = readByte();
            if (b == -1 || b == '\r' || b == '\n') {
                break;
            }
        }
    }

    private boolean skipKeyword(byte[] keyword) throws IOException {
        for (byte b : keyword) {
            if (readByte() != (b & 0xFF)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Reads a non-negative or signed integer, which must have at least one
     * digit.
     */
    private long readLong() throws IOException {
        long start = getPosition();
        long value = 0;
        boolean negative = false;
        int b = peek();
        if (b == '-') {
            negative = true;
            readByte();
        } else if (b == '+') {
            readByte();
        }
        int digits = 0;
        while (isDigit(b = peek())) {
            value = value * 10 + (b - '0');
            readByte();
            digits++;
        }
        if (digits == 0) {
            throw new PDFParseException("Expected integer", start);
        }
        return negative ? -value : value;
    }

    private Number readNumber() throws IOException {
        long start = getPosition();
        StringBuilder sb = new StringBuilder();
        boolean isReal = false;
        int b = peek();
        if (b == '+' || b == '-') {
            sb.append((char) readByte());
        }
        while (true) {
            b = peek();
            if (isDigit(b)) {
                sb.append((char) readByte());
            } else if (b == '.' && !isReal) {
                isReal = true;
                sb.append((char) readByte());
            } else {
                break;
            }
        }
        String str = sb.toString();
        try {
            if (isReal) {
                return Double.parseDouble(str);
            }
            long value = Long.parseLong(str);
            if (value >= Integer.MIN_VALUE && value <= Integer.MAX_VALUE) {
                return (int) value;
            }
            return value;
        } catch (NumberFormatException e) {
            throw new PDFParseException("Invalid number: " + str, start);
        }
    }

    private byte[] readBytes(int length) throws IOException {
        byte[] result = new byte[length];
        int offset = 0;
        while (offset < length) {
            if (!buffer.hasRemaining()) {
                refillBuffer();
                if (!buffer.hasRemaining()) {
                    throw new PDFParseException("Unexpected end of data", getPosition());
                }
            }
            int toRead = Math.min(buffer.remaining(), length - offset);
            buffer.get(result, offset, toRead);
            offset += toRead;
        }
        return result;
    }

    private static boolean matches(byte[] buf, int pos, byte[] sequence) {
        if (pos + sequence.length > buf.length) {
            return false;
        }
        for (int i = 0; i < sequence.length; i++) {
            if (buf[pos + i] != sequence[i]) {
                return false;
            }
        }
        return true;
    }

    private static boolean isDigit(int b) {
        return b >= '0' && b <= '9';
    }

    private static boolean isWhitespace(int b) {
        return b == 0 || b == 9 || b == 10 || b == 12 || b == 13 || b == 32;
    }

    private static boolean isDelimiter(int b) {
        return b == '(' || b == ')' || b == '<' || b == '>' ||
               b == '[' || b == ']' || b == '{' || b == '}' ||
               b == '/' || b == '%';
    }

    private int hexValue(int c) {
        int value = Character.digit(c, 16);
        if (c < 0 || value < 0) {
            throw new PDFParseException("Invalid hex character: " + (char) c, getPosition());
        }
        return value;
    }

    // ==================== Object stream index ====================

    private static void skipWhitespace(ByteBuffer buf) {
        while (buf.hasRemaining()) {
            byte b = buf.get(buf.position());
            if (b == '%') {
                while (buf.hasRemaining() && buf.get() != '\n') {
                    // skip comment
                }
            } else if (isWhitespace(b)) {
                buf.get();
            } else {
                return;
            }
        }
    }

    private static long readInteger(ByteBuffer buf) {
        long value = 0;
        int digits = 0;
        while (buf.hasRemaining() && isDigit(buf.get(buf.position()))) {
            value = value * 10 + (buf.get() - '0');
            digits++;
        }
        if (digits == 0) {
            throw new PDFParseException("Invalid object stream index", buf.position());
        }
        return value;
    }

}
