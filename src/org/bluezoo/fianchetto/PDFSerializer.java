/*
 * PDFSerializer.java
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
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Serializes values of the object model to PDF syntax.
 * <p>
 * References are written with the current identity of their target: an
 * {@link ObjectId} as is, an {@link IndirectObject} handle as "n g R". A
 * handle with object number 0 is a wrapped direct value and is written as
 * that value.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class PDFSerializer {

    private static final byte[] HEX = "0123456789ABCDEF".getBytes(StandardCharsets.US_ASCII);

    /**
     * Serializes a direct value.
     *
     * @param value the value
     * @return the value in PDF syntax
     * @throws IllegalArgumentException if the value is not part of the
     *         object model or contains itself
     */
    public byte[] serialize(Object value) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        Set<Object> active = Collections.newSetFromMap(new IdentityHashMap<>());
        write(value, out, active);
        return out.toByteArray();
    }

    /**
     * Serializes an indirect object, with its stream data if it has any.
     * <p>
     * The /Length entry of a stream dictionary is set to the length of the
     * stream data.
     *
     * @param obj the object
     * @return the object definition in PDF syntax
     */
    public byte[] serializeIndirect(IndirectObject obj) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        ObjectId id = obj.getId();
        writeAscii(out, id.getObjectNumber() + " " + id.getGenerationNumber() + " obj\n");
        byte[] stream = obj.getStream();
        if (stream != null) {
            obj.getDictionary().put(Name.LENGTH, stream.length);
        }
        byte[] value = serialize(obj.getValue());
        out.write(value, 0, value.length);
        if (stream != null) {
            writeAscii(out, "\nstream\n");
            out.write(stream, 0, stream.length);
            writeAscii(out, "\nendstream");
        }
        writeAscii(out, "\nendobj\n");
        return out.toByteArray();
    }

    private void write(Object value, ByteArrayOutputStream out, Set<Object> active) {
        if (value == null) {
            writeAscii(out, "null");
        } else if (value instanceof Boolean) {
            writeAscii(out, value.toString());
        } else if (value instanceof Integer || value instanceof Long) {
            writeAscii(out, value.toString());
        } else if (value instanceof Number) {
            writeAscii(out, formatReal(((Number) value).doubleValue()));
        } else if (value instanceof Name) {
            writeName((Name) value, out);
        } else if (value instanceof String) {
            writeString((String) value, out);
        } else if (value instanceof ObjectId) {
            writeAscii(out, value.toString());
        } else if (value instanceof IndirectObject) {
            IndirectObject obj = (IndirectObject) value;
            if (obj.getId().isDirect()) {
                write(obj.getValue(), out, active);
            } else {
                writeAscii(out, obj.getId().toString());
            }
        } else if (value instanceof List) {
            enter(value, active);
            out.write('[');
            Iterator<?> i = ((List<?>) value).iterator();
            while (i.hasNext()) {
                write(i.next(), out, active);
                if (i.hasNext()) {
                    out.write(' ');
                }
            }
            out.write(']');
            active.remove(value);
        } else if (value instanceof Map) {
            enter(value, active);
            writeAscii(out, "<<");
            boolean first = true;
            for (Map.Entry<?, ?> entry : ((Map<?, ?>) value).entrySet()) {
                if (entry.getValue() == null) {
                    continue;
                }
                if (!(entry.getKey() instanceof Name)) {
                    throw new IllegalArgumentException("Dictionary key is not a name: " + entry.getKey());
                }
                if (!first) {
                    out.write(' ');
                }
                first = false;
                writeName((Name) entry.getKey(), out);
                out.write(' ');
                write(entry.getValue(), out, active);
            }
            writeAscii(out, ">>");
            active.remove(value);
        } else {
            throw new IllegalArgumentException("Cannot serialize " + value.getClass().getName());
        }
    }

    private static void enter(Object composite, Set<Object> active) {
        if (!active.add(composite)) {
            throw new IllegalArgumentException("Direct value contains itself");
        }
    }

    static String formatReal(double d) {
        if (Double.isNaN(d) || Double.isInfinite(d)) {
            throw new IllegalArgumentException("Not a PDF number: " + d);
        }
        if (d == Math.rint(d) && Math.abs(d) < 1e15) {
            return Long.toString((long) d);
        }
        return BigDecimal.valueOf(d).stripTrailingZeros().toPlainString();
    }

    private static void writeName(Name name, ByteArrayOutputStream out) {
        out.write('/');
        String value = name.getValue();
        for (int i = 0; i < value.length(); i++) {
            int c = value.charAt(i) & 0xFF;
            if (c < 0x21 || c > 0x7E || c == '#' || isDelimiter(c)) {
                out.write('#');
                out.write(HEX[c >> 4]);
                out.write(HEX[c & 0x0F]);
            } else {
                out.write(c);
            }
        }
    }

    private static void writeString(String value, ByteArrayOutputStream out) {
        out.write('(');
        for (int i = 0; i < value.length(); i++) {
            int c = value.charAt(i) & 0xFF;
            switch (c) {
                case '(':
                case ')':
                case '\\':
                    out.write('\\');
                    out.write(c);
                    break;
                case '\r':
                    writeAscii(out, "\\r");
                    break;
                default:
                    if (c < 0x20 && c != '\n' && c != '\t') {
                        out.write('\\');
                        out.write('0' + ((c >> 6) & 7));
                        out.write('0' + ((c >> 3) & 7));
                        out.write('0' + (c & 7));
                    } else {
                        out.write(c);
                    }
            }
        }
        out.write(')');
    }

    private static boolean isDelimiter(int b) {
        return b == '(' || b == ')' || b == '<' || b == '>' ||
               b == '[' || b == ']' || b == '{' || b == '}' ||
               b == '/' || b == '%';
    }

    private static void writeAscii(ByteArrayOutputStream out, String s) {
        byte[] bytes = s.getBytes(StandardCharsets.ISO_8859_1);
        out.write(bytes, 0, bytes.length);
    }

}
