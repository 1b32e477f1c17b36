/*
 * DefaultStreamCodec.java
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
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.zip.DataFormatException;
import java.util.zip.Deflater;
import java.util.zip.Inflater;

/**
 * Stream codec supporting FlateDecode and ASCIIHexDecode.
 * <p>
 * FlateDecode data is decompressed with {@link Inflater}; TIFF predictor 2
 * and the PNG predictors 10-15 given in /DecodeParms are undone after
 * decompression. Only FlateDecode is available for encoding.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class DefaultStreamCodec implements StreamCodec {

    private static final int BUFFER_SIZE = 8192;

    private static final Name FL = Name.of("Fl");
    private static final Name ASCII_HEX_DECODE = Name.of("ASCIIHexDecode");
    private static final Name AHX = Name.of("AHx");
    private static final Name DP = Name.of("DP");
    private static final Name PREDICTOR = Name.of("Predictor");
    private static final Name COLUMNS = Name.of("Columns");
    private static final Name COLORS = Name.of("Colors");
    private static final Name BITS_PER_COMPONENT = Name.of("BitsPerComponent");

    @Override
    public byte[] decode(byte[] data, Map<Name, Object> dictionary) {
        Object filterObj = dictionary != null ? dictionary.get(Name.FILTER) : null;
        if (filterObj == null) {
            return data;
        }
        Object paramsObj = dictionary.get(Name.DECODE_PARMS);
        if (paramsObj == null) {
            paramsObj = dictionary.get(DP);
        }
        List<Name> filters = new ArrayList<>();
        if (filterObj instanceof Name) {
            filters.add((Name) filterObj);
        } else if (filterObj instanceof List) {
            for (Object f : (List<?>) filterObj) {
                if (!(f instanceof Name)) {
                    throw new PDFParseException("Invalid filter: " + f);
                }
                filters.add((Name) f);
            }
        } else {
            throw new PDFParseException("Invalid /Filter entry: " + filterObj);
        }
        byte[] result = data;
        for (int i = 0; i < filters.size(); i++) {
            Name filter = filters.get(i);
            Map<Name, Object> params = extractParams(paramsObj, i);
            if (Name.FLATE_DECODE.equals(filter) || FL.equals(filter)) {
                result = inflate(result);
                result = applyPredictor(result, params);
            } else if (ASCII_HEX_DECODE.equals(filter) || AHX.equals(filter)) {
                result = decodeHex(result);
            } else {
                throw new PDFParseException("Unsupported filter: " + filter);
            }
        }
        return result;
    }

    @Override
    public byte[] encode(byte[] data, Name filter) {
        if (filter == null) {
            return data;
        }
        if (!Name.FLATE_DECODE.equals(filter)) {
            throw new IllegalArgumentException("Cannot encode with " + filter);
        }
        Deflater deflater = new Deflater(Deflater.BEST_COMPRESSION);
        try {
            deflater.setInput(data);
            deflater.finish();
            ByteArrayOutputStream out = new ByteArrayOutputStream(data.length / 2 + 16);
            byte[] buf = new byte[BUFFER_SIZE];
            while (!deflater.finished()) {
                int count = deflater.deflate(buf);
                out.write(buf, 0, count);
            }
            return out.toByteArray();
        } finally {
            deflater.end();
        }
    }

    @SuppressWarnings("unchecked")
    private static Map<Name, Object> extractParams(Object paramsObj, int index) {
        if (paramsObj instanceof Map) {
            return index == 0 ? (Map<Name, Object>) paramsObj : null;
        }
        if (paramsObj instanceof List) {
            List<Object> paramsList = (List<Object>) paramsObj;
            if (index < paramsList.size() && paramsList.get(index) instanceof Map) {
                return (Map<Name, Object>) paramsList.get(index);
            }
        }
        return null;
    }

    // ==================== FlateDecode ====================

    private static byte[] inflate(byte[] data) {
        Inflater inflater = new Inflater();
        try {
            inflater.setInput(data);
            ByteArrayOutputStream out = new ByteArrayOutputStream(data.length * 2 + 16);
            byte[] buf = new byte[BUFFER_SIZE];
            while (!inflater.finished()) {
                int count = inflater.inflate(buf);
                if (count == 0 && (inflater.needsInput() || inflater.needsDictionary())) {
                    // Truncated data: keep what could be decompressed
                    break;
                }
                out.write(buf, 0, count);
            }
            return out.toByteArray();
        } catch (DataFormatException e) {
            throw new PDFParseException("FlateDecode error: " + e.getMessage(), e);
        } finally {
            inflater.end();
        }
    }

    private static byte[] applyPredictor(byte[] data, Map<Name, Object> params) {
        if (params == null) {
            return data;
        }
        int predictor = intParam(params, PREDICTOR, 1);
        int columns = intParam(params, COLUMNS, 1);
        int colors = intParam(params, COLORS, 1);
        int bitsPerComponent = intParam(params, BITS_PER_COMPONENT, 8);
        int bytesPerPixel = Math.max(1, (colors * bitsPerComponent + 7) / 8);
        int rowBytes = (columns * colors * bitsPerComponent + 7) / 8;
        if (predictor == 2) {
            return applyTIFFPredictor(data, bytesPerPixel, rowBytes);
        }
        if (predictor >= 10 && predictor <= 15) {
            return applyPNGPredictor(data, bytesPerPixel, rowBytes);
        }
        return data;
    }

    private static int intParam(Map<Name, Object> params, Name key, int defaultValue) {
        Object value = params.get(key);
        return value instanceof Number ? ((Number) value).intValue() : defaultValue;
    }

    private static byte[] applyTIFFPredictor(byte[] input, int bytesPerPixel, int rowBytes) {
        if (rowBytes <= 0) {
            return input;
        }
        for (int row = 0; row < input.length / rowBytes; row++) {
            int rowStart = row * rowBytes;
            for (int i = bytesPerPixel; i < rowBytes; i++) {
                input[rowStart + i] = (byte) (input[rowStart + i] + input[rowStart + i - bytesPerPixel]);
            }
        }
        return input;
    }

    private static byte[] applyPNGPredictor(byte[] input, int bytesPerPixel, int rowBytes) {
        int fullRowBytes = rowBytes + 1;
        byte[] prevRow = new byte[rowBytes];
        ByteArrayOutputStream result = new ByteArrayOutputStream(input.length);
        int pos = 0;
        while (input.length - pos >= fullRowBytes) {
            int filterByte = input[pos++] & 0xFF;
            byte[] row = new byte[rowBytes];
            System.arraycopy(input, pos, row, 0, rowBytes);
            pos += rowBytes;
            switch (filterByte) {
                case 0: // None
                    break;
                case 1: // Sub
                    for (int i = bytesPerPixel; i < rowBytes; i++) {
                        row[i] = (byte) (row[i] + row[i - bytesPerPixel]);
                    }
                    break;
                case 2: // Up
                    for (int i = 0; i < rowBytes; i++) {
                        row[i] = (byte) (row[i] + prevRow[i]);
                    }
                    break;
                case 3: // Average
                    for (int i = 0; i < rowBytes; i++) {
                        int left = (i >= bytesPerPixel) ? (row[i - bytesPerPixel] & 0xFF) : 0;
                        int up = prevRow[i] & 0xFF;
                        row[i] = (byte) (row[i] + (left + up) / 2);
                    }
                    break;
                case 4: // Paeth
                    for (int i = 0; i < rowBytes; i++) {
                        int a = (i >= bytesPerPixel) ? (row[i - bytesPerPixel] & 0xFF) : 0;
                        int b = prevRow[i] & 0xFF;
                        int c = (i >= bytesPerPixel) ? (prevRow[i - bytesPerPixel] & 0xFF) : 0;
                        row[i] = (byte) (row[i] + paethPredictor(a, b, c));
                    }
                    break;
                default:
                    throw new PDFParseException("Invalid PNG predictor type: " + filterByte);
            }
            result.write(row, 0, rowBytes);
            prevRow = row;
        }
        return result.toByteArray();
    }

    private static int paethPredictor(int a, int b, int c) {
        int p = a + b - c;
        int pa = Math.abs(p - a);
        int pb = Math.abs(p - b);
        int pc = Math.abs(p - c);
        if (pa <= pb && pa <= pc) {
            return a;
        }
        if (pb <= pc) {
            return b;
        }
        return c;
    }

    // ==================== ASCIIHexDecode ====================

    private static byte[] decodeHex(byte[] data) {
        ByteArrayOutputStream out = new ByteArrayOutputStream(data.length / 2 + 1);
        int pendingNibble = -1;
        for (byte value : data) {
            int b = value & 0xFF;
            if (b == '>') {
                break;
            }
            if (b == 0 || b == 9 || b == 10 || b == 12 || b == 13 || b == 32) {
                continue;
            }
            int nibble = Character.digit(b, 16);
            if (nibble < 0) {
                throw new PDFParseException("Invalid character in ASCIIHexDecode data: " + (char) b);
            }
            if (pendingNibble < 0) {
                pendingNibble = nibble;
            } else {
                out.write((pendingNibble << 4) | nibble);
                pendingNibble = -1;
            }
        }
        if (pendingNibble >= 0) {
            out.write(pendingNibble << 4);
        }
        return out.toByteArray();
    }

}
