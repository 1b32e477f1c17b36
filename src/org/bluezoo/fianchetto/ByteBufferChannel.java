/*
 * ByteBufferChannel.java
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
import java.nio.ByteBuffer;
import java.nio.channels.ClosedChannelException;
import java.nio.channels.NonWritableChannelException;
import java.nio.channels.SeekableByteChannel;
import java.util.Arrays;

/**
 * {@link SeekableByteChannel} over bytes held in memory.
 * <p>
 * A channel created from existing data is read-only; it lets the tokenizer
 * read decoded object stream content or a document held in memory with the
 * same channel-based code as a file. A channel created with the no-argument
 * constructor is writable and grows as data is written, so a document can
 * be written to memory and read back.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class ByteBufferChannel implements SeekableByteChannel {

    private byte[] data;
    private int size;
    private int position;
    private final boolean writable;
    private boolean open = true;

    /**
     * Creates an empty writable channel.
     */
    public ByteBufferChannel() {
        this.data = new byte[4096];
        this.writable = true;
    }

    /**
     * Creates a read-only channel over the remaining bytes of a buffer.
     * The buffer's position and limit are not modified.
     *
     * @param source the buffer to read from
     */
    public ByteBufferChannel(ByteBuffer source) {
        ByteBuffer dup = source.duplicate();
        this.data = new byte[dup.remaining()];
        dup.get(data);
        this.size = data.length;
        this.writable = false;
    }

    /**
     * Creates a read-only channel over a byte array.
     *
     * @param source the bytes to read
     */
    public ByteBufferChannel(byte[] source) {
        this.data = source;
        this.size = source.length;
        this.writable = false;
    }

    private void checkOpen() throws IOException {
        if (!open) {
            throw new ClosedChannelException();
        }
    }

    @Override
    public int read(ByteBuffer dst) throws IOException {
        checkOpen();
        if (position >= size) {
            return -1;
        }
        int n = Math.min(size - position, dst.remaining());
        dst.put(data, position, n);
        position += n;
        return n;
    }

    @Override
    public int write(ByteBuffer src) throws IOException {
        checkOpen();
        if (!writable) {
            throw new NonWritableChannelException();
        }
        int n = src.remaining();
        int end = position + n;
        if (end > data.length) {
            data = Arrays.copyOf(data, Math.max(end, data.length * 2));
        }
        src.get(data, position, n);
        position = end;
        size = Math.max(size, end);
        return n;
    }

    @Override
    public long position() throws IOException {
        checkOpen();
        return position;
    }

    @Override
    public SeekableByteChannel position(long newPosition) throws IOException {
        checkOpen();
        if (newPosition < 0 || newPosition > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("Position out of range: " + newPosition);
        }
        position = (int) newPosition;
        return this;
    }

    @Override
    public long size() throws IOException {
        checkOpen();
        return size;
    }

    @Override
    public SeekableByteChannel truncate(long newSize) throws IOException {
        checkOpen();
        if (!writable) {
            throw new NonWritableChannelException();
        }
        if (newSize < size) {
            size = (int) newSize;
        }
        if (position > size) {
            position = size;
        }
        return this;
    }

    /**
     * Returns a copy of the bytes held by this channel.
     *
     * @return the channel content
     */
    public byte[] toByteArray() {
        return Arrays.copyOf(data, size);
    }

    @Override
    public boolean isOpen() {
        return open;
    }

    @Override
    public void close() throws IOException {
        open = false;
    }

}
