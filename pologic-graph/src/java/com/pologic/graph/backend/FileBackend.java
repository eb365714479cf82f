/*

Copyright (C) SYSTAP, LLC 2006-2008.  All rights reserved.

Contact:
     SYSTAP, LLC
     4501 Tower Road
     Greensboro, NC 27410
     licenses@bigdata.com

This program is free software; you can redistribute it and/or modify
it under the terms of the GNU General Public License as published by
the Free Software Foundation; version 2 of the License.

This program is distributed in the hope that it will be useful,
but WITHOUT ANY WARRANTY; without even the implied warranty of
MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
GNU General Public License for more details.

You should have received a copy of the GNU General Public License
along with this program; if not, write to the Free Software
Foundation, Inc., 59 Temple Place, Suite 330, Boston, MA  02111-1307  USA

*/
/*
 * Created on Mar 5, 2026
 */

package com.pologic.graph.backend;

import java.io.BufferedInputStream;
import java.io.DataInputStream;
import java.io.EOFException;
import java.io.File;
import java.io.IOException;
import java.io.RandomAccessFile;
import java.nio.ByteBuffer;
import java.nio.channels.Channels;
import java.nio.channels.FileChannel;
import java.nio.channels.OverlappingFileLockException;
import java.nio.file.Files;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

import org.apache.log4j.Logger;

import com.pologic.graph.GraphException;
import com.pologic.graph.model.Triple;
import com.pologic.graph.model.TripleId;
import com.pologic.graph.model.TripleSerializer;

/**
 * A persistent backend writing an append-only journal file. Each record is
 * 
 * <pre>
 * op:byte id:byte[32] len:int payload:byte[len]
 * </pre>
 * 
 * where <i>op</i> is {@link #OP_PUT} (the payload is the canonical triple
 * encoding) or {@link #OP_DELETE} (a tombstone with an empty payload). The
 * journal is replayed when the file is opened to rebuild the map from
 * {@link TripleId} to the offset and length of the live payload. A record
 * which was only partially written when the process died is discarded and
 * the file is truncated to the last complete record.
 * <p>
 * The file is opened for writing and an exclusive lock is held until
 * {@link #close()}.
 * 
 * @version $Id$
 */
public class FileBackend extends AbstractStorageBackend {

    private static final transient Logger log = Logger
            .getLogger(FileBackend.class);

    public static final byte OP_PUT = 'P';

    public static final byte OP_DELETE = 'D';

    /**
     * The size of the record header (op, id and length).
     */
    static final int HEADER_SIZE = 1 + TripleId.LENGTH + 4;

    private final File file;

    private final boolean forceOnFlush;

    private RandomAccessFile raf;

    /**
     * The offset and byte length of the payload of each live record.
     */
    private final Map<TripleId, long[]> addrs = new HashMap<TripleId, long[]>();

    /**
     * Open (or create) the journal.
     * 
     * @param file
     *            The journal file.
     * @param forceOnFlush
     *            When <code>true</code> {@link #flush()} forces the file
     *            contents and metadata to the disk.
     * 
     * @throws GraphException
     *             if the file can not be opened, locked or replayed.
     */
    public FileBackend(final File file, final boolean forceOnFlush) {

        if (file == null)
            throw new IllegalArgumentException("file is null");

        this.file = file;

        this.forceOnFlush = forceOnFlush;

        open();

        if (log.isInfoEnabled())
            log.info("Opened journal: file=" + file + ", records="
                    + addrs.size() + ", length=" + file.length());

    }

    public FileBackend(final File file) {

        this(file, true);

    }

    public BackendType getBackendType() {

        return BackendType.File;

    }

    public File getFile() {

        return file;

    }

    private void open() {

        try {

            raf = new RandomAccessFile(file, "rw");

        } catch (IOException ex) {

            throw new GraphException(GraphException.Kind.BACKEND_UNAVAILABLE,
                    "Could not open file: " + file.getAbsoluteFile(), ex);

        }

        boolean locked = false;
        try {
            locked = raf.getChannel().tryLock() != null;
        } catch (OverlappingFileLockException ex) {
            // Already locked by this JVM.
            locked = false;
        } catch (IOException ex) {
            closeQuietly();
            throw new GraphException(GraphException.Kind.BACKEND_UNAVAILABLE,
                    "Could not lock file: " + file.getAbsoluteFile(), ex);
        }

        if (!locked) {

            closeQuietly();

            throw new GraphException(GraphException.Kind.BACKEND_UNAVAILABLE,
                    "Could not lock file: " + file.getAbsoluteFile());

        }

        try {

            replay();

        } catch (IOException ex) {

            closeQuietly();

            throw new GraphException(GraphException.Kind.STORAGE,
                    "Could not read journal: " + file.getAbsoluteFile(), ex);

        } catch (GraphException ex) {

            closeQuietly();

            throw ex;

        }

    }

    /**
     * Used on the error paths of {@link #open()} where the original
     * exception is the one reported.
     */
    private void closeQuietly() {

        try {
            raf.close();
        } catch (IOException ex) {
            log.warn("Could not close: " + file, ex);
        }

    }

    /**
     * Read the journal from the start, rebuilding {@link #addrs}.
     */
    private void replay() throws IOException {

        addrs.clear();

        final FileChannel channel = raf.getChannel();

        final long length = channel.size();

        channel.position(0L);

        final DataInputStream in = new DataInputStream(new BufferedInputStream(
                Channels.newInputStream(channel)));

        long offset = 0L;

        while (offset < length) {

            final byte op;
            final byte[] id = new byte[TripleId.LENGTH];
            final int len;

            try {

                op = in.readByte();

                in.readFully(id);

                len = in.readInt();

                if (len < 0 || offset + HEADER_SIZE + len > length)
                    throw new EOFException();

                if (in.skipBytes(len) != len)
                    throw new EOFException();

            } catch (EOFException ex) {

                log.warn("Discarding torn record: file=" + file + ", offset="
                        + offset + ", length=" + length);

                raf.setLength(offset);

                break;

            }

            final TripleId tid = TripleId.wrap(id);

            switch (op) {
            case OP_PUT:
                addrs.put(tid, new long[] { offset + HEADER_SIZE, len });
                break;
            case OP_DELETE:
                addrs.remove(tid);
                break;
            default:
                throw new GraphException(GraphException.Kind.STORAGE,
                        "Corrupt journal: file=" + file + ", offset=" + offset
                                + ", op=" + op);
            }

            offset += HEADER_SIZE + len;

        }

    }

    /**
     * Append a record at the end of the file.
     * 
     * @return The offset of the payload.
     */
    private long append(final byte op, final TripleId id, final byte[] payload)
            throws IOException {

        final FileChannel channel = raf.getChannel();

        final long pos = channel.size();

        final ByteBuffer buf = ByteBuffer.allocate(HEADER_SIZE
                + payload.length);

        buf.put(op);
        buf.put(id.toByteArray());
        buf.putInt(payload.length);
        buf.put(payload);

        buf.flip();

        long p = pos;

        while (buf.hasRemaining()) {

            p += channel.write(buf, p);

        }

        return pos + HEADER_SIZE;

    }

    private byte[] read(final long offset, final int len) throws IOException {

        final ByteBuffer buf = ByteBuffer.allocate(len);

        final FileChannel channel = raf.getChannel();

        while (buf.hasRemaining()) {

            final int n = channel.read(buf, offset + buf.position());

            if (n < 0)
                throw new EOFException("offset=" + offset + ", len=" + len);

        }

        return buf.array();

    }

    synchronized public void put(final TripleId id, final Triple triple) {

        if (id == null || triple == null)
            throw new IllegalArgumentException();

        assertOpen();

        if (addrs.containsKey(id))
            return;

        final byte[] b = TripleSerializer.encode(triple);

        try {

            final long offset = append(OP_PUT, id, b);

            addrs.put(id, new long[] { offset, b.length });

        } catch (IOException ex) {

            throw new GraphException(GraphException.Kind.STORAGE,
                    "Could not write: id=" + id, ex);

        }

    }

    synchronized public Triple get(final TripleId id) {

        if (id == null)
            throw new IllegalArgumentException();

        assertOpen();

        final long[] addr = addrs.get(id);

        if (addr == null)
            return null;

        try {

            return TripleSerializer.decode(read(addr[0], (int) addr[1]));

        } catch (IOException ex) {

            throw new GraphException(GraphException.Kind.STORAGE,
                    "Could not read: id=" + id, ex);

        }

    }

    synchronized public boolean exists(final TripleId id) {

        if (id == null)
            throw new IllegalArgumentException();

        assertOpen();

        return addrs.containsKey(id);

    }

    synchronized public boolean delete(final TripleId id) {

        if (id == null)
            throw new IllegalArgumentException();

        assertOpen();

        if (!addrs.containsKey(id))
            return false;

        try {

            append(OP_DELETE, id, new byte[0]);

        } catch (IOException ex) {

            throw new GraphException(GraphException.Kind.STORAGE,
                    "Could not write: id=" + id, ex);

        }

        addrs.remove(id);

        return true;

    }

    synchronized public Iterator<Triple> iterAll() {

        assertOpen();

        final List<Triple> a = new ArrayList<Triple>(addrs.size());

        try {

            for (long[] addr : addrs.values()) {

                a.add(TripleSerializer.decode(read(addr[0], (int) addr[1])));

            }

        } catch (IOException ex) {

            throw new GraphException(GraphException.Kind.STORAGE,
                    "Could not read: " + file, ex);

        }

        return a.iterator();

    }

    synchronized public long count() {

        assertOpen();

        return addrs.size();

    }

    synchronized public long sizeBytes() {

        assertOpen();

        try {

            return raf.length();

        } catch (IOException ex) {

            throw new GraphException(GraphException.Kind.STORAGE,
                    file.toString(), ex);

        }

    }

    synchronized public void flush() {

        assertOpen();

        if (!forceOnFlush)
            return;

        try {

            raf.getChannel().force(true);

        } catch (IOException ex) {

            throw new GraphException(GraphException.Kind.STORAGE,
                    "Could not force: " + file, ex);

        }

    }

    /**
     * Rewrite the journal so that it holds only the live records. The new
     * journal is written to a sibling file which then replaces the original.
     * 
     * @return The number of bytes reclaimed.
     */
    synchronized public long compact() {

        assertOpen();

        final File tmp = new File(file.getAbsoluteFile().getParentFile(),
                file.getName() + ".compact");

        final long before;

        try {

            before = raf.length();

            final RandomAccessFile out = new RandomAccessFile(tmp, "rw");

            try {

                out.setLength(0L);

                for (Map.Entry<TripleId, long[]> e : addrs.entrySet()) {

                    final long[] addr = e.getValue();

                    final byte[] b = read(addr[0], (int) addr[1]);

                    out.writeByte(OP_PUT);
                    out.write(e.getKey().toByteArray());
                    out.writeInt(b.length);
                    out.write(b);

                }

                out.getChannel().force(true);

            } finally {

                out.close();

            }

            raf.close();

            Files.move(tmp.toPath(), file.toPath(),
                    StandardCopyOption.REPLACE_EXISTING,
                    StandardCopyOption.ATOMIC_MOVE);

        } catch (IOException ex) {

            throw new GraphException(GraphException.Kind.STORAGE,
                    "Could not compact: " + file, ex);

        }

        open();

        final long reclaimed = before - file.length();

        if (log.isInfoEnabled())
            log.info("Compacted journal: file=" + file + ", reclaimed="
                    + reclaimed);

        return reclaimed;

    }

    synchronized public void close() {

        if (!isOpen())
            return;

        try {

            if (forceOnFlush)
                raf.getChannel().force(true);

            raf.close();

        } catch (IOException ex) {

            throw new GraphException(GraphException.Kind.STORAGE,
                    "Could not close: " + file, ex);

        } finally {

            markClosed();

        }

        if (log.isInfoEnabled())
            log.info("Closed journal: file=" + file);

    }

}
