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
 * Created on Mar 4, 2026
 */

package com.pologic.graph.backend;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

import com.pologic.graph.model.Triple;
import com.pologic.graph.model.TripleId;
import com.pologic.graph.model.TripleSerializer;

/**
 * A volatile backend holding the canonical encodings in a concurrent hash
 * map. Nothing survives {@link #close()}.
 * 
 * @version $Id$
 */
public class MemoryBackend extends AbstractStorageBackend {

    private final ConcurrentHashMap<TripleId, byte[]> records = new ConcurrentHashMap<TripleId, byte[]>();

    private final AtomicLong nbytes = new AtomicLong();

    public MemoryBackend() {

    }

    public BackendType getBackendType() {

        return BackendType.Memory;

    }

    public void put(final TripleId id, final Triple triple) {

        if (id == null || triple == null)
            throw new IllegalArgumentException();

        assertOpen();

        final byte[] b = TripleSerializer.encode(triple);

        if (records.putIfAbsent(id, b) == null) {

            nbytes.addAndGet(b.length);

        }

    }

    public Triple get(final TripleId id) {

        if (id == null)
            throw new IllegalArgumentException();

        assertOpen();

        final byte[] b = records.get(id);

        return b == null ? null : TripleSerializer.decode(b);

    }

    public boolean exists(final TripleId id) {

        if (id == null)
            throw new IllegalArgumentException();

        assertOpen();

        return records.containsKey(id);

    }

    public boolean delete(final TripleId id) {

        if (id == null)
            throw new IllegalArgumentException();

        assertOpen();

        final byte[] b = records.remove(id);

        if (b == null)
            return false;

        nbytes.addAndGet(-b.length);

        return true;

    }

    public Iterator<Triple> iterAll() {

        assertOpen();

        final List<Triple> a = new ArrayList<Triple>(records.size());

        for (byte[] b : records.values()) {

            a.add(TripleSerializer.decode(b));

        }

        return a.iterator();

    }

    public long count() {

        assertOpen();

        return records.size();

    }

    public long sizeBytes() {

        assertOpen();

        return nbytes.get();

    }

    public void flush() {

        assertOpen();

    }

    public void close() {

        if (markClosed()) {

            records.clear();

            nbytes.set(0L);

        }

    }

}
