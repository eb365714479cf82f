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
 * Created on Mar 8, 2026
 */

package com.pologic.graph.backend;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import junit.framework.TestCase;

import com.pologic.graph.GraphException;
import com.pologic.graph.model.NodeId;
import com.pologic.graph.model.Predicate;
import com.pologic.graph.model.Triple;
import com.pologic.graph.model.TripleId;
import com.pologic.graph.model.Value;

/**
 * Tests of the {@link IStorageBackend} contract. Concrete subclasses supply
 * the backend and every backend must pass the same tests.
 * 
 * @version $Id$
 */
abstract public class AbstractBackendTestCase extends TestCase {

    public AbstractBackendTestCase() {
    }

    public AbstractBackendTestCase(String name) {
        super(name);
    }

    protected IStorageBackend backend;

    /**
     * Return a new, empty backend.
     */
    abstract protected IStorageBackend newBackend() throws Exception;

    public void setUp() throws Exception {

        backend = newBackend();

    }

    public void tearDown() throws Exception {

        if (backend != null && backend.isOpen())
            backend.close();

        backend = null;

    }

    protected static Triple[] sample() {

        return new Triple[] {
                Triple.link("alice", "knows", "bob"),
                Triple.of("alice", "age", Value.integer(30)),
                Triple.of("alice", "name", Value.string("Alice")),
                new Triple(NodeId.blank("b1"), new Predicate("weight"),
                        Value.floating(2.5d)),
                Triple.of("bob", "alive", Value.bool(true)), };

    }

    public void test_putGet() {

        for (Triple t : sample()) {

            final TripleId id = t.id();

            assertFalse(backend.exists(id));
            assertNull(backend.get(id));

            backend.put(id, t);

            assertTrue(backend.exists(id));
            assertEquals(t, backend.get(id));

        }

        assertEquals(sample().length, backend.count());
        assertTrue(backend.sizeBytes() > 0);

    }

    public void test_putTwiceIsNop() {

        final Triple t = Triple.link("alice", "knows", "bob");

        backend.put(t.id(), t);
        backend.put(t.id(), t);

        assertEquals(1, backend.count());

    }

    public void test_delete() {

        final Triple t = Triple.link("alice", "knows", "bob");

        backend.put(t.id(), t);

        assertTrue(backend.delete(t.id()));
        assertFalse(backend.exists(t.id()));
        assertNull(backend.get(t.id()));
        assertFalse(backend.delete(t.id()));
        assertEquals(0, backend.count());

        // may be stored again.
        backend.put(t.id(), t);
        assertEquals(t, backend.get(t.id()));

    }

    public void test_iterAll() {

        final Set<Triple> expected = new HashSet<Triple>();

        for (Triple t : sample()) {

            backend.put(t.id(), t);

            expected.add(t);

        }

        backend.delete(sample()[0].id());
        expected.remove(sample()[0]);

        final Set<Triple> actual = new HashSet<Triple>();

        final Iterator<Triple> itr = backend.iterAll();

        while (itr.hasNext()) {

            assertTrue(actual.add(itr.next()));

        }

        assertEquals(expected, actual);

    }

    /**
     * Several writers put, read back and delete their own triples at the
     * same time. Every operation must see its own writes and the final
     * state must be the union of what each writer left behind.
     */
    public void test_concurrentPutGetDelete() throws Exception {

        final int nthreads = 4;

        final int ntriples = 50;

        final ExecutorService service = Executors.newFixedThreadPool(nthreads);

        try {

            final List<Future<Void>> futures = new ArrayList<Future<Void>>();

            for (int i = 0; i < nthreads; i++) {

                final String subject = "writer" + i;

                futures.add(service.submit(new Callable<Void>() {

                    public Void call() throws Exception {

                        for (int j = 0; j < ntriples; j++) {

                            final Triple t = Triple.of(subject, "seq",
                                    Value.integer(j));

                            backend.put(t.id(), t);

                            assertEquals(t, backend.get(t.id()));

                            if (j % 2 == 0)
                                assertTrue(backend.delete(t.id()));

                        }

                        return null;

                    }

                }));

            }

            for (Future<Void> f : futures) {

                // rethrows any assertion failure from the writer.
                f.get(60, TimeUnit.SECONDS);

            }

        } finally {

            service.shutdownNow();

        }

        assertEquals(nthreads * ntriples / 2, backend.count());

        for (int i = 0; i < nthreads; i++) {

            for (int j = 0; j < ntriples; j++) {

                final Triple t = Triple.of("writer" + i, "seq",
                        Value.integer(j));

                assertEquals(j % 2 != 0, backend.exists(t.id()));

            }

        }

    }

    public void test_closed() {

        backend.flush();

        backend.close();

        assertFalse(backend.isOpen());

        try {
            backend.get(Triple.link("a", "b", "c").id());
            fail("Expecting: " + GraphException.class);
        } catch (GraphException ex) {
            assertEquals(GraphException.Kind.STORAGE, ex.getKind());
        }

    }

}
