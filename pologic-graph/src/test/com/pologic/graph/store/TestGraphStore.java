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
 * Created on Mar 9, 2026
 */

package com.pologic.graph.store;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import com.pologic.graph.GraphException;
import com.pologic.graph.backend.MemoryBackend;
import com.pologic.graph.model.NodeId;
import com.pologic.graph.model.Predicate;
import com.pologic.graph.model.Triple;
import com.pologic.graph.model.TripleId;
import com.pologic.graph.model.TriplePattern;
import com.pologic.graph.model.Value;

/**
 * Test suite for {@link GraphStore}.
 * 
 * @version $Id$
 */
public class TestGraphStore extends AbstractGraphStoreTestCase {

    public TestGraphStore() {
    }

    public TestGraphStore(String name) {
        super(name);
    }

    static final NodeId alice = NodeId.named("alice");

    static final NodeId bob = NodeId.named("bob");

    static final NodeId carol = NodeId.named("carol");

    static final Predicate knows = new Predicate("knows");

    static final Predicate age = new Predicate("age");

    static final Predicate name = new Predicate("name");

    protected List<Triple> data() {

        return Arrays.asList(//
                new Triple(alice, knows, Value.node(bob)),//
                new Triple(bob, knows, Value.node(carol)),//
                new Triple(alice, age, Value.integer(30)),//
                new Triple(bob, age, Value.integer(30)),//
                new Triple(carol, age, Value.string("30")),//
                new Triple(alice, name, Value.string("Alice")),//
                new Triple(carol, knows, Value.node(alice))//
                );

    }

    public void test_insertIsIdempotent() {

        final Triple t = new Triple(alice, knows, Value.node(bob));

        final TripleId id1 = store.insert(t);
        final long n1 = store.count();
        final GraphStats s1 = store.stats();

        final TripleId id2 = store.insert(t);

        assertEquals(id1, id2);
        assertEquals(n1, store.count());
        assertEquals(s1.getSubjectCount(), store.stats().getSubjectCount());
        assertEquals(1, store.find(TriplePattern.subject(alice)).size());

        assertFalse(store.addIfAbsent(t));
        assertTrue(store.addIfAbsent(new Triple(bob, knows, Value.node(alice))));

    }

    public void test_insertDuplicateDoesNotRewrite() {

        final AtomicInteger puts = new AtomicInteger();

        final GraphStore g = new GraphStore(new MemoryBackend() {
            public void put(final TripleId id, final Triple triple) {
                puts.incrementAndGet();
                super.put(id, triple);
            }
        });

        try {

            final Triple t = new Triple(alice, knows, Value.node(bob));

            g.insert(t);
            g.insert(t);
            g.insertBatch(Arrays.asList(t, t));
            g.addIfAbsent(t);

            assertEquals(1, puts.get());

            assertEquals(1, g.count());

        } finally {

            g.close();

        }

    }

    /**
     * A delete racing with inserts of the same triple must leave the indices
     * agreeing with the backend: either the triple is gone or it is found.
     */
    public void test_concurrentInsertAndDelete() throws Exception {

        final Triple t = new Triple(alice, knows, Value.node(bob));

        final ExecutorService service = Executors.newFixedThreadPool(2);

        try {

            for (int round = 0; round < 200; round++) {

                store.insert(t);

                final CountDownLatch start = new CountDownLatch(1);

                final Future<Void> deleter = service.submit(new Callable<Void>() {
                    public Void call() throws Exception {
                        start.await();
                        store.delete(t.id());
                        return null;
                    }
                });

                final Future<Void> inserter = service.submit(new Callable<Void>() {
                    public Void call() throws Exception {
                        start.await();
                        for (int i = 0; i < 20; i++) {
                            store.insert(t);
                        }
                        return null;
                    }
                });

                start.countDown();

                deleter.get(30, TimeUnit.SECONDS);

                inserter.get(30, TimeUnit.SECONDS);

                final boolean present = store.contains(t);

                assertEquals("round=" + round, present, !store.find(
                        TriplePattern.subject(alice)).isEmpty());

                assertEquals("round=" + round, present ? 1 : 0, store.count());

                assertEquals("round=" + round, store.getBackend().count(),
                        store.count());

            }

        } finally {

            service.shutdownNow();

        }

    }

    public void test_contentAddressing() {

        final Triple t = new Triple(alice, age, Value.integer(30));

        final TripleId id = store.insert(t);

        assertEquals(t.id(), id);
        assertEquals(t, store.get(id));
        assertTrue(store.contains(id));
        assertTrue(store.contains(t));

    }

    public void test_getMissing() {

        try {
            store.get(new Triple(alice, age, Value.integer(1)).id());
            fail("Expecting: " + GraphException.class);
        } catch (GraphException ex) {
            assertEquals(GraphException.Kind.NOT_FOUND, ex.getKind());
        }

    }

    public void test_insertBatch() {

        final List<Triple> a = new ArrayList<Triple>(data());

        // a duplicate within the batch.
        a.add(a.get(0));

        final List<TripleId> ids = store.insertBatch(a);

        assertEquals(a.size(), ids.size());
        assertEquals(ids.get(0), ids.get(ids.size() - 1));
        assertEquals(data().size(), store.count());

    }

    /**
     * Every combination of specified fields returns exactly the triples a
     * brute-force filter would.
     */
    public void test_findIsComplete() {

        store.insertBatch(data());

        final NodeId[] subjects = new NodeId[] { null, alice, bob, carol };
        final Predicate[] predicates = new Predicate[] { null, knows, age };
        final Value[] objects = new Value[] { null, Value.node(bob),
                Value.integer(30), Value.string("30") };

        for (NodeId s : subjects) {
            for (Predicate p : predicates) {
                for (Value o : objects) {

                    final TriplePattern pattern = new TriplePattern(s, p, o);

                    final Set<Triple> expected = new HashSet<Triple>();

                    for (Triple t : data()) {
                        if (pattern.matches(t))
                            expected.add(t);
                    }

                    final List<Triple> actual = store.find(pattern);

                    assertEquals(pattern.toString(), expected.size(),
                            actual.size());
                    assertEquals(pattern.toString(), expected,
                            new HashSet<Triple>(actual));

                }
            }
        }

    }

    public void test_findIsOrderedById() {

        store.insertBatch(data());

        final List<Triple> a = store.find(TriplePattern.any());

        for (int i = 1; i < a.size(); i++) {

            assertTrue(a.get(i - 1).id().compareTo(a.get(i).id()) < 0);

        }

    }

    public void test_integerAndStringObjectsDiffer() {

        store.insertBatch(data());

        assertEquals(2, store.find(TriplePattern.object(Value.integer(30)))
                .size());
        assertEquals(1, store.find(TriplePattern.object(Value.string("30")))
                .size());

    }

    public void test_delete() {

        store.insertBatch(data());

        final Triple t = new Triple(alice, name, Value.string("Alice"));

        assertTrue(store.delete(t.id()));
        assertFalse(store.delete(t.id()));
        assertFalse(store.contains(t));
        assertTrue(store.find(TriplePattern.predicate(name)).isEmpty());
        assertFalse(store.find(TriplePattern.subject(alice)).contains(t));
        assertEquals(2, store.stats().getPredicateCount());

    }

    public void test_deleteScenario() {

        final TripleId id = store.insert(new Triple(alice, knows,
                Value.node(bob)));

        assertTrue(store.delete(id));

        assertTrue(store.find(TriplePattern.subject(alice)).isEmpty());
        assertEquals(0, store.stats().getTripleCount());
        assertEquals(0, store.stats().getSubjectCount());

    }

    public void test_stats() {

        store.insertBatch(data());

        final GraphStats stats = store.stats();

        assertEquals(7, stats.getTripleCount());
        assertEquals(3, stats.getSubjectCount());
        assertEquals(3, stats.getPredicateCount());
        // bob, carol, alice, 30, "30", "Alice"
        assertEquals(6, stats.getObjectCount());
        assertTrue(stats.getStorageBytes() > 0);

        // the triple count follows inserts and deletes.
        final Triple t = data().get(0);

        store.insert(t);

        assertEquals(7, store.stats().getTripleCount());

        assertTrue(store.delete(t.id()));

        assertFalse(store.delete(t.id()));

        assertEquals(6, store.stats().getTripleCount());

        assertEquals(store.getBackend().count(), store.count());

    }

    public void test_traverse() {

        store.insertBatch(data());

        store.insert(new Triple(carol, new Predicate("likes"), Value
                .node(NodeId.named("dave"))));

        assertEquals(Arrays.asList(bob, carol), store.traverse(alice, knows));

        assertEquals(Arrays.asList(bob, carol, NodeId.named("dave")),
                store.traverse(alice));

        assertTrue(store.traverse(NodeId.named("nobody")).isEmpty());

    }

    public void test_query() {

        store.insertBatch(data());

        final List<Triple> all = store.query().predicate(knows).execute();

        assertEquals(3, all.size());
        assertEquals(3, store.query().predicate(knows).count());

        assertEquals(all.subList(1, 3), store.query().predicate(knows)
                .offset(1).execute());
        assertEquals(all.subList(0, 2), store.query().predicate(knows)
                .limit(2).execute());
        assertEquals(all.subList(1, 2), store.query().predicate(knows)
                .offset(1).limit(1).execute());
        assertTrue(store.query().predicate(knows).offset(10).execute()
                .isEmpty());

        try {
            store.query().limit(-1);
            fail("Expecting: " + GraphException.class);
        } catch (GraphException ex) {
            assertEquals(GraphException.Kind.QUERY, ex.getKind());
        }

    }

}
