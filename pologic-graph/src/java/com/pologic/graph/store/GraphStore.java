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
 * Created on Mar 6, 2026
 */

package com.pologic.graph.store;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Properties;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.atomic.AtomicLong;

import org.apache.log4j.Logger;

import com.pologic.graph.GraphException;
import com.pologic.graph.backend.IStorageBackend;
import com.pologic.graph.backend.StorageBackendFactory;
import com.pologic.graph.model.NodeId;
import com.pologic.graph.model.Predicate;
import com.pologic.graph.model.Triple;
import com.pologic.graph.model.TripleId;
import com.pologic.graph.model.TriplePattern;
import com.pologic.graph.model.Value;

/**
 * A content-addressed triple store. Triples are kept by an
 * {@link IStorageBackend} under their {@link TripleId} and three derived
 * indices (see {@link TripleIndex}) answer pattern queries.
 * <p>
 * Every operation is atomic with respect to a single triple: the backend
 * write and the index update for an id are made while holding the lock
 * stripe for that id, so concurrent writers of the same triple can not leave
 * the indices behind the backend. There are no multi-triple transactions: a
 * batch insert which fails part way leaves the triples inserted before the
 * failure in place.
 * <p>
 * The indices are rebuilt from the backend when the store is opened, so a
 * store opened on a persistent backend answers queries at once.
 * 
 * @version $Id$
 */
public class GraphStore implements ITripleSource {

    private static final transient Logger log = Logger
            .getLogger(GraphStore.class);

    private final IStorageBackend backend;

    private final TripleIndex index = new TripleIndex();

    /**
     * The number of lock stripes (a power of two).
     */
    private static final int NLOCKS = 64;

    private final Object[] locks = new Object[NLOCKS];

    /**
     * The number of triples in the backend.
     */
    private final AtomicLong ntriples = new AtomicLong();

    /**
     * Open a store on the given backend.
     */
    public GraphStore(final IStorageBackend backend) {

        if (backend == null)
            throw new IllegalArgumentException();

        this.backend = backend;

        for (int i = 0; i < NLOCKS; i++) {

            locks[i] = new Object();

        }

        rebuildIndices();

    }

    /**
     * Open a store on the backend described by the properties.
     * 
     * @see StorageBackendFactory.Options
     */
    public GraphStore(final Properties properties) {

        this(StorageBackendFactory.open(properties));

    }

    private void rebuildIndices() {

        index.clear();

        long n = 0;

        final Iterator<Triple> itr = backend.iterAll();

        while (itr.hasNext()) {

            final Triple t = itr.next();

            index.add(t, t.id());

            n++;

        }

        ntriples.set(n);

        if (log.isInfoEnabled())
            log.info("Indexed " + n + " triples: backend="
                    + backend.getBackendType());

    }

    public IStorageBackend getBackend() {

        return backend;

    }

    /**
     * Insert a triple. Inserting a triple which is already present is a
     * success and returns the same id.
     * 
     * @return The id of the triple.
     */
    public TripleId insert(final Triple t) {

        if (t == null)
            throw new IllegalArgumentException();

        final TripleId id = t.id();

        final boolean added = add(t, id);

        if (log.isDebugEnabled())
            log.debug("insert: " + t + " => " + id + (added ? "" : " (present)"));

        return id;

    }

    /**
     * Insert a triple unless it is already present.
     * 
     * @return <code>true</code> iff the triple was not present.
     */
    public boolean addIfAbsent(final Triple t) {

        if (t == null)
            throw new IllegalArgumentException();

        return add(t, t.id());

    }

    /**
     * The lock stripe for an id.
     */
    private Object lockFor(final TripleId id) {

        return locks[id.hashCode() & (NLOCKS - 1)];

    }

    private boolean add(final Triple t, final TripleId id) {

        synchronized (lockFor(id)) {

            if (backend.exists(id))
                return false;

            backend.put(id, t);

            index.add(t, id);

            ntriples.incrementAndGet();

            return true;

        }

    }

    /**
     * Insert each triple in turn.
     * 
     * @return The ids in the order of the input.
     */
    public List<TripleId> insertBatch(final Collection<Triple> triples) {

        if (triples == null)
            throw new IllegalArgumentException();

        final List<TripleId> ids = new ArrayList<TripleId>(triples.size());

        for (Triple t : triples) {

            ids.add(insert(t));

        }

        return ids;

    }

    /**
     * Return the triple having that id.
     * 
     * @throws GraphException
     *             of kind {@link GraphException.Kind#NOT_FOUND} if there is
     *             no such triple.
     */
    public Triple get(final TripleId id) {

        if (id == null)
            throw new IllegalArgumentException();

        final Triple t = backend.get(id);

        if (t == null)
            throw new GraphException(GraphException.Kind.NOT_FOUND,
                    "No such triple: " + id);

        return t;

    }

    public boolean contains(final TripleId id) {

        if (id == null)
            throw new IllegalArgumentException();

        return backend.exists(id);

    }

    public boolean contains(final Triple t) {

        if (t == null)
            throw new IllegalArgumentException();

        return backend.exists(t.id());

    }

    /**
     * Remove the triple having that id.
     * 
     * @return <code>true</code> iff it was present.
     */
    public boolean delete(final TripleId id) {

        if (id == null)
            throw new IllegalArgumentException();

        final boolean removed;

        synchronized (lockFor(id)) {

            final Triple t = backend.get(id);

            if (t == null)
                return false;

            removed = backend.delete(id);

            index.remove(t, id);

            if (removed)
                ntriples.decrementAndGet();

        }

        if (log.isDebugEnabled())
            log.debug("delete: " + id + " => " + removed);

        return removed;

    }

    /**
     * Return the triples matching the pattern, ordered by id.
     * <p>
     * The wildcard pattern is answered by a scan of the backend. Otherwise
     * the id sets of each specified field are intersected, starting with the
     * smallest, and every surviving triple is re-loaded and re-checked
     * against the pattern.
     */
    public List<Triple> find(final TriplePattern pattern) {

        if (pattern == null)
            throw new IllegalArgumentException();

        final List<KeyOrder> keyOrders = KeyOrder.getKeyOrders(pattern);

        if (keyOrders.isEmpty()) {

            return scan(pattern);

        }

        final List<Set<TripleId>> sets = new ArrayList<Set<TripleId>>(
                keyOrders.size());

        for (KeyOrder keyOrder : keyOrders) {

            final Set<TripleId> ids = index.lookup(keyOrder, pattern);

            if (ids.isEmpty())
                return Collections.emptyList();

            sets.add(ids);

        }

        // most selective first.
        Collections.sort(sets, new Comparator<Set<TripleId>>() {
            public int compare(final Set<TripleId> a, final Set<TripleId> b) {
                return Integer.compare(a.size(), b.size());
            }
        });

        final TreeSet<TripleId> candidates = new TreeSet<TripleId>(sets.get(0));

        for (int i = 1; i < sets.size(); i++) {

            candidates.retainAll(sets.get(i));

        }

        final List<Triple> a = new ArrayList<Triple>(candidates.size());

        for (TripleId id : candidates) {

            final Triple t = backend.get(id);

            if (t != null && pattern.matches(t)) {

                a.add(t);

            }

        }

        if (log.isDebugEnabled())
            log.debug("find: " + pattern + ", keyOrders=" + keyOrders
                    + ", candidates=" + candidates.size() + ", matched="
                    + a.size());

        return a;

    }

    private List<Triple> scan(final TriplePattern pattern) {

        final TreeMap<TripleId, Triple> a = new TreeMap<TripleId, Triple>();

        final Iterator<Triple> itr = backend.iterAll();

        while (itr.hasNext()) {

            final Triple t = itr.next();

            if (pattern.matches(t))
                a.put(t.id(), t);

        }

        return new ArrayList<Triple>(a.values());

    }

    /**
     * Return a builder for a query against this store.
     */
    public QueryBuilder query() {

        return new QueryBuilder(this);

    }

    /**
     * Return the nodes reachable from <i>start</i> by following node-valued
     * objects, breadth first. The start node itself is never reported.
     * 
     * @param start
     *            The start node.
     * @param predicates
     *            The predicates to follow. When none are given every
     *            predicate is followed.
     * 
     * @return The reachable nodes in the order in which they were reached.
     */
    public List<NodeId> traverse(final NodeId start,
            final Predicate... predicates) {

        if (start == null)
            throw new IllegalArgumentException();

        final Set<Predicate> follow = predicates == null
                || predicates.length == 0 ? null : new HashSet<Predicate>(
                Arrays.asList(predicates));

        final Set<NodeId> visited = new LinkedHashSet<NodeId>();

        final ArrayDeque<NodeId> queue = new ArrayDeque<NodeId>();

        queue.add(start);

        while (!queue.isEmpty()) {

            final NodeId n = queue.poll();

            for (Triple t : find(TriplePattern.subject(n))) {

                if (follow != null && !follow.contains(t.getPredicate()))
                    continue;

                final Value o = t.getObject();

                if (!o.isNode())
                    continue;

                if (visited.add(o.asNode())) {

                    queue.add(o.asNode());

                }

            }

        }

        visited.remove(start);

        return new ArrayList<NodeId>(visited);

    }

    /**
     * The number of triples.
     */
    public long count() {

        return ntriples.get();

    }

    /**
     * Summary counts, taken from the triple counter, the index sizes and the
     * backend's running byte total.
     */
    public GraphStats stats() {

        return new GraphStats(ntriples.get(),
                index.size(KeyOrder.SUBJECT), index.size(KeyOrder.PREDICATE),
                index.size(KeyOrder.OBJECT), backend.sizeBytes());

    }

    public void flush() {

        backend.flush();

    }

    public boolean isOpen() {

        return backend.isOpen();

    }

    public void close() {

        backend.close();

        index.clear();

        ntriples.set(0);

    }

    public String toString() {

        return getClass().getSimpleName() + "{backend="
                + backend.getBackendType() + "}";

    }

}
