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

import java.util.Collections;
import java.util.HashSet;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.BiFunction;

import com.pologic.graph.model.NodeId;
import com.pologic.graph.model.Predicate;
import com.pologic.graph.model.Triple;
import com.pologic.graph.model.TripleId;
import com.pologic.graph.model.TriplePattern;
import com.pologic.graph.model.Value;

/**
 * The derived subject, predicate and object indices. Each maps a key to the
 * set of ids of the triples having that key in the corresponding position.
 * Objects are keyed by {@link Value}, whose equality includes the kind, so
 * the integer <code>1</code> and the string <code>"1"</code> are distinct
 * keys. Updates to a key are atomic and empty id sets are removed.
 * 
 * @version $Id$
 */
public class TripleIndex {

    private final ConcurrentHashMap<NodeId, Set<TripleId>> subjects = new ConcurrentHashMap<NodeId, Set<TripleId>>();

    private final ConcurrentHashMap<Predicate, Set<TripleId>> predicates = new ConcurrentHashMap<Predicate, Set<TripleId>>();

    private final ConcurrentHashMap<Value, Set<TripleId>> objects = new ConcurrentHashMap<Value, Set<TripleId>>();

    public TripleIndex() {

    }

    public void add(final Triple t, final TripleId id) {

        add(subjects, t.getSubject(), id);

        add(predicates, t.getPredicate(), id);

        add(objects, t.getObject(), id);

    }

    public void remove(final Triple t, final TripleId id) {

        remove(subjects, t.getSubject(), id);

        remove(predicates, t.getPredicate(), id);

        remove(objects, t.getObject(), id);

    }

    public void clear() {

        subjects.clear();

        predicates.clear();

        objects.clear();

    }

    private static <K> void add(final ConcurrentHashMap<K, Set<TripleId>> map,
            final K key, final TripleId id) {

        map.compute(key, new BiFunction<K, Set<TripleId>, Set<TripleId>>() {

            public Set<TripleId> apply(final K k, Set<TripleId> ids) {

                if (ids == null)
                    ids = ConcurrentHashMap.newKeySet();

                ids.add(id);

                return ids;

            }

        });

    }

    private static <K> void remove(
            final ConcurrentHashMap<K, Set<TripleId>> map, final K key,
            final TripleId id) {

        map.computeIfPresent(key,
                new BiFunction<K, Set<TripleId>, Set<TripleId>>() {

                    public Set<TripleId> apply(final K k,
                            final Set<TripleId> ids) {

                        ids.remove(id);

                        // drop the key once it has no triples.
                        return ids.isEmpty() ? null : ids;

                    }

                });

    }

    /**
     * Return a snapshot of the ids under the key of the given index for the
     * pattern.
     * 
     * @throws IllegalArgumentException
     *             if the pattern does not specify the field of that index.
     */
    public Set<TripleId> lookup(final KeyOrder keyOrder,
            final TriplePattern pattern) {

        final Set<TripleId> ids;

        switch (keyOrder) {
        case SUBJECT:
            if (pattern.getSubject() == null)
                throw new IllegalArgumentException();
            ids = subjects.get(pattern.getSubject());
            break;
        case PREDICATE:
            if (pattern.getPredicate() == null)
                throw new IllegalArgumentException();
            ids = predicates.get(pattern.getPredicate());
            break;
        case OBJECT:
            if (pattern.getObject() == null)
                throw new IllegalArgumentException();
            ids = objects.get(pattern.getObject());
            break;
        default:
            throw new AssertionError(keyOrder);
        }

        if (ids == null)
            return Collections.emptySet();

        return new HashSet<TripleId>(ids);

    }

    /**
     * The number of distinct keys in the index.
     */
    public int size(final KeyOrder keyOrder) {

        switch (keyOrder) {
        case SUBJECT:
            return subjects.size();
        case PREDICATE:
            return predicates.size();
        case OBJECT:
            return objects.size();
        default:
            throw new AssertionError(keyOrder);
        }

    }

}
