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
import java.util.List;

import com.pologic.graph.GraphException;
import com.pologic.graph.model.NodeId;
import com.pologic.graph.model.Predicate;
import com.pologic.graph.model.Triple;
import com.pologic.graph.model.TriplePattern;
import com.pologic.graph.model.Value;

/**
 * Fluent construction of a pattern query with paging.
 * 
 * <pre>
 * store.query().subject(NodeId.named(&quot;alice&quot;)).limit(10).execute();
 * </pre>
 * 
 * @version $Id$
 */
public class QueryBuilder {

    private final GraphStore store;

    private TriplePattern pattern = TriplePattern.any();

    private int offset = 0;

    private int limit = -1;

    QueryBuilder(final GraphStore store) {

        this.store = store;

    }

    public QueryBuilder subject(final NodeId s) {

        pattern = pattern.withSubject(s);

        return this;

    }

    public QueryBuilder predicate(final Predicate p) {

        pattern = pattern.withPredicate(p);

        return this;

    }

    public QueryBuilder object(final Value o) {

        pattern = pattern.withObject(o);

        return this;

    }

    /**
     * Skip the first <i>n</i> results.
     */
    public QueryBuilder offset(final int n) {

        if (n < 0)
            throw new GraphException(GraphException.Kind.QUERY,
                    "offset must be non-negative: " + n);

        offset = n;

        return this;

    }

    /**
     * Return at most <i>n</i> results.
     */
    public QueryBuilder limit(final int n) {

        if (n < 0)
            throw new GraphException(GraphException.Kind.QUERY,
                    "limit must be non-negative: " + n);

        limit = n;

        return this;

    }

    public TriplePattern getPattern() {

        return pattern;

    }

    public List<Triple> execute() {

        final List<Triple> a = store.find(pattern);

        if (offset >= a.size())
            return Collections.emptyList();

        final int end = limit < 0 ? a.size() : (int) Math.min(a.size(),
                (long) offset + limit);

        return a.subList(offset, end);

    }

    /**
     * The number of matching triples, ignoring the offset and limit.
     */
    public int count() {

        return store.find(pattern).size();

    }

}
