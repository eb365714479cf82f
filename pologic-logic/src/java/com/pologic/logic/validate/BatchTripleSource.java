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
 * Created on Mar 14, 2026
 */

package com.pologic.logic.validate;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

import com.pologic.graph.model.Triple;
import com.pologic.graph.model.TripleId;
import com.pologic.graph.model.TriplePattern;
import com.pologic.graph.store.ITripleSource;

/**
 * A read-only view of a graph as if a batch of candidate triples had been
 * inserted.
 * 
 * @version $Id$
 */
class BatchTripleSource implements ITripleSource {

    private final ITripleSource graph;

    private final Set<Triple> batch;

    BatchTripleSource(final ITripleSource graph, final Collection<Triple> batch) {

        this.graph = graph;

        this.batch = new LinkedHashSet<Triple>(batch);

    }

    public List<Triple> find(final TriplePattern pattern) {

        final Map<TripleId, Triple> a = new TreeMap<TripleId, Triple>();

        for (Triple t : graph.find(pattern)) {

            a.put(t.id(), t);

        }

        for (Triple t : batch) {

            if (pattern.matches(t))
                a.put(t.id(), t);

        }

        return new ArrayList<Triple>(a.values());

    }

    public boolean contains(final Triple triple) {

        return batch.contains(triple) || graph.contains(triple);

    }

}
