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

/**
 * Summary counts for a {@link GraphStore}.
 * 
 * @version $Id$
 */
public class GraphStats {

    private final long tripleCount;

    private final long subjectCount;

    private final long predicateCount;

    private final long objectCount;

    private final long storageBytes;

    public GraphStats(final long tripleCount, final long subjectCount,
            final long predicateCount, final long objectCount,
            final long storageBytes) {

        this.tripleCount = tripleCount;
        this.subjectCount = subjectCount;
        this.predicateCount = predicateCount;
        this.objectCount = objectCount;
        this.storageBytes = storageBytes;

    }

    public long getTripleCount() {
        return tripleCount;
    }

    /**
     * The number of distinct subjects.
     */
    public long getSubjectCount() {
        return subjectCount;
    }

    /**
     * The number of distinct predicates.
     */
    public long getPredicateCount() {
        return predicateCount;
    }

    /**
     * The number of distinct objects.
     */
    public long getObjectCount() {
        return objectCount;
    }

    public long getStorageBytes() {
        return storageBytes;
    }

    public String toString() {

        return "GraphStats{triples=" + tripleCount + ",subjects="
                + subjectCount + ",predicates=" + predicateCount
                + ",objects=" + objectCount + ",bytes=" + storageBytes + "}";

    }

}
