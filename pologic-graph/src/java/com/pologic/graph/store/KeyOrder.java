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

import java.util.ArrayList;
import java.util.List;

import com.pologic.graph.model.TriplePattern;

/**
 * Identifies one of the derived indices of a {@link GraphStore}.
 * 
 * @version $Id$
 */
public enum KeyOrder {

    SUBJECT,
    PREDICATE,
    OBJECT;

    /**
     * Return the indices which may be used to answer the pattern, one per
     * specified field. The list is empty for the wildcard pattern, which
     * can only be answered by a scan.
     */
    public static List<KeyOrder> getKeyOrders(final TriplePattern pattern) {

        final List<KeyOrder> a = new ArrayList<KeyOrder>(3);

        if (pattern.getSubject() != null)
            a.add(SUBJECT);

        if (pattern.getPredicate() != null)
            a.add(PREDICATE);

        if (pattern.getObject() != null)
            a.add(OBJECT);

        return a;

    }

}
