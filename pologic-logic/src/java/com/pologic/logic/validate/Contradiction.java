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
import java.util.Collections;
import java.util.List;

import com.pologic.graph.model.Triple;

/**
 * A set of triples of the graph which can not all hold.
 * 
 * @version $Id$
 */
public class Contradiction {

    private final String description;

    private final List<Triple> triples;

    public Contradiction(final String description, final List<Triple> triples) {

        this.description = description;

        this.triples = Collections.unmodifiableList(new ArrayList<Triple>(
                triples));

    }

    public String getDescription() {
        return description;
    }

    public List<Triple> getTriples() {
        return triples;
    }

    public String toString() {

        return description + ": " + triples;

    }

}
