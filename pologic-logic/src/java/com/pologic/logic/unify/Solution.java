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
 * Created on Mar 12, 2026
 */

package com.pologic.logic.unify;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.pologic.graph.model.Triple;
import com.pologic.logic.term.IBindingSet;

/**
 * A joint solution of a list of conditions: the bindings and the triple
 * matched by each condition, in condition order.
 * 
 * @version $Id$
 */
public class Solution {

    private final IBindingSet bindings;

    private final List<Triple> premises;

    public Solution(final IBindingSet bindings, final List<Triple> premises) {

        this.bindings = bindings;

        this.premises = Collections.unmodifiableList(new ArrayList<Triple>(
                premises));

    }

    public IBindingSet getBindings() {

        return bindings;

    }

    public List<Triple> getPremises() {

        return premises;

    }

    /**
     * A solution with one more premise.
     */
    Solution extend(final IBindingSet b, final Triple premise) {

        final List<Triple> a = new ArrayList<Triple>(premises.size() + 1);

        a.addAll(premises);

        a.add(premise);

        return new Solution(b, a);

    }

    public String toString() {

        return "Solution{bindings=" + bindings + ",premises=" + premises
                + "}";

    }

}
