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
 * Created on Mar 13, 2026
 */

package com.pologic.logic.proof;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.pologic.graph.model.Triple;
import com.pologic.graph.model.TripleId;

/**
 * One application of a rule in a {@link LogicProof}: the premises, listed in
 * the order of the rule's conditions, and the triple derived from them.
 * 
 * @version $Id$
 */
public class ProofStep {

    private final String ruleName;

    private final List<TripleId> premises;

    private final Triple derived;

    public ProofStep(final String ruleName, final List<TripleId> premises,
            final Triple derived) {

        if (ruleName == null || premises == null || derived == null)
            throw new IllegalArgumentException();

        this.ruleName = ruleName;

        this.premises = Collections.unmodifiableList(new ArrayList<TripleId>(
                premises));

        this.derived = derived;

    }

    public String getRuleName() {
        return ruleName;
    }

    public List<TripleId> getPremises() {
        return premises;
    }

    public Triple getDerived() {
        return derived;
    }

    public boolean equals(final Object o) {

        if (this == o)
            return true;

        if (!(o instanceof ProofStep))
            return false;

        final ProofStep t = (ProofStep) o;

        return ruleName.equals(t.ruleName) && premises.equals(t.premises)
                && derived.equals(t.derived);

    }

    public int hashCode() {

        return (ruleName.hashCode() * 31 + premises.hashCode()) * 31
                + derived.hashCode();

    }

    public String toString() {

        return ruleName + premises + " => " + derived;

    }

}
