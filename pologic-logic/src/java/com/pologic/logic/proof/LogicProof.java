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
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.pologic.graph.model.Triple;
import com.pologic.graph.model.TripleId;

/**
 * A machine checkable derivation of a conclusion. The steps are in
 * dependency order: every premise of a step is either a ground fact of the
 * graph or the triple derived by an earlier step. A proof without steps
 * asserts that the conclusion is itself a ground fact.
 * 
 * @see ProofVerifier
 * 
 * @version $Id$
 */
public class LogicProof {

    private final Triple conclusion;

    private final List<ProofStep> steps;

    public LogicProof(final Triple conclusion, final List<ProofStep> steps) {

        if (conclusion == null || steps == null)
            throw new IllegalArgumentException();

        this.conclusion = conclusion;

        this.steps = Collections.unmodifiableList(new ArrayList<ProofStep>(
                steps));

    }

    public Triple getConclusion() {
        return conclusion;
    }

    public List<ProofStep> getSteps() {
        return steps;
    }

    /**
     * <code>true</code> iff the conclusion is a ground fact.
     */
    public boolean isDirect() {

        return steps.isEmpty();

    }

    /**
     * The distinct names of the rules applied, in order of first use.
     */
    public Set<String> rulesUsed() {

        final Set<String> names = new LinkedHashSet<String>();

        for (ProofStep step : steps) {

            names.add(step.getRuleName());

        }

        return names;

    }

    /**
     * The length of the longest chain of rule applications, zero for a
     * direct proof. A premise which is not derived by an earlier step is a
     * ground fact.
     */
    public int depth() {

        final Map<TripleId, Integer> levels = new HashMap<TripleId, Integer>();

        int max = 0;

        for (ProofStep step : steps) {

            int level = 1;

            for (TripleId id : step.getPremises()) {

                final Integer n = levels.get(id);

                if (n != null && n.intValue() + 1 > level)
                    level = n.intValue() + 1;

            }

            levels.put(step.getDerived().id(), Integer.valueOf(level));

            if (level > max)
                max = level;

        }

        return max;

    }

    public boolean equals(final Object o) {

        if (this == o)
            return true;

        if (!(o instanceof LogicProof))
            return false;

        final LogicProof t = (LogicProof) o;

        return conclusion.equals(t.conclusion) && steps.equals(t.steps);

    }

    public int hashCode() {

        return conclusion.hashCode() * 31 + steps.hashCode();

    }

    public String toString() {

        final StringBuilder sb = new StringBuilder();

        sb.append("LogicProof{conclusion=").append(conclusion);

        for (int i = 0; i < steps.size(); i++) {

            sb.append("\n  ").append(i).append(": ").append(steps.get(i));

        }

        sb.append("}");

        return sb.toString();

    }

}
