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

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.apache.log4j.Logger;

import com.pologic.graph.GraphException;
import com.pologic.graph.model.Triple;
import com.pologic.graph.model.TripleId;
import com.pologic.graph.store.GraphStore;
import com.pologic.logic.InvalidProofException;
import com.pologic.logic.LogicException;
import com.pologic.logic.rule.Action;
import com.pologic.logic.rule.Condition;
import com.pologic.logic.rule.Rule;
import com.pologic.logic.rule.RuleSet;
import com.pologic.logic.term.HashBindingSet;
import com.pologic.logic.term.IBindingSet;
import com.pologic.logic.unify.Unifier;

/**
 * Replays a {@link LogicProof} against a {@link RuleSet} and a graph. Each
 * step must name a rule of the set, each premise must be a ground fact of the
 * graph or the triple derived by an earlier step, the premises must unify
 * positionally with the rule's conditions (constraints included), and one of
 * the rule's asserted templates must reproduce the step's derived triple
 * under the resulting bindings. The last step must derive the conclusion.
 * 
 * @version $Id$
 */
public class ProofVerifier {

    private static final transient Logger log = Logger
            .getLogger(ProofVerifier.class);

    private final RuleSet ruleSet;

    public ProofVerifier(final RuleSet ruleSet) {

        if (ruleSet == null)
            throw new IllegalArgumentException();

        this.ruleSet = ruleSet;

    }

    /**
     * Verify the proof.
     * 
     * @param proof
     *            The proof.
     * @param graph
     *            The graph holding the ground facts.
     * 
     * @throws InvalidProofException
     *             if the proof does not replay.
     * @throws LogicException
     *             of kind {@link LogicException.Kind#GRAPH_ERROR} if the
     *             graph fails.
     */
    public void verify(final LogicProof proof, final GraphStore graph) {

        if (proof == null || graph == null)
            throw new IllegalArgumentException();

        try {

            verify2(proof, graph);

        } catch (GraphException ex) {

            throw new LogicException(LogicException.Kind.GRAPH_ERROR,
                    ex.getMessage(), ex);

        }

        if (log.isDebugEnabled())
            log.debug("Verified: " + proof);

    }

    /**
     * Variant returns <code>false</code> rather than throwing an
     * {@link InvalidProofException}.
     */
    public boolean isValid(final LogicProof proof, final GraphStore graph) {

        try {

            verify(proof, graph);

            return true;

        } catch (InvalidProofException ex) {

            if (log.isInfoEnabled())
                log.info(ex.getMessage());

            return false;

        }

    }

    private void verify2(final LogicProof proof, final GraphStore graph) {

        final List<ProofStep> steps = proof.getSteps();

        if (steps.isEmpty()) {

            if (!graph.contains(proof.getConclusion()))
                throw new InvalidProofException(
                        "Conclusion is not a ground fact: "
                                + proof.getConclusion());

            return;

        }

        // the triples derived by the steps verified so far.
        final Map<TripleId, Triple> derived = new HashMap<TripleId, Triple>();

        for (int i = 0; i < steps.size(); i++) {

            final ProofStep step = steps.get(i);

            final Rule rule = ruleSet.get(step.getRuleName());

            if (rule == null)
                throw new InvalidProofException("step " + i
                        + ": unknown rule: " + step.getRuleName());

            final List<Condition> conditions = rule.getConditions();

            final List<TripleId> premises = step.getPremises();

            if (premises.size() != conditions.size())
                throw new InvalidProofException("step " + i + ": rule "
                        + rule.getName() + " has " + conditions.size()
                        + " conditions but the step has " + premises.size()
                        + " premises");

            IBindingSet bindings = new HashBindingSet();

            for (int j = 0; j < premises.size(); j++) {

                final TripleId id = premises.get(j);

                Triple t = derived.get(id);

                if (t == null && graph.contains(id))
                    t = graph.get(id);

                if (t == null)
                    throw new InvalidProofException("step " + i
                            + ": premise " + j
                            + " is neither a fact nor derived earlier: " + id);

                bindings = Unifier.unify(conditions.get(j), t, bindings);

                if (bindings == null)
                    throw new InvalidProofException("step " + i
                            + ": premise " + j + " does not satisfy "
                            + conditions.get(j) + ": " + t);

            }

            boolean reproduced = false;

            for (Action.Assert a : rule.getAsserts()) {

                if (step.getDerived().equals(
                        Unifier.substitute(a.getTemplate(), bindings))) {

                    reproduced = true;

                    break;

                }

            }

            if (!reproduced)
                throw new InvalidProofException("step " + i + ": rule "
                        + rule.getName() + " does not derive "
                        + step.getDerived() + " from " + bindings);

            derived.put(step.getDerived().id(), step.getDerived());

        }

        final Triple last = steps.get(steps.size() - 1).getDerived();

        if (!last.equals(proof.getConclusion()))
            throw new InvalidProofException("Last step derives " + last
                    + " but the conclusion is " + proof.getConclusion());

    }

}
