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
import java.util.Collections;
import java.util.Comparator;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.apache.log4j.Logger;

import com.pologic.graph.GraphException;
import com.pologic.graph.model.NodeId;
import com.pologic.graph.model.Predicate;
import com.pologic.graph.model.Triple;
import com.pologic.graph.model.TriplePattern;
import com.pologic.graph.model.Value;
import com.pologic.graph.store.ITripleSource;
import com.pologic.logic.LogicException;
import com.pologic.logic.rule.Action;
import com.pologic.logic.rule.Condition;
import com.pologic.logic.rule.Rule;
import com.pologic.logic.rule.RuleKind;
import com.pologic.logic.rule.RuleSet;
import com.pologic.logic.rule.Severity;
import com.pologic.logic.term.IBindingSet;
import com.pologic.logic.term.IVariable;
import com.pologic.logic.unify.Join;
import com.pologic.logic.unify.Solution;
import com.pologic.logic.unify.Unifier;

/**
 * Checks candidate triples against the {@link RuleKind#INTEGRITY} and
 * {@link RuleKind#AUTHORITY} rules of a {@link RuleSet} and against its
 * functional predicates and contradicting predicate pairs. Validation reads
 * the graph but never modifies it, and does not prevent the candidates from
 * being inserted afterwards.
 * <p>
 * A rule is checked once for each of its conditions with the candidate
 * pinned to that condition: the other conditions are joined against the
 * graph plus the whole batch, in the declared order, and each solution fires
 * the rule's reject actions and checks its require actions. Violations which do not involve a candidate are not
 * reported (see {@link #findContradictions(RuleSet)} for a whole graph
 * check).
 * 
 * @version $Id$
 */
public class Validator {

    private static final transient Logger log = Logger
            .getLogger(Validator.class);

    private final ITripleSource graph;

    public Validator(final ITripleSource graph) {

        if (graph == null)
            throw new IllegalArgumentException();

        this.graph = graph;

    }

    public ValidationResult validate(final Triple candidate,
            final RuleSet ruleSet) {

        if (candidate == null)
            throw new IllegalArgumentException();

        return validate(Collections.singletonList(candidate), ruleSet);

    }

    /**
     * Validate a batch of candidates as if they were inserted together.
     */
    public ValidationResult validate(final Collection<Triple> candidates,
            final RuleSet ruleSet) {

        if (candidates == null || ruleSet == null)
            throw new IllegalArgumentException();

        final Set<ValidationError> errors = new LinkedHashSet<ValidationError>();

        try {

            final ITripleSource view = new BatchTripleSource(graph, candidates);

            final List<Rule> rules = ruleSet.getRules(RuleKind.INTEGRITY,
                    RuleKind.AUTHORITY);

            final List<Triple> earlier = new ArrayList<Triple>();

            for (Triple c : candidates) {

                for (Rule rule : rules) {

                    checkRule(rule, c, view, errors);

                }

                checkFunctional(ruleSet, c, earlier, errors);

                checkContradicting(ruleSet, c, earlier, errors);

                earlier.add(c);

            }

        } catch (GraphException ex) {

            throw new LogicException(LogicException.Kind.GRAPH_ERROR,
                    ex.getMessage(), ex);

        }

        final ValidationResult result = new ValidationResult(
                new ArrayList<ValidationError>(errors));

        if (log.isDebugEnabled())
            log.debug("candidates=" + candidates.size() + " : " + result);

        return result;

    }

    private void checkRule(final Rule rule, final Triple candidate,
            final ITripleSource view, final Set<ValidationError> errors) {

        final List<Condition> conditions = rule.getConditions();

        final Join join = new Join(view);

        for (int i = 0; i < conditions.size(); i++) {

            for (Solution s : join.solve(conditions, i, candidate)) {

                fire(rule, s.getBindings(), view, errors);

            }

        }

    }

    private void fire(final Rule rule, final IBindingSet bindings,
            final ITripleSource view, final Set<ValidationError> errors) {

        for (Action a : rule.getActions()) {

            if (a instanceof Action.Reject) {

                errors.add(new ValidationError(rule.getSeverity(), rule
                        .getName(), expand(((Action.Reject) a).getReason(),
                        bindings), ValidationError.Kind.RULE_VIOLATION));

            } else if (a instanceof Action.Require) {

                final TriplePattern pattern = Unifier.toPattern(
                        ((Action.Require) a).getTemplate(), bindings);

                if (pattern == null || view.find(pattern).isEmpty()) {

                    errors.add(new ValidationError(rule.getSeverity(), rule
                            .getName(), "Required "
                            + (pattern == null ? ((Action.Require) a)
                                    .getTemplate() : pattern)
                            + " not found for " + bindings,
                            ValidationError.Kind.REQUIREMENT_UNSATISFIED));

                }

            }

        }

    }

    /**
     * Replace each <code>?name</code> in the reason by the binding of that
     * variable. Longer names are replaced first.
     */
    static String expand(final String reason, final IBindingSet bindings) {

        final List<Map.Entry<IVariable<?>, Value>> entries = new ArrayList<Map.Entry<IVariable<?>, Value>>();

        final Iterator<Map.Entry<IVariable<?>, Value>> itr = bindings
                .iterator();

        while (itr.hasNext()) {

            entries.add(itr.next());

        }

        Collections.sort(entries,
                new Comparator<Map.Entry<IVariable<?>, Value>>() {
                    public int compare(final Map.Entry<IVariable<?>, Value> a,
                            final Map.Entry<IVariable<?>, Value> b) {
                        return b.getKey().getName().length()
                                - a.getKey().getName().length();
                    }
                });

        String s = reason;

        for (Map.Entry<IVariable<?>, Value> e : entries) {

            s = s.replace("?" + e.getKey().getName(), e.getValue()
                    .getLexicalForm());

        }

        return s;

    }

    private void checkFunctional(final RuleSet ruleSet, final Triple c,
            final List<Triple> earlier, final Set<ValidationError> errors) {

        final Predicate p = c.getPredicate();

        if (!ruleSet.isFunctional(p))
            return;

        final List<Triple> others = new ArrayList<Triple>(
                graph.find(new TriplePattern(c.getSubject(), p, null)));

        for (Triple t : earlier) {

            if (t.getSubject().equals(c.getSubject())
                    && t.getPredicate().equals(p))
                others.add(t);

        }

        for (Triple t : others) {

            if (!t.getObject().equals(c.getObject())) {

                errors.add(new ValidationError(Severity.FATAL, "functional:"
                        + p, "Functional predicate " + p + " of "
                        + c.getSubject() + " has " + t.getObject()
                        + " and " + c.getObject(),
                        ValidationError.Kind.CONTRADICTION));

            }

        }

    }

    private void checkContradicting(final RuleSet ruleSet, final Triple c,
            final List<Triple> earlier, final Set<ValidationError> errors) {

        for (Predicate q : ruleSet.getContradicting(c.getPredicate())) {

            final Triple opposite = new Triple(c.getSubject(), q,
                    c.getObject());

            if (graph.contains(opposite) || earlier.contains(opposite)) {

                errors.add(new ValidationError(Severity.ERROR, "contradicts:"
                        + c.getPredicate() + "/" + q, c + " contradicts "
                        + opposite, ValidationError.Kind.CONTRADICTION));

            }

        }

    }

    /**
     * Scan the whole graph for violations of the functional predicates and
     * contradicting pairs of the rule set.
     */
    public List<Contradiction> findContradictions(final RuleSet ruleSet) {

        if (ruleSet == null)
            throw new IllegalArgumentException();

        final List<Contradiction> a = new ArrayList<Contradiction>();

        try {

            for (Predicate p : ruleSet.getFunctionalPredicates()) {

                final Map<NodeId, List<Triple>> bySubject = new LinkedHashMap<NodeId, List<Triple>>();

                for (Triple t : graph.find(TriplePattern.predicate(p))) {

                    List<Triple> list = bySubject.get(t.getSubject());

                    if (list == null) {

                        list = new ArrayList<Triple>();

                        bySubject.put(t.getSubject(), list);

                    }

                    list.add(t);

                }

                for (Map.Entry<NodeId, List<Triple>> e : bySubject.entrySet()) {

                    if (e.getValue().size() > 1) {

                        a.add(new Contradiction("Functional predicate " + p
                                + " of " + e.getKey() + " has "
                                + e.getValue().size() + " objects",
                                e.getValue()));

                    }

                }

            }

            for (Predicate[] pair : ruleSet.getContradictingPairs()) {

                for (Triple t : graph.find(TriplePattern.predicate(pair[0]))) {

                    final Triple opposite = new Triple(t.getSubject(),
                            pair[1], t.getObject());

                    if (graph.contains(opposite)) {

                        final List<Triple> both = new ArrayList<Triple>(2);

                        both.add(t);

                        both.add(opposite);

                        a.add(new Contradiction(pair[0] + " contradicts "
                                + pair[1], both));

                    }

                }

            }

        } catch (GraphException ex) {

            throw new LogicException(LogicException.Kind.GRAPH_ERROR,
                    ex.getMessage(), ex);

        }

        if (log.isInfoEnabled())
            log.info("ruleSet=" + ruleSet.getName() + ", contradictions="
                    + a.size());

        return a;

    }

}
