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

package com.pologic.logic.inference;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.Set;

import org.apache.log4j.Logger;

import com.pologic.graph.GraphException;
import com.pologic.graph.config.Configuration;
import com.pologic.graph.config.IntegerValidator;
import com.pologic.graph.model.Triple;
import com.pologic.graph.model.TripleId;
import com.pologic.graph.model.TriplePattern;
import com.pologic.graph.store.GraphStore;
import com.pologic.logic.InferenceLoopException;
import com.pologic.logic.LogicException;
import com.pologic.logic.MaxDepthExceededException;
import com.pologic.logic.proof.LogicProof;
import com.pologic.logic.proof.ProofStep;
import com.pologic.logic.rule.Action;
import com.pologic.logic.rule.Condition;
import com.pologic.logic.rule.Rule;
import com.pologic.logic.rule.RuleSet;
import com.pologic.logic.term.HashBindingSet;
import com.pologic.logic.term.IBindingSet;
import com.pologic.logic.unify.Join;
import com.pologic.logic.unify.Solution;
import com.pologic.logic.unify.Unifier;

/**
 * Forward and backward chaining over a {@link GraphStore}.
 * <p>
 * Forward chaining ({@link #inferForward(RuleSet, int)}) applies the
 * {@link Action.Assert} actions of every rule to every solution of its
 * conditions and inserts the new triples, sweeping over the rules until a
 * sweep adds nothing.
 * <p>
 * Backward chaining ({@link #prove(TriplePattern, RuleSet, int)}) searches
 * for a derivation of a goal without modifying the graph. A goal is solved
 * by a ground fact or by a rule with an asserted template which unifies with
 * the goal, whose conditions are then solved left to right as sub-goals.
 * Each branch carries the chain of goals being solved above it, and a goal
 * which is already on its own chain is not expanded again. The triples
 * derived for a goal at a given depth are remembered for the rest of the
 * search unless they were cut short by a goal further up the chain.
 * 
 * @version $Id$
 */
public class InferenceEngine {

    private static final transient Logger log = Logger
            .getLogger(InferenceEngine.class);

    /**
     * Options understood by {@link InferenceEngine}.
     */
    public static interface Options {

        /**
         * The default bound on forward chaining sweeps.
         */
        String MAX_ITERATIONS = "com.pologic.logic.maxIterations";

        String DEFAULT_MAX_ITERATIONS = "100";

        /**
         * The default bound on nested rule applications in backward
         * chaining.
         */
        String MAX_DEPTH = "com.pologic.logic.maxDepth";

        String DEFAULT_MAX_DEPTH = "32";

    }

    private final GraphStore store;

    private final int maxIterations;

    private final int maxDepth;

    private final EngineStats stats = new EngineStats();

    public InferenceEngine(final GraphStore store) {

        this(store, new Properties());

    }

    public InferenceEngine(final GraphStore store, final Properties properties) {

        if (store == null)
            throw new IllegalArgumentException();

        this.store = store;

        this.maxIterations = Configuration.getProperty(properties,
                Options.MAX_ITERATIONS, Options.DEFAULT_MAX_ITERATIONS,
                IntegerValidator.GT_ZERO);

        this.maxDepth = Configuration.getProperty(properties,
                Options.MAX_DEPTH, Options.DEFAULT_MAX_DEPTH,
                IntegerValidator.GT_ZERO);

    }

    public GraphStore getStore() {

        return store;

    }

    public EngineStats getStats() {

        return stats;

    }

    /**
     * Forward chain using the configured iteration bound.
     */
    public List<Triple> inferForward(final RuleSet ruleSet) {

        return inferForward(ruleSet, maxIterations);

    }

    /**
     * Apply the rules until a fixpoint is reached. Each sweep over the rules
     * counts as one iteration, including the final sweep which adds nothing.
     * 
     * @param ruleSet
     *            The rules.
     * @param maxIterations
     *            The maximum number of sweeps.
     * 
     * @return The triples added to the graph, in the order in which they
     *         were derived.
     * 
     * @throws MaxDepthExceededException
     *             if no fixpoint was reached within <i>maxIterations</i>
     *             sweeps. The triples derived before then remain in the
     *             graph.
     */
    public List<Triple> inferForward(final RuleSet ruleSet,
            final int maxIterations) {

        if (ruleSet == null)
            throw new IllegalArgumentException();

        if (maxIterations <= 0)
            throw new IllegalArgumentException();

        stats.forwardRuns.incrementAndGet();

        final List<Rule> rules = ruleSet.getDerivationRules();

        final Join join = new Join(store);

        final List<Triple> derived = new ArrayList<Triple>();

        int iteration = 0;

        try {

            while (true) {

                iteration++;

                if (iteration > maxIterations)
                    throw new MaxDepthExceededException(maxIterations,
                            "No fixpoint: derived=" + derived.size());

                stats.sweeps.incrementAndGet();

                final int before = derived.size();

                for (Rule rule : rules) {

                    for (Solution solution : join.solve(rule.getConditions())) {

                        for (Action.Assert a : rule.getAsserts()) {

                            final Triple t = Unifier.substitute(
                                    a.getTemplate(), solution.getBindings());

                            if (t != null && store.addIfAbsent(t)) {

                                derived.add(t);

                                if (log.isDebugEnabled())
                                    log.debug(rule.getName() + " => " + t);

                            }

                        }

                    }

                }

                if (derived.size() == before)
                    break;

            }

        } catch (GraphException ex) {

            throw new LogicException(LogicException.Kind.GRAPH_ERROR,
                    ex.getMessage(), ex);

        } finally {

            stats.inferences.addAndGet(derived.size());

        }

        if (log.isInfoEnabled())
            log.info("Fixpoint: ruleSet=" + ruleSet.getName()
                    + ", iterations=" + iteration + ", derived="
                    + derived.size());

        return derived;

    }

    /**
     * Prove using the configured depth bound.
     */
    public LogicProof prove(final TriplePattern goal, final RuleSet ruleSet) {

        return prove(goal, ruleSet, maxDepth);

    }

    /**
     * Search for a derivation of some triple matching the goal.
     * 
     * @param goal
     *            The goal. Unspecified fields match anything.
     * @param ruleSet
     *            The rules.
     * @param maxDepth
     *            The maximum number of nested rule applications. With zero
     *            only ground facts prove a goal.
     * 
     * @return A proof whose conclusion matches the goal.
     * 
     * @throws MaxDepthExceededException
     *             if there is no proof and some branch was cut by the depth
     *             bound.
     * @throws InferenceLoopException
     *             if there is no proof, no branch was cut by the depth bound
     *             and some branch was cut because it revisited a fully bound
     *             goal.
     * @throws LogicException
     *             of kind {@link LogicException.Kind#MISSING_PRECONDITION}
     *             if there is no proof otherwise.
     */
    public LogicProof prove(final TriplePattern goal, final RuleSet ruleSet,
            final int maxDepth) {

        if (goal == null || ruleSet == null)
            throw new IllegalArgumentException();

        if (maxDepth < 0)
            throw new IllegalArgumentException();

        stats.proofsAttempted.incrementAndGet();

        final Search search = new Search(ruleSet.getDerivationRules(),
                maxDepth);

        final Map<Triple, Derivation> found;

        try {

            found = search.solve(goal, 0, GoalChain.EMPTY);

        } catch (GraphException ex) {

            throw new LogicException(LogicException.Kind.GRAPH_ERROR,
                    ex.getMessage(), ex);

        }

        if (!found.isEmpty()) {

            final Derivation d = found.values().iterator().next();

            stats.proofsFound.incrementAndGet();

            final LogicProof proof = new LogicProof(d.fact, d.steps);

            if (log.isDebugEnabled())
                log.debug("Proved " + goal + ": " + proof);

            return proof;

        }

        if (search.depthExceeded)
            throw new MaxDepthExceededException(maxDepth, "No proof of "
                    + goal);

        if (search.loopDetected)
            throw new InferenceLoopException("No proof of " + goal
                    + ": a required triple depends on itself");

        throw new LogicException(LogicException.Kind.MISSING_PRECONDITION,
                "No proof of " + goal);

    }

    /**
     * A triple and the steps deriving it (empty for a ground fact).
     */
    private static class Derivation {

        final Triple fact;

        final List<ProofStep> steps;

        Derivation(final Triple fact, final List<ProofStep> steps) {

            this.fact = fact;

            this.steps = steps;

        }

    }

    /**
     * The immutable chain of goals above a branch. Branches share their
     * common prefix.
     */
    private static class GoalChain {

        static final GoalChain EMPTY = new GoalChain(null, -1, null);

        final TriplePattern goal;

        final int depth;

        final GoalChain parent;

        private GoalChain(final TriplePattern goal, final int depth,
                final GoalChain parent) {

            this.goal = goal;

            this.depth = depth;

            this.parent = parent;

        }

        GoalChain push(final TriplePattern g, final int d) {

            return new GoalChain(g, d, this);

        }

        /**
         * The depth at which the goal is being solved on this chain, or
         * <code>-1</code> if it is not on the chain.
         */
        int find(final TriplePattern g) {

            for (GoalChain c = this; c.goal != null; c = c.parent) {

                if (c.goal.equals(g))
                    return c.depth;

            }

            return -1;

        }

    }

    /**
     * A goal and the depth at which it is solved.
     */
    private static class GoalKey {

        final TriplePattern goal;

        final int depth;

        GoalKey(final TriplePattern goal, final int depth) {

            this.goal = goal;

            this.depth = depth;

        }

        public boolean equals(final Object o) {

            if (this == o)
                return true;

            if (!(o instanceof GoalKey))
                return false;

            final GoalKey k = (GoalKey) o;

            return depth == k.depth && goal.equals(k.goal);

        }

        public int hashCode() {

            return goal.hashCode() * 31 + depth;

        }

    }

    /**
     * A partial solution of a rule's conditions.
     */
    private static class Partial {

        final IBindingSet bindings;

        final List<Derivation> premises;

        Partial(final IBindingSet bindings, final List<Derivation> premises) {

            this.bindings = bindings;

            this.premises = premises;

        }

        Partial extend(final IBindingSet b, final Derivation d) {

            final List<Derivation> a = new ArrayList<Derivation>(
                    premises.size() + 1);

            a.addAll(premises);

            a.add(d);

            return new Partial(b, a);

        }

    }

    /**
     * The state of one call to prove. The failure flags and the table of
     * solved goals are shared between branches.
     */
    private class Search {

        final List<Rule> rules;

        final int maxDepth;

        boolean depthExceeded = false;

        boolean loopDetected = false;

        final Map<GoalKey, Map<Triple, Derivation>> solved = new HashMap<GoalKey, Map<Triple, Derivation>>();

        /**
         * The shallowest chain depth at which a goal was cut as a repeat
         * since this field was last reset.
         */
        int lowestCut = Integer.MAX_VALUE;

        Search(final List<Rule> rules, final int maxDepth) {

            this.rules = rules;

            this.maxDepth = maxDepth;

        }

        /**
         * Return the distinct triples matching the goal which can be derived
         * below the given depth, each with its first derivation. Ground facts
         * come first.
         */
        Map<Triple, Derivation> solve(final TriplePattern goal,
                final int depth, final GoalChain chain) {

            final int repeat = chain.find(goal);

            if (repeat >= 0) {

                lowestCut = Math.min(lowestCut, repeat);

                if (goal.isFullyBound() && expandable(goal))
                    loopDetected = true;

                return facts(goal);

            }

            final GoalKey key = new GoalKey(goal, depth);

            final Map<Triple, Derivation> known = solved.get(key);

            if (known != null)
                return known;

            final int outer = lowestCut;

            lowestCut = Integer.MAX_VALUE;

            final Map<Triple, Derivation> results = expand(goal, depth, chain);

            final int cut = lowestCut;

            lowestCut = Math.min(outer, cut);

            // Cuts at or below this goal recur whenever it is solved here.
            if (cut >= depth)
                solved.put(key, results);

            return results;

        }

        private Map<Triple, Derivation> facts(final TriplePattern goal) {

            final Map<Triple, Derivation> results = new LinkedHashMap<Triple, Derivation>();

            for (Triple t : store.find(goal)) {

                results.put(t, new Derivation(t,
                        Collections.<ProofStep> emptyList()));

            }

            return results;

        }

        private Map<Triple, Derivation> expand(final TriplePattern goal,
                final int depth, final GoalChain chain) {

            final Map<Triple, Derivation> results = facts(goal);

            if (depth >= maxDepth) {

                if (expandable(goal))
                    depthExceeded = true;

                return results;

            }

            final GoalChain branch = chain.push(goal, depth);

            for (Rule rule : rules) {

                for (Action.Assert a : rule.getAsserts()) {

                    final IBindingSet b0 = Unifier.unify(a.getTemplate(),
                            goal, new HashBindingSet());

                    if (b0 == null)
                        continue;

                    for (Partial p : solveConditions(rule, b0, depth, branch)) {

                        final Triple t = Unifier.substitute(a.getTemplate(),
                                p.bindings);

                        if (t == null || !goal.matches(t)
                                || results.containsKey(t))
                            continue;

                        results.put(t, new Derivation(t, steps(rule, p, t)));

                    }

                }

            }

            return results;

        }

        /**
         * <code>true</code> iff some asserted template unifies with the
         * goal.
         */
        private boolean expandable(final TriplePattern goal) {

            for (Rule rule : rules) {

                for (Action.Assert a : rule.getAsserts()) {

                    if (Unifier.unify(a.getTemplate(), goal,
                            new HashBindingSet()) != null)
                        return true;

                }

            }

            return false;

        }

        private List<Partial> solveConditions(final Rule rule,
                final IBindingSet b0, final int depth, final GoalChain branch) {

            List<Partial> partials = new ArrayList<Partial>();

            partials.add(new Partial(b0, Collections.<Derivation> emptyList()));

            for (Condition c : rule.getConditions()) {

                final List<Partial> next = new ArrayList<Partial>();

                for (Partial p : partials) {

                    final TriplePattern subgoal = Unifier.toPattern(
                            c.getTemplate(), p.bindings);

                    if (subgoal == null)
                        continue;

                    for (Derivation d : solve(subgoal, depth + 1, branch)
                            .values()) {

                        final IBindingSet b = Unifier.unify(c, d.fact,
                                p.bindings);

                        if (b != null)
                            next.add(p.extend(b, d));

                    }

                }

                if (next.isEmpty())
                    return next;

                partials = next;

            }

            return partials;

        }

        /**
         * Merge the steps of the premises, keeping the first step for each
         * derived triple, and append the step deriving <i>t</i>. If a premise
         * already derived <i>t</i> the merged steps up to that point are
         * returned instead.
         */
        private List<ProofStep> steps(final Rule rule, final Partial p,
                final Triple t) {

            final List<ProofStep> steps = new ArrayList<ProofStep>();

            final Set<Triple> seen = new LinkedHashSet<Triple>();

            final List<TripleId> premises = new ArrayList<TripleId>(
                    p.premises.size());

            for (Derivation d : p.premises) {

                for (ProofStep s : d.steps) {

                    if (seen.add(s.getDerived())) {

                        steps.add(s);

                        if (s.getDerived().equals(t))
                            return steps;

                    }

                }

                premises.add(d.fact.id());

            }

            steps.add(new ProofStep(rule.getName(), premises, t));

            return steps;

        }

    }

}
