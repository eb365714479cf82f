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
 * Created on Mar 16, 2026
 */

package com.pologic.logic.inference;

import java.util.List;
import java.util.Properties;

import com.pologic.graph.config.ConfigurationException;
import com.pologic.graph.model.NodeId;
import com.pologic.graph.model.Predicate;
import com.pologic.graph.model.Triple;
import com.pologic.graph.model.TriplePattern;
import com.pologic.graph.model.Value;
import com.pologic.logic.AbstractLogicTestCase;
import com.pologic.logic.InferenceLoopException;
import com.pologic.logic.LogicException;
import com.pologic.logic.MaxDepthExceededException;
import com.pologic.logic.proof.LogicProof;
import com.pologic.logic.proof.ProofStep;
import com.pologic.logic.proof.ProofVerifier;
import com.pologic.logic.rule.BuiltinRules;
import com.pologic.logic.rule.Comparison;
import com.pologic.logic.rule.Rule;
import com.pologic.logic.rule.RuleSet;

/**
 * Test suite for forward and backward chaining.
 * 
 * @version $Id$
 */
public class TestInferenceEngine extends AbstractLogicTestCase {

    public TestInferenceEngine() {
    }

    public TestInferenceEngine(String name) {
        super(name);
    }

    private static final Predicate ancestor = new Predicate("ancestor");

    private static final Predicate knows = new Predicate("knows");

    private static RuleSet ancestry() {

        return RuleSet.builder("ancestry")
                .add(BuiltinRules.transitive(ancestor))
                .build();

    }

    private static TriplePattern goal(final String s, final Predicate p,
            final String o) {

        return new TriplePattern(NodeId.named(s), p, Value.node(o));

    }

    public void test_inferForward_transitiveClosure() {

        add("a", "ancestor", "b");
        add("b", "ancestor", "c");
        add("c", "ancestor", "d");

        final InferenceEngine engine = new InferenceEngine(store);

        final List<Triple> derived = engine.inferForward(ancestry());

        // a-c, b-d, a-d
        assertEquals(3, derived.size());

        assertTrue(store.contains(Triple.link("a", "ancestor", "d")));

        assertEquals(6, store.count());

        // a second run reaches the fixpoint at once.
        assertTrue(engine.inferForward(ancestry()).isEmpty());

        assertEquals(6, store.count());

        assertEquals(2, engine.getStats().forwardRuns.get());

        assertEquals(3, engine.getStats().inferences.get());

    }

    public void test_inferForward_symmetricTerminates() {

        add("a", "knows", "b");

        final RuleSet rs = RuleSet.builder("social")
                .add(BuiltinRules.symmetric(knows)).build();

        final List<Triple> derived = new InferenceEngine(store)
                .inferForward(rs);

        assertEquals(1, derived.size());

        assertEquals(Triple.link("b", "knows", "a"), derived.get(0));

    }

    public void test_inferForward_typeInheritance() {

        add("rex", "rdf:type", "Dog");
        add("Dog", "rdfs:subClassOf", "Mammal");
        add("Mammal", "rdfs:subClassOf", "Animal");

        new InferenceEngine(store).inferForward(BuiltinRules.standard());

        assertTrue(store.contains(Triple.link("Dog", "rdfs:subClassOf",
                "Animal")));

        assertTrue(store.contains(Triple.link("rex", "rdf:type", "Mammal")));

        assertTrue(store.contains(Triple.link("rex", "rdf:type", "Animal")));

    }

    public void test_inferForward_ignoresValidationRules() {

        add("a", "knows", "a");

        final List<Triple> derived = new InferenceEngine(store)
                .inferForward(RuleSet.builder("test")
                        .add(BuiltinRules.noSelfReference()).build());

        assertTrue(derived.isEmpty());

        assertEquals(1, store.count());

    }

    public void test_inferForward_maxIterations() {

        add("a", "ancestor", "b");
        add("b", "ancestor", "c");

        final InferenceEngine engine = new InferenceEngine(store);

        try {
            engine.inferForward(ancestry(), 1);
            fail("Expecting: " + MaxDepthExceededException.class);
        } catch (MaxDepthExceededException ex) {
            assertEquals(LogicException.Kind.MAX_DEPTH_EXCEEDED, ex.getKind());
            assertEquals(1, ex.getLimit());
        }

        // the triple derived in the first sweep remains.
        assertTrue(store.contains(Triple.link("a", "ancestor", "c")));

    }

    public void test_options() {

        final Properties p = new Properties();

        p.setProperty(InferenceEngine.Options.MAX_ITERATIONS, "1");

        add("a", "ancestor", "b");
        add("b", "ancestor", "c");

        try {
            new InferenceEngine(store, p).inferForward(ancestry());
            fail("Expecting: " + MaxDepthExceededException.class);
        } catch (MaxDepthExceededException ex) {
            // ignore
        }

        p.setProperty(InferenceEngine.Options.MAX_DEPTH, "0");

        try {
            new InferenceEngine(store, p);
            fail("Expecting: " + ConfigurationException.class);
        } catch (ConfigurationException ex) {
            // ignore
        }

    }

    public void test_prove_fact() {

        final Triple t = add("a", "ancestor", "b");

        final LogicProof proof = new InferenceEngine(store).prove(
                goal("a", ancestor, "b"), ancestry());

        assertEquals(t, proof.getConclusion());

        assertTrue(proof.isDirect());

        assertTrue(proof.getSteps().isEmpty());

        assertTrue(new ProofVerifier(ancestry()).isValid(proof, store));

    }

    public void test_prove_chain() {

        add("a", "ancestor", "b");
        add("b", "ancestor", "c");
        add("c", "ancestor", "d");

        final long before = store.count();

        final InferenceEngine engine = new InferenceEngine(store);

        final LogicProof proof = engine.prove(goal("a", ancestor, "d"),
                ancestry());

        assertEquals(Triple.link("a", "ancestor", "d"), proof.getConclusion());

        assertFalse(proof.isDirect());

        final List<ProofStep> steps = proof.getSteps();

        assertEquals(proof.getConclusion(), steps.get(steps.size() - 1)
                .getDerived());

        assertTrue(proof.rulesUsed().contains("ancestor_is_transitive"));

        // the proof replays.
        new ProofVerifier(ancestry()).verify(proof, store);

        // the graph is not modified.
        assertEquals(before, store.count());

        assertFalse(store.contains(Triple.link("a", "ancestor", "d")));

        assertEquals(1, engine.getStats().proofsFound.get());

    }

    public void test_prove_openGoal() {

        add("a", "ancestor", "b");
        add("b", "ancestor", "c");

        final LogicProof proof = new InferenceEngine(store).prove(
                new TriplePattern(null, ancestor, Value.node("c")),
                ancestry());

        // a ground fact is found first.
        assertEquals(Triple.link("b", "ancestor", "c"), proof.getConclusion());

        assertTrue(proof.isDirect());

    }

    public void test_prove_cyclicData() {

        add("a", "ancestor", "b");
        add("b", "ancestor", "a");

        final InferenceEngine engine = new InferenceEngine(store);

        final LogicProof proof = engine.prove(goal("a", ancestor, "a"),
                ancestry());

        new ProofVerifier(ancestry()).verify(proof, store);

        try {
            engine.prove(goal("a", ancestor, "z"), ancestry());
            fail("Expecting: " + LogicException.class);
        } catch (LogicException ex) {
            // the search terminates.
        }

    }

    public void test_prove_loop() {

        add("a", "knows", "b");

        final RuleSet rs = RuleSet.builder("social")
                .add(BuiltinRules.symmetric(knows)).build();

        final InferenceEngine engine = new InferenceEngine(store);

        assertEquals(1, engine.prove(goal("b", knows, "a"), rs).getSteps()
                .size());

        // every derivation of (c knows d) needs (d knows c) which needs
        // (c knows d).
        try {
            engine.prove(goal("c", knows, "d"), rs);
            fail("Expecting: " + InferenceLoopException.class);
        } catch (InferenceLoopException ex) {
            assertEquals(LogicException.Kind.INFERENCE_LOOP, ex.getKind());
        }

    }

    public void test_prove_missingPrecondition() {

        add("a", "ancestor", "b");

        try {
            new InferenceEngine(store).prove(goal("a", knows, "b"),
                    ancestry());
            fail("Expecting: " + LogicException.class);
        } catch (LogicException ex) {
            assertEquals(LogicException.Kind.MISSING_PRECONDITION,
                    ex.getKind());
        }

    }

    /**
     * A goal on acyclic data with no derivation is reported as missing even
     * though open sub-goals repeat along the way.
     */
    public void test_prove_unreachableOnAcyclicData() {

        add("a", "ancestor", "b");
        add("b", "ancestor", "c");

        try {
            new InferenceEngine(store).prove(goal("a", ancestor, "z"),
                    ancestry());
            fail("Expecting: " + LogicException.class);
        } catch (LogicException ex) {
            assertEquals(LogicException.Kind.MISSING_PRECONDITION,
                    ex.getKind());
        }

    }

    /**
     * A transitive chain of 30 edges, proved and refuted with the default
     * depth bound.
     */
    public void test_prove_longChain() {

        final int n = 30;

        for (int i = 0; i < n; i++) {

            add("n" + i, "ancestor", "n" + (i + 1));

        }

        final InferenceEngine engine = new InferenceEngine(store);

        final long begin = System.currentTimeMillis();

        final LogicProof proof = engine.prove(goal("n0", ancestor, "n" + n),
                ancestry());

        assertEquals(Triple.link("n0", "ancestor", "n" + n), proof
                .getConclusion());

        new ProofVerifier(ancestry()).verify(proof, store);

        try {
            engine.prove(goal("n0", ancestor, "zz"), ancestry());
            fail("Expecting: " + LogicException.class);
        } catch (LogicException ex) {
            assertEquals(LogicException.Kind.MISSING_PRECONDITION,
                    ex.getKind());
        }

        final long elapsed = System.currentTimeMillis() - begin;

        assertTrue("elapsed=" + elapsed, elapsed < 10000);

        // nothing was written to the graph.
        assertEquals(n, store.count());

    }

    public void test_prove_maxDepth() {

        add("a", "ancestor", "b");
        add("b", "ancestor", "c");

        final InferenceEngine engine = new InferenceEngine(store);

        try {
            engine.prove(goal("a", ancestor, "c"), ancestry(), 0);
            fail("Expecting: " + MaxDepthExceededException.class);
        } catch (MaxDepthExceededException ex) {
            assertEquals(0, ex.getLimit());
        }

        assertNotNull(engine.prove(goal("a", ancestor, "c"), ancestry(), 1));

    }

    public void test_prove_ruleWithLiteral() {

        store.insert(Triple.of("bob", "age", Value.integer(30)));

        final RuleSet rs = RuleSet.builder("people")
                .add(Rule.builder("adult")
                        .when("?x", "age", "?n")
                        .where(Comparison.of("n", Comparison.Op.GE,
                                Value.integer(18)))
                        .then("?x", "rdf:type", "Adult")
                        .build())
                .build();

        final LogicProof proof = new InferenceEngine(store).prove(
                goal("bob", Predicate.RDF_TYPE, "Adult"), rs);

        assertEquals(1, proof.getSteps().size());

        assertEquals("adult", proof.getSteps().get(0).getRuleName());

        new ProofVerifier(rs).verify(proof, store);

    }

}
