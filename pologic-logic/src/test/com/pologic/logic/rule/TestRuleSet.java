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
 * Created on Mar 15, 2026
 */

package com.pologic.logic.rule;

import java.util.List;

import junit.framework.TestCase;

import com.pologic.graph.model.Predicate;
import com.pologic.logic.LogicException;

/**
 * Test suite for {@link RuleBuilder}, {@link RuleSet} and
 * {@link BuiltinRules}.
 * 
 * @version $Id$
 */
public class TestRuleSet extends TestCase {

    public TestRuleSet() {
    }

    public TestRuleSet(String name) {
        super(name);
    }

    private static final Predicate is = new Predicate("is");

    private static final Predicate is_not = new Predicate("is_not");

    public void test_build() {

        final Rule r = Rule.builder("grandparent")
                .description("grandparents")
                .when("?x", "parent", "?y")
                .when("?y", "parent", "?z")
                .then("?x", "grandparent", "?z")
                .build();

        assertEquals("grandparent", r.getName());

        assertEquals(RuleKind.INFERENCE, r.getKind());

        assertEquals(Severity.ERROR, r.getSeverity());

        assertEquals(2, r.getConditions().size());

        assertEquals(1, r.getAsserts().size());

        assertTrue(r.isDerivation());

    }

    public void test_build_requiresName() {

        try {
            Rule.builder(" ").when("?x", "p", "?y").then("?y", "p", "?x")
                    .build();
            fail("Expecting: " + LogicException.class);
        } catch (LogicException ex) {
            assertEquals(LogicException.Kind.INVALID_RULE, ex.getKind());
        }

    }

    public void test_build_requiresConditionsAndActions() {

        try {
            Rule.builder("r").then("a", "p", "b").build();
            fail("Expecting: " + LogicException.class);
        } catch (LogicException ex) {
            assertEquals(LogicException.Kind.INVALID_RULE, ex.getKind());
        }

        try {
            Rule.builder("r").when("?x", "p", "?y").build();
            fail("Expecting: " + LogicException.class);
        } catch (LogicException ex) {
            assertEquals(LogicException.Kind.INVALID_RULE, ex.getKind());
        }

    }

    public void test_build_unboundAssertVariable() {

        try {
            Rule.builder("r").when("?x", "p", "?y").then("?x", "q", "?z")
                    .build();
            fail("Expecting: " + LogicException.class);
        } catch (LogicException ex) {
            assertEquals(LogicException.Kind.INVALID_RULE, ex.getKind());
        }

    }

    public void test_build_constraintOnUnboundVariable() {

        try {
            Rule.builder("r").when("?x", "p", "?y").where(NotEqual.of("x", "z"))
                    .then("?y", "p", "?x").build();
            fail("Expecting: " + LogicException.class);
        } catch (LogicException ex) {
            assertEquals(LogicException.Kind.INVALID_RULE, ex.getKind());
        }

    }

    public void test_duplicateName() {

        final RuleSet.Builder b = RuleSet.builder("test").add(
                BuiltinRules.symmetric(is));

        try {
            b.add(BuiltinRules.symmetric(is));
            fail("Expecting: " + LogicException.class);
        } catch (LogicException ex) {
            assertEquals(LogicException.Kind.INVALID_RULE, ex.getKind());
        }

    }

    public void test_withRule_replacesInPlace() {

        final RuleSet a = RuleSet.builder("test")
                .add(BuiltinRules.noSelfReference())
                .add(BuiltinRules.symmetric(is))
                .add(BuiltinRules.transitive(is))
                .build();

        final Rule r = Rule.builder(BuiltinRules.symmetric(is).getName())
                .when("?x", "is", "?y")
                .then("?y", "is", "?x")
                .then("?x", "is", "?x")
                .build();

        final RuleSet b = a.withRule(r);

        assertEquals(3, b.size());

        assertTrue(r == b.get(r.getName()));

        assertEquals(r.getName(), b.getRules().get(1).getName());

        // the original is unchanged.
        assertFalse(r == a.get(r.getName()));

        final RuleSet c = a.withRule(BuiltinRules.typeInheritance());

        assertEquals(4, c.size());

        assertEquals("type_inheritance", c.getRules().get(3).getName());

    }

    public void test_getRules_byKind() {

        final RuleSet rs = BuiltinRules.standard();

        final List<Rule> integrity = rs.getRules(RuleKind.INTEGRITY);

        assertEquals(1, integrity.size());

        assertEquals("no_self_reference", integrity.get(0).getName());

        assertEquals(3, rs.getDerivationRules().size());

        assertTrue(rs.getRules(RuleKind.TEMPORAL).isEmpty());

    }

    public void test_contradicts() {

        final RuleSet rs = RuleSet.builder("test").contradicts(is, is_not)
                .functional(Predicate.of("born_in")).build();

        assertTrue(rs.getContradicting(is).contains(is_not));

        assertTrue(rs.getContradicting(is_not).contains(is));

        assertTrue(rs.getContradicting(new Predicate("has")).isEmpty());

        // each pair is reported once.
        assertEquals(1, rs.getContradictingPairs().size());

        assertTrue(rs.isFunctional(new Predicate("born_in")));

        assertFalse(rs.isFunctional(is));

    }

    public void test_contradicts_self() {

        try {
            RuleSet.builder("test").contradicts(is, is);
            fail("Expecting: " + LogicException.class);
        } catch (LogicException ex) {
            assertEquals(LogicException.Kind.RULE_CONFLICT, ex.getKind());
        }

    }

    public void test_standard() {

        final RuleSet rs = BuiltinRules.standard();

        assertNotNull(rs.get("type_inheritance"));

        assertNotNull(rs.get("rdfs:subClassOf_is_transitive"));

        assertNotNull(rs.get("owl:sameAs_is_symmetric"));

        assertEquals(4, rs.getContradictingPairs().size());

    }

}
