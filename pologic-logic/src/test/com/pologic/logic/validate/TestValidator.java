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

package com.pologic.logic.validate;

import java.util.Arrays;
import java.util.List;

import com.pologic.graph.model.Predicate;
import com.pologic.graph.model.Triple;
import com.pologic.logic.AbstractLogicTestCase;
import com.pologic.logic.LogicException;
import com.pologic.logic.rule.BuiltinRules;
import com.pologic.logic.rule.NotEqual;
import com.pologic.logic.rule.Rule;
import com.pologic.logic.rule.RuleKind;
import com.pologic.logic.rule.RuleSet;
import com.pologic.logic.rule.Severity;

/**
 * Test suite for {@link Validator}.
 * 
 * @version $Id$
 */
public class TestValidator extends AbstractLogicTestCase {

    public TestValidator() {
    }

    public TestValidator(String name) {
        super(name);
    }

    private Validator validator;

    public void setUp() throws Exception {

        super.setUp();

        validator = new Validator(store);

    }

    public void test_valid() {

        final ValidationResult r = validator.validate(
                Triple.link("a", "knows", "b"), BuiltinRules.standard());

        assertTrue(r.isValid());

        assertTrue(r.getErrors().isEmpty());

        r.assertValid();

    }

    public void test_reject() {

        final ValidationResult r = validator.validate(
                Triple.link("a", "knows", "a"), BuiltinRules.standard());

        assertFalse(r.isValid());

        assertEquals(1, r.getErrors().size());

        final ValidationError e = r.getErrors().get(0);

        assertEquals("no_self_reference", e.getRuleName());

        assertEquals(Severity.ERROR, e.getSeverity());

        assertEquals(ValidationError.Kind.RULE_VIOLATION, e.getKind());

        assertEquals("a refers to itself through knows", e.getMessage());

        try {
            r.assertValid();
            fail("Expecting: " + LogicException.class);
        } catch (LogicException ex) {
            assertEquals(LogicException.Kind.VALIDATION_FAILED, ex.getKind());
        }

        // validation does not modify the graph.
        assertEquals(0, store.count());

    }

    public void test_warningIsNotBlocking() {

        final RuleSet rs = RuleSet.builder("test")
                .add(Rule.builder("no_self_link")
                        .kind(RuleKind.INTEGRITY)
                        .severity(Severity.WARNING)
                        .when("?x", "?p", "?x")
                        .reject("?x links to itself")
                        .build())
                .build();

        final ValidationResult r = validator.validate(
                Triple.link("a", "knows", "a"), rs);

        assertTrue(r.isValid());

        assertEquals(1, r.getErrors(Severity.WARNING).size());

        assertTrue(r.getErrors(Severity.ERROR).isEmpty());

    }

    public void test_inferenceRulesAreNotChecked() {

        final RuleSet rs = RuleSet.builder("test")
                .add(Rule.builder("reject_all")
                        .kind(RuleKind.INFERENCE)
                        .when("?x", "?p", "?y")
                        .reject("no")
                        .build())
                .build();

        assertTrue(validator.validate(Triple.link("a", "knows", "b"), rs)
                .isValid());

    }

    private static RuleSet authority() {

        return RuleSet.builder("authority")
                .add(Rule.builder("publish_requires_editor")
                        .kind(RuleKind.AUTHORITY)
                        .when("?u", "publishes", "?doc")
                        .require("?u", "has_role", "editor")
                        .build())
                .build();

    }

    public void test_require() {

        final Triple t = Triple.link("alice", "publishes", "doc1");

        final ValidationResult r = validator.validate(t, authority());

        assertFalse(r.isValid());

        assertEquals(ValidationError.Kind.REQUIREMENT_UNSATISFIED, r
                .getErrors().get(0).getKind());

        add("alice", "has_role", "editor");

        assertTrue(validator.validate(t, authority()).isValid());

    }

    public void test_require_satisfiedByBatch() {

        final List<Triple> batch = Arrays.asList(
                Triple.link("bob", "publishes", "doc2"),
                Triple.link("bob", "has_role", "editor"));

        assertTrue(validator.validate(batch, authority()).isValid());

    }

    public void test_joinWithGraph() {

        final RuleSet rs = RuleSet.builder("test")
                .add(Rule.builder("no_banned_members")
                        .kind(RuleKind.INTEGRITY)
                        .when("?x", "member_of", "?g")
                        .when("?x", "status", "banned")
                        .reject("?x is banned and may not join ?g")
                        .build())
                .build();

        add("mallory", "status", "banned");

        final ValidationResult r = validator.validate(
                Triple.link("mallory", "member_of", "club"), rs);

        assertFalse(r.isValid());

        assertEquals("mallory is banned and may not join club", r
                .getErrors().get(0).getMessage());

        assertTrue(validator.validate(
                Triple.link("alice", "member_of", "club"), rs).isValid());

        // the candidate can match either condition.
        add("trent", "member_of", "club");

        assertFalse(validator.validate(
                Triple.link("trent", "status", "banned"), rs).isValid());

    }

    /**
     * The candidate matches the second condition while the constraint reads
     * a variable bound by the first.
     */
    public void test_constraintOnEarlierCondition() {

        final RuleSet rs = RuleSet.builder("test")
                .add(Rule.builder("owner_edits_alone")
                        .kind(RuleKind.AUTHORITY)
                        .when("?x", "owner", "?d")
                        .when("?y", "editor", "?d")
                        .where(NotEqual.of("x", "y"))
                        .reject("?y may not edit ?d owned by ?x")
                        .build())
                .build();

        add("alice", "owner", "doc");

        final ValidationResult r = validator.validate(
                Triple.link("bob", "editor", "doc"), rs);

        assertFalse(r.isValid());

        assertEquals(1, r.getErrors().size());

        assertEquals("bob may not edit doc owned by alice", r.getErrors()
                .get(0).getMessage());

        assertTrue(validator.validate(Triple.link("alice", "editor", "doc"),
                rs).isValid());

    }

    private static RuleSet functional() {

        return RuleSet.builder("test").functional(new Predicate("born_in"))
                .build();

    }

    public void test_functional_againstGraph() {

        add("alice", "born_in", "paris");

        final ValidationResult r = validator.validate(
                Triple.link("alice", "born_in", "rome"), functional());

        assertFalse(r.isValid());

        assertEquals(1, r.getErrors(Severity.FATAL).size());

        assertEquals(ValidationError.Kind.CONTRADICTION,
                r.getErrors().get(0).getKind());

        try {
            r.assertValid();
            fail("Expecting: " + LogicException.class);
        } catch (LogicException ex) {
            assertEquals(LogicException.Kind.CONTRADICTION, ex.getKind());
        }

        // the same object again is not a conflict.
        assertTrue(validator.validate(Triple.link("alice", "born_in", "paris"),
                functional()).isValid());

    }

    public void test_functional_withinBatch() {

        final List<Triple> batch = Arrays.asList(
                Triple.link("bob", "born_in", "paris"),
                Triple.link("bob", "born_in", "rome"),
                Triple.link("carol", "born_in", "rome"));

        final ValidationResult r = validator.validate(batch, functional());

        assertFalse(r.isValid());

        // the conflict is reported once.
        assertEquals(1, r.getErrors().size());

    }

    public void test_contradictingPair() {

        add("door", "is", "open");

        final ValidationResult r = validator.validate(
                Triple.link("door", "is_not", "open"), BuiltinRules.standard());

        assertFalse(r.isValid());

        assertEquals(Severity.ERROR, r.getErrors().get(0).getSeverity());

        assertEquals(ValidationError.Kind.CONTRADICTION,
                r.getErrors().get(0).getKind());

        assertTrue(validator.validate(Triple.link("door", "is_not", "closed"),
                BuiltinRules.standard()).isValid());

        assertFalse(validator.validate(Arrays.asList(
                Triple.link("cat", "can", "fly"),
                Triple.link("cat", "cannot", "fly")), BuiltinRules.standard())
                .isValid());

    }

    public void test_findContradictions() {

        final RuleSet rs = RuleSet.builder("test")
                .addAll(BuiltinRules.standard())
                .functional(new Predicate("born_in"))
                .build();

        assertTrue(validator.findContradictions(rs).isEmpty());

        add("door", "is", "open");
        add("door", "is_not", "open");
        add("alice", "born_in", "paris");
        add("alice", "born_in", "rome");
        add("bob", "born_in", "rome");

        final List<Contradiction> a = validator.findContradictions(rs);

        assertEquals(2, a.size());

        for (Contradiction c : a) {

            assertEquals(2, c.getTriples().size());

        }

    }

}
