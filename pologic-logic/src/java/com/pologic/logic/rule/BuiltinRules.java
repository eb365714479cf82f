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

package com.pologic.logic.rule;

import com.pologic.graph.model.Predicate;

/**
 * Factories for commonly used rules and the standard rule set.
 * 
 * @version $Id$
 */
public class BuiltinRules {

    private BuiltinRules() {

    }

    /**
     * Rejects a triple whose object is its own subject.
     */
    public static Rule noSelfReference() {

        return Rule.builder("no_self_reference")
                .kind(RuleKind.INTEGRITY)
                .severity(Severity.ERROR)
                .description("A node may not refer to itself")
                .when("?x", "?p", "?x")
                .reject("?x refers to itself through ?p")
                .build();

    }

    /**
     * <code>(x p y) =&gt; (y p x)</code>
     */
    public static Rule symmetric(final Predicate p) {

        final String n = p.getName();

        return Rule.builder(n + "_is_symmetric")
                .kind(RuleKind.INFERENCE)
                .when("?x", n, "?y")
                .then("?y", n, "?x")
                .build();

    }

    /**
     * <code>(x p y) =&gt; (y q x)</code>
     */
    public static Rule inverse(final Predicate p, final Predicate q) {

        return Rule.builder(p.getName() + "_inverse_of_" + q.getName())
                .kind(RuleKind.INFERENCE)
                .when("?x", p.getName(), "?y")
                .then("?y", q.getName(), "?x")
                .build();

    }

    /**
     * <code>(x p y) (y p z) =&gt; (x p z)</code>
     */
    public static Rule transitive(final Predicate p) {

        final String n = p.getName();

        return Rule.builder(n + "_is_transitive")
                .kind(RuleKind.INFERENCE)
                .when("?x", n, "?y")
                .when("?y", n, "?z")
                .then("?x", n, "?z")
                .build();

    }

    /**
     * <code>(x rdf:type c) (c rdfs:subClassOf d) =&gt; (x rdf:type d)</code>
     */
    public static Rule typeInheritance() {

        final String type = Predicate.RDF_TYPE.getName();

        return Rule.builder("type_inheritance")
                .kind(RuleKind.INFERENCE)
                .when("?x", type, "?c")
                .when("?c", Predicate.RDFS_SUBCLASS_OF.getName(), "?d")
                .then("?x", type, "?d")
                .build();

    }

    /**
     * The rule set used when none is given: self references are rejected,
     * types are inherited along a transitive subclass relation,
     * <code>owl:sameAs</code> is symmetric and the usual opposing predicates
     * contradict each other.
     */
    public static RuleSet standard() {

        return RuleSet.builder("standard")
                .add(noSelfReference())
                .add(typeInheritance())
                .add(transitive(Predicate.RDFS_SUBCLASS_OF))
                .add(symmetric(Predicate.OWL_SAME_AS))
                .contradicts(new Predicate("is"), new Predicate("is_not"))
                .contradicts(new Predicate("has"), new Predicate("lacks"))
                .contradicts(new Predicate("can"), new Predicate("cannot"))
                .contradicts(new Predicate("allows"), new Predicate("forbids"))
                .build();

    }

}
