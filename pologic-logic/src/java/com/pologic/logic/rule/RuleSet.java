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
 * Created on Mar 11, 2026
 */

package com.pologic.logic.rule;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.pologic.graph.model.Predicate;
import com.pologic.logic.LogicException;

/**
 * An immutable, named collection of {@link Rule}s with unique names, kept in
 * insertion order. A rule set also declares the <em>functional</em>
 * predicates (at most one object per subject) and the pairs of
 * <em>contradicting</em> predicates (the same subject and object may not
 * appear under both) which the validator enforces.
 * 
 * @version $Id$
 */
public class RuleSet {

    private final String name;

    private final LinkedHashMap<String, Rule> rules;

    private final Set<Predicate> functional;

    private final Map<Predicate, Set<Predicate>> contradictions;

    private RuleSet(final Builder b) {

        this.name = b.name;
        this.rules = new LinkedHashMap<String, Rule>(b.rules);
        this.functional = Collections
                .unmodifiableSet(new LinkedHashSet<Predicate>(b.functional));

        final Map<Predicate, Set<Predicate>> m = new LinkedHashMap<Predicate, Set<Predicate>>();

        for (Map.Entry<Predicate, Set<Predicate>> e : b.contradictions
                .entrySet()) {

            m.put(e.getKey(),
                    Collections.unmodifiableSet(new LinkedHashSet<Predicate>(e
                            .getValue())));

        }

        this.contradictions = Collections.unmodifiableMap(m);

    }

    public static Builder builder(final String name) {

        return new Builder(name);

    }

    public String getName() {
        return name;
    }

    public int size() {
        return rules.size();
    }

    /**
     * Return the named rule -or- <code>null</code>.
     */
    public Rule get(final String ruleName) {

        return rules.get(ruleName);

    }

    public List<Rule> getRules() {

        return Collections.unmodifiableList(new ArrayList<Rule>(rules.values()));

    }

    /**
     * The rules of the given kinds, in insertion order.
     */
    public List<Rule> getRules(final RuleKind... kinds) {

        final Set<RuleKind> set = new LinkedHashSet<RuleKind>(
                Arrays.asList(kinds));

        final List<Rule> a = new ArrayList<Rule>();

        for (Rule r : rules.values()) {

            if (set.contains(r.getKind()))
                a.add(r);

        }

        return a;

    }

    /**
     * The rules having at least one {@link Action.Assert}.
     */
    public List<Rule> getDerivationRules() {

        final List<Rule> a = new ArrayList<Rule>();

        for (Rule r : rules.values()) {

            if (r.isDerivation())
                a.add(r);

        }

        return a;

    }

    public Set<Predicate> getFunctionalPredicates() {

        return functional;

    }

    public boolean isFunctional(final Predicate p) {

        return functional.contains(p);

    }

    /**
     * The predicates declared to contradict <i>p</i> (empty if none).
     */
    public Set<Predicate> getContradicting(final Predicate p) {

        final Set<Predicate> s = contradictions.get(p);

        return s == null ? Collections.<Predicate> emptySet() : s;

    }

    /**
     * Every contradicting pair, each reported once.
     */
    public List<Predicate[]> getContradictingPairs() {

        final List<Predicate[]> a = new ArrayList<Predicate[]>();

        final Set<Predicate> seen = new LinkedHashSet<Predicate>();

        for (Map.Entry<Predicate, Set<Predicate>> e : contradictions
                .entrySet()) {

            for (Predicate q : e.getValue()) {

                if (!seen.contains(q))
                    a.add(new Predicate[] { e.getKey(), q });

            }

            seen.add(e.getKey());

        }

        return a;

    }

    /**
     * Return a new rule set in which the rule replaces the rule of the same
     * name, or is appended if there is none.
     */
    public RuleSet withRule(final Rule rule) {

        return toBuilder().replace(rule).build();

    }

    /**
     * Return a builder initialized with this rule set.
     */
    public Builder toBuilder() {

        final Builder b = new Builder(name);

        b.rules.putAll(rules);

        b.functional.addAll(functional);

        for (Map.Entry<Predicate, Set<Predicate>> e : contradictions
                .entrySet()) {

            b.contradictions.put(e.getKey(),
                    new LinkedHashSet<Predicate>(e.getValue()));

        }

        return b;

    }

    public String toString() {

        return "RuleSet{name=" + name + ",rules=" + rules.keySet()
                + ",functional=" + functional + "}";

    }

    /**
     * Collects the rules and declarations of a {@link RuleSet}.
     */
    public static class Builder {

        private final String name;

        private final LinkedHashMap<String, Rule> rules = new LinkedHashMap<String, Rule>();

        private final Set<Predicate> functional = new LinkedHashSet<Predicate>();

        private final Map<Predicate, Set<Predicate>> contradictions = new LinkedHashMap<Predicate, Set<Predicate>>();

        private Builder(final String name) {

            if (name == null)
                throw new IllegalArgumentException();

            this.name = name;

        }

        /**
         * Add a rule.
         * 
         * @throws LogicException
         *             of kind {@link LogicException.Kind#INVALID_RULE} if a
         *             rule of the same name was already added.
         */
        public Builder add(final Rule rule) {

            if (rule == null)
                throw new IllegalArgumentException();

            if (rules.containsKey(rule.getName()))
                throw new LogicException(LogicException.Kind.INVALID_RULE,
                        "Duplicate rule name: " + rule.getName());

            rules.put(rule.getName(), rule);

            return this;

        }

        public Builder addAll(final RuleSet other) {

            for (Rule r : other.getRules()) {

                add(r);

            }

            functional.addAll(other.functional);

            for (Predicate[] pair : other.getContradictingPairs()) {

                contradicts(pair[0], pair[1]);

            }

            return this;

        }

        /**
         * Add the rule, replacing any rule of the same name in place.
         */
        public Builder replace(final Rule rule) {

            if (rule == null)
                throw new IllegalArgumentException();

            rules.put(rule.getName(), rule);

            return this;

        }

        /**
         * Declare predicates which may have at most one object per subject.
         */
        public Builder functional(final Predicate... predicates) {

            for (Predicate p : predicates) {

                if (p == null)
                    throw new IllegalArgumentException();

                functional.add(p);

            }

            return this;

        }

        /**
         * Declare that no subject and object may appear under both
         * predicates.
         * 
         * @throws LogicException
         *             of kind {@link LogicException.Kind#RULE_CONFLICT} if the
         *             two predicates are the same.
         */
        public Builder contradicts(final Predicate a, final Predicate b) {

            if (a == null || b == null)
                throw new IllegalArgumentException();

            if (a.equals(b))
                throw new LogicException(LogicException.Kind.RULE_CONFLICT,
                        "Predicate can not contradict itself: " + a);

            link(a, b);

            link(b, a);

            return this;

        }

        private void link(final Predicate a, final Predicate b) {

            Set<Predicate> s = contradictions.get(a);

            if (s == null) {

                s = new LinkedHashSet<Predicate>();

                contradictions.put(a, s);

            }

            s.add(b);

        }

        public RuleSet build() {

            return new RuleSet(this);

        }

    }

}
