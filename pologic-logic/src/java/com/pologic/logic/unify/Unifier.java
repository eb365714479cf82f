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

package com.pologic.logic.unify;

import com.pologic.graph.model.NodeId;
import com.pologic.graph.model.Predicate;
import com.pologic.graph.model.Triple;
import com.pologic.graph.model.TriplePattern;
import com.pologic.graph.model.Value;
import com.pologic.logic.rule.Condition;
import com.pologic.logic.rule.TripleTemplate;
import com.pologic.logic.term.HashBindingSet;
import com.pologic.logic.term.IBindingSet;
import com.pologic.logic.term.IVariable;
import com.pologic.logic.term.IVariableOrConstant;
import com.pologic.logic.term.Terms;

/**
 * Unification of {@link TripleTemplate}s with triples and patterns, and
 * substitution of bindings into templates. None of these methods modify the
 * binding set they are given.
 * 
 * @version $Id$
 */
public class Unifier {

    private Unifier() {

    }

    /**
     * Unify the template with a concrete triple.
     * 
     * @return The bindings extended with the template's variables -or-
     *         <code>null</code> if a constant or an existing binding
     *         disagrees with the triple.
     */
    public static IBindingSet unify(final TripleTemplate t,
            final Triple triple, final IBindingSet bindings) {

        if (t == null || triple == null || bindings == null)
            throw new IllegalArgumentException();

        final IBindingSet out = bindings.clone();

        if (!bind(t.s(), Terms.asValue(triple.getSubject()), out))
            return null;

        if (!bind(t.p(), Terms.asValue(triple.getPredicate()), out))
            return null;

        if (!bind(t.o(), triple.getObject(), out))
            return null;

        return out;

    }

    /**
     * Unify the condition's template with the triple and then apply its
     * constraints.
     * 
     * @return The extended bindings -or- <code>null</code>.
     */
    public static IBindingSet unify(final Condition c, final Triple triple,
            final IBindingSet bindings) {

        final IBindingSet out = unify(c.getTemplate(), triple, bindings);

        if (out == null || !c.accept(out))
            return null;

        return out;

    }

    /**
     * Unify the template with a goal pattern. Specified fields of the goal
     * bind the template's variables. Unspecified fields match anything.
     * 
     * @return The extended bindings -or- <code>null</code>.
     */
    public static IBindingSet unify(final TripleTemplate t,
            final TriplePattern goal, final IBindingSet bindings) {

        final IBindingSet out = bindings.clone();

        if (goal.getSubject() != null
                && !bind(t.s(), Terms.asValue(goal.getSubject()), out))
            return null;

        if (goal.getPredicate() != null
                && !bind(t.p(), Terms.asValue(goal.getPredicate()), out))
            return null;

        if (goal.getObject() != null && !bind(t.o(), goal.getObject(), out))
            return null;

        return out;

    }

    /**
     * Return a new binding set unifying the template with the triple.
     */
    public static IBindingSet unify(final TripleTemplate t, final Triple triple) {

        return unify(t, triple, new HashBindingSet());

    }

    private static boolean bind(final IVariableOrConstant<?> term,
            final Value val, final IBindingSet out) {

        if (term.isConstant())
            return constantValue(term).equals(val);

        final IVariable<?> var = (IVariable<?>) term;

        final Value existing = out.get(var);

        if (existing == null) {

            out.set(var, val);

            return true;

        }

        return existing.equals(val);

    }

    /**
     * The binding form of a constant term.
     */
    private static Value constantValue(final IVariableOrConstant<?> term) {

        final Object o = term.get();

        if (o instanceof NodeId)
            return Terms.asValue((NodeId) o);

        if (o instanceof Predicate)
            return Terms.asValue((Predicate) o);

        return (Value) o;

    }

    /**
     * Return the pattern selecting the triples which could unify with the
     * template under the bindings. Unbound variables become unspecified
     * fields.
     * 
     * @return The pattern -or- <code>null</code> if a binding can not
     *         appear in its position (for example a literal bound to a
     *         variable in the subject position).
     */
    public static TriplePattern toPattern(final TripleTemplate t,
            final IBindingSet bindings) {

        NodeId s = null;
        Predicate p = null;
        Value o = null;

        final Value sv = resolve(t.s(), bindings);

        if (sv != null) {

            s = Terms.toSubject(sv);

            if (s == null)
                return null;

        }

        final Value pv = resolve(t.p(), bindings);

        if (pv != null) {

            p = Terms.toPredicate(pv);

            if (p == null)
                return null;

        }

        o = resolve(t.o(), bindings);

        return new TriplePattern(s, p, o);

    }

    /**
     * Return the triple obtained by substituting the bindings into the
     * template.
     * 
     * @return The triple -or- <code>null</code> if some variable is unbound
     *         or a binding can not appear in its position.
     */
    public static Triple substitute(final TripleTemplate t,
            final IBindingSet bindings) {

        final TriplePattern pattern = toPattern(t, bindings);

        if (pattern == null || !pattern.isFullyBound())
            return null;

        return pattern.toTriple();

    }

    /**
     * The value of a constant, the binding of a variable, or
     * <code>null</code> for an unbound variable.
     */
    private static Value resolve(final IVariableOrConstant<?> term,
            final IBindingSet bindings) {

        if (term.isConstant())
            return constantValue(term);

        return bindings.get((IVariable<?>) term);

    }

}
