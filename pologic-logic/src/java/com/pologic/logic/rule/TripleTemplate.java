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

import java.util.LinkedHashSet;
import java.util.Set;

import com.pologic.graph.model.NodeId;
import com.pologic.graph.model.Predicate;
import com.pologic.graph.model.Value;
import com.pologic.logic.term.IVariable;
import com.pologic.logic.term.IVariableOrConstant;
import com.pologic.logic.term.Terms;

/**
 * A triple each of whose positions is a variable or a constant.
 * 
 * @version $Id$
 */
public class TripleTemplate {

    private final IVariableOrConstant<NodeId> s;

    private final IVariableOrConstant<Predicate> p;

    private final IVariableOrConstant<Value> o;

    public TripleTemplate(final IVariableOrConstant<NodeId> s,
            final IVariableOrConstant<Predicate> p,
            final IVariableOrConstant<Value> o) {

        if (s == null || p == null || o == null)
            throw new IllegalArgumentException();

        this.s = s;

        this.p = p;

        this.o = o;

    }

    /**
     * Parse each position with {@link Terms}: <code>?name</code> is a
     * variable and anything else names a node or predicate.
     */
    public static TripleTemplate of(final String s, final String p,
            final String o) {

        return new TripleTemplate(Terms.subject(s), Terms.predicate(p),
                Terms.object(o));

    }

    /**
     * Variant with a constant object value.
     */
    public static TripleTemplate of(final String s, final String p,
            final Value o) {

        return new TripleTemplate(Terms.subject(s), Terms.predicate(p),
                Terms.object(o));

    }

    public IVariableOrConstant<NodeId> s() {

        return s;

    }

    public IVariableOrConstant<Predicate> p() {

        return p;

    }

    public IVariableOrConstant<Value> o() {

        return o;

    }

    /**
     * The distinct variables in subject, predicate, object order.
     */
    public Set<IVariable<?>> getVariables() {

        final Set<IVariable<?>> vars = new LinkedHashSet<IVariable<?>>();

        if (s.isVar())
            vars.add((IVariable<?>) s);

        if (p.isVar())
            vars.add((IVariable<?>) p);

        if (o.isVar())
            vars.add((IVariable<?>) o);

        return vars;

    }

    public boolean equals(final Object x) {

        if (this == x)
            return true;

        if (!(x instanceof TripleTemplate))
            return false;

        final TripleTemplate t = (TripleTemplate) x;

        return s.equals(t.s) && p.equals(t.p) && o.equals(t.o);

    }

    public int hashCode() {

        return (s.hashCode() * 31 + p.hashCode()) * 31 + o.hashCode();

    }

    public String toString() {

        return "(" + s + " " + p + " " + o + ")";

    }

}
