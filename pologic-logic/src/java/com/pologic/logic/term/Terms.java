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
 * Created on Mar 10, 2026
 */

package com.pologic.logic.term;

import com.pologic.graph.model.NodeId;
import com.pologic.graph.model.Predicate;
import com.pologic.graph.model.Value;

/**
 * Factory for terms and the conversions between the typed positions of a
 * triple and the {@link Value}s held by an {@link IBindingSet}.
 * <p>
 * The string factories treat a leading <code>?</code> as a variable and
 * anything else as the name of a constant.
 * 
 * @version $Id$
 */
public class Terms {

    private Terms() {

    }

    public static IVariableOrConstant<NodeId> subject(final String s) {

        if (s.startsWith("?"))
            return Var.var(s);

        return new Constant<NodeId>(NodeId.named(s));

    }

    public static IVariableOrConstant<Predicate> predicate(final String s) {

        if (s.startsWith("?"))
            return Var.var(s);

        return new Constant<Predicate>(new Predicate(s));

    }

    /**
     * An object term. A constant is a reference to the named node.
     */
    public static IVariableOrConstant<Value> object(final String s) {

        if (s.startsWith("?"))
            return Var.var(s);

        return new Constant<Value>(Value.node(s));

    }

    public static IVariableOrConstant<Value> object(final Value v) {

        return new Constant<Value>(v);

    }

    /**
     * The binding form of a subject.
     */
    public static Value asValue(final NodeId id) {

        return Value.node(id);

    }

    /**
     * The binding form of a predicate.
     */
    public static Value asValue(final Predicate p) {

        return Value.node(NodeId.named(p.getName()));

    }

    /**
     * Return the subject for a binding -or- <code>null</code> if the binding
     * is not a node reference.
     */
    public static NodeId toSubject(final Value v) {

        return v.isNode() ? v.asNode() : null;

    }

    /**
     * Return the predicate for a binding -or- <code>null</code> if the
     * binding is not a reference to a named node.
     */
    public static Predicate toPredicate(final Value v) {

        if (!v.isNode() || !v.asNode().isNamed())
            return null;

        return new Predicate(v.asNode().getLabel());

    }

}
