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

import com.pologic.graph.model.Value;
import com.pologic.logic.term.IBindingSet;
import com.pologic.logic.term.IVariable;
import com.pologic.logic.term.Var;

/**
 * Requires two variables to be bound to different values.
 * 
 * @version $Id$
 */
public class NotEqual implements IConstraint {

    private final IVariable<?> x;

    private final IVariable<?> y;

    public NotEqual(final IVariable<?> x, final IVariable<?> y) {

        if (x == null || y == null)
            throw new IllegalArgumentException();

        if (x.equals(y))
            throw new IllegalArgumentException("Same variable: " + x);

        this.x = x;

        this.y = y;

    }

    public static NotEqual of(final String x, final String y) {

        return new NotEqual(Var.var(x), Var.var(y));

    }

    public boolean accept(final IBindingSet bindings) {

        final Value a = bindings.get(x);

        final Value b = bindings.get(y);

        if (a == null || b == null)
            return false;

        return !a.equals(b);

    }

    public Set<IVariable<?>> getVariables() {

        final Set<IVariable<?>> vars = new LinkedHashSet<IVariable<?>>();

        vars.add(x);

        vars.add(y);

        return vars;

    }

    public String toString() {

        return x + " != " + y;

    }

}
