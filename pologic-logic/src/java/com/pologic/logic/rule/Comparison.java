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

import java.util.Collections;
import java.util.Set;

import com.pologic.graph.model.Value;
import com.pologic.graph.model.ValueType;
import com.pologic.logic.term.IBindingSet;
import com.pologic.logic.term.IVariable;
import com.pologic.logic.term.Var;

/**
 * Compares the binding of a variable with a constant. Numeric values
 * (integers and floats) compare by magnitude and strings compare
 * lexically. {@link Op#EQ} and {@link Op#NE} apply to any value. An ordering
 * between values which can not be ordered is not satisfied.
 * 
 * @version $Id$
 */
public class Comparison implements IConstraint {

    public static enum Op {

        LT("<"), LE("<="), GT(">"), GE(">="), EQ("=="), NE("!=");

        private final String symbol;

        private Op(final String symbol) {
            this.symbol = symbol;
        }

        public String toString() {
            return symbol;
        }

    }

    private final IVariable<?> var;

    private final Op op;

    private final Value value;

    public Comparison(final IVariable<?> var, final Op op, final Value value) {

        if (var == null || op == null || value == null)
            throw new IllegalArgumentException();

        this.var = var;

        this.op = op;

        this.value = value;

    }

    public static Comparison of(final String var, final Op op,
            final Value value) {

        return new Comparison(Var.var(var), op, value);

    }

    public boolean accept(final IBindingSet bindings) {

        final Value v = bindings.get(var);

        if (v == null)
            return false;

        if (v.isNumeric() && value.isNumeric()) {

            return test(Double.compare(v.doubleValue(), value.doubleValue()));

        }

        if (op == Op.EQ)
            return v.equals(value);

        if (op == Op.NE)
            return !v.equals(value);

        if (v.getType() == ValueType.STRING
                && value.getType() == ValueType.STRING) {

            return test(v.getLexicalForm().compareTo(value.getLexicalForm()));

        }

        return false;

    }

    private boolean test(final int cmp) {

        switch (op) {
        case LT:
            return cmp < 0;
        case LE:
            return cmp <= 0;
        case GT:
            return cmp > 0;
        case GE:
            return cmp >= 0;
        case EQ:
            return cmp == 0;
        case NE:
            return cmp != 0;
        default:
            throw new AssertionError(op);
        }

    }

    public Set<IVariable<?>> getVariables() {

        return Collections.<IVariable<?>> singleton(var);

    }

    public String toString() {

        return var + " " + op + " " + value;

    }

}
