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

import java.util.Iterator;
import java.util.Map;

import com.pologic.graph.model.Value;

/**
 * A set of variable bindings. Every binding is a {@link Value}: a subject
 * binds as a node reference and a predicate binds as a reference to the
 * named node of the same name (see {@link Terms}), so a variable shared
 * between positions compares consistently.
 * 
 * @version $Id$
 */
public interface IBindingSet extends Cloneable {

    /**
     * Return <code>true</code> iff the variable is bound.
     */
    boolean isBound(IVariable<?> var);

    /**
     * Return the binding for the variable -or- <code>null</code> if it is
     * not bound.
     */
    Value get(IVariable<?> var);

    /**
     * Bind the variable, replacing any existing binding.
     */
    void set(IVariable<?> var, Value val);

    void clear(IVariable<?> var);

    /**
     * Visits the bindings in the order in which they were made. The
     * iterator does not support removal.
     */
    Iterator<Map.Entry<IVariable<?>, Value>> iterator();

    int size();

    /**
     * Return a shallow copy of the binding set.
     */
    IBindingSet clone();

    /**
     * Two binding sets are equal iff they bind the same variables to equal
     * values.
     */
    boolean equals(Object o);

    int hashCode();

}
