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

/**
 * Abstraction models either a constant or an unbound variable in one
 * position of a rule's triple template.
 * 
 * @param <E>
 *            The type of the position: a subject
 *            {@link com.pologic.graph.model.NodeId}, a
 *            {@link com.pologic.graph.model.Predicate} or an object
 *            {@link com.pologic.graph.model.Value}.
 * 
 * @version $Id$
 */
public interface IVariableOrConstant<E> {

    /**
     * Return <code>true</code> iff this is a variable.
     */
    boolean isVar();

    /**
     * Return <code>true</code> iff this is a constant.
     */
    boolean isConstant();

    /**
     * Return the constant value.
     * 
     * @throws UnsupportedOperationException
     *             if this is a variable.
     */
    E get();

    /**
     * Return the name of a variable.
     * 
     * @throws UnsupportedOperationException
     *             if this is not a variable.
     */
    String getName();

}
