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
 * A constant.
 * 
 * @version $Id$
 */
final public class Constant<E> implements IConstant<E> {

    final private E value;

    public Constant(final E value) {

        if (value == null)
            throw new IllegalArgumentException();

        this.value = value;

    }

    final public boolean isVar() {

        return false;

    }

    final public boolean isConstant() {

        return true;

    }

    public E get() {

        return value;

    }

    public String getName() {

        throw new UnsupportedOperationException();

    }

    final public boolean equals(final Object o) {

        if (this == o)
            return true;

        if (!(o instanceof IConstant<?>))
            return false;

        return value.equals(((IConstant<?>) o).get());

    }

    final public int hashCode() {

        return value.hashCode();

    }

    public String toString() {

        return value.toString();

    }

}
