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

import java.util.concurrent.ConcurrentHashMap;

/**
 * A variable. Variables are canonical: {@link #var(String)} returns the same
 * instance for the same name, whatever the generic type at the call site.
 * Equality is by name. A leading <code>?</code> is not part of the name.
 * 
 * @version $Id$
 */
final public class Var<E> implements IVariable<E>, Comparable<IVariable<?>> {

    final private String name;

    private Var(final String name) {

        this.name = name;

    }

    static private final ConcurrentHashMap<String, Var<?>> vars = new ConcurrentHashMap<String, Var<?>>();

    /**
     * Return the variable having that name.
     * 
     * @param name
     *            The name, with or without a leading <code>?</code>.
     */
    @SuppressWarnings("unchecked")
    static public <E> Var<E> var(String name) {

        if (name == null)
            throw new IllegalArgumentException();

        if (name.startsWith("?"))
            name = name.substring(1);

        if (name.length() == 0)
            throw new IllegalArgumentException();

        Var<?> var = vars.get(name);

        if (var == null) {

            final Var<?> tmp = vars.putIfAbsent(name, var = new Var<E>(name));

            if (tmp != null) {

                // race condition - someone else inserted first.
                var = tmp;

            }

        }

        return (Var<E>) var;

    }

    final public boolean isVar() {

        return true;

    }

    final public boolean isConstant() {

        return false;

    }

    public E get() {

        throw new UnsupportedOperationException();

    }

    public String getName() {

        return name;

    }

    public final boolean equals(final Object o) {

        if (this == o)
            return true;

        if (o instanceof IVariable<?>) {

            return name.equals(((IVariable<?>) o).getName());

        }

        return false;

    }

    public final int hashCode() {

        return name.hashCode();

    }

    public int compareTo(final IVariable<?> o) {

        return name.compareTo(o.getName());

    }

    public String toString() {

        return "?" + name;

    }

}
