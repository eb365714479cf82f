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

import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

import com.pologic.graph.model.Value;

/**
 * {@link IBindingSet} backed by a {@link LinkedHashMap}.
 * 
 * @version $Id$
 */
public class HashBindingSet implements IBindingSet {

    /**
     * Note: A {@link LinkedHashMap} provides a fast iterator, which we use a
     * bunch.
     */
    private final LinkedHashMap<IVariable<?>, Value> map;

    private int hash;

    /**
     * New empty binding set.
     */
    public HashBindingSet() {

        map = new LinkedHashMap<IVariable<?>, Value>();

    }

    /**
     * Copy constructor.
     */
    public HashBindingSet(final IBindingSet src) {

        if (src == null)
            throw new IllegalArgumentException();

        map = new LinkedHashMap<IVariable<?>, Value>(src.size());

        final Iterator<Map.Entry<IVariable<?>, Value>> itr = src.iterator();

        while (itr.hasNext()) {

            final Map.Entry<IVariable<?>, Value> e = itr.next();

            map.put(e.getKey(), e.getValue());

        }

    }

    public boolean isBound(final IVariable<?> var) {

        if (var == null)
            throw new IllegalArgumentException();

        return map.containsKey(var);

    }

    public Value get(final IVariable<?> var) {

        if (var == null)
            throw new IllegalArgumentException();

        return map.get(var);

    }

    public void set(final IVariable<?> var, final Value val) {

        if (var == null)
            throw new IllegalArgumentException();

        if (val == null)
            throw new IllegalArgumentException();

        map.put(var, val);

        // clear the hash code.
        hash = 0;

    }

    public void clear(final IVariable<?> var) {

        if (var == null)
            throw new IllegalArgumentException();

        map.remove(var);

        // clear the hash code.
        hash = 0;

    }

    public Iterator<Map.Entry<IVariable<?>, Value>> iterator() {

        return Collections.unmodifiableMap(map).entrySet().iterator();

    }

    public int size() {

        return map.size();

    }

    public HashBindingSet clone() {

        return new HashBindingSet(this);

    }

    public boolean equals(final Object t) {

        if (this == t)
            return true;

        if (!(t instanceof IBindingSet))
            return false;

        final IBindingSet o = (IBindingSet) t;

        if (size() != o.size())
            return false;

        for (Map.Entry<IVariable<?>, Value> e : map.entrySet()) {

            if (!e.getValue().equals(o.get(e.getKey())))
                return false;

        }

        return true;

    }

    public int hashCode() {

        if (hash == 0) {

            int result = 0;

            for (Map.Entry<IVariable<?>, Value> e : map.entrySet()) {

                result ^= e.getKey().hashCode() * 31 + e.getValue().hashCode();

            }

            hash = result;

        }

        return hash;

    }

    public String toString() {

        final StringBuilder sb = new StringBuilder();

        sb.append("{ ");

        int i = 0;

        for (Map.Entry<IVariable<?>, Value> e : map.entrySet()) {

            if (i > 0)
                sb.append(", ");

            sb.append(e.getKey());
            sb.append("=");
            sb.append(e.getValue());

            i++;

        }

        sb.append(" }");

        return sb.toString();

    }

}
