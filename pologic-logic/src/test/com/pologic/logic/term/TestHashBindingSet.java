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
 * Created on Mar 15, 2026
 */

package com.pologic.logic.term;

import java.util.Iterator;
import java.util.Map;

import junit.framework.TestCase;

import com.pologic.graph.model.Value;

/**
 * Test suite for {@link Var} and {@link HashBindingSet}.
 * 
 * @version $Id$
 */
public class TestHashBindingSet extends TestCase {

    public TestHashBindingSet() {
    }

    public TestHashBindingSet(String name) {
        super(name);
    }

    public void test_var_canonical() {

        final Var<?> x = Var.var("x");

        assertTrue(x == Var.var("x"));

        assertTrue(x == Var.var("?x"));

        assertEquals("x", x.getName());

        assertEquals("?x", x.toString());

        assertTrue(x.isVar());

        assertFalse(x.isConstant());

        assertFalse(x.equals(Var.var("y")));

    }

    public void test_bind() {

        final IVariable<?> x = Var.var("x");

        final IVariable<?> y = Var.var("y");

        final IBindingSet b = new HashBindingSet();

        assertEquals(0, b.size());

        assertFalse(b.isBound(x));

        assertNull(b.get(x));

        b.set(x, Value.integer(1));

        b.set(y, Value.string("a"));

        assertTrue(b.isBound(x));

        assertEquals(Value.integer(1), b.get(x));

        assertEquals(2, b.size());

        // bindings are visited in the order in which they were made.
        final Iterator<Map.Entry<IVariable<?>, Value>> itr = b.iterator();

        assertEquals(x, itr.next().getKey());

        assertEquals(y, itr.next().getKey());

        assertFalse(itr.hasNext());

        b.clear(x);

        assertFalse(b.isBound(x));

        assertEquals(1, b.size());

    }

    public void test_clone_isIndependent() {

        final IVariable<?> x = Var.var("x");

        final IBindingSet a = new HashBindingSet();

        a.set(x, Value.node("a"));

        final IBindingSet b = a.clone();

        assertEquals(a, b);

        assertEquals(a.hashCode(), b.hashCode());

        b.set(x, Value.node("b"));

        assertEquals(Value.node("a"), a.get(x));

        assertFalse(a.equals(b));

    }

    public void test_equals_ignoresOrder() {

        final IVariable<?> x = Var.var("x");

        final IVariable<?> y = Var.var("y");

        final IBindingSet a = new HashBindingSet();

        a.set(x, Value.integer(1));

        a.set(y, Value.integer(2));

        final IBindingSet b = new HashBindingSet();

        b.set(y, Value.integer(2));

        b.set(x, Value.integer(1));

        assertEquals(a, b);

        assertEquals(a.hashCode(), b.hashCode());

    }

}
