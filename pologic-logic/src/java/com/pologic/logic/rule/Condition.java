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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import com.pologic.logic.term.IBindingSet;

/**
 * A {@link TripleTemplate} which must match some triple, optionally
 * filtered by {@link IConstraint}s over the variables bound so far.
 * 
 * @version $Id$
 */
public class Condition {

    private final TripleTemplate template;

    private final List<IConstraint> constraints;

    public Condition(final TripleTemplate template,
            final IConstraint... constraints) {

        this(template, Arrays.asList(constraints));

    }

    public Condition(final TripleTemplate template,
            final List<IConstraint> constraints) {

        if (template == null)
            throw new IllegalArgumentException();

        if (constraints == null)
            throw new IllegalArgumentException();

        this.template = template;

        this.constraints = Collections
                .unmodifiableList(new ArrayList<IConstraint>(constraints));

    }

    public TripleTemplate getTemplate() {

        return template;

    }

    public List<IConstraint> getConstraints() {

        return constraints;

    }

    /**
     * Return <code>true</code> iff every constraint accepts the bindings.
     */
    public boolean accept(final IBindingSet bindings) {

        for (IConstraint c : constraints) {

            if (!c.accept(bindings))
                return false;

        }

        return true;

    }

    /**
     * A copy having the additional constraint.
     */
    public Condition and(final IConstraint c) {

        final List<IConstraint> a = new ArrayList<IConstraint>(constraints);

        a.add(c);

        return new Condition(template, a);

    }

    public String toString() {

        return constraints.isEmpty() ? template.toString() : template
                + " where " + constraints;

    }

}
