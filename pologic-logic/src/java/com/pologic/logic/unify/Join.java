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
 * Created on Mar 12, 2026
 */

package com.pologic.logic.unify;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.apache.log4j.Logger;

import com.pologic.graph.model.Triple;
import com.pologic.graph.model.TriplePattern;
import com.pologic.graph.store.ITripleSource;
import com.pologic.logic.rule.Condition;
import com.pologic.logic.term.HashBindingSet;
import com.pologic.logic.term.IBindingSet;

/**
 * Nested-loop evaluation of a conjunction of {@link Condition}s against an
 * {@link ITripleSource}. Conditions are evaluated in the declared order. For
 * each partial solution the next condition's template is specialized with
 * the bindings so far and handed to the source as a pattern.
 * 
 * @version $Id$
 */
public class Join {

    private static final transient Logger log = Logger.getLogger(Join.class);

    private final ITripleSource source;

    public Join(final ITripleSource source) {

        if (source == null)
            throw new IllegalArgumentException();

        this.source = source;

    }

    public List<Solution> solve(final List<Condition> conditions) {

        return solve(conditions, new HashBindingSet());

    }

    /**
     * Return every solution of the conditions which extends the initial
     * bindings.
     */
    public List<Solution> solve(final List<Condition> conditions,
            final IBindingSet initial) {

        if (conditions == null || initial == null)
            throw new IllegalArgumentException();

        return solve(conditions, initial, -1, null);

    }

    /**
     * Return every solution of the conditions in which the condition at the
     * given position is matched by the given triple. The other conditions are
     * matched against the source. Conditions, and so their constraints, are
     * still evaluated in the declared order.
     */
    public List<Solution> solve(final List<Condition> conditions,
            final int position, final Triple triple) {

        if (conditions == null || triple == null)
            throw new IllegalArgumentException();

        if (position < 0 || position >= conditions.size())
            throw new IllegalArgumentException();

        // pre-bind the template so the conditions before the position are
        // specialized by it. Its constraints are applied at the position.
        final IBindingSet initial = Unifier.unify(conditions.get(position)
                .getTemplate(), triple);

        if (initial == null)
            return new ArrayList<Solution>();

        return solve(conditions, initial, position, triple);

    }

    private List<Solution> solve(final List<Condition> conditions,
            final IBindingSet initial, final int position, final Triple triple) {

        List<Solution> partials = new ArrayList<Solution>();

        partials.add(new Solution(initial, Collections.<Triple> emptyList()));

        for (int i = 0; i < conditions.size(); i++) {

            final Condition c = conditions.get(i);

            final List<Solution> next = new ArrayList<Solution>();

            for (Solution partial : partials) {

                final List<Triple> matches;

                if (i == position) {

                    matches = Collections.singletonList(triple);

                } else {

                    final TriplePattern pattern = Unifier.toPattern(
                            c.getTemplate(), partial.getBindings());

                    if (pattern == null)
                        continue;

                    matches = source.find(pattern);

                }

                for (Triple t : matches) {

                    final IBindingSet b = Unifier.unify(c, t,
                            partial.getBindings());

                    if (b != null)
                        next.add(partial.extend(b, t));

                }

            }

            if (log.isDebugEnabled())
                log.debug(c + " : " + partials.size() + " => " + next.size());

            if (next.isEmpty())
                return next;

            partials = next;

        }

        return partials;

    }

}
