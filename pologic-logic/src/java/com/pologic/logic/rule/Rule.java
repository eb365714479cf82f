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
import java.util.Collections;
import java.util.List;

/**
 * An immutable rule: a conjunction of {@link Condition}s and the
 * {@link Action}s taken for each of their joint solutions. Use
 * {@link #builder(String)} to create one.
 * 
 * @version $Id$
 */
public class Rule {

    private final String name;

    private final RuleKind kind;

    private final Severity severity;

    private final String description;

    private final List<Condition> conditions;

    private final List<Action> actions;

    Rule(final String name, final RuleKind kind, final Severity severity,
            final String description, final List<Condition> conditions,
            final List<Action> actions) {

        this.name = name;
        this.kind = kind;
        this.severity = severity;
        this.description = description;
        this.conditions = Collections
                .unmodifiableList(new ArrayList<Condition>(conditions));
        this.actions = Collections.unmodifiableList(new ArrayList<Action>(
                actions));

    }

    public static RuleBuilder builder(final String name) {

        return new RuleBuilder(name);

    }

    public String getName() {
        return name;
    }

    public RuleKind getKind() {
        return kind;
    }

    public Severity getSeverity() {
        return severity;
    }

    /**
     * A human readable description (may be empty).
     */
    public String getDescription() {
        return description;
    }

    public List<Condition> getConditions() {
        return conditions;
    }

    public List<Action> getActions() {
        return actions;
    }

    /**
     * The {@link Action.Assert} actions, in declared order.
     */
    public List<Action.Assert> getAsserts() {

        final List<Action.Assert> a = new ArrayList<Action.Assert>();

        for (Action action : actions) {

            if (action instanceof Action.Assert)
                a.add((Action.Assert) action);

        }

        return a;

    }

    public boolean isDerivation() {

        return !getAsserts().isEmpty();

    }

    public String toString() {

        return name + "{kind=" + kind + ",severity=" + severity + "} "
                + conditions + " => " + actions;

    }

}
