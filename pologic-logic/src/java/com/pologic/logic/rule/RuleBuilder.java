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
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import com.pologic.graph.model.Value;
import com.pologic.logic.LogicException;
import com.pologic.logic.term.IVariable;

/**
 * Builds a {@link Rule}.
 * 
 * <pre>
 * Rule.builder(&quot;knows_is_symmetric&quot;)
 *     .kind(RuleKind.INFERENCE)
 *     .when(&quot;?x&quot;, &quot;knows&quot;, &quot;?y&quot;)
 *     .then(&quot;?y&quot;, &quot;knows&quot;, &quot;?x&quot;)
 *     .build();
 * </pre>
 * 
 * {@link #build()} rejects, with {@link LogicException.Kind#INVALID_RULE}, a
 * rule without a name, conditions or actions, a rule whose asserted
 * templates use a variable that no condition binds, and a constraint which
 * reads a variable not bound by its own or an earlier condition.
 * 
 * @version $Id$
 */
public class RuleBuilder {

    private final String name;

    private RuleKind kind = RuleKind.INFERENCE;

    private Severity severity = Severity.ERROR;

    private String description = "";

    private final List<Condition> conditions = new ArrayList<Condition>();

    private final List<Action> actions = new ArrayList<Action>();

    RuleBuilder(final String name) {

        this.name = name;

    }

    public RuleBuilder kind(final RuleKind kind) {

        if (kind == null)
            throw new IllegalArgumentException();

        this.kind = kind;

        return this;

    }

    public RuleBuilder severity(final Severity severity) {

        if (severity == null)
            throw new IllegalArgumentException();

        this.severity = severity;

        return this;

    }

    public RuleBuilder description(final String description) {

        if (description == null)
            throw new IllegalArgumentException();

        this.description = description;

        return this;

    }

    public RuleBuilder when(final Condition c) {

        if (c == null)
            throw new IllegalArgumentException();

        conditions.add(c);

        return this;

    }

    public RuleBuilder when(final TripleTemplate t) {

        return when(new Condition(t));

    }

    public RuleBuilder when(final String s, final String p, final String o) {

        return when(TripleTemplate.of(s, p, o));

    }

    public RuleBuilder when(final String s, final String p, final Value o) {

        return when(TripleTemplate.of(s, p, o));

    }

    /**
     * Attach a constraint to the most recent condition.
     */
    public RuleBuilder where(final IConstraint c) {

        if (c == null)
            throw new IllegalArgumentException();

        if (conditions.isEmpty())
            throw new LogicException(LogicException.Kind.INVALID_RULE, name
                    + ": constraint before any condition: " + c);

        final int last = conditions.size() - 1;

        conditions.set(last, conditions.get(last).and(c));

        return this;

    }

    public RuleBuilder then(final TripleTemplate t) {

        actions.add(new Action.Assert(t));

        return this;

    }

    public RuleBuilder then(final String s, final String p, final String o) {

        return then(TripleTemplate.of(s, p, o));

    }

    public RuleBuilder then(final String s, final String p, final Value o) {

        return then(TripleTemplate.of(s, p, o));

    }

    public RuleBuilder reject(final String reason) {

        actions.add(new Action.Reject(reason));

        return this;

    }

    public RuleBuilder require(final TripleTemplate t) {

        actions.add(new Action.Require(t));

        return this;

    }

    public RuleBuilder require(final String s, final String p, final String o) {

        return require(TripleTemplate.of(s, p, o));

    }

    public Rule build() {

        if (name == null || name.trim().length() == 0)
            throw new LogicException(LogicException.Kind.INVALID_RULE,
                    "Rule name is required");

        if (conditions.isEmpty())
            throw new LogicException(LogicException.Kind.INVALID_RULE, name
                    + ": no conditions");

        if (actions.isEmpty())
            throw new LogicException(LogicException.Kind.INVALID_RULE, name
                    + ": no actions");

        final Set<IVariable<?>> bound = new HashSet<IVariable<?>>();

        for (Condition c : conditions) {

            bound.addAll(c.getTemplate().getVariables());

            for (IConstraint k : c.getConstraints()) {

                if (!bound.containsAll(k.getVariables()))
                    throw new LogicException(
                            LogicException.Kind.INVALID_RULE, name
                                    + ": constraint reads an unbound variable: "
                                    + k);

            }

        }

        for (Action a : actions) {

            if (a instanceof Action.Assert) {

                final TripleTemplate t = ((Action.Assert) a).getTemplate();

                if (!bound.containsAll(t.getVariables()))
                    throw new LogicException(
                            LogicException.Kind.INVALID_RULE, name
                                    + ": asserted template uses an unbound variable: "
                                    + t);

            }

        }

        return new Rule(name, kind, severity, description, conditions,
                actions);

    }

}
