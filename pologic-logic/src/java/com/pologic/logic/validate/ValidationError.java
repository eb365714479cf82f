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
 * Created on Mar 14, 2026
 */

package com.pologic.logic.validate;

import com.pologic.logic.rule.Severity;

/**
 * One problem reported by the {@link Validator}.
 * 
 * @version $Id$
 */
public class ValidationError {

    /**
     * What kind of check reported the error.
     */
    public static enum Kind {

        /** A rule's reject action fired. */
        RULE_VIOLATION,

        /** A rule's require action found no matching triple. */
        REQUIREMENT_UNSATISFIED,

        /** A functional predicate or contradicting pair was violated. */
        CONTRADICTION;

    }

    private final Severity severity;

    private final String ruleName;

    private final String message;

    private final Kind kind;

    public ValidationError(final Severity severity, final String ruleName,
            final String message, final Kind kind) {

        if (severity == null || ruleName == null || message == null
                || kind == null)
            throw new IllegalArgumentException();

        this.severity = severity;
        this.ruleName = ruleName;
        this.message = message;
        this.kind = kind;

    }

    public Severity getSeverity() {
        return severity;
    }

    public String getRuleName() {
        return ruleName;
    }

    public String getMessage() {
        return message;
    }

    public Kind getKind() {
        return kind;
    }

    public boolean equals(final Object o) {

        if (this == o)
            return true;

        if (!(o instanceof ValidationError))
            return false;

        final ValidationError t = (ValidationError) o;

        return severity == t.severity && kind == t.kind
                && ruleName.equals(t.ruleName) && message.equals(t.message);

    }

    public int hashCode() {

        return ((severity.hashCode() * 31 + kind.hashCode()) * 31 + ruleName
                .hashCode()) * 31 + message.hashCode();

    }

    public String toString() {

        return severity + " [" + ruleName + "] " + message;

    }

}
