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

package com.pologic.logic;

/**
 * Unchecked exception for failures in the logic layer.
 * 
 * @version $Id$
 */
public class LogicException extends RuntimeException {

    private static final long serialVersionUID = -3829474421874419523L;

    /**
     * The categories of logic failures.
     */
    public static enum Kind {

        /** A rule is malformed. */
        INVALID_RULE,

        /** Two declarations of a rule set can not both hold. */
        RULE_CONFLICT,

        VALIDATION_FAILED,

        CONTRADICTION,

        /** A proof does not replay against its rule set and graph. */
        INVALID_PROOF,

        UNIFICATION_FAILED,

        /** Backward chaining only found cyclic derivations. */
        INFERENCE_LOOP,

        /** An iteration or depth bound was exceeded. */
        MAX_DEPTH_EXCEEDED,

        /** Backward chaining found no derivation of the goal. */
        MISSING_PRECONDITION,

        /** The graph layer failed. The cause is the graph exception. */
        GRAPH_ERROR,

        SERIALIZATION_ERROR;

    }

    private final Kind kind;

    public LogicException(final Kind kind, final String msg) {

        super(msg);

        if (kind == null)
            throw new IllegalArgumentException();

        this.kind = kind;

    }

    public LogicException(final Kind kind, final String msg,
            final Throwable cause) {

        super(msg, cause);

        if (kind == null)
            throw new IllegalArgumentException();

        this.kind = kind;

    }

    public Kind getKind() {

        return kind;

    }

    public String toString() {

        return getClass().getSimpleName() + "{kind=" + kind + "}: "
                + getMessage();

    }

}
