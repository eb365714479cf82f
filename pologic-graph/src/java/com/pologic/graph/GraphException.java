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
 * Created on Mar 3, 2026
 */

package com.pologic.graph;

/**
 * Unchecked exception for failures in the graph layer. Each instance carries
 * a {@link Kind} so that callers can dispatch on the category of the failure
 * without parsing the message.
 * 
 * @version $Id$
 */
public class GraphException extends RuntimeException {

    private static final long serialVersionUID = 6017354129017451339L;

    /**
     * The categories of graph failures.
     */
    public static enum Kind {

        /** The addressed triple or node does not exist. */
        NOT_FOUND,

        /**
         * The triple already exists. Insert treats duplicates as a success so
         * this kind is not raised by the store itself.
         */
        DUPLICATE,

        /** The triple is malformed. */
        INVALID_TRIPLE,

        /** The storage backend failed. */
        STORAGE,

        /** A record could not be encoded or decoded. */
        SERIALIZATION,

        /** A query could not be evaluated. */
        QUERY,

        /** The indices are inconsistent with the backend. */
        INDEX,

        /** A configuration property is missing or invalid. */
        CONFIG,

        /** The requested backend is not available. */
        BACKEND_UNAVAILABLE;

    }

    private final Kind kind;

    public GraphException(final Kind kind, final String msg) {

        super(msg);

        if (kind == null)
            throw new IllegalArgumentException();

        this.kind = kind;

    }

    public GraphException(final Kind kind, final String msg,
            final Throwable cause) {

        super(msg, cause);

        if (kind == null)
            throw new IllegalArgumentException();

        this.kind = kind;

    }

    /**
     * The category of this failure.
     */
    public Kind getKind() {

        return kind;

    }

    public String toString() {

        return getClass().getSimpleName() + "{kind=" + kind + "}: "
                + getMessage();

    }

}
