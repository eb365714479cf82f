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
 * Created on Mar 4, 2026
 */

package com.pologic.graph.backend;

import com.pologic.graph.GraphException;
import com.pologic.graph.model.TripleId;

/**
 * Abstract base class for {@link IStorageBackend} implementations. Tracks the
 * open/closed state and derives {@link #exists(TripleId)} from
 * {@link #get(TripleId)}.
 * 
 * @version $Id$
 */
abstract public class AbstractStorageBackend implements IStorageBackend {

    private volatile boolean open = true;

    protected AbstractStorageBackend() {

    }

    public boolean exists(final TripleId id) {

        return get(id) != null;

    }

    public boolean isOpen() {

        return open;

    }

    /**
     * Mark the backend as closed.
     * 
     * @return <code>false</code> if it was already closed.
     */
    protected boolean markClosed() {

        if (!open)
            return false;

        open = false;

        return true;

    }

    /**
     * @throws GraphException
     *             if the backend has been closed.
     */
    protected void assertOpen() {

        if (!open)
            throw new GraphException(GraphException.Kind.STORAGE,
                    "Backend closed: " + getBackendType());

    }

    public String toString() {

        return getClass().getSimpleName() + "{open=" + open + ",count="
                + (open ? count() : -1) + "}";

    }

}
