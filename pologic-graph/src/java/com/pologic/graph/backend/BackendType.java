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

/**
 * The available {@link IStorageBackend} implementations.
 * 
 * @version $Id$
 */
public enum BackendType {

    /**
     * Volatile storage on the JVM heap ({@link MemoryBackend}).
     */
    Memory(false),

    /**
     * Persistent storage in an append-only journal file ({@link FileBackend}).
     */
    File(true),

    /**
     * Persistent storage in an embedded SQL database reached through JDBC
     * ({@link JdbcBackend}).
     */
    Jdbc(true);

    private final boolean stable;

    private BackendType(final boolean stable) {

        this.stable = stable;

    }

    /**
     * <code>true</code> iff data survives a restart.
     */
    public boolean isStable() {

        return stable;

    }

}
