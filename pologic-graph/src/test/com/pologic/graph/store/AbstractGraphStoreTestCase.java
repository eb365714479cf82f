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
 * Created on Mar 9, 2026
 */

package com.pologic.graph.store;

import junit.framework.TestCase;

import com.pologic.graph.backend.IStorageBackend;
import com.pologic.graph.backend.MemoryBackend;

/**
 * Base class for tests against a {@link GraphStore}. The store is created in
 * {@link #setUp()} on the backend returned by {@link #newBackend()}, which
 * subclasses override to run the same tests against another backend.
 * 
 * @version $Id$
 */
abstract public class AbstractGraphStoreTestCase extends TestCase {

    public AbstractGraphStoreTestCase() {
    }

    public AbstractGraphStoreTestCase(String name) {
        super(name);
    }

    protected GraphStore store;

    /**
     * Return a new empty backend (default is a {@link MemoryBackend}).
     */
    protected IStorageBackend newBackend() throws Exception {

        return new MemoryBackend();

    }

    public void setUp() throws Exception {

        store = new GraphStore(newBackend());

    }

    public void tearDown() throws Exception {

        if (store != null && store.isOpen())
            store.close();

        store = null;

    }

}
