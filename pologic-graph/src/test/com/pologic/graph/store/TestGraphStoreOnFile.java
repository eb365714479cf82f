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

import java.io.File;
import java.util.Properties;

import com.pologic.graph.backend.BackendType;
import com.pologic.graph.backend.FileBackend;
import com.pologic.graph.backend.IStorageBackend;
import com.pologic.graph.backend.StorageBackendFactory;
import com.pologic.graph.model.TriplePattern;
import com.pologic.graph.model.Value;

/**
 * Runs the {@link TestGraphStore} suite on a {@link FileBackend} and checks
 * that the indices are rebuilt when the store is reopened.
 * 
 * @version $Id$
 */
public class TestGraphStoreOnFile extends TestGraphStore {

    public TestGraphStoreOnFile() {
    }

    public TestGraphStoreOnFile(String name) {
        super(name);
    }

    private File file;

    protected IStorageBackend newBackend() throws Exception {

        file = File.createTempFile(getName(), ".jnl");

        return new FileBackend(file, false);

    }

    public void tearDown() throws Exception {

        super.tearDown();

        if (file != null)
            file.delete();

    }

    public void test_reopenRebuildsIndices() {

        store.insertBatch(data());

        store.flush();

        store.close();

        final Properties properties = new Properties();

        properties.setProperty(StorageBackendFactory.Options.BACKEND,
                BackendType.File.toString());

        properties.setProperty(StorageBackendFactory.Options.FILE,
                file.getAbsolutePath());

        store = new GraphStore(properties);

        assertEquals(data().size(), store.count());
        assertEquals(3, store.find(TriplePattern.predicate(knows)).size());
        assertEquals(2, store.find(TriplePattern.object(Value.integer(30)))
                .size());
        assertEquals(3, store.stats().getSubjectCount());

    }

}
