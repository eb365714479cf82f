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

package com.pologic.graph.config;

import java.util.Properties;

import junit.framework.TestCase;

import com.pologic.graph.GraphException;
import com.pologic.graph.backend.BackendType;
import com.pologic.graph.backend.IStorageBackend;
import com.pologic.graph.backend.StorageBackendFactory;

/**
 * Test suite for {@link Configuration} and the validators.
 * 
 * @version $Id$
 */
public class TestConfiguration extends TestCase {

    public TestConfiguration() {
    }

    public TestConfiguration(String name) {
        super(name);
    }

    public void test_default() {

        final Properties p = new Properties();

        assertEquals(Integer.valueOf(12), Configuration.getProperty(p,
                "com.pologic.test.x", "12", IntegerValidator.GT_ZERO));

        p.setProperty("com.pologic.test.x", "7");

        assertEquals(Integer.valueOf(7), Configuration.getProperty(p,
                "com.pologic.test.x", "12", IntegerValidator.GT_ZERO));

        assertNull(Configuration.getProperty(p, "com.pologic.test.y", null,
                IntegerValidator.DEFAULT));

    }

    public void test_validatorRejects() {

        final Properties p = new Properties();

        p.setProperty("com.pologic.test.x", "0");

        try {
            Configuration.getProperty(p, "com.pologic.test.x", null,
                    IntegerValidator.GT_ZERO);
            fail("Expecting: " + ConfigurationException.class);
        } catch (ConfigurationException ex) {
            assertEquals(GraphException.Kind.CONFIG, ex.getKind());
        }

        p.setProperty("com.pologic.test.x", "abc");

        try {
            Configuration.getProperty(p, "com.pologic.test.x", null,
                    IntegerValidator.DEFAULT);
            fail("Expecting: " + ConfigurationException.class);
        } catch (ConfigurationException ex) {
            assertEquals(GraphException.Kind.CONFIG, ex.getKind());
        }

    }

    public void test_backendFactory() {

        final Properties p = new Properties();

        final IStorageBackend backend = StorageBackendFactory.open(p);

        try {
            assertEquals(BackendType.Memory, backend.getBackendType());
        } finally {
            backend.close();
        }

        p.setProperty(StorageBackendFactory.Options.BACKEND, "Tape");

        try {
            StorageBackendFactory.open(p);
            fail("Expecting: " + ConfigurationException.class);
        } catch (ConfigurationException ex) {
            // ignore
        }

        p.setProperty(StorageBackendFactory.Options.BACKEND,
                BackendType.File.toString());

        try {
            StorageBackendFactory.open(p);
            fail("Expecting: " + ConfigurationException.class);
        } catch (ConfigurationException ex) {
            // the journal file is required.
        }

    }

}
