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
 * Created on Mar 5, 2026
 */

package com.pologic.graph.backend;

import java.io.File;
import java.util.Properties;

import org.apache.log4j.Logger;

import com.pologic.graph.config.Configuration;
import com.pologic.graph.config.ConfigurationException;

/**
 * Opens the {@link IStorageBackend} described by a {@link Properties}
 * object.
 * 
 * @version $Id$
 */
public class StorageBackendFactory {

    private static final transient Logger log = Logger
            .getLogger(StorageBackendFactory.class);

    /**
     * Options understood by {@link StorageBackendFactory#open(Properties)}.
     */
    public static interface Options {

        /**
         * The {@link BackendType} to open.
         */
        String BACKEND = "com.pologic.graph.backend";

        String DEFAULT_BACKEND = BackendType.Memory.toString();

        /**
         * The journal file for {@link BackendType#File}.
         */
        String FILE = "com.pologic.graph.file";

        /**
         * The JDBC URL for {@link BackendType#Jdbc}.
         */
        String JDBC_URL = "com.pologic.graph.jdbcUrl";

        /**
         * When <code>true</code> the file backend forces its writes to the
         * disk on flush.
         */
        String FORCE_ON_FLUSH = "com.pologic.graph.forceOnFlush";

        String DEFAULT_FORCE_ON_FLUSH = "true";

    }

    private StorageBackendFactory() {

    }

    /**
     * Open the configured backend.
     * 
     * @throws ConfigurationException
     *             if the configuration is invalid.
     */
    public static IStorageBackend open(final Properties properties) {

        final String s = Configuration.getProperty(properties,
                Options.BACKEND, Options.DEFAULT_BACKEND);

        final BackendType type;
        try {
            type = BackendType.valueOf(s);
        } catch (IllegalArgumentException ex) {
            throw new ConfigurationException(Options.BACKEND, s,
                    "Unknown backend");
        }

        if (log.isInfoEnabled())
            log.info("backend=" + type);

        switch (type) {
        case Memory:
            return new MemoryBackend();
        case File: {
            final String file = Configuration.getRequiredProperty(properties,
                    Options.FILE);
            final boolean force = Boolean.parseBoolean(Configuration
                    .getProperty(properties, Options.FORCE_ON_FLUSH,
                            Options.DEFAULT_FORCE_ON_FLUSH));
            return new FileBackend(new File(file), force);
        }
        case Jdbc:
            return new JdbcBackend(Configuration.getRequiredProperty(
                    properties, Options.JDBC_URL));
        default:
            throw new AssertionError(type);
        }

    }

}
