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

package com.pologic.graph.config;

import java.util.Properties;

import org.apache.log4j.Logger;

/**
 * Resolves configuration properties against a {@link Properties} object,
 * falling back to the declared default and then to the JVM system
 * properties.
 * 
 * @version $Id$
 */
public class Configuration {

    private static final transient Logger log = Logger
            .getLogger(Configuration.class);

    private Configuration() {

    }

    /**
     * Return the value of the property.
     * 
     * @param properties
     *            The properties (required).
     * @param name
     *            The property name.
     * @param defaultValue
     *            The value used when the property is not set (optional).
     * 
     * @return The value -or- <code>null</code> if it is not set and there
     *         is no default.
     */
    public static String getProperty(final Properties properties,
            final String name, final String defaultValue) {

        if (properties == null)
            throw new IllegalArgumentException();

        if (name == null)
            throw new IllegalArgumentException();

        String val = properties.getProperty(name);

        if (val == null) {

            val = System.getProperty(name);

        }

        if (val == null) {

            val = defaultValue;

        } else if (log.isInfoEnabled()) {

            log.info(name + "=" + val);

        }

        return val;

    }

    /**
     * Variant converts to the specified generic type and validates the value.
     * 
     * @return The validated value -or- <code>null</code> if the property is
     *         not set and there was no default.
     */
    public static <E> E getProperty(final Properties properties,
            final String name, final String defaultValue,
            final IValidator<E> validator) throws ConfigurationException {

        if (validator == null)
            throw new IllegalArgumentException();

        final String val = getProperty(properties, name, defaultValue);

        if (val == null)
            return null;

        final E e = validator.parse(name, val);

        validator.accept(name, val, e);

        return e;

    }

    /**
     * Return the value of a property which must be given.
     * 
     * @throws ConfigurationException
     *             if the property is not set.
     */
    public static String getRequiredProperty(final Properties properties,
            final String name) throws ConfigurationException {

        final String val = getProperty(properties, name, null);

        if (val == null || val.trim().length() == 0)
            throw new ConfigurationException(name, val, "Required property");

        return val;

    }

}
