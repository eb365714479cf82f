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

/**
 * Base impl for {@link Integer}.
 * 
 * @version $Id$
 */
public class IntegerValidator implements IValidator<Integer> {

    public static final transient IValidator<Integer> DEFAULT = new IntegerValidator();

    /**
     * Only allows positive values (GT ZERO).
     */
    public static final transient IValidator<Integer> GT_ZERO = new IntegerValidator() {

        public void accept(String key, String val, Integer arg) {

            if (arg <= 0)
                throw new ConfigurationException(key, val, "Must be positive");

        }

    };

    protected IntegerValidator() {

    }

    public Integer parse(final String key, final String val) {

        try {
            return Integer.parseInt(val.trim());
        } catch (NumberFormatException ex) {
            throw new ConfigurationException(key, val, ex);
        }

    }

    public void accept(String key, String val, Integer arg)
            throws ConfigurationException {

    }

}
