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
 * Parses and validates a property value.
 * 
 * @param <E>
 *            The generic type of the parsed value.
 * 
 * @version $Id$
 */
public interface IValidator<E> {

    /**
     * Convert the property value to the generic type.
     * 
     * @throws ConfigurationException
     *             if the value can not be parsed.
     */
    E parse(String key, String val) throws ConfigurationException;

    /**
     * Reject the parsed value by throwing a {@link ConfigurationException}.
     */
    void accept(String key, String val, E arg) throws ConfigurationException;

}
