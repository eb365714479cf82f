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
 * Created on Mar 10, 2026
 */

package com.pologic.logic;

/**
 * Thrown when forward chaining does not reach a fixpoint within its
 * iteration bound, or when backward chaining fails and at least one branch
 * was cut by the depth bound.
 * 
 * @version $Id$
 */
public class MaxDepthExceededException extends LogicException {

    private static final long serialVersionUID = 4361785587913645672L;

    private final int limit;

    public MaxDepthExceededException(final int limit, final String msg) {

        super(Kind.MAX_DEPTH_EXCEEDED, msg + ": limit=" + limit);

        this.limit = limit;

    }

    /**
     * The bound which was exceeded.
     */
    public int getLimit() {

        return limit;

    }

}
