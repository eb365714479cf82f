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
 * Created on Mar 11, 2026
 */

package com.pologic.logic.rule;

/**
 * The role of a {@link Rule}. The validator evaluates {@link #INTEGRITY} and
 * {@link #AUTHORITY} rules. Forward and backward chaining use the
 * {@link Action.Assert} actions of rules of any kind.
 * 
 * @version $Id$
 */
public enum RuleKind {

    /** Structural constraints on the data. */
    INTEGRITY,

    /** Who may assert what. */
    AUTHORITY,

    /** Constraints on the ordering of events. */
    TEMPORAL,

    /** Derives new triples. */
    INFERENCE;

}
