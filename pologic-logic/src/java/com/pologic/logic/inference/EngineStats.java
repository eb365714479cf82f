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
 * Created on Mar 13, 2026
 */

package com.pologic.logic.inference;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Counters for an {@link InferenceEngine}.
 * 
 * @version $Id$
 */
public class EngineStats {

    /** The number of forward chaining runs. */
    public final AtomicLong forwardRuns = new AtomicLong();

    /** The number of forward chaining sweeps over the rules. */
    public final AtomicLong sweeps = new AtomicLong();

    /** The number of triples added by forward chaining. */
    public final AtomicLong inferences = new AtomicLong();

    /** The number of calls to prove. */
    public final AtomicLong proofsAttempted = new AtomicLong();

    /** The number of calls to prove which returned a proof. */
    public final AtomicLong proofsFound = new AtomicLong();

    public String toString() {

        return "EngineStats{forwardRuns=" + forwardRuns + ",sweeps=" + sweeps
                + ",inferences=" + inferences + ",proofsAttempted="
                + proofsAttempted + ",proofsFound=" + proofsFound + "}";

    }

}
