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

package com.pologic.graph.backend;

import java.util.Iterator;

import com.pologic.graph.GraphException;
import com.pologic.graph.model.Triple;
import com.pologic.graph.model.TripleId;

/**
 * A key/value store of canonically encoded triples keyed by their
 * {@link TripleId}. Implementations are safe for concurrent callers at the
 * granularity of a single operation. Every failure is reported as a
 * {@link GraphException} of kind {@link GraphException.Kind#STORAGE} (or
 * {@link GraphException.Kind#SERIALIZATION} for an undecodable record).
 * 
 * @version $Id$
 */
public interface IStorageBackend {

    /**
     * Store the triple under its id. Storing a triple which is already
     * present is a NOP.
     */
    void put(TripleId id, Triple triple);

    /**
     * Return the triple stored under the id -or- <code>null</code> if there
     * is none.
     */
    Triple get(TripleId id);

    /**
     * Remove the triple stored under the id.
     * 
     * @return <code>true</code> iff a triple was removed.
     */
    boolean delete(TripleId id);

    /**
     * <code>true</code> iff a triple is stored under the id.
     */
    boolean exists(TripleId id);

    /**
     * Visit every stored triple in no particular order. The iterator reads
     * from a snapshot and does not reflect concurrent writes.
     */
    Iterator<Triple> iterAll();

    /**
     * The number of stored triples.
     */
    long count();

    /**
     * The number of bytes used by the backend.
     */
    long sizeBytes();

    /**
     * Make any buffered writes durable.
     */
    void flush();

    /**
     * Flush and release the backend's resources. Any further operation will
     * fail.
     */
    void close();

    boolean isOpen();

    BackendType getBackendType();

}
