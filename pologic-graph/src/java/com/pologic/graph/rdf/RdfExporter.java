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
 * Created on Mar 7, 2026
 */

package com.pologic.graph.rdf;

import java.io.OutputStream;
import java.io.Writer;
import java.util.List;

import org.apache.log4j.Logger;
import org.openrdf.rio.RDFFormat;
import org.openrdf.rio.RDFHandlerException;
import org.openrdf.rio.RDFWriter;
import org.openrdf.rio.Rio;
import org.openrdf.rio.UnsupportedRDFormatException;

import com.pologic.graph.GraphException;
import com.pologic.graph.model.Triple;
import com.pologic.graph.model.TriplePattern;
import com.pologic.graph.store.GraphStore;

/**
 * Writes the triples of a {@link GraphStore} as RDF.
 * 
 * @version $Id$
 */
public class RdfExporter {

    private static final transient Logger log = Logger
            .getLogger(RdfExporter.class);

    private final GraphStore store;

    private final RdfConverter converter;

    public RdfExporter(final GraphStore store) {

        this(store, new RdfConverter());

    }

    public RdfExporter(final GraphStore store, final RdfConverter converter) {

        if (store == null)
            throw new IllegalArgumentException();

        if (converter == null)
            throw new IllegalArgumentException();

        this.store = store;

        this.converter = converter;

    }

    /**
     * Write every triple.
     * 
     * @return The number of statements written.
     */
    public long export(final OutputStream os, final RDFFormat format) {

        return write(newWriter(format, os, null), TriplePattern.any());

    }

    /**
     * Write the triples matching the pattern.
     * 
     * @return The number of statements written.
     */
    public long export(final Writer w, final RDFFormat format,
            final TriplePattern pattern) {

        return write(newWriter(format, null, w), pattern);

    }

    private RDFWriter newWriter(final RDFFormat format, final OutputStream os,
            final Writer w) {

        if (format == null)
            throw new IllegalArgumentException();

        try {

            return os != null ? Rio.createWriter(format, os) : Rio
                    .createWriter(format, w);

        } catch (UnsupportedRDFormatException ex) {

            throw new GraphException(GraphException.Kind.SERIALIZATION,
                    "No writer: " + format, ex);

        }

    }

    private long write(final RDFWriter writer, final TriplePattern pattern) {

        final List<Triple> triples = store.find(pattern);

        try {

            writer.startRDF();

            for (Triple t : triples) {

                writer.handleStatement(converter.toStatement(t));

            }

            writer.endRDF();

        } catch (RDFHandlerException ex) {

            throw new GraphException(GraphException.Kind.SERIALIZATION,
                    ex.getMessage(), ex);

        }

        if (log.isInfoEnabled())
            log.info("Exported " + triples.size() + " statements: format="
                    + writer.getRDFFormat().getName());

        return triples.size();

    }

}
