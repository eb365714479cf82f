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

import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;

import org.apache.log4j.Logger;
import org.openrdf.model.Statement;
import org.openrdf.rio.RDFFormat;
import org.openrdf.rio.RDFHandlerException;
import org.openrdf.rio.RDFParseException;
import org.openrdf.rio.RDFParser;
import org.openrdf.rio.Rio;
import org.openrdf.rio.UnsupportedRDFormatException;
import org.openrdf.rio.helpers.RDFHandlerBase;

import com.pologic.graph.GraphException;
import com.pologic.graph.store.GraphStore;

/**
 * Loads RDF (N-Triples, Turtle or any other format with a Rio parser on the
 * classpath) into a {@link GraphStore}.
 * 
 * @version $Id$
 */
public class RdfImporter {

    private static final transient Logger log = Logger
            .getLogger(RdfImporter.class);

    private final GraphStore store;

    private final RdfConverter converter;

    public RdfImporter(final GraphStore store) {

        this(store, new RdfConverter());

    }

    public RdfImporter(final GraphStore store, final RdfConverter converter) {

        if (store == null)
            throw new IllegalArgumentException();

        if (converter == null)
            throw new IllegalArgumentException();

        this.store = store;

        this.converter = converter;

    }

    /**
     * Load the data.
     * 
     * @return The number of statements read. Statements which were already
     *         in the store are counted.
     */
    public long load(final InputStream is, final RDFFormat format) {

        if (is == null)
            throw new IllegalArgumentException();

        final LoadHandler handler = new LoadHandler();

        try {

            newParser(format, handler).parse(is, converter.getNamespace());

        } catch (IOException ex) {

            throw new GraphException(GraphException.Kind.STORAGE,
                    "Could not read: " + format, ex);

        } catch (RDFParseException ex) {

            throw new GraphException(GraphException.Kind.SERIALIZATION,
                    ex.getMessage(), ex);

        } catch (RDFHandlerException ex) {

            throw unwrap(ex);

        }

        return done(handler, format);

    }

    /**
     * Load the data.
     * 
     * @return The number of statements read.
     */
    public long load(final Reader r, final RDFFormat format) {

        if (r == null)
            throw new IllegalArgumentException();

        final LoadHandler handler = new LoadHandler();

        try {

            newParser(format, handler).parse(r, converter.getNamespace());

        } catch (IOException ex) {

            throw new GraphException(GraphException.Kind.STORAGE,
                    "Could not read: " + format, ex);

        } catch (RDFParseException ex) {

            throw new GraphException(GraphException.Kind.SERIALIZATION,
                    ex.getMessage(), ex);

        } catch (RDFHandlerException ex) {

            throw unwrap(ex);

        }

        return done(handler, format);

    }

    private long done(final LoadHandler handler, final RDFFormat format) {

        if (log.isInfoEnabled())
            log.info("Loaded " + handler.n + " statements: format="
                    + format.getName());

        return handler.n;

    }

    private RDFParser newParser(final RDFFormat format,
            final LoadHandler handler) {

        if (format == null)
            throw new IllegalArgumentException();

        final RDFParser parser;
        try {
            parser = Rio.createParser(format, converter.getValueFactory());
        } catch (UnsupportedRDFormatException ex) {
            throw new GraphException(GraphException.Kind.SERIALIZATION,
                    "No parser: " + format, ex);
        }

        parser.setRDFHandler(handler);

        return parser;

    }

    /**
     * Graph failures raised by the handler are reported as themselves.
     */
    private static GraphException unwrap(final RDFHandlerException ex) {

        if (ex.getCause() instanceof GraphException)
            return (GraphException) ex.getCause();

        return new GraphException(GraphException.Kind.SERIALIZATION,
                ex.getMessage(), ex);

    }

    private class LoadHandler extends RDFHandlerBase {

        long n = 0;

        public void handleStatement(final Statement st)
                throws RDFHandlerException {

            try {

                store.insert(converter.toTriple(st));

            } catch (GraphException ex) {

                throw new RDFHandlerException(ex);

            }

            n++;

        }

    }

}
