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
 * Created on Mar 9, 2026
 */

package com.pologic.graph.rdf;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.StringReader;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.util.HashSet;

import org.openrdf.rio.RDFFormat;

import com.pologic.graph.GraphException;
import com.pologic.graph.backend.MemoryBackend;
import com.pologic.graph.model.NodeId;
import com.pologic.graph.model.Predicate;
import com.pologic.graph.model.Triple;
import com.pologic.graph.model.TriplePattern;
import com.pologic.graph.model.Value;
import com.pologic.graph.store.AbstractGraphStoreTestCase;
import com.pologic.graph.store.GraphStore;

/**
 * Test suite for {@link RdfImporter} and {@link RdfExporter}.
 * 
 * @version $Id$
 */
public class TestRdfRoundTrip extends AbstractGraphStoreTestCase {

    public TestRdfRoundTrip() {
    }

    public TestRdfRoundTrip(String name) {
        super(name);
    }

    public void test_loadNTriples() {

        final String data = ""
                + "<http://example.org/alice> <http://example.org/knows> <http://example.org/bob> .\n"
                + "<http://example.org/alice> <http://example.org/age> \"30\"^^<http://www.w3.org/2001/XMLSchema#integer> .\n"
                + "<http://example.org/alice> <http://example.org/name> \"Alice\" .\n"
                + "_:x <http://example.org/alive> \"true\"^^<http://www.w3.org/2001/XMLSchema#boolean> .\n";

        final long n = new RdfImporter(store).load(new StringReader(data),
                RDFFormat.NTRIPLES);

        assertEquals(4, n);
        assertEquals(4, store.count());

        final NodeId alice = NodeId.named("http://example.org/alice");

        assertTrue(store.contains(new Triple(alice, new Predicate(
                "http://example.org/age"), Value.integer(30))));
        assertTrue(store.contains(new Triple(alice, new Predicate(
                "http://example.org/name"), Value.string("Alice"))));
        assertTrue(store.contains(new Triple(alice, new Predicate(
                "http://example.org/knows"), Value.node(NodeId
                .named("http://example.org/bob")))));

        final Triple blank = store.find(
                TriplePattern.predicate(new Predicate(
                        "http://example.org/alive"))).get(0);

        assertTrue(blank.getSubject().isBlank());
        assertEquals(Value.bool(true), blank.getObject());

    }

    public void test_roundTrip() {

        store.insert(Triple.link("alice", "knows", "bob"));
        store.insert(Triple.of("alice", "age", Value.integer(30)));
        store.insert(Triple.of("alice", "height", Value.floating(1.75d)));
        store.insert(Triple.of("alice", "alive", Value.bool(true)));
        store.insert(Triple.of("alice", "name", Value.string("Alice")));
        store.insert(Triple.of("ex:bob", "ex:name", Value.string("Bob")));

        for (RDFFormat format : new RDFFormat[] { RDFFormat.NTRIPLES,
                RDFFormat.TURTLE }) {

            final ByteArrayOutputStream os = new ByteArrayOutputStream();

            assertEquals(6, new RdfExporter(store).export(os, format));

            final GraphStore copy = new GraphStore(new MemoryBackend());

            try {

                new RdfImporter(copy).load(
                        new ByteArrayInputStream(os.toByteArray()), format);

                assertEquals(format.getName(),
                        new HashSet<Triple>(store.find(TriplePattern.any())),
                        new HashSet<Triple>(copy.find(TriplePattern.any())));

            } finally {

                copy.close();

            }

        }

    }

    public void test_exportPattern() {

        store.insert(Triple.link("alice", "knows", "bob"));
        store.insert(Triple.of("alice", "age", Value.integer(30)));

        final StringWriter w = new StringWriter();

        assertEquals(1, new RdfExporter(store).export(w, RDFFormat.NTRIPLES,
                TriplePattern.predicate(new Predicate("knows"))));

        assertTrue(w.toString(), w.toString().contains("<urn:pologic:knows>"));

    }

    public void test_parseError() {

        try {
            new RdfImporter(store).load(new ByteArrayInputStream(
                    "<http://a.example/s> <http://a.example/p> .\n".getBytes(StandardCharsets.UTF_8)),
                    RDFFormat.NTRIPLES);
            fail("Expecting: " + GraphException.class);
        } catch (GraphException ex) {
            assertEquals(GraphException.Kind.SERIALIZATION, ex.getKind());
        }

    }

}
