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

import org.openrdf.model.BNode;
import org.openrdf.model.Literal;
import org.openrdf.model.Resource;
import org.openrdf.model.Statement;
import org.openrdf.model.URI;
import org.openrdf.model.ValueFactory;
import org.openrdf.model.impl.ValueFactoryImpl;
import org.openrdf.model.vocabulary.XMLSchema;

import com.pologic.graph.GraphException;
import com.pologic.graph.model.NodeId;
import com.pologic.graph.model.Predicate;
import com.pologic.graph.model.Triple;
import com.pologic.graph.model.Value;

/**
 * Converts between {@link Triple}s and openrdf {@link Statement}s.
 * <p>
 * Named nodes and predicates become {@link URI}s. A name which is not an
 * absolute URI (it has no <code>:</code>) is resolved against the base
 * namespace, and the base namespace is stripped again on the way in. Blank
 * nodes become {@link BNode}s. Integers, floats and booleans are written as
 * <code>xsd:long</code>, <code>xsd:double</code> and
 * <code>xsd:boolean</code> literals. Other literals are read as strings.
 * 
 * @version $Id$
 */
public class RdfConverter {

    /**
     * The default base namespace.
     */
    public static final String DEFAULT_NAMESPACE = "urn:pologic:";

    private final String namespace;

    private final ValueFactory vf;

    public RdfConverter() {

        this(DEFAULT_NAMESPACE);

    }

    /**
     * @param namespace
     *            The base namespace for names which are not absolute URIs.
     */
    public RdfConverter(final String namespace) {

        if (namespace == null || namespace.indexOf(':') < 0)
            throw new IllegalArgumentException("Not a namespace: " + namespace);

        this.namespace = namespace;

        this.vf = ValueFactoryImpl.getInstance();

    }

    public String getNamespace() {

        return namespace;

    }

    public ValueFactory getValueFactory() {

        return vf;

    }

    private String toURIString(final String name) {

        return name.indexOf(':') < 0 ? namespace + name : name;

    }

    private String fromURIString(final String s) {

        if (s.startsWith(namespace) && s.length() > namespace.length())
            return s.substring(namespace.length());

        return s;

    }

    public Statement toStatement(final Triple t) {

        final Resource s = toResource(t.getSubject());

        final URI p = vf.createURI(toURIString(t.getPredicate().getName()));

        final org.openrdf.model.Value o;

        final Value v = t.getObject();

        switch (v.getType()) {
        case NODE:
            o = toResource(v.asNode());
            break;
        case STRING:
            o = vf.createLiteral(((Value.StringValue) v).stringValue());
            break;
        case INTEGER:
            o = vf.createLiteral(((Value.IntegerValue) v).longValue());
            break;
        case FLOAT:
            o = vf.createLiteral(v.doubleValue());
            break;
        case BOOLEAN:
            o = vf.createLiteral(((Value.BooleanValue) v).booleanValue());
            break;
        default:
            throw new AssertionError(v.getType());
        }

        return vf.createStatement(s, p, o);

    }

    private Resource toResource(final NodeId id) {

        if (id.isBlank())
            return vf.createBNode(toBNodeID(id.getLabel()));

        try {

            return vf.createURI(toURIString(id.getLabel()));

        } catch (IllegalArgumentException ex) {

            throw new GraphException(GraphException.Kind.SERIALIZATION,
                    "Not a URI: " + id, ex);

        }

    }

    /**
     * Blank node labels are restricted to letters and digits. Any other
     * character (and <code>x</code>) is escaped as <code>x</code> followed by
     * four hex digits.
     */
    static String toBNodeID(final String label) {

        final StringBuilder sb = new StringBuilder(label.length() + 1);

        sb.append('b');

        for (int i = 0; i < label.length(); i++) {

            final char c = label.charAt(i);

            if (c != 'x'
                    && ((c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9'))) {

                sb.append(c);

            } else {

                sb.append('x').append(String.format("%04x", (int) c));

            }

        }

        return sb.toString();

    }

    public Triple toTriple(final Statement st) {

        final NodeId s = toNodeId(st.getSubject());

        final Predicate p = new Predicate(fromURIString(st.getPredicate()
                .stringValue()));

        final org.openrdf.model.Value o = st.getObject();

        final Value v;

        if (o instanceof Resource) {

            v = Value.node(toNodeId((Resource) o));

        } else {

            v = toValue((Literal) o);

        }

        return new Triple(s, p, v);

    }

    private NodeId toNodeId(final Resource r) {

        if (r instanceof BNode)
            return NodeId.blank(((BNode) r).getID());

        return NodeId.named(fromURIString(r.stringValue()));

    }

    private Value toValue(final Literal lit) {

        final URI dt = lit.getDatatype();

        if (dt == null)
            return Value.string(lit.getLabel());

        try {

            if (dt.equals(XMLSchema.LONG) || dt.equals(XMLSchema.INTEGER)
                    || dt.equals(XMLSchema.INT) || dt.equals(XMLSchema.SHORT)
                    || dt.equals(XMLSchema.BYTE)) {

                return Value.integer(Long.parseLong(lit.getLabel().trim()));

            }

            if (dt.equals(XMLSchema.DOUBLE) || dt.equals(XMLSchema.FLOAT)
                    || dt.equals(XMLSchema.DECIMAL)) {

                return Value.floating(lit.doubleValue());

            }

        } catch (NumberFormatException ex) {

            throw new GraphException(GraphException.Kind.SERIALIZATION,
                    "Bad literal: " + lit, ex);

        }

        if (dt.equals(XMLSchema.BOOLEAN)) {

            return Value.bool(lit.booleanValue());

        }

        return Value.string(lit.getLabel());

    }

}
