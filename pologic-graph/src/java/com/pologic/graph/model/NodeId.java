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
 * Created on Mar 3, 2026
 */

package com.pologic.graph.model;

import java.util.UUID;

/**
 * The identity of a graph node. A node is either <em>named</em>, in which
 * case its label is chosen by the application (typically a prefixed name or
 * an IRI), or <em>blank</em>, in which case the label is generated by the
 * system and only identifies the node within this graph.
 * <p>
 * Equality is structural: two ids are equal iff they have the same
 * {@link Kind} and the same label.
 * 
 * @version $Id$
 */
final public class NodeId implements Comparable<NodeId> {

    /**
     * The two kinds of node identity.
     */
    public static enum Kind {
        NAMED, BLANK;
    }

    private final Kind kind;

    private final String label;

    private NodeId(final Kind kind, final String label) {

        if (kind == null)
            throw new IllegalArgumentException();

        if (label == null)
            throw new IllegalArgumentException();

        this.kind = kind;

        this.label = label;

    }

    /**
     * Return a named node id.
     * 
     * @param name
     *            The name (required, may be empty).
     */
    public static NodeId named(final String name) {

        return new NodeId(Kind.NAMED, name);

    }

    /**
     * Return a fresh blank node id. The label is a random {@link UUID} so
     * blank nodes minted by different processes do not collide.
     */
    public static NodeId blank() {

        return new NodeId(Kind.BLANK, UUID.randomUUID().toString());

    }

    /**
     * Return the blank node id having the given label.
     */
    public static NodeId blank(final String label) {

        return new NodeId(Kind.BLANK, label);

    }

    public Kind getKind() {

        return kind;

    }

    public boolean isNamed() {

        return kind == Kind.NAMED;

    }

    public boolean isBlank() {

        return kind == Kind.BLANK;

    }

    /**
     * The name of a named node or the generated label of a blank node.
     */
    public String getLabel() {

        return label;

    }

    /**
     * The text before the first <code>:</code> of a named node, or
     * <code>null</code> if there is none (or if the node is blank).
     */
    public String namespace() {

        if (!isNamed())
            return null;

        final int i = label.indexOf(':');

        return i < 0 ? null : label.substring(0, i);

    }

    /**
     * The text after the last <code>:</code> of the label.
     */
    public String localName() {

        return label.substring(label.lastIndexOf(':') + 1);

    }

    public int compareTo(final NodeId o) {

        final int ret = kind.compareTo(o.kind);

        if (ret != 0)
            return ret;

        return label.compareTo(o.label);

    }

    public boolean equals(final Object o) {

        if (this == o)
            return true;

        if (!(o instanceof NodeId))
            return false;

        final NodeId t = (NodeId) o;

        return kind == t.kind && label.equals(t.label);

    }

    public int hashCode() {

        return 31 * kind.hashCode() + label.hashCode();

    }

    public String toString() {

        return isBlank() ? "_:" + label : label;

    }

}
