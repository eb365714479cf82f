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

/**
 * An immutable <code>(subject, predicate, object)</code> assertion.
 * 
 * @version $Id$
 */
final public class Triple {

    private final NodeId subject;

    private final Predicate predicate;

    private final Value object;

    public Triple(final NodeId subject, final Predicate predicate,
            final Value object) {

        if (subject == null)
            throw new IllegalArgumentException();

        if (predicate == null)
            throw new IllegalArgumentException();

        if (object == null)
            throw new IllegalArgumentException();

        this.subject = subject;

        this.predicate = predicate;

        this.object = object;

    }

    /**
     * A triple linking two named nodes.
     */
    public static Triple link(final String s, final String p, final String o) {

        return new Triple(NodeId.named(s), new Predicate(p), Value.node(o));

    }

    /**
     * A triple whose object is the given value.
     */
    public static Triple of(final String s, final String p, final Value o) {

        return new Triple(NodeId.named(s), new Predicate(p), o);

    }

    public NodeId getSubject() {

        return subject;

    }

    public Predicate getPredicate() {

        return predicate;

    }

    public Value getObject() {

        return object;

    }

    /**
     * The content address of this triple.
     */
    public TripleId id() {

        return TripleId.digest(TripleSerializer.encode(this));

    }

    public boolean equals(final Object o) {

        if (this == o)
            return true;

        if (!(o instanceof Triple))
            return false;

        final Triple t = (Triple) o;

        return subject.equals(t.subject) && predicate.equals(t.predicate)
                && object.equals(t.object);

    }

    public int hashCode() {

        int h = subject.hashCode();

        h = 31 * h + predicate.hashCode();

        h = 31 * h + object.hashCode();

        return h;

    }

    public String toString() {

        return "<" + subject + ", " + predicate + ", " + object + ">";

    }

}
