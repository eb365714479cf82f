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
 * A triple with optional fields. An absent field matches anything. Patterns
 * are immutable; the <code>with*</code> methods return copies.
 * 
 * @version $Id$
 */
final public class TriplePattern {

    private static final TriplePattern ANY = new TriplePattern(null, null,
            null);

    private final NodeId subject;

    private final Predicate predicate;

    private final Value object;

    /**
     * @param subject
     *            The subject (optional).
     * @param predicate
     *            The predicate (optional).
     * @param object
     *            The object (optional).
     */
    public TriplePattern(final NodeId subject, final Predicate predicate,
            final Value object) {

        this.subject = subject;

        this.predicate = predicate;

        this.object = object;

    }

    /**
     * The pattern matching every triple.
     */
    public static TriplePattern any() {

        return ANY;

    }

    public static TriplePattern subject(final NodeId s) {

        return new TriplePattern(s, null, null);

    }

    public static TriplePattern predicate(final Predicate p) {

        return new TriplePattern(null, p, null);

    }

    public static TriplePattern object(final Value o) {

        return new TriplePattern(null, null, o);

    }

    /**
     * The fully bound pattern matching exactly the given triple.
     */
    public static TriplePattern exact(final Triple t) {

        return new TriplePattern(t.getSubject(), t.getPredicate(),
                t.getObject());

    }

    public TriplePattern withSubject(final NodeId s) {

        return new TriplePattern(s, predicate, object);

    }

    public TriplePattern withPredicate(final Predicate p) {

        return new TriplePattern(subject, p, object);

    }

    public TriplePattern withObject(final Value o) {

        return new TriplePattern(subject, predicate, o);

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
     * <code>true</code> iff no field is specified.
     */
    public boolean isWildcard() {

        return subject == null && predicate == null && object == null;

    }

    /**
     * <code>true</code> iff every field is specified.
     */
    public boolean isFullyBound() {

        return subject != null && predicate != null && object != null;

    }

    /**
     * <code>true</code> iff every specified field equals the corresponding
     * field of the triple.
     */
    public boolean matches(final Triple t) {

        if (subject != null && !subject.equals(t.getSubject()))
            return false;

        if (predicate != null && !predicate.equals(t.getPredicate()))
            return false;

        if (object != null && !object.equals(t.getObject()))
            return false;

        return true;

    }

    /**
     * The triple described by a fully bound pattern.
     * 
     * @throws IllegalStateException
     *             if some field is not specified.
     */
    public Triple toTriple() {

        if (!isFullyBound())
            throw new IllegalStateException(toString());

        return new Triple(subject, predicate, object);

    }

    public boolean equals(final Object o) {

        if (this == o)
            return true;

        if (!(o instanceof TriplePattern))
            return false;

        final TriplePattern t = (TriplePattern) o;

        return eq(subject, t.subject) && eq(predicate, t.predicate)
                && eq(object, t.object);

    }

    private static boolean eq(final Object a, final Object b) {

        return a == null ? b == null : a.equals(b);

    }

    public int hashCode() {

        int h = subject == null ? 0 : subject.hashCode();

        h = 31 * h + (predicate == null ? 0 : predicate.hashCode());

        h = 31 * h + (object == null ? 0 : object.hashCode());

        return h;

    }

    public String toString() {

        return "(" + (subject == null ? "*" : subject) + ", "
                + (predicate == null ? "*" : predicate) + ", "
                + (object == null ? "*" : object) + ")";

    }

}
