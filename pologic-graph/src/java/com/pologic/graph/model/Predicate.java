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
 * A named relation label. Two predicates are equal iff their names are
 * equal.
 * 
 * @version $Id$
 */
final public class Predicate implements Comparable<Predicate> {

    public static final Predicate RDF_TYPE = new Predicate("rdf:type");

    public static final Predicate RDFS_SUBCLASS_OF = new Predicate(
            "rdfs:subClassOf");

    public static final Predicate OWL_SAME_AS = new Predicate("owl:sameAs");

    private final String name;

    public Predicate(final String name) {

        if (name == null)
            throw new IllegalArgumentException();

        this.name = name;

    }

    public static Predicate of(final String name) {

        return new Predicate(name);

    }

    public String getName() {

        return name;

    }

    /**
     * The text before the first <code>:</code>, or <code>null</code>.
     */
    public String namespace() {

        final int i = name.indexOf(':');

        return i < 0 ? null : name.substring(0, i);

    }

    /**
     * The text after the last <code>:</code>.
     */
    public String localName() {

        return name.substring(name.lastIndexOf(':') + 1);

    }

    public int compareTo(final Predicate o) {

        return name.compareTo(o.name);

    }

    public boolean equals(final Object o) {

        if (this == o)
            return true;

        if (!(o instanceof Predicate))
            return false;

        return name.equals(((Predicate) o).name);

    }

    public int hashCode() {

        return name.hashCode();

    }

    public String toString() {

        return name;

    }

}
