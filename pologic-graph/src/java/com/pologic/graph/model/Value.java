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
 * The object of a triple. This is a closed sum of a reference to another
 * node, a string, a 64-bit integer, a 64-bit float and a boolean. Instances
 * are immutable and compare by kind and payload.
 * 
 * @version $Id$
 */
public abstract class Value {

    /**
     * Only the nested classes may extend this one.
     */
    private Value() {

    }

    public static Value node(final NodeId id) {

        return new NodeValue(id);

    }

    /**
     * A reference to the named node.
     */
    public static Value node(final String name) {

        return new NodeValue(NodeId.named(name));

    }

    public static Value string(final String s) {

        return new StringValue(s);

    }

    public static Value integer(final long v) {

        return new IntegerValue(v);

    }

    public static Value floating(final double v) {

        return new FloatValue(v);

    }

    public static Value bool(final boolean v) {

        return v ? BooleanValue.TRUE : BooleanValue.FALSE;

    }

    abstract public ValueType getType();

    public boolean isNode() {

        return getType() == ValueType.NODE;

    }

    /**
     * <code>true</code> for {@link ValueType#INTEGER} and
     * {@link ValueType#FLOAT}.
     */
    public boolean isNumeric() {

        final ValueType t = getType();

        return t == ValueType.INTEGER || t == ValueType.FLOAT;

    }

    /**
     * The referenced node.
     * 
     * @throws UnsupportedOperationException
     *             unless this is a node reference.
     */
    public NodeId asNode() {

        throw new UnsupportedOperationException(getType().toString());

    }

    /**
     * The numeric payload widened to a double.
     * 
     * @throws UnsupportedOperationException
     *             unless this value {@link #isNumeric()}.
     */
    public double doubleValue() {

        throw new UnsupportedOperationException(getType().toString());

    }

    /**
     * The payload rendered as a string, without any type decoration.
     */
    abstract public String getLexicalForm();

    public String toString() {

        return getLexicalForm();

    }

    /**
     * A reference to another node.
     */
    public static final class NodeValue extends Value {

        private final NodeId id;

        private NodeValue(final NodeId id) {

            if (id == null)
                throw new IllegalArgumentException();

            this.id = id;

        }

        public ValueType getType() {

            return ValueType.NODE;

        }

        public NodeId asNode() {

            return id;

        }

        public String getLexicalForm() {

            return id.toString();

        }

        public boolean equals(final Object o) {

            if (this == o)
                return true;

            if (!(o instanceof NodeValue))
                return false;

            return id.equals(((NodeValue) o).id);

        }

        public int hashCode() {

            return id.hashCode();

        }

    }

    public static final class StringValue extends Value {

        private final String value;

        private StringValue(final String value) {

            if (value == null)
                throw new IllegalArgumentException();

            this.value = value;

        }

        public ValueType getType() {

            return ValueType.STRING;

        }

        public String stringValue() {

            return value;

        }

        public String getLexicalForm() {

            return value;

        }

        public String toString() {

            return "\"" + value + "\"";

        }

        public boolean equals(final Object o) {

            if (this == o)
                return true;

            if (!(o instanceof StringValue))
                return false;

            return value.equals(((StringValue) o).value);

        }

        public int hashCode() {

            return 7 + value.hashCode();

        }

    }

    public static final class IntegerValue extends Value {

        private final long value;

        private IntegerValue(final long value) {

            this.value = value;

        }

        public ValueType getType() {

            return ValueType.INTEGER;

        }

        public long longValue() {

            return value;

        }

        public double doubleValue() {

            return value;

        }

        public String getLexicalForm() {

            return Long.toString(value);

        }

        public boolean equals(final Object o) {

            if (this == o)
                return true;

            if (!(o instanceof IntegerValue))
                return false;

            return value == ((IntegerValue) o).value;

        }

        public int hashCode() {

            return Long.hashCode(value);

        }

    }

    /**
     * A 64-bit float. Equality uses the IEEE-754 bit pattern, which is also
     * what gets encoded, so <code>NaN</code> equals itself while
     * <code>0.0</code> and <code>-0.0</code> differ.
     */
    public static final class FloatValue extends Value {

        private final double value;

        private FloatValue(final double value) {

            this.value = value;

        }

        public ValueType getType() {

            return ValueType.FLOAT;

        }

        public double doubleValue() {

            return value;

        }

        public String getLexicalForm() {

            return Double.toString(value);

        }

        public boolean equals(final Object o) {

            if (this == o)
                return true;

            if (!(o instanceof FloatValue))
                return false;

            return Double.doubleToRawLongBits(value) == Double
                    .doubleToRawLongBits(((FloatValue) o).value);

        }

        public int hashCode() {

            return Long.hashCode(Double.doubleToRawLongBits(value));

        }

    }

    public static final class BooleanValue extends Value {

        static final BooleanValue TRUE = new BooleanValue(true);

        static final BooleanValue FALSE = new BooleanValue(false);

        private final boolean value;

        private BooleanValue(final boolean value) {

            this.value = value;

        }

        public ValueType getType() {

            return ValueType.BOOLEAN;

        }

        public boolean booleanValue() {

            return value;

        }

        public String getLexicalForm() {

            return Boolean.toString(value);

        }

        public boolean equals(final Object o) {

            if (this == o)
                return true;

            if (!(o instanceof BooleanValue))
                return false;

            return value == ((BooleanValue) o).value;

        }

        public int hashCode() {

            return value ? 1231 : 1237;

        }

    }

}
