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

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;

import com.pologic.graph.GraphException;

/**
 * The canonical binary encoding of a {@link Triple}. The same bytes are
 * hashed to form the {@link TripleId} and stored by the persistent backends,
 * so the encoding is deterministic and never changes for a given version
 * byte.
 * <p>
 * Layout (big-endian):
 * 
 * <pre>
 * version    := 0x01
 * node       := (0x01 named | 0x02 blank) u32:len utf8
 * predicate  := 0x10 u32:len utf8
 * object     := 0x20 node
 *             | 0x21 u32:len utf8
 *             | 0x22 i64
 *             | 0x23 i64 (IEEE-754 bits)
 *             | 0x24 u8 (0 or 1)
 * triple     := version node predicate object
 * </pre>
 * 
 * @version $Id$
 */
public class TripleSerializer {

    public static final byte VERSION = 0x01;

    static final byte NAMED = 0x01;

    static final byte BLANK = 0x02;

    static final byte PREDICATE = 0x10;

    private TripleSerializer() {

    }

    /**
     * Return the canonical encoding of the triple.
     */
    public static byte[] encode(final Triple t) {

        if (t == null)
            throw new IllegalArgumentException();

        final ByteArrayOutputStream baos = new ByteArrayOutputStream(64);

        final DataOutputStream out = new DataOutputStream(baos);

        try {

            out.writeByte(VERSION);

            writeNode(out, t.getSubject());

            out.writeByte(PREDICATE);
            writeString(out, t.getPredicate().getName());

            writeValue(out, t.getObject());

            out.flush();

        } catch (IOException ex) {

            // Not expected for a byte array stream.
            throw new GraphException(GraphException.Kind.SERIALIZATION,
                    t.toString(), ex);

        }

        return baos.toByteArray();

    }

    /**
     * Decode a canonical encoding.
     * 
     * @throws GraphException
     *             of kind {@link GraphException.Kind#SERIALIZATION} if the
     *             record is malformed.
     */
    public static Triple decode(final byte[] b) {

        if (b == null)
            throw new IllegalArgumentException();

        final DataInputStream in = new DataInputStream(
                new ByteArrayInputStream(b));

        try {

            final byte version = in.readByte();

            if (version != VERSION)
                throw new GraphException(GraphException.Kind.SERIALIZATION,
                        "Unknown version: " + version);

            final NodeId s = readNode(in, in.readByte());

            final byte ptag = in.readByte();

            if (ptag != PREDICATE)
                throw new GraphException(GraphException.Kind.SERIALIZATION,
                        "Expecting predicate, tag=" + ptag);

            final Predicate p = new Predicate(readString(in));

            final Value o = readValue(in);

            if (in.available() != 0)
                throw new GraphException(GraphException.Kind.SERIALIZATION,
                        "Trailing bytes: " + in.available());

            return new Triple(s, p, o);

        } catch (IOException ex) {

            throw new GraphException(GraphException.Kind.SERIALIZATION,
                    "Truncated record: length=" + b.length, ex);

        }

    }

    /**
     * Encode a value alone, using the same layout as the object position of
     * a triple. Used to key the object index.
     */
    public static byte[] encodeValue(final Value v) {

        final ByteArrayOutputStream baos = new ByteArrayOutputStream(32);

        final DataOutputStream out = new DataOutputStream(baos);

        try {

            writeValue(out, v);

            out.flush();

        } catch (IOException ex) {

            throw new GraphException(GraphException.Kind.SERIALIZATION,
                    v.toString(), ex);

        }

        return baos.toByteArray();

    }

    private static void writeNode(final DataOutputStream out, final NodeId id)
            throws IOException {

        out.writeByte(id.isNamed() ? NAMED : BLANK);

        writeString(out, id.getLabel());

    }

    private static NodeId readNode(final DataInputStream in, final byte tag)
            throws IOException {

        switch (tag) {
        case NAMED:
            return NodeId.named(readString(in));
        case BLANK:
            return NodeId.blank(readString(in));
        default:
            throw new GraphException(GraphException.Kind.SERIALIZATION,
                    "Expecting node, tag=" + tag);
        }

    }

    private static void writeValue(final DataOutputStream out, final Value v)
            throws IOException {

        out.writeByte(v.getType().getCode());

        switch (v.getType()) {
        case NODE:
            writeNode(out, v.asNode());
            break;
        case STRING:
            writeString(out, ((Value.StringValue) v).stringValue());
            break;
        case INTEGER:
            out.writeLong(((Value.IntegerValue) v).longValue());
            break;
        case FLOAT:
            out.writeLong(Double.doubleToRawLongBits(v.doubleValue()));
            break;
        case BOOLEAN:
            out.writeByte(((Value.BooleanValue) v).booleanValue() ? 1 : 0);
            break;
        default:
            throw new AssertionError(v.getType());
        }

    }

    private static Value readValue(final DataInputStream in)
            throws IOException {

        final byte tag = in.readByte();

        final ValueType type;
        try {
            type = ValueType.valueOf(tag);
        } catch (IllegalArgumentException ex) {
            throw new GraphException(GraphException.Kind.SERIALIZATION,
                    "Unknown value tag: " + tag, ex);
        }

        switch (type) {
        case NODE:
            return Value.node(readNode(in, in.readByte()));
        case STRING:
            return Value.string(readString(in));
        case INTEGER:
            return Value.integer(in.readLong());
        case FLOAT:
            return Value.floating(Double.longBitsToDouble(in.readLong()));
        case BOOLEAN: {
            final byte b = in.readByte();
            if (b != 0 && b != 1)
                throw new GraphException(GraphException.Kind.SERIALIZATION,
                        "Bad boolean: " + b);
            return Value.bool(b == 1);
        }
        default:
            throw new AssertionError(type);
        }

    }

    private static void writeString(final DataOutputStream out,
            final String s) throws IOException {

        final byte[] b = s.getBytes(StandardCharsets.UTF_8);

        out.writeInt(b.length);

        out.write(b);

    }

    private static String readString(final DataInputStream in)
            throws IOException {

        final int len = in.readInt();

        if (len < 0 || len > in.available())
            throw new GraphException(GraphException.Kind.SERIALIZATION,
                    "Bad string length: " + len);

        final byte[] b = new byte[len];

        in.readFully(b);

        return new String(b, StandardCharsets.UTF_8);

    }

}
