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

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Arrays;

/**
 * The content address of a {@link Triple}: the SHA-256 digest of its
 * canonical encoding (see {@link TripleSerializer}). Instances are ordered by
 * unsigned lexicographic comparison of the digest bytes.
 * 
 * @version $Id$
 */
final public class TripleId implements Comparable<TripleId> {

    /**
     * The length of a triple id in bytes.
     */
    public static final int LENGTH = 32;

    private static final char[] HEX = "0123456789abcdef".toCharArray();

    private final byte[] digest;

    private int hash = 0;

    private TripleId(final byte[] digest) {

        this.digest = digest;

    }

    /**
     * Wrap an existing digest.
     * 
     * @param digest
     *            The 32 digest bytes. The array is copied.
     */
    public static TripleId wrap(final byte[] digest) {

        if (digest == null)
            throw new IllegalArgumentException();

        if (digest.length != LENGTH)
            throw new IllegalArgumentException("length=" + digest.length);

        return new TripleId(digest.clone());

    }

    /**
     * Compute the id of a canonical triple encoding.
     */
    public static TripleId digest(final byte[] canonical) {

        if (canonical == null)
            throw new IllegalArgumentException();

        final MessageDigest md;
        try {
            md = MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException ex) {
            throw new RuntimeException(ex);
        }

        return new TripleId(md.digest(canonical));

    }

    /**
     * Parse the lower or upper case hex form produced by {@link #toString()}.
     */
    public static TripleId fromHex(final String s) {

        if (s == null)
            throw new IllegalArgumentException();

        if (s.length() != LENGTH * 2)
            throw new IllegalArgumentException("Not a triple id: " + s);

        final byte[] b = new byte[LENGTH];

        for (int i = 0; i < LENGTH; i++) {

            final int hi = Character.digit(s.charAt(2 * i), 16);
            final int lo = Character.digit(s.charAt(2 * i + 1), 16);

            if (hi < 0 || lo < 0)
                throw new IllegalArgumentException("Not a triple id: " + s);

            b[i] = (byte) ((hi << 4) | lo);

        }

        return new TripleId(b);

    }

    /**
     * A copy of the digest bytes.
     */
    public byte[] toByteArray() {

        return digest.clone();

    }

    public int compareTo(final TripleId o) {

        for (int i = 0; i < LENGTH; i++) {

            final int a = digest[i] & 0xff;
            final int b = o.digest[i] & 0xff;

            if (a != b)
                return a < b ? -1 : 1;

        }

        return 0;

    }

    public boolean equals(final Object o) {

        if (this == o)
            return true;

        if (!(o instanceof TripleId))
            return false;

        return Arrays.equals(digest, ((TripleId) o).digest);

    }

    public int hashCode() {

        if (hash == 0) {

            hash = Arrays.hashCode(digest);

        }

        return hash;

    }

    public String toString() {

        final char[] a = new char[LENGTH * 2];

        for (int i = 0; i < LENGTH; i++) {

            a[2 * i] = HEX[(digest[i] >> 4) & 0xf];
            a[2 * i + 1] = HEX[digest[i] & 0xf];

        }

        return new String(a);

    }

}
