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
 * The kinds of {@link Value}. The byte code of each kind is part of the
 * canonical triple encoding and must never change.
 * 
 * @version $Id$
 */
public enum ValueType {

    NODE((byte) 0x20),

    STRING((byte) 0x21),

    INTEGER((byte) 0x22),

    FLOAT((byte) 0x23),

    BOOLEAN((byte) 0x24);

    private final byte code;

    private ValueType(final byte code) {

        this.code = code;

    }

    public byte getCode() {

        return code;

    }

    /**
     * Return the type for the code.
     * 
     * @throws IllegalArgumentException
     *             if the code is not defined.
     */
    public static ValueType valueOf(final byte code) {

        switch (code) {
        case 0x20:
            return NODE;
        case 0x21:
            return STRING;
        case 0x22:
            return INTEGER;
        case 0x23:
            return FLOAT;
        case 0x24:
            return BOOLEAN;
        default:
            throw new IllegalArgumentException("code=" + code);
        }

    }

}
