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
 * Created on Mar 5, 2026
 */

package com.pologic.graph.backend;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

import org.apache.log4j.Logger;

import com.pologic.graph.GraphException;
import com.pologic.graph.model.Triple;
import com.pologic.graph.model.TripleId;
import com.pologic.graph.model.TripleSerializer;

/**
 * A persistent backend storing the canonical encodings in a single SQL
 * table of an embedded H2 database:
 * 
 * <pre>
 * triples(id BINARY(32) PRIMARY KEY, len INT, data BLOB)
 * </pre>
 * 
 * All statements run on one connection in auto-commit mode and are
 * serialized on {@link #lock}. The row count and the byte total are read
 * once when connecting and then maintained by {@link #put(TripleId, Triple)}
 * and {@link #delete(TripleId)}.
 * 
 * @version $Id$
 */
public class JdbcBackend extends AbstractStorageBackend {

    private static final transient Logger log = Logger
            .getLogger(JdbcBackend.class);

    static final String TABLE = "triples";

    static final String CREATE_TABLE = "CREATE TABLE IF NOT EXISTS " + TABLE
            + " (id BINARY(32) PRIMARY KEY, len INT NOT NULL, data BLOB NOT NULL)";

    private final Object lock = new Object();

    private final String url;

    private final Connection con;

    private final PreparedStatement insertStmt;

    private final PreparedStatement selectStmt;

    private final PreparedStatement existsStmt;

    private final PreparedStatement lenStmt;

    private final PreparedStatement deleteStmt;

    private final PreparedStatement countStmt;

    private final PreparedStatement sizeStmt;

    private final PreparedStatement selectAllStmt;

    /**
     * The number of rows (guarded by {@link #lock}).
     */
    private long nrecords;

    /**
     * The sum of the <code>len</code> column (guarded by {@link #lock}).
     */
    private long nbytes;

    /**
     * Connect to the database, creating the table if it does not exist.
     * 
     * @param url
     *            The JDBC URL, e.g. <code>jdbc:h2:/var/data/graph</code>.
     */
    public JdbcBackend(final String url) {

        if (url == null)
            throw new IllegalArgumentException();

        this.url = url;

        try {

            con = DriverManager.getConnection(url);

        } catch (SQLException ex) {

            throw new GraphException(GraphException.Kind.BACKEND_UNAVAILABLE,
                    "Could not connect: " + url, ex);

        }

        try {

            con.setAutoCommit(true);

            final Statement stmt = con.createStatement();
            try {
                stmt.execute(CREATE_TABLE);
            } finally {
                stmt.close();
            }

            insertStmt = con.prepareStatement("MERGE INTO " + TABLE
                    + " (id, len, data) KEY (id) VALUES (?, ?, ?)");

            selectStmt = con.prepareStatement("SELECT data FROM " + TABLE
                    + " WHERE id = ?");

            existsStmt = con.prepareStatement("SELECT 1 FROM " + TABLE
                    + " WHERE id = ?");

            lenStmt = con.prepareStatement("SELECT len FROM " + TABLE
                    + " WHERE id = ?");

            deleteStmt = con.prepareStatement("DELETE FROM " + TABLE
                    + " WHERE id = ?");

            countStmt = con.prepareStatement("SELECT COUNT(*) FROM " + TABLE);

            sizeStmt = con.prepareStatement("SELECT COALESCE(SUM(len), 0) FROM "
                    + TABLE);

            selectAllStmt = con.prepareStatement("SELECT data FROM " + TABLE
                    + " ORDER BY id");

            nrecords = queryLong(countStmt);

            nbytes = queryLong(sizeStmt);

        } catch (SQLException ex) {

            try {
                con.close();
            } catch (SQLException ex2) {
                log.warn("Could not close: " + url, ex2);
            }

            throw new GraphException(GraphException.Kind.STORAGE,
                    "Could not initialize: " + url, ex);

        }

        if (log.isInfoEnabled())
            log.info("Connected: url=" + url + ", records=" + nrecords);

    }

    public BackendType getBackendType() {

        return BackendType.Jdbc;

    }

    public String getUrl() {

        return url;

    }

    private GraphException storageError(final String msg,
            final SQLException ex) {

        return new GraphException(GraphException.Kind.STORAGE, msg + ": " + ex,
                ex);

    }

    public void put(final TripleId id, final Triple triple) {

        if (id == null || triple == null)
            throw new IllegalArgumentException();

        final byte[] b = TripleSerializer.encode(triple);

        synchronized (lock) {

            assertOpen();

            try {

                final int oldLen = recordLength(id);

                insertStmt.setBytes(1, id.toByteArray());
                insertStmt.setInt(2, b.length);
                insertStmt.setBytes(3, b);

                insertStmt.executeUpdate();

                if (oldLen < 0) {

                    nrecords++;

                    nbytes += b.length;

                } else {

                    nbytes += b.length - oldLen;

                }

            } catch (SQLException ex) {

                throw storageError("on put(" + id + ")", ex);

            }

        }

    }

    public Triple get(final TripleId id) {

        if (id == null)
            throw new IllegalArgumentException();

        final byte[] b;

        synchronized (lock) {

            assertOpen();

            try {

                selectStmt.setBytes(1, id.toByteArray());

                final ResultSet rs = selectStmt.executeQuery();
                try {
                    b = rs.next() ? rs.getBytes(1) : null;
                } finally {
                    rs.close();
                }

            } catch (SQLException ex) {

                throw storageError("on get(" + id + ")", ex);

            }

        }

        return b == null ? null : TripleSerializer.decode(b);

    }

    public boolean exists(final TripleId id) {

        if (id == null)
            throw new IllegalArgumentException();

        synchronized (lock) {

            assertOpen();

            try {

                existsStmt.setBytes(1, id.toByteArray());

                final ResultSet rs = existsStmt.executeQuery();
                try {
                    return rs.next();
                } finally {
                    rs.close();
                }

            } catch (SQLException ex) {

                throw storageError("on exists(" + id + ")", ex);

            }

        }

    }

    public boolean delete(final TripleId id) {

        if (id == null)
            throw new IllegalArgumentException();

        synchronized (lock) {

            assertOpen();

            try {

                final int oldLen = recordLength(id);

                if (oldLen < 0)
                    return false;

                deleteStmt.setBytes(1, id.toByteArray());

                if (deleteStmt.executeUpdate() == 0)
                    return false;

                nrecords--;

                nbytes -= oldLen;

                return true;

            } catch (SQLException ex) {

                throw storageError("on delete(" + id + ")", ex);

            }

        }

    }

    public Iterator<Triple> iterAll() {

        final List<byte[]> records = new ArrayList<byte[]>();

        synchronized (lock) {

            assertOpen();

            try {

                final ResultSet rs = selectAllStmt.executeQuery();
                try {
                    while (rs.next()) {
                        records.add(rs.getBytes(1));
                    }
                } finally {
                    rs.close();
                }

            } catch (SQLException ex) {

                throw storageError("on iterAll()", ex);

            }

        }

        final List<Triple> a = new ArrayList<Triple>(records.size());

        for (byte[] b : records) {

            a.add(TripleSerializer.decode(b));

        }

        return a.iterator();

    }

    /**
     * Return the single long value of the query.
     */
    private static long queryLong(final PreparedStatement stmt)
            throws SQLException {

        final ResultSet rs = stmt.executeQuery();
        try {
            rs.next();
            return rs.getLong(1);
        } finally {
            rs.close();
        }

    }

    /**
     * Return the length of the stored record -or- <code>-1</code> if there
     * is no record for that id. The caller must hold {@link #lock}.
     */
    private int recordLength(final TripleId id) throws SQLException {

        lenStmt.setBytes(1, id.toByteArray());

        final ResultSet rs = lenStmt.executeQuery();
        try {
            return rs.next() ? rs.getInt(1) : -1;
        } finally {
            rs.close();
        }

    }

    public long count() {

        synchronized (lock) {

            assertOpen();

            return nrecords;

        }

    }

    public long sizeBytes() {

        synchronized (lock) {

            assertOpen();

            return nbytes;

        }

    }

    /**
     * Statements are auto-committed so there is nothing to do.
     */
    public void flush() {

        assertOpen();

    }

    public void close() {

        synchronized (lock) {

            if (!markClosed())
                return;

            try {

                con.close();

            } catch (SQLException ex) {

                throw storageError("on close()", ex);

            }

        }

        if (log.isInfoEnabled())
            log.info("Closed: url=" + url);

    }

}
