package org.aincraft.vecstore.storage.record;

import java.sql.Connection;
import java.sql.SQLException;
import org.sqlite.Function;
import org.sqlite.SQLiteConnection;

/**
 * Java implementation of sqlite-vec's {@code vec_distance_l2(a, b)} for connections
 * that run without the extension. Both arguments are little-endian float32 blobs.
 */
public final class L2DistanceFunction extends Function {
    public static final String NAME = "vec_distance_l2";
    static final String LENGTH_MISMATCH = "vec_distance_l2: vector length mismatch";

    public static void register(Connection connection) throws SQLException {
        Function.create(connection.unwrap(SQLiteConnection.class), NAME, new L2DistanceFunction());
    }

    @Override
    protected void xFunc() throws SQLException {
        if (args() != 2) {
            error("vec_distance_l2 expects 2 arguments, got " + args());
            return;
        }
        byte[] a = value_blob(0);
        byte[] b = value_blob(1);
        if (a == null || b == null) {
            result();
            return;
        }
        if (a.length != b.length || a.length % Float.BYTES != 0) {
            error(LENGTH_MISMATCH);
            return;
        }
        result(VectorCodec.l2(a, b));
    }
}
