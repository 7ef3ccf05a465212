package shadow.postgis;

import java.io.IOException;

/**
 * What registration needs from a connection: one scalar query and the connection's type map.
 * <p/>
 * Implemented by the host driver, NOT THREAD-SAFE like the connection behind it.
 */
public interface Session {
    /**
     * execute a query that returns exactly one row with one column
     *
     * @return the decoded column value, may be null
     * @throws IOException if the query fails, server errors should be a CommandException
     */
    Object queryScalar(String sql) throws IOException;

    TypeMap getTypeMap();
}
