package shadow.postgis;

import org.junit.Test;

import java.util.HashMap;
import java.util.Map;

import static org.junit.Assert.*;

public class CommandExceptionTest {

    @Test
    public void testErrorData() {
        Map<String, String> errorData = new HashMap<>();
        errorData.put("M", "type \"geometry\" does not exist");
        errorData.put("S", "ERROR");
        errorData.put("C", "42704");

        CommandException e = new CommandException("Failed to execute query", errorData);

        assertEquals("Failed to execute query\nSeverity: ERROR\nCode: 42704\nMessage: type \"geometry\" does not exist", e.getMessage());
        assertEquals("42704", e.getSqlState());
        assertEquals("ERROR", e.getErrorData().get("S"));
    }

    @Test
    public void testNoServerError() {
        CommandException e = new CommandException("get geometry oid failed", new IllegalStateException("closed"));

        assertNull(e.getSqlState());
        assertTrue(e.getErrorData().isEmpty());
    }
}
