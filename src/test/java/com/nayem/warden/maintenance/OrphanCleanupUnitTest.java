package com.nayem.warden.maintenance;

import org.junit.jupiter.api.Test;

import javax.sql.DataSource;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;

public class OrphanCleanupUnitTest {

    @Test
    public void testSqlTargetsRowsWithoutParent() {
        OrphanCleanupUnit unit = new OrphanCleanupUnit(mock(DataSource.class),
                new OrphanCleanupUnit.Rule("messages", "flow_id", "flows", "id"), Duration.ofSeconds(5));

        assertEquals("DELETE FROM messages WHERE flow_id IS NOT NULL"
                + " AND NOT EXISTS (SELECT 1 FROM flows p WHERE p.id = messages.flow_id)", unit.sql());
        assertEquals("orphans:messages", unit.name());
    }

    @Test
    public void testIdentifiersAreValidated() {
        assertThrows(IllegalArgumentException.class,
                () -> new OrphanCleanupUnit.Rule("messages; DROP TABLE flows", "flow_id", "flows", "id"));
        assertThrows(IllegalArgumentException.class,
                () -> new OrphanCleanupUnit.Rule("messages", "1col", "flows", "id"));
        assertThrows(IllegalArgumentException.class,
                () -> new OrphanCleanupUnit.Rule("messages", "flow_id", null, "id"));
    }
}
