package io.causelog.projection;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.causelog.util.Jsons;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

final class MigrationTableTest {

    private static PayloadMigration tag(String step) {
        return payload -> {
            ObjectNode copy = (ObjectNode) payload;
            ArrayNode steps = copy.has("steps") ? (ArrayNode) copy.get("steps") : copy.putArray("steps");
            steps.add(step);
            return copy;
        };
    }

    private static MigrationTable table() {
        return MigrationTable.builder()
                .add("Rename", tag("t0"), tag("t1"), tag("t2"))
                .build();
    }

    @Test
    void versionOneRunsEveryStepInOrder() throws Exception {
        JsonNode out = table().apply("Rename", 1, Jsons.object());
        Assertions.assertEquals("[\"t0\",\"t1\",\"t2\"]", Jsons.toCompactJson(out.get("steps")));
    }

    @Test
    void laterVersionsSkipStepsAlreadyApplied() throws Exception {
        JsonNode out = table().apply("Rename", 3, Jsons.object());
        Assertions.assertEquals("[\"t2\"]", Jsons.toCompactJson(out.get("steps")));
    }

    @Test
    void currentVersionPassesPayloadThrough() throws Exception {
        ObjectNode original = Jsons.object();
        original.put("name", "x");
        Assertions.assertEquals(4, table().currentVersion("Rename"));
        Assertions.assertSame(original, table().apply("Rename", 4, original));
        Assertions.assertSame(original, table().apply("Unknown", 1, original));
    }

    @Test
    void storedPayloadIsNeverMutated() throws Exception {
        ObjectNode original = Jsons.object();
        table().apply("Rename", 1, original);
        Assertions.assertFalse(original.has("steps"));
    }

    @Test
    void nullStepsActAsIdentity() throws Exception {
        MigrationTable table = MigrationTable.builder().add("Cmd", null, tag("t1")).build();
        JsonNode out = table.apply("Cmd", 1, Jsons.object());
        Assertions.assertEquals("[\"t1\"]", Jsons.toCompactJson(out.get("steps")));
        Assertions.assertThrows(IllegalArgumentException.class, () -> MigrationTable.builder().add(" ", tag("x")));
    }
}
