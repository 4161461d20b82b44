package com.armada.core.engine;

import com.armada.core.model.ChangeType;
import com.armada.core.model.FileChange;
import com.armada.core.workspace.InMemoryWorkspaceFiles;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ResponseChangeParserTest {

    private final ResponseChangeParser parser =
            new ResponseChangeParser(new InMemoryWorkspaceFiles(Map.of("src/a.ts", "old")));

    @Test
    @DisplayName("Existing paths become modifications, new paths creations")
    void changeTypes() {
        List<FileChange> changes = parser.parse("""
                Updated a and added b.
                ```ts src/a.ts
                new a
                ```
                ```ts src/b.ts
                new b
                ```
                """);

        assertEquals(2, changes.size());
        assertEquals(new FileChange("src/a.ts", ChangeType.MODIFY, null, "new a"), changes.get(0));
        assertEquals(new FileChange("src/b.ts", ChangeType.CREATE, null, "new b"), changes.get(1));
    }

    @Test
    @DisplayName("Blocks without a path are ignored")
    void ignoresUnnamedBlocks() {
        List<FileChange> changes = parser.parse("""
                ```java
                int x = 1;
                ```
                ```
                plain
                ```
                """);

        assertTrue(changes.isEmpty());
    }

    @Test
    @DisplayName("The last block wins when a path repeats")
    void lastBlockWins() {
        List<FileChange> changes = parser.parse("```ts src/a.ts\nfirst\n```\n```ts src/a.ts\nsecond\n```");

        assertEquals(1, changes.size());
        assertEquals("second", changes.get(0).modifiedContent());
    }

    @Test
    @DisplayName("Header forms")
    void headerForms() {
        assertEquals("src/main/java/App.java", ResponseChangeParser.pathFrom("java // src/main/java/App.java"));
        assertEquals("src/a.ts", ResponseChangeParser.pathFrom("src/a.ts"));
        assertEquals("scripts/run.py", ResponseChangeParser.pathFrom("python # scripts/run.py"));
        assertEquals("src/x.ts", ResponseChangeParser.pathFrom("ts ./src/x.ts"));
        assertEquals("Makefile.am", ResponseChangeParser.pathFrom("Makefile.am"));
        assertNull(ResponseChangeParser.pathFrom("java"));
        assertNull(ResponseChangeParser.pathFrom(""));
        assertNull(ResponseChangeParser.pathFrom("see the file below"));
    }

    @Test
    @DisplayName("Empty answers carry no changes")
    void emptyAnswer() {
        assertTrue(parser.parse(null).isEmpty());
        assertTrue(parser.parse("").isEmpty());
        assertTrue(parser.parse("No code needed.").isEmpty());
    }
}
