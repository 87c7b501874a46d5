package org.calista.kinda.io;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FileIOTest {

    @Test
    @DisplayName("relative paths stay under the base directory")
    void resolve(@TempDir Path dir) {
        FileIO io = new FileIO(dir);
        assertEquals(dir.toAbsolutePath().normalize().resolve("a/b.txt"), io.resolve("a/b.txt"));
        assertThrows(IllegalArgumentException.class, () -> io.resolve("../escape.txt"));
        assertThrows(IllegalArgumentException.class, () -> io.resolve(dir.resolve("x").toAbsolutePath().toString()));
    }

    @Test
    @DisplayName("write creates parents and read returns the text unchanged")
    void writeRead(@TempDir Path dir) throws Exception {
        FileIO io = new FileIO(dir);
        Path f = io.resolve("deep/nested/Out.java");
        io.writeString(f, "a\r\nb\n");
        assertEquals("a\r\nb\n", io.readString(f));

        io.writeString(f, "c");
        assertEquals("c", io.readString(f));
    }

    @Test
    @DisplayName("JSONL records are single lines; missing file reads as empty")
    void jsonl(@TempDir Path dir) throws Exception {
        FileIO io = new FileIO(dir);
        Path f = io.resolve("log.jsonl");
        assertTrue(io.readJsonl(f).isEmpty());

        io.appendJsonl(f, "{\"a\":1}");
        io.appendJsonl(f, "   ");
        io.appendJsonl(f, " {\"a\":2} ");
        assertEquals(List.of("{\"a\":1}", "{\"a\":2}"), io.readJsonl(f));

        assertThrows(IllegalArgumentException.class, () -> io.appendJsonl(f, "{\"a\":\n3}"));
    }

    @Test
    @DisplayName("walk lists matching files sorted, ignores the rest")
    void walk(@TempDir Path dir) throws Exception {
        FileIO io = new FileIO(dir);
        io.writeString(io.resolve("src/b/B.java.knda"), "b");
        io.writeString(io.resolve("src/a/A.java.KNDA"), "a");
        io.writeString(io.resolve("src/a/notes.txt"), "n");

        List<Path> found = io.walk(io.resolve("src"), ".knda");
        assertEquals(2, found.size());
        assertTrue(found.get(0).endsWith(Path.of("a", "A.java.KNDA")));
        assertTrue(found.get(1).endsWith(Path.of("b", "B.java.knda")));

        assertTrue(io.walk(io.resolve("missing"), ".knda").isEmpty());
        assertTrue(Files.isDirectory(io.baseDir()));
    }
}
