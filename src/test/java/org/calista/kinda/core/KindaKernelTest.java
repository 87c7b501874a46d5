package org.calista.kinda.core;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.calista.kinda.runtime.Kinda;
import org.calista.kinda.transform.KindaSyntaxException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class KindaKernelTest {

    static final String GOOD = ""
            + "class Good {\n"
            + "    void f(int x) {\n"
            + "        ~sometimes (x > 0) {\n"
            + "            x++;\n"
            + "        }\n"
            + "    }\n"
            + "}\n";

    static final String BAD = "~sometimes_while running\n";

    static void write(Path file, String text) throws Exception {
        Files.createDirectories(file.getParent());
        Files.writeString(file, text);
    }

    static KindaKernel kernel(Path root) throws Exception {
        return KindaKernel.builder().configRoot(root).build(Path.of("config/kinda.json"));
    }

    @Test
    @DisplayName("transforms the tree, writes source maps, reports failures per file")
    void transformTree(@TempDir Path root) throws Exception {
        write(root.resolve("src/main/kinda/demo/Good.java.knda"), GOOD);
        write(root.resolve("src/main/kinda/demo/Bad.java.knda"), BAD);
        write(root.resolve("src/main/kinda/demo/readme.txt"), "not a source");

        try (KindaKernel k = kernel(root)) {
            assertTrue(Files.exists(root.resolve("config/kinda.json")));

            TransformReport report = k.transformTree();

            assertEquals(2, report.files());
            assertEquals(1, report.nodes());
            assertEquals(1, report.written().size());
            assertTrue(report.hasFailures());
            KindaSyntaxException failure = report.failures().values().iterator().next();
            assertEquals(1, failure.line());

            Path outRoot = root.resolve("build/kinda/generated-sources/kinda/demo");
            String java = Files.readString(outRoot.resolve("Good.java"));
            assertTrue(java.contains("if (Kinda.sometimes(x > 0)) {"), java);
            assertFalse(java.contains("~sometimes"));
            assertFalse(Files.exists(outRoot.resolve("Bad.java")));

            JsonNode map = new ObjectMapper().readTree(Files.readString(outRoot.resolve("Good.java.map.json")));
            assertEquals("demo/Good.java.knda", map.get("file").asText());
            assertEquals("demo/Good.java", map.get("generatedFile").asText());
            assertTrue(map.get("lines").size() >= 7);
        }
    }

    @Test
    @DisplayName("file that stops transforming loses its earlier output and source map")
    void failedFileDropsStaleOutput(@TempDir Path root) throws Exception {
        Path src = root.resolve("src/main/kinda/A.java.knda");
        Path outRoot = root.resolve("build/kinda/generated-sources/kinda");
        write(src, "class A {\n    void f(boolean c) {\n        ~sometimes (c) {\n        }\n    }\n}\n");

        try (KindaKernel k = kernel(root)) {
            assertFalse(k.transformTree().hasFailures());
            assertTrue(Files.exists(outRoot.resolve("A.java")));
            assertTrue(Files.exists(outRoot.resolve("A.java.map.json")));

            write(src, "class A {\n    void f(boolean c) {\n        ~sometiems (c) {\n        }\n    }\n}\n");
            TransformReport second = k.transformTree();

            assertEquals(1, second.failures().size());
            assertEquals(3, second.failures().values().iterator().next().line());
            assertFalse(Files.exists(outRoot.resolve("A.java")));
            assertFalse(Files.exists(outRoot.resolve("A.java.map.json")));
        }
    }

    @Test
    @DisplayName("configured seed makes the kernel runtime reproducible")
    void seeded(@TempDir Path root) throws Exception {
        write(root.resolve("config/kinda.json"), "{\"personality\":{\"mood\":\"chaotic\",\"chaosLevel\":9,\"seed\":99}}");

        try (KindaKernel a = kernel(root); KindaKernel b = kernel(root)) {
            assertEquals("chaotic", a.personality().current().mood().id());
            for (int i = 0; i < 50; i++) {
                assertEquals(a.runtime().kindaFloat(i), b.runtime().kindaFloat(i));
            }
        }
    }

    @Test
    @DisplayName("installed runtime backs the facade until close")
    void install(@TempDir Path root) throws Exception {
        KindaKernel k = kernel(root);
        k.installRuntime();
        try {
            assertTrue(k.isInstalled());
            assertSame(k.runtime(), Kinda.runtime());
        } finally {
            k.close();
        }
        assertFalse(k.isInstalled());
        assertNotSame(k.runtime(), Kinda.runtime());
    }
}
