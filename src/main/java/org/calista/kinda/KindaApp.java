package org.calista.kinda;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.kinda.core.KindaKernel;
import org.calista.kinda.core.TransformReport;
import org.calista.kinda.transform.KindaSyntaxException;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;

/**
 * KindaApp: build-time runner.
 *
 * Lifecycle:
 *  1) build kernel (loads or creates config/kinda.json)
 *  2) transform the dialect source tree
 *  3) report, exit 1 when any file failed
 */
public final class KindaApp {

    private static final Logger log = LogManager.getLogger(KindaApp.class);

    static final Path DEFAULT_CONFIG = Path.of("config/kinda.json");

    private final Path configRoot;
    private final Path cfgPath;

    public KindaApp() {
        this(Path.of("."), DEFAULT_CONFIG);
    }

    public KindaApp(Path configRoot, Path cfgPath) {
        this.configRoot = configRoot;
        this.cfgPath = cfgPath;
    }

    public static void main(String[] args) throws Exception {
        int status = new KindaApp().run();
        if (status != 0) System.exit(status);
    }

    /**
     * @return process exit status
     */
    public int run() throws IOException {
        try (KindaKernel kernel = KindaKernel.builder()
                .configRoot(configRoot)
                .build(cfgPath)) {

            TransformReport report = kernel.transformTree();
            log.info("kinda: {} file(s), {} marker(s) rewritten, {} failure(s)",
                    report.files(), report.nodes(), report.failures().size());

            if (!report.hasFailures()) return 0;
            for (Map.Entry<Path, KindaSyntaxException> e : report.failures().entrySet()) {
                log.error("{}: {}", e.getKey(), e.getValue().reason());
            }
            return 1;
        }
    }

    public Path getCfgPath() { return cfgPath; }

    public Path getConfigRoot() { return configRoot; }
}
