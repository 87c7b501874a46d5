package org.calista.kinda.core;

import org.calista.kinda.transform.KindaSyntaxException;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of one {@link KindaKernel#transformTree()} run.
 */
public final class TransformReport {

    private final List<Path> written = new ArrayList<>();
    private final Map<Path, KindaSyntaxException> failures = new LinkedHashMap<>();
    private int files;
    private int nodes;

    void transformed(Path output, int nodeCount) {
        files++;
        nodes += nodeCount;
        written.add(output);
    }

    void failed(Path source, KindaSyntaxException e) {
        files++;
        failures.put(source, e);
    }

    /** Files seen, failed ones included. */
    public int files() {
        return files;
    }

    /** Fuzzy markers rewritten over all successful files. */
    public int nodes() {
        return nodes;
    }

    public List<Path> written() {
        return Collections.unmodifiableList(written);
    }

    public Map<Path, KindaSyntaxException> failures() {
        return Collections.unmodifiableMap(failures);
    }

    public boolean hasFailures() {
        return !failures.isEmpty();
    }

    @Override
    public String toString() {
        return "TransformReport{files=" + files + ", written=" + written.size() + ", nodes=" + nodes
                + ", failures=" + failures.size() + "}";
    }
}
