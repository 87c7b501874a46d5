package org.calista.kinda.transform.detect;

import org.calista.kinda.transform.node.FuzzyNode;
import org.calista.kinda.transform.scan.SourceLine;

import java.util.List;

/**
 * Recognises one family of markers on a line.
 *
 * Detectors run in a fixed order; each sees the nodes earlier detectors found on the same line.
 */
public interface Detector {

    String name();

    /**
     * Appends recognised nodes to {@code found}.
     *
     * @throws org.calista.kinda.transform.KindaSyntaxException when a marker this detector owns is malformed
     */
    void detect(DetectionContext ctx, SourceLine line, List<FuzzyNode> found);
}
