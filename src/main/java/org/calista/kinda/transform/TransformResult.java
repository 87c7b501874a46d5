package org.calista.kinda.transform;

import org.calista.kinda.transform.node.FuzzyNode;

import java.util.List;

public final class TransformResult {

    public final String text;
    public final SourceMap sourceMap;
    public final List<FuzzyNode> nodes;

    public TransformResult(String text, SourceMap sourceMap, List<FuzzyNode> nodes) {
        this.text = text;
        this.sourceMap = sourceMap;
        this.nodes = List.copyOf(nodes);
    }

    public boolean changed() {
        return !nodes.isEmpty();
    }
}
