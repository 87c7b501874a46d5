package org.calista.kinda.transform.impl;

import org.calista.kinda.transform.KindaSyntaxException;
import org.calista.kinda.transform.SourceMap;
import org.calista.kinda.transform.SourcePosition;
import org.calista.kinda.transform.SourceTransformer;
import org.calista.kinda.transform.TransformOptions;
import org.calista.kinda.transform.TransformResult;
import org.calista.kinda.transform.detect.DetectionContext;
import org.calista.kinda.transform.detect.DetectorChain;
import org.calista.kinda.transform.emit.EditPlan;
import org.calista.kinda.transform.emit.JavaEmitter;
import org.calista.kinda.transform.node.FuzzyNode;
import org.calista.kinda.transform.scan.LexicalScanner;
import org.calista.kinda.transform.scan.SourceLine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Scan, detect, emit. Source without markers comes back as the same string.
 */
public final class KindaTransformer implements SourceTransformer {

    private static final Logger log = LoggerFactory.getLogger(KindaTransformer.class);

    public static final String SOURCE_SUFFIX = ".knda";

    private final TransformOptions options;
    private final DetectorChain chain;
    private final JavaEmitter emitter;

    public KindaTransformer() {
        this(TransformOptions.defaults());
    }

    public KindaTransformer(TransformOptions options) {
        this(options, DetectorChain.standard());
    }

    public KindaTransformer(TransformOptions options, DetectorChain chain) {
        this.options = Objects.requireNonNull(options, "options");
        this.chain = Objects.requireNonNull(chain, "chain");
        this.emitter = new JavaEmitter(options);
    }

    public TransformOptions options() {
        return options;
    }

    @Override
    public TransformResult transform(String source, String fileName) {
        Objects.requireNonNull(source, "source");
        List<SourceLine> lines = LexicalScanner.scan(source);
        DetectionContext ctx = new DetectionContext(fileName, lines);
        checkLineLengths(ctx);

        String generated = generatedName(ctx.fileName());
        List<FuzzyNode> nodes = chain.detect(ctx);
        if (nodes.isEmpty()) {
            return new TransformResult(source, identityMap(ctx.fileName(), generated, lines.size()), nodes);
        }

        EditPlan.Rendered out;
        try {
            out = emitter.emit(lines, nodes).render();
        } catch (IllegalStateException e) {
            FuzzyNode first = nodes.get(0);
            SourceLine l = lines.get(first.line);
            throw new KindaSyntaxException(first.position(ctx.fileName()),
                    "cannot rewrite overlapping fuzzy markers: " + e.getMessage(), l.text(), null);
        }
        log.debug("{}: rewrote {} marker(s), {} -> {} line(s)", ctx.fileName(), nodes.size(), lines.size(), out.lineMap.size());
        return new TransformResult(out.text, out.sourceMap(ctx.fileName(), generated), nodes);
    }

    private void checkLineLengths(DetectionContext ctx) {
        for (SourceLine l : ctx.lines()) {
            if (l.length() > options.maxLineLength) {
                throw new KindaSyntaxException(new SourcePosition(ctx.fileName(), l.number(), options.maxLineLength + 1),
                        "line is longer than " + options.maxLineLength + " characters", null, null);
            }
        }
    }

    static String generatedName(String fileName) {
        return fileName.endsWith(SOURCE_SUFFIX) ? fileName.substring(0, fileName.length() - SOURCE_SUFFIX.length()) : fileName;
    }

    private static SourceMap identityMap(String file, String generated, int lineCount) {
        List<Integer> map = new ArrayList<>(lineCount);
        for (int i = 1; i <= lineCount; i++) map.add(i);
        return new SourceMap(file, generated, map);
    }
}
