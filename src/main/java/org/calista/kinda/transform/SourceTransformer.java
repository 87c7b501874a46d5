package org.calista.kinda.transform;

/**
 * Rewrites fuzzy markers into runtime calls. Text outside replaced spans is kept byte for byte.
 */
public interface SourceTransformer {

    /**
     * @param fileName used in error positions and the source map; may be null
     * @throws KindaSyntaxException on the first unrecognised or malformed marker
     */
    TransformResult transform(String source, String fileName);
}
