package org.calista.kinda.transform.node;

/**
 * {@code primary ~welp fallback}. The primary runs inside a lambda so a throw can be caught.
 */
public final class WelpFallback extends FuzzyNode {

    public final int primaryStart;
    public final int primaryEnd;
    public final int fallbackStart;
    public final int fallbackEnd;

    public WelpFallback(int line, int tilde, int primaryStart, int primaryEnd, int fallbackStart, int fallbackEnd) {
        super(NodeKind.WELP_FALLBACK, line, tilde, tilde + 5);
        if (primaryStart >= primaryEnd || primaryEnd > tilde) throw new IllegalArgumentException("empty welp primary");
        if (fallbackStart < tilde + 5 || fallbackEnd <= fallbackStart) throw new IllegalArgumentException("empty welp fallback");
        this.primaryStart = primaryStart;
        this.primaryEnd = primaryEnd;
        this.fallbackStart = fallbackStart;
        this.fallbackEnd = fallbackEnd;
    }
}
