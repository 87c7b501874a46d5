package org.calista.kinda.transform.node;

import org.calista.kinda.transform.Vocabulary;

public enum LoopKind {
    SOMETIMES_WHILE(Vocabulary.SOMETIMES_WHILE),
    MAYBE_FOR(Vocabulary.MAYBE_FOR),
    KINDA_REPEAT(Vocabulary.KINDA_REPEAT),
    EVENTUALLY_UNTIL(Vocabulary.EVENTUALLY_UNTIL);

    private final String keyword;

    LoopKind(String keyword) {
        this.keyword = keyword;
    }

    public String keyword() {
        return keyword;
    }

    public static LoopKind fromKeyword(String word) {
        for (LoopKind k : values()) {
            if (k.keyword.equals(word)) return k;
        }
        return null;
    }
}
