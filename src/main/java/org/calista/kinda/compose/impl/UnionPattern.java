package org.calista.kinda.compose.impl;

import org.calista.kinda.compose.CompositionPattern;
import org.calista.kinda.compose.CompositionResult;
import org.calista.kinda.compose.PatternMode;
import org.calista.kinda.personality.ConstructKind;
import org.calista.kinda.personality.Mood;
import org.calista.kinda.runtime.Primitives;

import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Fires when the condition holds and any member gate fires. "sorta" is the union of
 * sometimes and maybe, plus a small bridge chance for the looser moods.
 */
public final class UnionPattern extends CompositionPattern {

    public static final double DEFAULT_BRIDGE = 0.2;
    private static final Set<Mood> BRIDGED = EnumSet.of(Mood.PLAYFUL, Mood.CHAOTIC);

    private final List<ConstructKind> gates;
    private final double bridge;

    public UnionPattern(String name, List<ConstructKind> gates, double bridge) {
        super(name, PatternMode.GATE);
        this.gates = List.copyOf(Objects.requireNonNull(gates, "gates"));
        if (this.gates.isEmpty()) throw new IllegalArgumentException("union needs at least one gate");
        for (ConstructKind k : this.gates) {
            if (!k.isProbability()) throw new IllegalArgumentException("not a gate kind: " + k);
        }
        if (bridge < 0.0 || bridge > 1.0) throw new IllegalArgumentException("bridge must be in [0,1]: " + bridge);
        this.bridge = bridge;
    }

    public static UnionPattern sorta(String name) {
        return new UnionPattern(name, List.of(ConstructKind.SOMETIMES, ConstructKind.MAYBE), DEFAULT_BRIDGE);
    }

    @Override
    public CompositionResult<Boolean> evaluate(Primitives p, boolean condition) {
        return guard(() -> {
            if (!condition) return false;
            for (ConstructKind k : gates) {
                if (p.gate(k, true)) return true;
            }
            return BRIDGED.contains(p.personality().current().mood()) && p.random().chance(bridge);
        });
    }
}
