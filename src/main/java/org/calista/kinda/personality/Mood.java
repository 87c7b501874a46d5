package org.calista.kinda.personality;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Fixed set of personalities. Each one owns a {@link MoodProfile} in {@link MoodProfiles}.
 */
public enum Mood {
    RELIABLE,
    PROFESSIONAL,
    CAUTIOUS,
    FRIENDLY,
    PLAYFUL,
    SNARKY,
    CHAOTIC;

    public static final Mood DEFAULT = PLAYFUL;

    /**
     * Case-insensitive lookup ("Playful", "CHAOTIC", " snarky ").
     *
     * @throws InvalidConfigurationException for null, blank or unknown names
     */
    public static Mood parse(String name) {
        if (name == null || name.isBlank()) {
            throw new InvalidConfigurationException("mood must not be blank; known moods: " + known());
        }
        String key = name.trim().toUpperCase(Locale.ROOT);
        for (Mood m : values()) {
            if (m.name().equals(key)) return m;
        }
        throw new InvalidConfigurationException("unknown mood '" + name.trim() + "'; known moods: " + known());
    }

    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }

    private static String known() {
        return Arrays.stream(values()).map(Mood::id).collect(Collectors.joining(", "));
    }
}
