package org.example.questionnaire.style;

import java.util.Locale;
import java.util.Optional;

/** RGB ranges used to read meaning from a fill colour. */
public enum ColorRange {
    RED {
        @Override
        boolean test(int r, int g, int b) {
            return r > 180 && g < 100 && b < 100;
        }
    },
    GREEN {
        @Override
        boolean test(int r, int g, int b) {
            return r < 150 && g > 150 && b < 150;
        }
    },
    GREY {
        @Override
        boolean test(int r, int g, int b) {
            double avg = (r + g + b) / 3.0;
            return Math.abs(r - avg) <= 10 && Math.abs(g - avg) <= 10 && Math.abs(b - avg) <= 10;
        }
    },
    YELLOW {
        @Override
        boolean test(int r, int g, int b) {
            return r > 180 && g > 180 && b < 100;
        }
    },
    ORANGE {
        @Override
        boolean test(int r, int g, int b) {
            return r > 180 && g > 100 && g < 180 && b < 100;
        }
    };

    abstract boolean test(int r, int g, int b);

    /** {@code #rgb} or {@code #rrggbb}, with or without the hash; anything else never matches. */
    public boolean matches(String color) {
        return rgb(color).map(c -> test(c[0], c[1], c[2])).orElse(false);
    }

    /** First range the colour falls into, in declaration order. */
    public static Optional<ColorRange> of(String color) {
        for (ColorRange range : values()) {
            if (range.matches(color)) return Optional.of(range);
        }
        return Optional.empty();
    }

    static Optional<int[]> rgb(String color) {
        if (color == null) return Optional.empty();
        String hex = color.trim().toLowerCase(Locale.ROOT);
        if (hex.startsWith("#")) hex = hex.substring(1);
        if (hex.length() == 3) {
            hex = "" + hex.charAt(0) + hex.charAt(0) + hex.charAt(1) + hex.charAt(1) + hex.charAt(2) + hex.charAt(2);
        }
        if (!hex.matches("[0-9a-f]{6}")) return Optional.empty();
        return Optional.of(new int[] {
            Integer.parseInt(hex.substring(0, 2), 16),
            Integer.parseInt(hex.substring(2, 4), 16),
            Integer.parseInt(hex.substring(4, 6), 16)
        });
    }
}
