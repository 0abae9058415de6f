package ops;

import java.util.Locale;
import java.util.Map;

/** 8-bit RGBA color used as a parameter value (fill, tint, duotone ends). */
public record Rgba(int r, int g, int b, int a) {

    private static final Map<String, String> NAMED = Map.ofEntries(
            Map.entry("black", "#000000"),
            Map.entry("white", "#ffffff"),
            Map.entry("red", "#ff0000"),
            Map.entry("green", "#00ff00"),
            Map.entry("blue", "#0000ff"),
            Map.entry("yellow", "#ffff00"),
            Map.entry("cyan", "#00ffff"),
            Map.entry("magenta", "#ff00ff"),
            Map.entry("orange", "#ffa500"),
            Map.entry("purple", "#800080"),
            Map.entry("gray", "#808080"),
            Map.entry("grey", "#808080"),
            Map.entry("transparent", "#00000000"));

    public Rgba {
        if (r < 0 || r > 255 || g < 0 || g > 255 || b < 0 || b > 255 || a < 0 || a > 255)
            throw new IllegalArgumentException("color components must be in [0..255]");
    }

    public static Rgba rgb(int r, int g, int b) {
        return new Rgba(r, g, b, 255);
    }

    /**
     * Parse {@code #rrggbb}, {@code #rrggbbaa} or one of a few color names.
     *
     * @throws IllegalArgumentException if the text is not a color
     */
    public static Rgba parse(String text) {
        if (text == null)
            throw new IllegalArgumentException("color is null");
        String s = text.trim().toLowerCase(Locale.ROOT);
        s = NAMED.getOrDefault(s, s);
        if (!s.startsWith("#") || (s.length() != 7 && s.length() != 9))
            throw new IllegalArgumentException("not a color: '" + text + "'");
        try {
            int r = Integer.parseInt(s.substring(1, 3), 16);
            int g = Integer.parseInt(s.substring(3, 5), 16);
            int b = Integer.parseInt(s.substring(5, 7), 16);
            int a = s.length() == 9 ? Integer.parseInt(s.substring(7, 9), 16) : 255;
            return new Rgba(r, g, b, a);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("not a color: '" + text + "'", e);
        }
    }

    /** Component {@code i} (0=r .. 3=a) scaled to {@code [0..maxValue]}. */
    public int scaled(int i, int maxValue) {
        int v = switch (i) {
            case 0 -> r;
            case 1 -> g;
            case 2 -> b;
            default -> a;
        };
        return (int) Math.round(v * (double) maxValue / 255.0);
    }

    @Override
    public String toString() {
        if (a == 255)
            return String.format("#%02x%02x%02x", r, g, b);
        return String.format("#%02x%02x%02x%02x", r, g, b, a);
    }
}
