package uk.gegc.manuscript.features.scrivener.domain.model;

import java.util.Locale;

/**
 * Color with components in [0, 1], as written in project XML ("R G B").
 */
public record RgbColor(double red, double green, double blue) {

    public static final RgbColor GRAY = new RgbColor(0.5, 0.5, 0.5);

    public RgbColor {
        red = clamp(red);
        green = clamp(green);
        blue = clamp(blue);
    }

    /**
     * Parses space-separated floats. Anything malformed gives {@link #GRAY}.
     */
    public static RgbColor parse(String value) {
        if (value == null || value.isBlank()) {
            return GRAY;
        }
        String[] parts = value.trim().split("\\s+");
        if (parts.length < 3) {
            return GRAY;
        }
        try {
            return new RgbColor(Double.parseDouble(parts[0]), Double.parseDouble(parts[1]), Double.parseDouble(parts[2]));
        } catch (NumberFormatException e) {
            return GRAY;
        }
    }

    /**
     * Parses {@code #rrggbb} (or {@code rrggbb}). Anything malformed gives {@link #GRAY}.
     */
    public static RgbColor fromHex(String hex) {
        if (hex == null) {
            return GRAY;
        }
        String digits = hex.startsWith("#") ? hex.substring(1) : hex;
        if (digits.length() != 6) {
            return GRAY;
        }
        try {
            int rgb = Integer.parseInt(digits, 16);
            return new RgbColor(((rgb >> 16) & 0xff) / 255.0, ((rgb >> 8) & 0xff) / 255.0, (rgb & 0xff) / 255.0);
        } catch (NumberFormatException e) {
            return GRAY;
        }
    }

    public String toHex() {
        return String.format(Locale.ROOT, "#%02x%02x%02x", toByte(red), toByte(green), toByte(blue));
    }

    public String toXmlValue() {
        return String.format(Locale.ROOT, "%.6f %.6f %.6f", red, green, blue);
    }

    private static int toByte(double component) {
        return (int) Math.round(component * 255);
    }

    private static double clamp(double component) {
        if (Double.isNaN(component)) {
            return 0.5;
        }
        return Math.max(0.0, Math.min(1.0, component));
    }
}
