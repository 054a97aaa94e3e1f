package com.questrail.fits.api;

import java.util.Locale;
import java.util.Optional;

/**
 * Colour filter array layouts found on one-shot-colour astronomy cameras.
 * The name reads the top-left 2x2 cell row by row.
 */
public enum BayerPattern
{
    RGGB, BGGR, GRBG, GBRG;

    public enum BayerColor { RED, GREEN, BLUE }

    /**
     * Returns the filter colour covering the pixel at (x, y).
     */
    public BayerColor colorAt(int x, int y) {
        final char c = name().charAt(((y & 1) << 1) | (x & 1));
        return switch (c) {
            case 'R' -> BayerColor.RED;
            case 'G' -> BayerColor.GREEN;
            default -> BayerColor.BLUE;
        };
    }

    /**
     * Parses a BAYERPAT-style header value such as {@code 'RGGB'}.
     */
    public static Optional<BayerPattern> parse(String text) {
        if (text == null) {
            return Optional.empty();
        }
        final String normalized = text.trim().toUpperCase(Locale.ROOT);
        for (BayerPattern p : values()) {
            if (p.name().equals(normalized)) {
                return Optional.of(p);
            }
        }
        return Optional.empty();
    }
}
