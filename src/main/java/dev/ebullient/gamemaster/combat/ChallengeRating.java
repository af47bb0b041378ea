package dev.ebullient.gamemaster.combat;

import java.util.Map;

/**
 * Challenge rating to XP, from the 5e SRD. Shared by combat rewards and manual awards.
 */
public final class ChallengeRating {

    private static final Map<Double, Integer> XP_BY_CR = Map.ofEntries(
            Map.entry(0.0, 10),
            Map.entry(0.125, 25),
            Map.entry(0.25, 50),
            Map.entry(0.5, 100),
            Map.entry(1.0, 200),
            Map.entry(2.0, 450),
            Map.entry(3.0, 700),
            Map.entry(4.0, 1100),
            Map.entry(5.0, 1800),
            Map.entry(6.0, 2300),
            Map.entry(7.0, 2900),
            Map.entry(8.0, 3900),
            Map.entry(9.0, 5000),
            Map.entry(10.0, 5900),
            Map.entry(11.0, 7200),
            Map.entry(12.0, 8400),
            Map.entry(13.0, 10000),
            Map.entry(14.0, 11500),
            Map.entry(15.0, 13000),
            Map.entry(16.0, 15000),
            Map.entry(17.0, 18000),
            Map.entry(18.0, 20000),
            Map.entry(19.0, 22000),
            Map.entry(20.0, 25000),
            Map.entry(21.0, 33000),
            Map.entry(22.0, 41000),
            Map.entry(23.0, 50000),
            Map.entry(24.0, 62000),
            Map.entry(25.0, 75000),
            Map.entry(26.0, 90000),
            Map.entry(27.0, 105000),
            Map.entry(28.0, 120000),
            Map.entry(29.0, 135000),
            Map.entry(30.0, 155000));

    private ChallengeRating() {
    }

    /**
     * Accepts numbers ({@code 0.25}, {@code 3}) and text ({@code "1/4"}, {@code "0.5"}, {@code "3"}).
     */
    public static double parse(Object cr) {
        double value;
        if (cr instanceof Number n) {
            value = n.doubleValue();
        } else if (cr instanceof String s && !s.isBlank()) {
            String text = s.trim();
            try {
                int slash = text.indexOf('/');
                value = slash < 0
                        ? Double.parseDouble(text)
                        : Double.parseDouble(text.substring(0, slash)) / Double.parseDouble(text.substring(slash + 1));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Not a challenge rating: " + cr);
            }
        } else {
            throw new IllegalArgumentException("Not a challenge rating: " + cr);
        }
        if (!XP_BY_CR.containsKey(value)) {
            throw new IllegalArgumentException("Unknown challenge rating: " + cr);
        }
        return value;
    }

    public static boolean isValid(Object cr) {
        try {
            parse(cr);
            return true;
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    public static int xpFor(Object cr) {
        return XP_BY_CR.get(parse(cr));
    }
}
