package nl.bytesoflife.windregrid.model;

import java.util.Locale;
import java.util.Map;

/**
 * Unit domain of shape and offset values before they are normalized to metres.
 */
public enum Units {
    METERS("m"),
    DEGREES("d");

    private static final Map<String, Units> NAMES = Map.ofEntries(
            Map.entry("m", METERS),
            Map.entry("meters", METERS),
            Map.entry("metres", METERS),
            Map.entry("d", DEGREES),
            Map.entry("deg", DEGREES),
            Map.entry("degrees", DEGREES)
    );

    private final String symbol;

    Units(String symbol) {
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }

    public static Units fromName(String name) {
        Units units = NAMES.get(name.trim().toLowerCase(Locale.ROOT));
        if (units == null) {
            throw new IllegalArgumentException("Unknown units: '" + name + "', expected 'm' or 'd'");
        }
        return units;
    }
}
