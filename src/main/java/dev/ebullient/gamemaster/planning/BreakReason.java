package dev.ebullient.gamemaster.planning;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * The only conditions that lift a freeze before it expires.
 */
public enum BreakReason {
    /** materially new, relevant information */
    NEW_INFORMATION,
    /** a distinct approach toward the same goal */
    DIFFERENT_METHOD,
    /** help from a qualified third party */
    QUALIFIED_ASSISTANCE,
    ADMIN_OVERRIDE;

    @JsonValue
    public String value() {
        return name().toLowerCase();
    }

    @JsonCreator
    public static BreakReason fromValue(String value) {
        return valueOf(value.trim().toUpperCase());
    }
}
