package me.ud.ltc.tak.distributed.realtime.starter.model;

/**
 * Delivery priority of an emitted event. High priority events are never rate limited.
 *
 * @author takltc
 */
public enum Priority {

    HIGH,

    NORMAL,

    LOW;

    /**
     * Parse a priority name, defaulting to {@link #NORMAL}
     *
     * @param value Priority name (case insensitive), may be null
     * @return Priority
     */
    public static Priority fromValue(String value) {
        if (value == null || value.trim().isEmpty()) {
            return NORMAL;
        }
        return Priority.valueOf(value.trim().toUpperCase(java.util.Locale.ROOT));
    }
}
