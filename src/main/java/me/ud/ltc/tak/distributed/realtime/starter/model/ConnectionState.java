package me.ud.ltc.tak.distributed.realtime.starter.model;

/**
 * Lifecycle of a server side push connection.
 * <p>
 * CONNECTING -> OPEN -> CLOSING -> CLOSED, and OPEN -> CLOSED directly on error.
 *
 * @author takltc
 */
public enum ConnectionState {

    CONNECTING,

    OPEN,

    CLOSING,

    CLOSED;

    public boolean canTransitionTo(ConnectionState next) {
        switch (this) {
            case CONNECTING:
                return next == OPEN || next == CLOSED;
            case OPEN:
                return next == CLOSING || next == CLOSED;
            case CLOSING:
                return next == CLOSED;
            default:
                return false;
        }
    }
}
