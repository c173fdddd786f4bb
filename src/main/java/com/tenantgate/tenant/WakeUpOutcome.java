package com.tenantgate.tenant;

public enum WakeUpOutcome {
    /** Another wake-up was armed. */
    RESCHEDULED,
    /** The sandbox was destroyed for inactivity. */
    DESTROYED,
    /** Idle with nothing left to tear down. */
    DORMANT
}
