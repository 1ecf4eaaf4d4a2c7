package com.phonepe.soulwire.core.soul;

public enum SoulState {
    IDLE,
    TURN_ACTIVE,
    STEP_ACTIVE,
}
