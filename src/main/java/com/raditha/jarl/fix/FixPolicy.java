package com.raditha.jarl.fix;

import com.raditha.jarl.model.FixSafety;

/**
 * Which fixes the engine is allowed to apply.
 */
public enum FixPolicy {
    NONE,
    SAFE,
    ALL;

    public boolean accepts(FixSafety safety) {
        return switch (this) {
            case NONE -> false;
            case SAFE -> safety == FixSafety.SAFE;
            case ALL -> safety == FixSafety.SAFE || safety == FixSafety.UNSAFE;
        };
    }

    /**
     * Policy selected by the {@code --fix} and {@code --unsafe-fixes} flags.
     */
    public static FixPolicy from(boolean fix, boolean unsafeFixes) {
        if (!fix) {
            return NONE;
        }
        return unsafeFixes ? ALL : SAFE;
    }
}
