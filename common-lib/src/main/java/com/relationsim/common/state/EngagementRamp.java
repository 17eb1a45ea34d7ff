package com.relationsim.common.state;

import com.relationsim.common.math.ScoreMath;
import com.relationsim.common.model.EngagementLevels;

/**
 * Gradual return of engagement after withdrawal ends.
 *
 * <p>While recovering, each metric moves toward its target by at most {@value #MAX_STEP}
 * per interaction. Decreases always apply at once, so a relapse is never smoothed.
 * Outside recovery the target is returned unchanged.
 *
 * <p>Stateless and thread-safe.
 */
public final class EngagementRamp {

    public static final double MAX_STEP = 0.15;

    private EngagementRamp() {}

    /**
     * @param current    levels shown after the previous interaction
     * @param target     levels the current state calls for
     * @param recovering true between leaving withdrawal and reaching the target
     */
    public static EngagementLevels advance(EngagementLevels current, EngagementLevels target, boolean recovering) {
        if (!recovering) return target;
        return new EngagementLevels(
            step(current.responseLength(), target.responseLength()),
            step(current.initiation(),     target.initiation()),
            step(current.cooperation(),    target.cooperation()));
    }

    public static boolean reached(EngagementLevels current, EngagementLevels target) {
        return current.responseLength() >= target.responseLength()
            && current.initiation()     >= target.initiation()
            && current.cooperation()    >= target.cooperation();
    }

    private static double step(double current, double target) {
        if (target <= current) return target;
        return ScoreMath.round2(Math.min(target, current + MAX_STEP));
    }
}
