package com.relationsim.common.state;

import com.relationsim.common.model.EngagementLevels;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class EngagementRampTest {

    @Test
    @DisplayName("while recovering, increases are capped at 0.15 per step")
    void cappedIncrease() {
        EngagementLevels current = new EngagementLevels(0.5, 0.2, 0.4);
        EngagementLevels target  = new EngagementLevels(1.0, 0.3, 1.0);

        EngagementLevels next = EngagementRamp.advance(current, target, true);

        assertEquals(0.65, next.responseLength());
        assertEquals(0.3,  next.initiation());
        assertEquals(0.55, next.cooperation());
        assertFalse(EngagementRamp.reached(next, target));
    }

    @Test
    @DisplayName("decreases apply immediately")
    void decreaseImmediate() {
        EngagementLevels current = new EngagementLevels(1.0, 0.9, 1.0);
        EngagementLevels target  = new EngagementLevels(0.5, 0.1, 0.4);

        assertEquals(target, EngagementRamp.advance(current, target, true));
    }

    @Test
    @DisplayName("outside recovery the target is returned as is")
    void notRecovering() {
        EngagementLevels target = new EngagementLevels(1.0, 0.67, 1.0);
        assertSame(target, EngagementRamp.advance(new EngagementLevels(0.3, 0.1, 0.2), target, false));
    }

    @Test
    @DisplayName("repeated steps reach the target")
    void reachesTarget() {
        EngagementLevels target  = EngagementLevels.full();
        EngagementLevels current = new EngagementLevels(0.3, 0.1, 0.2);
        int steps = 0;
        while (!EngagementRamp.reached(current, target)) {
            current = EngagementRamp.advance(current, target, true);
            steps++;
        }
        assertEquals(6, steps);
        assertEquals(target, current);
    }
}
