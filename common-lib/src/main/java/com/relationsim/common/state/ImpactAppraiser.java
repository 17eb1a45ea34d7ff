package com.relationsim.common.state;

import com.relationsim.common.math.ScoreMath;
import com.relationsim.common.model.ActionType;
import com.relationsim.common.model.EmotionType;
import com.relationsim.common.model.EmotionalImpact;
import com.relationsim.common.model.PlayerAction;

import java.util.EnumMap;
import java.util.Map;

/**
 * Maps a {@link PlayerAction} to the {@link EmotionalImpact} it leaves behind.
 *
 * <p>Primary emotion comes from the action type and the sign of its valence; intensity is
 * {@code |valence|}. Stateless and thread-safe.
 */
public final class ImpactAppraiser {

    private record EmotionPair(EmotionType whenWelcome, EmotionType whenHurtful) {}

    private static final Map<ActionType, EmotionPair> EMOTIONS = new EnumMap<>(ActionType.class);

    static {
        EMOTIONS.put(ActionType.PARENTING_PRESENT,    new EmotionPair(EmotionType.JOY,         EmotionType.DISAPPOINTMENT));
        EMOTIONS.put(ActionType.PARENTING_ABSENT,     new EmotionPair(EmotionType.CONTENTMENT, EmotionType.LONELINESS));
        EMOTIONS.put(ActionType.CONFLICT_ENGAGE,      new EmotionPair(EmotionType.TRUST,       EmotionType.FRUSTRATION));
        EMOTIONS.put(ActionType.CONFLICT_AVOID,       new EmotionPair(EmotionType.CALM,        EmotionType.FRUSTRATION));
        EMOTIONS.put(ActionType.CONTROL_TAKING,       new EmotionPair(EmotionType.CALM,        EmotionType.RESENTMENT));
        EMOTIONS.put(ActionType.SUPPORTIVE_AUTONOMY,  new EmotionPair(EmotionType.GRATITUDE,   EmotionType.ANXIETY));
        EMOTIONS.put(ActionType.EMPATHY_SHOWN,        new EmotionPair(EmotionType.CONTENTMENT, EmotionType.SADNESS));
        EMOTIONS.put(ActionType.EMPATHY_LACKING,      new EmotionPair(EmotionType.CALM,        EmotionType.HURT));
        EMOTIONS.put(ActionType.PUBLIC_SUPPORT,       new EmotionPair(EmotionType.TRUST,       EmotionType.DISAPPOINTMENT));
        EMOTIONS.put(ActionType.PUBLIC_CONTRADICTION, new EmotionPair(EmotionType.CALM,        EmotionType.ANGER));
        EMOTIONS.put(ActionType.PRIVATE_CORRECTION,   new EmotionPair(EmotionType.TRUST,       EmotionType.FRUSTRATION));
        EMOTIONS.put(ActionType.STRESS_ACKNOWLEDGED,  new EmotionPair(EmotionType.CALM,        EmotionType.STRESS));
        EMOTIONS.put(ActionType.STRESS_DISMISSED,     new EmotionPair(EmotionType.CALM,        EmotionType.STRESS));
        EMOTIONS.put(ActionType.APOLOGY,              new EmotionPair(EmotionType.HOPE,        EmotionType.RESENTMENT));
        EMOTIONS.put(ActionType.INITIATION_ACCEPTED,  new EmotionPair(EmotionType.JOY,         EmotionType.ANXIETY));
        EMOTIONS.put(ActionType.INITIATION_REBUFFED,  new EmotionPair(EmotionType.HOPE,        EmotionType.SADNESS));
        EMOTIONS.put(ActionType.INTIMACY_SHARED,      new EmotionPair(EmotionType.LOVE,        EmotionType.HURT));
    }

    private ImpactAppraiser() {}

    public static EmotionalImpact appraise(PlayerAction action) {
        EmotionPair pair = EMOTIONS.get(action.actionType());
        EmotionType emotion = action.valence() >= 0 ? pair.whenWelcome() : pair.whenHurtful();
        return new EmotionalImpact(
            emotion,
            ScoreMath.round2(Math.abs(action.valence())),
            ScoreMath.round2(action.valence()),
            action.actionType().category());
    }
}
