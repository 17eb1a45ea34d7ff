package com.relationsim.common.state;

/**
 * Band-level defaults for one {@link RelationshipTone}.
 *
 * @param strategy         suggested conversational stance
 * @param cooperationBase  cooperation before control-taking dampening
 * @param vulnerabilityCap upper bound on emotional vulnerability
 */
public record ModifierPreset(
    ToneStrategy strategy,
    double       cooperationBase,
    double       vulnerabilityCap
) {}
