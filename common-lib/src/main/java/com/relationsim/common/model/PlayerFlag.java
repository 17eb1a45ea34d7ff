package com.relationsim.common.model;

/**
 * Standing judgements the AI parent holds about the player, kept alongside emotional memory.
 */
public enum PlayerFlag {
    /** Set after repeated conflict avoidance (three or more in seven days). */
    UNRELIABLE
}
