package com.leadscoring.model;

/**
 * Pipeline stage of a prospect.
 *
 * The automatic analysis trigger only moves IDENTIFIED -> ANALYZING -> ANALYZED.
 * Later stages are reached through sales actions; DISQUALIFIED and CONVERTED are terminal.
 */
public enum ProspectStage {
    IDENTIFIED,
    ANALYZING,
    ANALYZED,
    CONTACTED,
    QUALIFIED,
    DISQUALIFIED,
    CONVERTED;

    public boolean isTerminal() {
        return this == DISQUALIFIED || this == CONVERTED;
    }
}
