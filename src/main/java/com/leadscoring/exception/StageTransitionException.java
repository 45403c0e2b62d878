package com.leadscoring.exception;

import com.leadscoring.model.ProspectStage;
import lombok.Getter;

/**
 * Sales action the pipeline does not allow: a backward move, leaving a terminal stage,
 * or a stage only the analysis trigger may set.
 */
@Getter
public class StageTransitionException extends EngineException {

    private final ProspectStage currentStage;
    private final ProspectStage targetStage;

    public StageTransitionException(String component, String prospectId, ProspectStage currentStage,
                                    ProspectStage targetStage, String message) {
        super(component, prospectId, message);
        this.currentStage = currentStage;
        this.targetStage = targetStage;
    }
}
