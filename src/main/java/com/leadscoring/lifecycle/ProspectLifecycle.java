package com.leadscoring.lifecycle;

import com.leadscoring.exception.StageTransitionException;
import com.leadscoring.model.ProspectStage;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Stage rules of the prospect pipeline:
 *
 * <pre>
 * identified -> analyzing -> analyzed -> contacted -> qualified -> (disqualified | converted)
 * </pre>
 *
 * A new analysis snapshot moves a prospect exactly one step, and only inside
 * identified..analyzed. Everything after that is a sales action. Nothing moves backwards here;
 * an operator override is the only way back and happens outside the engine.
 */
@Component
public class ProspectLifecycle {

    private static final String COMPONENT = "ProspectLifecycle";

    /**
     * Step taken when a new snapshot version arrives. Empty when the stage is already
     * ANALYZED or beyond, which makes repeated triggers no-ops.
     */
    public Optional<StageTransition> advanceOnAnalysis(ProspectStage current) {
        return switch (current) {
            case IDENTIFIED -> Optional.of(new StageTransition(current, ProspectStage.ANALYZING));
            case ANALYZING -> Optional.of(new StageTransition(current, ProspectStage.ANALYZED));
            default -> Optional.empty();
        };
    }

    /**
     * Transitions still owed for the snapshot versions recorded so far: each recorded version
     * accounts for one step, capped at ANALYZED. Derived from the count rather than from the
     * trigger, so replaying a recompute for the same snapshot never moves the prospect twice.
     */
    public List<StageTransition> catchUpWithAnalysis(ProspectStage current, long recordedSnapshots) {
        List<StageTransition> transitions = new ArrayList<>();
        long owedStage = Math.min(recordedSnapshots, ProspectStage.ANALYZED.ordinal());
        ProspectStage stage = current;
        while (stage.ordinal() < owedStage) {
            Optional<StageTransition> step = advanceOnAnalysis(stage);
            if (step.isEmpty()) {
                break;
            }
            transitions.add(step.get());
            stage = step.get().to();
        }
        return transitions;
    }

    /**
     * Forward move requested by sales (contacted, qualified, disqualified, converted).
     *
     * @return empty when the prospect is already at the target
     * @throws StageTransitionException for backward moves, moves out of a terminal stage,
     *                                  or targets that only the analysis trigger may set
     */
    public Optional<StageTransition> advanceBySalesAction(String prospectId, ProspectStage current,
                                                          ProspectStage target) {
        if (current == target) {
            return Optional.empty();
        }
        if (current.isTerminal()) {
            throw forbidden(prospectId, current, target, "Prospect is in terminal stage " + current);
        }
        if (target.ordinal() <= ProspectStage.ANALYZED.ordinal()) {
            throw forbidden(prospectId, current, target, "Stage " + target + " is only reached through analysis");
        }
        if (target.ordinal() < current.ordinal()) {
            throw forbidden(prospectId, current, target,
                    "Cannot move prospect back from " + current + " to " + target);
        }
        return Optional.of(new StageTransition(current, target));
    }

    private static StageTransitionException forbidden(String prospectId, ProspectStage current,
                                                      ProspectStage target, String message) {
        return new StageTransitionException(COMPONENT, prospectId, current, target, message);
    }
}
