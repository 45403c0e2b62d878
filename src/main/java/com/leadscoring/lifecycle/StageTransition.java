package com.leadscoring.lifecycle;

import com.leadscoring.model.ProspectStage;

public record StageTransition(ProspectStage from, ProspectStage to) {
}
