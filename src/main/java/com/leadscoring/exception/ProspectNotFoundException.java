package com.leadscoring.exception;

public class ProspectNotFoundException extends EngineException {

    public ProspectNotFoundException(String component, String tenantId, String prospectId) {
        super(component, prospectId, "Prospect not found: " + prospectId + " (tenant " + tenantId + ")");
    }
}
