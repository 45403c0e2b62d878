package com.leadscoring.exception;

public class IntegrationNotFoundException extends EngineException {

    public IntegrationNotFoundException(String component, String tenantId, String integrationId) {
        super(component, integrationId, "No engagement recorded for integration: " + integrationId
                + " (tenant " + tenantId + ")");
    }
}
