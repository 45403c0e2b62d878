package com.leadscoring.assignment;

import com.leadscoring.model.CompanySize;

import java.math.BigDecimal;

/**
 * Everything the resolver looks at. Null ROI / industry / size are allowed and mean "unknown".
 */
public record AssignmentInputs(
    int leadScore,
    BigDecimal roiPotential,
    String industry,
    CompanySize companySize,
    int opportunityCount
) {
}
