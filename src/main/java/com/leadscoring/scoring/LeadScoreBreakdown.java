package com.leadscoring.scoring;

/**
 * Individual components of a lead score, kept for the assignment reason and for debugging.
 */
public record LeadScoreBreakdown(
    double companySizePoints,      // 0-25
    double opportunityPoints,      // 0-35
    double analysisPoints,         // 0-25
    double serviceFitPoints,       // 0-15
    int opportunityCount,
    int completedAnalysisTypes,
    int total                      // clamped to 0-100
) {
}
