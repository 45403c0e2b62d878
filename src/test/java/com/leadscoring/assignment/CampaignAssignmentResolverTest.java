package com.leadscoring.assignment;

import com.leadscoring.model.AssignmentPriority;
import com.leadscoring.model.CampaignAssignment;
import com.leadscoring.model.CompanySize;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

class CampaignAssignmentResolverTest {

    private CampaignAssignmentResolver resolver;

    @BeforeEach
    void setUp() {
        resolver = new CampaignAssignmentResolver("");
    }

    // ========== Decision table ==========

    @Test
    @DisplayName("Score 85 with ROI 60k goes to the enterprise tier")
    void testEnterpriseTier() {
        AssignmentDecision decision = resolver.resolve(inputs(85, "60000", "Logistics", CompanySize.MEDIUM, 3));

        assertEquals("enterprise_vip", decision.campaignId());
        assertEquals("seq_enterprise_executive", decision.sequenceId());
        assertEquals(0, new BigDecimal("0.5").compareTo(decision.delayHours()));
        assertEquals(AssignmentPriority.HIGH, decision.priority());
        assertEquals("Lead Score: 85, ROI: $60K, Opportunities: 3", decision.reason());
    }

    @Test
    @DisplayName("ROI above 50k alone is enough for enterprise")
    void testEnterpriseByRoi() {
        assertEquals(CampaignTier.ENTERPRISE, resolver.selectTier(10, new BigDecimal("50001"), 0));
        assertEquals(CampaignTier.COLD, resolver.selectTier(10, new BigDecimal("50000"), 0),
                "Threshold is exclusive");
    }

    @Test
    @DisplayName("Professional by score or by ROI with two opportunities")
    void testProfessionalTier() {
        assertEquals(CampaignTier.PROFESSIONAL, resolver.selectTier(60, BigDecimal.ZERO, 0));
        assertEquals(CampaignTier.PROFESSIONAL, resolver.selectTier(20, new BigDecimal("30000"), 2));
        assertEquals(CampaignTier.WARM, resolver.selectTier(20, new BigDecimal("30000"), 1));
    }

    @Test
    @DisplayName("Warm by score or by any opportunity, cold otherwise")
    void testWarmAndCold() {
        assertEquals(CampaignTier.WARM, resolver.selectTier(40, BigDecimal.ZERO, 0));
        assertEquals(CampaignTier.WARM, resolver.selectTier(5, BigDecimal.ZERO, 1));
        assertEquals(CampaignTier.COLD, resolver.selectTier(39, BigDecimal.ZERO, 0));
    }

    // ========== Overrides ==========

    @Test
    @DisplayName("Healthcare at score 45: warm, compliance sequence, delay 2h")
    void testRegulatedIndustry() {
        AssignmentDecision decision = resolver.resolve(inputs(45, null, "Healthcare Services", CompanySize.SMALL, 0));

        assertEquals("warm_prospects", decision.campaignId());
        assertEquals("seq_warm_nurture_compliance", decision.sequenceId());
        assertEquals(0, new BigDecimal("4").compareTo(decision.delayHours()),
                "Warm delay is already above the regulated minimum");
        assertEquals(AssignmentPriority.MEDIUM, decision.priority());
    }

    @Test
    @DisplayName("Regulated minimum raises the fast tiers to 2h")
    void testRegulatedRaisesDelay() {
        AssignmentDecision decision = resolver.resolve(inputs(90, null, "LEGAL", CompanySize.SMALL, 1));

        assertEquals("seq_enterprise_executive_compliance", decision.sequenceId());
        assertEquals(0, new BigDecimal("2").compareTo(decision.delayHours()));
    }

    @Test
    @DisplayName("Large and enterprise companies wait at least 4h")
    void testLargeCompanyDelay() {
        AssignmentDecision large = resolver.resolve(inputs(85, null, "Retail", CompanySize.LARGE, 1));
        AssignmentDecision enterprise = resolver.resolve(inputs(65, null, "Financial Services", CompanySize.ENTERPRISE, 1));
        AssignmentDecision cold = resolver.resolve(inputs(10, null, null, CompanySize.ENTERPRISE, 0));

        assertEquals(0, new BigDecimal("4").compareTo(large.delayHours()));
        assertEquals(0, new BigDecimal("4").compareTo(enterprise.delayHours()));
        assertEquals("seq_professional_priority_compliance", enterprise.sequenceId());
        assertEquals(0, new BigDecimal("24").compareTo(cold.delayHours()), "Longer delays are kept");
    }

    @Test
    @DisplayName("Industry match is case-insensitive and partial")
    void testIsRegulated() {
        assertTrue(resolver.isRegulated("healthcare"));
        assertTrue(resolver.isRegulated("Paralegal Staffing"));
        assertTrue(resolver.isRegulated("FINANCIAL advisory"));
        assertFalse(resolver.isRegulated("Manufacturing"));
        assertFalse(resolver.isRegulated(null));
    }

    // ========== Reason and purity ==========

    @Test
    @DisplayName("Reason rounds ROI to the nearest thousand")
    void testReason() {
        assertEquals("Lead Score: 45, ROI: $13K, Opportunities: 2",
                resolver.reason(45, new BigDecimal("12500"), 2));
        assertEquals("Lead Score: 0, ROI: $0K, Opportunities: 0",
                resolver.reason(0, BigDecimal.ZERO, 0));
    }

    @Test
    @DisplayName("Null context falls through to cold")
    void testNullInputs() {
        AssignmentDecision decision = resolver.resolve(new AssignmentInputs(0, null, null, null, 0));

        assertEquals("cold_outreach", decision.campaignId());
        assertEquals(AssignmentPriority.LOW, decision.priority());
    }

    @Test
    @DisplayName("Same inputs, same decision")
    void testPure() {
        AssignmentInputs inputs = inputs(72, "26000", "Legal", CompanySize.MEDIUM, 2);

        assertEquals(resolver.resolve(inputs), resolver.resolve(inputs));
    }

    @Test
    @DisplayName("Campaign prefix is prepended")
    void testCampaignPrefix() {
        CampaignAssignmentResolver prefixed = new CampaignAssignmentResolver("acme_");

        assertEquals("acme_cold_outreach", prefixed.resolve(inputs(0, null, null, null, 0)).campaignId());
    }

    @Test
    @DisplayName("Treatment comparison ignores the reason and delay scale")
    void testSameTreatment() {
        AssignmentDecision decision = resolver.resolve(inputs(45, null, "Retail", CompanySize.SMALL, 1));

        CampaignAssignment current = new CampaignAssignment();
        current.setCampaignId("warm_prospects");
        current.setSequenceId("seq_warm_nurture");
        current.setDelayHours(new BigDecimal("4.00"));
        current.setPriority(AssignmentPriority.MEDIUM);
        current.setReason("Lead Score: 41, ROI: $0K, Opportunities: 1");

        assertTrue(decision.sameTreatmentAs(current));

        current.setPriority(AssignmentPriority.HIGH);
        assertFalse(decision.sameTreatmentAs(current));
        assertFalse(decision.sameTreatmentAs(null));
    }

    private static AssignmentInputs inputs(int score, String roi, String industry, CompanySize size, int opportunities) {
        return new AssignmentInputs(score, roi == null ? null : new BigDecimal(roi), industry, size, opportunities);
    }
}
