package com.leadscoring.assignment;

import com.leadscoring.model.CompanySize;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.regex.Pattern;

/**
 * Maps a lead score and its context to a campaign, sequence, send delay and priority.
 *
 * Decision table, evaluated top-down, first match wins:
 * <pre>
 * score >= 80 or roi > 50k                      enterprise     0.5h  high
 * score >= 60 or (roi > 25k and opps >= 2)      professional   1h    medium
 * score >= 40 or opps >= 1                      warm           4h    medium
 * otherwise                                     cold           24h   low
 * </pre>
 * Then the overrides: regulated industries (legal, healthcare, financial) get the compliance
 * sequence variant and at least 2h delay; enterprise and large companies at least 4h.
 *
 * Total and pure: null inputs fall through to the cold tier, nothing throws.
 */
@Component
@Slf4j
public class CampaignAssignmentResolver {

    static final String COMPLIANCE_SUFFIX = "_compliance";

    private static final BigDecimal ENTERPRISE_ROI_THRESHOLD = new BigDecimal("50000");
    private static final BigDecimal PROFESSIONAL_ROI_THRESHOLD = new BigDecimal("25000");
    private static final BigDecimal REGULATED_MIN_DELAY = new BigDecimal("2");
    private static final BigDecimal LARGE_COMPANY_MIN_DELAY = new BigDecimal("4");
    private static final BigDecimal ONE_THOUSAND = new BigDecimal("1000");

    private static final Pattern REGULATED_INDUSTRY =
            Pattern.compile("legal|healthcare|financial", Pattern.CASE_INSENSITIVE);

    private final String campaignPrefix;

    public CampaignAssignmentResolver(@Value("${leadscoring.assignment.campaign-prefix:}") String campaignPrefix) {
        this.campaignPrefix = campaignPrefix == null ? "" : campaignPrefix;
    }

    public AssignmentDecision resolve(AssignmentInputs inputs) {
        BigDecimal roi = inputs.roiPotential() == null ? BigDecimal.ZERO : inputs.roiPotential();
        CampaignTier tier = selectTier(inputs.leadScore(), roi, inputs.opportunityCount());

        String sequenceId = tier.sequence;
        BigDecimal delayHours = tier.delayHours;

        if (isRegulated(inputs.industry())) {
            sequenceId = sequenceId + COMPLIANCE_SUFFIX;
            delayHours = delayHours.max(REGULATED_MIN_DELAY);
        }
        if (inputs.companySize() == CompanySize.ENTERPRISE || inputs.companySize() == CompanySize.LARGE) {
            delayHours = delayHours.max(LARGE_COMPANY_MIN_DELAY);
        }

        AssignmentDecision decision = new AssignmentDecision(
                campaignPrefix + tier.campaign,
                sequenceId,
                delayHours,
                tier.priority,
                reason(inputs.leadScore(), roi, inputs.opportunityCount()));

        log.debug("Resolved {} tier for inputs {}: {}", tier, inputs, decision);
        return decision;
    }

    CampaignTier selectTier(int leadScore, BigDecimal roi, int opportunityCount) {
        if (leadScore >= 80 || roi.compareTo(ENTERPRISE_ROI_THRESHOLD) > 0) {
            return CampaignTier.ENTERPRISE;
        }
        if (leadScore >= 60 || (roi.compareTo(PROFESSIONAL_ROI_THRESHOLD) > 0 && opportunityCount >= 2)) {
            return CampaignTier.PROFESSIONAL;
        }
        if (leadScore >= 40 || opportunityCount >= 1) {
            return CampaignTier.WARM;
        }
        return CampaignTier.COLD;
    }

    boolean isRegulated(String industry) {
        return industry != null && REGULATED_INDUSTRY.matcher(industry).find();
    }

    /**
     * e.g. "Lead Score: 85, ROI: $60K, Opportunities: 3"
     */
    String reason(int leadScore, BigDecimal roi, int opportunityCount) {
        String roiThousands = roi.divide(ONE_THOUSAND, 0, RoundingMode.HALF_UP).toPlainString();
        return String.format("Lead Score: %d, ROI: $%sK, Opportunities: %d", leadScore, roiThousands, opportunityCount);
    }
}
