package com.neuroassist.stroke.protocol;

import com.neuroassist.stroke.exception.ConfigurationException;
import com.neuroassist.stroke.model.StrokeType;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Picks one of the four canonical action protocols from the stroke type and the eligibility
 * verdict. No patient value ever reaches the text; the agent regime is the only input.
 */
@Slf4j
public class ProtocolTextSelector {

    private final ThrombolyticAgentConfig agentConfig;
    private final String eligibleProtocol;

    /**
     * @throws ConfigurationException if the agent configuration is missing or inconsistent
     */
    public ProtocolTextSelector(ThrombolyticAgentConfig agentConfig) {
        if (agentConfig == null) {
            throw new ConfigurationException("No thrombolytic agent configured");
        }
        this.agentConfig = agentConfig.requireConsistent();
        this.eligibleProtocol = render(agentConfig);
        log.debug("Protocol texts prepared for thrombolytic agent {}", agentConfig.agentName());
    }

    public ThrombolyticAgentConfig agentConfig() {
        return agentConfig;
    }

    public String selectProtocol(StrokeType strokeType, boolean eligible) {
        return switch (strokeType) {
            case HEMORRHAGIC -> ProtocolTemplates.HEMORRHAGIC;
            case ISCHEMIC -> eligible ? eligibleProtocol : ProtocolTemplates.ISCHEMIC_NOT_ELIGIBLE;
            case UNCERTAIN -> ProtocolTemplates.UNCERTAIN;
        };
    }

    /**
     * Same selection against an explicitly supplied regime.
     *
     * @throws ConfigurationException if {@code agent} is missing or inconsistent
     */
    public static String selectProtocol(StrokeType strokeType, boolean eligible, ThrombolyticAgentConfig agent) {
        return new ProtocolTextSelector(agent).selectProtocol(strokeType, eligible);
    }

    /** All four variants, keyed for review screens. */
    public Map<String, String> canonicalProtocols() {
        Map<String, String> protocols = new LinkedHashMap<>();
        protocols.put("Hemorrhagic", selectProtocol(StrokeType.HEMORRHAGIC, false));
        protocols.put("IschemicEligible", selectProtocol(StrokeType.ISCHEMIC, true));
        protocols.put("IschemicNotEligible", selectProtocol(StrokeType.ISCHEMIC, false));
        protocols.put("Uncertain", selectProtocol(StrokeType.UNCERTAIN, false));
        return protocols;
    }

    private static String render(ThrombolyticAgentConfig agent) {
        return ProtocolTemplates.ISCHEMIC_ELIGIBLE
                .replace(ProtocolTemplates.AGENT_NAME, agent.agentName().trim())
                .replace(ProtocolTemplates.DOSE_MG_PER_KG, figure(agent.doseMgPerKg()))
                .replace(ProtocolTemplates.MAX_DOSE_MG, figure(agent.maxDoseMg()))
                .replace(ProtocolTemplates.BOLUS_PERCENTAGE, figure(agent.bolusPercentage()));
    }

    static String figure(double value) {
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }
}
