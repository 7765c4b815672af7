package com.neuroassist.stroke.protocol;

import com.neuroassist.stroke.exception.ConfigurationException;

import java.io.Serializable;

/**
 * Dosing regime of the configured thrombolytic agent. Only these figures vary between
 * deployments; the protocol wording stays fixed.
 */
public record ThrombolyticAgentConfig(
        String agentName,
        double bolusPercentage,
        double maxDoseMg,
        double doseMgPerKg
) implements Serializable {

    public static final ThrombolyticAgentConfig ALTEPLASE = new ThrombolyticAgentConfig("Alteplase", 10, 90, 0.9);
    public static final ThrombolyticAgentConfig TENECTEPLASE = new ThrombolyticAgentConfig("Tenecteplase", 100, 25, 0.25);

    /**
     * @return this config
     * @throws ConfigurationException when a figure is missing or out of range
     */
    public ThrombolyticAgentConfig requireConsistent() {
        if (agentName == null || agentName.isBlank()) {
            throw new ConfigurationException("Thrombolytic agent name must not be blank");
        }
        if (!(bolusPercentage > 0 && bolusPercentage <= 100)) {
            throw new ConfigurationException("Bolus percentage for " + agentName + " must be in (0, 100], got " + bolusPercentage);
        }
        if (!(doseMgPerKg > 0) || Double.isInfinite(doseMgPerKg)) {
            throw new ConfigurationException("Dose per kg for " + agentName + " must be positive, got " + doseMgPerKg);
        }
        if (!(maxDoseMg > 0) || Double.isInfinite(maxDoseMg)) {
            throw new ConfigurationException("Maximum dose for " + agentName + " must be positive, got " + maxDoseMg);
        }
        return this;
    }
}
