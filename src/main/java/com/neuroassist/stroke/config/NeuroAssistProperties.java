package com.neuroassist.stroke.config;

import com.neuroassist.stroke.exception.ConfigurationException;
import com.neuroassist.stroke.protocol.ThrombolyticAgentConfig;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.Locale;

@Data
@ConfigurationProperties(prefix = "neuroassist")
public class NeuroAssistProperties {

    private Thrombolytic thrombolytic = new Thrombolytic();
    private ImageAnalysis imageAnalysis = new ImageAnalysis();

    /**
     * Thrombolytic regime. {@code agent} picks a built-in regime ({@code alteplase},
     * {@code tenecteplase}) or {@code custom}, which takes the four figures below.
     */
    @Data
    public static class Thrombolytic {
        private String agent = "alteplase";
        private String agentName;
        private Double bolusPercentage;
        private Double maxDoseMg;
        private Double doseMgPerKg;

        public ThrombolyticAgentConfig resolve() {
            String key = agent == null ? "" : agent.trim().toLowerCase(Locale.ROOT);
            return switch (key) {
                case "alteplase" -> ThrombolyticAgentConfig.ALTEPLASE;
                case "tenecteplase" -> ThrombolyticAgentConfig.TENECTEPLASE;
                case "custom" -> custom();
                default -> throw new ConfigurationException("Unrecognized thrombolytic agent '" + agent
                        + "', expected alteplase, tenecteplase or custom");
            };
        }

        private ThrombolyticAgentConfig custom() {
            if (bolusPercentage == null || maxDoseMg == null || doseMgPerKg == null) {
                throw new ConfigurationException(
                        "Custom thrombolytic agent needs agent-name, bolus-percentage, max-dose-mg and dose-mg-per-kg");
            }
            return new ThrombolyticAgentConfig(agentName, bolusPercentage, maxDoseMg, doseMgPerKg).requireConsistent();
        }
    }

    @Data
    public static class ImageAnalysis {
        private Duration timeout = Duration.ofSeconds(30);
        private Gemini gemini = new Gemini();
    }

    @Data
    public static class Gemini {
        private String apiKey;
        private String modelName = "gemini-2.0-flash";
        private Double temperature = 0.0;
    }
}
