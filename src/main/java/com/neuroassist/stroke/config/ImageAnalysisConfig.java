package com.neuroassist.stroke.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.neuroassist.stroke.imaging.ChatModelImageAnalysisCapability;
import com.neuroassist.stroke.imaging.ImageAnalysisCapability;
import com.neuroassist.stroke.imaging.ImageAnalysisModelListener;
import com.neuroassist.stroke.imaging.UnavailableImageAnalysisCapability;
import com.neuroassist.stroke.thread.MdcPropagatingExecutor;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.googleai.GoogleAiGeminiChatModel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;
import java.util.concurrent.Executors;

/**
 * Image-analysis wiring. With {@code neuroassist.image-analysis.gemini.api-key} set, CT images
 * go to Gemini; without it every image-bearing assessment fails as unavailable.
 */
@Slf4j
@Configuration
public class ImageAnalysisConfig {

    @Bean
    @ConditionalOnProperty(prefix = "neuroassist.image-analysis.gemini", name = "api-key")
    public ChatModel imageAnalysisChatModel(NeuroAssistProperties properties) {
        NeuroAssistProperties.Gemini gemini = properties.getImageAnalysis().getGemini();
        log.info("Image analysis backed by Gemini model {}", gemini.getModelName());
        return GoogleAiGeminiChatModel.builder()
                .apiKey(gemini.getApiKey())
                .modelName(gemini.getModelName())
                .temperature(gemini.getTemperature())
                .timeout(properties.getImageAnalysis().getTimeout())
                .listeners(List.of(new ImageAnalysisModelListener()))
                .build();
    }

    @Bean(destroyMethod = "shutdown")
    public MdcPropagatingExecutor imageAnalysisExecutor() {
        return new MdcPropagatingExecutor(Executors.newCachedThreadPool());
    }

    @Bean
    public ImageAnalysisCapability imageAnalysisCapability(ObjectProvider<ChatModel> chatModel,
                                                           ObjectMapper objectMapper,
                                                           MdcPropagatingExecutor imageAnalysisExecutor) {
        ChatModel model = chatModel.getIfAvailable();
        if (model == null) {
            log.warn("No image model configured; assessments with a CT image will be reported as unavailable");
            return new UnavailableImageAnalysisCapability();
        }
        return new ChatModelImageAnalysisCapability(model, objectMapper, imageAnalysisExecutor);
    }
}
