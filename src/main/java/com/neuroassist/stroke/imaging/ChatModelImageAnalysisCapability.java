package com.neuroassist.stroke.imaging;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.neuroassist.stroke.model.ClarityBand;
import com.neuroassist.stroke.model.CtScanImage;
import com.neuroassist.stroke.model.PatientAssessment;
import com.neuroassist.stroke.model.StrokeType;
import dev.langchain4j.data.message.ImageContent;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.TextContent;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.request.ChatRequestParameters;
import dev.langchain4j.model.chat.request.ResponseFormat;
import dev.langchain4j.model.chat.request.ResponseFormatType;
import dev.langchain4j.model.chat.response.ChatResponse;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Image-analysis capability backed by a multimodal langchain4j {@link ChatModel}.
 * The model receives the CT image plus the non-image clinical fields and must answer with
 * a JSON verdict; anything else fails the future.
 */
@Slf4j
public class ChatModelImageAnalysisCapability implements ImageAnalysisCapability {

    static final String SYSTEM_MESSAGE = """
            You are a neuroradiologist reading a non-contrast axial CT scan of the brain
            of a patient with suspected acute stroke. Classify the scan:
            1. strokeType: "Ischemic", "Hemorrhagic" or "Uncertain"
            2. clarityBand: "high" when the finding is unambiguous, "medium" when it is
               probable but not certain, "low" when the scan is ambiguous or unreadable.
            Use the clinical context only to orient your reading; base the verdict on the image.

            Respond ONLY with a JSON object in this exact format, no other text:
            {
              "strokeType": "Ischemic",
              "clarityBand": "high"
            }
            """;

    private final ChatModel chatModel;
    private final ObjectMapper objectMapper;
    private final Executor executor;

    public ChatModelImageAnalysisCapability(ChatModel chatModel, ObjectMapper objectMapper, Executor executor) {
        this.chatModel = chatModel;
        this.objectMapper = objectMapper;
        this.executor = executor;
    }

    @Override
    public CompletableFuture<ImageAnalysisVerdict> analyze(CtScanImage image, PatientAssessment clinicalContext) {
        return CompletableFuture.supplyAsync(() -> {
            log.debug("Sending {} to image model", image);
            ChatResponse response = chatModel.chat(toRequest(image, clinicalContext));
            return parseVerdict(response.aiMessage().text());
        }, executor);
    }

    ChatRequest toRequest(CtScanImage image, PatientAssessment context) {
        ImageContent imageContent = image.isInline()
                ? ImageContent.from(image.base64Data(), image.mimeType())
                : ImageContent.from(image.uri());

        return ChatRequest.builder()
                .messages(List.of(
                        SystemMessage.from(SYSTEM_MESSAGE),
                        UserMessage.from(TextContent.from(describe(context)), imageContent)))
                .parameters(ChatRequestParameters.builder()
                        .responseFormat(ResponseFormat.builder().type(ResponseFormatType.JSON).build())
                        .build())
                .build();
    }

    ImageAnalysisVerdict parseVerdict(String reply) {
        if (reply == null || reply.isBlank()) {
            throw new IllegalStateException("Image model returned an empty reply");
        }
        JsonNode node;
        try {
            node = objectMapper.readTree(stripCodeFence(reply));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Image model reply is not JSON: " + reply, e);
        }
        StrokeType strokeType = StrokeType.fromLabel(node.path("strokeType").asText())
                .orElseThrow(() -> new IllegalStateException("Unknown strokeType in image model reply: " + reply));
        ClarityBand clarity = ClarityBand.fromLabel(node.path("clarityBand").asText())
                .orElseThrow(() -> new IllegalStateException("Unknown clarityBand in image model reply: " + reply));
        return new ImageAnalysisVerdict(strokeType, clarity);
    }

    static String describe(PatientAssessment a) {
        return """
                Clinical context:
                Time since symptom onset: %s minutes
                Face droop: %s
                Slurred speech: %s
                Arm weakness: %s
                Systolic blood pressure: %s
                Diastolic blood pressure: %s
                History of hypertension: %s
                History of diabetes: %s
                History of smoking: %s
                Level of consciousness: %s
                Vomiting: %s
                Headache: %s
                """.formatted(
                a.timeSinceOnsetMinutes(),
                yesNo(a.faceDroop()),
                yesNo(a.speechSlurred()),
                a.armWeakness().label(),
                a.systolicBloodPressure() == null ? "not recorded" : a.systolicBloodPressure(),
                a.diastolicBloodPressure() == null ? "not recorded" : a.diastolicBloodPressure(),
                yesNo(a.historyHypertension()),
                yesNo(a.historyDiabetes()),
                yesNo(a.historySmoking()),
                a.levelOfConsciousness() == null ? "not recorded" : a.levelOfConsciousness().label(),
                a.vomiting() == null ? "not recorded" : yesNo(a.vomiting()),
                a.headache() == null ? "not recorded" : yesNo(a.headache()));
    }

    private static String yesNo(boolean value) {
        return value ? "Yes" : "No";
    }

    private static String stripCodeFence(String reply) {
        String trimmed = reply.trim();
        if (trimmed.startsWith("```")) {
            int firstNewline = trimmed.indexOf('\n');
            int lastFence = trimmed.lastIndexOf("```");
            if (firstNewline > 0 && lastFence > firstNewline) {
                return trimmed.substring(firstNewline + 1, lastFence).trim();
            }
        }
        return trimmed;
    }
}
