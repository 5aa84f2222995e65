package ai.longdoc.translator.translate;

import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.exception.ModelNotFoundException;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.response.ChatResponse;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Generation service backed by a LangChain4j {@link ChatModel} implementation.
 */
public class ChatModelGenerationService implements GenerationService {

    private static final Logger LOGGER = LoggerFactory.getLogger(ChatModelGenerationService.class);

    private final ChatModel model;
    private final String providerName;
    private final String modelName;

    public ChatModelGenerationService(ChatModel model, String providerName, String modelName) {
        this.model = Objects.requireNonNull(model, "model");
        this.providerName = requireNonBlank(providerName, "providerName");
        this.modelName = requireNonBlank(modelName, "modelName");
    }

    @Override
    public String generate(String prompt, double temperature) {
        Objects.requireNonNull(prompt, "prompt");
        ChatRequest request = ChatRequest.builder()
                .messages(UserMessage.from(prompt))
                .temperature(temperature)
                .build();
        ChatResponse response;
        try {
            response = model.chat(request);
        } catch (RuntimeException ex) {
            if (isModelMissing(ex)) {
                throw new GenerationException("%s model '%s' is not available.".formatted(providerName, modelName), ex);
            }
            throw new GenerationException("%s generation failed: %s".formatted(providerName, ex.getMessage()), ex);
        }
        String text = response == null || response.aiMessage() == null ? null : response.aiMessage().text();
        if (text == null || text.isBlank()) {
            throw new GenerationException("%s model '%s' returned an empty response".formatted(providerName, modelName), null);
        }
        LOGGER.debug("{} returned {} characters for a {} character prompt", modelName, text.length(), prompt.length());
        return text;
    }

    private boolean isModelMissing(Throwable throwable) {
        Throwable cause = throwable;
        while (cause != null) {
            if (cause instanceof ModelNotFoundException) {
                return true;
            }
            cause = cause.getCause();
        }
        return false;
    }

    private static String requireNonBlank(String value, String fieldName) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(fieldName + " must not be blank");
        }
        return value;
    }
}
