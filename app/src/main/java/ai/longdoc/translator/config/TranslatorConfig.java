package ai.longdoc.translator.config;

import java.util.Objects;
import java.util.Optional;

/**
 * Holds runtime settings for the model provider: the translation model, the model used by the
 * validation reviewers, and the Ollama endpoint when applicable.
 */
public record TranslatorConfig(LlmProvider provider, String modelName, String validationModelName, Optional<String> baseUrl) {

    public TranslatorConfig {
        provider = Objects.requireNonNull(provider, "provider");
        modelName = requireNonBlank(modelName, "modelName");
        validationModelName = validationModelName == null || validationModelName.isBlank() ? modelName : validationModelName;
        baseUrl = baseUrl == null ? Optional.empty() : baseUrl;
    }

    public boolean isOllama() {
        return provider == LlmProvider.OLLAMA;
    }

    public boolean usesSeparateValidationModel() {
        return !validationModelName.equals(modelName);
    }

    private static String requireNonBlank(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new ConfigurationException(field + " must not be blank");
        }
        return value;
    }
}
