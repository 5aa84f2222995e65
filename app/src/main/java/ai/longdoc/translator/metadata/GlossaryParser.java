package ai.longdoc.translator.metadata;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads the entity dictionary produced by the extraction prompt.
 *
 * <p>Expected shape: {@code {"term": {"context": "...", "suggested_translation": "..."}}}, possibly
 * wrapped in a Markdown code fence. A value that is a plain string is taken as the suggestion.
 */
public class GlossaryParser {

    private static final Logger LOGGER = LoggerFactory.getLogger(GlossaryParser.class);

    private final ObjectMapper objectMapper;

    public GlossaryParser() {
        this(new ObjectMapper());
    }

    public GlossaryParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public Map<String, GlossaryTerm> parse(String entityText) {
        if (entityText == null || entityText.isBlank()) {
            return Map.of();
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(stripCodeFence(entityText));
        } catch (JsonProcessingException ex) {
            LOGGER.warn("Entity glossary is not valid JSON; it will be used as free text ({})", ex.getOriginalMessage());
            return Map.of();
        }
        if (root == null || !root.isObject()) {
            LOGGER.warn("Entity glossary is not a JSON object; it will be used as free text");
            return Map.of();
        }
        Map<String, GlossaryTerm> terms = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            JsonNode value = field.getValue();
            if (value.isTextual()) {
                terms.put(field.getKey(), new GlossaryTerm("", value.asText()));
            } else if (value.isObject()) {
                terms.put(field.getKey(), new GlossaryTerm(value.path("context").asText(""),
                        value.path("suggested_translation").asText("")));
            }
        }
        return terms;
    }

    static String stripCodeFence(String text) {
        String trimmed = text.strip();
        if (!trimmed.startsWith("```")) {
            return trimmed;
        }
        int firstLineEnd = trimmed.indexOf('\n');
        int closingFence = trimmed.lastIndexOf("```");
        if (firstLineEnd < 0 || closingFence <= firstLineEnd) {
            return trimmed;
        }
        return trimmed.substring(firstLineEnd + 1, closingFence).strip();
    }
}
