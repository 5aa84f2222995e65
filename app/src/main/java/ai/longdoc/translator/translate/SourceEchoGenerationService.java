package ai.longdoc.translator.translate;

/**
 * Dry-run generation: returns the source section of a translation prompt unchanged, or the whole
 * prompt when it has no such section.
 */
public class SourceEchoGenerationService implements GenerationService {

    static final String SOURCE_HEADING = "## 4. Source Content\n---\n";
    static final String SOURCE_TERMINATOR = "\n---\n";

    @Override
    public String generate(String prompt, double temperature) {
        return sourceSection(prompt);
    }

    static String sourceSection(String prompt) {
        int heading = prompt.indexOf(SOURCE_HEADING);
        if (heading < 0) {
            return prompt;
        }
        int start = heading + SOURCE_HEADING.length();
        int end = prompt.lastIndexOf(SOURCE_TERMINATOR);
        if (end < start) {
            return prompt.substring(start);
        }
        return prompt.substring(start, end);
    }
}
