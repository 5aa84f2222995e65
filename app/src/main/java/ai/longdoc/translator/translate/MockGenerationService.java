package ai.longdoc.translator.translate;

/**
 * Mock generation used for offline runs: echoes the prompt with a marker prefix.
 */
public class MockGenerationService implements GenerationService {

    static final String PREFIX = "[MOCK] ";

    @Override
    public String generate(String prompt, double temperature) {
        return PREFIX + SourceEchoGenerationService.sourceSection(prompt);
    }
}
