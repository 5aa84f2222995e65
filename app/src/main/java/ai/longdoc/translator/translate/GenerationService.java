package ai.longdoc.translator.translate;

/**
 * Produces text for a prompt. Implementations block until the full response is available.
 */
@FunctionalInterface
public interface GenerationService {

    /**
     * @throws GenerationException on any upstream failure
     */
    String generate(String prompt, double temperature);
}
