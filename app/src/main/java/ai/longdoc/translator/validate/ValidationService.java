package ai.longdoc.translator.validate;

import ai.longdoc.translator.store.ArtifactLocator;

/**
 * Reviews a translated chunk against the prompt it was produced from and returns the final text.
 */
@FunctionalInterface
public interface ValidationService {

    /**
     * @throws ValidationException when the review cannot be completed
     */
    String validate(ArtifactLocator promptLocator, ArtifactLocator translatedLocator);
}
