package ai.longdoc.translator.validate;

import ai.longdoc.translator.store.ArtifactLocator;
import ai.longdoc.translator.store.ArtifactStore;
import java.util.Objects;

/**
 * Accepts every translation as is.
 */
public class PassThroughValidationService implements ValidationService {

    private final ArtifactStore store;

    public PassThroughValidationService(ArtifactStore store) {
        this.store = Objects.requireNonNull(store, "store");
    }

    @Override
    public String validate(ArtifactLocator promptLocator, ArtifactLocator translatedLocator) {
        return store.getText(translatedLocator);
    }
}
