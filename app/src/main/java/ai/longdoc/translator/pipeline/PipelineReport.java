package ai.longdoc.translator.pipeline;

import ai.longdoc.translator.store.ArtifactLocator;
import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of a completed run.
 */
public record PipelineReport(String sessionId, ArtifactLocator finalDocument, Optional<ArtifactLocator> encodedDocument,
                             SessionSnapshot snapshot) {

    public PipelineReport {
        Objects.requireNonNull(sessionId, "sessionId");
        Objects.requireNonNull(finalDocument, "finalDocument");
        encodedDocument = encodedDocument == null ? Optional.empty() : encodedDocument;
        Objects.requireNonNull(snapshot, "snapshot");
    }
}
