package ai.longdoc.translator.translate;

import java.util.Objects;

/**
 * Provides generation services based on the desired execution mode.
 */
public class GenerationServiceFactory {

    private final GenerationService productionService;
    private final GenerationService dryRunService;
    private final GenerationService mockService;

    public GenerationServiceFactory(GenerationService productionService,
                                    GenerationService dryRunService,
                                    GenerationService mockService) {
        this.productionService = Objects.requireNonNull(productionService, "productionService");
        this.dryRunService = Objects.requireNonNull(dryRunService, "dryRunService");
        this.mockService = Objects.requireNonNull(mockService, "mockService");
    }

    public GenerationService select(TranslationMode mode) {
        return switch (mode) {
            case PRODUCTION -> productionService;
            case DRY_RUN -> dryRunService;
            case MOCK -> mockService;
        };
    }
}
