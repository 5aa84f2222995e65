package ai.longdoc.translator.metadata;

/**
 * Where the glossary and style guidance of a session came from.
 */
public enum MetadataOrigin {
    SUPPLIED,
    EXTRACTED,
    /** One part supplied by the caller, the other extracted. */
    MIXED,
    STORED
}
