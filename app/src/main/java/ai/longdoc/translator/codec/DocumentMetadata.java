package ai.longdoc.translator.codec;

/**
 * Marker for the structural information a codec keeps aside for reassembly.
 */
public interface DocumentMetadata {
}
