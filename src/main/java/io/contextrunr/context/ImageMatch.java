package io.contextrunr.context;

/**
 * A stored image analysis similar to a query.
 *
 * @param id              id of the image-analysis message
 * @param similarityScore similarity in [0, 1]
 */
public record ImageMatch(String id, double similarityScore) {
}
