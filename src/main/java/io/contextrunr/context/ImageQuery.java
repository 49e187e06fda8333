package io.contextrunr.context;

import java.time.Instant;

/**
 * Parameters of an image similarity lookup.
 *
 * @param conversationId conversation the images were shared in
 * @param since          only images analysed at or after this instant
 * @param limit          maximum number of matches
 * @param threshold      minimum similarity score, in [0, 1]
 */
public record ImageQuery(String conversationId, Instant since, int limit, double threshold) {
}
