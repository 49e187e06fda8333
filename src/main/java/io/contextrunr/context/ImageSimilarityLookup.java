package io.contextrunr.context;

import java.util.List;

/**
 * Finds previously analysed images whose descriptions resemble a text.
 * Optional: without an implementation the most recent analysis is used.
 */
public interface ImageSimilarityLookup {

    /**
     * @param text  the query text
     * @param query search bounds
     * @return matches, in any order
     */
    List<ImageMatch> findSimilar(String text, ImageQuery query);
}
