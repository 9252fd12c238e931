package org.springaicommunity.github.extractor;

/**
 * Pull request selection criteria.
 *
 * @param state list-path state filter: {@code open}, {@code closed} or {@code all}
 * @param mergedOnly keep only pull requests with a merge timestamp
 * @param window bound on the merge timestamp
 */
public record PullRequestFilter(String state, boolean mergedOnly, ExtractionWindow window) {
}
