package org.springaicommunity.github.extractor.server;

import org.jspecify.annotations.Nullable;

import java.util.Map;

/**
 * Body of {@code POST /api/extract}.
 *
 * @param type tool id, e.g. {@code pull-request-extractor}
 * @param token GitHub credential; {@code GITHUB_TOKEN} is used when absent
 * @param args tool arguments ({@code org}, {@code repos}, {@code since}, ...)
 */
public record ExtractRequest(@Nullable String type, @Nullable String token, @Nullable Map<String, Object> args) {
}
