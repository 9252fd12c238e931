package org.springaicommunity.github.extractor.server;

public record ExtractResponse(String jobId) {
}
