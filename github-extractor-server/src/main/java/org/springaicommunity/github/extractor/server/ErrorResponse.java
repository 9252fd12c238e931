package org.springaicommunity.github.extractor.server;

public record ErrorResponse(String error) {
}
