package com.tdnet.insight.controller;

import java.util.List;

/**
 * Object keys written by one insight request.
 */
public record ArtifactsResponse(int count, List<String> keys) {

    static ArtifactsResponse of(List<String> keys) {
        return new ArtifactsResponse(keys.size(), keys);
    }
}
