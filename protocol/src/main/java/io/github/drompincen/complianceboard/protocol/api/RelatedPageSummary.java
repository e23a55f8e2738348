package io.github.drompincen.complianceboard.protocol.api;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record RelatedPageSummary(
        String id,
        String title,
        String status,
        String pageKind,
        @JsonProperty("isControl") Boolean isControl,
        String relationType
) {
    public record Groups(
            List<RelatedPageSummary> controls,
            List<RelatedPageSummary> risks,
            List<RelatedPageSummary> threats,
            List<RelatedPageSummary> others
    ) {
        @JsonIgnore
        public int size() {
            return controls.size() + risks.size() + threats.size() + others.size();
        }
    }
}
