package io.github.drompincen.complianceboard.client.model;

import io.github.drompincen.complianceboard.protocol.api.*;
import io.github.drompincen.complianceboard.protocol.api.EvidenceRequestDto.Bucket;
import io.github.drompincen.complianceboard.runtime.evidence.EvidenceRequestClassifier;
import io.github.drompincen.complianceboard.runtime.evidence.EvidenceTimeline;
import io.github.drompincen.complianceboard.runtime.evidence.RelevanceClassifier;
import io.github.drompincen.complianceboard.runtime.related.RelatedPageClassifier;

import java.time.LocalDate;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/** Read-only view of the selected page's evidence, requests, relevance and related pages. */
public final class EvidencePanelModel {

    private final List<EvidenceEntry> entries;
    private final Map<Bucket, Integer> requestBuckets;
    private final Optional<RelevanceClassification> relevance;
    private final RelatedPageSummary.Groups related;
    private final LocalDate today;

    private EvidencePanelModel(List<EvidenceEntry> entries, Map<Bucket, Integer> requestBuckets,
                               Optional<RelevanceClassification> relevance, RelatedPageSummary.Groups related,
                               LocalDate today) {
        this.entries = entries;
        this.requestBuckets = requestBuckets;
        this.relevance = relevance;
        this.related = related;
        this.today = today;
    }

    public static EvidencePanelModel of(FullDocumentDto document, LocalDate today) {
        List<EvidenceRequestDto> requests = document.evidenceRequests() != null ? document.evidenceRequests() : List.of();
        Map<Bucket, Integer> buckets = new EnumMap<>(Bucket.class);
        for (Bucket bucket : Bucket.values()) buckets.put(bucket, 0);
        for (EvidenceRequestDto request : requests) {
            buckets.merge(EvidenceRequestClassifier.bucket(request, today), 1, Integer::sum);
        }
        Integer score = document.document() != null ? document.document().relevanceScore() : null;
        return new EvidencePanelModel(
                EvidenceTimeline.combine(document.evidence(), requests),
                buckets,
                RelevanceClassifier.classify(score),
                RelatedPageClassifier.partition(document.relatedPages()),
                today);
    }

    /** Requests first, then evidence items. */
    public List<EvidenceEntry> entries() {
        return entries;
    }

    public int requestCount(Bucket bucket) {
        return requestBuckets.getOrDefault(bucket, 0);
    }

    public int openRequestCount() {
        return requestBuckets.values().stream().mapToInt(Integer::intValue).sum() - requestCount(Bucket.COMPLETED);
    }

    public Bucket bucketOf(EvidenceRequestDto request) {
        return EvidenceRequestClassifier.bucket(request, today);
    }

    /** Empty when the page carries no relevance score. */
    public Optional<RelevanceClassification> relevance() {
        return relevance;
    }

    public RelatedPageSummary.Groups related() {
        return related;
    }
}
