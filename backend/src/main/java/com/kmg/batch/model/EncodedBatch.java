package com.kmg.batch.model;

import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

public record EncodedBatch(List<EncodedRequest> requests, List<SkippedRecord> skipped) {
    public EncodedBatch {
        requests = List.copyOf(requests);
        skipped = List.copyOf(skipped);
    }

    public boolean isEmpty() {
        return requests.isEmpty();
    }

    public Set<Integer> submittedIndices() {
        return requests.stream().map(EncodedRequest::index).collect(Collectors.toCollection(TreeSet::new));
    }
}
