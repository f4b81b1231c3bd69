package com.example.assetembed.service;

import com.example.assetembed.model.AssetProfile;
import com.example.assetembed.model.AssetRecord;
import com.example.assetembed.model.EmbeddingOptions;

/**
 * Inputs of a single decision plus the threshold that applies to the asset's media kind.
 */
final class DecisionContext {

    final AssetRecord record;
    final AssetProfile profile;
    final EmbeddingOptions options;
    final int threshold;

    DecisionContext(AssetRecord record, AssetProfile profile, EmbeddingOptions options) {
        this.record = record;
        this.profile = profile;
        this.options = options;
        this.threshold = options.thresholdFor(record.getMediaKind());
    }

    int size() {
        return record.getSize();
    }
}
