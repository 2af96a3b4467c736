package com.anomalywatch.transform;

import com.anomalywatch.batch.DataBatch;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Ordered transformer chains keyed by {@link TransformHook}. Built once, immutable afterwards.
 *
 * <p>{@link #apply} runs a hook's chain strictly left to right. A hook with no transformers
 * returns the input untouched. The first failing transformer aborts the rest of the chain and
 * its exception propagates as is.</p>
 */
@Slf4j
public final class TransformPipeline {

    private static final TransformPipeline EMPTY = new TransformPipeline(new EnumMap<>(TransformHook.class));

    private final Map<TransformHook, List<BatchTransformer>> chains;

    private TransformPipeline(EnumMap<TransformHook, List<BatchTransformer>> chains) {
        this.chains = Collections.unmodifiableMap(chains);
    }

    public static TransformPipeline empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    public List<BatchTransformer> transformers(TransformHook hook) {
        return chains.getOrDefault(hook, List.of());
    }

    public boolean hasTransformers(TransformHook hook) {
        return !transformers(hook).isEmpty();
    }

    public DataBatch apply(TransformHook hook, DataBatch batch) {
        List<BatchTransformer> chain = transformers(hook);
        if (chain.isEmpty()) {
            return batch;
        }
        log.debug("Running hook | hook={} | transformers={} | rows={}", hook, chain.size(), batch.size());
        DataBatch current = batch;
        for (BatchTransformer transformer : chain) {
            current = transformer.transform(current);
            log.debug("Applied {} | hook={} | rows={}", transformer.describe(), hook, current.size());
        }
        return current;
    }

    public static final class Builder {
        private final EnumMap<TransformHook, List<BatchTransformer>> chains = new EnumMap<>(TransformHook.class);

        private Builder() {
        }

        public Builder add(TransformHook hook, BatchTransformer transformer) {
            chains.computeIfAbsent(hook, h -> new ArrayList<>()).add(transformer);
            return this;
        }

        public Builder addAll(TransformHook hook, List<? extends BatchTransformer> transformers) {
            transformers.forEach(t -> add(hook, t));
            return this;
        }

        public Builder before(BatchTransformer... transformers) {
            return addAll(TransformHook.BEFORE, List.of(transformers));
        }

        public Builder after(BatchTransformer... transformers) {
            return addAll(TransformHook.AFTER, List.of(transformers));
        }

        public Builder afterDetection(BatchTransformer... transformers) {
            return addAll(TransformHook.AFTER_DETECTION, List.of(transformers));
        }

        public TransformPipeline build() {
            EnumMap<TransformHook, List<BatchTransformer>> frozen = new EnumMap<>(TransformHook.class);
            chains.forEach((hook, list) -> frozen.put(hook, List.copyOf(list)));
            return new TransformPipeline(frozen);
        }
    }
}
