package com.ivamare.eventsourcing.query;

import com.ivamare.eventsourcing.pipeline.RequestMetadata;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A request to read state, routed to exactly one handler by {@link #queryType()}.
 *
 * <p>Paging fields are mutable so that middlewares can apply defaults before the
 * handler runs.
 */
public final class Query {

    private final String queryType;
    private final Map<String, Object> params;
    private final RequestMetadata metadata;
    private final String cacheKey;
    private final boolean skipCache;
    private final List<String> fields;
    private final Instant timestamp;
    private Integer page;
    private Integer pageSize;

    private Query(Builder builder) {
        this.queryType = builder.queryType;
        this.params = Collections.unmodifiableMap(new LinkedHashMap<>(builder.params));
        this.metadata = builder.metadata == null ? RequestMetadata.empty() : builder.metadata;
        this.cacheKey = builder.cacheKey;
        this.skipCache = builder.skipCache;
        this.fields = builder.fields == null ? List.of() : List.copyOf(builder.fields);
        this.timestamp = builder.timestamp == null ? Instant.now() : builder.timestamp;
        this.page = builder.page;
        this.pageSize = builder.pageSize;
    }

    public static Builder builder(String queryType) {
        return new Builder(queryType);
    }

    public static Query of(String queryType) {
        return builder(queryType).build();
    }

    public String queryType() {
        return queryType;
    }

    public Map<String, Object> params() {
        return params;
    }

    @SuppressWarnings("unchecked")
    public <T> T param(String name) {
        return (T) params.get(name);
    }

    public RequestMetadata metadata() {
        return metadata;
    }

    public String correlationId() {
        return metadata.correlationId();
    }

    public String cacheKey() {
        return cacheKey;
    }

    public boolean skipCache() {
        return skipCache;
    }

    public List<String> fields() {
        return fields;
    }

    public Instant timestamp() {
        return timestamp;
    }

    public Integer getPage() {
        return page;
    }

    public void setPage(Integer page) {
        this.page = page;
    }

    public Integer getPageSize() {
        return pageSize;
    }

    public void setPageSize(Integer pageSize) {
        this.pageSize = pageSize;
    }

    public Query withCorrelationId(String correlationId) {
        return toBuilder().metadata(metadata.withCorrelationId(correlationId)).build();
    }

    public Builder toBuilder() {
        return new Builder(queryType)
            .params(params)
            .metadata(metadata)
            .cacheKey(cacheKey)
            .skipCache(skipCache)
            .fields(fields)
            .timestamp(timestamp)
            .page(page)
            .pageSize(pageSize);
    }

    @Override
    public String toString() {
        return "Query{type=" + queryType + ", correlationId=" + metadata.correlationId() + "}";
    }

    public static final class Builder {

        private final String queryType;
        private Map<String, Object> params = Map.of();
        private RequestMetadata metadata;
        private String cacheKey;
        private boolean skipCache;
        private List<String> fields;
        private Instant timestamp;
        private Integer page;
        private Integer pageSize;

        private Builder(String queryType) {
            this.queryType = queryType;
        }

        public Builder params(Map<String, Object> params) {
            this.params = params == null ? Map.of() : params;
            return this;
        }

        public Builder metadata(RequestMetadata metadata) {
            this.metadata = metadata;
            return this;
        }

        public Builder actor(String actorId) {
            this.metadata = RequestMetadata.forActor(actorId);
            return this;
        }

        public Builder cacheKey(String cacheKey) {
            this.cacheKey = cacheKey;
            return this;
        }

        public Builder skipCache(boolean skipCache) {
            this.skipCache = skipCache;
            return this;
        }

        public Builder fields(List<String> fields) {
            this.fields = fields;
            return this;
        }

        private Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder page(Integer page) {
            this.page = page;
            return this;
        }

        public Builder pageSize(Integer pageSize) {
            this.pageSize = pageSize;
            return this;
        }

        public Query build() {
            return new Query(this);
        }
    }
}
