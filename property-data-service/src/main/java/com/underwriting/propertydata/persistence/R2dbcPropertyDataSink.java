package com.underwriting.propertydata.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.underwriting.common.model.CanonicalPropertyData;
import com.underwriting.common.trace.AggregationContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.LocalDateTime;

/**
 * Appends one {@code property_snapshot} row per aggregation through Spring Data R2DBC.
 */
@Service
public class R2dbcPropertyDataSink implements PropertyDataSink {

    private static final Logger log = LoggerFactory.getLogger(R2dbcPropertyDataSink.class);

    private final PropertySnapshotRepository repository;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public R2dbcPropertyDataSink(PropertySnapshotRepository repository, ObjectMapper objectMapper, Clock clock) {
        this.repository   = repository;
        this.objectMapper = objectMapper;
        this.clock        = clock;
    }

    @Override
    public Mono<Void> save(CanonicalPropertyData record) {
        return Mono.deferContextual(ctx -> {
            String traceId = AggregationContext.traceId(ctx);
            return Mono.fromCallable(() -> toEntity(record, traceId))
                .flatMap(repository::save)
                .doOnSuccess(s -> log.info("Property snapshot persisted. id={} address={} sources={} traceId={}",
                    s.getId(), record.address().format(), s.getSources(), traceId))
                .doOnError(e -> log.error("Failed to persist property snapshot. address={} traceId={}",
                    record.address().format(), traceId, e))
                .then();
        });
    }

    PropertySnapshot toEntity(CanonicalPropertyData record, String traceId) throws JsonProcessingException {
        PropertySnapshot entity = new PropertySnapshot();
        entity.setCacheKey(record.address().cacheKey());
        entity.setLine1(record.address().line1());
        entity.setCity(record.address().city());
        entity.setState(record.address().state());
        entity.setZip(record.address().zip());
        entity.setRecordJson(objectMapper.writeValueAsString(record));
        entity.setSources(String.join(",", record.sources()));
        entity.setPartialResult(record.isPartial());
        entity.setTraceId(traceId);
        entity.setSavedAt(LocalDateTime.now(clock));
        return entity;
    }
}
