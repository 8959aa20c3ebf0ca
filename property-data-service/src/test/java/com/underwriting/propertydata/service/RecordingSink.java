package com.underwriting.propertydata.service;

import com.underwriting.common.model.CanonicalPropertyData;
import com.underwriting.propertydata.persistence.PropertyDataSink;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

final class RecordingSink implements PropertyDataSink {

    final List<CanonicalPropertyData> saved = new CopyOnWriteArrayList<>();
    private volatile RuntimeException failure;

    void failWith(RuntimeException failure) {
        this.failure = failure;
    }

    @Override
    public Mono<Void> save(CanonicalPropertyData record) {
        if (failure != null) {
            return Mono.error(failure);
        }
        return Mono.fromRunnable(() -> saved.add(record));
    }
}
