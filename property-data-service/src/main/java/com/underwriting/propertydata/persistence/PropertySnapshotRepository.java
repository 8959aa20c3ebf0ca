package com.underwriting.propertydata.persistence;

import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface PropertySnapshotRepository extends ReactiveCrudRepository<PropertySnapshot, Long> {
}
