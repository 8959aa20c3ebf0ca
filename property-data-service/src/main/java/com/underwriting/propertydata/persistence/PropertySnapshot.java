package com.underwriting.propertydata.persistence;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;

/**
 * One merged record as it was at aggregation time.
 *
 * recordJson: JSON-serialised {@code CanonicalPropertyData}
 * sources: comma-separated provider ids in precedence order
 */
@Data
@NoArgsConstructor
@Table("property_snapshot")
public class PropertySnapshot {

    @Id
    private Long id;

    private String cacheKey;

    private String line1;

    private String city;

    private String state;

    private String zip;

    private String recordJson;

    private String sources;

    private boolean partialResult;

    private String traceId;

    private LocalDateTime savedAt;
}
