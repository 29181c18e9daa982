package com.phonepe.memsight.core.classifier;

import com.phonepe.memsight.core.model.MemoryCategory;
import com.phonepe.memsight.core.model.QueryIntent;
import lombok.Builder;
import lombok.Value;

import java.util.Set;

/**
 * Intent of a query and the categories it routes to
 */
@Value
@Builder
public class QueryClassification {
    QueryIntent intent;
    double confidence;
    ClassificationSource source;
    Set<MemoryCategory> targetCategories;
}
