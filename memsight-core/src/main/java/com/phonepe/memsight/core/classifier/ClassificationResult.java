package com.phonepe.memsight.core.classifier;

import com.phonepe.memsight.core.model.MemoryCategory;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Map;
import java.util.Set;

/**
 * Category assigned to a piece of content along with attributes extracted from it
 */
@Value
@Builder
public class ClassificationResult {
    MemoryCategory category;
    double confidence;
    ClassificationSource source;
    @Singular
    Set<String> subcategories;
    @Singular
    Map<String, Object> attributes;
}
