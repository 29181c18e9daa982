package com.phonepe.memsight.core.retrieval;

import lombok.experimental.UtilityClass;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reciprocal rank fusion
 */
@UtilityClass
class RankFusion {

    /**
     * Sum of 1 / (rank + c) over every ranking an id appears in, ranks starting at 1
     */
    static Map<String, Double> fuse(List<List<String>> rankings, int c) {
        final var scores = new LinkedHashMap<String, Double>();
        for (final var ranking : rankings) {
            for (int i = 0; i < ranking.size(); i++) {
                scores.merge(ranking.get(i), 1.0 / (i + 1 + c), Double::sum);
            }
        }
        return scores;
    }
}
