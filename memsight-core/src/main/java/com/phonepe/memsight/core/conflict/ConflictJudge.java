package com.phonepe.memsight.core.conflict;

import java.util.Optional;

/**
 * A language model asked about pairs of texts the rules leave undecided. Implementations may block on network I/O.
 * Returning empty keeps the texts apart.
 */
public interface ConflictJudge {

    enum Relation {
        /**
         * Same text, give or take formatting
         */
        DUPLICATE,
        /**
         * Same meaning, different wording
         */
        EQUIVALENT,
        /**
         * The new text says the opposite of, or replaces a value in, the existing one
         */
        CONTRADICTORY,
        /**
         * The new text adds detail to the existing one
         */
        COMPLEMENTARY,
        UNRELATED,
    }

    record Judgement(Relation relation, double confidence) {
    }

    Optional<Judgement> judge(String incoming, String existing);
}
