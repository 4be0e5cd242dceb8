package com.purchasingpower.repoagent.model;

import lombok.Builder;
import lombok.Value;

/**
 * Result of the generate-with-tests workflow: the model answer split into the
 * implementation section and the tests section.
 *
 * <p>Either part is an empty string when the model omitted its label.
 */
@Value
@Builder
public class GeneratedCodeWithTests {

    String implementation;

    String tests;

    /**
     * @return true when both sections were recovered
     */
    public boolean isComplete() {
        return !implementation.isEmpty() && !tests.isEmpty();
    }
}
