package com.moonshift.pipeline;

import java.util.List;

/**
 * Outcome of one invocation. A failure carries no output text.
 */
public sealed interface TransformResult permits TransformResult.Success, TransformResult.Failure {

    List<Warning> warnings();

    default boolean isSuccess() {
        return this instanceof Success;
    }

    /**
     * @throws TransformException for a failure
     */
    default String orElseThrow() {
        if (this instanceof Success success) {
            return success.output();
        }
        throw new TransformException(((Failure) this).diagnostic());
    }

    record Success(String output, List<Warning> warnings) implements TransformResult {
        public Success {
            warnings = List.copyOf(warnings);
        }
    }

    record Failure(Diagnostic diagnostic, List<Warning> warnings) implements TransformResult {
        public Failure {
            warnings = List.copyOf(warnings);
        }
    }
}
