package com.moonshift.pass;

import com.moonshift.ast.SourceLocation;
import com.moonshift.pipeline.TransformOptions;
import com.moonshift.pipeline.Warning;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

/**
 * Per-invocation state shared by the passes of one pipeline run.
 */
public final class PassContext {

    private static final Logger LOG = LoggerFactory.getLogger(PassContext.class);

    private final TransformOptions options;
    private final Random random;
    private final List<Warning> warnings = new ArrayList<>();

    public PassContext(TransformOptions options) {
        this.options = options;
        this.random = options.seed() != null ? new Random(options.seed()) : new Random();
    }

    public TransformOptions options() {
        return options;
    }

    public Random random() {
        return random;
    }

    public void warn(String source, Warning.Category category, String message, SourceLocation loc) {
        Warning warning = Warning.at(category, source, message, loc);
        LOG.warn("{}", warning);
        warnings.add(warning);
    }

    public void addAll(List<Warning> more) {
        warnings.addAll(more);
    }

    public List<Warning> warnings() {
        return Collections.unmodifiableList(warnings);
    }
}
