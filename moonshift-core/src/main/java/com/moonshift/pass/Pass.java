package com.moonshift.pass;

import com.moonshift.ast.Chunk;

/**
 * One semantics-preserving rewrite. Implementations keep no state between calls.
 */
public interface Pass {

    String name();

    Chunk apply(Chunk chunk, PassContext context);
}
