package com.sparrowlogic.infracompiler.compiler;

import com.sparrowlogic.infracompiler.ir.Block;
import com.sparrowlogic.infracompiler.model.Resource;

/**
 * Deterministic mapping from one resource value to one top-level block. Implementations hold
 * no state and may be shared between threads.
 */
public interface ResourceCompiler<R extends Resource> {

    Block compile(R resource);
}
