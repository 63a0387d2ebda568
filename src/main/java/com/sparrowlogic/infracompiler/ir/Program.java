package com.sparrowlogic.infracompiler.ir;

import java.util.List;

/**
 * Ordered top-level blocks of one Terraform configuration.
 */
public record Program(List<Block> blocks) {

    public Program {
        blocks = List.copyOf(blocks);
    }

    public static Program of(Block... blocks) {
        return new Program(List.of(blocks));
    }

    public boolean isEmpty() {
        return blocks.isEmpty();
    }
}
