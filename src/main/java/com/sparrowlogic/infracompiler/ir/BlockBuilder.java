package com.sparrowlogic.infracompiler.ir;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Single-use accumulator for a {@link Block}. Calling anything after {@link #build()} fails.
 */
public final class BlockBuilder {

    private final String blockType;
    private final List<String> labels = new ArrayList<>();
    private final Map<String, Expression> attributes = new LinkedHashMap<>();
    private final List<Block> blocks = new ArrayList<>();
    private boolean built;

    BlockBuilder(String blockType) {
        this.blockType = Objects.requireNonNull(blockType, "blockType");
    }

    public BlockBuilder label(String label) {
        ensureOpen();
        labels.add(Objects.requireNonNull(label, "label"));
        return this;
    }

    public BlockBuilder attribute(String name, Expression value) {
        ensureOpen();
        attributes.put(Objects.requireNonNull(name, "name"), Objects.requireNonNull(value, "value"));
        return this;
    }

    public BlockBuilder attribute(String name, String value) {
        return attribute(name, Expression.string(value));
    }

    public BlockBuilder attribute(String name, boolean value) {
        return attribute(name, Expression.bool(value));
    }

    public BlockBuilder block(Block block) {
        ensureOpen();
        blocks.add(Objects.requireNonNull(block, "block"));
        return this;
    }

    public BlockBuilder blocks(List<Block> nested) {
        nested.forEach(this::block);
        return this;
    }

    public Block build() {
        ensureOpen();
        built = true;
        return new Block(blockType, labels, attributes, blocks);
    }

    private void ensureOpen() {
        if (built) {
            throw new IllegalStateException("Block '" + blockType + "' has already been built");
        }
    }
}
