package com.sparrowlogic.infracompiler.ir;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A labelled container of attributes and nested blocks, e.g.
 * {@code resource "aws_vpc" "main" { ... }}. Attribute and block order is the order they were added.
 */
public record Block(String blockType,
                    List<String> labels,
                    Map<String, Expression> attributes,
                    List<Block> blocks) {

    public Block {
        Objects.requireNonNull(blockType, "blockType");
        labels = List.copyOf(labels);
        attributes = Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
        blocks = List.copyOf(blocks);
    }

    public static BlockBuilder builder(String blockType) {
        return new BlockBuilder(blockType);
    }

    public Expression attribute(String name) {
        return attributes.get(name);
    }

    public List<Block> blocks(String blockType) {
        return blocks.stream().filter(b -> b.blockType().equals(blockType)).toList();
    }
}
