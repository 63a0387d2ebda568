package com.sparrowlogic.infracompiler.compiler;

import com.sparrowlogic.infracompiler.ir.Block;
import com.sparrowlogic.infracompiler.ir.BlockBuilder;
import com.sparrowlogic.infracompiler.ir.Expression;
import com.sparrowlogic.infracompiler.ir.Expression.RawReference;
import com.sparrowlogic.infracompiler.model.Filter;
import com.sparrowlogic.infracompiler.model.Resource;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Shared emission rules: null optionals add nothing, tags become an object with sorted keys,
 * filters become one nested block each in the given order.
 */
abstract class AbstractResourceCompiler<R extends Resource> implements ResourceCompiler<R> {

    static final String ID = "id";
    static final String ARN = "arn";

    BlockBuilder start(R resource) {
        return Block.builder(resource.blockType())
            .label(resource.resourceType())
            .label(resource.label());
    }

    static RawReference reference(Resource target, String attribute) {
        return new RawReference(target.blockType(), target.resourceType(), target.label(), attribute);
    }

    static void optional(BlockBuilder block, String name, String value) {
        if (value != null) {
            block.attribute(name, value);
        }
    }

    static void optional(BlockBuilder block, String name, Boolean value) {
        if (value != null) {
            block.attribute(name, value.booleanValue());
        }
    }

    static void optional(BlockBuilder block, String name, List<String> values) {
        if (values != null) {
            block.attribute(name, Expression.strings(values));
        }
    }

    static void tags(BlockBuilder block, Map<String, String> tags) {
        if (tags == null) {
            return;
        }
        var entries = new TreeMap<String, Expression>();
        tags.forEach((key, value) -> entries.put(key, Expression.string(value)));
        block.attribute("tags", Expression.object(entries));
    }

    static void filters(BlockBuilder block, List<Filter> filters) {
        if (filters == null) {
            return;
        }
        for (var filter : filters) {
            block.block(Block.builder("filter")
                .attribute("name", filter.name())
                .attribute("values", Expression.strings(filter.values()))
                .build());
        }
    }
}
