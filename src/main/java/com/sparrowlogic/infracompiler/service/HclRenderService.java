package com.sparrowlogic.infracompiler.service;

import com.sparrowlogic.infracompiler.ir.Block;
import com.sparrowlogic.infracompiler.ir.Expression;
import com.sparrowlogic.infracompiler.ir.Expression.ArrayValue;
import com.sparrowlogic.infracompiler.ir.Expression.BoolValue;
import com.sparrowlogic.infracompiler.ir.Expression.ObjectValue;
import com.sparrowlogic.infracompiler.ir.Expression.RawReference;
import com.sparrowlogic.infracompiler.ir.Expression.StringValue;
import com.sparrowlogic.infracompiler.ir.Program;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.stream.Collectors;

/**
 * Writes IR blocks as Terraform HCL. Attributes come before nested blocks, each group in
 * insertion order.
 */
@Service
public class HclRenderService {

    private final int indentWidth;

    public HclRenderService(@Value("${infracompiler.render.indent:2}") int indentWidth) {
        if (indentWidth < 1) {
            throw new IllegalArgumentException("Indent width must be positive, got " + indentWidth);
        }
        this.indentWidth = indentWidth;
    }

    public String render(Program program) {
        return program.blocks().stream()
            .map(this::render)
            .collect(Collectors.joining("\n"));
    }

    public String render(Block block) {
        var out = new StringBuilder();
        appendBlock(out, block, 0);
        return out.toString();
    }

    private void appendBlock(StringBuilder out, Block block, int depth) {
        indent(out, depth).append(block.blockType());
        block.labels().forEach(label -> out.append(' ').append(quote(label)));

        if (block.attributes().isEmpty() && block.blocks().isEmpty()) {
            out.append(" {}\n");
            return;
        }
        out.append(" {\n");

        block.attributes().forEach((name, value) -> {
            indent(out, depth + 1).append(name).append(" = ");
            appendExpression(out, value, depth + 1);
            out.append('\n');
        });
        block.blocks().forEach(nested -> appendBlock(out, nested, depth + 1));

        indent(out, depth).append("}\n");
    }

    private void appendExpression(StringBuilder out, Expression expression, int depth) {
        if (expression instanceof StringValue string) {
            out.append(quote(string.value()));
        } else if (expression instanceof BoolValue bool) {
            out.append(bool.value());
        } else if (expression instanceof RawReference reference) {
            out.append(reference.token());
        } else if (expression instanceof ArrayValue array) {
            out.append('[');
            for (int i = 0; i < array.elements().size(); i++) {
                if (i > 0) {
                    out.append(", ");
                }
                appendExpression(out, array.elements().get(i), depth);
            }
            out.append(']');
        } else if (expression instanceof ObjectValue object) {
            if (object.entries().isEmpty()) {
                out.append("{}");
                return;
            }
            out.append("{\n");
            object.entries().forEach((key, value) -> {
                indent(out, depth + 1).append(quote(key)).append(" = ");
                appendExpression(out, value, depth + 1);
                out.append('\n');
            });
            indent(out, depth).append('}');
        } else {
            throw new IllegalArgumentException("Unsupported expression: " + expression);
        }
    }

    private StringBuilder indent(StringBuilder out, int depth) {
        return out.append(" ".repeat(depth * indentWidth));
    }

    static String quote(String value) {
        var quoted = new StringBuilder(value.length() + 2).append('"');
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            boolean templateStart = i + 1 < value.length() && value.charAt(i + 1) == '{';
            switch (c) {
                case '"' -> quoted.append("\\\"");
                case '\\' -> quoted.append("\\\\");
                case '\n' -> quoted.append("\\n");
                case '\r' -> quoted.append("\\r");
                case '\t' -> quoted.append("\\t");
                case '$' -> quoted.append(templateStart ? "$$" : "$");
                case '%' -> quoted.append(templateStart ? "%%" : "%");
                default -> quoted.append(c);
            }
        }
        return quoted.append('"').toString();
    }
}
