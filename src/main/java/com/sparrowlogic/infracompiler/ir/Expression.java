package com.sparrowlogic.infracompiler.ir;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Value of an attribute in the IR.
 */
public sealed interface Expression {

    static StringValue string(String value) {
        return new StringValue(value);
    }

    static BoolValue bool(boolean value) {
        return value ? BoolValue.TRUE : BoolValue.FALSE;
    }

    static ArrayValue array(List<? extends Expression> elements) {
        return new ArrayValue(List.copyOf(elements));
    }

    static ArrayValue strings(List<String> values) {
        return new ArrayValue(values.stream().<Expression>map(StringValue::new).toList());
    }

    static ObjectValue object(Map<String, ? extends Expression> entries) {
        return new ObjectValue(new LinkedHashMap<>(entries));
    }

    record StringValue(String value) implements Expression {
        public StringValue {
            Objects.requireNonNull(value, "value");
        }
    }

    record BoolValue(boolean value) implements Expression {
        static final BoolValue TRUE = new BoolValue(true);
        static final BoolValue FALSE = new BoolValue(false);
    }

    record ArrayValue(List<Expression> elements) implements Expression {
        public ArrayValue {
            elements = List.copyOf(elements);
        }
    }

    record ObjectValue(Map<String, Expression> entries) implements Expression {
        public ObjectValue {
            entries = Collections.unmodifiableMap(new LinkedHashMap<>(entries));
        }
    }

    /**
     * Unquoted traversal to another block's attribute, resolved by Terraform at apply time,
     * e.g. {@code aws_vpc.main.id} or {@code data.aws_vpc.shared.id}.
     */
    record RawReference(String mode, String resourceType, String name, String attribute) implements Expression {

        public static final String MANAGED = "resource";
        public static final String DATA = "data";

        public RawReference {
            Objects.requireNonNull(mode, "mode");
            Objects.requireNonNull(resourceType, "resourceType");
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(attribute, "attribute");
        }

        public static RawReference to(String resourceType, String name, String attribute) {
            return new RawReference(MANAGED, resourceType, name, attribute);
        }

        public String token() {
            var traversal = resourceType + "." + name + "." + attribute;
            return DATA.equals(mode) ? DATA + "." + traversal : traversal;
        }
    }
}
