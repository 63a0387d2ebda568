package com.sparrowlogic.infracompiler.model;

import java.util.Map;
import java.util.Objects;

/**
 * An {@code aws_iam_role}. {@code assumeRolePolicy} is the trust policy JSON document.
 */
public record IamRole(
    String name,
    String assumeRolePolicy,
    String description,
    String path,
    Map<String, String> tags
) implements Resource {

    public static final String TYPE = "aws_iam_role";

    public IamRole {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(assumeRolePolicy, "assumeRolePolicy");
    }

    public static IamRole of(String name, String assumeRolePolicy) {
        return new IamRole(name, assumeRolePolicy, null, null, null);
    }

    @Override
    public String resourceType() {
        return TYPE;
    }

    @Override
    public String label() {
        return name;
    }

    @Override
    public <T> T accept(ResourceVisitor<T> visitor) {
        return visitor.visitIamRole(this);
    }
}
