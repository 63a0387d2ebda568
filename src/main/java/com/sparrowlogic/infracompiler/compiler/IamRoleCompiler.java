package com.sparrowlogic.infracompiler.compiler;

import com.sparrowlogic.infracompiler.ir.Block;
import com.sparrowlogic.infracompiler.model.IamRole;

public final class IamRoleCompiler extends AbstractResourceCompiler<IamRole> {

    @Override
    public Block compile(IamRole role) {
        var block = start(role)
            .attribute("name", role.name())
            .attribute("assume_role_policy", role.assumeRolePolicy());

        optional(block, "description", role.description());
        optional(block, "path", role.path());
        tags(block, role.tags());

        return block.build();
    }
}
