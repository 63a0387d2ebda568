package com.sparrowlogic.infracompiler.compiler;

import com.sparrowlogic.infracompiler.ir.Block;
import com.sparrowlogic.infracompiler.model.AwsProvider;

public final class ProviderCompiler {

    public Block compile(AwsProvider provider) {
        return Block.builder("provider")
            .label("aws")
            .attribute("region", provider.region().code())
            .build();
    }
}
