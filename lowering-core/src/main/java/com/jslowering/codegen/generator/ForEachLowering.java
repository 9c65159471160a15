package com.jslowering.codegen.generator;

import com.jslowering.ast.ForEachStatement;
import com.jslowering.ast.Statement;
import com.jslowering.codegen.UniqueIdentifierGenerator;

/**
 * Lowers one for-each loop into iteration protocol calls.
 */
@FunctionalInterface
public interface ForEachLowering {
    Statement lower(UniqueIdentifierGenerator identifierGenerator, ForEachStatement loop);
}
