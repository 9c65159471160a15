package com.jslowering.codegen;

import com.jslowering.ast.Identifier;
import com.jslowering.ast.Node;
import com.jslowering.ast.visitor.AstVisitor;

import java.util.HashSet;
import java.util.Set;

/**
 * Hands out identifiers that are distinct from each other and from a set of reserved names.
 *
 * <p>One generator serves a whole compilation run and is shared by every transformation in
 * that run; it is never reset. It is not thread safe.</p>
 */
public class UniqueIdentifierGenerator {

    public static final String DEFAULT_PREFIX = "$__";

    private final String prefix;
    private final Set<String> reserved;
    private int identifierIndex;

    public UniqueIdentifierGenerator() {
        this(DEFAULT_PREFIX, Set.of());
    }

    public UniqueIdentifierGenerator(String prefix, Set<String> reserved) {
        if (prefix == null || prefix.isEmpty()) {
            throw new IllegalArgumentException("Identifier prefix must not be empty");
        }
        this.prefix = prefix;
        this.reserved = Set.copyOf(reserved);
    }

    /**
     * Creates a generator that never produces a name already used in {@code tree}.
     */
    public static UniqueIdentifierGenerator forTree(Node tree) {
        IdentifierCollector collector = new IdentifierCollector();
        collector.visitAny(tree);
        return new UniqueIdentifierGenerator(DEFAULT_PREFIX, collector.names);
    }

    public String generateUniqueIdentifier() {
        String name;
        do {
            name = prefix + identifierIndex++;
        } while (reserved.contains(name));
        return name;
    }

    private static final class IdentifierCollector extends AstVisitor {
        private final Set<String> names = new HashSet<>();

        @Override
        protected void visitIdentifier(Identifier tree) {
            names.add(tree.name());
        }
    }
}
