package com.jslowering.jackson;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.Version;
import com.fasterxml.jackson.databind.BeanDescription;
import com.fasterxml.jackson.databind.DeserializationConfig;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.SerializationConfig;
import com.fasterxml.jackson.databind.deser.BeanDeserializerModifier;
import com.fasterxml.jackson.databind.deser.ResolvableDeserializer;
import com.fasterxml.jackson.databind.jsontype.NamedType;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.ser.BeanPropertyWriter;
import com.fasterxml.jackson.databind.ser.BeanSerializerModifier;
import com.jslowering.ast.*;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Jackson module that configures serialization/deserialization for the tree records.
 *
 * This module handles:
 * - Polymorphic node types through a "type" property named after the record
 * - A loc object in place of startLine/startCol/endLine/endCol
 * - Null children that stay in the output because their absence means something
 */
public class AstModule extends SimpleModule {

    // Written as loc instead
    private static final Set<String> POSITION_FIELDS = Set.of("startLine", "startCol", "endLine", "endCol");

    public AstModule() {
        super("AstModule", new Version(0, 1, 0, "SNAPSHOT", "com.jslowering", "lowering-jackson"));
    }

    @Override
    public void setupModule(SetupContext context) {
        super.setupModule(context);

        context.setMixInAnnotations(Node.class, NodeMixin.class);
        context.setMixInAnnotations(Statement.class, NodeMixin.class);
        context.setMixInAnnotations(Expression.class, NodeMixin.class);
        context.setMixInAnnotations(ObjectMember.class, NodeMixin.class);
        context.setMixInAnnotations(ClassElement.class, NodeMixin.class);

        for (Class<?> nodeClass : nodeRecords()) {
            context.registerSubtypes(new NamedType(nodeClass, nodeClass.getSimpleName()));
        }

        context.setMixInAnnotations(FunctionDeclaration.class, FunctionMixin.class);
        context.setMixInAnnotations(ClassDeclaration.class, ClassMixin.class);
        context.setMixInAnnotations(IfStatement.class, IfStatementMixin.class);
        context.setMixInAnnotations(ForStatement.class, ForStatementMixin.class);
        context.setMixInAnnotations(TryStatement.class, TryStatementMixin.class);
        context.setMixInAnnotations(ReturnStatement.class, ArgumentMixin.class);
        context.setMixInAnnotations(YieldStatement.class, ArgumentMixin.class);
        context.setMixInAnnotations(BreakStatement.class, LabelMixin.class);
        context.setMixInAnnotations(ContinueStatement.class, LabelMixin.class);
        context.setMixInAnnotations(VariableDeclarator.class, VariableDeclaratorMixin.class);
        context.setMixInAnnotations(Literal.class, LiteralMixin.class);

        context.addBeanSerializerModifier(new AstSerializerModifier());
        context.addBeanDeserializerModifier(new AstDeserializerModifier());
    }

    /**
     * Every record reachable from the sealed {@link Node} hierarchy.
     */
    static Set<Class<?>> nodeRecords() {
        Set<Class<?>> records = new LinkedHashSet<>();
        collectRecords(Node.class, records);
        return records;
    }

    private static void collectRecords(Class<?> type, Set<Class<?>> records) {
        if (type.isRecord()) {
            records.add(type);
            return;
        }
        Class<?>[] permitted = type.getPermittedSubclasses();
        if (permitted == null) {
            return;
        }
        for (Class<?> subclass : permitted) {
            collectRecords(subclass, records);
        }
    }

    // ==================== Serialization Mixins ====================

    @JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
    private abstract static class NodeMixin {
        @JsonProperty("loc")
        abstract SourceLocation loc();
    }

    // A null id marks a function expression
    private abstract static class FunctionMixin extends NodeMixin {
        @JsonInclude(JsonInclude.Include.ALWAYS)
        abstract Identifier id();
    }

    private abstract static class ClassMixin extends NodeMixin {
        @JsonInclude(JsonInclude.Include.ALWAYS)
        abstract Identifier id();
        @JsonInclude(JsonInclude.Include.ALWAYS)
        abstract Expression superClass();
    }

    private abstract static class IfStatementMixin extends NodeMixin {
        @JsonInclude(JsonInclude.Include.ALWAYS)
        abstract Statement alternate();
    }

    private abstract static class ForStatementMixin extends NodeMixin {
        @JsonInclude(JsonInclude.Include.ALWAYS)
        abstract Node init();
        @JsonInclude(JsonInclude.Include.ALWAYS)
        abstract Expression test();
        @JsonInclude(JsonInclude.Include.ALWAYS)
        abstract Expression update();
    }

    private abstract static class TryStatementMixin extends NodeMixin {
        @JsonInclude(JsonInclude.Include.ALWAYS)
        abstract CatchClause handler();
        @JsonInclude(JsonInclude.Include.ALWAYS)
        abstract BlockStatement finalizer();
    }

    private abstract static class ArgumentMixin extends NodeMixin {
        @JsonInclude(JsonInclude.Include.ALWAYS)
        abstract Expression argument();
    }

    private abstract static class LabelMixin extends NodeMixin {
        @JsonInclude(JsonInclude.Include.ALWAYS)
        abstract Identifier label();
    }

    private abstract static class VariableDeclaratorMixin extends NodeMixin {
        @JsonInclude(JsonInclude.Include.ALWAYS)
        abstract Expression init();
    }

    // JavaScript null literal
    private abstract static class LiteralMixin extends NodeMixin {
        @JsonInclude(JsonInclude.Include.ALWAYS)
        abstract Object value();
    }

    // ==================== Serializer Modifier ====================

    private static class AstSerializerModifier extends BeanSerializerModifier {
        @Override
        public List<BeanPropertyWriter> changeProperties(SerializationConfig config,
                                                         BeanDescription beanDesc,
                                                         List<BeanPropertyWriter> beanProperties) {
            if (!Node.class.isAssignableFrom(beanDesc.getBeanClass())) {
                return beanProperties;
            }
            List<BeanPropertyWriter> filtered = new ArrayList<>();
            for (BeanPropertyWriter prop : beanProperties) {
                if (!POSITION_FIELDS.contains(prop.getName())) {
                    filtered.add(prop);
                }
            }
            return filtered;
        }
    }

    // ==================== Deserializer Modifier ====================

    private static class AstDeserializerModifier extends BeanDeserializerModifier {
        @Override
        public JsonDeserializer<?> modifyDeserializer(DeserializationConfig config,
                                                      BeanDescription beanDesc,
                                                      JsonDeserializer<?> deserializer) {
            Class<?> beanClass = beanDesc.getBeanClass();
            if (Node.class.isAssignableFrom(beanClass) && beanClass.isRecord()) {
                return new AstNodeDeserializer(deserializer);
            }
            return deserializer;
        }
    }

    /**
     * Spreads the loc object of a node over its position components before the record is built.
     * Child nodes go through their own instance, so only the current object is rewritten.
     */
    private static class AstNodeDeserializer extends JsonDeserializer<Object> implements ResolvableDeserializer {

        private final JsonDeserializer<?> delegate;

        AstNodeDeserializer(JsonDeserializer<?> delegate) {
            this.delegate = delegate;
        }

        @Override
        public void resolve(DeserializationContext ctxt) throws JsonMappingException {
            if (delegate instanceof ResolvableDeserializer resolvable) {
                resolvable.resolve(ctxt);
            }
        }

        @Override
        public Object deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
            JsonNode tree = p.readValueAsTree();
            if (!(tree instanceof ObjectNode node)) {
                return ctxt.handleUnexpectedToken(Node.class, p);
            }

            JsonNode loc = node.remove("loc");
            if (loc != null && loc.isObject()) {
                node.put("startLine", loc.path("start").path("line").asInt());
                node.put("startCol", loc.path("start").path("column").asInt());
                node.put("endLine", loc.path("end").path("line").asInt());
                node.put("endCol", loc.path("end").path("column").asInt());
            }
            for (String field : List.of("start", "end", "startLine", "startCol", "endLine", "endCol")) {
                if (!node.has(field)) {
                    node.put(field, 0);
                }
            }

            JsonParser rewritten = node.traverse(p.getCodec());
            rewritten.nextToken();
            return delegate.deserialize(rewritten, ctxt);
        }
    }
}
