package com.moonshift.jackson;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.Version;
import com.fasterxml.jackson.databind.BeanDescription;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializationConfig;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.databind.ser.BeanPropertyWriter;
import com.fasterxml.jackson.databind.ser.BeanSerializerModifier;
import com.moonshift.ast.BinaryOperator;
import com.moonshift.ast.Literal;
import com.moonshift.ast.Node;
import com.moonshift.ast.UnaryOperator;
import com.moonshift.scope.Symbol;
import com.moonshift.value.LuaStrings;
import com.moonshift.value.LuaValue;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Jackson module that configures serialization for the AST records.
 *
 * This module handles:
 * - A "type" property on every node
 * - Symbols written as their numeric id, scopes and symbol tables left out
 * - Lua values written as JSON null, boolean, number or string
 * - Operators written with their Lua spelling
 */
public class AstModule extends SimpleModule {

    // Derived accessors and back references that are not part of the tree
    private static final Set<String> EXCLUDED_FIELDS = Set.of(
        "scope", "symbols", "prefix", "multiValued", "empty", "synthetic", "string", "number");

    public AstModule() {
        super("AstModule", new Version(1, 0, 0, null, "com.moonshift", "moonshift-jackson"));
        addSerializer(Symbol.class, new SymbolSerializer());
        addSerializer(LuaValue.class, new LuaValueSerializer());
        addSerializer(BinaryOperator.class, new BinaryOperatorSerializer());
        addSerializer(UnaryOperator.class, new UnaryOperatorSerializer());
    }

    @Override
    public void setupModule(SetupContext context) {
        super.setupModule(context);

        // Mixins on the sealed interfaces are not reliably inherited by records, so every
        // concrete node type gets its own
        for (Class<?> nodeClass : concreteNodeClasses(Node.class)) {
            context.setMixInAnnotations(nodeClass, nodeClass == Literal.class ? LiteralMixin.class : NodeMixin.class);
        }

        context.addBeanSerializerModifier(new AstSerializerModifier());
    }

    static List<Class<?>> concreteNodeClasses(Class<?> type) {
        if (!type.isSealed()) {
            return List.of(type);
        }
        List<Class<?>> classes = new ArrayList<>();
        for (Class<?> permitted : type.getPermittedSubclasses()) {
            classes.addAll(concreteNodeClasses(permitted));
        }
        return classes;
    }

    // ==================== Serialization Mixins ====================

    private abstract static class NodeMixin {
        @JsonProperty("type")
        abstract String type();
    }

    private abstract static class LiteralMixin extends NodeMixin {
        @JsonInclude(JsonInclude.Include.ALWAYS)
        abstract LuaValue value();
    }

    // ==================== Serializer Modifier ====================

    private static class AstSerializerModifier extends BeanSerializerModifier {
        @Override
        public List<BeanPropertyWriter> changeProperties(SerializationConfig config,
                                                         BeanDescription beanDesc,
                                                         List<BeanPropertyWriter> beanProperties) {
            beanProperties.removeIf(writer -> EXCLUDED_FIELDS.contains(writer.getName()));
            return beanProperties;
        }
    }

    // ==================== Value Serializers ====================

    private static class SymbolSerializer extends JsonSerializer<Symbol> {
        @Override
        public void serialize(Symbol symbol, JsonGenerator gen, SerializerProvider serializers) throws IOException {
            gen.writeNumber(symbol.id());
        }
    }

    private static class LuaValueSerializer extends JsonSerializer<LuaValue> {
        @Override
        public void serialize(LuaValue value, JsonGenerator gen, SerializerProvider serializers) throws IOException {
            if (value instanceof LuaValue.Bool b) {
                gen.writeBoolean(b.value());
            } else if (value instanceof LuaValue.Num n) {
                if (n.isIntegral() && Math.abs(n.value()) < 1e15) {
                    gen.writeNumber((long) n.value());
                } else {
                    gen.writeNumber(n.value());
                }
            } else if (value instanceof LuaValue.Str s) {
                gen.writeString(LuaStrings.toText(s.bytes()));
            } else {
                gen.writeNull();
            }
        }
    }

    private static class BinaryOperatorSerializer extends JsonSerializer<BinaryOperator> {
        @Override
        public void serialize(BinaryOperator operator, JsonGenerator gen, SerializerProvider serializers) throws IOException {
            gen.writeString(operator.symbol());
        }
    }

    private static class UnaryOperatorSerializer extends JsonSerializer<UnaryOperator> {
        @Override
        public void serialize(UnaryOperator operator, JsonGenerator gen, SerializerProvider serializers) throws IOException {
            gen.writeString(operator.symbol());
        }
    }
}
