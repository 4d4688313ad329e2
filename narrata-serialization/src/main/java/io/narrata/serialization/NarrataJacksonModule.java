package io.narrata.serialization;

import com.fasterxml.jackson.databind.module.SimpleModule;
import io.narrata.core.debug.DebugView;
import io.narrata.core.expression.Assignment;
import io.narrata.core.expression.AssignmentOperator;
import io.narrata.core.expression.Condition;
import io.narrata.core.expression.ConditionLogic;
import io.narrata.core.expression.ExpressionParser;
import io.narrata.core.expression.Rule;
import io.narrata.core.expression.RuleOperator;
import io.narrata.core.expression.ValueType;
import io.narrata.core.flow.FlowGraph;
import io.narrata.core.flow.node.Node;
import io.narrata.core.state.ConsoleLevel;
import io.narrata.core.state.ExecutionStatus;
import io.narrata.core.variable.Variable;
import io.narrata.core.variable.VariableSource;
import io.narrata.core.variable.VariableStore;
import io.narrata.core.variable.VariableType;
import io.narrata.serialization.mixin.AssignmentOperatorMixin;
import io.narrata.serialization.mixin.ConditionLogicMixin;
import io.narrata.serialization.mixin.ConsoleLevelMixin;
import io.narrata.serialization.mixin.DebugViewMixin;
import io.narrata.serialization.mixin.ExecutionStatusMixin;
import io.narrata.serialization.mixin.RuleOperatorMixin;
import io.narrata.serialization.mixin.ValueTypeMixin;
import io.narrata.serialization.mixin.VariableSourceMixin;
import io.narrata.serialization.mixin.VariableTypeMixin;
import java.io.Serial;
import java.util.Objects;

/// Jackson `SimpleModule` that registers all Narrata serialization configuration in one place.
///
/// Covers two registration strategies:
///
/// **Custom serializer/deserializer pairs** (hierarchies and builder-built types, written
/// field by field with no reflection):
/// - `FlowGraph` - `FlowGraphSerializer` / `FlowGraphDeserializer`
/// - `Node` - `NodeSerializer` / `NodeDeserializer`, discriminator: `"type"`
/// - `Condition`, `Rule`, `Assignment` - structured form on write; text or structured on read
/// - `Variable`, `VariableStore` - sheet variable files
///
/// **Mixins** (types Jackson binds on its own once told how):
/// - enums written by their lowercase `id()` rather than their constant name
/// - `DebugView`, hiding derived accessors from the export
///
/// @implNote Expression text found in flow files is parsed with the module's
/// {@link ExpressionParser}. Text that does not parse fails deserialization.
/// @see FlowSerializer for the convenience factory API
public class NarrataJacksonModule extends SimpleModule {

    @Serial private static final long serialVersionUID = 5281147393024017711L;

    /// Constructs the module with a default expression parser.
    public NarrataJacksonModule() {
        this(new ExpressionParser());
    }

    /// Constructs the module and registers all custom serializer/deserializer pairs.
    ///
    /// @param parser parser for conditions and instructions written as text, not null
    public NarrataJacksonModule(ExpressionParser parser) {
        super("NarrataJacksonModule");
        Objects.requireNonNull(parser, "parser must not be null");

        addSerializer(FlowGraph.class, new FlowGraphSerializer());
        addDeserializer(FlowGraph.class, new FlowGraphDeserializer());

        addSerializer(Node.class, new NodeSerializer());
        addDeserializer(Node.class, new NodeDeserializer(parser));

        addSerializer(Condition.class, new ConditionSerializer());
        addDeserializer(Condition.class, new ConditionDeserializer(parser));
        addSerializer(Rule.class, new RuleSerializer());
        addDeserializer(Rule.class, new RuleDeserializer());
        addSerializer(Assignment.class, new AssignmentSerializer());
        addDeserializer(Assignment.class, new AssignmentDeserializer());

        addSerializer(Variable.class, new VariableSerializer());
        addDeserializer(Variable.class, new VariableDeserializer());
        addSerializer(VariableStore.class, new VariableStoreSerializer());
        addDeserializer(VariableStore.class, new VariableStoreDeserializer());
    }

    /// Applies mixin annotations to core types.
    ///
    /// Called by Jackson when the module is registered with an `ObjectMapper`.
    ///
    /// @param context the setup context provided by Jackson, not null
    @Override
    public void setupModule(SetupContext context) {
        super.setupModule(context);

        context.setMixInAnnotations(RuleOperator.class, RuleOperatorMixin.class);
        context.setMixInAnnotations(AssignmentOperator.class, AssignmentOperatorMixin.class);
        context.setMixInAnnotations(ConditionLogic.class, ConditionLogicMixin.class);
        context.setMixInAnnotations(ValueType.class, ValueTypeMixin.class);
        context.setMixInAnnotations(VariableType.class, VariableTypeMixin.class);
        context.setMixInAnnotations(VariableSource.class, VariableSourceMixin.class);

        // Debug session export
        context.setMixInAnnotations(ConsoleLevel.class, ConsoleLevelMixin.class);
        context.setMixInAnnotations(ExecutionStatus.class, ExecutionStatusMixin.class);
        context.setMixInAnnotations(DebugView.class, DebugViewMixin.class);
    }
}
