package work.lumen.kernel.instruction;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import work.lumen.kernel.instruction.Instruction.Assign;
import work.lumen.kernel.instruction.Instruction.Branch;
import work.lumen.kernel.instruction.Instruction.Invoke;
import work.lumen.kernel.instruction.Instruction.Operate;
import work.lumen.kernel.instruction.Instruction.Scope;
import work.lumen.kernel.instruction.Instruction.Sequence;
import work.lumen.kernel.instruction.Instruction.Transfer;
import work.lumen.kernel.lex.Span;
import work.lumen.kernel.runtime.FunctionDef;
import work.lumen.kernel.runtime.FunctionTable;
import work.lumen.kernel.runtime.Value;

/**
 * JSON form of instruction trees, used for {@code --dump-instructions} and for storing reduced
 * programs. Constants are written as their literal source text and re-read through the language's
 * tokenizer and value system, so the codec needs the {@link SchemaLanguage} they belong to.
 */
public final class InstructionCodec {
    private static final ObjectMapper JSON = new ObjectMapper();

    private final SchemaLanguage language;

    public InstructionCodec(SchemaLanguage language) {
        this.language = language;
    }

    public String write(Instruction instruction) {
        return pretty(toJson(instruction));
    }

    public String writeProgram(CompiledProgram program) {
        var root = JSON.createObjectNode();
        root.put("language", language.name());
        var functions = root.putObject("functions");
        program.functions().entries().forEach((name, fn) -> {
            var node = functions.putObject(name);
            var params = node.putArray("params");
            fn.params().forEach(params::add);
            node.put("memoizable", fn.memoizable());
            putSpan(node, fn.span());
            node.set("body", toJson(fn.body()));
        });
        root.set("root", toJson(program.root()));
        return pretty(root);
    }

    public Instruction read(String json) {
        return fromJson(parse(json));
    }

    public CompiledProgram readProgram(String json) {
        var root = parse(json);
        var functions = new FunctionTable<Instruction>();
        var declared = root.path("functions");
        declared.fieldNames().forEachRemaining(name -> {
            var node = declared.get(name);
            var params = new ArrayList<String>();
            node.path("params").forEach(param -> params.add(param.asText()));
            functions.define(new FunctionDef<>(name, params, fromJson(node.get("body")), node.path("memoizable").asBoolean(), span(node)));
        });
        var program = fromJson(require(root, "root"));
        if (!(program instanceof Sequence sequence)) {
            throw new IllegalArgumentException("Program root must be a sequence");
        }
        return new CompiledProgram(language, sequence, functions);
    }

    public JsonNode toJson(Instruction instruction) {
        var node = JSON.createObjectNode();
        node.put("tag", instruction.tag().name().toLowerCase(Locale.ROOT));
        putSpan(node, instruction.span());
        switch (instruction.tag()) {
            case SEQUENCE -> node.set("body", array(((Sequence) instruction).body()));
            case SCOPE -> {
                var scope = (Scope) instruction;
                node.put("repeating", scope.repeating());
                node.set("body", toJson(scope.body()));
            }
            case BRANCH -> {
                var branch = (Branch) instruction;
                node.set("cond", toJson(branch.condition()));
                node.set("then", toJson(branch.then()));
                if (branch.otherwise() != null) {
                    node.set("else", toJson(branch.otherwise()));
                }
            }
            case ASSIGN -> {
                var assign = (Assign) instruction;
                node.put("name", assign.name());
                node.put("mode", assign.mode().name().toLowerCase(Locale.ROOT));
                node.set("value", toJson(assign.value()));
            }
            case INVOKE -> {
                var invoke = (Invoke) instruction;
                node.put("selector", invoke.selector());
                node.put("extern", invoke.extern());
                node.set("args", array(invoke.args()));
            }
            case OPERATE -> {
                var operate = (Operate) instruction;
                node.put("operator", operate.operator());
                if (operate.immediate() != null) {
                    node.put("immediate", operate.immediate());
                }
                if (!operate.operands().isEmpty()) {
                    node.set("operands", array(operate.operands()));
                }
            }
            case TRANSFER -> {
                var transfer = (Transfer) instruction;
                node.put("kind", transfer.kind().name().toLowerCase(Locale.ROOT));
                if (transfer.value() != null) {
                    node.set("value", toJson(transfer.value()));
                }
            }
        }
        return node;
    }

    public Instruction fromJson(JsonNode node) {
        if (node == null || !node.isObject()) {
            throw new IllegalArgumentException("Instruction must be a JSON object");
        }
        var tag = parseEnum(Instruction.Tag.class, require(node, "tag").asText());
        var span = span(node);
        return switch (tag) {
            case SEQUENCE -> new Sequence(list(node.path("body")), span);
            case SCOPE -> new Scope(fromJson(require(node, "body")), node.path("repeating").asBoolean(), span);
            case BRANCH -> new Branch(
                fromJson(require(node, "cond")),
                fromJson(require(node, "then")),
                node.has("else") ? fromJson(node.get("else")) : null,
                span
            );
            case ASSIGN -> new Assign(
                require(node, "name").asText(),
                fromJson(require(node, "value")),
                parseEnum(Assign.Mode.class, require(node, "mode").asText()),
                span
            );
            case INVOKE -> new Invoke(
                require(node, "selector").asText(),
                list(node.path("args")),
                require(node, "extern").asBoolean(),
                span
            );
            case OPERATE -> operate(node, span);
            case TRANSFER -> new Transfer(
                parseEnum(Transfer.Kind.class, require(node, "kind").asText()),
                node.has("value") ? fromJson(node.get("value")) : null,
                span
            );
        };
    }

    private Operate operate(JsonNode node, Span span) {
        var operator = require(node, "operator").asText();
        if (Operate.CONST.equals(operator)) {
            var text = require(node, "immediate").asText();
            return Operate.constant(text, constant(text), span);
        }
        if (Operate.LOAD.equals(operator)) {
            return Operate.load(require(node, "immediate").asText(), span);
        }
        if (Operate.NEXT.equals(operator)) {
            return Operate.advance(require(node, "immediate").asText(), span);
        }
        return Operate.apply(operator, list(node.path("operands")), span);
    }

    private Value constant(String text) {
        var tokens = language.tokenizer().tokenize(text);
        if (tokens.size() != 1) {
            throw new IllegalArgumentException("Constant '" + text + "' is not a single literal");
        }
        return language.values().literal(tokens.get(0))
            .orElseThrow(() -> new IllegalArgumentException("'" + text + "' is not a literal of " + language.name()));
    }

    private ArrayNode array(List<Instruction> instructions) {
        var array = JSON.createArrayNode();
        for (var instruction : instructions) {
            array.add(toJson(instruction));
        }
        return array;
    }

    private List<Instruction> list(JsonNode array) {
        var result = new ArrayList<Instruction>();
        array.forEach(item -> result.add(fromJson(item)));
        return result;
    }

    private static void putSpan(ObjectNode node, Span span) {
        node.putArray("span").add(span.start()).add(span.end());
    }

    private static Span span(JsonNode node) {
        var span = node.get("span");
        if (span == null || !span.isArray() || span.size() != 2) {
            throw new IllegalArgumentException("Instruction is missing its span");
        }
        return Span.of(span.get(0).asInt(), span.get(1).asInt());
    }

    private static JsonNode require(JsonNode node, String field) {
        var value = node.get(field);
        if (value == null || value.isNull()) {
            throw new IllegalArgumentException("Missing '" + field + "' in instruction JSON");
        }
        return value;
    }

    private static <E extends Enum<E>> E parseEnum(Class<E> type, String raw) {
        try {
            return Enum.valueOf(type, raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unknown " + type.getSimpleName() + " '" + raw + "'");
        }
    }

    private static JsonNode parse(String json) {
        try {
            return JSON.readTree(json);
        } catch (JsonProcessingException ex) {
            throw new IllegalArgumentException("Invalid instruction JSON: " + ex.getOriginalMessage(), ex);
        }
    }

    private static String pretty(JsonNode node) {
        try {
            return JSON.writerWithDefaultPrettyPrinter().writeValueAsString(node);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Unable to serialize instructions: " + ex.getMessage(), ex);
        }
    }
}
