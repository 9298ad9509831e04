package work.lumen.kernel.registry;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tomlj.Toml;
import org.tomlj.TomlArray;
import org.tomlj.TomlParseResult;
import org.tomlj.TomlTable;
import work.lumen.kernel.error.ConfigurationException;
import work.lumen.kernel.lex.FallbackRules;
import work.lumen.kernel.lex.LexemeRole;

/**
 * Builds {@link SchemaRegistry} instances from TOML or YAML language descriptions.
 *
 * <p>Both formats share one layout:
 * <pre>
 * name = "mini_rust"
 * keywords = ["true", "false"]
 * [syntax]
 * layout = "braces"          # or "indentation" (then block_open/block_close/newline are marker names)
 * block_open = "{"
 * block_close = "}"
 * terminators = [";"]
 * assignment = "="
 * extern = "extern"
 * comment = "//"
 * quote = "\""
 * memoize = ["fib"]
 * [[operators]]
 * lexeme = "+"
 * precedence = 10
 * associativity = "left"
 * [[prefix]]
 * lexeme = "-"
 * precedence = 70
 * [[statements]]
 * keyword = "while"
 * action = "loop"
 * pattern = ["expr:cond", "block:body"]
 * </pre>
 */
public final class SchemaLoader {
    private static final Logger LOGGER = LoggerFactory.getLogger(SchemaLoader.class);
    private static final ObjectMapper YAML = new ObjectMapper(new YAMLFactory());
    private static final TypeReference<Map<String, Object>> MAP_REF = new TypeReference<>() {};

    private SchemaLoader() {}

    public static SchemaRegistry load(Path path) {
        String text;
        try {
            text = Files.readString(path);
        } catch (IOException ex) {
            throw new ConfigurationException("Unable to read language schema " + path + ": " + ex.getMessage(), ex);
        }
        return parse(text, path.getFileName().toString());
    }

    public static SchemaRegistry fromResource(String resource) {
        try (InputStream in = SchemaLoader.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                throw new ConfigurationException("Language schema resource not found: " + resource);
            }
            return parse(new String(in.readAllBytes(), StandardCharsets.UTF_8), resource);
        } catch (IOException ex) {
            throw new ConfigurationException("Unable to read language schema " + resource + ": " + ex.getMessage(), ex);
        }
    }

    static SchemaRegistry parse(String text, String origin) {
        var lower = origin.toLowerCase(Locale.ROOT);
        if (lower.endsWith(".toml")) {
            return fromToml(text, origin);
        }
        if (lower.endsWith(".yaml") || lower.endsWith(".yml")) {
            return fromYaml(text, origin);
        }
        throw new ConfigurationException("Unsupported language schema format: " + origin);
    }

    public static SchemaRegistry fromToml(String text, String origin) {
        TomlParseResult result = Toml.parse(text);
        if (result.hasErrors()) {
            var first = result.errors().get(0);
            throw new ConfigurationException("Invalid TOML in " + origin + ": " + first.toString());
        }
        return fromMap(tableToMap(result), origin);
    }

    public static SchemaRegistry fromYaml(String text, String origin) {
        Map<String, Object> document;
        try {
            document = YAML.readValue(text, MAP_REF);
        } catch (JsonProcessingException ex) {
            throw new ConfigurationException("Invalid YAML in " + origin + ": " + ex.getOriginalMessage(), ex);
        }
        if (document == null) {
            throw new ConfigurationException("Empty language schema: " + origin);
        }
        return fromMap(document, origin);
    }

    static SchemaRegistry fromMap(Map<String, Object> document, String origin) {
        var builder = SchemaRegistry.builder(requireString(document, "name", origin));
        var syntax = asMap(document.get("syntax"), "syntax", origin);

        builder.fallback(FallbackRules.whitespace());
        var comment = optionalString(syntax, "comment");
        if (comment != null) {
            builder.fallback(FallbackRules.lineComment(comment));
        }
        builder.fallback(FallbackRules.identifier());
        builder.fallback(FallbackRules.number());
        var quote = optionalString(syntax, "quote");
        builder.fallback(FallbackRules.quoted(quote == null || quote.isEmpty() ? '"' : quote.charAt(0)));

        for (var keyword : stringList(document.get("keywords"), "keywords", origin)) {
            builder.lexeme(keyword, LexemeRole.KEYWORD);
        }

        var layout = BlockLayout.from(optionalString(syntax, "layout"));
        if (layout == BlockLayout.INDENTATION) {
            builder.indentation(
                requireString(syntax, "block_open", origin),
                requireString(syntax, "block_close", origin),
                requireString(syntax, "newline", origin)
            );
        } else {
            builder.blocks(requireString(syntax, "block_open", origin), requireString(syntax, "block_close", origin));
        }
        builder.terminators(stringList(syntax.get("terminators"), "terminators", origin).toArray(String[]::new));
        if (syntax.containsKey("assignment")) {
            builder.assignment(requireString(syntax, "assignment", origin));
        }
        if (syntax.containsKey("call_open")) {
            builder.calls(
                requireString(syntax, "call_open", origin),
                requireString(syntax, "call_close", origin),
                requireString(syntax, "separator", origin)
            );
        }
        var extern = optionalString(syntax, "extern");
        if (extern != null) {
            builder.externKeyword(extern);
        }
        builder.memoizable(stringList(syntax.get("memoize"), "memoize", origin).toArray(String[]::new));

        for (var entry : mapList(document.get("operators"), "operators", origin)) {
            builder.binaryOperator(
                requireString(entry, "lexeme", origin),
                requireInt(entry, "precedence", origin),
                Associativity.from(optionalString(entry, "associativity")),
                ShortCircuit.from(optionalString(entry, "short_circuit"))
            );
        }
        for (var entry : mapList(document.get("prefix"), "prefix", origin)) {
            builder.prefixOperator(requireString(entry, "lexeme", origin), requireInt(entry, "precedence", origin));
        }
        for (var entry : mapList(document.get("statements"), "statements", origin)) {
            var elements = new ArrayList<PatternElement>();
            for (var raw : stringList(entry.get("pattern"), "pattern", origin)) {
                elements.add(PatternElement.parse(raw));
            }
            builder.statement(new StatementPattern(
                requireString(entry, "keyword", origin),
                elements,
                CanonicalAction.from(optionalString(entry, "action")),
                optionalString(entry, "selector")
            ));
        }
        var registry = builder.build();
        LOGGER.debug(
            "Loaded language '{}' from {} ({} operators, {} statements)",
            registry.name(), origin, registry.binaryOperators().size(), registry.statements().size()
        );
        return registry;
    }

    private static Map<String, Object> tableToMap(TomlTable table) {
        var map = new LinkedHashMap<String, Object>();
        for (var entry : table.entrySet()) {
            map.put(entry.getKey(), tomlValue(entry.getValue()));
        }
        return map;
    }

    private static Object tomlValue(Object value) {
        if (value instanceof TomlTable table) {
            return tableToMap(table);
        }
        if (value instanceof TomlArray array) {
            var list = new ArrayList<Object>(array.size());
            for (int i = 0; i < array.size(); i++) {
                list.add(tomlValue(array.get(i)));
            }
            return list;
        }
        return value;
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> asMap(Object value, String key, String origin) {
        if (value == null) {
            throw new ConfigurationException("Language schema " + origin + " is missing '" + key + "'");
        }
        if (!(value instanceof Map<?, ?>)) {
            throw new ConfigurationException("'" + key + "' in " + origin + " must be a table");
        }
        return (Map<String, Object>) value;
    }

    private static List<Map<String, Object>> mapList(Object value, String key, String origin) {
        if (value == null) {
            return List.of();
        }
        if (!(value instanceof List<?> list)) {
            throw new ConfigurationException("'" + key + "' in " + origin + " must be a list of tables");
        }
        var result = new ArrayList<Map<String, Object>>(list.size());
        for (var item : list) {
            result.add(asMap(item, key, origin));
        }
        return result;
    }

    private static List<String> stringList(Object value, String key, String origin) {
        if (value == null) {
            return List.of();
        }
        if (!(value instanceof List<?> list)) {
            throw new ConfigurationException("'" + key + "' in " + origin + " must be a list of strings");
        }
        var result = new ArrayList<String>(list.size());
        for (var item : list) {
            if (!(item instanceof String text)) {
                throw new ConfigurationException("'" + key + "' in " + origin + " must only contain strings");
            }
            result.add(text);
        }
        return result;
    }

    private static String optionalString(Map<String, Object> map, String key) {
        var value = map.get(key);
        return value == null ? null : value.toString();
    }

    private static String requireString(Map<String, Object> map, String key, String origin) {
        var value = map.get(key);
        if (!(value instanceof String text) || text.isEmpty()) {
            throw new ConfigurationException("Language schema " + origin + " needs a string '" + key + "'");
        }
        return text;
    }

    private static int requireInt(Map<String, Object> map, String key, String origin) {
        var value = map.get(key);
        if (!(value instanceof Number number)) {
            throw new ConfigurationException("Language schema " + origin + " needs a number '" + key + "'");
        }
        double raw = number.doubleValue();
        if (raw != Math.rint(raw) || raw < Integer.MIN_VALUE || raw > Integer.MAX_VALUE) {
            throw new ConfigurationException("Language schema " + origin + " needs a whole number '" + key + "', got " + number);
        }
        return number.intValue();
    }
}
