package work.lumen.kernel.demo;

import java.io.PrintStream;
import java.util.List;
import java.util.stream.Collectors;
import work.lumen.kernel.error.RuntimeTypeException;
import work.lumen.kernel.extern.CapabilityRegistry;
import work.lumen.kernel.runtime.Value;

/**
 * Host capabilities available to the demo languages.
 *
 * <ul>
 *   <li>{@code host:print}, {@code host:str}, {@code host:type}, {@code host:len}</li>
 *   <li>{@code debug:print} prints debug representations</li>
 *   <li>{@code math:sqrt}, {@code math:abs}</li>
 * </ul>
 */
public final class DemoCapabilities {
    private DemoCapabilities() {}

    public static CapabilityRegistry register(CapabilityRegistry registry, PrintStream out) {
        registry.register("host", "print", args -> {
            out.println(args.stream().map(Value::display).collect(Collectors.joining(" ")));
            return NoneValue.INSTANCE;
        });
        registry.register("host", "str", args -> new TextValue(single(args, "str").display()));
        registry.register("host", "type", args -> new TextValue(single(args, "type").typeName()));
        registry.register("host", "len", args -> {
            var text = single(args, "len").downcast(TextValue.class, "len");
            return new NumberValue(text.value().length());
        });
        registry.register("debug", "print", args -> {
            out.println("[debug] " + args.stream().map(Value::debugDisplay).collect(Collectors.joining(" ")));
            return NoneValue.INSTANCE;
        });
        registry.register("math", "sqrt", args ->
            new NumberValue(Math.sqrt(single(args, "sqrt").downcast(NumberValue.class, "sqrt").value())));
        registry.register("math", "abs", args ->
            new NumberValue(Math.abs(single(args, "abs").downcast(NumberValue.class, "abs").value())));
        return registry;
    }

    private static Value single(List<Value> args, String capability) {
        if (args.size() != 1) {
            throw new RuntimeTypeException("Capability '" + capability + "' expects 1 argument but got " + args.size());
        }
        return args.get(0);
    }
}
