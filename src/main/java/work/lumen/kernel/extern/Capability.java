package work.lumen.kernel.extern;

import java.util.List;
import work.lumen.kernel.runtime.Value;

@FunctionalInterface
public interface Capability {
    Value invoke(List<Value> args);
}
