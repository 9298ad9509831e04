package work.lumen.kernel.extern;

import java.util.List;
import work.lumen.kernel.runtime.Value;

/**
 * Boundary between the kernel and host capabilities, addressed by selector strings such as
 * {@code fs|posix:read_file} or a bare {@code print}.
 */
@FunctionalInterface
public interface ExternDispatcher {
    /**
     * @throws work.lumen.kernel.error.ExternResolutionException when the selector is malformed or no
     *     named backend provides the capability
     */
    Value invoke(String selector, List<Value> args);
}
