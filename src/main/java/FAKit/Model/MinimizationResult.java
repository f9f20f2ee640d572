package FAKit.Model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Minimal DFA together with the mapping from every original state to the state that now represents it.
 */
public record MinimizationResult<I>(NamedDFA<I> dfa, Map<String, String> stateMapping) {

    public MinimizationResult {
        stateMapping = Collections.unmodifiableMap(new LinkedHashMap<>(stateMapping));
    }

    /**
     * @return original states merged into newState, in original order.
     */
    public List<String> representedBy(String newState) {
        final List<String> originals = new ArrayList<>();
        for (Map.Entry<String, String> e : stateMapping.entrySet()) {
            if (e.getValue().equals(newState)) {
                originals.add(e.getKey());
            }
        }
        return originals;
    }
}
