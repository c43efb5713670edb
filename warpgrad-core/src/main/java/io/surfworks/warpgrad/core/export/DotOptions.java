package io.surfworks.warpgrad.core.export;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Rendering options of {@link ComputationalGraph#toDot}.
 *
 * @param variableStyle  dot attributes of variable nodes
 * @param operationStyle dot attributes of operation nodes
 * @param rankdir        layout direction: TB, BT, LR or RL
 * @param showName       prefix variable labels with their name, when set
 */
public record DotOptions(
        Map<String, String> variableStyle,
        Map<String, String> operationStyle,
        String rankdir,
        boolean showName
) {

    private static final Set<String> RANKDIRS = Set.of("TB", "BT", "LR", "RL");

    public DotOptions {
        Objects.requireNonNull(variableStyle, "variableStyle cannot be null");
        Objects.requireNonNull(operationStyle, "operationStyle cannot be null");
        Objects.requireNonNull(rankdir, "rankdir cannot be null");
        if (!RANKDIRS.contains(rankdir)) {
            throw new IllegalArgumentException("rankdir must be in TB, BT, LR or RL, got " + rankdir);
        }
        variableStyle = copy(variableStyle);
        operationStyle = copy(operationStyle);
    }

    public static DotOptions defaults() {
        Map<String, String> variables = new LinkedHashMap<>();
        variables.put("shape", "octagon");
        variables.put("fillcolor", "#E0E0E0");
        variables.put("style", "filled");
        Map<String, String> operations = new LinkedHashMap<>();
        operations.put("shape", "record");
        operations.put("fillcolor", "#6495ED");
        operations.put("style", "filled");
        return new DotOptions(variables, operations, "TB", true);
    }

    public DotOptions withRankdir(String value) {
        return new DotOptions(variableStyle, operationStyle, value, showName);
    }

    public DotOptions withVariableStyle(Map<String, String> value) {
        return new DotOptions(value, operationStyle, rankdir, showName);
    }

    public DotOptions withOperationStyle(Map<String, String> value) {
        return new DotOptions(variableStyle, value, rankdir, showName);
    }

    public DotOptions withShowName(boolean value) {
        return new DotOptions(variableStyle, operationStyle, rankdir, value);
    }

    private static Map<String, String> copy(Map<String, String> style) {
        return Collections.unmodifiableMap(new LinkedHashMap<>(style));
    }
}
