package io.jerry.core.provider;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public final class ModelCatalog {

    public record ModelInfo(String name, String provider, int contextTokens, boolean parallelToolCalling) {
    }

    private static final Map<String, ModelInfo> MODELS = new LinkedHashMap<>();

    static {
        add(new ModelInfo("mistral-large-latest", "mistral", 128000, true));
        add(new ModelInfo("mistral-small-latest", "mistral", 32000, true));
        add(new ModelInfo("mistral-nemo", "mistral", 128000, true));
    }

    private ModelCatalog() {
    }

    public static Optional<ModelInfo> find(String model) {
        return Optional.ofNullable(MODELS.get(model));
    }

    public static List<ModelInfo> all() {
        return List.copyOf(MODELS.values());
    }

    // unknown models are assumed to accept parallel tool calls
    public static boolean supportsParallelToolCalls(String model) {
        return find(model).map(ModelInfo::parallelToolCalling).orElse(true);
    }

    private static void add(ModelInfo info) {
        MODELS.put(info.name(), info);
    }
}
