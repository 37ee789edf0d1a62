package io.jerry.core.provider;

import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class FallbackLlmProvider implements LlmProvider {
    private static final Logger LOG = LoggerFactory.getLogger(FallbackLlmProvider.class);
    private final String name;
    private final List<LlmProvider> chain;

    public FallbackLlmProvider(String name, List<LlmProvider> chain) {
        this.name = name;
        this.chain = List.copyOf(chain);
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public LlmResponse chat(ModelRequest request) {
        LlmResponse last = LlmResponse.error("no providers in fallback chain " + name);
        for (LlmProvider provider : chain) {
            last = provider.chat(request);
            if (!last.isError()) {
                LOG.debug("Provider {} served request for chain {}", provider.name(), name);
                return last;
            }
            LOG.warn("Provider {} failed in chain {}: {}", provider.name(), name, abbreviate(last.content(), 300));
        }
        return last;
    }

    private static String abbreviate(String value, int max) {
        return value.length() <= max ? value : value.substring(0, max) + "...";
    }
}
