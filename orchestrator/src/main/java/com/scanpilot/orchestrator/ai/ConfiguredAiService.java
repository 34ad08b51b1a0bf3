package com.scanpilot.orchestrator.ai;

import com.scanpilot.orchestrator.model.AiProvider;
import com.scanpilot.orchestrator.model.ModelSelection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds sessions from {@code scanpilot.ai.*}: one API key per provider,
 * shared temperature and token limits.
 */
@Service
public class ConfiguredAiService implements AiService {

    private static final Logger log = LoggerFactory.getLogger(ConfiguredAiService.class);

    private final AiProperties props;

    public ConfiguredAiService(AiProperties props) {
        this.props = props;
    }

    @Override
    public AiSession initialize(ModelSelection selection) {
        if (selection == null || selection.provider() == null
                || selection.model() == null || selection.model().isBlank()) {
            throw new AiServiceException("Model selection is incomplete: " + selection);
        }
        String key = keyFor(selection.provider());
        if (key == null || key.isBlank()) {
            if (props.isRequireApiKey()) {
                throw new AiServiceException("No API key configured for provider " + selection.provider());
            }
            log.warn("No API key configured for provider {}; chain calls to it will fail", selection.provider());
        }
        log.info("AI service initialised with {}/{}", selection.provider(), selection.model());
        return new AiSession(selection, key, props.getTemperature(), props.getMaxTokens());
    }

    @Override
    public List<ProviderModels> models() {
        List<ProviderModels> out = new ArrayList<>();
        for (AiProvider p : AiProvider.values()) {
            out.add(new ProviderModels(p.wireName(),
                    List.copyOf(props.getModels().getOrDefault(p.wireName(), List.of())), p.description()));
        }
        return out;
    }

    @Override
    public AiStatus status() {
        Map<String, Boolean> providers = new LinkedHashMap<>();
        for (AiProvider p : AiProvider.values()) {
            String key = keyFor(p);
            providers.put(p.wireName(), key != null && !key.isBlank());
        }
        boolean any = providers.containsValue(true);
        return new AiStatus(any ? "healthy" : "degraded", providers);
    }

    private String keyFor(AiProvider provider) {
        return props.getApiKeys().get(provider.wireName());
    }
}
