package com.scanpilot.orchestrator.ai;

import com.scanpilot.orchestrator.model.AiProvider;
import com.scanpilot.orchestrator.model.ModelSelection;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConfiguredAiServiceTest {

    AiProperties props = new AiProperties();

    @Test
    void initialize_usesProviderKeyAndDefaults() {
        props.setApiKeys(Map.of("openai", "sk-test"));

        AiSession session = new ConfiguredAiService(props).initialize(ModelSelection.of(null, "gpt-4"));

        assertThat(session.selection().provider()).isEqualTo(AiProvider.OPENAI);
        assertThat(session.apiKey()).isEqualTo("sk-test");
        assertThat(session.temperature()).isEqualTo(0.3);
        assertThat(session.maxTokens()).isEqualTo(2048);
        assertThat(session.toString()).doesNotContain("sk-test");
    }

    @Test
    void initialize_missingKey_allowedUnlessRequired() {
        ConfiguredAiService service = new ConfiguredAiService(props);
        ModelSelection selection = new ModelSelection(AiProvider.GEMINI, "gemini-pro");

        assertThat(service.initialize(selection).apiKey()).isNull();

        props.setRequireApiKey(true);
        assertThatThrownBy(() -> service.initialize(selection)).isInstanceOf(AiServiceException.class);
    }

    @Test
    void initialize_incompleteSelection_throws() {
        assertThatThrownBy(() -> new ConfiguredAiService(props).initialize(new ModelSelection(AiProvider.OPENAI, " ")))
                .isInstanceOf(AiServiceException.class);
    }

    @Test
    void models_coversEveryProviderInOrder() {
        props.setModels(Map.of("anthropic", List.of("claude-3-haiku")));

        List<ProviderModels> models = new ConfiguredAiService(props).models();

        assertThat(models).extracting(ProviderModels::provider).containsExactly("openai", "anthropic", "gemini");
        assertThat(models.get(1).models()).containsExactly("claude-3-haiku");
        assertThat(models.get(0).models()).isEmpty();
        assertThat(models.get(2).description()).isEqualTo("Google Gemini models");
    }

    @Test
    void status_healthyOnlyWhenSomeProviderHasKey() {
        ConfiguredAiService service = new ConfiguredAiService(props);

        assertThat(service.status().status()).isEqualTo("degraded");

        props.setApiKeys(Map.of("gemini", "g-key", "openai", " "));
        AiStatus status = service.status();

        assertThat(status.status()).isEqualTo("healthy");
        assertThat(status.providers()).containsEntry("gemini", true).containsEntry("openai", false)
                .containsEntry("anthropic", false);
    }
}
