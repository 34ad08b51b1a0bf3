package com.scanpilot.orchestrator.api;

import com.scanpilot.orchestrator.tool.OutputFormat;
import com.scanpilot.orchestrator.tool.ToolHealth;
import com.scanpilot.orchestrator.tool.ToolInvocationService;
import com.scanpilot.orchestrator.tool.ToolInvocationSpec;
import com.scanpilot.orchestrator.tool.ToolRegistry;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(ToolController.class)
class ToolControllerTest {

    @Autowired MockMvc                 mockMvc;
    @MockitoBean ToolRegistry          registry;
    @MockitoBean ToolInvocationService invocations;

    @Test
    void list_returnsConfiguredSpecs() throws Exception {
        when(registry.list()).thenReturn(List.of(new ToolInvocationSpec("nmap", "nmap", "7.93", 300_000,
                List.of("-sV"), OutputFormat.TEXT)));

        mockMvc.perform(get("/api/tools"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.tools[0].name").value("nmap"))
                .andExpect(jsonPath("$.tools[0].allowedArgPrefixes[0]").value("-sV"));
    }

    @Test
    void status_reportsDegradedWhenAToolIsMissing() throws Exception {
        when(invocations.healthStatus()).thenReturn(new ToolHealth.Report("degraded", Map.of(
                "nmap", new ToolHealth(true, "Nmap version 7.93", null),
                "sqlmap", new ToolHealth(false, null, "No such file or directory"))));

        mockMvc.perform(get("/api/tools/status"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("degraded"))
                .andExpect(jsonPath("$.tools.nmap.available").value(true))
                .andExpect(jsonPath("$.tools.sqlmap.error").value("No such file or directory"));
    }

    @Test
    void add_registersSpecWithDefaults() throws Exception {
        mockMvc.perform(post("/api/tools")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"name":"whatweb","command":"/usr/bin/whatweb","allowedArgs":["-a"]}
                                """))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.success").value(true));

        ArgumentCaptor<ToolInvocationSpec> captor = ArgumentCaptor.forClass(ToolInvocationSpec.class);
        verify(registry).add(captor.capture());
        assertThat(captor.getValue().timeoutMs()).isEqualTo(300_000);
        assertThat(captor.getValue().outputFormat()).isEqualTo(OutputFormat.TEXT);
    }

    @Test
    void add_missingCommand_returns400() throws Exception {
        mockMvc.perform(post("/api/tools")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"name":"whatweb"}
                                """))
                .andExpect(status().isBadRequest());
    }

    @Test
    void remove_unknownTool_returns404() throws Exception {
        when(registry.remove("ghost")).thenReturn(false);

        mockMvc.perform(delete("/api/tools/{name}", "ghost"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("unknown_tool"));
    }
}
