package com.projectdesk;

import com.projectdesk.providers.GenerationEndpoint;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class AppConfigTest {

    @TempDir
    Path dir;

    @Test
    void readsEnvironmentDefaults() throws Exception {
        Map<String, String> env = Map.of(
            "DESK_PROJECTS_DIR", dir.toString(),
            "DESK_PROVIDER", "ollama",
            "DESK_MODEL", "llama3",
            "DESK_MAX_RETRIES", "5",
            "ANTHROPIC_API_KEY", "sk-test");

        AppConfig config = new AppConfig.Builder(env::get).port(0).build();

        assertEquals(dir.toAbsolutePath().normalize(), config.getProjectsPath());
        assertEquals("ollama", config.getEndpoint().provider());
        assertEquals("llama3", config.getEndpoint().model());
        assertEquals("sk-test", config.getApiKey());
        assertEquals(5, config.getEndpoint().maxRetries());
        assertEquals(GenerationEndpoint.DEFAULT_MAX_OUTPUT_TOKENS, config.getEndpoint().maxOutputTokens());
        assertTrue(config.isShellEnabled());
        assertEquals(AppConfig.DEFAULT_GENERATION_TIMEOUT_MS, config.getGenerationTimeoutMs());
        assertEquals(2, config.getCorsOrigins().size());
    }

    @Test
    void argumentsOverrideEnvironment() throws Exception {
        Map<String, String> env = Map.of("DESK_PROVIDER", "ollama", "DESK_API_KEY", "k");

        AppConfig config = new AppConfig.Builder(env::get)
            .parseArgs(new String[]{
                "--projects", dir.toString(),
                "--provider=openai",
                "--model", "gpt-4o",
                "--generation-timeout-ms", "1500",
                "--max-output-tokens", "512",
                "--max-retries=0",
                "--no-shell",
                "--cors-origin", "http://example.test",
                "--dev"
            })
            .port(0)
            .build();

        assertEquals(dir.toAbsolutePath().normalize(), config.getProjectsPath());
        assertEquals("openai", config.getEndpoint().provider());
        assertEquals("gpt-4o", config.getEndpoint().model());
        assertEquals(1500L, config.getGenerationTimeoutMs());
        assertEquals(512, config.getEndpoint().maxOutputTokens());
        assertEquals(0, config.getEndpoint().maxRetries());
        assertFalse(config.isShellEnabled());
        assertTrue(config.isDevMode());
        assertEquals(List.of("http://example.test"), config.getCorsOrigins());
    }

    @Test
    void badNumbersKeepDefaults() throws Exception {
        Map<String, String> env = Map.of();
        AppConfig config = new AppConfig.Builder(env::get)
            .parseArgs(new String[]{"--generation-timeout-ms", "soon", "--max-output-tokens", "lots"})
            .build();

        assertEquals(AppConfig.DEFAULT_GENERATION_TIMEOUT_MS, config.getGenerationTimeoutMs());
        assertEquals(GenerationEndpoint.DEFAULT_MAX_OUTPUT_TOKENS, config.getEndpoint().maxOutputTokens());
        assertEquals(GenerationEndpoint.DEFAULT_MAX_RETRIES, config.getEndpoint().maxRetries());
        assertEquals("anthropic", config.getEndpoint().provider());
        assertNull(config.getApiKey());
    }
}
