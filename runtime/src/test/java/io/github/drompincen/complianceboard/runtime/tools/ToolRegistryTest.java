package io.github.drompincen.complianceboard.runtime.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.TextNode;
import io.github.drompincen.complianceboard.protocol.api.ToolRiskProfile;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.NoSuchBeanDefinitionException;
import org.springframework.context.ApplicationContext;

import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.*;

class ToolRegistryTest {

    private ToolRegistry registry;
    private ApplicationContext mockContext;

    @BeforeEach
    void setUp() {
        mockContext = mock(ApplicationContext.class);
        // Default: no beans available
        when(mockContext.getBean(any(Class.class))).thenThrow(new NoSuchBeanDefinitionException("none"));
        registry = new ToolRegistry(mockContext);
    }

    @Test
    void registerAndRetrieveTool() {
        registry.register(new StubTool("list_project_tasks", Set.of(ToolRiskProfile.READ_ONLY)));

        assertThat(registry.get("list_project_tasks")).isPresent();
        assertThat(registry.get("nonexistent")).isEmpty();
        assertThat(registry.all()).hasSize(1);
    }

    @Test
    void descriptorsAreSortedAndFlagProjectWrites() {
        registry.register(new StubTool("run_auditor", Set.of(ToolRiskProfile.WRITE_PROJECT)));
        registry.register(new StubTool("list_project_tasks", Set.of(ToolRiskProfile.READ_ONLY)));

        var descriptors = registry.descriptors();

        assertThat(descriptors).extracting("name").containsExactly("list_project_tasks", "run_auditor");
        assertThat(descriptors.get(0).mutatesProject()).isFalse();
        assertThat(descriptors.get(1).mutatesProject()).isTrue();
        assertThat(descriptors.get(1).riskProfiles()).contains(ToolRiskProfile.WRITE_PROJECT);
    }

    @Test
    void invokeUnknownToolFails() {
        ToolResult result = registry.invoke("missing", ToolContext.forProject("p1"), null, null);

        assertThat(result.success()).isFalse();
        assertThat(result.error()).isEqualTo("Unknown tool: missing");
    }

    @Test
    void invokeTurnsExceptionIntoFailure() {
        registry.register(new StubTool("boom", Set.of()) {
            @Override
            public ToolResult execute(ToolContext ctx, JsonNode input, ToolStream stream) {
                throw new IllegalStateException("store offline");
            }
        });

        ToolResult result = registry.invoke("boom", ToolContext.forProject("p1"), null, ToolStream.NONE);

        assertThat(result.success()).isFalse();
        assertThat(result.error()).contains("boom").contains("store offline");
    }

    @Test
    void invokePassesContextThrough() {
        registry.register(new StubTool("echo", Set.of()) {
            @Override
            public ToolResult execute(ToolContext ctx, JsonNode input, ToolStream stream) {
                return ToolResult.success(new TextNode(ctx.projectId()));
            }
        });

        ToolResult result = registry.invoke("echo", ToolContext.forProject("p42"), null, null);

        assertThat(result.success()).isTrue();
        assertThat(result.output().asText()).isEqualTo("p42");
    }

    @Test
    void injectDependenciesWiresSetterWhenBeanAvailable() throws Exception {
        Object injectedValue = new Object();
        ToolWithSetter tool = new ToolWithSetter();

        // Use doReturn to avoid triggering the default stub
        doReturn(injectedValue).when(mockContext).getBean(Object.class);

        var method = ToolRegistry.class.getDeclaredMethod("injectDependencies", Tool.class);
        method.setAccessible(true);
        method.invoke(registry, tool);

        assertThat(tool.injectedObject).isSameAs(injectedValue);
    }

    @Test
    void injectDependenciesSkipsWhenNoBeanAvailable() throws Exception {
        ToolWithSetter tool = new ToolWithSetter();

        var method = ToolRegistry.class.getDeclaredMethod("injectDependencies", Tool.class);
        method.setAccessible(true);
        method.invoke(registry, tool);

        assertThat(tool.injectedObject).isNull();
    }

    static class StubTool implements Tool {
        private final String name;
        private final Set<ToolRiskProfile> profiles;

        StubTool(String name, Set<ToolRiskProfile> profiles) {
            this.name = name;
            this.profiles = profiles;
        }

        @Override public String name() { return name; }
        @Override public String description() { return "stub " + name; }
        @Override public JsonNode inputSchema() { return null; }
        @Override public Set<ToolRiskProfile> riskProfiles() { return profiles; }
        @Override public ToolResult execute(ToolContext ctx, JsonNode input, ToolStream stream) {
            return ToolResult.success(null);
        }
    }

    /** Test tool with a setter method for dependency injection */
    static class ToolWithSetter extends StubTool {
        Object injectedObject;

        ToolWithSetter() {
            super("setter_tool", Set.of());
        }

        public void setInjectedObject(Object obj) { this.injectedObject = obj; }
    }
}
