package io.github.drompincen.complianceboard.runtime.tools;

import com.fasterxml.jackson.databind.JsonNode;
import io.github.drompincen.complianceboard.protocol.api.ToolDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.NoSuchBeanDefinitionException;
import org.springframework.context.ApplicationContext;
import org.springframework.stereotype.Component;

import jakarta.annotation.PostConstruct;
import java.lang.reflect.Method;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;

@Component
public class ToolRegistry {

    private static final Logger log = LoggerFactory.getLogger(ToolRegistry.class);
    private final Map<String, Tool> tools = new ConcurrentHashMap<>();
    private final ApplicationContext applicationContext;

    public ToolRegistry(ApplicationContext applicationContext) {
        this.applicationContext = applicationContext;
    }

    @PostConstruct
    public void loadTools() {
        ServiceLoader<Tool> loader = ServiceLoader.load(Tool.class);
        for (Tool tool : loader) {
            injectDependencies(tool);
            register(tool);
        }
        log.info("Loaded {} assistant tools via SPI", tools.size());
    }

    public void register(Tool tool) {
        tools.put(tool.name(), tool);
        log.debug("Registered tool: {}", tool.name());
    }

    public Optional<Tool> get(String name) {
        return Optional.ofNullable(tools.get(name));
    }

    public Collection<Tool> all() {
        return Collections.unmodifiableCollection(tools.values());
    }

    public List<ToolDescriptor> descriptors() {
        return tools.values().stream()
                .sorted(Comparator.comparing(Tool::name))
                .map(t -> new ToolDescriptor(t.name(), t.description(), t.inputSchema(),
                        t.riskProfiles(), t.mutatesProject()))
                .toList();
    }

    /** Runs a tool by name. Unknown tools and exceptions thrown by a tool come back as failures. */
    public ToolResult invoke(String name, ToolContext ctx, JsonNode input, ToolStream stream) {
        Tool tool = tools.get(name);
        if (tool == null) return ToolResult.failure("Unknown tool: " + name);
        try {
            ToolResult result = tool.execute(ctx, input, stream != null ? stream : ToolStream.NONE);
            if (!result.success()) {
                log.debug("Tool {} failed for project {}: {}", name, ctx.projectId(), result.error());
            }
            return result;
        } catch (Exception e) {
            log.warn("Tool {} threw for project {}", name, ctx.projectId(), e);
            return ToolResult.failure("Failed to run " + name + ": " + e.getMessage());
        }
    }

    private void injectDependencies(Tool tool) {
        for (Method method : tool.getClass().getMethods()) {
            if (method.getName().startsWith("set") && method.getParameterCount() == 1) {
                Class<?> paramType = method.getParameterTypes()[0];
                try {
                    Object bean = applicationContext.getBean(paramType);
                    method.invoke(tool, bean);
                    log.debug("Injected {} into {}.{}", paramType.getSimpleName(),
                            tool.getClass().getSimpleName(), method.getName());
                } catch (NoSuchBeanDefinitionException e) {
                    log.trace("No bean of type {} for {}.{}", paramType.getSimpleName(),
                            tool.getClass().getSimpleName(), method.getName());
                } catch (Exception e) {
                    log.warn("Failed to inject {} into {}.{}: {}", paramType.getSimpleName(),
                            tool.getClass().getSimpleName(), method.getName(), e.getMessage());
                }
            }
        }
    }
}
