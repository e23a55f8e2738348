package io.github.drompincen.complianceboard.gateway.controller;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import io.github.drompincen.complianceboard.protocol.api.ToolDescriptor;
import io.github.drompincen.complianceboard.runtime.tools.*;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api")
public class ToolController {

    private final ToolRegistry toolRegistry;

    public ToolController(ToolRegistry toolRegistry) {
        this.toolRegistry = toolRegistry;
    }

    @GetMapping("/tools")
    public List<ToolDescriptor> list() {
        return toolRegistry.descriptors();
    }

    @GetMapping("/tools/{name}")
    public ResponseEntity<ToolDescriptor> describe(@PathVariable String name) {
        return toolRegistry.descriptors().stream()
                .filter(d -> d.name().equals(name))
                .findFirst()
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    @PostMapping("/projects/{projectId}/tools/{name}")
    public ResponseEntity<ToolResult> invoke(@PathVariable String projectId, @PathVariable String name,
                                             @RequestBody(required = false) JsonNode input,
                                             @RequestHeader(value = "X-Invoked-By", defaultValue = "assistant")
                                             String invokedBy) {
        if (toolRegistry.get(name).isEmpty()) return ResponseEntity.notFound().build();
        ToolContext ctx = new ToolContext(projectId, invokedBy, Map.of());
        JsonNode body = input != null ? input : JsonNodeFactory.instance.objectNode();
        CollectingToolStream stream = new CollectingToolStream();
        ToolResult result = toolRegistry.invoke(name, ctx, body, stream).withNotes(stream.lines());
        return result.success() ? ResponseEntity.ok(result) : ResponseEntity.badRequest().body(result);
    }
}
