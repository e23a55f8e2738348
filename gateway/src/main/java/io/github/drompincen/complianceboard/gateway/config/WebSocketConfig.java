package io.github.drompincen.complianceboard.gateway.config;

import io.github.drompincen.complianceboard.gateway.websocket.ProjectEventWebSocketHandler;
import io.github.drompincen.complianceboard.runtime.config.ComplianceBoardProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

/** Registers the project change feed under {@code complianceboard.websocket.path}. */
@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

    private static final Logger log = LoggerFactory.getLogger(WebSocketConfig.class);

    private final ProjectEventWebSocketHandler projectEvents;
    private final ComplianceBoardProperties.Websocket settings;

    public WebSocketConfig(ProjectEventWebSocketHandler projectEvents, ComplianceBoardProperties properties) {
        this.projectEvents = projectEvents;
        this.settings = properties.websocket();
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(projectEvents, settings.path())
                .setAllowedOriginPatterns(settings.allowedOrigins().toArray(String[]::new));
        log.info("Project change feed at {} for origins {}", settings.path(), settings.allowedOrigins());
    }
}
