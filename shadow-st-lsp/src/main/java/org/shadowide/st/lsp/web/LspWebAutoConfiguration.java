package org.shadowide.st.lsp.web;

import org.shadowide.st.lsp.web.ws.WebSocketEndpointConfig;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Import;
import org.springframework.web.socket.server.standard.ServerEndpointExporter;

/**
 * Serves the language server over WebSocket inside a Spring Boot web application.
 */
@Configuration
@ConditionalOnClass(ServerEndpointExporter.class)
@Import(WebSocketEndpointConfig.class)
public class LspWebAutoConfiguration {

    /**
     * Registers the {@code ServerEndpointConfig} beans with the embedded servlet container.
     */
    @Bean
    @ConditionalOnMissingBean
    public ServerEndpointExporter serverEndpointExporter() {
        return new ServerEndpointExporter();
    }
}
