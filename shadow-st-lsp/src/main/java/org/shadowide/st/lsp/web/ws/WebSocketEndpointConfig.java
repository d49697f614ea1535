package org.shadowide.st.lsp.web.ws;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.websocket.server.ServerEndpointConfig;

@Configuration
public class WebSocketEndpointConfig {

    @Value("${shadow-st.lsp.path:/st-lsp}")
    private String lspPath;

    @Bean
    public ServerEndpointConfig lspEndpointConfig() {
        return ServerEndpointConfig.Builder.create(LspEndpoint.class, lspPath).build();
    }
}
