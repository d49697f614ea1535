package org.shadowide.st.lsp.web.ws;

import org.eclipse.lsp4j.jsonrpc.Launcher;
import org.eclipse.lsp4j.services.LanguageClient;
import org.eclipse.lsp4j.websocket.WebSocketLauncherBuilder;
import org.shadowide.st.lsp.StLanguageServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.websocket.CloseReason;
import javax.websocket.Endpoint;
import javax.websocket.EndpointConfig;
import javax.websocket.Session;
import java.io.IOException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * WebSocket endpoint running one language server per session.
 */
public class LspEndpoint extends Endpoint {

    private static final Logger logger = LoggerFactory.getLogger(LspEndpoint.class);

    private static final String SERVER = "st.lsp.server";
    private static final String LISTENING = "st.lsp.listening";
    private static final String EXECUTOR = "st.lsp.executor";

    @Override
    public void onOpen(Session session, EndpointConfig config) {
        logger.info("LSP WebSocket connection opened: {}", session.getId());
        ExecutorService executor = Executors.newCachedThreadPool();
        try {
            StLanguageServer server = new StLanguageServer();
            WebSocketLauncherBuilder<LanguageClient> builder = new WebSocketLauncherBuilder<>();
            builder.setSession(session);
            builder.setLocalService(server);
            builder.setRemoteInterface(LanguageClient.class);
            builder.setExecutorService(executor);
            Launcher<LanguageClient> launcher = builder.create();
            server.connect(launcher.getRemoteProxy());
            session.getUserProperties().put(SERVER, server);
            session.getUserProperties().put(EXECUTOR, executor);
            session.getUserProperties().put(LISTENING, launcher.startListening());
            logger.info("LSP WebSocket session {} started listening", session.getId());
        } catch (RuntimeException e) {
            logger.error("Failed to start LSP over WebSocket for session {}", session.getId(), e);
            executor.shutdownNow();
            try {
                session.close(new CloseReason(CloseReason.CloseCodes.UNEXPECTED_CONDITION, "language server failed to start"));
            } catch (IOException closeError) {
                logger.warn("Failed to close WebSocket session {}", session.getId(), closeError);
            }
        }
    }

    @Override
    public void onError(Session session, Throwable t) {
        logger.error("LSP WebSocket error on session {}", session != null ? session.getId() : "n/a", t);
    }

    @Override
    public void onClose(Session session, CloseReason closeReason) {
        logger.info("LSP WebSocket connection closed: {} ({})", session.getId(), closeReason.getReasonPhrase());
        Object listening = session.getUserProperties().remove(LISTENING);
        if (listening instanceof Future) {
            ((Future<?>) listening).cancel(true);
        }
        Object server = session.getUserProperties().remove(SERVER);
        if (server instanceof StLanguageServer) {
            ((StLanguageServer) server).shutdown();
        }
        Object executor = session.getUserProperties().remove(EXECUTOR);
        if (executor instanceof ExecutorService) {
            ((ExecutorService) executor).shutdownNow();
        }
    }
}
