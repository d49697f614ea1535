package org.shadowide.st.lsp;

import org.eclipse.lsp4j.jsonrpc.Launcher;
import org.eclipse.lsp4j.launch.LSPLauncher;
import org.eclipse.lsp4j.services.LanguageClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.InputStream;
import java.io.OutputStream;
import java.util.concurrent.Future;

/**
 * Structured Text Language Server launcher over stdio.
 */
public class StLspServer {

    private static final Logger logger = LoggerFactory.getLogger(StLspServer.class);

    public static void main(String[] args) {
        logger.info("Starting Structured Text Language Server...");

        try {
            startServer(System.in, System.out);
        } catch (Exception e) {
            logger.error("Failed to start Structured Text Language Server", e);
            System.exit(1);
        }
    }

    /**
     * Start the Language Server with custom input/output streams
     *
     * @param in  Input stream for LSP communication
     * @param out Output stream for LSP communication
     */
    public static void startServer(InputStream in, OutputStream out) {
        StLanguageServer server = new StLanguageServer();

        Launcher<LanguageClient> launcher = LSPLauncher.createServerLauncher(server, in, out);
        server.connect(launcher.getRemoteProxy());

        logger.info("Structured Text Language Server started successfully");
        Future<?> startListening = launcher.startListening();
        try {
            startListening.get();
        } catch (Exception e) {
            logger.error("Language Server execution interrupted", e);
        } finally {
            server.shutdown();
        }

        logger.info("Structured Text Language Server stopped");
    }
}
