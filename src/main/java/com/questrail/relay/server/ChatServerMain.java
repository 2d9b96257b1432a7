package com.questrail.relay.server;

import com.questrail.relay.ExitCode;
import com.questrail.relay.config.RelayServerConfig;
import com.questrail.relay.observability.Slf4jRelayObservabilitySink;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.net.SocketAddress;
import java.util.concurrent.ExecutionException;

/**
 * Command line entry point for the relay server.
 *
 * <pre>
 *   chat-server
 * </pre>
 *
 * Takes no arguments and listens on port {@value RelayServerConfig#DEFAULT_PORT}
 * on all interfaces until the process is terminated.
 */
public final class ChatServerMain
{
    private static final Logger log = LoggerFactory.getLogger(ChatServerMain.class);

    private ChatServerMain() {}

    public static void main(String[] args)
    {
        ExitCode code = run(args, RelayServerConfig.defaults(), System.err);
        if (code != ExitCode.SUCCESS) {
            System.exit(code.code());
        }
    }

    /**
     * Start the server and block until it stops.
     */
    static ExitCode run(String[] args, RelayServerConfig config, PrintStream err)
    {
        if (args.length != 0) {
            err.println("Usage: chat-server");
            return ExitCode.BAD_ARGUMENTS;
        }

        final ChatServer server;
        try {
            server = ChatServer.create(config, new Slf4jRelayObservabilitySink());
        }
        catch (RuntimeException e) {
            err.println("Startup error: " + e.getMessage());
            return ExitCode.STARTUP_FAILURE;
        }

        final SocketAddress address;
        try {
            address = server.start().get();
        }
        catch (ExecutionException e) {
            err.println("Acceptor error: " + e.getCause().getMessage());
            server.stop();
            return ExitCode.ACCEPTOR_FAILURE;
        }
        catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            err.println("Startup interrupted");
            server.stop();
            return ExitCode.STARTUP_FAILURE;
        }

        Runtime.getRuntime().addShutdownHook(new Thread(server::stop, "relay-server-shutdown"));
        log.info("Chat relay started on {}", address);

        server.terminated().join();
        return ExitCode.SUCCESS;
    }
}
