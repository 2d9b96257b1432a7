package com.questrail.relay.client;

import com.questrail.relay.ExitCode;
import com.questrail.relay.config.RelayClientConfig;
import com.questrail.relay.config.RelayServerConfig;
import com.questrail.relay.transport.StreamConnector;
import com.questrail.relay.transport.netty.NettyStreamConnector;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Command line entry point for the interactive client.
 *
 * <pre>
 *   chat-client &lt;host&gt;
 * </pre>
 *
 * Connects to port {@value RelayServerConfig#DEFAULT_PORT} of {@code host}.
 * Lines typed on standard input are sent to the server; broadcasts from the
 * server are printed on standard output.
 */
public final class ChatClientMain
{
    private static final long QUIT_FLUSH_TIMEOUT_SECONDS = 5;

    private ChatClientMain() {}

    public static void main(String[] args)
    {
        BufferedReader in = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
        ExitCode code = run(args, in, System.out, System.err,
            NettyStreamConnector::new, HostResolver.system(),
            outcome -> System.exit(exitCodeFor(outcome).code()));
        System.exit(code.code());
    }

    /**
     * Run one session.
     *
     * @param onAbort invoked from the event loop when the session fails while the
     *                console is still blocked reading input
     */
    static ExitCode run(String[] args,
                        BufferedReader in,
                        PrintStream out,
                        PrintStream err,
                        Supplier<? extends StreamConnector> connectors,
                        HostResolver resolver,
                        Consumer<SessionOutcome> onAbort)
    {
        final RelayClientConfig config;
        try {
            config = parseArguments(args);
        }
        catch (IllegalArgumentException e) {
            err.println("Usage: chat-client <host>");
            return ExitCode.BAD_ARGUMENTS;
        }

        StreamConnector connector = connectors.get();
        try {
            ChatClient client = new ChatClient(config, connector, resolver, out::println);

            try {
                client.connect().join();
            }
            catch (CompletionException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                if (cause instanceof ResolutionException) {
                    err.println("Resolver error: " + cause.getMessage());
                    return ExitCode.RESOLVER_FAILURE;
                }
                err.println("Connection error: " + cause.getMessage());
                return ExitCode.CONNECTION_FAILURE;
            }

            client.finished().thenAccept(outcome -> {
                if (outcome.isFailure()) {
                    err.println(diagnostic(outcome));
                    onAbort.accept(outcome);
                }
            });

            try {
                new ClientConsole(client, in).run();
            }
            catch (IOException e) {
                err.println("Console error: " + e.getMessage());
                client.close();
                return ExitCode.READ_FAILURE;
            }

            return exitCodeFor(awaitOutcome(client));
        }
        finally {
            connector.shutdown();
        }
    }

    static RelayClientConfig parseArguments(String[] args)
    {
        if (args.length != 1) {
            throw new IllegalArgumentException("expected <host>");
        }
        return RelayClientConfig.builder()
            .withHost(args[0])
            .withPort(RelayServerConfig.DEFAULT_PORT)
            .build();
    }

    static ExitCode exitCodeFor(SessionOutcome outcome)
    {
        return switch (outcome.kind()) {
            case READ_FAILURE -> ExitCode.READ_FAILURE;
            case WRITE_FAILURE -> ExitCode.WRITE_FAILURE;
            case CLOSED -> ExitCode.SUCCESS;
        };
    }

    private static String diagnostic(SessionOutcome outcome)
    {
        String prefix = outcome.kind() == SessionOutcome.Kind.WRITE_FAILURE ? "Write error: " : "Read error: ";
        Throwable cause = outcome.cause();
        return prefix + (cause == null ? "connection lost" : cause.getMessage());
    }

    private static SessionOutcome awaitOutcome(ChatClient client)
    {
        try {
            return client.finished().get(QUIT_FLUSH_TIMEOUT_SECONDS, TimeUnit.SECONDS);
        }
        catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            client.close();
            return SessionOutcome.closed();
        }
        catch (ExecutionException | TimeoutException e) {
            client.close();
            return client.finished().join();
        }
    }
}
