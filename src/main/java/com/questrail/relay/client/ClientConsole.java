package com.questrail.relay.client;

import java.io.BufferedReader;
import java.io.IOException;
import java.util.Objects;

/**
 * Blocking console loop: one input line per send.
 *
 * <p>Runs on the calling thread until the user quits, input ends, or the
 * session finishes on its own. End of input is treated as a quit.</p>
 */
public final class ClientConsole
{
    private final ChatClient client;
    private final BufferedReader input;

    public ClientConsole(ChatClient client, BufferedReader input)
    {
        this.client = Objects.requireNonNull(client, "client");
        this.input = Objects.requireNonNull(input, "input");
    }

    public void run() throws IOException
    {
        String line;
        while (!client.isFinished()) {
            line = input.readLine();
            if (line == null) {
                if (!client.isFinished()) {
                    client.quit();
                }
                return;
            }
            if (client.isFinished()) {
                return;
            }
            if (!client.submitLine(line)) {
                return;
            }
        }
    }
}
