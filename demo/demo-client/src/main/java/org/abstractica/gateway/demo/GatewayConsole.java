package org.abstractica.gateway.demo;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.abstractica.gateway.EventFanOut;
import org.abstractica.gateway.GatewayClient;
import org.abstractica.gateway.GatewayClientFactory;
import org.abstractica.gateway.impl.client.DefaultGatewayClientFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import java.util.Properties;
import java.util.concurrent.CompletionException;

/**
 * Console client for a gateway.
 *
 * <p>Features demonstrated:</p>
 * <ul>
 *   <li>Client configuration from a properties file and command line</li>
 *   <li>Hello, close and error callbacks</li>
 *   <li>Several event subscribers sharing one connection</li>
 *   <li>Request/response calls with JSON parameters</li>
 * </ul>
 */
public class GatewayConsole
{
    private static final Logger LOG = LoggerFactory.getLogger(GatewayConsole.class);
    private static final String DEFAULT_URL = "ws://localhost:18789";

    private final GatewayClient client;
    private final ObjectMapper mapper;
    private final EventFanOut events;

    public GatewayConsole(GatewayClient client)
    {
        this.client = client;
        this.mapper = new ObjectMapper();
        this.events = new EventFanOut();

        registerCallbacks();
    }

    private void registerCallbacks()
    {
        client.onHello(hello -> System.out.println("Connected: " + render(hello)));
        client.onClose(reason -> System.out.println("Disconnected: " + reason));
        client.onError(error -> LOG.warn("Gateway error: {}", error.getMessage()));
        client.onEvent(events);

        events.add((event, payload) -> System.out.printf("[event] %s %s%n", event, render(payload)));
        events.add((event, payload) -> chatLine(event, payload).ifPresent(System.out::println));
    }

    /**
     * Formats a chat event for the console.
     *
     * @param event   the event name
     * @param payload the payload, may be null
     * @return the line, or empty for non-chat events and chat events without a payload
     */
    static Optional<String> chatLine(String event, JsonNode payload)
    {
        if (!event.startsWith("chat.") || payload == null)
        {
            return Optional.empty();
        }
        return Optional.of("[chat] " + payload.path("text").asText(""));
    }

    public void connect()
    {
        System.out.println("Connecting to gateway...");
        client.connect();
    }

    public void runCommandLoop()
    {
        BufferedReader reader = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));

        try
        {
            String line;
            while ((line = reader.readLine()) != null)
            {
                String[] parts = line.trim().split("\\s+", 2);
                String command = parts[0].toLowerCase();

                switch (command)
                {
                    case "call" ->
                    {
                        if (parts.length > 1)
                        {
                            handleCall(parts[1]);
                        }
                        else
                        {
                            System.out.println("Usage: call <method> [json]");
                        }
                    }
                    case "status" -> System.out.println("State: " + client.getState());
                    case "connect" -> client.connect();
                    case "disconnect" -> client.disconnect();
                    case "quit", "exit", "q" ->
                    {
                        System.out.println("Disconnecting...");
                        return;
                    }
                    case "help" ->
                    {
                        System.out.println("Commands:");
                        System.out.println("  call <method> [json]  - Send a request, e.g. call listThings {}");
                        System.out.println("  status                - Show the connection state");
                        System.out.println("  connect               - Connect if not connected");
                        System.out.println("  disconnect            - Close the connection");
                        System.out.println("  quit                  - Disconnect and exit");
                    }
                    case "" ->
                    {
                        // Ignore empty input
                    }
                    default -> System.out.println("Unknown command: " + command + " (type 'help' for commands)");
                }
            }
        }
        catch (IOException e)
        {
            LOG.error("Error reading console input", e);
        }
    }

    private void handleCall(String args)
    {
        String[] parts = args.trim().split("\\s+", 2);
        String method = parts[0];

        JsonNode params = null;
        if (parts.length > 1)
        {
            try
            {
                params = mapper.readTree(parts[1]);
            }
            catch (JsonProcessingException e)
            {
                System.out.println("Invalid JSON parameters: " + e.getOriginalMessage());
                return;
            }
        }

        client.send(method, params).whenComplete((result, error) ->
        {
            if (error == null)
            {
                System.out.printf("[%s] %s%n", method, render(result));
            }
            else
            {
                Throwable cause = (error instanceof CompletionException && error.getCause() != null)
                        ? error.getCause()
                        : error;
                System.out.printf("[%s] failed: %s%n", method, cause.getMessage());
            }
        });
    }

    private String render(JsonNode node)
    {
        if (node == null)
        {
            return "(no payload)";
        }
        try
        {
            return mapper.writeValueAsString(node);
        }
        catch (JsonProcessingException e)
        {
            return node.toString();
        }
    }

    public void disconnect()
    {
        client.close();
    }

    public static void main(String[] args)
    {
        Properties properties = new Properties();
        properties.setProperty("gateway.url", System.getProperty("gateway.url", DEFAULT_URL));
        String token = System.getenv("GATEWAY_TOKEN");
        if (token != null)
        {
            properties.setProperty("gateway.token", token);
        }

        // Parse arguments
        for (int i = 0; i < args.length; i++)
        {
            switch (args[i])
            {
                case "-c", "--config" ->
                {
                    if (i + 1 < args.length)
                    {
                        loadProperties(Path.of(args[++i]), properties);
                    }
                }
                case "-u", "--url" ->
                {
                    if (i + 1 < args.length)
                    {
                        properties.setProperty("gateway.url", args[++i]);
                    }
                }
                case "-t", "--token" ->
                {
                    if (i + 1 < args.length)
                    {
                        properties.setProperty("gateway.token", args[++i]);
                    }
                }
                case "-p", "--password" ->
                {
                    if (i + 1 < args.length)
                    {
                        properties.setProperty("gateway.password", args[++i]);
                    }
                }
                case "--help" ->
                {
                    System.out.println("Usage: demo-client [options]");
                    System.out.println("Options:");
                    System.out.println("  -c, --config <file>      Properties file with gateway.* settings");
                    System.out.println("  -u, --url <url>          Gateway URL (default: " + DEFAULT_URL + ")");
                    System.out.println("  -t, --token <token>      Auth token (default: $GATEWAY_TOKEN)");
                    System.out.println("  -p, --password <secret>  Auth password");
                    System.exit(0);
                }
                default -> System.out.println("Ignoring unknown option: " + args[i]);
            }
        }

        GatewayClientFactory factory = new DefaultGatewayClientFactory();
        GatewayClient client;
        try
        {
            client = factory.builder()
                    .properties(properties)
                    .build();
        }
        catch (IllegalArgumentException e)
        {
            System.err.println("Invalid configuration: " + e.getMessage());
            System.exit(1);
            return;
        }

        GatewayConsole console = new GatewayConsole(client);
        console.connect();

        console.runCommandLoop();

        console.disconnect();
    }

    private static void loadProperties(Path file, Properties into)
    {
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8))
        {
            into.load(reader);
        }
        catch (IOException e)
        {
            System.err.println("Failed to read config file " + file + ": " + e.getMessage());
            System.exit(1);
        }
    }
}
