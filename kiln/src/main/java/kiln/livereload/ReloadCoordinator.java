// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package kiln.livereload;

import java.nio.file.Path;
import java.util.Map;
import java.util.TreeMap;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.javalin.Javalin;
import io.javalin.http.staticfiles.Location;
import io.javalin.websocket.WsContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Serves the destination tree over HTTP and pushes {@link ReloadEvent}s to the browsers connected to the live
 * reload WebSocket.
 * <p>
 * Broadcasting is fire-and-forget: an event reaches exactly the clients connected when it is sent, and nothing is
 * queued for clients that connect later. Each connected client's {@link ClientState} is tracked until it
 * disconnects.
 * <p>
 * This class is thread-safe.
 */
public final class ReloadCoordinator implements AutoCloseable {
    /**
     * Creates a coordinator serving the given destination root, which must exist. The server is not started.
     */
    public ReloadCoordinator(final Path destinationRoot) {
        endpoint = endpointPrefix + UUID.randomUUID().toString().replace("-", "");
        server = Javalin.create(config -> {
            config.showJavalinBanner = false;
            config.staticFiles.add(staticFiles -> {
                staticFiles.hostedPath = "/";
                staticFiles.directory = destinationRoot.toAbsolutePath().toString();
                staticFiles.location = Location.EXTERNAL;
                staticFiles.precompress = false;
            });
        });
        server.ws('/' + endpoint, ws -> {
            ws.onConnect(ctx -> {
                ctx.enableAutomaticPings();
                clients.put(ctx.sessionId(), new Client(ctx, ClientState.IDLE));
                logger.debug("Live reload client {} connected", ctx.sessionId());
            });
            ws.onClose(ctx -> {
                clients.remove(ctx.sessionId());
                logger.debug("Live reload client {} disconnected", ctx.sessionId());
            });
            ws.onError(ctx -> logger.warn("Live reload client {} failed", ctx.sessionId(), ctx.error()));
        });
    }

    /**
     * Starts serving on the given interface and port. Port zero picks a free port.
     */
    public void start(final String host, final int port) {
        server.start(host, port);
        logger.info("Serving on http://{}:{}/", host, server.port());
    }

    @Override
    public void close() {
        server.stop();
    }

    /**
     * The underlying server, for embedding in test harnesses.
     */
    @SuppressFBWarnings(value = "EI_EXPOSE_REP", justification = "Callers need the live server, not a copy")
    public Javalin server() {
        return server;
    }

    /**
     * The path of the WebSocket endpoint, without the leading slash.
     */
    public String endpoint() {
        return endpoint;
    }

    /**
     * Sends the event to every currently connected client.
     */
    public void broadcast(final ReloadEvent event) {
        final var message = event.toJson().toString();
        logger.debug("Broadcasting {} to {} client(s)", message, clients.size());
        for (final var id : clients.keySet()) {
            clients.computeIfPresent(id, (key, client) -> {
                if (!client.context.session.isOpen()) {
                    return null;
                }
                try {
                    client.context.send(message);
                } catch (final RuntimeException e) {
                    logger.warn("Cannot send to live reload client {}", key, e);
                    return null;
                }
                return new Client(client.context, client.state.next(event));
            });
        }
    }

    /**
     * Returns a snapshot of the connected clients' states, keyed by session ID.
     */
    public Map<String, ClientState> clientStates() {
        final var result = new TreeMap<String, ClientState>();
        clients.forEach((id, client) -> result.put(id, client.state));
        return result;
    }

    private final String endpoint;
    private final Javalin server;
    private final ConcurrentHashMap<String, Client> clients = new ConcurrentHashMap<>();

    private static final String endpointPrefix = "__livereload/";
    private static final Logger logger = LoggerFactory.getLogger(ReloadCoordinator.class);

    private record Client(WsContext context, ClientState state) {
    }
}
