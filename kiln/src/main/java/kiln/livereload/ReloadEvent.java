// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package kiln.livereload;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A build lifecycle event pushed to live reload clients.
 * <p>
 * On the wire each event is a JSON object whose {@code type} member names the kind: {@code {"type":"start"}},
 * {@code {"type":"notify","message":"...","error":false}}, and {@code {"type":"reload"}} optionally carrying an
 * {@code href} to navigate to instead of reloading the current location.
 */
public sealed interface ReloadEvent permits ReloadEvent.Start, ReloadEvent.Notify, ReloadEvent.Reload {
    ObjectNode toJson();

    /**
     * Decodes an event from its wire form, or returns {@code null} if the object is not a known event.
     */
    static @Nullable ReloadEvent fromJson(final JsonNode node) {
        final var type = node.path(typeMember).asText();
        switch (type) {
            case "start":
                return new Start();
            case "notify":
                return new Notify(node.path("message").asText(), node.path("error").asBoolean());
            case "reload": {
                final var href = node.get("href");
                return new Reload((href != null && href.isTextual()) ? href.asText() : null);
            }
            default:
                return null;
        }
    }

    /**
     * A build pass has started.
     */
    record Start() implements ReloadEvent {
        @Override
        public ObjectNode toJson() {
            return object("start");
        }
    }

    /**
     * A message to show to the user, such as a progress note or a build failure summary.
     */
    record Notify(String message, boolean error) implements ReloadEvent {
        @Override
        public ObjectNode toJson() {
            return object("notify").put("message", message).put("error", error);
        }
    }

    /**
     * The build succeeded; reload the current page, or go to {@code href} if set.
     */
    record Reload(@Nullable String href) implements ReloadEvent {
        @Override
        public ObjectNode toJson() {
            final var result = object("reload");
            if (href != null) {
                result.put("href", href);
            }
            return result;
        }
    }

    private static ObjectNode object(final String type) {
        return JsonNodeFactory.instance.objectNode().put(typeMember, type);
    }

    String typeMember = "type";
}
