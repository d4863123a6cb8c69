package ua.beengoo.rolink.bot.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedWriter;
import java.io.Closeable;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.util.Map;

/**
 * Audit trail of link attempts, one JSON object per line:
 * {@code {"at":"...","event":"link_ok","state":"...","discord":42,...}}.
 */
@Slf4j
public class AuditLogger implements Closeable {
    private final Path file;
    private final BufferedWriter writer;
    private final ObjectMapper om;
    private final Clock clock;

    public AuditLogger(Path file) throws IOException {
        this(file, new ObjectMapper(), Clock.systemUTC());
    }

    public AuditLogger(Path file, ObjectMapper om, Clock clock) throws IOException {
        this.file = file;
        this.om = om;
        this.clock = clock;
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);
        this.writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.APPEND);
    }

    /** Successful callback: who got linked to what, and which roles were granted per guild. */
    public void linked(String state, long discordId, long robloxId, String robloxName,
                       Map<Long, ? extends Iterable<Long>> granted, int roleErrors) {
        ObjectNode node = event("link_ok", state);
        node.put("discord", discordId);
        node.put("roblox", robloxId);
        node.put("robloxName", robloxName);
        ObjectNode roles = node.putObject("granted");
        granted.forEach((guild, ids) -> {
            ArrayNode arr = roles.putArray(Long.toString(guild));
            ids.forEach(id -> arr.add(id.longValue()));
        });
        if (roleErrors > 0) node.put("roleErrors", roleErrors);
        write(node);
    }

    /** Rejected or failed callback. */
    public void failed(String state, String failure, String message) {
        ObjectNode node = event("link_failed", state);
        node.put("failure", failure);
        node.put("message", message);
        write(node);
    }

    private ObjectNode event(String name, String state) {
        ObjectNode node = om.createObjectNode();
        node.put("at", clock.instant().toString());
        node.put("event", name);
        node.put("state", state);
        return node;
    }

    private synchronized void write(ObjectNode node) {
        try {
            writer.write(om.writeValueAsString(node));
            writer.newLine();
            writer.flush();
        } catch (JsonProcessingException e) {
            log.warn("Failed to encode audit event: {}", e.getMessage());
        } catch (IOException e) {
            log.warn("Failed to write audit event to {}: {}", file, e.getMessage());
        }
    }

    @Override
    public synchronized void close() throws IOException {
        writer.close();
    }
}
