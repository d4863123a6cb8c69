package ua.beengoo.rolink.bot.adapters.jdbc;

import ua.beengoo.rolink.api.model.Linkage;
import ua.beengoo.rolink.api.ports.LinkageRepo;
import ua.beengoo.rolink.bot.db.DatabaseManager;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

/** One row per Discord user in {@code linkages}; relinking overwrites the row. */
public class JdbcLinkageRepo implements LinkageRepo {
    private static final String SELECT =
            "SELECT requester_id, external_id, external_display_name, linked_at FROM linkages ";

    private final DataSource ds;
    private final DatabaseManager.Dialect dialect;
    private final Clock clock;

    public JdbcLinkageRepo(DataSource ds, DatabaseManager.Dialect dialect) {
        this(ds, dialect, Clock.systemUTC());
    }

    public JdbcLinkageRepo(DataSource ds, DatabaseManager.Dialect dialect, Clock clock) {
        this.ds = ds; this.dialect = dialect; this.clock = clock;
    }

    @Override
    public Optional<Linkage> getByRequester(long requesterId) {
        return findOne(SELECT + "WHERE requester_id=?", requesterId);
    }

    @Override
    public Optional<Linkage> getByExternalId(long externalId) {
        // the same Roblox account may be linked by several Discord users; newest wins
        return findOne(SELECT + "WHERE external_id=? ORDER BY linked_at DESC LIMIT 1", externalId);
    }

    @Override
    public Linkage upsert(long requesterId, long externalId, String externalDisplayName) {
        long now = clock.instant().getEpochSecond();
        String sql = switch (dialect) {
            case POSTGRES, SQLITE -> "INSERT INTO linkages(requester_id, external_id, external_display_name, linked_at) " +
                    "VALUES(?,?,?,?) ON CONFLICT(requester_id) DO UPDATE SET external_id=EXCLUDED.external_id, " +
                    "external_display_name=EXCLUDED.external_display_name, linked_at=EXCLUDED.linked_at";
            case MYSQL -> "INSERT INTO linkages(requester_id, external_id, external_display_name, linked_at) " +
                    "VALUES(?,?,?,?) ON DUPLICATE KEY UPDATE external_id=VALUES(external_id), " +
                    "external_display_name=VALUES(external_display_name), linked_at=VALUES(linked_at)";
        };
        try (Connection c = ds.getConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setLong(1, requesterId);
            ps.setLong(2, externalId);
            ps.setString(3, externalDisplayName);
            ps.setLong(4, now);
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new IllegalStateException("Failed to save linkage for " + requesterId, e);
        }
        return new Linkage(requesterId, externalId, externalDisplayName, Instant.ofEpochSecond(now));
    }

    @Override
    public boolean delete(long requesterId) {
        try (Connection c = ds.getConnection();
             PreparedStatement ps = c.prepareStatement("DELETE FROM linkages WHERE requester_id=?")) {
            ps.setLong(1, requesterId);
            return ps.executeUpdate() > 0;
        } catch (SQLException e) {
            throw new IllegalStateException("Failed to delete linkage for " + requesterId, e);
        }
    }

    private Optional<Linkage> findOne(String sql, long id) {
        try (Connection c = ds.getConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setLong(1, id);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) return Optional.empty();
                return Optional.of(new Linkage(
                        rs.getLong("requester_id"),
                        rs.getLong("external_id"),
                        rs.getString("external_display_name"),
                        Instant.ofEpochSecond(rs.getLong("linked_at"))));
            }
        } catch (SQLException e) {
            throw new IllegalStateException("Failed to read linkage " + id, e);
        }
    }
}
