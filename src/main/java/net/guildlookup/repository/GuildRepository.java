package net.guildlookup.repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.util.List;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import net.guildlookup.model.Faction;
import net.guildlookup.model.Guild;
import net.guildlookup.model.GuildCrest;
import net.guildlookup.model.GuildKey;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.ObjectMapper;

/**
 * Postgres cache of guild records keyed by (region, realm, name).
 *
 * <p>Rows are only ever written by {@link #upsert(Guild)}; the database stamps
 * {@code updated_at}, and a row lock on conflict serializes concurrent writers of the
 * same key so the last commit wins.</p>
 */
@Repository
@Slf4j
public class GuildRepository {

    private static final String SELECT_BY_KEY = """
        SELECT id, region, realm, name, faction, created, achievement_points, member_count,
               crest::text AS crest, updated_at
        FROM guild
        WHERE region = ? AND realm = ? AND name = ?
        """;

    private static final String UPSERT = """
        INSERT INTO guild
          (id, region, realm, name, faction, created, achievement_points, member_count, crest, created_at, updated_at)
        VALUES (?, ?, ?, ?, ?, ?, ?, ?, CAST(? AS jsonb), NOW(), NOW())
        ON CONFLICT (region, realm, name) DO UPDATE SET
          id = EXCLUDED.id,
          faction = EXCLUDED.faction,
          created = EXCLUDED.created,
          achievement_points = EXCLUDED.achievement_points,
          member_count = EXCLUDED.member_count,
          crest = EXCLUDED.crest,
          updated_at = GREATEST(NOW(), guild.updated_at + INTERVAL '1 microsecond')
        RETURNING updated_at
        """;

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;

    public GuildRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
    }

    /**
     * Point lookup by composite key. Partial keys never reach the database.
     *
     * @param key region (any case), realm and name as stored
     * @return the cached record when present
     */
    @Transactional(readOnly = true)
    public Optional<Guild> findByKey(GuildKey key) {
        if (key == null || !key.isComplete()) {
            return Optional.empty();
        }
        List<Guild> rows = jdbcTemplate.query(SELECT_BY_KEY, this::mapRow,
            key.storedRegion(), key.realm(), key.name());
        return rows.stream().findFirst();
    }

    /**
     * Inserts or overwrites the record at its key. The caller's {@code updatedAt} is
     * ignored; the stored timestamp comes from the database clock and is strictly
     * greater than the previous one for the key.
     *
     * @param guild fully populated record
     * @return the record carrying its stored timestamp
     */
    @Transactional
    public Guild upsert(Guild guild) {
        if (guild == null || !guild.key().isComplete()) {
            throw new IllegalArgumentException("guild with a complete key is required");
        }
        String crestJson = writeCrest(guild);
        Timestamp updatedAt = jdbcTemplate.queryForObject(UPSERT, Timestamp.class,
            guild.id(),
            guild.key().storedRegion(),
            guild.realm(),
            guild.name(),
            guild.faction().name(),
            guild.created(),
            guild.achievementPoints(),
            guild.memberCount(),
            crestJson
        );
        if (updatedAt == null) {
            throw new IllegalStateException("Upsert of guild " + guild.key() + " returned no timestamp");
        }
        log.debug("Upserted guild {} at {}", guild.key(), updatedAt);
        return guild.withUpdatedAt(updatedAt.toInstant());
    }

    private Guild mapRow(ResultSet rs, int rowNum) throws SQLException {
        Timestamp updatedAt = rs.getTimestamp("updated_at");
        return new Guild(
            rs.getLong("id"),
            rs.getString("region"),
            rs.getString("realm"),
            rs.getString("name"),
            Faction.valueOf(rs.getString("faction")),
            rs.getString("created"),
            rs.getInt("achievement_points"),
            rs.getInt("member_count"),
            readCrest(rs.getString("crest"), rs.getString("realm"), rs.getString("name")),
            updatedAt != null ? updatedAt.toInstant() : null
        );
    }

    private String writeCrest(Guild guild) {
        try {
            return objectMapper.writeValueAsString(guild.crest());
        } catch (JacksonException ex) {
            throw new IllegalStateException("Could not serialize crest for guild " + guild.key(), ex);
        }
    }

    private GuildCrest readCrest(String json, String realm, String name) {
        try {
            return objectMapper.readValue(json, GuildCrest.class);
        } catch (JacksonException ex) {
            throw new IllegalStateException("Stored crest for guild " + realm + "/" + name + " is not valid JSON", ex);
        }
    }
}
