package net.guildlookup.repository;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verifyNoInteractions;

import net.guildlookup.GuildFixtures;
import net.guildlookup.model.GuildKey;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.jdbc.core.JdbcTemplate;

@ExtendWith(MockitoExtension.class)
class GuildRepositoryTest {

    @Mock
    private JdbcTemplate jdbcTemplate;

    @Test
    void findByKey_partialKeyNeverQueries() {
        GuildRepository repository = new GuildRepository(jdbcTemplate, GuildFixtures.MAPPER);

        assertThat(repository.findByKey(new GuildKey("eu", "", "Method"))).isEmpty();
        assertThat(repository.findByKey(new GuildKey("eu", "Tarren Mill", null))).isEmpty();
        assertThat(repository.findByKey(null)).isEmpty();

        verifyNoInteractions(jdbcTemplate);
    }

    @Test
    void upsert_rejectsPartialKey() {
        GuildRepository repository = new GuildRepository(jdbcTemplate, GuildFixtures.MAPPER);

        assertThatThrownBy(() -> repository.upsert(GuildFixtures.guild("eu", " ", "Method")))
            .isInstanceOf(IllegalArgumentException.class);
        verifyNoInteractions(jdbcTemplate);
    }
}
