package com.mifinca.backend;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.UUID;

import com.mifinca.backend.support.AbstractPostgresIntegrationTest;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;

/**
 * Checks the unique indexes behind the services' case-insensitive name checks.
 */
@SpringBootTest
class SchemaMigrationIntegrationTest extends AbstractPostgresIntegrationTest {

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @Test
    @DisplayName("grupo names are unique per creator regardless of case")
    void grupoNameIgnoresCase() {
        UUID creator = insertUser();
        UUID other = insertUser();
        insertGrupo("Novillas", creator);

        assertThatThrownBy(() -> insertGrupo("NOVILLAS", creator))
                .isInstanceOf(DuplicateKeyException.class);
        assertThatCode(() -> insertGrupo("novillas", other)).doesNotThrowAnyException();
    }

    @Test
    @DisplayName("role, permission and module names are unique regardless of case")
    void catalogNamesIgnoreCase() {
        String suffix = UUID.randomUUID().toString().substring(0, 8);
        insertNamed("role", "Capataz-" + suffix);
        insertNamed("permission", "lots:audit-" + suffix);
        insertNamed("permission_module", "Potreros-" + suffix);

        assertThatThrownBy(() -> insertNamed("role", "CAPATAZ-" + suffix))
                .isInstanceOf(DuplicateKeyException.class);
        assertThatThrownBy(() -> insertNamed("permission", "LOTS:AUDIT-" + suffix))
                .isInstanceOf(DuplicateKeyException.class);
        assertThatThrownBy(() -> insertNamed("permission_module", "potreros-" + suffix))
                .isInstanceOf(DuplicateKeyException.class);
    }

    @Test
    @DisplayName("configuration parameter names are unique regardless of case")
    void configurationParameterNameIgnoresCase() {
        String name = "MAX_LOTS_" + UUID.randomUUID().toString().substring(0, 8).toUpperCase();
        insertParameter(name);

        assertThatThrownBy(() -> insertParameter(name.toLowerCase()))
                .isInstanceOf(DuplicateKeyException.class);
    }

    private UUID insertUser() {
        UUID id = UUID.randomUUID();
        jdbcTemplate.update("INSERT INTO app_user (id, email, password_hash) VALUES (?, ?, 'hash')",
                id, id + "@finca.test");
        return id;
    }

    private void insertGrupo(String name, UUID creator) {
        jdbcTemplate.update("INSERT INTO grupo (id, name, created_by_user_id) VALUES (?, ?, ?)",
                UUID.randomUUID(), name, creator);
    }

    private void insertNamed(String table, String name) {
        jdbcTemplate.update("INSERT INTO " + table + " (id, name) VALUES (?, ?)", UUID.randomUUID(), name);
    }

    private void insertParameter(String name) {
        UUID dataType = jdbcTemplate.queryForObject(
                "SELECT id FROM master_data WHERE category = 'DATA_TYPE' AND name = 'Entero'", UUID.class);
        jdbcTemplate.update(
                "INSERT INTO configuration_parameter (id, name, value, data_type_id) VALUES (?, ?, '10', ?)",
                UUID.randomUUID(), name, dataType);
    }
}
