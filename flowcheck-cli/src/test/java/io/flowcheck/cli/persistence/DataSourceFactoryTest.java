package io.flowcheck.cli.persistence;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.postgresql.ds.PGSimpleDataSource;
import org.sqlite.SQLiteDataSource;

@DisplayName("DataSourceFactory")
class DataSourceFactoryTest {

    @Test
    @DisplayName("creates a SQLite data source")
    void shouldCreateSqlite() {
        assertThat(DataSourceFactory.create("jdbc:sqlite:tasks.db", null, null))
                .isInstanceOf(SQLiteDataSource.class);
    }

    @Test
    @DisplayName("creates a PostgreSQL data source with credentials")
    void shouldCreatePostgres() {
        var dataSource =
                DataSourceFactory.create("jdbc:postgresql://localhost:5432/tasks", "app", "secret");

        assertThat(dataSource).isInstanceOf(PGSimpleDataSource.class);
        assertThat(((PGSimpleDataSource) dataSource).getUser()).isEqualTo("app");
    }

    @ParameterizedTest
    @ValueSource(strings = {"jdbc:mysql://localhost/tasks", " "})
    @DisplayName("rejects unsupported or blank URLs")
    void shouldRejectUnsupported(String url) {
        assertThatThrownBy(() -> DataSourceFactory.create(url, null, null))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
