package edu.uconn.imat.service;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.jdbc.core.JdbcTemplate;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
@DisplayName("SchemaInitializer Unit Tests")
class SchemaInitializerTest {

    @Mock
    private JdbcTemplate jdbcTemplate;

    @Test
    @DisplayName("Should only issue idempotent create statements")
    void shouldIssueIdempotentDdl() {
        // Given
        SchemaInitializer initializer = new SchemaInitializer(jdbcTemplate);
        ArgumentCaptor<String> statements = ArgumentCaptor.forClass(String.class);

        // When
        initializer.initialize();

        // Then
        verify(jdbcTemplate, times(9)).execute(statements.capture());
        List<String> ddl = statements.getAllValues();
        assertThat(ddl).allMatch(sql -> sql.startsWith("CREATE ") && sql.contains(" IF NOT EXISTS "));
        assertThat(ddl).noneMatch(sql -> sql.contains("DROP") || sql.contains("ALTER"));
        assertThat(ddl.get(0)).isEqualTo("CREATE SCHEMA IF NOT EXISTS raw");
        assertThat(ddl).anyMatch(sql -> sql.contains("imat_annotations_label_ids_gin") && sql.contains("USING GIN"));
        assertThat(ddl).anyMatch(sql -> sql.contains("raw.imat_images") && sql.contains("PRIMARY KEY (split, image_id)"));
    }
}
