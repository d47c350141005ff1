package com.agentflow.engine.persistence.jdbc;

import com.agentflow.core.model.Project;
import com.agentflow.core.repository.ProjectRepository;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public class JdbcProjectRepository extends JdbcRepositorySupport implements ProjectRepository {

    private final RowMapper<Project> rowMapper = (rs, rowNum) -> new Project(
        rs.getString("id"),
        rs.getString("name"),
        rs.getString("path"),
        readTree(rs.getString("config")),
        toInstant(rs.getTimestamp("created_at"))
    );

    public JdbcProjectRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        super(jdbcTemplate, objectMapper);
    }

    @Override
    public void save(Project project) {
        jdbcTemplate.update("""
            INSERT INTO projects (id, name, path, config, created_at)
            VALUES (?, ?, ?, ?, ?)
            """,
            project.id(),
            project.name(),
            project.path(),
            toJson(project.config()),
            toTimestamp(project.createdAt())
        );
    }

    @Override
    public Optional<Project> findById(String id) {
        return jdbcTemplate.query("SELECT * FROM projects WHERE id = ?", rowMapper, id)
            .stream().findFirst();
    }

    @Override
    public List<Project> findAll() {
        return jdbcTemplate.query("SELECT * FROM projects ORDER BY name", rowMapper);
    }
}
