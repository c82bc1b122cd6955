package com.starscape.mediacatalog.integration;

import com.starscape.mediacatalog.features.basepaths.app.BasePathRegistry;
import com.starscape.mediacatalog.features.categories.app.CategoryRegistry;
import com.starscape.mediacatalog.features.media.app.MediaCatalog;
import com.starscape.mediacatalog.features.tags.app.TagRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

/**
 * Base class for integration tests.
 * Runs the full application context against the test profile's database and
 * empties every table before each test. Tests are not transactional, so every
 * registry call commits the way it would in production.
 */
@SpringBootTest
@ActiveProfiles("test")
public abstract class BaseIntegrationTest {
    
    @Autowired
    protected BasePathRegistry basePaths;
    
    @Autowired
    protected CategoryRegistry categories;
    
    @Autowired
    protected TagRegistry tags;
    
    @Autowired
    protected MediaCatalog media;
    
    @Autowired
    protected JdbcTemplate jdbcTemplate;
    
    @BeforeEach
    void cleanDatabase() {
        // children first, the foreign keys forbid any other order
        jdbcTemplate.update("DELETE FROM media_tags");
        jdbcTemplate.update("DELETE FROM media");
        jdbcTemplate.update("DELETE FROM tags");
        jdbcTemplate.update("DELETE FROM tag_categories");
        jdbcTemplate.update("DELETE FROM base_paths");
    }
    
    protected int countRows(String table) {
        Integer count = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM " + table, Integer.class);
        return count == null ? 0 : count;
    }
}
