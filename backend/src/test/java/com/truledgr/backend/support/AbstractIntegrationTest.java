package com.truledgr.backend.support;

import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;

/**
 * Boots the full application against an in-memory H2 database in PostgreSQL mode.
 * Flyway builds the schema, so every test class sees the production migrations.
 */
@SpringBootTest
@AutoConfigureMockMvc
@Import(TestClockConfig.class)
public abstract class AbstractIntegrationTest {

    // 48 random bytes, Base64 encoded
    public static final String TEST_JWT_SECRET = "k0c8S3n3b1xq7Yd0vJpQm4T2Wf9ZrL6uA5hN8eKjC1oP3sVyX7gB2dR4tM6wE9qF";

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url",
                () -> "jdbc:h2:mem:truledgr;MODE=PostgreSQL;DATABASE_TO_LOWER=TRUE;DB_CLOSE_DELAY=-1;LOCK_TIMEOUT=10000");
        registry.add("spring.datasource.username", () -> "sa");
        registry.add("spring.datasource.password", () -> "");
        // Flyway owns the schema; H2 reports some column types differently from PostgreSQL
        registry.add("spring.jpa.hibernate.ddl-auto", () -> "none");
        registry.add("jwt.secret", () -> TEST_JWT_SECRET);
    }
}
