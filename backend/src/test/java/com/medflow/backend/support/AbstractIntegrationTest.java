package com.medflow.backend.support;

import org.junit.jupiter.api.BeforeEach;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

/**
 * In-memory H2 (PostgreSQL mode) context with a freshly seeded station catalog before every test.
 */
@SpringBootTest
@ActiveProfiles("test")
public abstract class AbstractIntegrationTest {

    @Autowired
    protected TestFixtures fixtures;

    @BeforeEach
    void resetFixtures() {
        fixtures.reset();
    }
}
