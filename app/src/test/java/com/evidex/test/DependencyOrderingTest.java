package com.evidex.test;

import com.evidex.core.db.DatabaseService;
import com.evidex.core.service.ManagedService;
import io.quarkus.test.junit.QuarkusTest;
import jakarta.inject.Inject;
import org.junit.jupiter.api.MethodOrderer;
import org.junit.jupiter.api.Order;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestMethodOrder;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatIllegalStateException;

@QuarkusTest
@TestMethodOrder(MethodOrderer.OrderAnnotation.class)
class DependencyOrderingTest {

    @Inject
    DatabaseService databaseService;

    @Inject
    TestService testService;

    @Test
    @Order(1)
    void testServiceStartsAfterDatabase() throws Exception {
        assertThat(databaseService.state()).isEqualTo(ManagedService.State.RUNNING);

        testService.start();
        assertThat(testService.state()).isEqualTo(ManagedService.State.RUNNING);

        testService.forceState(ManagedService.State.STOPPED);
    }

    @Test
    @Order(2)
    void testServiceCascadesOnDatabaseFailure() throws Exception {
        testService.start();
        assertThat(testService.state()).isEqualTo(ManagedService.State.RUNNING);

        databaseService.fail(new RuntimeException("simulated DB failure"));
        try {
            assertThat(testService.state()).isEqualTo(ManagedService.State.FAILED);
            assertThatIllegalStateException()
                    .isThrownBy(() -> databaseService.jdbi())
                    .withMessageContaining("not running");
        } finally {
            databaseService.forceState(ManagedService.State.RUNNING);
            testService.forceState(ManagedService.State.STOPPED);
        }
    }
}
