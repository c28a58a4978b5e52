package im.arun.docoutline.util;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.ExecutorService;

import static org.assertj.core.api.Assertions.assertThat;

/** Unit tests for {@link ExecutorProvider}. */
class ExecutorProviderTest {

    @AfterEach
    void tearDown() {
        ExecutorProvider.shutdown();
    }

    @Test
    @DisplayName("The pool is shared until shut down")
    void shouldShareExecutor() {
        ExecutorService first = ExecutorProvider.getExecutor(2);

        assertThat(ExecutorProvider.getExecutor()).isSameAs(first);

        ExecutorProvider.shutdown();
        assertThat(first.isShutdown()).isTrue();
        assertThat(ExecutorProvider.getExecutor()).isNotSameAs(first);
    }

    @Test
    @DisplayName("Workers are named daemon threads")
    void shouldRunOnNamedDaemonThreads() throws Exception {
        Thread worker = ExecutorProvider.getExecutor(1).submit(Thread::currentThread).get();

        assertThat(worker.getName()).startsWith("docoutline-worker-");
        assertThat(worker.isDaemon()).isTrue();
    }

    @Test
    @DisplayName("The default size follows the processor count with an upper bound")
    void shouldBoundDefaultWorkers() {
        assertThat(ExecutorProvider.defaultWorkers()).isBetween(1, 8);
    }
}
