package br.com.ferroxide.chatstore.service;

import br.com.ferroxide.chatstore.error.exception.ConstraintViolationException;
import br.com.ferroxide.chatstore.support.StoreIntegrationTestSupport;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import static org.assertj.core.api.Assertions.assertThat;

class ConcurrentCreationTest extends StoreIntegrationTestSupport {

    private static final int THREADS = 8;

    @Autowired
    private UserService userService;

    @Autowired
    private RoomService roomService;

    @Autowired
    private MembershipService membershipService;

    @Test
    @DisplayName("of several racing case-variant registrations exactly one succeeds")
    void racingUsernames() throws Exception {
        String[] variants = {"carol", "Carol", "CAROL", "cArOl", "caROL", "CaRoL", "carOL", "CAROl"};

        List<Outcome> outcomes = race(i -> userService.createUser(variants[i], "h" + i, null));

        assertThat(outcomes).filteredOn(Outcome::succeeded).hasSize(1);
        assertThat(outcomes).filteredOn(o -> !o.succeeded())
                .allSatisfy(o -> assertThat(o.failure()).isInstanceOf(ConstraintViolationException.class));
        assertThat(countRows("select count(*) from users")).isEqualTo(1);
    }

    @Test
    @DisplayName("of several racing inserts of one membership pair exactly one succeeds")
    void racingMemberships() throws Exception {
        Long owner = userService.createUser("Owner", "h", null);
        Long room = roomService.createRoom("lobby", owner, null, null);

        List<Outcome> outcomes = race(i -> {
            membershipService.addMembership(room, owner);
            return null;
        });

        assertThat(outcomes).filteredOn(Outcome::succeeded).hasSize(1);
        assertThat(countRows("select count(*) from rooms_users")).isEqualTo(1);
    }

    private List<Outcome> race(IndexedTask task) throws InterruptedException {
        ExecutorService pool = Executors.newFixedThreadPool(THREADS);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<Object>> futures = new ArrayList<>();
            for (int i = 0; i < THREADS; i++) {
                int index = i;
                Callable<Object> call = () -> {
                    start.await();
                    return task.run(index);
                };
                futures.add(pool.submit(call));
            }
            start.countDown();

            List<Outcome> outcomes = new ArrayList<>();
            for (Future<Object> f : futures) {
                try {
                    f.get(30, TimeUnit.SECONDS);
                    outcomes.add(new Outcome(null));
                } catch (ExecutionException e) {
                    outcomes.add(new Outcome(e.getCause()));
                } catch (TimeoutException e) {
                    throw new AssertionError("task did not finish", e);
                }
            }
            return outcomes;
        } finally {
            pool.shutdownNow();
        }
    }

    @FunctionalInterface
    private interface IndexedTask {
        Object run(int index) throws Exception;
    }

    private record Outcome(Throwable failure) {
        boolean succeeded() {
            return failure == null;
        }
    }
}
