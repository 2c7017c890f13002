package com.ivamare.modulebus.registry;

import com.ivamare.modulebus.exception.DuplicateMessageTypeException;
import com.ivamare.modulebus.exception.UnknownMessageTypeException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("DefaultMessageTypeRegistry")
class DefaultMessageTypeRegistryTest {

    private DefaultMessageTypeRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new DefaultMessageTypeRegistry();
    }

    @Nested
    @DisplayName("Built-in types")
    class BuiltInTests {

        @Test
        @DisplayName("should contain every built-in type")
        void shouldContainEveryBuiltInType() {
            for (String type : MessageTypes.BUILT_IN) {
                assertTrue(registry.isRegistered(type), type);
            }
            assertEquals(11, registry.registeredTypes().size());
        }

        @Test
        @DisplayName("should reject re-registering a built-in type")
        void shouldRejectReRegisteringBuiltIn() {
            assertThrows(DuplicateMessageTypeException.class, () -> registry.register(MessageTypes.START));
        }

        @Test
        @DisplayName("should start empty when seeded with no types")
        void shouldStartEmptyWhenSeededWithNoTypes() {
            DefaultMessageTypeRegistry empty = new DefaultMessageTypeRegistry(List.of());

            assertTrue(empty.registeredTypes().isEmpty());
            assertFalse(empty.isRegistered(MessageTypes.SYNC));
        }

        @Test
        @DisplayName("should share one process-wide registry")
        void shouldShareOneGlobalRegistry() {
            assertSame(MessageTypes.global(), MessageTypes.global());
            assertTrue(MessageTypes.global().isRegistered(MessageTypes.SYNC));
        }
    }

    @Nested
    @DisplayName("Registration")
    class RegistrationTests {

        @Test
        @DisplayName("should register new type")
        void shouldRegisterNewType() {
            registry.register("new frame");

            assertTrue(registry.isRegistered("new frame"));
        }

        @Test
        @DisplayName("should throw on strict duplicate registration")
        void shouldThrowOnStrictDuplicate() {
            registry.register("new frame");

            DuplicateMessageTypeException exception = assertThrows(
                DuplicateMessageTypeException.class,
                () -> registry.register("new frame", true));

            assertEquals("new frame", exception.getMessageType());
            assertEquals("Message type 'new frame' already exists", exception.getMessage());
        }

        @Test
        @DisplayName("should accept non-strict duplicate registration")
        void shouldAcceptNonStrictDuplicate() {
            registry.register("new frame");

            assertDoesNotThrow(() -> registry.register("new frame", false));
            assertEquals(1, registry.registeredTypes().stream().filter("new frame"::equals).count());
        }

        @Test
        @DisplayName("should reject blank names")
        void shouldRejectBlankNames() {
            assertThrows(IllegalArgumentException.class, () -> registry.register(" "));
            assertThrows(IllegalArgumentException.class, () -> registry.register(null, false));
        }

        @Test
        @DisplayName("should list types sorted")
        void shouldListTypesSorted() {
            DefaultMessageTypeRegistry custom = new DefaultMessageTypeRegistry(List.of("zoom", "align"));
            custom.register("focus");

            assertEquals(List.of("align", "focus", "zoom"), custom.registeredTypes());
        }

        @Test
        @DisplayName("should let exactly one concurrent strict registration win")
        void shouldLetExactlyOneConcurrentRegistrationWin() throws Exception {
            int threads = 16;
            AtomicInteger successes = new AtomicInteger();
            AtomicInteger duplicates = new AtomicInteger();
            CountDownLatch start = new CountDownLatch(1);
            CountDownLatch finished = new CountDownLatch(threads);
            ExecutorService executor = Executors.newFixedThreadPool(threads);
            try {
                for (int i = 0; i < threads; i++) {
                    executor.execute(() -> {
                        try {
                            start.await();
                            registry.register("joystick", true);
                            successes.incrementAndGet();
                        } catch (DuplicateMessageTypeException e) {
                            duplicates.incrementAndGet();
                        } catch (InterruptedException e) {
                            Thread.currentThread().interrupt();
                        } finally {
                            finished.countDown();
                        }
                    });
                }
                start.countDown();
                assertTrue(finished.await(10, TimeUnit.SECONDS));
            } finally {
                executor.shutdownNow();
            }

            assertEquals(1, successes.get());
            assertEquals(threads - 1, duplicates.get());
        }
    }

    @Nested
    @DisplayName("Lookup")
    class LookupTests {

        @Test
        @DisplayName("should not find unknown or null types")
        void shouldNotFindUnknownTypes() {
            assertFalse(registry.isRegistered("strat"));
            assertFalse(registry.isRegistered(null));
        }

        @Test
        @DisplayName("should throw for unknown type on require")
        void shouldThrowForUnknownTypeOnRequire() {
            UnknownMessageTypeException exception = assertThrows(
                UnknownMessageTypeException.class,
                () -> registry.requireRegistered("strat"));

            assertEquals("strat", exception.getMessageType());
            assertEquals("Invalid message type 'strat'", exception.getMessage());
        }

        @Test
        @DisplayName("should pass require for registered type")
        void shouldPassRequireForRegisteredType() {
            assertDoesNotThrow(() -> registry.requireRegistered(MessageTypes.CONFIGURE1));
        }
    }
}
