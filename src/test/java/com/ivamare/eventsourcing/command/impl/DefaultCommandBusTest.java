package com.ivamare.eventsourcing.command.impl;

import com.ivamare.eventsourcing.command.Command;
import com.ivamare.eventsourcing.command.CommandHandler;
import com.ivamare.eventsourcing.command.middleware.ValidationMiddleware;
import com.ivamare.eventsourcing.exception.HandlerAlreadyRegisteredException;
import com.ivamare.eventsourcing.pipeline.RequestMetadata;
import com.ivamare.eventsourcing.pipeline.Result;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.slf4j.MDC;
import org.springframework.boot.test.system.CapturedOutput;
import org.springframework.boot.test.system.OutputCaptureExtension;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

@ExtendWith(OutputCaptureExtension.class)
class DefaultCommandBusTest {

    private DefaultCommandBus commandBus;

    @BeforeEach
    void setUp() {
        commandBus = new DefaultCommandBus();
    }

    @Nested
    class RegisterTests {

        @Test
        void shouldRegisterHandler() {
            commandBus.register("CreatePortal", () -> command -> "created");

            assertTrue(commandBus.hasHandler("CreatePortal"));
            assertEquals(List.of("CreatePortal"), commandBus.registeredCommandTypes());
        }

        @Test
        void shouldRejectDuplicateRegistration() {
            commandBus.register("CreatePortal", () -> command -> "created");

            assertThrows(HandlerAlreadyRegisteredException.class,
                () -> commandBus.register("CreatePortal", () -> command -> "again"));
        }
    }

    @Nested
    class ExecuteTests {

        @Test
        void shouldReturnHandlerResult() {
            commandBus.register("CreatePortal", () -> command -> Map.of("id", command.data().get("id")));

            Result<Object> result = commandBus.execute(Command.of("CreatePortal", Map.of("id", "p-1")));

            assertTrue(result.success());
            assertEquals(Map.of("id", "p-1"), result.data());
            assertNotNull(result.correlationId());
            assertFalse(result.fromCache());
        }

        @Test
        void shouldKeepProvidedCorrelationId() {
            commandBus.register("CreatePortal", () -> command -> command.correlationId());
            Command command = new Command("CreatePortal", Map.of(),
                RequestMetadata.forActor("u-1").withCorrelationId("corr-1"));

            Result<Object> result = commandBus.execute(command);

            assertEquals("corr-1", result.correlationId());
            assertEquals("corr-1", result.data());
        }

        @Test
        void shouldGenerateCorrelationIdVisibleToHandler() {
            commandBus.register("CreatePortal", () -> command -> command.correlationId());

            Result<Object> result = commandBus.execute(Command.of("CreatePortal", Map.of()));

            assertEquals(result.correlationId(), result.data());
        }

        @Test
        void shouldReturnFailureForUnknownType() {
            Result<Object> result = commandBus.execute(Command.of("Unknown", Map.of()));

            assertTrue(result.isFailure());
            assertEquals("HandlerNotFoundException", result.errorType());
            assertEquals("No handler registered for command: Unknown", result.error());
            assertNotNull(result.timestamp());
        }

        @Test
        void shouldReturnFailureForNullCommand() {
            Result<Object> result = commandBus.execute(null);

            assertTrue(result.isFailure());
            assertEquals("ValidationException", result.errorType());
            assertNotNull(result.timestamp());
        }

        @Test
        void shouldTranslateCheckedHandlerException() {
            CommandHandler failing = command -> {
                throw new IOException("storage offline");
            };
            commandBus.register("CreatePortal", () -> failing);

            Result<Object> result = commandBus.execute(Command.of("CreatePortal", Map.of()));

            assertTrue(result.isFailure());
            assertEquals("storage offline", result.error());
            assertEquals("IOException", result.errorType());
            assertNotNull(result.timestamp());
        }

        @Test
        void shouldLogFailureAtWarnWithCorrelationId(CapturedOutput output) {
            commandBus.register("CreatePortal", () -> command -> {
                throw new IllegalStateException("portal store offline");
            });

            Result<Object> result = commandBus.execute(
                Command.of("CreatePortal", Map.of()).withCorrelationId("corr-42"));

            assertTrue(result.isFailure());
            assertTrue(output.getOut().contains("WARN"));
            assertTrue(output.getOut().contains("Command CreatePortal failed (correlationId=corr-42): portal store offline"));
        }

        @Test
        void shouldExposeCorrelationIdInMdcDuringExecution() {
            AtomicReference<String> seen = new AtomicReference<>();
            commandBus.register("CreatePortal", () -> command -> {
                seen.set(MDC.get("correlationId"));
                return null;
            });

            Result<Object> result = commandBus.execute(Command.of("CreatePortal", Map.of()));

            assertEquals(result.correlationId(), seen.get());
            assertNull(MDC.get("correlationId"));
        }
    }

    @Nested
    class MiddlewareTests {

        @Test
        void shouldRunMiddlewaresInRegistrationOrder() {
            List<String> trace = new ArrayList<>();
            commandBus.use((command, next) -> {
                trace.add("outer");
                return next.proceed();
            });
            commandBus.use((command, next) -> {
                trace.add("inner");
                return next.proceed();
            });
            commandBus.register("CreatePortal", () -> command -> {
                trace.add("handler");
                return null;
            });

            commandBus.execute(Command.of("CreatePortal", Map.of()));

            assertEquals(List.of("outer", "inner", "handler"), trace);
        }

        @Test
        void shouldStopAtValidationFailure() {
            List<String> trace = new ArrayList<>();
            commandBus.use(new ValidationMiddleware()
                .register("CreatePortal", command -> command.data().containsKey("name")
                    ? List.of()
                    : List.of("name is required")));
            commandBus.register("CreatePortal", () -> command -> {
                trace.add("handler");
                return null;
            });

            Result<Object> result = commandBus.execute(Command.of("CreatePortal", Map.of()));

            assertTrue(result.isFailure());
            assertEquals("Invalid CreatePortal: name is required", result.error());
            assertTrue(trace.isEmpty());
        }
    }
}
