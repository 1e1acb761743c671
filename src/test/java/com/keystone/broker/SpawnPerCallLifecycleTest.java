package com.keystone.broker;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class SpawnPerCallLifecycleTest {

    private final ToolServerConfig config = ToolServerConfig.local("shell", "shell");

    @Test
    @DisplayName("every call opens and closes its own connection")
    void freshConnectionPerCall() {
        AtomicInteger opened = new AtomicInteger();
        ToolConnection first = mock(ToolConnection.class);
        ToolConnection second = mock(ToolConnection.class);
        var lifecycle = new SpawnPerCallLifecycle(c -> opened.incrementAndGet() == 1 ? first : second);

        assertSame(first, lifecycle.withConnection(config, conn -> conn));
        assertSame(second, lifecycle.withConnection(config, conn -> conn));

        assertEquals(2, opened.get());
        verify(first).close();
        verify(second).close();
    }

    @Test
    @DisplayName("the connection is closed even when the call fails")
    void closesOnFailure() {
        ToolConnection connection = mock(ToolConnection.class);
        var lifecycle = new SpawnPerCallLifecycle(c -> connection);

        assertThrows(ToolException.class, () -> lifecycle.withConnection(config, conn -> {
            throw new ToolException(ToolErrorKind.REMOTE_ERROR, "crashed");
        }));

        verify(connection).close();
    }
}
