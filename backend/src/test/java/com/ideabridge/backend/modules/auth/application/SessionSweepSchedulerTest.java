package com.ideabridge.backend.modules.auth.application;

import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class SessionSweepSchedulerTest {

    @Mock
    private SessionStore sessionStore;

    @InjectMocks
    private SessionSweepScheduler scheduler;

    @Test
    void sweepDelegatesToSessionStore() {
        when(sessionStore.sweepExpired()).thenReturn(4);

        scheduler.sweepExpiredSessions();

        verify(sessionStore).sweepExpired();
    }
}
