package com.cuttlefish.backend.service;

import com.cuttlefish.backend.config.PredictionProperties;
import com.cuttlefish.backend.exception.TradeRejectedException;
import com.cuttlefish.backend.exception.UnauthorizedActorException;
import com.cuttlefish.backend.model.Capability;
import com.cuttlefish.backend.model.RejectReason;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class UpkeepSchedulerTest {

    @Mock
    private PredictionLifecycle lifecycle;

    private final PredictionProperties properties = new PredictionProperties();
    private UpkeepScheduler scheduler;

    @BeforeEach
    void setUp() {
        properties.setKeeperActor("keeper-bot");
        scheduler = new UpkeepScheduler(lifecycle, properties);
    }

    @Test
    void firesUpkeepAsKeeperWhenDue() {
        when(lifecycle.checkUpkeep()).thenReturn(PredictionLifecycle.UpkeepCheck.needed());

        scheduler.poll();

        InOrder order = inOrder(lifecycle);
        order.verify(lifecycle).detectStalePending();
        order.verify(lifecycle).checkUpkeep();
        order.verify(lifecycle).performUpkeep("keeper-bot");
    }

    @Test
    void skipsUpkeepWhenNotDue() {
        when(lifecycle.checkUpkeep())
                .thenReturn(PredictionLifecycle.UpkeepCheck.notNeeded("Prediction interval not elapsed"));

        scheduler.poll();

        verify(lifecycle).detectStalePending();
        verify(lifecycle, never()).performUpkeep(anyString());
    }

    @Test
    void keeperWithoutGrantDoesNotBreakThePoll() {
        when(lifecycle.checkUpkeep()).thenReturn(PredictionLifecycle.UpkeepCheck.needed());
        when(lifecycle.performUpkeep("keeper-bot"))
                .thenThrow(new UnauthorizedActorException("keeper-bot", Capability.KEEPER));

        assertThatCode(scheduler::poll).doesNotThrowAnyException();
    }

    @Test
    void rejectedUpkeepDoesNotBreakThePoll() {
        when(lifecycle.checkUpkeep()).thenReturn(PredictionLifecycle.UpkeepCheck.needed());
        when(lifecycle.performUpkeep("keeper-bot"))
                .thenThrow(new TradeRejectedException(RejectReason.PENDING_REQUEST_EXISTS));

        assertThatCode(scheduler::poll).doesNotThrowAnyException();
    }
}
