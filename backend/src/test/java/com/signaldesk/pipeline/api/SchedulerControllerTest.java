package com.signaldesk.pipeline.api;

import com.signaldesk.pipeline.model.SchedulerStatusResponse;
import com.signaldesk.pipeline.scheduler.ExecutionResult;
import com.signaldesk.pipeline.scheduler.JobAlreadyRunningException;
import com.signaldesk.pipeline.scheduler.JobScheduler;
import com.signaldesk.pipeline.scheduler.SchedulerState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.List;

import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class SchedulerControllerTest {

    @Mock
    private JobScheduler scheduler;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new SchedulerController(scheduler))
            .setControllerAdvice(new SchedulerExceptionHandler())
            .build();
    }

    @Test
    void runningJobReturns409() throws Exception {
        when(scheduler.runOneNow("market-quotes")).thenThrow(new JobAlreadyRunningException("market-quotes"));

        mockMvc.perform(post("/api/scheduler/jobs/market-quotes/run"))
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.error").value("job_already_running"));
    }

    @Test
    void runJobReturnsExecutionResult() throws Exception {
        when(scheduler.runOneNow("insider-trades")).thenReturn(new ExecutionResult(
            "insider-trades", null, null, false, "TransportException: io_error"
        ));

        mockMvc.perform(post("/api/scheduler/jobs/insider-trades/run"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.jobName").value("insider-trades"))
            .andExpect(jsonPath("$.succeeded").value(false))
            .andExpect(jsonPath("$.error").value("TransportException: io_error"));
    }

    @Test
    void startReturnsStatusAfterStarting() throws Exception {
        when(scheduler.status()).thenReturn(new SchedulerStatusResponse(SchedulerState.RUNNING, true, List.of(), List.of()));

        mockMvc.perform(post("/api/scheduler/start"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.state").value("RUNNING"))
            .andExpect(jsonPath("$.demoMode").value(true));

        verify(scheduler).start();
    }
}
