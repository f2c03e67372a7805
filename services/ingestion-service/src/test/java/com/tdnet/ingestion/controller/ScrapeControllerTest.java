package com.tdnet.ingestion.controller;

import static org.hamcrest.Matchers.startsWith;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.verify;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.tdnet.common.storage.LayoutMode;
import com.tdnet.ingestion.config.ScraperProperties;
import com.tdnet.ingestion.domain.ScrapeRun;
import com.tdnet.ingestion.service.ScrapeRunService;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

/**
 * WebMvc tests for the scrape trigger endpoints and their error mapping.
 */
@WebMvcTest(controllers = {ScrapeController.class, HealthController.class})
@Import({ApiExceptionHandler.class, ScrapeControllerTest.PropertiesConfig.class})
class ScrapeControllerTest {

    @TestConfiguration
    @EnableConfigurationProperties(ScraperProperties.class)
    static class PropertiesConfig {
    }

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private ScrapeRunService scrapeRunService;

    /**
     * A date range expands to every day in between and the configured layout is used by default.
     *
     * @throws Exception when the mock request fails
     */
    @Test
    void rangeRunIsAccepted() throws Exception {
        UUID runId = UUID.randomUUID();
        given(scrapeRunService.startRun(List.of("20240101", "20240102", "20240103"), LayoutMode.DATE))
            .willReturn(runId);

        mockMvc.perform(post("/v1/scrape/run")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"startDate\":\"20240101\",\"endDate\":\"20240103\"}"))
            .andExpect(status().isAccepted())
            .andExpect(jsonPath("$.runId").value(runId.toString()));
    }

    @Test
    void singleDateWithLayout() throws Exception {
        given(scrapeRunService.startRun(List.of("20240105"), LayoutMode.SECTOR)).willReturn(UUID.randomUUID());

        mockMvc.perform(post("/v1/scrape/run")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"date\":\"20240105\",\"layout\":\"SECTOR\"}"))
            .andExpect(status().isAccepted());

        verify(scrapeRunService).startRun(eq(List.of("20240105")), eq(LayoutMode.SECTOR));
    }

    /**
     * Malformed dates and ambiguous selections are rejected before any run starts.
     *
     * @throws Exception when the mock request fails
     */
    @Test
    void invalidSelectionIsBadRequest() throws Exception {
        mockMvc.perform(post("/v1/scrape/run")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"date\":\"2024-01-05\"}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("validation_error"));

        mockMvc.perform(post("/v1/scrape/run")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"date\":\"20240105\",\"startDate\":\"20240101\"}"))
            .andExpect(status().isBadRequest());
    }

    @Test
    void reversedRangeIsBadRequest() throws Exception {
        mockMvc.perform(post("/v1/scrape/run")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"startDate\":\"20240105\",\"endDate\":\"20240101\"}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("bad_request"));
    }

    @Test
    void runViewIsReturned() throws Exception {
        ScrapeRun run = new ScrapeRun(UUID.randomUUID(), List.of("20240101"));
        run.start();
        run.recordDate("20240101", 4);
        run.addDiscovered(4);
        run.addTransferred(4, 0);
        run.complete();
        given(scrapeRunService.getRun(run.getRunId())).willReturn(Optional.of(run));

        mockMvc.perform(get("/v1/scrape/runs/{runId}", run.getRunId()))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("SUCCEEDED"))
            .andExpect(jsonPath("$.savedByDate['20240101']").value(4))
            .andExpect(jsonPath("$.succeededCount").value(4));
    }

    @Test
    void unknownRunIsBadRequest() throws Exception {
        given(scrapeRunService.getRun(any())).willReturn(Optional.empty());

        mockMvc.perform(get("/v1/scrape/runs/{runId}", UUID.randomUUID()))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.message").value(startsWith("Run not found")));
    }

    @Test
    void healthIsOk() throws Exception {
        mockMvc.perform(get("/health"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("ok"));
    }
}
