package com.ai.codescope.controller;

import com.ai.codescope.exception.DeadlineExceededException;
import com.ai.codescope.model.Deadline;
import com.ai.codescope.model.RepositorySnapshot;
import com.ai.codescope.service.ContentGrepService;
import com.ai.codescope.service.FindService;
import com.ai.codescope.service.PathFilter;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * A scan that runs past its deadline fails the whole request with 504 and no partial list.
 */
@SpringBootTest(properties = "codescope.root=src/test/resources/fixtures/basic")
@AutoConfigureMockMvc
public class ScanDeadlineResponseTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private ContentGrepService grepService;

    @MockBean
    private FindService findService;

    @Test
    void testGrepPastDeadline_GatewayTimeout() throws Exception {
        when(grepService.grep(any(RepositorySnapshot.class), anyList(), any(), anyInt(), anyInt(),
                any(Deadline.class)))
                .thenThrow(new DeadlineExceededException("grep scan timed out after 10000ms"));

        mockMvc.perform(get("/api/grep").param("q", "config"))
                .andExpect(status().isGatewayTimeout())
                .andExpect(jsonPath("$.status").value(504))
                .andExpect(jsonPath("$.code").value("DEADLINE_EXCEEDED"))
                .andExpect(jsonPath("$.path").value("/api/grep"))
                .andExpect(jsonPath("$.matches").doesNotExist())
                .andExpect(jsonPath("$.totalMatches").doesNotExist());
    }

    @Test
    void testFindPastDeadline_GatewayTimeout() throws Exception {
        when(findService.find(any(RepositorySnapshot.class), any(), anyInt(), any(PathFilter.class),
                any(Deadline.class)))
                .thenThrow(new DeadlineExceededException("find scan timed out after 10000ms"));

        mockMvc.perform(get("/api/find").param("q", "main"))
                .andExpect(status().isGatewayTimeout())
                .andExpect(jsonPath("$.code").value("DEADLINE_EXCEEDED"))
                .andExpect(jsonPath("$.results").doesNotExist());
    }
}
