package com.delta.urlscout.crawl.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.mockwebserver.Dispatcher;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import org.springframework.web.context.WebApplicationContext;

import static org.hamcrest.Matchers.containsString;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@ActiveProfiles("test")
class DiscoveryApiSmokeTest {

    @Autowired
    private WebApplicationContext context;

    @Autowired
    private ObjectMapper objectMapper;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        this.mockMvc = MockMvcBuilders.webAppContextSetup(context).build();
    }

    @Test
    void runsEndpointIsPostOnly() throws Exception {
        mockMvc.perform(get("/api/discovery/runs"))
            .andExpect(status().isMethodNotAllowed());
    }

    @Test
    void blankBaseUrlIsRejected() throws Exception {
        mockMvc.perform(post("/api/discovery/runs")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"baseUrl\":\"  \"}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("invalid_discovery_request"));
    }

    @Test
    void nonHttpBaseUrlIsRejected() throws Exception {
        mockMvc.perform(post("/api/discovery/runs")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"baseUrl\":\"ftp://example.com/files\"}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("invalid_discovery_request"));
    }

    @Test
    void unknownPhaseIsRejected() throws Exception {
        mockMvc.perform(post("/api/discovery/runs")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"baseUrl\":\"https://example.com/\",\"phases\":[\"teleportation\"]}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.message", containsString("teleportation")));
    }

    @Test
    void unknownRunIsNotFound() throws Exception {
        mockMvc.perform(get("/api/discovery/runs/does-not-exist"))
            .andExpect(status().isNotFound());
        mockMvc.perform(get("/api/discovery/runs/does-not-exist/result"))
            .andExpect(status().isNotFound());
        mockMvc.perform(post("/api/discovery/runs/does-not-exist/cancel"))
            .andExpect(status().isNotFound());
    }

    @Test
    void startedRunCompletesAndExposesItsResult() throws Exception {
        try (MockWebServer server = new MockWebServer()) {
            server.setDispatcher(new Dispatcher() {
                @Override
                public MockResponse dispatch(RecordedRequest request) {
                    if ("/".equals(request.getPath())) {
                        return html("<a href=\"/about\">About</a><a href=\"/contact\">Contact</a>");
                    }
                    if ("/about".equals(request.getPath()) || "/contact".equals(request.getPath())) {
                        return html("<p>nothing else here</p>");
                    }
                    return new MockResponse().setResponseCode(404);
                }
            });
            server.start();

            MvcResult started = mockMvc.perform(post("/api/discovery/runs")
                    .contentType(MediaType.APPLICATION_JSON)
                    .content("{\"baseUrl\":\"" + server.url("/") + "\",\"maxPages\":50,\"phases\":[\"recursive_crawl\"]}"))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.runId").isNotEmpty())
                .andReturn();
            String runId = objectMapper.readTree(started.getResponse().getContentAsString()).path("runId").asText();

            JsonNode runStatus = null;
            for (int attempt = 0; attempt < 100; attempt++) {
                MvcResult polled = mockMvc.perform(get("/api/discovery/runs/" + runId))
                    .andExpect(status().isOk())
                    .andReturn();
                runStatus = objectMapper.readTree(polled.getResponse().getContentAsString());
                if ("COMPLETED".equals(runStatus.path("state").asText()) && !runStatus.path("finishedAt").isNull()) {
                    break;
                }
                Thread.sleep(100);
            }
            assertEquals("COMPLETED", runStatus.path("state").asText());

            MvcResult result = mockMvc.perform(get("/api/discovery/runs/" + runId + "/result"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalUrls").value(3))
                .andExpect(jsonPath("$.terminationReason").value("completed"))
                .andReturn();
            String body = result.getResponse().getContentAsString();
            assertTrue(body.contains("/about"));
            assertTrue(body.contains("/contact"));
        }
    }

    private static MockResponse html(String body) {
        return new MockResponse()
            .setHeader("Content-Type", "text/html")
            .setBody("<html><head><title>Page</title></head><body>" + body + "</body></html>");
    }
}
