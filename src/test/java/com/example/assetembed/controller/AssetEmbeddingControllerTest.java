package com.example.assetembed.controller;

import com.example.assetembed.model.BatchPageResult;
import com.example.assetembed.model.BatchRequest;
import com.example.assetembed.model.EmbeddingTask;
import com.example.assetembed.service.AssetEmbeddingService;
import com.example.assetembed.service.AssetProfiler;
import com.example.assetembed.service.DecisionEngine;
import com.example.assetembed.service.DocumentMutator;
import com.example.assetembed.service.EmbeddingManager;
import com.example.assetembed.service.EmbeddingReporter;
import com.example.assetembed.service.EmbeddingRequestMapper;
import com.example.assetembed.service.ReferenceExtractor;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.Collections;

import static org.hamcrest.Matchers.containsString;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(controllers = AssetEmbeddingController.class)
@Import({AssetEmbeddingService.class, ReferenceExtractor.class, AssetProfiler.class, DecisionEngine.class,
        DocumentMutator.class, EmbeddingReporter.class, EmbeddingRequestMapper.class})
class AssetEmbeddingControllerTest {

    @Autowired
    private MockMvc mvc;

    @MockBean
    private EmbeddingManager embeddingManager;

    @Test
    void processInlinesASmallImage() throws Exception {
        String body = "{\"html\":\"<img src=\\\"/a.png\\\">\",\"assets\":{\"/a.png\":\"AAEC\"}}";

        mvc.perform(post("/api/asset-embedding/process").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.result.html").value(containsString("data:image/png;base64,AAEC")))
                .andExpect(jsonPath("$.result.decisions[0].assetPath").value("/a.png"))
                .andExpect(jsonPath("$.result.decisions[0].decision").value("inline-base64"))
                .andExpect(jsonPath("$.result.stats.inlined").value(1))
                .andExpect(jsonPath("$.result.recommendations[0]").value("Saved 1 HTTP requests by inlining small assets"));
    }

    @Test
    void optionsInTheRequestOverrideDefaults() throws Exception {
        String body = "{\"html\":\"<img src=\\\"/a.png\\\">\",\"assets\":{\"/a.png\":\"AAEC\"},"
                + "\"options\":{\"enableBase64\":false}}";

        mvc.perform(post("/api/asset-embedding/process").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.result.decisions[0].decision").value("external"));
    }

    @Test
    void missingHtmlIsRejected() throws Exception {
        mvc.perform(post("/api/asset-embedding/process").contentType(MediaType.APPLICATION_JSON).content("{\"assets\":{}}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.error").value("HTML content is required"));
    }

    @Test
    void missingAssetsAreRejected() throws Exception {
        mvc.perform(post("/api/asset-embedding/analyze").contentType(MediaType.APPLICATION_JSON).content("{\"html\":\"<p>x</p>\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value(containsString("Assets object is required")));
    }

    @Test
    void invalidBase64NamesTheAsset() throws Exception {
        String body = "{\"html\":\"<img src=\\\"/a.png\\\">\",\"assets\":{\"/a.png\":\"not base64!!\"}}";

        mvc.perform(post("/api/asset-embedding/process").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.assetPath").value("/a.png"));
    }

    @Test
    void malformedJsonIsABadRequest() throws Exception {
        mvc.perform(post("/api/asset-embedding/stats").contentType(MediaType.APPLICATION_JSON).content("{\"html\":"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.success").value(false));
    }

    @Test
    void thresholdsForHttp2AreHalved() throws Exception {
        mvc.perform(get("/api/asset-embedding/calculate-thresholds").param("http2", "true"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.http2").value(true))
                .andExpect(jsonPath("$.thresholds.imageThreshold").value(4096))
                .andExpect(jsonPath("$.formatted.imageThreshold").value("4.00KB"));

        mvc.perform(get("/api/asset-embedding/calculate-thresholds"))
                .andExpect(jsonPath("$.http2").value(false))
                .andExpect(jsonPath("$.thresholds.fontThreshold").value(50000));
    }

    @Test
    void decisionPreviewCountsEveryKind() throws Exception {
        String body = "{\"html\":\"<img src=\\\"/a.png\\\"><img src=\\\"/b.svg\\\">\","
                + "\"assets\":{\"/a.png\":\"AAEC\",\"/b.svg\":\"PHN2Zy8+\"}}";

        mvc.perform(post("/api/asset-embedding/decision-preview").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.preview.totalAssets").value(2))
                .andExpect(jsonPath("$.preview.decisionCounts['inline-base64']").value(1))
                .andExpect(jsonPath("$.preview.decisionCounts['inline-svg']").value(1))
                .andExpect(jsonPath("$.preview.decisionCounts.external").value(0))
                .andExpect(jsonPath("$.preview.decisions[0].isCritical").value(true))
                .andExpect(jsonPath("$.preview.decisions[0].sizeFormatted").value("3B"));
    }

    @Test
    void batchProcessSummarisesPageResults() throws Exception {
        when(embeddingManager.runBatch(any(BatchRequest.class)))
                .thenReturn(Collections.singletonList(BatchPageResult.failed("home", "Missing HTML or assets")));

        mvc.perform(post("/api/asset-embedding/batch-process").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"pages\":[{\"name\":\"home\"}]}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.summary.total").value(1))
                .andExpect(jsonPath("$.summary.successful").value(0))
                .andExpect(jsonPath("$.summary.failed").value(1))
                .andExpect(jsonPath("$.results[0].error").value("Missing HTML or assets"));
    }

    @Test
    void asyncBatchReturnsTheTaskId() throws Exception {
        EmbeddingTask task = new EmbeddingTask(new BatchRequest());
        when(embeddingManager.submit(any(BatchRequest.class))).thenReturn(task);

        mvc.perform(post("/api/asset-embedding/batch/async").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"pages\":[{\"name\":\"home\",\"html\":\"<p/>\",\"assets\":{}}]}"))
                .andExpect(status().isOk())
                .andExpect(content().string(task.getId()));
    }

    @Test
    void asyncBatchWithoutPagesIsRejected() throws Exception {
        mvc.perform(post("/api/asset-embedding/batch/async").contentType(MediaType.APPLICATION_JSON).content("{\"pages\":[]}"))
                .andExpect(status().isBadRequest());
        verify(embeddingManager, never()).submit(any(BatchRequest.class));
    }

    @Test
    void unknownTaskIsNotFound() throws Exception {
        mvc.perform(get("/api/asset-embedding/tasks/missing"))
                .andExpect(status().isNotFound())
                .andExpect(content().string("Task not found"));

        mvc.perform(post("/api/asset-embedding/tasks/missing/cancel"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.success").value(false));
    }
}
