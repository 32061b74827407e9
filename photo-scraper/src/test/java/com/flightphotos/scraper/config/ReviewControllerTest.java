package com.flightphotos.scraper.config;

import com.flightphotos.scraper.model.CandidatePhoto;
import com.flightphotos.scraper.model.ReviewState;
import com.flightphotos.scraper.review.ReviewQueueService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.NoSuchElementException;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(ReviewController.class)
class ReviewControllerTest {

    @Autowired
    private MockMvc mvc;

    @MockBean
    private ReviewQueueService reviewService;

    @Test
    void queueIsListed() throws Exception {
        when(reviewService.queue()).thenReturn(List.of(CandidatePhoto.builder()
                .id(7L).source("jetphotos").sourcePhotoId("1001").score(100).build()));

        mvc.perform(get("/review/queue"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].id").value(7))
                .andExpect(jsonPath("$[0].reviewState").value("PENDING"));
    }

    @Test
    void approveTakesAnOptionalComment() throws Exception {
        when(reviewService.approve(eq(7L), any())).thenReturn(CandidatePhoto.builder()
                .id(7L).reviewState(ReviewState.APPROVED).reviewComment("nice").build());

        mvc.perform(post("/review/7/approve")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"comment\":\"nice\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.reviewState").value("APPROVED"));
        verify(reviewService).approve(7L, "nice");

        mvc.perform(post("/review/7/approve")).andExpect(status().isOk());
    }

    @Test
    void secondDecisionIsAConflict() throws Exception {
        when(reviewService.reject(eq(7L), any()))
                .thenThrow(new IllegalStateException("Candidate 7 is APPROVED, cannot move to REJECTED"));

        mvc.perform(post("/review/7/reject"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("Candidate 7 is APPROVED, cannot move to REJECTED"));
    }

    @Test
    void unknownCandidateIsNotFound() throws Exception {
        when(reviewService.position(99L)).thenThrow(new NoSuchElementException("No candidate photo 99"));

        mvc.perform(get("/review/99")).andExpect(status().isNotFound());
    }

    @Test
    void deleteReportsTheId() throws Exception {
        mvc.perform(delete("/review/7"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("deleted"));
        verify(reviewService).delete(7L);
    }
}
