package com.immowatch.backend.listing.controller;

import com.immowatch.backend.listing.dto.IngestionResultDTO;
import com.immowatch.backend.listing.service.ListingIngestionService;
import com.immowatch.backend.model.enums.MockDataMode;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(ListingController.class)
class ListingControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private ListingIngestionService ingestionService;

    @Test
    void testIngestListings() throws Exception {
        when(ingestionService.upsertListings(anyList())).thenReturn(new IngestionResultDTO(2, 1, 1, List.of()));

        mockMvc.perform(post("/api/listings")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("[{\"source\":\"seloger\",\"url\":\"https://www.seloger.com/annonces/1.htm\",\"title\":\"T2\"},"
                                + "{\"source\":\"leboncoin\",\"url\":\"https://www.leboncoin.fr/ventes_immobilieres/1.htm\"}]"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.result.inserted").value(1))
                .andExpect(jsonPath("$.result.updated").value(1));
    }

    @Test
    void testIngestionFailureIsServerError() throws Exception {
        when(ingestionService.upsertListings(anyList())).thenThrow(new IllegalStateException("disk full"));

        mockMvc.perform(post("/api/listings")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("[]"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.message").value("disk full"));
    }

    @Test
    void testSeedMockListings() throws Exception {
        when(ingestionService.seedMockListings(MockDataMode.ENHANCED, 120, 0.5, 7L))
                .thenReturn(new IngestionResultDTO(128, 128, 0, List.of()));

        mockMvc.perform(post("/api/listings/mock")
                        .param("total", "120")
                        .param("duplicateRatio", "0.5")
                        .param("seed", "7"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.result.received").value(128));

        verify(ingestionService).seedMockListings(MockDataMode.ENHANCED, 120, 0.5, 7L);
    }

    @Test
    void testSeedExactMockListings() throws Exception {
        when(ingestionService.seedMockListings(MockDataMode.EXACT, 300, 0.4, 42L))
                .thenReturn(new IngestionResultDTO(428, 428, 0, List.of()));

        mockMvc.perform(post("/api/listings/mock").param("mode", "Exact"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.result.inserted").value(428));

        verify(ingestionService).seedMockListings(MockDataMode.EXACT, 300, 0.4, 42L);
    }

    @Test
    void testUnknownMockModeIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/listings/mock").param("mode", "shuffled"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Unknown mock mode"));

        verifyNoInteractions(ingestionService);
    }

    @Test
    void testStats() throws Exception {
        when(ingestionService.getListingStats()).thenReturn(Map.of("totalListings", 5L, "seloger", 3L, "leboncoin", 2L));

        mockMvc.perform(get("/api/listings/stats"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.seloger").value(3));
    }

    @Test
    void testClearListings() throws Exception {
        when(ingestionService.clear()).thenReturn(4L);

        mockMvc.perform(delete("/api/listings"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.removed").value(4));
    }
}
