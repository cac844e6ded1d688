package com.shafts.catalog.controller;

import com.shafts.catalog.model.ClubType;
import com.shafts.catalog.model.Flex;
import com.shafts.catalog.model.ShaftKey;
import com.shafts.catalog.model.ShaftSpec;
import com.shafts.catalog.service.core.ShaftCatalog;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.nio.file.Files;
import java.nio.file.Path;

import static com.shafts.catalog.CatalogFixtures.shaft;
import static com.shafts.catalog.CatalogFixtures.ventusBlue;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.hasSize;
import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest(properties = "catalog.snapshot-file=target/test-catalog/catalog.csv")
@AutoConfigureMockMvc
class ShaftControllerTest {

    @Autowired
    private MockMvc mvc;

    @Autowired
    private ShaftCatalog catalog;

    private final ShaftSpec stiff = ventusBlue(Flex.STIFF, 65.0);
    private final ShaftSpec xStiff = ventusBlue(Flex.X_STIFF, 70.0);
    private final ShaftSpec tour = shaft("KBS", "Tour", null, ClubType.IRON, Flex.STIFF, 120.0).build();

    @BeforeEach
    void setUp() {
        catalog.clear();
        catalog.insert(xStiff);
        catalog.insert(tour);
        catalog.insert(stiff);
    }

    @Test
    void listsInCatalogOrder() throws Exception {
        mvc.perform(get("/api/shafts"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(3)))
                .andExpect(jsonPath("$[0].flex").value("Stiff"))
                .andExpect(jsonPath("$[0].club_type").value("woods"))
                .andExpect(jsonPath("$[0].weight_grams").value(65.0))
                .andExpect(jsonPath("$[1].flex").value("X-Stiff"))
                .andExpect(jsonPath("$[2].manufacturer").value("KBS"));
    }

    @Test
    void listAppliesQueryStringFilters() throws Exception {
        mvc.perform(get("/api/shafts").param("flex", "Stiff"))
                .andExpect(jsonPath("$", hasSize(2)));
        mvc.perform(get("/api/shafts").param("club_type", "woods", "iron").param("weight_grams_min", "66"))
                .andExpect(jsonPath("$", hasSize(2)));
        mvc.perform(get("/api/shafts").param("weight_grams_min", "66").param("weight_grams_max", "100"))
                .andExpect(jsonPath("$", hasSize(1)))
                .andExpect(jsonPath("$[0].flex").value("X-Stiff"));
        mvc.perform(get("/api/shafts").param("offset", "1").param("limit", "1"))
                .andExpect(jsonPath("$", hasSize(1)))
                .andExpect(jsonPath("$[0].flex").value("X-Stiff"));
    }

    @Test
    void valueAndBoundsOnSameFieldAreRejected() throws Exception {
        mvc.perform(get("/api/shafts").param("weight_grams", "65").param("weight_grams_min", "70"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_FILTER"));
        mvc.perform(get("/api/shafts").param("weight_grams_min", "70").param("weight_grams", "65"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_FILTER"));
        mvc.perform(get("/api/shafts/export").param("flex", "Stiff", "X-Stiff").param("flex_max", "3"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void searchAcceptsStructuredFilters() throws Exception {
        mvc.perform(post("/api/shafts/search")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"parameters": {"flex": ["Stiff", "X-Stiff"],
                                                "weight_grams": {"min": 60, "max": 80}},
                                 "limit": 10}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(2)));
    }

    @Test
    void invalidFilterIsBadRequest() throws Exception {
        mvc.perform(post("/api/shafts/search")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"parameters\": {\"colour\": \"red\"}}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_FILTER"));
        mvc.perform(get("/api/shafts").param("limit", "501"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void lookupByKey() throws Exception {
        mvc.perform(get("/api/shafts/lookup")
                        .param("manufacturer", "Fujikura").param("model", "Ventus Blue").param("generation", "TR")
                        .param("club_type", "woods").param("flex", "X-Stiff"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.weight_grams").value(70.0))
                .andExpect(jsonPath("$.launch").value("Mid"));
    }

    @Test
    void lookupOfAbsentKeyIsNotFound() throws Exception {
        mvc.perform(get("/api/shafts/lookup")
                        .param("manufacturer", "Fujikura").param("model", "Ventus Blue")
                        .param("club_type", "woods").param("flex", "Stiff"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("NOT_FOUND"));
        mvc.perform(get("/api/shafts/lookup")
                        .param("manufacturer", "Fujikura").param("model", "Ventus Blue")
                        .param("club_type", "woods").param("flex", "S"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void textSearchStatsAndProgression() throws Exception {
        mvc.perform(get("/api/shafts/text-search").param("q", "ventus"))
                .andExpect(jsonPath("$", hasSize(2)));
        mvc.perform(get("/api/shafts/stats"))
                .andExpect(jsonPath("$.total_shafts").value(3))
                .andExpect(jsonPath("$.flex_distribution.Stiff").value(2))
                .andExpect(jsonPath("$.weight_range.max").value(120.0))
                .andExpect(jsonPath("$.launch_distribution.Mid").value(2));
        mvc.perform(get("/api/shafts/progression").param("manufacturer", "Fujikura").param("model", "Ventus Blue"))
                .andExpect(jsonPath("$[0].flex").value("Stiff"))
                .andExpect(jsonPath("$[1].flex").value("X-Stiff"));
        mvc.perform(get("/api/manufacturers"))
                .andExpect(jsonPath("$", hasSize(2)))
                .andExpect(jsonPath("$[0]").value("Fujikura"));
    }

    @Test
    void exportsCsvAndJson() throws Exception {
        mvc.perform(get("/api/shafts/export").param("manufacturer", "KBS"))
                .andExpect(status().isOk())
                .andExpect(content().contentTypeCompatibleWith("text/csv"))
                .andExpect(header().string(HttpHeaders.CONTENT_DISPOSITION, containsString("shafts.csv")))
                .andExpect(content().string(containsString("\"KBS\",\"Tour\"")));
        mvc.perform(get("/api/shafts/export").param("format", "json"))
                .andExpect(status().isOk())
                .andExpect(content().contentTypeCompatibleWith(MediaType.APPLICATION_JSON))
                .andExpect(jsonPath("$", hasSize(3)));
        mvc.perform(get("/api/shafts/export").param("format", "xml"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void replaceCorrectsRecord() throws Exception {
        mvc.perform(put("/api/shafts")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(replaceBody("Stiff", 66.5)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.weight_grams").value(66.5));

        assertEquals(66.5, catalog.get(stiff.key()).weightGrams());
    }

    @Test
    void replaceWithInvalidRecordIsUnprocessable() throws Exception {
        mvc.perform(put("/api/shafts")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(replaceBody("Stiff", 320.0)))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.code").value("OUT_OF_RANGE_VALUE"))
                .andExpect(jsonPath("$.field").value("weight_grams"));
    }

    @Test
    void replaceOntoExistingKeyIsConflict() throws Exception {
        mvc.perform(put("/api/shafts")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(replaceBody("X-Stiff", 66.0)))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("DUPLICATE_KEY"));
    }

    @Test
    void deleteRemovesRecord() throws Exception {
        mvc.perform(delete("/api/shafts")
                        .param("manufacturer", "KBS").param("model", "Tour")
                        .param("club_type", "iron").param("flex", "Stiff"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.model").value("Tour"));

        assertFalse(catalog.contains(new ShaftKey("KBS", "Tour", null, ClubType.IRON, Flex.STIFF)));

        mvc.perform(delete("/api/shafts")
                        .param("manufacturer", "KBS").param("model", "Tour")
                        .param("club_type", "iron").param("flex", "Stiff"))
                .andExpect(status().isNotFound());
    }

    @Test
    void snapshotWritesConfiguredFile() throws Exception {
        Path file = Path.of("target/test-catalog/catalog.csv");
        Files.deleteIfExists(file);

        mvc.perform(post("/api/shafts/snapshot"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.saved").value(3));

        assertTrue(Files.exists(file));
        Files.delete(file);
    }

    private static String replaceBody(final String newFlex, final double weight) {
        return """
                {"key": {"manufacturer": "Fujikura", "model": "Ventus Blue", "generation": "TR",
                         "club_type": "woods", "flex": "Stiff"},
                 "shaft": {"manufacturer": "Fujikura", "model": "Ventus Blue", "generation": "TR",
                           "club_type": "woods", "flex": "%s", "weight_grams": %s,
                           "length_inches": 46.0, "launch": "Mid"}}
                """.formatted(newFlex, weight);
    }
}
