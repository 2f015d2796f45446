package com.jimin.digest.controller;

import com.jimin.digest.core.access.Tier;
import com.jimin.digest.entity.UserSubscription;
import com.jimin.digest.repository.UserSubscriptionRepository;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import java.time.LocalDateTime;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class ItemControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private UserSubscriptionRepository subscriptionRepository;

    @BeforeEach
    void setUp() {
        UserSubscription premium = new UserSubscription();
        premium.setUserId("premium-user");
        premium.setTier(Tier.PREMIUM);
        premium.setUpdatedAt(LocalDateTime.now());
        subscriptionRepository.save(premium);
    }

    @AfterEach
    void tearDown() {
        subscriptionRepository.deleteAll();
    }

    @Test
    void freeUserCannotSearchAllDigests() throws Exception {
        mockMvc.perform(get("/api/items")
                        .param("scope", "all_digests")
                        .header(ApiHeaders.USER_ID, "nobody"))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.code").value("TIER_INSUFFICIENT"))
                .andExpect(jsonPath("$.details.requiredTier").value("premium"))
                .andExpect(jsonPath("$.details.currentTier").value("free"))
                .andExpect(jsonPath("$.details.upgradeRequired").value(true));
    }

    @Test
    void premiumUserCannotSearchFolders() throws Exception {
        mockMvc.perform(get("/api/items")
                        .param("scope", "folder")
                        .param("folderId", "1")
                        .header(ApiHeaders.USER_ID, "premium-user"))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.details.requiredTier").value("pro"));
    }

    @Test
    void premiumUserSearchesAllDigests() throws Exception {
        mockMvc.perform(get("/api/items")
                        .param("scope", "all_digests")
                        .param("sort", "recency-desc")
                        .header(ApiHeaders.USER_ID, "premium-user"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$").isArray());
    }

    @Test
    void premiumUserCannotRemoveFolderMembership() throws Exception {
        mockMvc.perform(delete("/api/folders/1/items/some-item")
                        .header(ApiHeaders.USER_ID, "premium-user"))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.code").value("TIER_INSUFFICIENT"))
                .andExpect(jsonPath("$.details.requiredTier").value("pro"));
    }

    @Test
    void digestScopeNeedsDigestId() throws Exception {
        mockMvc.perform(get("/api/items").param("scope", "current_digest"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("MISSING_SCOPE_FIELD"))
                .andExpect(jsonPath("$.details.field").value("digestId"));
    }

    @Test
    void unknownSortIsBadRequest() throws Exception {
        mockMvc.perform(get("/api/items").param("scope", "all_digests").param("sort", "random")
                        .header(ApiHeaders.USER_ID, "premium-user"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("BAD_REQUEST"));
    }

    @Test
    void missingItemIsNotFound() throws Exception {
        mockMvc.perform(get("/api/items/does-not-exist"))
                .andExpect(status().isNotFound());
    }

    @Test
    void feedSubmissionWithUnknownTopicIsUnprocessable() throws Exception {
        String body = """
                {"name": "Odd feed", "url": "https://odd.example/rss", "sourceType": "substack",
                 "category": "health", "topics": ["keto", "not-a-topic"]}
                """;

        mockMvc.perform(post("/api/catalog")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.code").value("INVALID_TOPIC"))
                .andExpect(jsonPath("$.details.invalidTopics['not-a-topic']").value(1))
                .andExpect(jsonPath("$.details.taxonomyVersion").value("2025.1"));
    }
}
