package com.infomedia.abacox.callshipping;

import com.infomedia.abacox.callshipping.component.configmanager.ConfigKey;
import com.infomedia.abacox.callshipping.component.configmanager.ConfigService;
import com.infomedia.abacox.callshipping.component.engine.StartupWatermarkInitializer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.patch;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class ApplicationTests {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ConfigService configService;

    @Autowired
    private StartupWatermarkInitializer startupInitializer;

    @AfterEach
    void resetBatchSize() {
        configService.updateValue(ConfigKey.BATCH_SIZE, ConfigKey.BATCH_SIZE.getDefaultValue());
    }

    @Test
    void testContextLoads() {
        assertTrue(startupInitializer.isReady());
    }

    @Test
    void testConfigurationGroupMasksSecrets() throws Exception {
        mockMvc.perform(get("/api/configuration/api"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.apiKey").value("********"))
                .andExpect(jsonPath("$.apiTimeoutSeconds").value("30"));
    }

    @Test
    void testUpdateConfiguration() throws Exception {
        mockMvc.perform(patch("/api/configuration/delivery")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"values\":{\"batchSize\":\"50\"}}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.batchSize").value("50"));

        assertEquals(50, configService.getValue(ConfigKey.BATCH_SIZE).asInt());
    }

    @Test
    void testUnknownKeyOrGroupIsRejected() throws Exception {
        mockMvc.perform(patch("/api/configuration/delivery")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"values\":{\"noSuchKey\":\"1\"}}"))
                .andExpect(status().isBadRequest());
        mockMvc.perform(get("/api/configuration/nonsense"))
                .andExpect(status().isNotFound());
    }

    @Test
    void testUnknownCall() throws Exception {
        mockMvc.perform(get("/api/call/1714564800.1"))
                .andExpect(status().isNotFound());
        mockMvc.perform(get("/api/call/1714564800.1/exists"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.exists").value(false));
    }
}
