package com.churchadmin.controller;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.security.test.context.support.WithMockUser;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.jdbc.Sql;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.multipart.MaxUploadSizeExceededException;

import java.nio.charset.StandardCharsets;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Uploads over {@code churchadmin.import.max-file-bytes} are refused with a 400 before any row is read.
 */
@SpringBootTest(properties = "churchadmin.import.max-file-bytes=64")
@AutoConfigureMockMvc
@ActiveProfiles("test")
@Sql("/grace-church.sql")
@Transactional
@WithMockUser(roles = "ADMIN")
class UploadSizeLimitTest {

    private static final String GRACE = "11111111-1111-1111-1111-111111111111";
    private static final String TOO_LARGE = "File is too large (maximum 64 bytes)";

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private GivingImportController givingImportController;

    @Autowired
    private MemberImportController memberImportController;

    private static MockMultipartFile oversized(String header) {
        StringBuilder csv = new StringBuilder(header).append('\n');
        while (csv.length() <= 64) {
            csv.append("12,50.00,2024-01-07\n");
        }
        return new MockMultipartFile("file", "big.csv", "text/csv", csv.toString().getBytes(StandardCharsets.UTF_8));
    }

    @Test
    void givingImportRejectsOversizedFile() throws Exception {
        mockMvc.perform(multipart("/api/giving/bulk-import")
                .file(oversized("Envelope Number,Current,Date Given"))
                .header("X-Church-Id", GRACE))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value(TOO_LARGE));
    }

    @Test
    void memberImportRejectsOversizedFile() throws Exception {
        mockMvc.perform(multipart("/api/members/bulk-import")
                .file(oversized("First Name,Last Name,Envelope Number"))
                .header("X-Church-Id", GRACE))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value(TOO_LARGE));
    }

    @Test
    void smallFileIsStillAccepted() throws Exception {
        MockMultipartFile small = new MockMultipartFile("file", "small.csv", "text/csv",
            "Envelope Number,Current,Date Given\n12,5,2024-01-07\n".getBytes(StandardCharsets.UTF_8));

        mockMvc.perform(multipart("/api/giving/bulk-import").file(small).header("X-Church-Id", GRACE))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.success").value(1));
    }

    @Test
    void containerUploadLimitMapsToBadRequest() {
        MaxUploadSizeExceededException exceeded = new MaxUploadSizeExceededException(52428800L);

        ResponseEntity<Map<String, String>> giving = givingImportController.uploadTooLarge(exceeded);
        ResponseEntity<Map<String, String>> members = memberImportController.uploadTooLarge(exceeded);

        assertThat(giving.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(giving.getBody()).containsEntry("error", TOO_LARGE);
        assertThat(members.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(members.getBody()).containsEntry("error", TOO_LARGE);
    }
}
