package com.churchadmin.controller;

import com.churchadmin.service.CsvUploadReader;
import com.churchadmin.service.MemberImportService;
import com.churchadmin.service.MemberLimitExceededException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MaxUploadSizeExceededException;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.util.Map;
import java.util.UUID;

@RestController
@RequestMapping("/api/members")
public class MemberImportController {

    private final MemberImportService memberImportService;
    private final CsvUploadReader uploadReader;

    public MemberImportController(MemberImportService memberImportService, CsvUploadReader uploadReader) {
        this.memberImportService = memberImportService;
        this.uploadReader = uploadReader;
    }

    @PostMapping("/bulk-import")
    public ResponseEntity<?> bulkImport(
            @RequestHeader("X-Church-Id") UUID churchId,
            @RequestParam(value = "file", required = false) MultipartFile file) {
        try {
            return ResponseEntity.ok(memberImportService.importCsv(churchId, file));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        } catch (MemberLimitExceededException e) {
            return ResponseEntity.status(HttpStatus.FORBIDDEN).body(Map.of("error", e.getMessage()));
        } catch (IOException e) {
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(Map.of("error", "Failed to read uploaded file"));
        }
    }

    /**
     * Uploads past the servlet container's multipart ceiling fail before the handler body runs.
     */
    @ExceptionHandler(MaxUploadSizeExceededException.class)
    public ResponseEntity<Map<String, String>> uploadTooLarge(MaxUploadSizeExceededException e) {
        return ResponseEntity.badRequest().body(Map.of("error", uploadReader.tooLargeMessage()));
    }
}
