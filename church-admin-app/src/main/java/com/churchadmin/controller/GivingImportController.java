package com.churchadmin.controller;

import com.churchadmin.importer.HeadOfHouseholdStrategy;
import com.churchadmin.model.BulkGivingRequest;
import com.churchadmin.model.ImportResult;
import com.churchadmin.service.CsvUploadReader;
import com.churchadmin.service.GivingImportService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MaxUploadSizeExceededException;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.util.Map;
import java.util.UUID;

@RestController
@RequestMapping("/api/giving")
public class GivingImportController {

    private final GivingImportService givingImportService;
    private final CsvUploadReader uploadReader;

    public GivingImportController(GivingImportService givingImportService, CsvUploadReader uploadReader) {
        this.givingImportService = givingImportService;
        this.uploadReader = uploadReader;
    }

    @PostMapping("/bulk-import")
    public ResponseEntity<?> bulkImport(
            @RequestHeader("X-Church-Id") UUID churchId,
            @RequestParam(value = "file", required = false) MultipartFile file,
            @RequestParam(value = "policy", required = false) String policy) {
        try {
            HeadOfHouseholdStrategy strategy = givingImportService.resolveStrategy(policy);
            ImportResult result = givingImportService.importCsv(churchId, file, strategy);
            return ResponseEntity.ok(result);
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        } catch (IOException e) {
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(Map.of("error", "Failed to read uploaded file"));
        }
    }

    @PostMapping("/bulk-input")
    public ResponseEntity<?> bulkInput(
            @RequestHeader("X-Church-Id") UUID churchId,
            @RequestBody BulkGivingRequest request,
            @RequestParam(value = "policy", required = false) String policy) {
        try {
            HeadOfHouseholdStrategy strategy = givingImportService.resolveStrategy(policy);
            return ResponseEntity.ok(givingImportService.importEntries(churchId, request, strategy));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
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
