package com.churchadmin.service;

import com.churchadmin.config.ImportProperties;
import com.churchadmin.importer.BulkGivingEntryValidator;
import com.churchadmin.importer.CategoryAmountResolver;
import com.churchadmin.importer.CsvDocument;
import com.churchadmin.importer.GiverResolver;
import com.churchadmin.importer.GivingRowValidator;
import com.churchadmin.importer.HeadOfHouseholdStrategy;
import com.churchadmin.importer.HeaderIndex;
import com.churchadmin.importer.ImportFileException;
import com.churchadmin.importer.ImportRow;
import com.churchadmin.importer.ImportVocabulary;
import com.churchadmin.importer.MemberSnapshot;
import com.churchadmin.importer.RowResult;
import com.churchadmin.model.BulkGivingRequest;
import com.churchadmin.model.GivingCategory;
import com.churchadmin.model.GivingRecord;
import com.churchadmin.model.ImportResult;
import com.churchadmin.repository.GivingCategoryRepository;
import com.churchadmin.repository.MemberRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Giving imports: CSV uploads and entries typed into the bulk input grid.
 *
 * Members and categories are fetched once per import, rows are validated in order without touching
 * the database, and the accepted gifts are written in a single transaction at the end.
 */
@Service
public class GivingImportService {

    private static final Logger log = LoggerFactory.getLogger(GivingImportService.class);

    private final MemberRepository memberRepository;
    private final GivingCategoryRepository categoryRepository;
    private final GivingBatchCommitter committer;
    private final CsvUploadReader uploadReader;
    private final ImportProperties importProperties;
    private final ImportVocabulary vocabulary;

    public GivingImportService(MemberRepository memberRepository,
                               GivingCategoryRepository categoryRepository,
                               GivingBatchCommitter committer,
                               CsvUploadReader uploadReader,
                               ImportProperties importProperties) {
        this.memberRepository = memberRepository;
        this.categoryRepository = categoryRepository;
        this.committer = committer;
        this.uploadReader = uploadReader;
        this.importProperties = importProperties;
        this.vocabulary = importProperties.toVocabulary();
    }

    public HeadOfHouseholdStrategy resolveStrategy(String policyParameter) {
        return HeadOfHouseholdStrategy.fromParameter(policyParameter, importProperties.getHeadOfHouseholdPolicy());
    }

    public ImportResult importCsv(UUID churchId, MultipartFile file, HeadOfHouseholdStrategy strategy)
            throws IOException {
        return importCsv(churchId, uploadReader.read(file), strategy);
    }

    ImportResult importCsv(UUID churchId, CsvDocument document, HeadOfHouseholdStrategy strategy) {
        HeaderIndex headers = HeaderIndex.of(document.header());
        List<GivingCategory> categories = categoryRepository.findActiveByChurch(churchId);
        CategoryAmountResolver amounts = CategoryAmountResolver.build(headers, categories, vocabulary);
        checkColumns(headers, amounts, categories);

        MemberSnapshot snapshot = MemberSnapshot.of(memberRepository.findLookupsByChurch(churchId));
        log.info("Giving import for church {}: {} rows, vocabulary {}, policy {}",
            churchId, document.rows().size(), vocabulary.version(), strategy);

        GivingRowValidator validator = new GivingRowValidator(
            headers, amounts, new GiverResolver(snapshot, strategy.policy()));

        ImportResult.Tally tally = new ImportResult.Tally();
        List<GivingRecord> accepted = new ArrayList<>();
        for (ImportRow row : document.rows()) {
            try {
                collect(validator.validate(row), accepted, tally);
            } catch (RuntimeException e) {
                log.warn("Unexpected failure on row {}", row.lineNumber(), e);
                tally.rowFailed("Row " + row.lineNumber() + ": " + e.getMessage());
            }
        }

        commit(churchId, accepted, tally);
        return finish(churchId, tally);
    }

    public ImportResult importEntries(UUID churchId, BulkGivingRequest request, HeadOfHouseholdStrategy strategy) {
        if (request == null || request.records() == null || request.records().isEmpty()) {
            throw new ImportFileException("Records array is required and must not be empty");
        }

        List<GivingCategory> categories = categoryRepository.findActiveByChurch(churchId);
        MemberSnapshot snapshot = MemberSnapshot.of(memberRepository.findLookupsByChurch(churchId));
        log.info("Bulk giving input for church {}: {} entries, policy {}",
            churchId, request.records().size(), strategy);

        BulkGivingEntryValidator validator = new BulkGivingEntryValidator(
            categories, new GiverResolver(snapshot, strategy.policy()));

        ImportResult.Tally tally = new ImportResult.Tally();
        List<GivingRecord> accepted = new ArrayList<>();
        List<BulkGivingRequest.Entry> entries = request.records();
        for (int i = 0; i < entries.size(); i++) {
            int rowNumber = i + 1;
            try {
                collect(validator.validate(rowNumber, entries.get(i)), accepted, tally);
            } catch (RuntimeException e) {
                log.warn("Unexpected failure on entry {}", rowNumber, e);
                tally.rowFailed("Row " + rowNumber + ": " + e.getMessage());
            }
        }

        commit(churchId, accepted, tally);
        return finish(churchId, tally);
    }

    private void checkColumns(HeaderIndex headers, CategoryAmountResolver amounts, List<GivingCategory> categories) {
        if (!amounts.hasColumns()) {
            String available = categories.stream()
                .map(GivingCategory::name)
                .collect(Collectors.joining(", "));
            throw new ImportFileException(
                "Missing required column: at least one category amount column is required. Available categories: "
                    + available);
        }
        if (!headers.has(GivingRowValidator.DATE_COLUMN)) {
            throw new ImportFileException("Missing required column: dateGiven (or 'date given' or 'date')");
        }
        if (!headers.has(GivingRowValidator.ENVELOPE_COLUMN) && !headers.has(GivingRowValidator.MEMBER_ID_COLUMN)) {
            throw new ImportFileException(
                "Missing required column: envelopeNumber (or 'envelope number') or memberId (or 'member id')");
        }
    }

    private static void collect(RowResult<GivingRecord> result, List<GivingRecord> accepted,
                                ImportResult.Tally tally) {
        if (result.isAccepted()) {
            accepted.add(result.value());
        } else {
            log.debug("Rejected: {}", result.errorMessage());
            tally.rowFailed(result.errorMessage());
        }
    }

    private void commit(UUID churchId, List<GivingRecord> accepted, ImportResult.Tally tally) {
        if (accepted.isEmpty()) {
            return;
        }
        try {
            committer.commit(churchId, accepted);
            tally.committed(accepted.size());
        } catch (DataAccessException e) {
            log.error("Failed to insert {} giving records for church {}", accepted.size(), churchId, e);
            tally.batchFailed(accepted.size(), "Database error: " + e.getMessage());
        }
    }

    private static ImportResult finish(UUID churchId, ImportResult.Tally tally) {
        ImportResult result = tally.build();
        log.info("Giving import for church {} finished: {} succeeded, {} failed",
            churchId, result.success(), result.failed());
        return result;
    }
}
