package com.churchadmin.service;

import com.churchadmin.config.ImportProperties;
import com.churchadmin.importer.CsvDocument;
import com.churchadmin.importer.HeaderIndex;
import com.churchadmin.importer.ImportFileException;
import com.churchadmin.importer.ImportRow;
import com.churchadmin.importer.ImportVocabulary;
import com.churchadmin.importer.MemberImportState;
import com.churchadmin.importer.MemberRow;
import com.churchadmin.importer.MemberRowValidator;
import com.churchadmin.importer.RowResult;
import com.churchadmin.model.ImportResult;
import com.churchadmin.repository.HouseholdRepository;
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
import java.util.stream.Stream;

@Service
public class MemberImportService {

    private static final Logger log = LoggerFactory.getLogger(MemberImportService.class);

    private final MemberRepository memberRepository;
    private final HouseholdRepository householdRepository;
    private final MemberBatchCommitter committer;
    private final MemberLimitService memberLimitService;
    private final CsvUploadReader uploadReader;
    private final ImportVocabulary vocabulary;

    public MemberImportService(MemberRepository memberRepository,
                               HouseholdRepository householdRepository,
                               MemberBatchCommitter committer,
                               MemberLimitService memberLimitService,
                               CsvUploadReader uploadReader,
                               ImportProperties importProperties) {
        this.memberRepository = memberRepository;
        this.householdRepository = householdRepository;
        this.committer = committer;
        this.memberLimitService = memberLimitService;
        this.uploadReader = uploadReader;
        this.vocabulary = importProperties.toVocabulary();
    }

    public ImportResult importCsv(UUID churchId, MultipartFile file) throws IOException {
        return importCsv(churchId, uploadReader.read(file));
    }

    ImportResult importCsv(UUID churchId, CsvDocument document) {
        HeaderIndex headers = HeaderIndex.of(document.header());
        List<String> missing = Stream.of(MemberRowValidator.FIRST_NAME_COLUMN, MemberRowValidator.LAST_NAME_COLUMN)
            .filter(column -> !headers.has(column))
            .toList();
        if (!missing.isEmpty()) {
            throw new ImportFileException("Missing required columns: " + String.join(", ", missing));
        }

        memberLimitService.checkCanAdd(churchId, document.rows().size());

        MemberImportState state = new MemberImportState(
            householdRepository.findIdsByChurch(churchId),
            memberRepository.findEmailsByChurch(churchId));
        MemberRowValidator validator = new MemberRowValidator(headers, vocabulary);
        log.info("Member import for church {}: {} rows, vocabulary {}",
            churchId, document.rows().size(), vocabulary.version());

        ImportResult.Tally tally = new ImportResult.Tally();
        List<MemberRow> accepted = new ArrayList<>();
        for (ImportRow row : document.rows()) {
            try {
                RowResult<MemberRow> result = validator.validate(row, state);
                if (result.isAccepted()) {
                    accepted.add(result.value());
                } else {
                    log.debug("Rejected: {}", result.errorMessage());
                    tally.rowFailed(result.errorMessage());
                }
            } catch (RuntimeException e) {
                log.warn("Unexpected failure on row {}", row.lineNumber(), e);
                tally.rowFailed("Row " + row.lineNumber() + ": " + e.getMessage());
            }
        }

        if (!accepted.isEmpty()) {
            try {
                committer.commit(churchId, accepted);
                tally.committed(accepted.size());
            } catch (DataAccessException e) {
                log.error("Failed to insert {} members for church {}", accepted.size(), churchId, e);
                tally.batchFailed(accepted.size(), "Database error: " + e.getMessage());
            }
        }

        ImportResult result = tally.build();
        log.info("Member import for church {} finished: {} succeeded, {} failed",
            churchId, result.success(), result.failed());
        return result;
    }
}
