package com.churchadmin.service;

import com.churchadmin.config.ImportProperties;
import com.churchadmin.importer.CsvDocument;
import com.churchadmin.importer.ImportFileException;
import com.churchadmin.importer.MemberRow;
import com.churchadmin.model.ImportResult;
import com.churchadmin.repository.HouseholdRepository;
import com.churchadmin.repository.MemberRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.QueryTimeoutException;

import java.util.List;
import java.util.Set;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class MemberImportServiceTest {

    private static final UUID CHURCH = UUID.randomUUID();

    @Mock
    private MemberRepository memberRepository;

    @Mock
    private HouseholdRepository householdRepository;

    @Mock
    private MemberBatchCommitter committer;

    @Mock
    private MemberLimitService memberLimitService;

    private MemberImportService service;

    @BeforeEach
    void setUp() {
        ImportProperties properties = new ImportProperties();
        service = new MemberImportService(memberRepository, householdRepository, committer, memberLimitService,
            new CsvUploadReader(properties), properties);
        lenient().when(householdRepository.findIdsByChurch(CHURCH)).thenReturn(Set.of());
        lenient().when(memberRepository.findEmailsByChurch(CHURCH)).thenReturn(Set.of("ann@example.com"));
    }

    @Test
    @SuppressWarnings("unchecked")
    void acceptedRowsAreCommittedTogether() {
        ImportResult result = service.importCsv(CHURCH, CsvDocument.parse("""
            First Name,Last Name,Email,Household Group,Create New Household
            Bo,Lee,bo@example.com,lee,true
            Cy,Lee,,lee,true
            Ann,Other,ANN@example.com,,
            """));

        assertThat(result.success()).isEqualTo(2);
        assertThat(result.errors()).containsExactly("Row 4: Email ann@example.com already exists");

        ArgumentCaptor<List<MemberRow>> rows = ArgumentCaptor.forClass(List.class);
        verify(committer).commit(eq(CHURCH), rows.capture());
        assertThat(rows.getValue()).filteredOn(row -> row.newHousehold() != null).hasSize(1);
        verify(memberLimitService).checkCanAdd(CHURCH, 3);
    }

    @Test
    void missingNameColumnsAreListed() {
        assertThatThrownBy(() -> service.importCsv(CHURCH, CsvDocument.parse("FirstName,Email\nBo,bo@example.com")))
            .isInstanceOf(ImportFileException.class)
            .hasMessage("Missing required columns: last name");
    }

    @Test
    void planLimitStopsImportBeforeAnyRow() {
        doThrow(new MemberLimitExceededException("Cannot import 1 members."))
            .when(memberLimitService).checkCanAdd(eq(CHURCH), anyInt());

        assertThatThrownBy(() -> service.importCsv(CHURCH, CsvDocument.parse("First Name,Last Name\nBo,Lee")))
            .isInstanceOf(MemberLimitExceededException.class);
        verify(committer, never()).commit(any(), anyList());
    }

    @Test
    void databaseFailureFailsTheBatch() {
        doThrow(new QueryTimeoutException("timed out")).when(committer).commit(eq(CHURCH), anyList());

        ImportResult result = service.importCsv(CHURCH, CsvDocument.parse("First Name,Last Name\nBo,Lee\nCy,Lee"));

        assertThat(result.success()).isZero();
        assertThat(result.failed()).isEqualTo(2);
        assertThat(result.errors()).containsExactly("Database error: timed out");
    }
}
