package com.churchadmin.repository;

import com.churchadmin.model.Member;
import com.churchadmin.model.MemberLookup;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

@Repository
public class MemberRepository {

    private final JdbcTemplate jdbc;

    private static final RowMapper<MemberLookup> LOOKUP_MAPPER = (rs, rowNum) -> new MemberLookup(
        rs.getObject("id", UUID.class),
        rs.getObject("household_id", UUID.class),
        rs.getObject("envelope_number", Integer.class),
        rs.getString("sex"),
        rs.getObject("date_of_birth", LocalDate.class),
        rs.getString("sequence_role"),
        rs.getString("membership_code")
    );

    public MemberRepository(JdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    /**
     * Every member of the church in creation order, slimmed down for import lookups.
     */
    public List<MemberLookup> findLookupsByChurch(UUID churchId) {
        return jdbc.query("""
            SELECT id, household_id, envelope_number, sex, date_of_birth, sequence_role, membership_code
            FROM members
            WHERE church_id = ?
            ORDER BY created_at, id
            """,
            LOOKUP_MAPPER,
            churchId
        );
    }

    public Set<String> findEmailsByChurch(UUID churchId) {
        List<String> emails = jdbc.queryForList("""
            SELECT LOWER(email1) FROM members WHERE church_id = ? AND email1 IS NOT NULL
            UNION
            SELECT LOWER(email2) FROM members WHERE church_id = ? AND email2 IS NOT NULL
            """,
            String.class,
            churchId, churchId
        );
        return new HashSet<>(emails);
    }

    public int countByChurch(UUID churchId) {
        Integer count = jdbc.queryForObject(
            "SELECT COUNT(*) FROM members WHERE church_id = ?",
            Integer.class,
            churchId
        );
        return count != null ? count : 0;
    }

    public void insertAll(UUID churchId, List<Member> members) {
        if (members.isEmpty()) return;

        List<Object[]> args = members.stream()
            .map(m -> new Object[] {
                m.id(), churchId, m.householdId(),
                m.firstName(), m.middleName(), m.lastName(), m.suffix(), m.preferredName(), m.maidenName(),
                m.title(), m.sex(), m.dateOfBirth(),
                m.email1(), m.email2(), m.phoneHome(), m.phoneCell1(), m.phoneCell2(),
                m.baptismDate(), m.confirmationDate(), m.receivedBy(), m.dateReceived(),
                m.removedBy(), m.dateRemoved(), m.deceasedDate(),
                m.membershipCode(), m.envelopeNumber(), m.participation(), m.sequence()
            })
            .toList();
        jdbc.batchUpdate("""
            INSERT INTO members (
                id, church_id, household_id,
                first_name, middle_name, last_name, suffix, preferred_name, maiden_name,
                title, sex, date_of_birth,
                email1, email2, phone_home, phone_cell1, phone_cell2,
                baptism_date, confirmation_date, received_by, date_received,
                removed_by, date_removed, deceased_date,
                membership_code, envelope_number, participation, sequence_role
            ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            """,
            args
        );
    }
}
