package com.churchadmin.repository;

import com.churchadmin.model.Household;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

@Repository
public class HouseholdRepository {

    private final JdbcTemplate jdbc;

    public HouseholdRepository(JdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    public Set<UUID> findIdsByChurch(UUID churchId) {
        return new HashSet<>(jdbc.query(
            "SELECT id FROM household WHERE church_id = ?",
            (rs, rowNum) -> rs.getObject("id", UUID.class),
            churchId
        ));
    }

    public void insertAll(UUID churchId, List<Household> households) {
        if (households.isEmpty()) return;

        List<Object[]> args = households.stream()
            .map(h -> new Object[] {
                h.id(), churchId, h.name(), h.householdType(), h.nonHousehold(),
                h.personAssigned(), h.ministryGroup(),
                h.address1(), h.address2(), h.city(), h.state(), h.zip(), h.country(),
                h.alternateAddressBegin(), h.alternateAddressEnd()
            })
            .toList();
        jdbc.batchUpdate("""
            INSERT INTO household (
                id, church_id, name, household_type, is_non_household,
                person_assigned, ministry_group,
                address1, address2, city, state, zip, country,
                alternate_address_begin, alternate_address_end
            ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            """,
            args
        );
    }
}
