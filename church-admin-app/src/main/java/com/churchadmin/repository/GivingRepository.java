package com.churchadmin.repository;

import com.churchadmin.model.GivingItem;
import com.churchadmin.model.GivingRecord;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

@Repository
public class GivingRepository {

    private final JdbcTemplate jdbc;

    public GivingRepository(JdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    /**
     * Writes the gifts and their line items with one batch statement each.
     */
    public void insertAll(UUID churchId, List<GivingRecord> records) {
        if (records.isEmpty()) return;

        List<Object[]> givingArgs = new ArrayList<>(records.size());
        List<Object[]> itemArgs = new ArrayList<>();
        for (GivingRecord record : records) {
            UUID givingId = UUID.randomUUID();
            givingArgs.add(new Object[] {
                givingId, churchId, record.memberId(), record.dateGiven(), record.notes(), record.total()
            });
            for (GivingItem item : record.items()) {
                itemArgs.add(new Object[] { UUID.randomUUID(), givingId, item.categoryId(), item.amount() });
            }
        }

        jdbc.batchUpdate(
            "INSERT INTO giving (id, church_id, member_id, date_given, notes, total_amount) VALUES (?, ?, ?, ?, ?, ?)",
            givingArgs
        );
        jdbc.batchUpdate(
            "INSERT INTO giving_item (id, giving_id, category_id, amount) VALUES (?, ?, ?, ?)",
            itemArgs
        );
    }
}
