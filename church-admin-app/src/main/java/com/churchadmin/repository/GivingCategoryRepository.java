package com.churchadmin.repository;

import com.churchadmin.model.GivingCategory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public class GivingCategoryRepository {

    private final JdbcTemplate jdbc;

    private static final RowMapper<GivingCategory> CATEGORY_MAPPER = (rs, rowNum) -> new GivingCategory(
        rs.getObject("id", UUID.class),
        rs.getString("name"),
        rs.getBoolean("is_active")
    );

    public GivingCategoryRepository(JdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    public List<GivingCategory> findActiveByChurch(UUID churchId) {
        return jdbc.query(
            "SELECT id, name, is_active FROM giving_category WHERE church_id = ? AND is_active = TRUE ORDER BY display_order, name",
            CATEGORY_MAPPER,
            churchId
        );
    }
}
