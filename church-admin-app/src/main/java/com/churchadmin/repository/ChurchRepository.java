package com.churchadmin.repository;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public class ChurchRepository {

    private final JdbcTemplate jdbc;

    public ChurchRepository(JdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    public Optional<String> findSubscriptionPlan(UUID churchId) {
        List<String> plans = jdbc.queryForList(
            "SELECT subscription_plan FROM church WHERE id = ?",
            String.class,
            churchId
        );
        return plans.stream().findFirst();
    }
}
