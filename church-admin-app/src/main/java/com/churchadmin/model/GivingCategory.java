package com.churchadmin.model;

import java.util.UUID;

public record GivingCategory(
    UUID id,
    String name,
    boolean active
) {}
