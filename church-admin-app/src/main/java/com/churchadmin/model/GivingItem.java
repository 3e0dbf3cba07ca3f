package com.churchadmin.model;

import java.math.BigDecimal;
import java.util.UUID;

public record GivingItem(
    UUID categoryId,
    BigDecimal amount
) {}
