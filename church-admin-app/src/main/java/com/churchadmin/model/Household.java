package com.churchadmin.model;

import java.time.LocalDate;
import java.util.UUID;

public record Household(
    UUID id,
    String name,
    String householdType,
    boolean nonHousehold,
    String personAssigned,
    String ministryGroup,
    String address1,
    String address2,
    String city,
    String state,
    String zip,
    String country,
    LocalDate alternateAddressBegin,
    LocalDate alternateAddressEnd
) {}
