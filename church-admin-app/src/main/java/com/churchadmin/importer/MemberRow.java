package com.churchadmin.importer;

import com.churchadmin.model.Household;
import com.churchadmin.model.Member;

/**
 * An accepted member row. {@code newHousehold} is set only for the row that creates its household;
 * rows joining an existing or already-created household leave it null.
 */
public record MemberRow(
    int lineNumber,
    Member member,
    Household newHousehold
) {}
