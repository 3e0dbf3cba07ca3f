package com.churchadmin.service;

import com.churchadmin.importer.MemberRow;
import com.churchadmin.model.Household;
import com.churchadmin.model.Member;
import com.churchadmin.repository.HouseholdRepository;
import com.churchadmin.repository.MemberRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Objects;
import java.util.UUID;

@Service
public class MemberBatchCommitter {

    private final HouseholdRepository householdRepository;
    private final MemberRepository memberRepository;

    public MemberBatchCommitter(HouseholdRepository householdRepository, MemberRepository memberRepository) {
        this.householdRepository = householdRepository;
        this.memberRepository = memberRepository;
    }

    /**
     * Inserts the households planned by the accepted rows, then their members, in one transaction.
     */
    @Transactional
    public void commit(UUID churchId, List<MemberRow> rows) {
        List<Household> households = rows.stream()
            .map(MemberRow::newHousehold)
            .filter(Objects::nonNull)
            .toList();
        List<Member> members = rows.stream()
            .map(MemberRow::member)
            .toList();

        householdRepository.insertAll(churchId, households);
        memberRepository.insertAll(churchId, members);
    }
}
