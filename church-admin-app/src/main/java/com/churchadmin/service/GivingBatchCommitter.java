package com.churchadmin.service;

import com.churchadmin.model.GivingRecord;
import com.churchadmin.repository.GivingRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;

@Service
public class GivingBatchCommitter {

    private final GivingRepository givingRepository;

    public GivingBatchCommitter(GivingRepository givingRepository) {
        this.givingRepository = givingRepository;
    }

    /**
     * Inserts every accepted gift in one transaction; any failure rolls the whole batch back.
     */
    @Transactional
    public void commit(UUID churchId, List<GivingRecord> records) {
        givingRepository.insertAll(churchId, records);
    }
}
