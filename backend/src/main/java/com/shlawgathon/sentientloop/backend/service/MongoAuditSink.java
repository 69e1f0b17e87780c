package com.shlawgathon.sentientloop.backend.service;

import com.shlawgathon.sentientloop.backend.model.AuditEvent;
import com.shlawgathon.sentientloop.backend.model.AuditRecord;
import com.shlawgathon.sentientloop.backend.repository.AuditRecordRepository;
import org.springframework.stereotype.Component;

@Component
public class MongoAuditSink implements AuditSink {

    private final AuditRecordRepository auditRecordRepository;

    public MongoAuditSink(AuditRecordRepository auditRecordRepository) {
        this.auditRecordRepository = auditRecordRepository;
    }

    @Override
    public void record(AuditEvent event) {
        auditRecordRepository.insert(AuditRecord.from(event));
    }
}
