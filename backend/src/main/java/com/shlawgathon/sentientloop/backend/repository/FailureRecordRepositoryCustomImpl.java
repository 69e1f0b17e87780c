package com.shlawgathon.sentientloop.backend.repository;

import com.shlawgathon.sentientloop.backend.model.FailureRecord;
import com.shlawgathon.sentientloop.backend.model.FailureStatus;
import com.shlawgathon.sentientloop.backend.model.FailureType;
import org.bson.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.aggregation.Aggregation;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.time.Instant;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.springframework.data.mongodb.core.query.Criteria.where;
import static org.springframework.data.mongodb.core.query.Query.query;

public class FailureRecordRepositoryCustomImpl implements FailureRecordRepositoryCustom {

    private static final Logger log = LoggerFactory.getLogger(FailureRecordRepositoryCustomImpl.class);

    private static final List<FailureStatus> OPEN = List.of(FailureStatus.ACTIVE, FailureStatus.ACKNOWLEDGED);

    private final MongoTemplate mongoTemplate;

    public FailureRecordRepositoryCustomImpl(MongoTemplate mongoTemplate) {
        this.mongoTemplate = mongoTemplate;
    }

    @Override
    public FailureRecord upsertOpenFailure(String operationName, String moduleId, FailureType type,
            Map<String, Object> metadata, String errorMessage, Instant now) {
        Query query = query(where("openKey").is(FailureRecord.openKey(operationName, moduleId)));
        Update update = new Update()
                .inc("recoveryAttempts", 1)
                .set("lastRecoveryAttempt", now)
                .setOnInsert("operationName", operationName)
                .setOnInsert("moduleId", moduleId)
                .setOnInsert("type", type)
                .setOnInsert("status", FailureStatus.ACTIVE)
                .setOnInsert("firstSeenAt", now);
        if (metadata != null && !metadata.isEmpty()) {
            metadata.forEach((key, value) -> update.set("metadata." + sanitizeKey(key), value));
        } else {
            update.setOnInsert("metadata", new HashMap<String, Object>());
        }
        if (errorMessage != null) {
            update.set("lastErrorMessage", errorMessage);
        }
        FindAndModifyOptions options = FindAndModifyOptions.options().upsert(true).returnNew(true);
        try {
            return mongoTemplate.findAndModify(query, update, options, FailureRecord.class);
        } catch (DuplicateKeyException e) {
            // Lost the insert race; the record now exists so the retry is an update
            log.debug("[FAILURE] Concurrent insert for {}|{}, retrying as update", operationName, moduleId);
            return mongoTemplate.findAndModify(query, update, options, FailureRecord.class);
        }
    }

    @Override
    public Optional<FailureRecord> acknowledge(String id, String actor, Instant now) {
        Query query = query(where("_id").is(id).and("status").is(FailureStatus.ACTIVE));
        Update update = new Update()
                .set("status", FailureStatus.ACKNOWLEDGED)
                .set("acknowledgedBy", actor)
                .set("acknowledgedAt", now);
        return Optional.ofNullable(mongoTemplate.findAndModify(query, update,
                FindAndModifyOptions.options().returnNew(true), FailureRecord.class));
    }

    @Override
    public Optional<FailureRecord> acquireRecoveryLease(String id, String owner, Instant now, Instant leaseUntil) {
        Query query = query(where("_id").is(id)
                .and("status").in(OPEN)
                .orOperator(where("recoveryLeaseUntil").is(null), where("recoveryLeaseUntil").lt(now)));
        Update update = new Update()
                .set("recoveryLeaseOwner", owner)
                .set("recoveryLeaseUntil", leaseUntil);
        return Optional.ofNullable(mongoTemplate.findAndModify(query, update,
                FindAndModifyOptions.options().returnNew(true), FailureRecord.class));
    }

    @Override
    public Optional<FailureRecord> completeRecovery(String id, String owner, String actor, Instant now) {
        Query query = query(where("_id").is(id).and("recoveryLeaseOwner").is(owner));
        Update update = new Update()
                .set("status", FailureStatus.RECOVERED)
                .set("recoveredBy", actor)
                .set("recoveredAt", now)
                .set("lastRecoveryAttempt", now)
                .unset("openKey")
                .unset("recoveryLeaseOwner")
                .unset("recoveryLeaseUntil");
        return Optional.ofNullable(mongoTemplate.findAndModify(query, update,
                FindAndModifyOptions.options().returnNew(true), FailureRecord.class));
    }

    @Override
    public Optional<FailureRecord> failRecovery(String id, String owner, String errorMessage, Instant now) {
        Query query = query(where("_id").is(id).and("recoveryLeaseOwner").is(owner));
        Update update = new Update()
                .inc("recoveryAttempts", 1)
                .set("lastRecoveryAttempt", now)
                .unset("recoveryLeaseOwner")
                .unset("recoveryLeaseUntil");
        if (errorMessage != null) {
            update.set("lastErrorMessage", errorMessage);
        }
        return Optional.ofNullable(mongoTemplate.findAndModify(query, update,
                FindAndModifyOptions.options().returnNew(true), FailureRecord.class));
    }

    @Override
    public Map<String, Long> countOpenByModule() {
        Aggregation aggregation = Aggregation.newAggregation(
                Aggregation.match(where("status").in(OPEN)),
                Aggregation.group("moduleId").count().as("count"),
                Aggregation.sort(org.springframework.data.domain.Sort.Direction.ASC, "_id"));
        Map<String, Long> counts = new LinkedHashMap<>();
        mongoTemplate.aggregate(aggregation, FailureRecord.class, Document.class)
                .getMappedResults()
                .forEach(doc -> counts.put(String.valueOf(doc.get("_id")),
                        ((Number) doc.get("count")).longValue()));
        return counts;
    }

    // Mongo field names may not contain '.' or start with '$'
    private static String sanitizeKey(String key) {
        String cleaned = key.replace('.', '_');
        return cleaned.startsWith("$") ? "_" + cleaned.substring(1) : cleaned;
    }
}
