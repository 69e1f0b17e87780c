package com.shlawgathon.sentientloop.backend.repository;

import com.shlawgathon.sentientloop.backend.model.Checkpoint;
import com.shlawgathon.sentientloop.backend.model.CheckpointFilter;
import com.shlawgathon.sentientloop.backend.model.CheckpointStatus;
import com.shlawgathon.sentientloop.backend.model.ImpactLevel;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.springframework.data.mongodb.core.query.Criteria.where;
import static org.springframework.data.mongodb.core.query.Query.query;

public class CheckpointRepositoryCustomImpl implements CheckpointRepositoryCustom {

    private final MongoTemplate mongoTemplate;

    public CheckpointRepositoryCustomImpl(MongoTemplate mongoTemplate) {
        this.mongoTemplate = mongoTemplate;
    }

    @Override
    public Optional<Checkpoint> compareAndSetStatus(String id, CheckpointStatus expected, CheckpointStatus target,
            Update fields) {
        Update update = fields != null ? fields : new Update();
        update.set("status", target);
        Query query = query(where("_id").is(id).and("status").is(expected));
        return Optional.ofNullable(mongoTemplate.findAndModify(query, update,
                FindAndModifyOptions.options().returnNew(true), Checkpoint.class));
    }

    @Override
    public Optional<Checkpoint> advanceEscalationWatermark(String id, Instant cutoff, ImpactLevel level,
            Instant now) {
        Query query = query(where("_id").is(id)
                .and("status").is(CheckpointStatus.PENDING)
                .orOperator(where("lastEscalatedAt").is(null), where("lastEscalatedAt").lt(cutoff)));
        Update update = new Update()
                .set("lastEscalatedAt", now)
                .set("escalationLevel", level)
                .inc("escalationCount", 1);
        return Optional.ofNullable(mongoTemplate.findAndModify(query, update,
                FindAndModifyOptions.options().returnNew(true), Checkpoint.class));
    }

    @Override
    public Optional<Checkpoint> expireIfStale(String id, Instant cutoff, String reason, Instant now) {
        Query query = query(where("_id").is(id)
                .and("status").is(CheckpointStatus.PENDING)
                .and("createdAt").lt(cutoff)
                .orOperator(where("lastEscalatedAt").is(null), where("lastEscalatedAt").lt(cutoff)));
        Update update = new Update()
                .set("status", CheckpointStatus.EXPIRED)
                .set("resolvedAt", now)
                .set("resolvedBy", "system")
                .set("resolution", reason);
        return Optional.ofNullable(mongoTemplate.findAndModify(query, update,
                FindAndModifyOptions.options().returnNew(true), Checkpoint.class));
    }

    @Override
    public List<Checkpoint> findEscalationCandidates(String organizationId, Instant cutoff) {
        Query query = query(where("status").is(CheckpointStatus.PENDING)
                .and("organizationId").is(organizationId)
                .and("createdAt").lt(cutoff)
                .orOperator(where("lastEscalatedAt").is(null), where("lastEscalatedAt").lt(cutoff)))
                .with(Sort.by(Sort.Direction.ASC, "createdAt"));
        return mongoTemplate.find(query, Checkpoint.class);
    }

    @Override
    public List<String> findPendingOrganizations() {
        return mongoTemplate.findDistinct(query(where("status").is(CheckpointStatus.PENDING)),
                "organizationId", Checkpoint.class, String.class);
    }

    @Override
    public List<Checkpoint> findPending(CheckpointFilter filter) {
        Criteria criteria = where("status").is(CheckpointStatus.PENDING);
        if (filter.organizationId() != null) {
            criteria = criteria.and("organizationId").is(filter.organizationId());
        }
        if (filter.moduleId() != null) {
            criteria = criteria.and("moduleId").is(filter.moduleId());
        }
        if (filter.agentId() != null) {
            criteria = criteria.and("agentId").is(filter.agentId());
        }
        if (filter.type() != null) {
            criteria = criteria.and("type").is(filter.type());
        }
        return mongoTemplate.find(new Query(criteria).with(Sort.by(Sort.Direction.DESC, "createdAt")),
                Checkpoint.class);
    }
}
