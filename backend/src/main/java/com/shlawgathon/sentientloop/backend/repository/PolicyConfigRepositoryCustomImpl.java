package com.shlawgathon.sentientloop.backend.repository;

import com.shlawgathon.sentientloop.backend.model.PolicyConfig;
import org.springframework.data.mongodb.core.FindAndReplaceOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;

import java.util.Optional;

import static org.springframework.data.mongodb.core.query.Criteria.where;
import static org.springframework.data.mongodb.core.query.Query.query;

public class PolicyConfigRepositoryCustomImpl implements PolicyConfigRepositoryCustom {

    private final MongoTemplate mongoTemplate;

    public PolicyConfigRepositoryCustomImpl(MongoTemplate mongoTemplate) {
        this.mongoTemplate = mongoTemplate;
    }

    @Override
    public Optional<PolicyConfig> replaceIfVersionMatches(PolicyConfig replacement, long expectedVersion) {
        Query query = query(where("organizationId").is(replacement.getOrganizationId())
                .and("version").is(expectedVersion));
        return Optional.ofNullable(mongoTemplate.findAndReplace(query, replacement,
                FindAndReplaceOptions.options().returnNew()));
    }
}
