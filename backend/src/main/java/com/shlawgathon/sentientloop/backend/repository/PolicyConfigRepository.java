package com.shlawgathon.sentientloop.backend.repository;

import com.shlawgathon.sentientloop.backend.model.PolicyConfig;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface PolicyConfigRepository extends MongoRepository<PolicyConfig, String>, PolicyConfigRepositoryCustom {

    Optional<PolicyConfig> findByOrganizationId(String organizationId);
}
