package com.example.voice.persistence;

import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;

public interface OrganizationJpaRepository extends JpaRepository<OrganizationEntity, String> {

    Optional<OrganizationEntity> findByPhoneNumber(String phoneNumber);
}
