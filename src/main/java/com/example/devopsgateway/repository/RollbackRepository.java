package com.example.devopsgateway.repository;

import com.example.devopsgateway.domain.DeploymentStatus;
import com.example.devopsgateway.domain.Rollback;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface RollbackRepository extends JpaRepository<Rollback, String> {

    List<Rollback> findByStatusOrderByTimestampDesc(DeploymentStatus status, Pageable pageable);
}
