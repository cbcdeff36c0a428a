package com.example.devopsgateway.repository;

import com.example.devopsgateway.domain.Deployment;
import com.example.devopsgateway.domain.DeploymentStatus;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface DeploymentRepository extends JpaRepository<Deployment, String> {

    List<Deployment> findByStatusOrderByTimestampDesc(DeploymentStatus status, Pageable pageable);
}
