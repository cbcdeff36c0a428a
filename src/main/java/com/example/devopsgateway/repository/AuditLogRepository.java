package com.example.devopsgateway.repository;

import com.example.devopsgateway.domain.AuditLog;
import com.example.devopsgateway.domain.Route;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface AuditLogRepository extends JpaRepository<AuditLog, String> {

    List<AuditLog> findByRequestIdOrderByTimestampDesc(String requestId);

    @Query("SELECT a FROM AuditLog a ORDER BY a.timestamp DESC")
    Page<AuditLog> findAllPaged(Pageable pageable);

    @Query("SELECT a FROM AuditLog a WHERE " +
           "(:actor IS NULL OR a.actor = :actor) AND " +
           "(:action IS NULL OR a.action = :action) AND " +
           "(:route IS NULL OR a.route = :route) " +
           "ORDER BY a.timestamp DESC")
    List<AuditLog> findFiltered(String actor, String action, Route route);

    long countByRoute(Route route);
}
