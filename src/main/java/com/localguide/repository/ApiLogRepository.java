package com.localguide.repository;

import com.localguide.entity.ApiLog;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;

@Repository
public interface ApiLogRepository extends JpaRepository<ApiLog, Long> {

    /**
     * 에러 로그만 조회
     */
    @Query("SELECT a FROM ApiLog a WHERE a.statusCode >= 400 ORDER BY a.createdAt DESC")
    Page<ApiLog> findErrorLogs(Pageable pageable);

    /**
     * 보존 기간이 지난 로그 삭제
     * @return 삭제된 행 수
     */
    @Modifying
    @Query("DELETE FROM ApiLog a WHERE a.createdAt < :cutoffDate")
    int deleteOldLogs(@Param("cutoffDate") LocalDateTime cutoffDate);
}
