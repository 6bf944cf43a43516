package com.work.federation.repository.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.work.federation.repository.entity.FederationRunEntity;
import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;
import org.apache.ibatis.annotations.Update;

import java.time.Instant;
import java.util.List;

/**
 * 协商运行表 Mapper
 */
public interface FederationRunMapper extends BaseMapper<FederationRunEntity> {

    @Insert("INSERT INTO federation_run(run_id, role, outcome, created_at) " +
            "VALUES(#{runId}, #{role}, 'RUNNING', #{createdAt})")
    int insertRun(@Param("runId") String runId,
                  @Param("role") String role,
                  @Param("createdAt") Instant createdAt);

    @Update("UPDATE federation_run SET service_id = #{serviceId} WHERE run_id = #{runId}")
    int updateServiceId(@Param("runId") String runId, @Param("serviceId") String serviceId);

    /**
     * 只在 RUNNING 时写入结局，终态不可覆盖
     */
    @Update("UPDATE federation_run " +
            "SET outcome = #{outcome}, failed_step = #{failedStep}, error_type = #{errorType}, " +
            "error_message = #{errorMessage}, federated_host = #{federatedHost}, finished_at = #{finishedAt} " +
            "WHERE run_id = #{runId} AND outcome = 'RUNNING'")
    int finishRun(@Param("runId") String runId,
                  @Param("outcome") String outcome,
                  @Param("failedStep") String failedStep,
                  @Param("errorType") String errorType,
                  @Param("errorMessage") String errorMessage,
                  @Param("federatedHost") String federatedHost,
                  @Param("finishedAt") Instant finishedAt);

    @Select("SELECT run_id, role, service_id, outcome, failed_step, error_type, error_message, federated_host, " +
            "created_at, finished_at FROM federation_run WHERE run_id = #{runId}")
    FederationRunEntity selectByRunId(@Param("runId") String runId);

    @Select("SELECT run_id, role, service_id, outcome, failed_step, error_type, error_message, federated_host, " +
            "created_at, finished_at FROM federation_run ORDER BY created_at DESC LIMIT #{limit}")
    List<FederationRunEntity> listRecent(@Param("limit") int limit);
}
