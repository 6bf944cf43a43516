package com.work.federation.repository.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.work.federation.repository.entity.FederationRunStepEntity;
import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

import java.time.Instant;
import java.util.List;

/**
 * 协商步骤时间线表 Mapper
 */
public interface FederationRunStepMapper extends BaseMapper<FederationRunStepEntity> {

    /**
     * 同一 (run_id, seq) 先写 STARTED，完成后覆盖为 DONE/FAILED（PostgreSQL ON CONFLICT）
     */
    @Insert("INSERT INTO federation_run_step(run_id, seq, step, status, started_at, finished_at, detail) " +
            "VALUES(#{runId}, #{seq}, #{step}, #{status}, #{startedAt}, #{finishedAt}, #{detail}) " +
            "ON CONFLICT(run_id, seq) " +
            "DO UPDATE SET status = #{status}, finished_at = #{finishedAt}, detail = #{detail}")
    int upsertStep(@Param("runId") String runId,
                   @Param("seq") int seq,
                   @Param("step") String step,
                   @Param("status") String status,
                   @Param("startedAt") Instant startedAt,
                   @Param("finishedAt") Instant finishedAt,
                   @Param("detail") String detail);

    @Select("SELECT id, run_id, seq, step, status, started_at, finished_at, detail " +
            "FROM federation_run_step WHERE run_id = #{runId} ORDER BY seq ASC")
    List<FederationRunStepEntity> listByRunId(@Param("runId") String runId);
}
