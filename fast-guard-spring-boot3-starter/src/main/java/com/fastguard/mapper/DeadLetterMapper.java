package com.fastguard.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.fastguard.model.entity.DeadLetterEntity;
import org.apache.ibatis.annotations.Delete;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;
import org.apache.ibatis.annotations.Update;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

@Mapper
public interface DeadLetterMapper extends BaseMapper<DeadLetterEntity> {

    /**
     * 加行锁获取可拉取条目: PENDING 或租约到期的 IN_FLIGHT
     */
    @Select("""
        select * from guard_dead_letter
        where status = 0 or (status = 1 and visible_after <= #{now})
        order by id asc
        limit #{limit}
        for update skip locked
    """)
    List<DeadLetterEntity> lockReceivable(@Param("now") LocalDateTime now, @Param("limit") int limit);

    /**
     * 批量置 IN_FLIGHT
     */
    @Update({
            "<script>",
            "UPDATE guard_dead_letter",
            "   SET status = 1,",
            "       visible_after = #{visibleAfter},",
            "       updated_at = #{now},",
            "       version = version + 1",
            " WHERE status IN (0, 1)",
            "   <if test='ids != null and ids.size() > 0'>",
            "     AND id IN",
            "     <foreach collection='ids' item='id' open='(' separator=',' close=')'>",
            "       #{id}",
            "     </foreach>",
            "   </if>",
            "   <if test='ids == null or ids.size() == 0'>",
            "     AND 1 = 0",
            "   </if>",
            "</script>"
    })
    int markInFlightBatch(@Param("ids") List<Long> ids,
                          @Param("visibleAfter") LocalDateTime visibleAfter,
                          @Param("now") LocalDateTime now);

    /**
     * 状态写回, 乐观锁校验 version
     */
    @Update("""
        UPDATE guard_dead_letter
           SET status = #{status},
               attempt_count = #{attemptCount},
               visible_after = #{visibleAfter},
               last_reprocess_error = #{lastReprocessError},
               updated_at = #{updatedAt},
               version = version + 1
         WHERE message_id = #{messageId} AND version = #{version}
    """)
    int updateState(@Param("messageId") String messageId,
                    @Param("version") long version,
                    @Param("status") int status,
                    @Param("attemptCount") int attemptCount,
                    @Param("visibleAfter") LocalDateTime visibleAfter,
                    @Param("lastReprocessError") String lastReprocessError,
                    @Param("updatedAt") LocalDateTime updatedAt);

    @Select("select * from guard_dead_letter where message_id = #{messageId}")
    DeadLetterEntity selectByMessageId(@Param("messageId") String messageId);

    @Select({
            "<script>",
            "select * from guard_dead_letter",
            "   <if test='status != null'> where status = #{status} </if>",
            " order by id asc",
            " limit #{limit}",
            "</script>"
    })
    List<DeadLetterEntity> selectByStatus(@Param("status") Integer status, @Param("limit") int limit);

    @Select("select status, count(*) as cnt from guard_dead_letter group by status")
    List<Map<String, Object>> countGroupByStatus();

    @Delete("delete from guard_dead_letter where message_id = #{messageId}")
    int deleteByMessageId(@Param("messageId") String messageId);

    @Delete("delete from guard_dead_letter")
    int deleteAll();
}
