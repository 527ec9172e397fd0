package com.nextsub.auth.code;

import com.nextsub.auth.model.ClientInfo;

import java.time.Duration;
import java.util.Optional;

/**
 * 管理员验证码存储接口。
 * <p>
 * 每个主体最多一条有效记录；签发、失败计数与消费均为原子操作，
 * 调用方不得用“读取 + 写回”自行拼装。后端故障统一抛出 {@link com.nextsub.common.exception.StoreUnavailableException}。
 */
public interface AdminCodeStore {

    /**
     * 使该主体之前的记录失效并写入新记录，整体原子。
     *
     * @return 已写入的新记录，过期时间以其 {@code expiresAt} 为准
     */
    AdminCodeRecord issue(String principalId, String codeDigest, Duration ttl, int maxAttempts, ClientInfo client);

    /**
     * 仅返回未使用、未过期、未超限的记录。
     */
    Optional<AdminCodeRecord> loadLive(String principalId);

    /**
     * 返回该主体最近签发的记录，不论状态。
     */
    Optional<AdminCodeRecord> loadLatest(String principalId);

    /**
     * 失败次数加一并返回新值，不超过上限；达到上限时在同一原子步骤内标记为已使用。
     * 已使用的记录不再计数，原样返回当前次数。
     *
     * @return 失败次数，记录不存在时返回 -1
     */
    int recordFailedAttempt(String recordId);

    /**
     * CAS：仅当记录尚未使用时置为已使用。
     *
     * @return 本次调用是否完成了状态切换
     */
    boolean consume(String recordId);
}
