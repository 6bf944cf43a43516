package com.work.federation.core.lock.impl;

import com.work.federation.core.exception.LedgerUnavailableException;
import com.work.federation.core.lock.SubmitLockManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;

import java.time.Duration;
import java.util.Collections;

import static com.work.federation.core.support.ValidationUtils.requireNonEmpty;
import static com.work.federation.core.support.ValidationUtils.requireNonNull;
import static com.work.federation.core.support.ValidationUtils.requirePositive;

/**
 * 基于 Redis 的提交锁实现：SET NX EX 加锁，Lua 脚本校验 owner 后删除。
 */
public class RedisSubmitLockManager implements SubmitLockManager {

    private static final Logger log = LoggerFactory.getLogger(RedisSubmitLockManager.class);

    private static final String LOCK_KEY_PREFIX = "federation:submit-lock:";

    // 只有 owner 匹配时才删除，避免误释放其他实例的锁
    private static final String UNLOCK_SCRIPT =
            "if redis.call('get', KEYS[1]) == ARGV[1] then " +
            "    return redis.call('del', KEYS[1]) " +
            "else " +
            "    return 0 " +
            "end";

    private final StringRedisTemplate redisTemplate;
    private final DefaultRedisScript<Long> unlockScript;

    public RedisSubmitLockManager(StringRedisTemplate redisTemplate) {
        this.redisTemplate = requireNonNull(redisTemplate, "redisTemplate");
        this.unlockScript = new DefaultRedisScript<>();
        this.unlockScript.setScriptText(UNLOCK_SCRIPT);
        this.unlockScript.setResultType(Long.class);
    }

    @Override
    public boolean tryLock(String identity, String lockOwner, Duration ttl) {
        requireNonEmpty(identity, "identity");
        requireNonEmpty(lockOwner, "lockOwner");
        requirePositive(ttl, "ttl");

        try {
            Boolean result = redisTemplate.opsForValue().setIfAbsent(LOCK_KEY_PREFIX + identity, lockOwner, ttl);
            return Boolean.TRUE.equals(result);
        } catch (Exception e) {
            throw new LedgerUnavailableException("Redis 加锁异常: " + identity, e);
        }
    }

    /**
     * 锁不存在或 owner 不匹配（已过期或被其他实例持有）时静默返回，保证幂等。
     */
    @Override
    public void unlock(String identity, String lockOwner) {
        requireNonEmpty(identity, "identity");
        requireNonEmpty(lockOwner, "lockOwner");

        Long result = redisTemplate.execute(unlockScript,
                Collections.singletonList(LOCK_KEY_PREFIX + identity), lockOwner);
        if (result == null || result == 0) {
            log.debug("[ledger] unlock noop, key may be expired or owned by others, identity={}, owner={}",
                    identity, lockOwner);
        }
    }
}
