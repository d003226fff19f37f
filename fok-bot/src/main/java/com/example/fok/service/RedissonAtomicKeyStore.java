package com.example.fok.service;

import com.example.fok.service.exception.ErrorCode;
import com.example.fok.service.exception.ServiceException;
import java.time.Duration;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.redisson.api.RScript;
import org.redisson.api.RedissonClient;
import org.redisson.client.RedisException;
import org.redisson.client.codec.StringCodec;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class RedissonAtomicKeyStore implements AtomicKeyStore {

    static final String INCREMENT_WITH_EXPIRY =
            "local current = redis.call('incr', KEYS[1]) "
                    + "if current == 1 then redis.call('pexpire', KEYS[1], ARGV[1]) end "
                    + "return current";

    static final String SET_IF_ABSENT =
            "if redis.call('set', KEYS[1], '1', 'PX', ARGV[1], 'NX') then return 1 end "
                    + "return 0";

    private final RedissonClient redissonClient;

    @Override
    public long incrementAndExpire(String key, Duration ttl) {
        Long value = eval(INCREMENT_WITH_EXPIRY, key, ttl);
        return value != null ? value : 0L;
    }

    @Override
    public boolean setIfAbsent(String key, Duration ttl) {
        Long created = eval(SET_IF_ABSENT, key, ttl);
        return created != null && created == 1L;
    }

    @Override
    public boolean exists(String key) {
        try {
            return redissonClient.getBucket(key, StringCodec.INSTANCE).isExists();
        } catch (RedisException ex) {
            throw new ServiceException(ErrorCode.STORAGE_UNAVAILABLE, "Shared cache unavailable", ex);
        }
    }

    private Long eval(String script, String key, Duration ttl) {
        long ttlMillis = Math.max(1L, ttl.toMillis());
        try {
            RScript rScript = redissonClient.getScript(StringCodec.INSTANCE);
            return rScript.eval(
                    RScript.Mode.READ_WRITE,
                    script,
                    RScript.ReturnType.INTEGER,
                    List.of(key),
                    String.valueOf(ttlMillis));
        } catch (RedisException ex) {
            throw new ServiceException(ErrorCode.STORAGE_UNAVAILABLE, "Shared cache unavailable", ex);
        }
    }
}
