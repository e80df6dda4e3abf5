package com.careerhub.matchservice.infrastructure.redis;

import lombok.RequiredArgsConstructor;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 公用 Redis 原语：
 * - String / Hash / Set / List / Key / 脚本；
 * - 业务键名与字段名放在 Repo 层组织（见 RedisKeys）。
 */
@Component
@RequiredArgsConstructor
public class RedisOps {
    /** 通用对象模板：JSON 存储与反序列化 */
    private final RedisTemplate<String, Object> redis;
    /** 字符串模板：锁令牌等轻量值 */
    private final StringRedisTemplate strRedis;

    // -------------- String --------------

    public void set(String key, Object val) {
        redis.opsForValue().set(key, val);
    }

    public void setEx(String key, Object val, Duration ttl) {
        redis.opsForValue().set(key, val, ttl);
    }

    @SuppressWarnings("unchecked")
    public <T> T get(String key, Class<T> type) {
        Object v = redis.opsForValue().get(key);
        return (v == null) ? null : (T) v;
    }

    /**
     * 仅当不存在时写入字符串（SET NX PX）
     * @return true 表示写入成功
     */
    public boolean setStringNx(String key, String val, Duration ttl) {
        Boolean ok = strRedis.opsForValue().setIfAbsent(key, val, ttl);
        return Boolean.TRUE.equals(ok);
    }

    // -------------- Hash --------------

    public void hSet(String key, String field, Object val) {
        redis.opsForHash().put(key, field, val);
    }

    public void hSetAll(String key, Map<String, ?> map) {
        redis.opsForHash().putAll(key, map);
    }

    @SuppressWarnings("unchecked")
    public <T> T hGet(String key, String field, Class<T> type) {
        Object v = redis.opsForHash().get(key, field);
        return (v == null) ? null : (T) v;
    }

    /**
     * 获取整个 Hash（转为 Map<String,Object>）
     */
    public Map<String, Object> hGetAll(String key) {
        Map<Object, Object> raw = redis.opsForHash().entries(key);
        Map<String, Object> out = new HashMap<>();
        raw.forEach((k, v) -> out.put(String.valueOf(k), v));
        return out;
    }

    // -------------- Set --------------

    public void sAdd(String key, String... members) {
        strRedis.opsForSet().add(key, members);
    }

    public Set<String> sMembers(String key) {
        Set<String> s = strRedis.opsForSet().members(key);
        return s == null ? Collections.emptySet() : s;
    }

    public long sCard(String key) {
        Long n = strRedis.opsForSet().size(key);
        return n == null ? 0 : n;
    }

    // -------------- List --------------

    /** 尾部追加 */
    public void rPush(String key, Object val) {
        redis.opsForList().rightPush(key, val);
    }

    @SuppressWarnings("unchecked")
    public <T> List<T> lRangeAll(String key, Class<T> type) {
        List<Object> raw = redis.opsForList().range(key, 0, -1);
        List<T> out = new ArrayList<>();
        if (raw != null) {
            raw.forEach(v -> out.add((T) v));
        }
        return out;
    }

    // -------------- Key & TTL --------------

    public Boolean expire(String key, Duration ttl) {
        return redis.expire(key, ttl);
    }

    public Long del(String... keys) {
        return redis.delete(Arrays.asList(keys));
    }

    // -------------- Script --------------

    /**
     * 执行 Lua 脚本（原子操作），用于锁的“比对后删除”等。
     * 脚本走字符串模板，参数按字符串传递。
     */
    public <T> T evalString(String script, List<String> keys, List<String> args, Class<T> resultType) {
        DefaultRedisScript<T> rs = new DefaultRedisScript<>();
        rs.setResultType(resultType);
        rs.setScriptText(script);
        return strRedis.execute(rs, keys, args.toArray());
    }
}
