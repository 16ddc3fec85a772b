package com.shopsense.events.store;

import com.shopsense.events.dto.InteractionEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.RedisOperations;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.core.SessionCallback;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Redis-backed store shared by every engine instance.
 * One list per user: LPUSH keeps the newest event at the head and LTRIM caps
 * the list, both inside a MULTI/EXEC block.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "shopsense.interactions.store", havingValue = "redis")
public class RedisInteractionStore implements InteractionStore {

    private final RedisTemplate<String, InteractionEvent> redisTemplate;
    private final int historySize;
    private final String keyPrefix;

    public RedisInteractionStore(
            RedisTemplate<String, InteractionEvent> interactionRedisTemplate,
            @Value("${shopsense.interactions.history-size:100}") int historySize,
            @Value("${shopsense.interactions.redis-prefix:interactions:}") String keyPrefix) {
        this.redisTemplate = interactionRedisTemplate;
        this.historySize = historySize;
        this.keyPrefix = keyPrefix;
        log.info("Redis interaction store enabled: prefix={}, historySize={}", keyPrefix, historySize);
    }

    @Override
    public void append(InteractionEvent event) {
        String key = keyFor(event.getUserId());
        redisTemplate.execute(new SessionCallback<List<Object>>() {
            @Override
            @SuppressWarnings("unchecked")
            public <K, V> List<Object> execute(RedisOperations<K, V> operations) {
                RedisOperations<String, InteractionEvent> ops = (RedisOperations<String, InteractionEvent>) operations;
                ops.multi();
                ops.opsForList().leftPush(key, event);
                ops.opsForList().trim(key, 0, historySize - 1);
                return ops.exec();
            }
        });
    }

    @Override
    public List<InteractionEvent> recent(UUID userId) {
        List<InteractionEvent> events = redisTemplate.opsForList().range(keyFor(userId), 0, historySize - 1);
        return events != null ? events : List.of();
    }

    /**
     * Uses KEYS over the store prefix; acceptable for the periodic model build only.
     */
    @Override
    public Map<UUID, List<InteractionEvent>> snapshot() {
        Set<String> keys = redisTemplate.keys(keyPrefix + "*");
        Map<UUID, List<InteractionEvent>> snapshot = new HashMap<>();
        if (keys == null) {
            return snapshot;
        }
        for (String key : keys) {
            UUID userId;
            try {
                userId = UUID.fromString(key.substring(keyPrefix.length()));
            } catch (IllegalArgumentException e) {
                log.warn("Skipping malformed interaction key: {}", key);
                continue;
            }
            List<InteractionEvent> events = redisTemplate.opsForList().range(key, 0, historySize - 1);
            if (events != null && !events.isEmpty()) {
                snapshot.put(userId, events);
            }
        }
        return snapshot;
    }

    private String keyFor(UUID userId) {
        return keyPrefix + userId;
    }
}
