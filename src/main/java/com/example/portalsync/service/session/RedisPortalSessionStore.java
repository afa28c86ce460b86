package com.example.portalsync.service.session;

import com.example.portalsync.domain.model.PortalSession;
import com.example.portalsync.exception.SessionStoreUnavailableException;
import com.example.portalsync.properties.ApplicationProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.HashOperations;
import org.springframework.data.redis.core.RedisOperations;
import org.springframework.data.redis.core.SessionCallback;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Session store backed by one Redis hash per session. The key's native TTL always equals the
 * time left until the earlier of the two expiries, so Redis drops abandoned sessions on its own.
 */
@Slf4j
@Service
@ConditionalOnProperty(prefix = "app.store", name = "backend", havingValue = "redis", matchIfMissing = true)
public class RedisPortalSessionStore implements PortalSessionStore {

  public static final String SESSION_KEY_PREFIX = "session:";
  static final String FIELD_ACCOUNT = "account";
  static final String FIELD_COOKIES = "cookies";
  static final String FIELD_CREATED_AT = "createdAt";
  static final String FIELD_ABSOLUTE_EXPIRES_AT = "absoluteExpiresAt";
  static final String FIELD_IDLE_EXPIRES_AT = "idleExpiresAt";

  private static final TypeReference<Map<String, String>> COOKIE_MAP = new TypeReference<>() {
  };

  private final StringRedisTemplate redisTemplate;
  private final ObjectMapper objectMapper;
  private final Clock clock;
  private final ApplicationProperties.SessionProperties sessionProperties;

  public RedisPortalSessionStore(
      StringRedisTemplate redisTemplate,
      ObjectMapper objectMapper,
      Clock clock,
      ApplicationProperties properties) {
    this.redisTemplate = redisTemplate;
    this.objectMapper = objectMapper;
    this.clock = clock;
    this.sessionProperties = properties.session();
  }

  @Override
  public PortalSession create(String account, Map<String, String> cookies) {
    Instant now = clock.instant();
    PortalSession session = new PortalSession(
        SessionIds.generate(),
        account,
        cookies,
        now,
        now.plus(sessionProperties.absoluteTtl()),
        now.plus(sessionProperties.idleTtl())).touch(now, sessionProperties.idleTtl());
    String sessionKey = SESSION_KEY_PREFIX + session.sessionId();

    try {
      Map<String, String> sessionData = new HashMap<>();
      sessionData.put(FIELD_ACCOUNT, account);
      sessionData.put(FIELD_COOKIES, objectMapper.writeValueAsString(session.cookies()));
      sessionData.put(FIELD_CREATED_AT, String.valueOf(session.createdAt().toEpochMilli()));
      sessionData.put(FIELD_ABSOLUTE_EXPIRES_AT, String.valueOf(session.absoluteExpiresAt().toEpochMilli()));
      sessionData.put(FIELD_IDLE_EXPIRES_AT, String.valueOf(session.idleExpiresAt().toEpochMilli()));
      Duration ttl = Duration.between(now, session.expiresAt());

      redisTemplate.executePipelined(new SessionCallback<Object>() {
        @Override
        @SuppressWarnings("unchecked")
        public Object execute(@NonNull RedisOperations operations) {
          RedisOperations<String, String> redisOps = (RedisOperations<String, String>) operations;
          redisOps.opsForHash().putAll(sessionKey, sessionData);
          redisOps.expire(sessionKey, ttl);
          return null;
        }
      });
      log.info("Created session {} for account {}", SessionIds.mask(session.sessionId()), account);
      return session;
    } catch (JsonProcessingException | DataAccessException e) {
      throw new SessionStoreUnavailableException("Failed to create session", e);
    }
  }

  @Override
  public Optional<PortalSession> get(String sessionId) {
    if (!SessionIds.isWellFormed(sessionId)) {
      return Optional.empty();
    }
    String sessionKey = SESSION_KEY_PREFIX + sessionId;

    Map<String, String> sessionData;
    try {
      HashOperations<String, String, String> hashOps = redisTemplate.opsForHash();
      sessionData = hashOps.entries(sessionKey);
    } catch (DataAccessException e) {
      log.error("Session lookup failed for session: {}", SessionIds.mask(sessionId), e);
      return Optional.empty();
    }
    if (sessionData == null || sessionData.isEmpty()) {
      return Optional.empty();
    }

    PortalSession session;
    try {
      session = decode(sessionId, sessionData);
    } catch (JsonProcessingException | RuntimeException e) {
      log.warn("Dropping corrupt session entry {}: {}", SessionIds.mask(sessionId), e.getMessage());
      discard(sessionId);
      return Optional.empty();
    }

    Instant now = clock.instant();
    if (session.isExpired(now)) {
      log.debug("Session {} expired", SessionIds.mask(sessionId));
      discard(sessionId);
      return Optional.empty();
    }

    PortalSession touched = session.touch(now, sessionProperties.idleTtl());
    Duration ttl = Duration.between(now, touched.expiresAt());
    try {
      if (Boolean.TRUE.equals(redisTemplate.expire(sessionKey, ttl))) {
        redisTemplate.opsForHash().put(
            sessionKey, FIELD_IDLE_EXPIRES_AT, String.valueOf(touched.idleExpiresAt().toEpochMilli()));
      }
    } catch (DataAccessException e) {
      log.warn("Could not slide idle expiry for session {}: {}", SessionIds.mask(sessionId), e.getMessage());
    }
    return Optional.of(touched);
  }

  @Override
  public void delete(String sessionId) {
    if (!SessionIds.isWellFormed(sessionId)) {
      return;
    }
    try {
      redisTemplate.delete(SESSION_KEY_PREFIX + sessionId);
    } catch (DataAccessException e) {
      throw new SessionStoreUnavailableException("Failed to delete session", e);
    }
  }

  private void discard(String sessionId) {
    try {
      delete(sessionId);
    } catch (SessionStoreUnavailableException e) {
      log.warn("Could not remove session {}: {}", SessionIds.mask(sessionId), e.getMessage());
    }
  }

  private PortalSession decode(String sessionId, Map<String, String> data) throws JsonProcessingException {
    List<String> required = List.of(
        FIELD_ACCOUNT, FIELD_COOKIES, FIELD_CREATED_AT, FIELD_ABSOLUTE_EXPIRES_AT, FIELD_IDLE_EXPIRES_AT);
    for (String field : required) {
      if (data.get(field) == null) {
        throw new IllegalStateException("missing field " + field);
      }
    }
    return new PortalSession(
        sessionId,
        data.get(FIELD_ACCOUNT),
        objectMapper.readValue(data.get(FIELD_COOKIES), COOKIE_MAP),
        Instant.ofEpochMilli(Long.parseLong(data.get(FIELD_CREATED_AT))),
        Instant.ofEpochMilli(Long.parseLong(data.get(FIELD_ABSOLUTE_EXPIRES_AT))),
        Instant.ofEpochMilli(Long.parseLong(data.get(FIELD_IDLE_EXPIRES_AT))));
  }
}
