package com.z254.butterfly.triage.domain.repository;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.z254.butterfly.triage.domain.model.GroupSnapshot;
import com.z254.butterfly.triage.exception.PersistenceException;
import com.z254.butterfly.triage.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.core.ReactiveRedisTemplate;
import org.springframework.data.redis.core.ReactiveValueOperations;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;

import static com.z254.butterfly.triage.support.TestAlerts.T0;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for {@link RedisGroupSnapshotRepository}.
 */
@ExtendWith(MockitoExtension.class)
class RedisGroupSnapshotRepositoryTest {

    @Mock
    private ReactiveRedisTemplate<String, String> redisTemplate;

    @Mock
    private ReactiveValueOperations<String, String> valueOperations;

    private ObjectMapper objectMapper;
    private MutableClock clock;
    private RedisGroupSnapshotRepository repository;

    @BeforeEach
    void setUp() {
        objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        clock = new MutableClock(T0);
        repository = new RedisGroupSnapshotRepository(redisTemplate, objectMapper, "triage:",
                Duration.ofSeconds(1), clock);
    }

    private GroupSnapshot snapshot(String groupId, Duration lifetime) {
        return GroupSnapshot.builder()
                .groupId(groupId)
                .name("timeout - api")
                .alertIds(List.of("a", "b"))
                .rootCauseIds(List.of("a"))
                .createdAt(T0)
                .updatedAt(T0)
                .expiresAt(T0.plus(lifetime))
                .suppressionEnabled(true)
                .build();
    }

    @Test
    @DisplayName("should store the snapshot as JSON with a TTL matching the group expiry")
    void putWithTtl() throws Exception {
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        when(valueOperations.set(anyString(), anyString(), any(Duration.class))).thenReturn(Mono.just(true));

        repository.put(snapshot("g-1", Duration.ofMinutes(90)));

        ArgumentCaptor<String> json = ArgumentCaptor.forClass(String.class);
        verify(valueOperations).set(eq("triage:group:g-1"), json.capture(), eq(Duration.ofMinutes(90)));
        GroupSnapshot stored = objectMapper.readValue(json.getValue(), GroupSnapshot.class);
        assertThat(stored.getAlertIds()).containsExactly("a", "b");
        assertThat(stored.getExpiresAt()).isEqualTo(T0.plus(Duration.ofMinutes(90)));
        assertThat(stored.isSuppressionEnabled()).isTrue();
    }

    @Test
    @DisplayName("should delete instead of storing an already expired snapshot")
    void putExpired() {
        when(redisTemplate.delete("triage:group:g-1")).thenReturn(Mono.just(1L));

        repository.put(snapshot("g-1", Duration.ZERO));

        verify(redisTemplate).delete("triage:group:g-1");
        verify(redisTemplate, never()).opsForValue();
    }

    @Test
    @DisplayName("should read a stored snapshot")
    void get() throws Exception {
        String json = objectMapper.writeValueAsString(snapshot("g-1", Duration.ofHours(1)));
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        when(valueOperations.get("triage:group:g-1")).thenReturn(Mono.just(json));

        assertThat(repository.get("g-1")).get()
                .extracting(GroupSnapshot::getRootCauseIds)
                .isEqualTo(List.of("a"));
    }

    @Test
    @DisplayName("should return empty for a missing key")
    void getMissing() {
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        when(valueOperations.get("triage:group:none")).thenReturn(Mono.empty());

        assertThat(repository.get("none")).isEmpty();
    }

    @Test
    @DisplayName("should list snapshots and skip unreadable entries")
    void listSkipsCorrupt() throws Exception {
        String json = objectMapper.writeValueAsString(snapshot("g-1", Duration.ofHours(1)));
        when(redisTemplate.keys("triage:group:*"))
                .thenReturn(Flux.just("triage:group:g-1", "triage:group:broken"));
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        when(valueOperations.get("triage:group:g-1")).thenReturn(Mono.just(json));
        when(valueOperations.get("triage:group:broken")).thenReturn(Mono.just("{not json"));

        List<GroupSnapshot> snapshots = repository.list();

        assertThat(snapshots).extracting(GroupSnapshot::getGroupId).containsExactly("g-1");
    }

    @Test
    @DisplayName("should wrap store errors in PersistenceException")
    void wrapsStoreErrors() {
        when(redisTemplate.delete("triage:group:g-1"))
                .thenReturn(Mono.error(new IllegalStateException("connection refused")));

        assertThatThrownBy(() -> repository.delete("g-1"))
                .isInstanceOf(PersistenceException.class)
                .hasMessageContaining("g-1")
                .hasRootCauseMessage("connection refused");
    }
}
